/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.hotprune.prune;

import com.hotprune.engine.DefaultFatalErrorHandler;
import com.hotprune.engine.FatalErrorHandler;
import com.hotprune.engine.HeapPage;
import com.hotprune.engine.HeapRelation;
import com.hotprune.engine.PageBuffer;
import com.hotprune.engine.RedoLog;
import com.hotprune.engine.SlotState;
import com.hotprune.exception.HotPruneException;
import com.hotprune.log.LogManager;
import com.hotprune.transaction.LimitedHorizon;
import com.hotprune.transaction.TransactionOracle;

import java.util.logging.Level;

/**
 * Prunes a heap page in three passes:
 * <ol>
 *   <li>backward over all the slots, classifying every tuple once. Slots without storage are marked as visited, except
 *   redirects that are chain roots</li>
 *   <li>forward over the roots not visited yet, walking their chains with {@link ChainWalker}</li>
 *   <li>forward over the slots still not visited, that must be dead orphan heap-only tuples ({@link OrphanReclaimer})</li>
 * </ol>
 * The planned changes are then applied by {@link PageMutator}.
 */
public class HeapPruner {
  private final VisibilityClassifier classifier;
  private final ChainWalker          chainWalker;
  private final OrphanReclaimer      orphanReclaimer;
  private final PageMutator          mutator;
  private final RedoLog              redoLog;
  private final FatalErrorHandler    fatalErrorHandler;

  public HeapPruner(final TransactionOracle oracle, final RedoLog redoLog) {
    this(oracle, redoLog, DefaultFatalErrorHandler.INSTANCE);
  }

  public HeapPruner(final TransactionOracle oracle, final RedoLog redoLog, final FatalErrorHandler fatalErrorHandler) {
    this(new VisibilityClassifier(oracle), new ChainWalker(oracle), new OrphanReclaimer(), new PageMutator(fatalErrorHandler), redoLog,
        fatalErrorHandler);
  }

  public HeapPruner(final VisibilityClassifier classifier, final ChainWalker chainWalker, final OrphanReclaimer orphanReclaimer,
      final PageMutator mutator, final RedoLog redoLog, final FatalErrorHandler fatalErrorHandler) {
    this.classifier = classifier;
    this.chainWalker = chainWalker;
    this.orphanReclaimer = orphanReclaimer;
    this.mutator = mutator;
    this.redoLog = redoLog;
    this.fatalErrorHandler = fatalErrorHandler;
  }

  /**
   * Prunes the page held by {@code buffer}. The caller must hold a pin and the cleanup lock on it.
   *
   * @param limited lowered horizon of the old snapshot protection when the caller already computed it, otherwise null
   */
  public PruneResult prune(final PageBuffer buffer, final HeapRelation relation, final LimitedHorizon limited) {
    if (!buffer.isCleanupLockedByCurrentThread())
      throw new IllegalStateException("Cleanup lock on " + buffer.getPageId() + " must be held to prune the page");

    final HeapPage page = buffer.getPage();
    final PruneState state = new PruneState(page, limited, fatalErrorHandler);
    final PrunePlan plan = state.getPlan();
    final int maxOffset = page.getMaxOffsetNumber();

    int deleted = 0;
    try {
      // FIRST PASS: CLASSIFY EVERY TUPLE ONCE, SCANNING BACKWARD
      for (int slot = maxOffset; slot >= 1; --slot) {
        final SlotState slotState = page.getSlotState(slot);
        if (slotState != SlotState.NORMAL) {
          // A REDIRECT IS A CHAIN ROOT, DEAD AND UNUSED SLOTS HAVE NOTHING TO PRUNE
          if (slotState != SlotState.REDIRECT)
            state.markVisited(slot);
          continue;
        }

        if (page.isHeapOnly(slot))
          state.setHeapOnly(slot);

        state.setCurrentSlot(slot);
        state.setVisibility(slot, classifier.classify(page, slot, state));
      }

      // SECOND PASS: WALK THE CHAINS FROM THEIR ROOTS
      for (int slot = 1; slot <= maxOffset; ++slot) {
        if (state.isHeapOnly(slot) || state.isVisited(slot))
          continue;

        state.setCurrentSlot(slot);
        deleted += chainWalker.pruneFromRoot(state, slot);
      }

      // THIRD PASS: HEAP-ONLY TUPLES NOT REACHED FROM ANY ROOT
      for (int slot = 1; slot <= maxOffset; ++slot) {
        if (state.isVisited(slot))
          continue;

        state.setCurrentSlot(slot);
        deleted += orphanReclaimer.reclaim(state, slot);
      }

      state.setCurrentSlot(0);

    } catch (final HotPruneException e) {
      e.addContext("page", page.getPageId().toString());
      if (state.getCurrentSlot() > 0)
        e.addContext("slot", state.getCurrentSlot());
      throw e;
    }

    final boolean modified = !plan.isEmpty();
    final long lsn = mutator.apply(buffer, relation, plan, redoLog);

    if (modified)
      LogManager.instance()
          .log(this, Level.FINE, "Pruned page %s of %s: deleted=%d redirected=%d dead=%d unused=%d", page.getPageId(), relation,
              deleted, plan.getRedirectedCount(), plan.getDeadCount(), plan.getUnusedCount());

    return new PruneResult(deleted, plan.getDeadCount(), modified, state.isOldSnapshotUsed(), plan.getNewPruneXid(), lsn);
  }
}
