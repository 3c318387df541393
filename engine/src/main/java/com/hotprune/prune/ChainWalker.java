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

import com.hotprune.engine.HeapPage;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.engine.SlotState;
import com.hotprune.exception.InvariantViolationException;
import com.hotprune.transaction.TransactionOracle;
import com.hotprune.transaction.TransactionState;

/**
 * Walks a HOT chain from its root and plans the removal of the dead versions at the beginning of the chain.
 * <br>
 * The root is a redirect or a tuple that is not heap-only. The walk follows the {@code next} links of HOT updated tuples and
 * stops at a slot out of range, at a slot already visited, at a slot that is not heap-only, or at a tuple whose xmin is not the
 * xmax of its predecessor. Only the unbroken run of dead versions starting at the root is removed. A dead version found between
 * two surviving ones stays in the chain untouched. Dead versions after the last survivor are left unvisited for
 * {@link OrphanReclaimer}.
 * <br>
 * When some version survives, the root becomes a redirect to the first survivor. When the whole chain is dead, the root becomes a
 * tombstone. The other removed versions become unused.
 */
public class ChainWalker {
  private final TransactionOracle oracle;

  public ChainWalker(final TransactionOracle oracle) {
    this.oracle = oracle;
  }

  /**
   * Processes the chain starting at {@code rootSlot}, recording the changes in the plan of {@code state}.
   *
   * @return the number of tuples removed from the page
   */
  public int pruneFromRoot(final PruneState state, final int rootSlot) {
    if (state.isVisited(rootSlot) || state.isHeapOnly(rootSlot))
      throw state.getFatalErrorHandler()
          .raise(new InvariantViolationException(state.getPage().getPageId(), rootSlot, "Slot " + rootSlot + " is not a chain root"));

    final HeapPage page = state.getPage();
    final PrunePlan plan = state.getPlan();
    final int maxOffset = page.getMaxOffsetNumber();
    final int[] chainItems = state.getChainItems();

    long priorXmax = HeapTupleHeader.INVALID_XID;
    int slot = rootSlot;
    int latestDead = 0;
    int nChain = 0;
    int lastSurvivor = -1;
    int steps = 0;
    boolean redirectRoot = false;
    boolean pastLatestDead = false;

    while (true) {
      if (slot < 1 || slot > maxOffset)
        break;

      // A LONGER CHAIN THAN THE PAGE CAN HOLD LOOPS ON ITSELF
      if (++steps > maxOffset)
        throw state.getFatalErrorHandler()
            .raise(new InvariantViolationException(page.getPageId(), slot, "HOT chain starting at slot " + rootSlot + " loops"));

      // A VISITED SLOT OR A SLOT THAT IS NOT HEAP-ONLY CANNOT BELONG TO THIS CHAIN
      if (state.isVisited(slot) || (nChain > 0 && !state.isHeapOnly(slot)))
        break;

      if (page.getSlotState(slot) == SlotState.REDIRECT) {
        // ONLY THE ROOT CAN BE A REDIRECT: JUMP TO THE FIRST HEAP-ONLY TUPLE OF THE CHAIN
        chainItems[nChain++] = slot;
        state.markVisited(slot);
        redirectRoot = true;
        slot = page.getRedirectTarget(slot);
        continue;
      }

      final long xmin = page.getXmin(slot);
      if (nChain > 0 && HeapTupleHeader.isValidXid(priorXmax) && xmin != priorXmax)
        break;

      final TupleVisibility visibility = state.getVisibility(slot);
      if (visibility == null)
        throw state.getFatalErrorHandler()
            .raise(new InvariantViolationException(page.getPageId(), slot, "Slot " + slot + " has no visibility information"));

      final long xmax = page.getXmax(slot);

      switch (visibility) {
      case DEAD:
        if (!pastLatestDead) {
          // STILL IN THE RUN OF DEAD TUPLES AT THE BEGINNING OF THE CHAIN
          latestDead = slot;
          advanceLatestRemovedXid(plan, xmin, xmax);
          state.markVisited(slot);
        }
        // AFTER A SURVIVOR IT IS MARKED VISITED ONLY WHEN ANOTHER SURVIVOR FOLLOWS
        chainItems[nChain++] = slot;
        break;

      case RECENTLY_DEAD:
      case DELETE_IN_PROGRESS:
        // MAY BECOME DEAD SOON: THE PAGE SHOULD BE RECONSIDERED FOR PRUNING WHEN THE DELETER IS OLD ENOUGH
        plan.recordPrunable(xmax);
        // FALL THROUGH
      case LIVE:
      case INSERT_IN_PROGRESS:
        pastLatestDead = true;
        for (int j = lastSurvivor + 1; j < nChain; j++)
          state.markVisited(chainItems[j]);
        state.markVisited(slot);
        lastSurvivor = nChain;
        chainItems[nChain++] = slot;
        break;
      }

      if (!HeapTupleHeader.isHotUpdated(page.getInfomask(slot)))
        break;

      slot = page.getNextSlot(slot);
      priorXmax = xmax;
    }

    if (latestDead == 0)
      return 0;

    int deleted = 0;

    // THE NON-ROOT MEMBERS UP TO THE LATEST DEAD ONE ARE HEAP-ONLY TUPLES: THEY BECOME UNUSED
    int i;
    for (i = 1; i < nChain && chainItems[i - 1] != latestDead; i++) {
      plan.recordUnused(chainItems[i]);
      deleted++;
    }

    // A REDIRECT ROOT HAS NO STORAGE: CHANGING IT IS NOT A DELETION
    if (!redirectRoot)
      deleted++;

    if (i >= nChain)
      plan.recordDead(rootSlot);
    else
      plan.recordRedirect(rootSlot, chainItems[i]);

    return deleted;
  }

  private void advanceLatestRemovedXid(final PrunePlan plan, final long xmin, final long xmax) {
    // A TUPLE INSERTED BY AN ABORTED TRANSACTION HAS NEVER BEEN VISIBLE TO ANYBODY
    if (!HeapTupleHeader.isValidXid(xmax) || xmax == xmin)
      return;
    if (oracle.getState(xmin) == TransactionState.COMMITTED)
      plan.advanceLatestRemovedXid(xmax);
  }
}
