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

import com.hotprune.GlobalConfiguration;
import com.hotprune.engine.FatalErrorHandler;
import com.hotprune.engine.HeapPage;
import com.hotprune.engine.HeapRelation;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.engine.PageBuffer;
import com.hotprune.engine.RedoLog;
import com.hotprune.engine.SlotState;
import com.hotprune.exception.HotPruneException;
import com.hotprune.exception.InternalException;
import com.hotprune.exception.InvariantViolationException;

/**
 * Applies a {@link PrunePlan} to a page. The line pointers are rewritten, the storage is compacted, the prune hint is updated and
 * one redo record is written, all in a single step that cannot fail halfway: any error in it goes to the
 * {@link FatalErrorHandler}, because a page changed without its redo record cannot be recovered.
 */
public class PageMutator {
  private final FatalErrorHandler fatalErrorHandler;
  private final boolean           verifyRedirects;

  public PageMutator(final FatalErrorHandler fatalErrorHandler) {
    this(fatalErrorHandler, GlobalConfiguration.PRUNE_VERIFY_REDIRECTS.getValueAsBoolean());
  }

  public PageMutator(final FatalErrorHandler fatalErrorHandler, final boolean verifyRedirects) {
    this.fatalErrorHandler = fatalErrorHandler;
    this.verifyRedirects = verifyRedirects;
  }

  /**
   * Applies the plan to the page held by {@code buffer}. The caller must hold the cleanup lock. With an empty plan only the prune
   * hint and the full flag are updated, as a hint that is not logged.
   *
   * @return the LSN of the redo record written, or 0 if none was written
   */
  public long apply(final PageBuffer buffer, final HeapRelation relation, final PrunePlan plan, final RedoLog redoLog) {
    final HeapPage page = buffer.getPage();

    if (plan.isEmpty()) {
      if (page.getPruneXid() != plan.getNewPruneXid() || page.isFull()) {
        page.setPruneXid(plan.getNewPruneXid());
        page.clearFull();
        buffer.markDirtyHint();
      }
      return 0L;
    }

    // CRITICAL SECTION: FROM HERE ON ANY FAILURE IS FATAL
    try {
      execute(page, plan.getRedirected(), plan.getRedirectedCount(), plan.getNowDead(), plan.getDeadCount(), plan.getNowUnused(),
          plan.getUnusedCount(), plan.getSortBuffer());

      page.setPruneXid(plan.getNewPruneXid());
      // PRUNING AGAIN IS POINTLESS UNTIL SOMETHING ELSE HAPPENS TO THE PAGE
      page.clearFull();
      buffer.markDirty();

      long lsn = 0L;
      if (relation.needsRedo()) {
        final byte[] payload = plan.getPayloadBuffer();
        final int length = PruneRecord.encode(plan, payload);
        lsn = redoLog.beginRecord(RedoLog.RECORD_PRUNE).registerPage(page.getPageId()).registerPayload(payload, length).insert();
        page.setLsn(lsn);
      }
      return lsn;

    } catch (final InvariantViolationException e) {
      // ALREADY NOTIFIED
      throw e;
    } catch (final HotPruneException e) {
      e.addContext("page", page.getPageId().toString());
      throw fatalErrorHandler.raise(e);
    } catch (final RuntimeException | Error e) {
      // ALSO OUT OF MEMORY AND STACK OVERFLOW: THE PAGE MAY BE HALF REWRITTEN WITHOUT ANY REDO RECORD
      final InternalException fatal = new InternalException("Error while applying the prune plan to " + page.getPageId(), e);
      fatal.addContext("page", page.getPageId().toString());
      throw fatalErrorHandler.raise(fatal);
    }
  }

  /**
   * Rewrites the line pointers and compacts the page. Used both by the live pruning and by the redo replay, which does not know
   * the visibility of the tuples and trusts the slot lists.
   */
  public void execute(final HeapPage page, final int[] redirected, final int nRedirected, final int[] nowDead, final int nDead,
      final int[] nowUnused, final int nUnused) {
    execute(page, redirected, nRedirected, nowDead, nDead, nowUnused, nUnused, new long[page.getMaxOffsetNumber()]);
  }

  /**
   * Same as {@link #execute(HeapPage, int[], int, int[], int, int[], int)}, compacting the page with {@code sortBuffer} as scratch
   * space so that nothing is allocated.
   */
  public void execute(final HeapPage page, final int[] redirected, final int nRedirected, final int[] nowDead, final int nDead,
      final int[] nowUnused, final int nUnused, final long[] sortBuffer) {

    for (int i = 0; i < nRedirected; i++) {
      final int from = redirected[i * 2];
      final int to = redirected[i * 2 + 1];

      checkSlot(page, from);
      checkSlot(page, to);

      final SlotState fromState = page.getSlotState(from);
      if (fromState == SlotState.REDIRECT) {
        if (page.getRedirectTarget(from) == to)
          throw violation(page, from, "Redirect " + from + " already points to " + to);
      } else if (fromState != SlotState.NORMAL || page.isHeapOnly(from))
        throw violation(page, from, "Slot " + from + " (" + fromState + ") cannot become a redirect: it must be a chain root");

      if (!page.isHeapOnly(to))
        throw violation(page, from, "Redirect target " + to + " of slot " + from + " is not a heap-only tuple");

      page.setSlotRedirect(from, to);
    }

    for (int i = 0; i < nDead; i++) {
      final int slot = nowDead[i];
      checkSlot(page, slot);

      final SlotState state = page.getSlotState(slot);
      if (state == SlotState.NORMAL) {
        // AN INDEX CAN POINT TO THE ROOT OF A CHAIN, NEVER TO A HEAP-ONLY TUPLE
        if (page.isHeapOnly(slot))
          throw violation(page, slot, "Heap-only tuple in slot " + slot + " cannot become dead");
      } else if (state != SlotState.REDIRECT)
        throw violation(page, slot, "Slot " + slot + " (" + state + ") cannot become dead");

      page.setSlotDead(slot);
    }

    for (int i = 0; i < nUnused; i++) {
      final int slot = nowUnused[i];
      checkSlot(page, slot);

      if (!page.isHeapOnly(slot))
        throw violation(page, slot, "Slot " + slot + " (" + page.getSlotState(slot) + ") cannot become unused: it is not a heap-only tuple");

      page.setSlotUnused(slot);
    }

    page.repairFragmentation(sortBuffer);

    if (verifyRedirects)
      verifyRedirects(page);
  }

  /**
   * Checks every redirect of the page points to a heap-only tuple.
   */
  public void verifyRedirects(final HeapPage page) {
    final int maxOffset = page.getMaxOffsetNumber();
    for (int slot = 1; slot <= maxOffset; ++slot) {
      if (page.getSlotState(slot) != SlotState.REDIRECT)
        continue;

      final int target = page.getRedirectTarget(slot);
      if (!page.isValidSlot(target))
        throw violation(page, slot, "Redirect " + slot + " points to slot " + target + " out of the page");

      if (page.getSlotState(target) != SlotState.NORMAL || !HeapTupleHeader.isHeapOnly(page.getInfomask(target)))
        throw violation(page, slot, "Redirect " + slot + " points to slot " + target + " (" + page.getSlotState(target)
            + ") that is not a heap-only tuple");
    }
  }

  private void checkSlot(final HeapPage page, final int slot) {
    if (!page.isValidSlot(slot))
      throw violation(page, slot, "Slot " + slot + " is out of the page (max=" + page.getMaxOffsetNumber() + ")");
  }

  private InvariantViolationException violation(final HeapPage page, final int slot, final String message) {
    return fatalErrorHandler.raise(new InvariantViolationException(page.getPageId(), slot, message));
  }
}
