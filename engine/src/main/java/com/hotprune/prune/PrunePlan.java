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

import com.hotprune.engine.FatalErrorHandler;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.engine.PageId;
import com.hotprune.exception.InvariantViolationException;

/**
 * Changes planned by a pruning pass, applied at once by {@link PageMutator}:
 * <ul>
 *   <li>redirected: pairs of (root slot, first surviving member of the chain)</li>
 *   <li>now dead: roots of chains that are entirely dead. They become tombstones because an index may point to them</li>
 *   <li>now unused: heap-only tuples removed from the page</li>
 * </ul>
 * The arrays are allocated once with the maximum number of tuples of the page, so recording never allocates.
 */
public class PrunePlan {
  private final PageId            pageId;
  private final int               maxTuples;
  private final boolean[]         heapOnly;
  private final TupleVisibility[] htsv;
  private final FatalErrorHandler fatalErrorHandler;
  private final int[]             redirected;
  private final int[]             nowDead;
  private final int[]             nowUnused;
  private final byte[]            payloadBuffer;
  private final long[]            sortBuffer;
  private       int               nRedirected;
  private       int               nDead;
  private       int               nUnused;
  private       long              newPruneXid      = HeapTupleHeader.INVALID_XID;
  private       long              latestRemovedXid = HeapTupleHeader.INVALID_XID;

  PrunePlan(final PageId pageId, final int maxTuples, final boolean[] heapOnly, final TupleVisibility[] htsv,
      final FatalErrorHandler fatalErrorHandler) {
    this.pageId = pageId;
    this.maxTuples = maxTuples;
    this.heapOnly = heapOnly;
    this.htsv = htsv;
    this.fatalErrorHandler = fatalErrorHandler;
    this.redirected = new int[maxTuples * 2];
    this.nowDead = new int[maxTuples];
    this.nowUnused = new int[maxTuples];
    this.payloadBuffer = new byte[PruneRecord.maxPayloadSize(maxTuples)];
    this.sortBuffer = new long[maxTuples];
  }

  /**
   * Lowers the next prune hint to {@code xid}, the deleter of a tuple that may become dead soon.
   */
  public void recordPrunable(final long xid) {
    if (!HeapTupleHeader.isValidXid(xid))
      return;
    if (newPruneXid == HeapTupleHeader.INVALID_XID || xid < newPruneXid)
      newPruneXid = xid;
  }

  public void recordRedirect(final int slot, final int target) {
    if (nRedirected >= maxTuples)
      throw violation(slot, "Too many redirected slots");
    if (heapOnly[slot])
      throw violation(slot, "Redirect source slot " + slot + " is a heap-only tuple");
    if (!heapOnly[target])
      throw violation(slot, "Redirect target slot " + target + " is not a heap-only tuple");

    redirected[nRedirected * 2] = slot;
    redirected[nRedirected * 2 + 1] = target;
    nRedirected++;
  }

  public void recordDead(final int slot) {
    if (nDead >= maxTuples)
      throw violation(slot, "Too many dead slots");
    if (heapOnly[slot])
      throw violation(slot, "Slot " + slot + " cannot become dead: it is a heap-only tuple");

    nowDead[nDead++] = slot;
  }

  public void recordUnused(final int slot) {
    if (nUnused >= maxTuples)
      throw violation(slot, "Too many unused slots");
    if (htsv[slot] == null)
      throw violation(slot, "Slot " + slot + " cannot become unused: it has no storage");
    if (!heapOnly[slot])
      throw violation(slot, "Slot " + slot + " cannot become unused: it is not a heap-only tuple");

    nowUnused[nUnused++] = slot;
  }

  /**
   * Tracks the newest deleter among the removed tuples. Replicas use it to cancel the queries that could still see them.
   */
  public void advanceLatestRemovedXid(final long xid) {
    if (xid > latestRemovedXid)
      latestRemovedXid = xid;
  }

  public boolean isEmpty() {
    return nRedirected == 0 && nDead == 0 && nUnused == 0;
  }

  public int[] getRedirected() {
    return redirected;
  }

  public int getRedirectedCount() {
    return nRedirected;
  }

  public int[] getNowDead() {
    return nowDead;
  }

  public int getDeadCount() {
    return nDead;
  }

  public int[] getNowUnused() {
    return nowUnused;
  }

  public int getUnusedCount() {
    return nUnused;
  }

  public long getNewPruneXid() {
    return newPruneXid;
  }

  public long getLatestRemovedXid() {
    return latestRemovedXid;
  }

  /**
   * Buffer large enough for the redo payload of any plan of this page, see {@link PruneRecord#encode(PrunePlan, byte[])}.
   */
  public byte[] getPayloadBuffer() {
    return payloadBuffer;
  }

  /**
   * Scratch space for the compaction of the page, see {@link com.hotprune.engine.HeapPage#repairFragmentation(long[])}.
   */
  public long[] getSortBuffer() {
    return sortBuffer;
  }

  public int getMaxTuples() {
    return maxTuples;
  }

  @Override
  public String toString() {
    final StringBuilder buffer = new StringBuilder("PrunePlan(redirected=[");
    for (int i = 0; i < nRedirected; ++i) {
      if (i > 0)
        buffer.append(", ");
      buffer.append(redirected[i * 2]).append("->").append(redirected[i * 2 + 1]);
    }
    buffer.append("] dead=[");
    for (int i = 0; i < nDead; ++i)
      buffer.append(i > 0 ? ", " : "").append(nowDead[i]);
    buffer.append("] unused=[");
    for (int i = 0; i < nUnused; ++i)
      buffer.append(i > 0 ? ", " : "").append(nowUnused[i]);
    buffer.append("] newPruneXid=").append(newPruneXid).append(" latestRemovedXid=").append(latestRemovedXid).append(')');
    return buffer.toString();
  }

  private InvariantViolationException violation(final int slot, final String message) {
    return fatalErrorHandler.raise(new InvariantViolationException(pageId, slot, message));
  }
}
