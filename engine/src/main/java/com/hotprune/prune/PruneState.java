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
import com.hotprune.engine.HeapPage;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.transaction.LimitedHorizon;

/**
 * Working state of one pruning pass over a page. Created when the pass starts and dropped at the end, never shared between
 * passes. Arrays are indexed by slot number, so index 0 is never used.
 */
public class PruneState {
  private final HeapPage          page;
  private final TupleVisibility[] htsv;
  private final boolean[]         visited;
  private final boolean[]         heapOnly;
  private final int[]             chainItems;
  private final PrunePlan         plan;
  private final FatalErrorHandler fatalErrorHandler;
  private       long              oldSnapshotXmin      = HeapTupleHeader.INVALID_XID;
  private       long              oldSnapshotTimestamp = 0;
  private       boolean           oldSnapshotUsed      = false;
  private       boolean           limitedHorizonComputed;
  private       int               currentSlot          = 0;

  /**
   * @param limited lowered horizon already computed by the caller, or null to compute it on demand
   */
  public PruneState(final HeapPage page, final LimitedHorizon limited, final FatalErrorHandler fatalErrorHandler) {
    final int maxTuples = page.getMaxTuplesPerPage();
    this.page = page;
    this.htsv = new TupleVisibility[maxTuples + 1];
    this.visited = new boolean[maxTuples + 1];
    this.heapOnly = new boolean[maxTuples + 1];
    this.chainItems = new int[maxTuples];
    this.fatalErrorHandler = fatalErrorHandler;
    this.plan = new PrunePlan(page.getPageId(), maxTuples, heapOnly, htsv, fatalErrorHandler);
    if (limited != null) {
      this.oldSnapshotXmin = limited.getXmin();
      this.oldSnapshotTimestamp = limited.getTimestamp();
      this.limitedHorizonComputed = true;
    }
  }

  public HeapPage getPage() {
    return page;
  }

  public PrunePlan getPlan() {
    return plan;
  }

  public FatalErrorHandler getFatalErrorHandler() {
    return fatalErrorHandler;
  }

  /**
   * Returns the cached classification of the slot, null for slots without storage.
   */
  public TupleVisibility getVisibility(final int slot) {
    return htsv[slot];
  }

  public void setVisibility(final int slot, final TupleVisibility visibility) {
    htsv[slot] = visibility;
  }

  public boolean isVisited(final int slot) {
    return visited[slot];
  }

  public void markVisited(final int slot) {
    visited[slot] = true;
  }

  public boolean isHeapOnly(final int slot) {
    return heapOnly[slot];
  }

  public void setHeapOnly(final int slot) {
    heapOnly[slot] = true;
  }

  int[] getChainItems() {
    return chainItems;
  }

  public long getOldSnapshotXmin() {
    return oldSnapshotXmin;
  }

  public long getOldSnapshotTimestamp() {
    return oldSnapshotTimestamp;
  }

  public boolean isOldSnapshotUsed() {
    return oldSnapshotUsed;
  }

  void setOldSnapshotUsed() {
    this.oldSnapshotUsed = true;
  }

  public boolean isLimitedHorizonComputed() {
    return limitedHorizonComputed;
  }

  void setLimitedHorizon(final LimitedHorizon limited) {
    this.limitedHorizonComputed = true;
    if (limited != null) {
      this.oldSnapshotXmin = limited.getXmin();
      this.oldSnapshotTimestamp = limited.getTimestamp();
    }
  }

  /**
   * Slot being processed, reported in the errors raised during the pass. 0 when no slot is being processed.
   */
  public int getCurrentSlot() {
    return currentSlot;
  }

  public void setCurrentSlot(final int currentSlot) {
    this.currentSlot = currentSlot;
  }
}
