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
import com.hotprune.engine.HeapPage;
import com.hotprune.engine.HeapRelation;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.engine.PageBuffer;
import com.hotprune.engine.RedoLog;
import com.hotprune.log.LogManager;
import com.hotprune.transaction.LimitedHorizon;
import com.hotprune.transaction.TransactionOracle;

import java.util.logging.Level;

/**
 * Prunes a page on the read and write paths, only when it looks worth it and the cleanup lock is available right away. It must be
 * cheap to call when there is nothing to do: the prune hint and the free space are first checked without any lock, then checked
 * again once the lock is held.
 */
public class OpportunisticPruner {
  private final TransactionOracle oracle;
  private final RedoLog           redoLog;
  private final HeapPruner        pruner;
  private final int               minFreePercent;

  public OpportunisticPruner(final TransactionOracle oracle, final RedoLog redoLog, final HeapPruner pruner) {
    this(oracle, redoLog, pruner, GlobalConfiguration.PRUNE_MIN_FREE_PERCENT.getValueAsInteger());
  }

  public OpportunisticPruner(final TransactionOracle oracle, final RedoLog redoLog, final HeapPruner pruner, final int minFreePercent) {
    this.oracle = oracle;
    this.redoLog = redoLog;
    this.pruner = pruner;
    this.minFreePercent = minFreePercent;
  }

  /**
   * Prunes the page if its hint says some tuple may be dead and the page is full or short of free space. The caller must hold a
   * pin on the buffer and no lock.
   *
   * @return the result of the pruning, or null if the page was not pruned
   */
  public PruneResult maybePrune(final PageBuffer buffer, final HeapRelation relation) {
    // NO REDO RECORD CAN BE WRITTEN DURING RECOVERY
    if (redoLog.isRecoveryInProgress())
      return null;

    final HeapPage page = buffer.getPage();

    final long pruneXid = page.getPruneXid();
    if (!HeapTupleHeader.isValidXid(pruneXid))
      return null;

    LimitedHorizon limited = null;
    if (!oracle.isRemovable(pruneXid)) {
      if (!oracle.isOldSnapshotThresholdActive())
        return null;

      limited = oracle.computeLimitedHorizon(oracle.getNonRemovableHorizon());
      if (limited == null || pruneXid >= limited.getXmin())
        return null;
    }

    final int minFree = getMinFreeSpace(relation, page.getPageSize());

    // READ WITHOUT LOCK: THE ANSWER CAN BE STALE
    if (!needsPruning(page, minFree))
      return null;

    if (!buffer.tryLockForCleanup()) {
      LogManager.instance().log(this, Level.FINEST, "Cleanup lock on page %s not available, skip pruning", page.getPageId());
      return null;
    }

    try {
      if (!needsPruning(page, minFree))
        return null;

      final PruneResult result = pruner.prune(buffer, relation, limited);

      if (result.getReclaimed() > 0)
        LogManager.instance()
            .log(this, Level.FINE, "Reclaimed %d heap-only tuples from page %s of %s (%d new tombstones)", result.getReclaimed(),
                page.getPageId(), relation, result.getNewlyDead());

      return result;

    } finally {
      buffer.unlockCleanup();
    }
  }

  /**
   * Free space under which a page is pruned: the room reserved by the fill factor of the relation, and never less than the
   * configured minimum percentage of the page.
   */
  public int getMinFreeSpace(final HeapRelation relation, final int pageSize) {
    return Math.max(relation.getTargetFreeSpace(pageSize), pageSize * minFreePercent / 100);
  }

  private static boolean needsPruning(final HeapPage page, final int minFree) {
    return page.isFull() || page.getHeapFreeSpace() < minFree;
  }
}
