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

/**
 * Outcome of a pruning pass.
 */
public class PruneResult {
  private final int     deleted;
  private final int     newlyDead;
  private final boolean modified;
  private final boolean oldSnapshotUsed;
  private final long    newPruneXid;
  private final long    lsn;

  public PruneResult(final int deleted, final int newlyDead, final boolean modified, final boolean oldSnapshotUsed, final long newPruneXid,
      final long lsn) {
    this.deleted = deleted;
    this.newlyDead = newlyDead;
    this.modified = modified;
    this.oldSnapshotUsed = oldSnapshotUsed;
    this.newPruneXid = newPruneXid;
    this.lsn = lsn;
  }

  /**
   * Number of tuples removed from the page. A chain root turned into a tombstone counts, a redirect changed to point elsewhere
   * does not.
   */
  public int getDeleted() {
    return deleted;
  }

  /**
   * Number of slots turned into tombstones. They still have to be removed from the indexes.
   */
  public int getNewlyDead() {
    return newlyDead;
  }

  /**
   * Number of heap-only tuples removed for good: {@link #getDeleted()} minus the new tombstones.
   */
  public int getReclaimed() {
    return Math.max(0, deleted - newlyDead);
  }

  /**
   * Returns true if line pointers have been changed, false if at most the prune hint was updated.
   */
  public boolean isModified() {
    return modified;
  }

  public boolean isOldSnapshotUsed() {
    return oldSnapshotUsed;
  }

  public long getNewPruneXid() {
    return newPruneXid;
  }

  /**
   * LSN of the redo record written, 0 if the page was not modified or its relation is not logged.
   */
  public long getLsn() {
    return lsn;
  }

  @Override
  public String toString() {
    return "PruneResult(deleted=" + deleted + " newlyDead=" + newlyDead + " modified=" + modified + " oldSnapshotUsed=" + oldSnapshotUsed
        + " newPruneXid=" + newPruneXid + " lsn=" + lsn + ")";
  }
}
