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
import com.hotprune.transaction.LimitedHorizon;
import com.hotprune.transaction.TransactionOracle;
import com.hotprune.transaction.TransactionState;

/**
 * Classifies a tuple against the horizon oracle. A tuple deleted by a committed transaction is {@link TupleVisibility#DEAD} only
 * when the deleter is older than the non-removable horizon. Otherwise, if the old snapshot protection is active, the horizon
 * lowered by it is computed once per pruning pass and used for the remaining tuples.
 */
public class VisibilityClassifier {
  private final TransactionOracle oracle;

  public VisibilityClassifier(final TransactionOracle oracle) {
    this.oracle = oracle;
  }

  public TransactionOracle getOracle() {
    return oracle;
  }

  /**
   * Classifies the tuple stored in {@code slot}, upgrading recently dead tuples to dead when the horizon allows it. The lowered
   * horizon and the flag telling it has been used are kept in {@code state}.
   */
  public TupleVisibility classify(final HeapPage page, final int slot, final PruneState state) {
    final long xmax = page.getXmax(slot);
    final TupleVisibility result = classify(page.getXmin(slot), xmax, page.getInfomask(slot));
    if (result != TupleVisibility.RECENTLY_DEAD)
      return result;

    // RECENTLY DEAD: THE DELETER COMMITTED, xmax IS THE ID AFTER WHICH THE TUPLE IS DEAD FOR EVERYBODY
    final long deadAfter = xmax;

    if (state.isOldSnapshotUsed())
      return deadAfter < state.getOldSnapshotXmin() ? TupleVisibility.DEAD : result;

    if (oracle.isRemovable(deadAfter))
      return TupleVisibility.DEAD;

    if (oracle.isOldSnapshotThresholdActive()) {
      if (!state.isLimitedHorizonComputed()) {
        final LimitedHorizon limited = oracle.computeLimitedHorizon(oracle.getNonRemovableHorizon());
        state.setLimitedHorizon(limited);
      }

      if (HeapTupleHeader.isValidXid(state.getOldSnapshotXmin()) && deadAfter < state.getOldSnapshotXmin()) {
        // ABOUT TO REMOVE A TUPLE THAT AN OLD SNAPSHOT COULD STILL SEE: RAISE THE THRESHOLD SO THOSE READERS FAIL
        oracle.setOldSnapshotThresholdTimestamp(state.getOldSnapshotTimestamp(), state.getOldSnapshotXmin());
        state.setOldSnapshotUsed();
        return TupleVisibility.DEAD;
      }
    }

    return result;
  }

  /**
   * Classifies a tuple from its header only, without looking at the horizon: a tuple deleted by a committed transaction is
   * always {@link TupleVisibility#RECENTLY_DEAD}.
   */
  public TupleVisibility classify(final long xmin, final long xmax, final int infomask) {
    final TransactionState inserter = oracle.getState(xmin);

    if (inserter == TransactionState.ABORTED)
      return TupleVisibility.DEAD;

    final boolean deleted = HeapTupleHeader.isValidXid(xmax) && !HeapTupleHeader.isXmaxLockOnly(infomask);

    if (inserter == TransactionState.IN_PROGRESS)
      return deleted && xmax == xmin ? TupleVisibility.DELETE_IN_PROGRESS : TupleVisibility.INSERT_IN_PROGRESS;

    if (!deleted)
      return TupleVisibility.LIVE;

    return switch (oracle.getState(xmax)) {
      case ABORTED -> TupleVisibility.LIVE;
      case IN_PROGRESS -> TupleVisibility.DELETE_IN_PROGRESS;
      case COMMITTED -> TupleVisibility.RECENTLY_DEAD;
    };
  }
}
