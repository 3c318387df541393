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
package com.hotprune.transaction;

/**
 * Answers whether the effects of a transaction are guaranteed to be invisible to everybody. Lookups are expected to be cheap and
 * to hold any internal lock only for the duration of the call.
 */
public interface TransactionOracle {
  TransactionState getState(long xid);

  /**
   * Returns true if a version deleted by {@code xid} cannot be seen by any running or future transaction.
   */
  boolean isRemovable(long xid);

  /**
   * Oldest transaction id whose deletions must still be preserved.
   */
  long getNonRemovableHorizon();

  boolean isOldSnapshotThresholdActive();

  /**
   * Computes the horizon ignoring the snapshots older than the old snapshot threshold.
   *
   * @return the lowered horizon, or null if it cannot be computed
   */
  LimitedHorizon computeLimitedHorizon(long horizon);

  /**
   * Records that versions have been removed based on a limited horizon, so that snapshots older than {@code timestamp} fail when
   * they read a page instead of returning wrong results.
   */
  void setOldSnapshotThresholdTimestamp(long timestamp, long xmin);
}
