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

import com.hotprune.GlobalConfiguration;
import com.hotprune.exception.TransactionException;
import com.hotprune.log.LogManager;
import com.hotprune.utility.RWLockContext;

import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.logging.Level;

/**
 * In-memory transaction status table. Transaction ids are assigned in increasing order starting from 1 and never wrap. The
 * non-removable horizon is the oldest id still in progress.
 * <br>
 * The old snapshot threshold, when enabled, lets the horizon move past transactions that have been running for longer than the
 * threshold.
 */
public class TransactionRegistry extends RWLockContext implements TransactionOracle {
  private final    Map<Long, Entry> transactions = new HashMap<>();
  private final    LongSupplier     clock;
  private final    long             oldSnapshotThreshold;
  private          long             nextXid      = 1;
  private volatile long             thresholdTimestamp;
  private volatile long             thresholdXmin;

  private static class Entry {
    private TransactionState state;
    private final long       startTime;

    private Entry(final TransactionState state, final long startTime) {
      this.state = state;
      this.startTime = startTime;
    }
  }

  public TransactionRegistry() {
    this(GlobalConfiguration.OLD_SNAPSHOT_THRESHOLD.getValueAsLong(), System::currentTimeMillis);
  }

  /**
   * @param oldSnapshotThreshold milliseconds after which a running transaction stops holding back the limited horizon, -1 to
   *                             disable the feature
   * @param clock                time source in milliseconds
   */
  public TransactionRegistry(final long oldSnapshotThreshold, final LongSupplier clock) {
    this.oldSnapshotThreshold = oldSnapshotThreshold;
    this.clock = clock;
  }

  public long begin() {
    return executeInWriteLock(() -> {
      final long xid = nextXid++;
      transactions.put(xid, new Entry(TransactionState.IN_PROGRESS, clock.getAsLong()));
      return xid;
    });
  }

  public void commit(final long xid) {
    complete(xid, TransactionState.COMMITTED);
  }

  public void abort(final long xid) {
    complete(xid, TransactionState.ABORTED);
  }

  /**
   * Registers a transaction with a known outcome, as found in a status log. Ids beyond the last assigned one move the id counter
   * forward.
   */
  public void register(final long xid, final TransactionState state) {
    checkXid(xid);
    executeInWriteLock(() -> {
      if (transactions.containsKey(xid))
        throw new TransactionException("Transaction " + xid + " is already registered");
      transactions.put(xid, new Entry(state, clock.getAsLong()));
      if (xid >= nextXid)
        nextXid = xid + 1;
      return null;
    });
  }

  @Override
  public TransactionState getState(final long xid) {
    checkXid(xid);
    return executeInReadLock(() -> {
      final Entry entry = transactions.get(xid);
      if (entry == null)
        throw new TransactionException("Unknown transaction " + xid);
      return entry.state;
    });
  }

  @Override
  public boolean isRemovable(final long xid) {
    return xid < getNonRemovableHorizon();
  }

  @Override
  public long getNonRemovableHorizon() {
    return executeInReadLock(() -> {
      long horizon = nextXid;
      for (final Map.Entry<Long, Entry> e : transactions.entrySet())
        if (e.getValue().state == TransactionState.IN_PROGRESS && e.getKey() < horizon)
          horizon = e.getKey();
      return horizon;
    });
  }

  @Override
  public boolean isOldSnapshotThresholdActive() {
    return oldSnapshotThreshold >= 0;
  }

  @Override
  public LimitedHorizon computeLimitedHorizon(final long horizon) {
    if (!isOldSnapshotThresholdActive())
      return null;

    final long now = clock.getAsLong();
    final long limit = now - oldSnapshotThreshold;

    return executeInReadLock(() -> {
      long limited = nextXid;
      for (final Map.Entry<Long, Entry> e : transactions.entrySet()) {
        final Entry entry = e.getValue();
        // TRANSACTIONS STARTED BEFORE THE LIMIT DO NOT HOLD BACK THE HORIZON ANYMORE
        if (entry.state == TransactionState.IN_PROGRESS && entry.startTime > limit && e.getKey() < limited)
          limited = e.getKey();
      }
      return new LimitedHorizon(Math.max(horizon, limited), now);
    });
  }

  @Override
  public void setOldSnapshotThresholdTimestamp(final long timestamp, final long xmin) {
    executeInWriteLock(() -> {
      if (timestamp > thresholdTimestamp) {
        thresholdTimestamp = timestamp;
        thresholdXmin = xmin;
        LogManager.instance().log(this, Level.FINE, "Old snapshot threshold moved to timestamp=%d xmin=%d", timestamp, xmin);
      }
      return null;
    });
  }

  /**
   * Returns true if a snapshot taken at {@code snapshotTime} may miss versions removed through the old snapshot threshold.
   */
  public boolean isSnapshotTooOld(final long snapshotTime) {
    return thresholdTimestamp > 0 && snapshotTime <= thresholdTimestamp - oldSnapshotThreshold;
  }

  public long getThresholdTimestamp() {
    return thresholdTimestamp;
  }

  public long getThresholdXmin() {
    return thresholdXmin;
  }

  public long getNextXid() {
    return executeInReadLock(() -> nextXid);
  }

  private void complete(final long xid, final TransactionState state) {
    checkXid(xid);
    executeInWriteLock(() -> {
      final Entry entry = transactions.get(xid);
      if (entry == null)
        throw new TransactionException("Unknown transaction " + xid);
      if (entry.state != TransactionState.IN_PROGRESS)
        throw new TransactionException("Transaction " + xid + " is already " + entry.state);
      entry.state = state;
      return null;
    });
  }

  private static void checkXid(final long xid) {
    if (xid <= 0)
      throw new TransactionException("Invalid transaction id " + xid);
  }
}
