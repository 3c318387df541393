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
import com.hotprune.engine.HeapRelation;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.engine.RedoLog;
import com.hotprune.engine.SlotState;
import com.hotprune.exception.InvariantViolationException;
import com.hotprune.transaction.TransactionState;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HeapPrunerTest extends PruneTestHelper {

  @Test
  public void emptyPageIsLeftUntouched() {
    final PruneResult result = prune();

    assertThat(result.getDeleted()).isZero();
    assertThat(result.isModified()).isFalse();
    assertThat(result.getNewPruneXid()).isZero();
    assertThat(redoLog.getRecords()).isEmpty();
    assertThat(buffer.isDirty()).isFalse();
  }

  @Test
  public void liveTuplesAreNotPruned() {
    final int a = insert(committed());
    final int b = insert(committed());
    final byte[] before = page.toByteArray();

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isZero();
    assertThat(result.isModified()).isFalse();
    assertThat(page.getSlotState(a)).isEqualTo(SlotState.NORMAL);
    assertThat(page.getSlotState(b)).isEqualTo(SlotState.NORMAL);
    assertThat(page.toByteArray()).isEqualTo(before);
  }

  @Test
  public void deadRootWithoutChainBecomesTombstone() {
    final int slot = insert(committed());
    delete(slot, committed());

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(result.getNewlyDead()).isEqualTo(1);
    assertThat(result.getReclaimed()).isZero();
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.DEAD);
  }

  @Test
  public void tupleInsertedByAbortedTransactionBecomesTombstone() {
    final int slot = insert(aborted());

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.DEAD);
  }

  @Test
  public void deadPrefixIsRemovedAndRootRedirected() {
    final int root = insert(committed());
    final long t2 = running();
    final int h1 = hotUpdate(root, t2);
    registry.commit(t2);
    final long t3 = running();
    final int h2 = hotUpdate(h1, t3);
    registry.commit(t3);

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(2);
    assertThat(result.getNewlyDead()).isZero();
    assertThat(result.getReclaimed()).isEqualTo(2);
    assertThat(result.isModified()).isTrue();
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.REDIRECT);
    assertThat(page.getRedirectTarget(root)).isEqualTo(h2);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.UNUSED);
    assertThat(page.getSlotState(h2)).isEqualTo(SlotState.NORMAL);
    assertThat(page.getXmin(h2)).isEqualTo(t3);
    assertThat(page.readPayload(h2)).isEqualTo(payload("row-" + t3));
    assertThat(page.hasFreeLines()).isTrue();
    assertNoDanglingRedirects(page);
  }

  @Test
  public void fullyDeadChainLeavesOnlyTheRootTombstone() {
    final int root = insert(committed());
    final long t2 = running();
    final int h1 = hotUpdate(root, t2);
    registry.commit(t2);
    final long t3 = running();
    final int h2 = hotUpdate(h1, t3);
    registry.commit(t3);
    delete(h2, committed());

    final int upperBefore = page.getUpper();
    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(3);
    assertThat(result.getNewlyDead()).isEqualTo(1);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.DEAD);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.UNUSED);
    assertThat(page.getSlotState(h2)).isEqualTo(SlotState.UNUSED);
    // NO STORAGE LEFT
    assertThat(page.getUpper()).isGreaterThan(upperBefore).isEqualTo(PAGE_SIZE);
  }

  @Test
  public void redirectRootIsMovedToTheNextSurvivor() {
    final int root = insert(committed());
    final long t2 = running();
    final int h1 = hotUpdate(root, t2);
    registry.commit(t2);
    prune();
    assertThat(page.getRedirectTarget(root)).isEqualTo(h1);

    final long t3 = running();
    final int h2 = hotUpdate(h1, t3);
    registry.commit(t3);

    final PruneResult result = prune();

    // THE REDIRECT HAS NO STORAGE: ONLY h1 IS COUNTED
    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.REDIRECT);
    assertThat(page.getRedirectTarget(root)).isEqualTo(h2);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.UNUSED);
  }

  @Test
  public void redirectRootOfDeadChainBecomesTombstone() {
    final int root = insert(committed());
    final long t2 = running();
    final int h1 = hotUpdate(root, t2);
    registry.commit(t2);
    prune();

    delete(h1, committed());
    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(result.getNewlyDead()).isEqualTo(1);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.DEAD);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.UNUSED);
  }

  @Test
  public void versionsVisibleToRunningTransactionsAreKept() {
    final int root = insert(committed());
    final long reader = running();
    final long t2 = running();
    final int h1 = hotUpdate(root, t2);
    registry.commit(t2);
    final byte[] before = page.toByteArray();

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isZero();
    assertThat(result.isModified()).isFalse();
    assertThat(result.getNewPruneXid()).isEqualTo(t2);
    assertThat(page.getPruneXid()).isEqualTo(t2);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.NORMAL);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.NORMAL);
    // ONLY THE HINT CHANGED, WITHOUT REDO
    assertThat(buffer.isDirtyHint()).isTrue();
    assertThat(buffer.isDirty()).isFalse();
    assertThat(redoLog.getRecords()).isEmpty();
    assertThat(page.getLsn()).isZero();
    assertThat(Arrays.copyOfRange(page.toByteArray(), HeapPage.PAGE_HEADER_SIZE, PAGE_SIZE))
        .isEqualTo(Arrays.copyOfRange(before, HeapPage.PAGE_HEADER_SIZE, PAGE_SIZE));

    registry.commit(reader);
    assertThat(prune().getDeleted()).isEqualTo(1);
  }

  @Test
  public void pruneHintIsTheOldestPendingDeleter() {
    final int a = insert(committed());
    final int b = insert(committed());
    final int c = insert(committed());
    final int d = insert(committed());
    final long oldest = running();
    final long deleterOfD = committed();
    delete(d, deleterOfD);
    final long deleter1 = running();
    final long deleter2 = running();
    delete(b, deleter2);
    delete(c, deleter1);

    final PruneResult result = prune();

    // d IS RECENTLY DEAD WHILE oldest IS RUNNING
    assertThat(result.getDeleted()).isZero();
    assertThat(result.getNewPruneXid()).isEqualTo(deleterOfD);
    assertThat(page.getPruneXid()).isEqualTo(deleterOfD);
    assertThat(page.getSlotState(a)).isEqualTo(SlotState.NORMAL);

    registry.abort(oldest);
    final PruneResult second = prune();

    assertThat(second.getDeleted()).isEqualTo(1);
    assertThat(page.getSlotState(d)).isEqualTo(SlotState.DEAD);
    assertThat(second.getNewPruneXid()).isEqualTo(deleter1);
    assertThat(page.getPruneXid()).isEqualTo(deleter1);
  }

  @Test
  public void pruneHintIsClearedWhenNothingIsPending() {
    final int slot = insert(committed());
    page.setPruneXid(slot + 100L);
    page.setFull();

    final PruneResult result = prune();

    assertThat(result.getNewPruneXid()).isZero();
    assertThat(page.getPruneXid()).isZero();
    assertThat(page.isFull()).isFalse();
    assertThat(result.isModified()).isFalse();
    assertThat(buffer.isDirtyHint()).isTrue();
  }

  @Test
  public void insertInProgressDoesNotSetTheHint() {
    insert(running());

    assertThat(prune().getNewPruneXid()).isZero();
  }

  @Test
  public void deadVersionBetweenSurvivorsIsKept() {
    // root -> h1 (inserted by an aborted transaction) -> h2: h1 IS DEAD BUT COMES AFTER A LIVE ROOT
    final int root = insert(committed());
    final long t2 = aborted();
    final int h1 = hotUpdate(root, t2);
    final long t3 = committed();
    final int h2 = hotUpdate(h1, t3);
    final byte[] before = page.toByteArray();

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isZero();
    assertThat(result.isModified()).isFalse();
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.NORMAL);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.NORMAL);
    assertThat(page.getSlotState(h2)).isEqualTo(SlotState.NORMAL);
    assertThat(Arrays.copyOfRange(page.toByteArray(), HeapPage.PAGE_HEADER_SIZE, PAGE_SIZE))//
        .isEqualTo(Arrays.copyOfRange(before, HeapPage.PAGE_HEADER_SIZE, PAGE_SIZE));

    // THE TAIL IS STILL REACHABLE: A SECOND PASS FINDS NOTHING TO DO
    assertThat(prune().getDeleted()).isZero();
    assertThat(page.getSlotState(h2)).isEqualTo(SlotState.NORMAL);
    assertThat(fatalErrors.getErrors()).isEmpty();
  }

  @Test
  public void deadTailAfterSurvivorIsReclaimedByOrphanPass() {
    final int root = insert(committed());
    final long t2 = aborted();
    final int h1 = hotUpdate(root, t2);

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.NORMAL);
    assertThat(page.getSlotState(h1)).isEqualTo(SlotState.UNUSED);

    assertThat(prune().getDeleted()).isZero();
    assertThat(fatalErrors.getErrors()).isEmpty();
  }

  @Test
  public void chainLoopIsFatal() {
    final int root = insert(committed());
    final long t2 = aborted();
    final int h1 = hotUpdate(root, t2);
    page.setHotUpdated(h1, h1, t2);
    final byte[] before = page.toByteArray();

    assertThatThrownBy(this::prune).isInstanceOf(InvariantViolationException.class).hasMessageContaining("loops");
    assertThat(fatalErrors.getErrors()).hasSize(1);
    assertThat(page.toByteArray()).isEqualTo(before);
  }

  @Test
  public void orphanLeftByAbortedUpdateIsReclaimed() {
    final int root = insert(committed());
    final long t2 = running();
    final int orphan = hotUpdate(root, t2);
    registry.abort(t2);
    // THE ROW IS UPDATED AGAIN: NOTHING POINTS TO THE ABORTED VERSION ANYMORE
    final long t3 = running();
    final int h2 = hotUpdate(root, t3);
    registry.commit(t3);

    final PruneResult result = prune();

    assertThat(result.getDeleted()).isEqualTo(2);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.REDIRECT);
    assertThat(page.getRedirectTarget(root)).isEqualTo(h2);
    assertThat(page.getSlotState(orphan)).isEqualTo(SlotState.UNUSED);
    assertThat(fatalErrors.getErrors()).isEmpty();
  }

  @Test
  public void liveOrphanIsFatal() {
    final int root = insert(committed());
    final int orphan = page.addTuple(committed(), 0, HeapTupleHeader.HEAP_ONLY, payload("lost"));
    final byte[] before = page.toByteArray();

    assertThatThrownBy(this::prune).isInstanceOf(InvariantViolationException.class).satisfies(e -> {
      final InvariantViolationException violation = (InvariantViolationException) e;
      assertThat(violation.getContext()).containsEntry("slot", orphan).containsEntry("visibility", "LIVE");
      assertThat(violation.getContext()).containsKey("page");
    });

    assertThat(fatalErrors.getErrors()).hasSize(1);
    assertThat(page.toByteArray()).isEqualTo(before);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.NORMAL);
    assertThat(redoLog.getRecords()).isEmpty();
  }

  @Test
  public void redoRecordIsWrittenForLoggedRelations() {
    final int root = insert(committed());
    final long t2 = running();
    final int h1 = hotUpdate(root, t2);
    registry.commit(t2);
    final long deleter = committed();
    delete(h1, deleter);

    final PruneResult result = prune();

    assertThat(redoLog.getRecords()).hasSize(1);
    assertThat(redoLog.getLastRecord().getType()).isEqualTo(RedoLog.RECORD_PRUNE);
    assertThat(redoLog.getLastRecord().getPageId()).isEqualTo(page.getPageId());
    assertThat(result.getLsn()).isEqualTo(redoLog.getLastRecord().getLsn());
    assertThat(page.getLsn()).isEqualTo(result.getLsn());
    assertThat(buffer.isDirty()).isTrue();

    final PruneRecord record = PruneRecord.decode(redoLog.getLastRecord().getPayload());
    assertThat(record.getRedirectedCount()).isZero();
    assertThat(record.getNowDead()).containsExactly(root);
    assertThat(record.getNowUnused()).containsExactly(h1);
    assertThat(record.getLatestRemovedXid()).isEqualTo(deleter);
  }

  @Test
  public void latestRemovedXidIsTheNewestDeleter() {
    final int a = insert(committed());
    final long t2 = running();
    final int h1 = hotUpdate(a, t2);
    registry.commit(t2);
    final int b = insert(committed());
    final long t4 = committed();
    delete(b, t4);
    // INSERTED BY AN ABORTED TRANSACTION: NEVER VISIBLE, IT DOES NOT COUNT
    insert(aborted());

    prune();

    final PruneRecord record = PruneRecord.decode(redoLog.getLastRecord().getPayload());
    assertThat(record.getLatestRemovedXid()).isEqualTo(t4);
    assertThat(record.getRedirected()).containsExactly(a, h1);
  }

  @Test
  public void unloggedRelationWritesNoRedo() {
    relation = new HeapRelation("scratch", 7, 100, false);
    final int slot = insert(committed());
    delete(slot, committed());

    final PruneResult result = prune();

    assertThat(result.isModified()).isTrue();
    assertThat(result.getLsn()).isZero();
    assertThat(page.getLsn()).isZero();
    assertThat(redoLog.getRecords()).isEmpty();
    assertThat(buffer.isDirty()).isTrue();
  }

  @Test
  public void cleanupLockIsRequired() {
    buffer.pin();
    try {
      assertThatThrownBy(() -> newPruner().prune(buffer, relation, null)).isInstanceOf(IllegalStateException.class);
    } finally {
      buffer.unpin();
    }
  }

  @Test
  public void pruningTwiceChangesNothing() {
    final Random random = new Random(42);
    final int rows = 25;

    for (int row = 0; row < rows; ++row)
      buildRandomChain(random);

    final PruneResult first = prune();
    assertThat(fatalErrors.getErrors()).isEmpty();
    assertNoDanglingRedirects(page);

    final byte[] afterFirst = page.toByteArray();
    final int records = redoLog.getRecords().size();

    final PruneResult second = prune();

    assertThat(second.getDeleted()).isZero();
    assertThat(second.isModified()).isFalse();
    assertThat(second.getNewPruneXid()).isEqualTo(first.getNewPruneXid());
    assertThat(page.toByteArray()).isEqualTo(afterFirst);
    assertThat(redoLog.getRecords()).hasSize(records);
  }

  private void buildRandomChain(final Random random) {
    final long inserter = random.nextInt(5) == 0 ? aborted() : committed();
    int version = insert(inserter);
    if (registry.getState(inserter) != TransactionState.COMMITTED)
      return;

    final int updates = random.nextInt(4);
    for (int u = 0; u < updates; ++u) {
      final long updater = running();
      final int next = hotUpdate(version, updater);
      switch (random.nextInt(4)) {
      case 0:
        // ABORTED: THE SAME VERSION IS UPDATED AGAIN, LEAVING AN ORPHAN
        registry.abort(updater);
        version = hotUpdate(version, committed());
        break;
      case 1:
        // STILL RUNNING: NOTHING ELSE CAN HAPPEN TO THIS ROW
        return;
      default:
        registry.commit(updater);
        version = next;
      }
    }

    if (random.nextInt(4) == 0)
      delete(version, committed());
  }
}
