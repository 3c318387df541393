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

import com.hotprune.engine.HeapRelation;
import com.hotprune.engine.HeapTupleHeader;
import com.hotprune.engine.SlotState;
import com.hotprune.exception.InvariantViolationException;
import com.hotprune.transaction.TransactionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OpportunisticPrunerTest extends PruneTestHelper {

  @BeforeEach
  public void pinPage() {
    buffer.pin();
  }

  @AfterEach
  public void unpinPage() {
    assertThat(buffer.isCleanupLockedByCurrentThread()).isFalse();
    buffer.unpin();
  }

  @Test
  public void pageWithoutHintIsSkipped() {
    final int slot = insert(committed());
    delete(slot, committed());
    page.setFull();

    assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNull();
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.NORMAL);
  }

  @Test
  public void hintNotRemovableYetIsSkipped() {
    final int slot = insert(committed());
    running();
    deleteAndMark(slot, committed());
    page.setFull();

    assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNull();
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.NORMAL);
    assertThat(page.isFull()).isTrue();
  }

  @Test
  public void pageWithEnoughRoomIsSkipped() {
    final int slot = insert(committed());
    deleteAndMark(slot, committed());

    assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNull();
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.NORMAL);
  }

  @Test
  public void fullPageIsPruned() {
    final int slot = insert(committed());
    deleteAndMark(slot, committed());
    page.setFull();

    final PruneResult result = newOpportunisticPruner().maybePrune(buffer, relation);

    assertThat(result).isNotNull();
    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.DEAD);
    assertThat(page.isFull()).isFalse();
    assertThat(page.getPruneXid()).isZero();
    assertThat(buffer.getPinCount()).isEqualTo(1);
  }

  @Test
  public void pageShortOfSpaceIsPruned() {
    final byte[] big = new byte[1100];
    Arrays.fill(big, (byte) 'x');
    final long inserter = committed();
    final int[] slots = new int[6];
    for (int i = 0; i < slots.length; ++i)
      slots[i] = page.addTuple(inserter, HeapTupleHeader.INVALID_XID, 0, big);

    final int root = slots[3];
    final int h1 = hotUpdateBig(root, committed(), big);
    page.setPrunable(page.getXmax(root));
    final int freeBefore = page.getHeapFreeSpace();
    assertThat(freeBefore).isLessThan(newOpportunisticPruner().getMinFreeSpace(relation, PAGE_SIZE));

    final PruneResult result = newOpportunisticPruner().maybePrune(buffer, relation);

    assertThat(result).isNotNull();
    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(page.getSlotState(root)).isEqualTo(SlotState.REDIRECT);
    assertThat(page.getRedirectTarget(root)).isEqualTo(h1);
    assertThat(page.getHeapFreeSpace()).isGreaterThan(freeBefore);
  }

  @Test
  public void pageUsedByOthersIsSkipped() {
    final int slot = insert(committed());
    deleteAndMark(slot, committed());
    page.setFull();

    buffer.pin();
    try {
      assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNull();
      assertThat(page.getSlotState(slot)).isEqualTo(SlotState.NORMAL);
      assertThat(buffer.getPinCount()).isEqualTo(2);
    } finally {
      buffer.unpin();
    }

    assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNotNull();
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.DEAD);
  }

  @Test
  public void recoveryIsSkipped() {
    final int slot = insert(committed());
    deleteAndMark(slot, committed());
    page.setFull();
    redoLog.setRecoveryInProgress(true);

    assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNull();
    assertThat(page.getSlotState(slot)).isEqualTo(SlotState.NORMAL);
  }

  @Test
  public void lockIsReleasedWhenPruningFails() {
    final int slot = insert(committed());
    deleteAndMark(slot, committed());
    page.addTuple(committed(), 0, HeapTupleHeader.HEAP_ONLY, payload("lost"));
    page.setFull();

    assertThatThrownBy(() -> newOpportunisticPruner().maybePrune(buffer, relation)).isInstanceOf(InvariantViolationException.class);

    assertThat(buffer.isCleanupLockedByCurrentThread()).isFalse();
    assertThat(buffer.tryLockForCleanup()).isTrue();
    buffer.unlockCleanup();
  }

  @Test
  public void oldSnapshotThresholdAllowsPruning() {
    registry = new TransactionRegistry(1_000, () -> now);
    now = 0;
    registry.begin();
    final int slot = insert(committed());
    deleteAndMark(slot, committed());
    page.setFull();

    now = 500;
    assertThat(newOpportunisticPruner().maybePrune(buffer, relation)).isNull();

    now = 5_000;
    final PruneResult result = newOpportunisticPruner().maybePrune(buffer, relation);

    assertThat(result).isNotNull();
    assertThat(result.isOldSnapshotUsed()).isTrue();
    assertThat(result.getDeleted()).isEqualTo(1);
    assertThat(registry.getThresholdTimestamp()).isEqualTo(5_000);
  }

  @Test
  public void minFreeSpaceFollowsTheFillFactor() {
    final OpportunisticPruner pruner = newOpportunisticPruner();

    assertThat(pruner.getMinFreeSpace(new HeapRelation("dense", 1, 100, true), PAGE_SIZE)).isEqualTo(819);
    assertThat(pruner.getMinFreeSpace(new HeapRelation("sparse", 2, 70, true), PAGE_SIZE)).isEqualTo(2457);
  }

  private OpportunisticPruner newOpportunisticPruner() {
    return new OpportunisticPruner(registry, redoLog, newPruner(), 10);
  }

  private void deleteAndMark(final int slot, final long deleter) {
    delete(slot, deleter);
    page.setPrunable(deleter);
  }

  private int hotUpdateBig(final int slot, final long updater, final byte[] payload) {
    final int newSlot = page.addTuple(updater, HeapTupleHeader.INVALID_XID, HeapTupleHeader.HEAP_ONLY, payload);
    page.setHotUpdated(slot, newSlot, updater);
    return newSlot;
  }
}
