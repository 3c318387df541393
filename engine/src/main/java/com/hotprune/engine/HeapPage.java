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
package com.hotprune.engine;

import com.hotprune.GlobalConfiguration;
import com.hotprune.exception.ErrorCode;
import com.hotprune.exception.StorageException;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Slotted heap page. The page starts with a fixed header, followed by the array of line pointers growing forward. Tuples are
 * stored from the end of the page growing backward, 8-byte aligned.
 * <pre>
 * HEADER (24 bytes): LSN (long), FLAGS (short), LOWER (short), UPPER (short), RESERVED (short), PRUNE_XID (long)
 * </pre>
 * LOWER is the end of the line pointer array, UPPER the start of the tuple storage. Slots are numbered from 1.
 * <br>
 * NOTE: This class is not thread safe. Concurrent access is coordinated by the {@link PageBuffer} holding it.
 */
public class HeapPage {
  public static final int LSN_OFFSET       = 0;
  public static final int FLAGS_OFFSET     = 8;
  public static final int LOWER_OFFSET     = 10;
  public static final int UPPER_OFFSET     = 12;
  public static final int PRUNE_XID_OFFSET = 16;
  public static final int PAGE_HEADER_SIZE = 24;

  // PAGE FLAGS
  public static final int HAS_FREE_LINES = 0x0001;
  public static final int PAGE_FULL      = 0x0002;

  public static final int ALIGNMENT      = 8;
  public static final int MIN_TUPLE_SIZE = align(HeapTupleHeader.HEADER_SIZE);
  public static final int MIN_PAGE_SIZE  = 1024;
  public static final int MAX_PAGE_SIZE  = 32768;

  private final PageId     pageId;
  private final int        pageSize;
  private final byte[]     array;
  private final ByteBuffer content;

  /**
   * Creates an empty page of the size configured in {@link GlobalConfiguration#PAGE_SIZE}.
   */
  public HeapPage(final PageId pageId) {
    this(pageId, GlobalConfiguration.PAGE_SIZE.getValueAsInteger());
  }

  public HeapPage(final PageId pageId, final int pageSize) {
    checkPageSize(pageSize);
    this.pageId = pageId;
    this.pageSize = pageSize;
    this.array = new byte[pageSize];
    this.content = ByteBuffer.wrap(array);
    initialize();
  }

  /**
   * Loads a page from a raw image. The image is copied.
   */
  public HeapPage(final PageId pageId, final byte[] image) {
    checkPageSize(image.length);
    this.pageId = pageId;
    this.pageSize = image.length;
    this.array = Arrays.copyOf(image, image.length);
    this.content = ByteBuffer.wrap(array);

    final int lower = getLower();
    final int upper = getUpper();
    if (lower < PAGE_HEADER_SIZE || lower > upper || upper > pageSize || (lower - PAGE_HEADER_SIZE) % LinePointer.SIZE != 0)
      throw new StorageException(ErrorCode.CORRUPTION_DETECTED,
          "Corrupted page header in " + pageId + ": lower=" + lower + " upper=" + upper + " size=" + pageSize);
  }

  public static int maxTuplesPerPage(final int pageSize) {
    return (pageSize - PAGE_HEADER_SIZE) / (MIN_TUPLE_SIZE + LinePointer.SIZE);
  }

  public static int align(final int length) {
    return (length + ALIGNMENT - 1) & ~(ALIGNMENT - 1);
  }

  /**
   * Resets the page to empty: no slots, no tuples, no hint, no flags.
   */
  public void initialize() {
    Arrays.fill(array, (byte) 0);
    setLower(PAGE_HEADER_SIZE);
    setUpper(pageSize);
  }

  public PageId getPageId() {
    return pageId;
  }

  public int getPageSize() {
    return pageSize;
  }

  public int getMaxTuplesPerPage() {
    return maxTuplesPerPage(pageSize);
  }

  /**
   * Returns the highest slot number in use. Slot numbers range from 1 to this value, both included.
   */
  public int getMaxOffsetNumber() {
    return (getLower() - PAGE_HEADER_SIZE) / LinePointer.SIZE;
  }

  public boolean isValidSlot(final int slot) {
    return slot >= 1 && slot <= getMaxOffsetNumber();
  }

  // LINE POINTERS

  public int getSlotRaw(final int slot) {
    return content.getInt(slotPosition(slot));
  }

  public SlotState getSlotState(final int slot) {
    return LinePointer.stateOf(getSlotRaw(slot));
  }

  public int getSlotOffset(final int slot) {
    return LinePointer.offsetOf(getSlotRaw(slot));
  }

  public int getSlotLength(final int slot) {
    return LinePointer.lengthOf(getSlotRaw(slot));
  }

  /**
   * Returns the slot a redirect points to, or 0 if the slot is not a redirect.
   */
  public int getRedirectTarget(final int slot) {
    final int raw = getSlotRaw(slot);
    return LinePointer.stateOf(raw) == SlotState.REDIRECT ? LinePointer.offsetOf(raw) : 0;
  }

  public LinePointer getLinePointer(final int slot) {
    return new LinePointer(slot, getSlotRaw(slot));
  }

  public void setSlotUnused(final int slot) {
    content.putInt(slotPosition(slot), LinePointer.pack(0, SlotState.UNUSED, 0));
  }

  public void setSlotDead(final int slot) {
    content.putInt(slotPosition(slot), LinePointer.pack(0, SlotState.DEAD, 0));
  }

  public void setSlotRedirect(final int slot, final int target) {
    if (target < 1 || target > getMaxOffsetNumber())
      throw new IllegalArgumentException("Invalid redirect target " + target + " for slot " + slot + " in " + pageId);
    content.putInt(slotPosition(slot), LinePointer.pack(target, SlotState.REDIRECT, 0));
  }

  private void setSlotNormal(final int slot, final int offset, final int length) {
    content.putInt(slotPosition(slot), LinePointer.pack(offset, SlotState.NORMAL, length));
  }

  // TUPLES

  public long getXmin(final int slot) {
    return content.getLong(tuplePosition(slot) + HeapTupleHeader.XMIN_OFFSET);
  }

  public long getXmax(final int slot) {
    return content.getLong(tuplePosition(slot) + HeapTupleHeader.XMAX_OFFSET);
  }

  public int getInfomask(final int slot) {
    return content.getShort(tuplePosition(slot) + HeapTupleHeader.INFOMASK_OFFSET) & 0xFFFF;
  }

  /**
   * Returns the slot of the newer version of the tuple. Meaningful only if the tuple is HOT updated.
   */
  public int getNextSlot(final int slot) {
    return content.getShort(tuplePosition(slot) + HeapTupleHeader.NEXT_OFFSET) & 0xFFFF;
  }

  /**
   * Returns true if the slot holds a tuple marked as heap-only. Slots without storage are never heap-only.
   */
  public boolean isHeapOnly(final int slot) {
    return getSlotState(slot) == SlotState.NORMAL && HeapTupleHeader.isHeapOnly(getInfomask(slot));
  }

  public boolean isHotUpdated(final int slot) {
    return getSlotState(slot) == SlotState.NORMAL && HeapTupleHeader.isHotUpdated(getInfomask(slot));
  }

  public byte[] readPayload(final int slot) {
    final int pos = tuplePosition(slot);
    final byte[] payload = new byte[getSlotLength(slot) - HeapTupleHeader.HEADER_SIZE];
    System.arraycopy(array, pos + HeapTupleHeader.HEADER_SIZE, payload, 0, payload.length);
    return payload;
  }

  public void setXmax(final int slot, final long xmax) {
    content.putLong(tuplePosition(slot) + HeapTupleHeader.XMAX_OFFSET, xmax);
  }

  public void setInfomask(final int slot, final int infomask) {
    content.putShort(tuplePosition(slot) + HeapTupleHeader.INFOMASK_OFFSET, (short) infomask);
  }

  /**
   * Links the tuple in {@code slot} to its newer heap-only version in {@code nextSlot}, updated by {@code updaterXid}.
   */
  public void setHotUpdated(final int slot, final int nextSlot, final long updaterXid) {
    final int pos = tuplePosition(slot);
    content.putLong(pos + HeapTupleHeader.XMAX_OFFSET, updaterXid);
    content.putShort(pos + HeapTupleHeader.INFOMASK_OFFSET, (short) (getInfomask(slot) | HeapTupleHeader.HOT_UPDATED));
    content.putShort(pos + HeapTupleHeader.NEXT_OFFSET, (short) nextSlot);
  }

  /**
   * Stores a new tuple, reusing an unused slot when the page has any.
   *
   * @return the slot assigned to the tuple
   *
   * @throws StorageException with {@link ErrorCode#PAGE_FULL} if there is no room. In this case the page is also flagged as full.
   */
  public int addTuple(final long xmin, final long xmax, final int infomask, final byte[] payload) {
    final int length = HeapTupleHeader.HEADER_SIZE + payload.length;
    final int alignedLength = align(length);
    final int maxOffset = getMaxOffsetNumber();

    int slot = 0;
    if (hasFreeLines()) {
      for (int i = 1; i <= maxOffset; ++i)
        if (getSlotState(i) == SlotState.UNUSED) {
          slot = i;
          break;
        }
      if (slot == 0)
        // HINT WAS STALE
        clearFlag(HAS_FREE_LINES);
    }

    final int lower = slot == 0 ? getLower() + LinePointer.SIZE : getLower();
    if ((slot == 0 && maxOffset >= getMaxTuplesPerPage()) || getUpper() - alignedLength < lower) {
      setFull();
      throw new StorageException(ErrorCode.PAGE_FULL,
          "Not enough space in " + pageId + " for a tuple of " + length + " bytes (free=" + getFreeSpace() + ")");
    }

    if (slot == 0) {
      slot = maxOffset + 1;
      setLower(lower);
    }

    final int upper = getUpper() - alignedLength;
    setUpper(upper);

    content.putLong(upper + HeapTupleHeader.XMIN_OFFSET, xmin);
    content.putLong(upper + HeapTupleHeader.XMAX_OFFSET, xmax);
    content.putShort(upper + HeapTupleHeader.INFOMASK_OFFSET, (short) (infomask & ~HeapTupleHeader.HOT_UPDATED));
    content.putShort(upper + HeapTupleHeader.NEXT_OFFSET, (short) 0);
    System.arraycopy(payload, 0, array, upper + HeapTupleHeader.HEADER_SIZE, payload.length);
    // CLEAR ALIGNMENT PADDING
    Arrays.fill(array, upper + length, upper + alignedLength, (byte) 0);

    setSlotNormal(slot, upper, length);
    return slot;
  }

  /**
   * Compacts the storage of the surviving tuples toward the end of the page, reclaiming the space of the slots that do not own
   * storage anymore. Slot numbers do not change. Sets the free lines hint if any slot is unused.
   */
  public void repairFragmentation() {
    repairFragmentation(new long[getMaxOffsetNumber()]);
  }

  /**
   * Same as {@link #repairFragmentation()}, sorting the tuples in {@code sortBuffer} instead of allocating memory. The buffer
   * must have room for {@link #getMaxOffsetNumber()} entries.
   */
  public void repairFragmentation(final long[] sortBuffer) {
    final int lower = getLower();
    final int upper = getUpper();
    if (lower < PAGE_HEADER_SIZE || lower > upper || upper > pageSize)
      throw new StorageException(ErrorCode.CORRUPTION_DETECTED,
          "Corrupted page pointers in " + pageId + ": lower=" + lower + " upper=" + upper + " size=" + pageSize);

    final int maxOffset = getMaxOffsetNumber();
    if (sortBuffer.length < maxOffset)
      throw new IllegalArgumentException("Sort buffer of " + sortBuffer.length + " entries is too small for " + maxOffset + " slots");

    final long[] storage = sortBuffer;
    int nStorage = 0;
    int nUnused = 0;

    for (int slot = 1; slot <= maxOffset; ++slot) {
      final int raw = getSlotRaw(slot);
      final SlotState state = LinePointer.stateOf(raw);
      if (state == SlotState.NORMAL) {
        final int offset = LinePointer.offsetOf(raw);
        if (offset < upper || offset + LinePointer.lengthOf(raw) > pageSize)
          throw new StorageException(ErrorCode.CORRUPTION_DETECTED,
              "Corrupted line pointer " + slot + " in " + pageId + ": offset=" + offset + " length=" + LinePointer.lengthOf(raw));
        storage[nStorage++] = ((long) offset << 32) | slot;
      } else if (state == SlotState.UNUSED)
        ++nUnused;
    }

    if (nStorage == 0)
      setUpper(pageSize);
    else {
      // MOVE THE TUPLES WITH THE HIGHEST OFFSET FIRST: EVERY TUPLE ONLY MOVES TOWARD THE END OF THE PAGE
      sortInPlace(storage, nStorage);
      int newUpper = pageSize;
      for (int i = nStorage - 1; i >= 0; --i) {
        final int slot = (int) storage[i];
        final int offset = (int) (storage[i] >>> 32);
        final int length = getSlotLength(slot);
        newUpper -= align(length);
        if (newUpper != offset) {
          System.arraycopy(array, offset, array, newUpper, length);
          setSlotNormal(slot, newUpper, length);
        }
      }
      Arrays.fill(array, lower, newUpper, (byte) 0);
      setUpper(newUpper);
    }

    if (nUnused > 0)
      setFlag(HAS_FREE_LINES);
    else
      clearFlag(HAS_FREE_LINES);
  }

  // INSERTION SORT: NO TEMPORARY ARRAYS, AND THE SLOTS ARE MOSTLY IN REVERSE OFFSET ORDER ALREADY
  private static void sortInPlace(final long[] values, final int count) {
    for (int i = 1; i < count; ++i) {
      final long value = values[i];
      int j = i - 1;
      while (j >= 0 && values[j] > value) {
        values[j + 1] = values[j];
        --j;
      }
      values[j + 1] = value;
    }
  }

  /**
   * Returns the space between the line pointer array and the tuple storage, minus the room for one more line pointer.
   */
  public int getFreeSpace() {
    final int space = getUpper() - getLower();
    return space < LinePointer.SIZE ? 0 : space - LinePointer.SIZE;
  }

  /**
   * Like {@link #getFreeSpace()}, but returns 0 when the page cannot take another tuple because all the slots are taken.
   */
  public int getHeapFreeSpace() {
    int space = getFreeSpace();
    if (space > 0) {
      final int maxOffset = getMaxOffsetNumber();
      if (maxOffset >= getMaxTuplesPerPage()) {
        if (hasFreeLines()) {
          boolean found = false;
          for (int slot = 1; slot <= maxOffset; ++slot)
            if (getSlotState(slot) == SlotState.UNUSED) {
              found = true;
              break;
            }
          if (!found)
            space = 0;
        } else
          space = 0;
      }
    }
    return space;
  }

  // HEADER

  public long getPruneXid() {
    return content.getLong(PRUNE_XID_OFFSET);
  }

  public void setPruneXid(final long xid) {
    content.putLong(PRUNE_XID_OFFSET, xid);
  }

  /**
   * Lowers the prune hint to {@code xid} if the hint is unset or newer.
   */
  public void setPrunable(final long xid) {
    final long current = getPruneXid();
    if (current == HeapTupleHeader.INVALID_XID || xid < current)
      setPruneXid(xid);
  }

  public boolean isFull() {
    return (getFlags() & PAGE_FULL) != 0;
  }

  public void setFull() {
    setFlag(PAGE_FULL);
  }

  public void clearFull() {
    clearFlag(PAGE_FULL);
  }

  public boolean hasFreeLines() {
    return (getFlags() & HAS_FREE_LINES) != 0;
  }

  public long getLsn() {
    return content.getLong(LSN_OFFSET);
  }

  public void setLsn(final long lsn) {
    content.putLong(LSN_OFFSET, lsn);
  }

  public int getFlags() {
    return content.getShort(FLAGS_OFFSET) & 0xFFFF;
  }

  public int getLower() {
    return content.getShort(LOWER_OFFSET) & 0xFFFF;
  }

  public int getUpper() {
    return content.getShort(UPPER_OFFSET) & 0xFFFF;
  }

  /**
   * Returns a copy of the raw page image.
   */
  public byte[] toByteArray() {
    return Arrays.copyOf(array, array.length);
  }

  public HeapPage copy() {
    return new HeapPage(pageId, array);
  }

  @Override
  public String toString() {
    return pageId + " slots=" + getMaxOffsetNumber() + " lower=" + getLower() + " upper=" + getUpper() + " pruneXid=" + getPruneXid() + " lsn="
        + getLsn();
  }

  private void setFlag(final int flag) {
    content.putShort(FLAGS_OFFSET, (short) (getFlags() | flag));
  }

  private void clearFlag(final int flag) {
    content.putShort(FLAGS_OFFSET, (short) (getFlags() & ~flag));
  }

  private void setLower(final int lower) {
    content.putShort(LOWER_OFFSET, (short) lower);
  }

  private void setUpper(final int upper) {
    content.putShort(UPPER_OFFSET, (short) upper);
  }

  private int slotPosition(final int slot) {
    if (slot < 1 || slot > getMaxOffsetNumber())
      throw new IllegalArgumentException("Invalid slot " + slot + " in " + pageId + " (max=" + getMaxOffsetNumber() + ")");
    return PAGE_HEADER_SIZE + (slot - 1) * LinePointer.SIZE;
  }

  private int tuplePosition(final int slot) {
    final int raw = getSlotRaw(slot);
    if (LinePointer.stateOf(raw) != SlotState.NORMAL)
      throw new IllegalStateException("Slot " + slot + " in " + pageId + " has no storage (" + LinePointer.stateOf(raw) + ")");
    return LinePointer.offsetOf(raw);
  }

  private static void checkPageSize(final int pageSize) {
    if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE || Integer.bitCount(pageSize) != 1)
      throw new IllegalArgumentException("Invalid page size " + pageSize + ": must be a power of 2 between 1024 and 32768");
  }
}
