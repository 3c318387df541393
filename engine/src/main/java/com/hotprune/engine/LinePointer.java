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

/**
 * Line pointer encoding. A slot is a 32-bit value packing {@code offset:15 | state:2 | length:15}. A redirect stores the target
 * slot index in the offset field with length 0, dead and unused slots store 0 in both.
 * <br>
 * Instances are immutable snapshots of one slot, used for diagnostics and by read-only callers. The pruning code works on the
 * packed form through {@link HeapPage} to avoid allocations.
 */
public final class LinePointer {
  public static final int SIZE = 4;

  private static final int FIELD_MASK  = 0x7FFF;
  private static final int OFFSET_SHIFT = 17;
  private static final int STATE_SHIFT  = 15;

  private final int       slot;
  private final SlotState state;
  private final int       offset;
  private final int       length;

  LinePointer(final int slot, final int packed) {
    this.slot = slot;
    this.state = stateOf(packed);
    this.offset = offsetOf(packed);
    this.length = lengthOf(packed);
  }

  public static int pack(final int offset, final SlotState state, final int length) {
    if (offset < 0 || offset > FIELD_MASK)
      throw new IllegalArgumentException("Line pointer offset " + offset + " out of range");
    if (length < 0 || length > FIELD_MASK)
      throw new IllegalArgumentException("Line pointer length " + length + " out of range");
    return (offset << OFFSET_SHIFT) | (state.getCode() << STATE_SHIFT) | length;
  }

  public static int offsetOf(final int packed) {
    return (packed >>> OFFSET_SHIFT) & FIELD_MASK;
  }

  public static SlotState stateOf(final int packed) {
    return SlotState.fromCode(packed >>> STATE_SHIFT);
  }

  public static int lengthOf(final int packed) {
    return packed & FIELD_MASK;
  }

  public int getSlot() {
    return slot;
  }

  public SlotState getState() {
    return state;
  }

  /**
   * Storage offset of the tuple for normal slots, target slot for redirects.
   */
  public int getOffset() {
    return offset;
  }

  public int getLength() {
    return length;
  }

  public int getRedirectTarget() {
    return state == SlotState.REDIRECT ? offset : 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof LinePointer that))
      return false;
    return slot == that.slot && state == that.state && offset == that.offset && length == that.length;
  }

  @Override
  public int hashCode() {
    return ((slot * 31 + state.hashCode()) * 31 + offset) * 31 + length;
  }

  @Override
  public String toString() {
    return switch (state) {
      case UNUSED -> slot + ":unused";
      case DEAD -> slot + ":dead";
      case REDIRECT -> slot + ":redirect->" + offset;
      case NORMAL -> slot + ":normal@" + offset + "(" + length + ")";
    };
  }
}
