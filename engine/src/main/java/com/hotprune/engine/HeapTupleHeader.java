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
 * Layout of the header stored in front of every tuple:
 * <pre>
 * +--------+--------+----------+------+---------+
 * | xmin   | xmax   | infomask | next | payload |
 * | int64  | int64  | int16    | int16| ...     |
 * +--------+--------+----------+------+---------+
 * </pre>
 * {@code next} is the slot of the newer version and is meaningful only when {@link #HOT_UPDATED} is set.
 */
public final class HeapTupleHeader {
  public static final int XMIN_OFFSET     = 0;
  public static final int XMAX_OFFSET     = 8;
  public static final int INFOMASK_OFFSET = 16;
  public static final int NEXT_OFFSET     = 18;
  public static final int HEADER_SIZE     = 20;

  // INFOMASK FLAGS
  public static final int HAS_NULLS      = 0x0001;
  public static final int XMAX_LOCK_ONLY = 0x0080;
  public static final int HOT_UPDATED    = 0x4000;
  public static final int HEAP_ONLY      = 0x8000;

  public static final long INVALID_XID = 0L;

  private HeapTupleHeader() {
  }

  public static boolean isHeapOnly(final int infomask) {
    return (infomask & HEAP_ONLY) != 0;
  }

  public static boolean isHotUpdated(final int infomask) {
    return (infomask & HOT_UPDATED) != 0;
  }

  public static boolean isXmaxLockOnly(final int infomask) {
    return (infomask & XMAX_LOCK_ONLY) != 0;
  }

  public static boolean isValidXid(final long xid) {
    return xid != INVALID_XID;
  }

  /**
   * Storage size of a tuple with the given payload, aligned to {@link HeapPage#ALIGNMENT} bytes.
   */
  public static int alignedSize(final int payloadLength) {
    return HeapPage.align(HEADER_SIZE + payloadLength);
  }
}
