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
 * State of a line pointer. Only {@link #NORMAL} slots own tuple storage.
 */
public enum SlotState {
  /** Free, can be reused by the next insertion. */
  UNUSED(0),
  /** Points to a tuple stored in the page. */
  NORMAL(1),
  /** Points to another slot of the same page: the first live member of a HOT chain. */
  REDIRECT(2),
  /** Tombstone kept because an index may still reference it. */
  DEAD(3);

  private static final SlotState[] BY_CODE = { UNUSED, NORMAL, REDIRECT, DEAD };

  private final int code;

  SlotState(final int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public boolean hasStorage() {
    return this == NORMAL;
  }

  public static SlotState fromCode(final int code) {
    return BY_CODE[code & 0x03];
  }
}
