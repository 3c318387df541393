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

import com.hotprune.exception.InvariantViolationException;

/**
 * Removes the heap-only tuples that no chain walk reached. They are left behind when the transaction that HOT updated their
 * predecessor aborted and the predecessor was updated again: nothing points to them anymore, and they must be dead.
 */
public class OrphanReclaimer {

  /**
   * @return the number of tuples removed, always 1
   *
   * @throws InvariantViolationException if the tuple is not heap-only or not dead, after notifying the fatal error handler
   */
  public int reclaim(final PruneState state, final int slot) {
    if (!state.isHeapOnly(slot))
      throw state.getFatalErrorHandler().raise(new InvariantViolationException(state.getPage().getPageId(), slot,
          "Slot " + slot + " is not reachable from any chain root but it is not a heap-only tuple"));

    final TupleVisibility visibility = state.getVisibility(slot);
    if (visibility != TupleVisibility.DEAD)
      throw state.getFatalErrorHandler().raise(
          (InvariantViolationException) new InvariantViolationException(state.getPage().getPageId(), slot,
              "Orphan heap-only tuple in slot " + slot + " is not dead").addContext("visibility", String.valueOf(visibility)));

    state.getPlan().recordUnused(slot);
    return 1;
  }
}
