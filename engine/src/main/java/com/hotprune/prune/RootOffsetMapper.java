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
import com.hotprune.engine.SlotState;

import java.util.Arrays;

/**
 * Finds the root of the HOT chain every tuple of a page belongs to. Index builds use it to point the index entries of heap-only
 * tuples to their root. The mapping is valid only while the caller holds a pin on the page.
 */
public class RootOffsetMapper {

  /**
   * @return an array indexed by slot, holding the root slot of each tuple or 0 for none. Roots map to themselves, redirects have
   * no entry, heap-only tuples reachable from a redirect map to the redirect
   */
  public int[] mapRoots(final HeapPage page) {
    final int[] rootOffsets = new int[page.getMaxTuplesPerPage() + 1];
    mapRoots(page, rootOffsets);
    return rootOffsets;
  }

  public void mapRoots(final HeapPage page, final int[] rootOffsets) {
    if (rootOffsets.length < page.getMaxTuplesPerPage() + 1)
      throw new IllegalArgumentException("Root offsets array too small: " + rootOffsets.length + " < " + (page.getMaxTuplesPerPage() + 1));

    Arrays.fill(rootOffsets, 0);

    final int maxOffset = page.getMaxOffsetNumber();
    for (int slot = 1; slot <= maxOffset; ++slot) {
      final SlotState state = page.getSlotState(slot);

      int nextSlot;
      long priorXmax;

      if (state == SlotState.NORMAL) {
        final int infomask = page.getInfomask(slot);

        // HEAP-ONLY TUPLES ARE MAPPED WHEN THEIR ROOT IS FOUND
        if (HeapTupleHeader.isHeapOnly(infomask))
          continue;

        rootOffsets[slot] = slot;

        if (!HeapTupleHeader.isHotUpdated(infomask))
          continue;

        nextSlot = page.getNextSlot(slot);
        priorXmax = page.getXmax(slot);

      } else if (state == SlotState.REDIRECT) {
        nextSlot = page.getRedirectTarget(slot);
        priorXmax = HeapTupleHeader.INVALID_XID;

      } else
        continue;

      // EVERY STEP MOVES TO A DIFFERENT TUPLE: A CHAIN CANNOT BE LONGER THAN THE SLOTS OF THE PAGE
      for (int steps = 0; steps < maxOffset; ++steps) {
        if (nextSlot < 1 || nextSlot > maxOffset)
          break;

        if (page.getSlotState(nextSlot) != SlotState.NORMAL)
          break;

        final int infomask = page.getInfomask(nextSlot);
        if (!HeapTupleHeader.isHeapOnly(infomask))
          break;

        if (HeapTupleHeader.isValidXid(priorXmax) && priorXmax != page.getXmin(nextSlot))
          break;

        rootOffsets[nextSlot] = slot;

        if (!HeapTupleHeader.isHotUpdated(infomask))
          break;

        priorXmax = page.getXmax(nextSlot);
        nextSlot = page.getNextSlot(nextSlot);
      }
    }
  }
}
