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

import com.hotprune.engine.HeapTupleHeader;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RootOffsetMapperTest extends PruneTestHelper {
  private final RootOffsetMapper mapper = new RootOffsetMapper();

  @Test
  public void everyVersionMapsToItsRoot() {
    final int root = insert(committed());
    final int h1 = hotUpdate(root, committed());
    final int other = insert(committed());
    final int h2 = hotUpdate(h1, committed());

    final int[] roots = mapper.mapRoots(page);

    assertThat(roots).hasSize(page.getMaxTuplesPerPage() + 1);
    assertThat(roots[root]).isEqualTo(root);
    assertThat(roots[h1]).isEqualTo(root);
    assertThat(roots[h2]).isEqualTo(root);
    assertThat(roots[other]).isEqualTo(other);
    assertThat(roots[0]).isZero();
  }

  @Test
  public void versionsBehindRedirectMapToTheRedirect() {
    final int root = insert(committed());
    final int h1 = hotUpdate(root, committed());
    final int h2 = hotUpdate(h1, committed());
    prune();

    final int[] roots = mapper.mapRoots(page);

    assertThat(roots[root]).isZero();
    assertThat(roots[h1]).isZero();
    assertThat(roots[h2]).isEqualTo(root);
  }

  @Test
  public void tombstonesHaveNoRoot() {
    final int slot = insert(committed());
    delete(slot, committed());
    prune();

    assertThat(mapper.mapRoots(page)[slot]).isZero();
  }

  @Test
  public void chainStopsAtXminMismatch() {
    final int root = insert(committed());
    final int stranger = page.addTuple(committed(), 0, HeapTupleHeader.HEAP_ONLY, payload("stranger"));
    page.setHotUpdated(root, stranger, committed());

    final int[] roots = mapper.mapRoots(page);

    assertThat(roots[root]).isEqualTo(root);
    assertThat(roots[stranger]).isZero();
  }

  @Test
  public void nextSlotOutOfThePageEndsTheChain() {
    final int root = insert(committed());
    page.setHotUpdated(root, 250, committed());

    assertThat(mapper.mapRoots(page)[root]).isEqualTo(root);
  }

  @Test
  public void arrayTooSmallIsRejected() {
    insert(committed());

    assertThatThrownBy(() -> mapper.mapRoots(page, new int[2])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void arrayIsResetBeforeMapping() {
    final int root = insert(committed());
    final int[] roots = new int[page.getMaxTuplesPerPage() + 1];
    roots[5] = 3;

    mapper.mapRoots(page, roots);

    assertThat(roots[5]).isZero();
    assertThat(roots[root]).isEqualTo(root);
  }
}
