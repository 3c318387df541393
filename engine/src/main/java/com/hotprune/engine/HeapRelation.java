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

/**
 * Table stored in heap pages. Pruning only needs the file the pages belong to, the fill factor that decides how much room is
 * kept free for updates, and whether the changes must be logged.
 */
public class HeapRelation {
  private final String  name;
  private final int     fileId;
  private final int     fillFactor;
  private final boolean logged;

  public HeapRelation(final String name, final int fileId) {
    this(name, fileId, GlobalConfiguration.PRUNE_FILL_FACTOR.getValueAsInteger(), true);
  }

  public HeapRelation(final String name, final int fileId, final int fillFactor, final boolean logged) {
    if (fillFactor < 10 || fillFactor > 100)
      throw new IllegalArgumentException("Invalid fill factor " + fillFactor + " for relation '" + name + "': must be between 10 and 100");
    this.name = name;
    this.fileId = fileId;
    this.fillFactor = fillFactor;
    this.logged = logged;
  }

  public String getName() {
    return name;
  }

  public int getFileId() {
    return fileId;
  }

  public int getFillFactor() {
    return fillFactor;
  }

  /**
   * Returns true if the changes to the pages of this relation must be written to the redo log.
   */
  public boolean needsRedo() {
    return logged;
  }

  /**
   * Free space in bytes that the fill factor reserves on a page of the given size.
   */
  public int getTargetFreeSpace(final int pageSize) {
    return pageSize * (100 - fillFactor) / 100;
  }

  @Override
  public String toString() {
    return name + "(" + fileId + ")";
  }
}
