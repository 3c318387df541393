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
 * Record read back from the redo log.
 */
public class RedoRecord {
  private final long   lsn;
  private final byte   type;
  private final PageId pageId;
  private final byte[] payload;
  private final long   startPosition;

  public RedoRecord(final long lsn, final byte type, final PageId pageId, final byte[] payload, final long startPosition) {
    this.lsn = lsn;
    this.type = type;
    this.pageId = pageId;
    this.payload = payload;
    this.startPosition = startPosition;
  }

  public long getLsn() {
    return lsn;
  }

  public byte getType() {
    return type;
  }

  public PageId getPageId() {
    return pageId;
  }

  public byte[] getPayload() {
    return payload;
  }

  public long getStartPosition() {
    return startPosition;
  }

  @Override
  public String toString() {
    return "RedoRecord(lsn=" + lsn + " type=" + type + " page=" + pageId + " payload=" + payload.length + ")";
  }
}
