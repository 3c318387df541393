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

import com.hotprune.exception.ConfigurationException;
import com.hotprune.exception.RedoLogException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.RandomAccessFile;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RedoLogFileTest {
  private static final int RECORD_OVERHEAD = 8 + 1 + 4 + 4 + 4 + 8;

  @TempDir
  File tempDir;

  private File        file;
  private RedoLogFile redoLog;

  @BeforeEach
  public void openLog() throws Exception {
    file = new File(tempDir, "prune.redo");
    redoLog = new RedoLogFile(file.getAbsolutePath(), RedoLogFile.FLUSH_TYPE.NO);
  }

  @AfterEach
  public void closeLog() throws Exception {
    if (redoLog.isOpen())
      redoLog.close();
  }

  @Test
  public void lsnIsTheEndOfTheRecord() throws Exception {
    final long first = append(new PageId(1, 0), new byte[] { 1, 2, 3 });
    final long second = append(new PageId(1, 5), new byte[10]);

    assertThat(first).isEqualTo(RECORD_OVERHEAD + 3);
    assertThat(second).isEqualTo(first + RECORD_OVERHEAD + 10);
    assertThat(redoLog.getSize()).isEqualTo(second);
    assertThat(redoLog.getStats()).containsEntry("recordsWritten", 2L);
  }

  @Test
  public void recordsAreReadBack() {
    append(new PageId(1, 0), new byte[] { 1, 2, 3 });
    append(new PageId(2, 7), new byte[] { 9 });

    final List<RedoRecord> records = redoLog.readRecords();

    assertThat(records).hasSize(2);
    assertThat(records.get(0).getType()).isEqualTo(RedoLog.RECORD_PRUNE);
    assertThat(records.get(0).getPageId()).isEqualTo(new PageId(1, 0));
    assertThat(records.get(0).getPayload()).containsExactly(1, 2, 3);
    assertThat(records.get(0).getStartPosition()).isZero();
    assertThat(records.get(1).getPageId()).isEqualTo(new PageId(2, 7));
    assertThat(records.get(1).getStartPosition()).isEqualTo(records.get(0).getLsn());
    assertThat(redoLog.getFirstRecord().getLsn()).isEqualTo(records.get(0).getLsn());
  }

  @Test
  public void truncatedTailIsIgnored() throws Exception {
    append(new PageId(1, 0), new byte[] { 1, 2, 3 });
    final long end = append(new PageId(1, 1), new byte[20]);
    redoLog.close();

    try (final RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
      raf.setLength(end - 5);
    }

    redoLog = new RedoLogFile(file.getAbsolutePath(), RedoLogFile.FLUSH_TYPE.NO);
    assertThat(redoLog.readRecords()).hasSize(1);
  }

  @Test
  public void corruptedRecordStopsTheScan() throws Exception {
    final long first = append(new PageId(1, 0), new byte[] { 1, 2, 3 });
    append(new PageId(1, 1), new byte[4]);
    redoLog.close();

    // OVERWRITE THE MAGIC NUMBER OF THE FIRST RECORD
    try (final RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
      raf.seek(first - 8);
      raf.writeLong(0);
    }

    redoLog = new RedoLogFile(file.getAbsolutePath(), RedoLogFile.FLUSH_TYPE.NO);
    assertThat(redoLog.readRecords()).isEmpty();
  }

  @Test
  public void noWritesDuringRecovery() {
    redoLog.setRecoveryInProgress(true);

    assertThatThrownBy(() -> redoLog.beginRecord(RedoLog.RECORD_PRUNE)).isInstanceOf(RedoLogException.class);
  }

  @Test
  public void recordNeedsOnePage() {
    final RedoRecordBuilder builder = redoLog.beginRecord(RedoLog.RECORD_PRUNE);
    assertThatThrownBy(builder::insert).isInstanceOf(IllegalStateException.class);

    builder.registerPage(new PageId(1, 0));
    assertThatThrownBy(() -> builder.registerPage(new PageId(1, 1))).isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void closedLogRejectsWrites() throws Exception {
    redoLog.close();

    assertThatThrownBy(() -> append(new PageId(1, 0), new byte[1])).isInstanceOf(RedoLogException.class);
  }

  @Test
  public void flushTypeFromSetting() {
    assertThat(RedoLogFile.getFlushType(0)).isEqualTo(RedoLogFile.FLUSH_TYPE.NO);
    assertThat(RedoLogFile.getFlushType(1)).isEqualTo(RedoLogFile.FLUSH_TYPE.YES_NOMETADATA);
    assertThat(RedoLogFile.getFlushType(2)).isEqualTo(RedoLogFile.FLUSH_TYPE.YES_FULL);
    assertThatThrownBy(() -> RedoLogFile.getFlushType(5)).isInstanceOf(ConfigurationException.class);
  }

  private long append(final PageId pageId, final byte[] payload) {
    return redoLog.beginRecord(RedoLog.RECORD_PRUNE).registerPage(pageId).registerPayload(payload, payload.length).insert();
  }
}
