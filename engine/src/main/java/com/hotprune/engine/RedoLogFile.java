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
import com.hotprune.exception.ConfigurationException;
import com.hotprune.exception.RedoLogException;
import com.hotprune.log.LogManager;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Append-only redo log file. Every record has the layout:
 * <pre>
 * LSN (long) + TYPE (byte) + FILE_ID (int) + PAGE_NUMBER (int) + PAYLOAD_SIZE (int) + PAYLOAD (bytes) + MAGIC_NUMBER (long)
 * </pre>
 * The LSN of a record is the position in the file right after its last byte, so LSNs grow with the file.
 */
public class RedoLogFile implements RedoLog {
  public enum FLUSH_TYPE {
    NO, YES_NOMETADATA, YES_FULL
  }

  private static final int RECORD_HEADER_SIZE = 8 + 1 + 4 + 4 + 4;
  private static final int RECORD_FOOTER_SIZE = 8;

  public static final long MAGIC_NUMBER = 9371515385058702L;

  private final    String      filePath;
  private final    FileChannel channel;
  private final    FLUSH_TYPE  flushType;
  private volatile boolean     open;
  private volatile boolean     recoveryInProgress;

  private long statsRecordsWritten = 0;
  private long statsBytesWritten   = 0;

  // STATIC BUFFERS USED FOR RECOVERY
  private final ByteBuffer bufferLong = ByteBuffer.allocate(8);
  private final ByteBuffer bufferInt  = ByteBuffer.allocate(4);
  private final ByteBuffer bufferByte = ByteBuffer.allocate(1);

  public RedoLogFile(final String filePath) throws FileNotFoundException {
    this(filePath, getFlushType(GlobalConfiguration.REDO_FLUSH.getValueAsInteger()));
  }

  public RedoLogFile(final String filePath, final FLUSH_TYPE flushType) throws FileNotFoundException {
    this.filePath = filePath;
    this.flushType = flushType;
    this.channel = new RandomAccessFile(filePath, "rw").getChannel();
    this.open = true;
  }

  @Override
  public RedoRecordBuilder beginRecord(final byte type) {
    if (recoveryInProgress)
      throw new RedoLogException("Cannot write to redo log " + filePath + " while recovery is in progress");
    return new Builder(type);
  }

  @Override
  public boolean isRecoveryInProgress() {
    return recoveryInProgress;
  }

  public void setRecoveryInProgress(final boolean recoveryInProgress) {
    this.recoveryInProgress = recoveryInProgress;
  }

  public synchronized void close() throws IOException {
    this.open = false;
    channel.close();
  }

  public synchronized void drop() throws IOException {
    close();
    if (!new File(filePath).delete())
      LogManager.instance().log(this, Level.WARNING, "Cannot delete redo log file %s", filePath);
  }

  public RedoRecord getFirstRecord() {
    return getRecord(0);
  }

  /**
   * Reads the record starting at the given position.
   *
   * @return the record, or null if the file ends before the record is complete or the record is corrupted
   */
  public synchronized RedoRecord getRecord(long pos) {
    final long startPosition = pos;
    try {
      final long size = getSize();
      if (pos + RECORD_HEADER_SIZE + RECORD_FOOTER_SIZE > size)
        // TRUNCATED FILE
        return null;

      final long lsn = readLong(pos);
      pos += 8;

      final byte type = readByte(pos);
      pos += 1;

      final int fileId = readInt(pos);
      pos += 4;

      final int pageNumber = readInt(pos);
      pos += 4;

      final int payloadSize = readInt(pos);
      pos += 4;

      if (payloadSize < 0 || pos + payloadSize + RECORD_FOOTER_SIZE > size)
        // TRUNCATED FILE
        return null;

      final ByteBuffer payload = ByteBuffer.allocate(payloadSize);
      while (payload.hasRemaining())
        if (channel.read(payload, pos + payload.position()) < 0)
          return null;
      pos += payloadSize;

      final long mn = readLong(pos);
      pos += 8;

      if (mn != MAGIC_NUMBER || lsn != pos)
        // INVALID
        return null;

      return new RedoRecord(lsn, type, new PageId(fileId, pageNumber), payload.array(), startPosition);

    } catch (final IOException | IllegalArgumentException e) {
      LogManager.instance().log(this, Level.WARNING, "Error on reading redo record at position %d of file %s", e, startPosition, filePath);
      return null;
    }
  }

  /**
   * Reads all the records from the beginning of the file, stopping at the first truncated or corrupted one.
   */
  public List<RedoRecord> readRecords() {
    final List<RedoRecord> records = new ArrayList<>();
    long pos = 0;
    RedoRecord record;
    while ((record = getRecord(pos)) != null) {
      records.add(record);
      pos = record.getLsn();
    }
    return records;
  }

  public long getSize() throws IOException {
    return channel.size();
  }

  public boolean isOpen() {
    return open;
  }

  public String getFilePath() {
    return filePath;
  }

  public FLUSH_TYPE getFlushType() {
    return flushType;
  }

  public synchronized Map<String, Object> getStats() {
    final Map<String, Object> map = new HashMap<>();
    map.put("recordsWritten", statsRecordsWritten);
    map.put("bytesWritten", statsBytesWritten);
    return map;
  }

  @Override
  public String toString() {
    return filePath;
  }

  public static FLUSH_TYPE getFlushType(final int flushType) {
    switch (flushType) {
    case 0:
      return FLUSH_TYPE.NO;
    case 1:
      return FLUSH_TYPE.YES_NOMETADATA;
    case 2:
      return FLUSH_TYPE.YES_FULL;
    default:
      throw new ConfigurationException("Invalid redo flush setting " + flushType);
    }
  }

  private synchronized long append(final byte type, final PageId pageId, final byte[] payload, final int payloadLength) {
    if (!open)
      throw new RedoLogException("Redo log " + filePath + " is closed");

    try {
      final long position = channel.size();
      final int recordSize = RECORD_HEADER_SIZE + payloadLength + RECORD_FOOTER_SIZE;
      final long lsn = position + recordSize;

      final ByteBuffer buffer = ByteBuffer.allocate(recordSize);
      buffer.putLong(lsn);
      buffer.put(type);
      buffer.putInt(pageId.getFileId());
      buffer.putInt(pageId.getPageNumber());
      buffer.putInt(payloadLength);
      buffer.put(payload, 0, payloadLength);
      buffer.putLong(MAGIC_NUMBER);

      assert buffer.position() == recordSize;

      buffer.flip();
      long writePos = position;
      while (buffer.hasRemaining())
        writePos += channel.write(buffer, writePos);

      if (flushType == FLUSH_TYPE.YES_NOMETADATA)
        channel.force(false);
      else if (flushType == FLUSH_TYPE.YES_FULL)
        channel.force(true);

      statsRecordsWritten++;
      statsBytesWritten += recordSize;

      LogManager.instance().log(this, Level.FINE, "Appended redo record type=%d page=%s lsn=%d (size=%d file=%s)", type, pageId, lsn, recordSize, filePath);

      return lsn;

    } catch (final IOException e) {
      throw new RedoLogException("Error on writing to redo log file " + filePath, e);
    }
  }

  private long readLong(final long pos) throws IOException {
    bufferLong.rewind();
    channel.read(bufferLong, pos);
    return bufferLong.getLong(0);
  }

  private int readInt(final long pos) throws IOException {
    bufferInt.rewind();
    channel.read(bufferInt, pos);
    return bufferInt.getInt(0);
  }

  private byte readByte(final long pos) throws IOException {
    bufferByte.rewind();
    channel.read(bufferByte, pos);
    return bufferByte.get(0);
  }

  private class Builder implements RedoRecordBuilder {
    private final byte   type;
    private       PageId pageId;
    private       byte[] payload       = new byte[0];
    private       int    payloadLength = 0;

    private Builder(final byte type) {
      this.type = type;
    }

    @Override
    public RedoRecordBuilder registerPage(final PageId pageId) {
      if (this.pageId != null)
        throw new IllegalStateException("A redo record can register only one page");
      this.pageId = pageId;
      return this;
    }

    @Override
    public RedoRecordBuilder registerPayload(final byte[] payload, final int length) {
      if (length < 0 || length > payload.length)
        throw new IllegalArgumentException("Invalid payload length " + length);
      this.payload = payload;
      this.payloadLength = length;
      return this;
    }

    @Override
    public long insert() {
      if (pageId == null)
        throw new IllegalStateException("No page registered in the redo record");
      return append(type, pageId, payload, payloadLength);
    }
  }
}
