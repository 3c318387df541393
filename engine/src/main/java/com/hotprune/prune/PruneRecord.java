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

import com.hotprune.exception.ErrorCode;
import com.hotprune.exception.RedoLogException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Payload of the redo record written after a page has been pruned. Only slot numbers are logged, never tuple content:
 * <pre>
 * LATEST_REMOVED_XID (long) + N_REDIRECTED (ushort) + N_DEAD (ushort)
 *   + N_REDIRECTED x (FROM (ushort) + TO (ushort))
 *   + N_DEAD x SLOT (ushort)
 *   + remaining bytes / 2 x UNUSED SLOT (ushort)
 * </pre>
 */
public class PruneRecord {
  public static final int HEADER_SIZE = 8 + 2 + 2;

  private final long  latestRemovedXid;
  private final int[] redirected;
  private final int[] nowDead;
  private final int[] nowUnused;

  public PruneRecord(final long latestRemovedXid, final int[] redirected, final int[] nowDead, final int[] nowUnused) {
    if (redirected.length % 2 != 0)
      throw new IllegalArgumentException("Redirected slots must be pairs");
    this.latestRemovedXid = latestRemovedXid;
    this.redirected = redirected;
    this.nowDead = nowDead;
    this.nowUnused = nowUnused;
  }

  /**
   * Maximum size of the payload for a page holding up to {@code maxTuples} tuples.
   */
  public static int maxPayloadSize(final int maxTuples) {
    return HEADER_SIZE + (maxTuples * 2 + maxTuples + maxTuples) * 2;
  }

  /**
   * Writes the payload of the plan into {@code buffer}, which must be at least {@link #maxPayloadSize(int)} bytes long.
   *
   * @return the number of bytes written
   */
  public static int encode(final PrunePlan plan, final byte[] buffer) {
    final ByteBuffer out = ByteBuffer.wrap(buffer);
    out.putLong(plan.getLatestRemovedXid());
    out.putShort((short) plan.getRedirectedCount());
    out.putShort((short) plan.getDeadCount());

    final int[] redirected = plan.getRedirected();
    for (int i = 0; i < plan.getRedirectedCount() * 2; ++i)
      out.putShort((short) redirected[i]);

    final int[] nowDead = plan.getNowDead();
    for (int i = 0; i < plan.getDeadCount(); ++i)
      out.putShort((short) nowDead[i]);

    final int[] nowUnused = plan.getNowUnused();
    for (int i = 0; i < plan.getUnusedCount(); ++i)
      out.putShort((short) nowUnused[i]);

    return out.position();
  }

  public static PruneRecord decode(final byte[] payload) {
    if (payload.length < HEADER_SIZE || (payload.length - HEADER_SIZE) % 2 != 0)
      throw new RedoLogException(ErrorCode.SERIALIZATION_ERROR, "Invalid prune record payload of " + payload.length + " bytes");

    try {
      final ByteBuffer in = ByteBuffer.wrap(payload);
      final long latestRemovedXid = in.getLong();
      final int nRedirected = in.getShort() & 0xFFFF;
      final int nDead = in.getShort() & 0xFFFF;

      final int[] redirected = new int[nRedirected * 2];
      for (int i = 0; i < redirected.length; ++i)
        redirected[i] = in.getShort() & 0xFFFF;

      final int[] nowDead = new int[nDead];
      for (int i = 0; i < nDead; ++i)
        nowDead[i] = in.getShort() & 0xFFFF;

      // THE NUMBER OF UNUSED SLOTS IS NOT STORED: THEY TAKE THE REST OF THE PAYLOAD
      final int[] nowUnused = new int[in.remaining() / 2];
      for (int i = 0; i < nowUnused.length; ++i)
        nowUnused[i] = in.getShort() & 0xFFFF;

      return new PruneRecord(latestRemovedXid, redirected, nowDead, nowUnused);

    } catch (final BufferUnderflowException e) {
      throw new RedoLogException(ErrorCode.SERIALIZATION_ERROR,
          "Truncated prune record payload of " + payload.length + " bytes: the counters exceed the payload size");
    }
  }

  public long getLatestRemovedXid() {
    return latestRemovedXid;
  }

  public int[] getRedirected() {
    return redirected;
  }

  public int getRedirectedCount() {
    return redirected.length / 2;
  }

  public int[] getNowDead() {
    return nowDead;
  }

  public int[] getNowUnused() {
    return nowUnused;
  }

  @Override
  public String toString() {
    return "PruneRecord(latestRemovedXid=" + latestRemovedXid + " redirected=" + getRedirectedCount() + " dead=" + nowDead.length + " unused="
        + nowUnused.length + ")";
  }
}
