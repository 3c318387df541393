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
import com.hotprune.engine.PageId;
import com.hotprune.engine.RedoLog;
import com.hotprune.engine.RedoLogFile;
import com.hotprune.engine.RedoRecord;
import com.hotprune.exception.ErrorCode;
import com.hotprune.exception.RedoLogException;
import com.hotprune.log.LogManager;

import java.util.function.Function;
import java.util.logging.Level;

/**
 * Replays prune records on page images. The slots to change are taken from the record as they are: visibility is not computed
 * again, and the prune hint of the page is left untouched.
 */
public class PruneRedoReplayer {
  private final PageMutator mutator;

  public PruneRedoReplayer(final PageMutator mutator) {
    this.mutator = mutator;
  }

  /**
   * Applies the record to the page unless the page already contains it.
   *
   * @return true if the record has been applied, false if the page LSN shows it was already there
   */
  public boolean replay(final HeapPage page, final RedoRecord record) {
    if (record.getType() != RedoLog.RECORD_PRUNE)
      throw new RedoLogException(ErrorCode.WAL_ERROR, "Unexpected redo record type " + record.getType() + " at lsn " + record.getLsn());

    if (!record.getPageId().equals(page.getPageId()))
      throw new RedoLogException(ErrorCode.WAL_ERROR,
          "Redo record at lsn " + record.getLsn() + " is for page " + record.getPageId() + ", not " + page.getPageId());

    if (page.getLsn() >= record.getLsn())
      return false;

    final PruneRecord prune = PruneRecord.decode(record.getPayload());
    final int[] nowDead = prune.getNowDead();
    final int[] nowUnused = prune.getNowUnused();

    mutator.execute(page, prune.getRedirected(), prune.getRedirectedCount(), nowDead, nowDead.length, nowUnused, nowUnused.length);
    page.setLsn(record.getLsn());
    return true;
  }

  /**
   * Replays all the prune records of the log. The log is flagged in recovery for the duration of the replay.
   *
   * @param pages returns the page image for a page id, or null if the page is not available anymore
   *
   * @return the number of records applied
   */
  public int replayAll(final RedoLogFile redoLog, final Function<PageId, HeapPage> pages) {
    int applied = 0;
    redoLog.setRecoveryInProgress(true);
    try {
      for (final RedoRecord record : redoLog.readRecords()) {
        if (record.getType() != RedoLog.RECORD_PRUNE)
          continue;

        final HeapPage page = pages.apply(record.getPageId());
        if (page == null) {
          LogManager.instance().log(this, Level.WARNING, "Page %s not found, skip redo record at lsn %d", record.getPageId(), record.getLsn());
          continue;
        }

        if (replay(page, record))
          ++applied;
      }
    } finally {
      redoLog.setRecoveryInProgress(false);
    }

    LogManager.instance().log(this, Level.INFO, "Replayed %d prune records from %s", applied, redoLog);
    return applied;
  }
}
