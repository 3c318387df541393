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

import com.hotprune.exception.InternalException;
import com.hotprune.utility.RWLockContext;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Frame of the page cache holding one {@link HeapPage}. Callers pin the frame before touching the page and take the content lock
 * to read or modify it. The cleanup lock is the exclusive content lock taken while the caller's pin is the only one: nobody else
 * can be in the middle of following a line pointer of the page while it is held.
 */
public class PageBuffer extends RWLockContext {
  private final    HeapPage                         page;
  private final    AtomicInteger                    pinCount   = new AtomicInteger();
  private final    Object                           pinMonitor = new Object();
  private          ReentrantReadWriteLock.WriteLock cleanupLock;
  private volatile boolean                          dirty;
  private volatile boolean                          dirtyHint;

  public PageBuffer(final HeapPage page) {
    this.page = page;
  }

  public HeapPage getPage() {
    return page;
  }

  public PageId getPageId() {
    return page.getPageId();
  }

  public void pin() {
    pinCount.incrementAndGet();
  }

  public void unpin() {
    final int pins = pinCount.decrementAndGet();
    if (pins < 0) {
      pinCount.incrementAndGet();
      throw new IllegalStateException("Buffer " + page.getPageId() + " is not pinned");
    }

    if (pins <= 1)
      synchronized (pinMonitor) {
        pinMonitor.notifyAll();
      }
  }

  public int getPinCount() {
    return pinCount.get();
  }

  /**
   * Tries to acquire the cleanup lock without waiting. The caller must hold a pin on the buffer.
   *
   * @return true if the lock has been acquired, false if the content lock is busy or another pin exists
   */
  public boolean tryLockForCleanup() {
    checkPinned();
    if (pinCount.get() != 1)
      return false;

    final ReentrantReadWriteLock.WriteLock wl = tryWriteLock();
    if (wl == null)
      return false;

    if (pinCount.get() != 1) {
      writeUnlock(wl);
      return false;
    }

    cleanupLock = wl;
    return true;
  }

  /**
   * Acquires the cleanup lock, waiting until every other pin has been released. The caller must hold a pin on the buffer.
   */
  public void lockForCleanup() {
    checkPinned();
    while (true) {
      final ReentrantReadWriteLock.WriteLock wl = writeLock();
      if (pinCount.get() == 1) {
        cleanupLock = wl;
        return;
      }
      writeUnlock(wl);

      synchronized (pinMonitor) {
        while (pinCount.get() > 1)
          try {
            pinMonitor.wait();
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalException("Interrupted while waiting for the cleanup lock on " + page.getPageId(), e);
          }
      }
    }
  }

  public void unlockCleanup() {
    final ReentrantReadWriteLock.WriteLock wl = cleanupLock;
    if (wl == null || !isWriteLockedByCurrentThread())
      throw new IllegalStateException("Cleanup lock on " + page.getPageId() + " is not held by the current thread");
    cleanupLock = null;
    writeUnlock(wl);
  }

  public boolean isCleanupLockedByCurrentThread() {
    return cleanupLock != null && isWriteLockedByCurrentThread();
  }

  /**
   * Marks the page as modified by a change covered by a redo record.
   */
  public void markDirty() {
    dirty = true;
  }

  /**
   * Marks the page as modified by a change that is not logged (hint bits). Losing it on a crash is harmless.
   */
  public void markDirtyHint() {
    dirtyHint = true;
  }

  public boolean isDirty() {
    return dirty;
  }

  public boolean isDirtyHint() {
    return dirtyHint;
  }

  public void clearDirty() {
    dirty = false;
    dirtyHint = false;
  }

  @Override
  public String toString() {
    return "PageBuffer(" + page.getPageId() + " pins=" + pinCount.get() + (dirty ? " dirty" : dirtyHint ? " dirtyHint" : "") + ")";
  }

  private void checkPinned() {
    if (pinCount.get() < 1)
      throw new IllegalStateException("Buffer " + page.getPageId() + " must be pinned before locking it");
  }
}
