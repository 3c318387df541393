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
package com.hotprune.utility;

import com.hotprune.exception.HotPruneException;

import java.util.concurrent.Callable;
import java.util.concurrent.locks.*;

public class RWLockContext {
  private final ReentrantReadWriteLock lock;

  public RWLockContext() {
    this(true);
  }

  public RWLockContext(final boolean fair) {
    this.lock = new ReentrantReadWriteLock(fair);
  }

  protected ReentrantReadWriteLock.ReadLock readLock() {
    final ReentrantReadWriteLock.ReadLock rl = lock.readLock();
    rl.lock();
    return rl;
  }

  protected void readUnlock(final ReentrantReadWriteLock.ReadLock rl) {
    if (rl != null)
      rl.unlock();
  }

  protected ReentrantReadWriteLock.WriteLock writeLock() {
    final ReentrantReadWriteLock.WriteLock wl = lock.writeLock();
    wl.lock();
    return wl;
  }

  /**
   * Acquires the exclusive lock only if it is free at the time of the call.
   *
   * @return the acquired lock or null if it is held by another thread
   */
  protected ReentrantReadWriteLock.WriteLock tryWriteLock() {
    final ReentrantReadWriteLock.WriteLock wl = lock.writeLock();
    return wl.tryLock() ? wl : null;
  }

  protected void writeUnlock(final ReentrantReadWriteLock.WriteLock wl) {
    if (wl != null)
      wl.unlock();
  }

  protected boolean isWriteLockedByCurrentThread() {
    return lock.isWriteLockedByCurrentThread();
  }

  /**
   * Executes a callback in a shared lock.
   */
  public <RET> RET executeInReadLock(final Callable<RET> callable) {
    final ReentrantReadWriteLock.ReadLock rl = readLock();
    try {

      return callable.call();

    } catch (final RuntimeException e) {
      throw e;

    } catch (final Throwable e) {
      throw new HotPruneException("Error in execution in lock", e);

    } finally {
      readUnlock(rl);
    }
  }

  /**
   * Executes a callback in an exclusive lock.
   */
  public <RET> RET executeInWriteLock(final Callable<RET> callable) {
    final ReentrantReadWriteLock.WriteLock wl = writeLock();
    try {

      return callable.call();

    } catch (final RuntimeException e) {
      throw e;

    } catch (final Throwable e) {
      throw new HotPruneException("Error in execution in lock", e);

    } finally {
      writeUnlock(wl);
    }
  }
}
