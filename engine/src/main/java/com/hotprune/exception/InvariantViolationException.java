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
package com.hotprune.exception;

import com.hotprune.engine.PageId;

/**
 * A structural invariant of a page was found broken while pruning: an orphan heap-only tuple that is not dead, a redirect
 * without a heap-only target, a tombstone planned on a heap-only slot. The page cannot be trusted anymore, so this exception
 * always goes through the {@link com.hotprune.engine.FatalErrorHandler} before being thrown.
 */
public class InvariantViolationException extends HotPruneException {
  public InvariantViolationException(final String message) {
    super(ErrorCode.INVARIANT_VIOLATION, message);
  }

  public InvariantViolationException(final PageId pageId, final int slot, final String message) {
    super(ErrorCode.INVARIANT_VIOLATION, message);
    if (pageId != null)
      addContext("page", pageId.toString());
    if (slot > 0)
      addContext("slot", slot);
  }

  public InvariantViolationException(final String message, final Throwable cause) {
    super(ErrorCode.INVARIANT_VIOLATION, message, cause);
  }
}
