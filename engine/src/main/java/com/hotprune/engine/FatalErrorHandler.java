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

import com.hotprune.exception.HotPruneException;

/**
 * Receives the errors after which the process must not keep running: a page found in a state that breaks its structural
 * invariants while it is being modified.
 */
public interface FatalErrorHandler {
  void onFatalError(HotPruneException exception);

  /**
   * Notifies the handler and returns the exception, so the caller can write {@code throw handler.raise(e)}. When the handler
   * stops the process, the caller never gets control back.
   */
  default <E extends HotPruneException> E raise(final E exception) {
    onFatalError(exception);
    return exception;
  }
}
