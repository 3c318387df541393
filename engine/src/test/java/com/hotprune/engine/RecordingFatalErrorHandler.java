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

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the fatal errors instead of halting the JVM.
 */
public class RecordingFatalErrorHandler implements FatalErrorHandler {
  private final List<HotPruneException> errors = new ArrayList<>();

  @Override
  public void onFatalError(final HotPruneException exception) {
    errors.add(exception);
  }

  public List<HotPruneException> getErrors() {
    return errors;
  }

  public HotPruneException getLastError() {
    return errors.isEmpty() ? null : errors.get(errors.size() - 1);
  }
}
