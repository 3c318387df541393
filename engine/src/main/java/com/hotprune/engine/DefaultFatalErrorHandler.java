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
import com.hotprune.exception.HotPruneException;
import com.hotprune.log.LogManager;

import java.util.logging.Level;

/**
 * Logs the error with its context and halts the JVM, unless {@link GlobalConfiguration#FATAL_HALT} is disabled. Halting skips the
 * shutdown hooks: nothing else must be written after a page was found broken in the middle of a change.
 */
public class DefaultFatalErrorHandler implements FatalErrorHandler {
  public static final DefaultFatalErrorHandler INSTANCE = new DefaultFatalErrorHandler();

  @Override
  public void onFatalError(final HotPruneException exception) {
    LogManager.instance().log(this, Level.SEVERE, "Fatal error: %s %s", exception, exception.toString(), exception.getContext());
    LogManager.instance().flush();

    if (GlobalConfiguration.FATAL_HALT.getValueAsBoolean())
      Runtime.getRuntime().halt(GlobalConfiguration.FATAL_EXIT_CODE.getValueAsInteger());
  }
}
