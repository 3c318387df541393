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
package com.hotprune.log;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.IllegalFormatException;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Single line console formatter: timestamp, level, simple name of the requester and the message.
 */
public class LogFormatter extends Formatter {
  protected static final String           EOL        = System.lineSeparator();
  protected final        SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS");

  @Override
  public String format(final LogRecord record) {
    final StringBuilder buffer = new StringBuilder(256);

    synchronized (dateFormat) {
      buffer.append(dateFormat.format(new Date(record.getMillis())));
    }

    buffer.append(String.format(" %-7.7s ", record.getLevel().getName()));

    final String requester = getSourceClassSimpleName(record.getLoggerName());
    if (requester != null) {
      buffer.append('[');
      buffer.append(requester);
      buffer.append("] ");
    }

    final Object[] parameters = record.getParameters();
    try {
      if (parameters != null)
        buffer.append(String.format(record.getMessage(), parameters));
      else
        buffer.append(record.getMessage());
    } catch (final IllegalFormatException ignore) {
      buffer.append(record.getMessage());
    }

    buffer.append(EOL);

    if (record.getThrown() != null) {
      final StringWriter writer = new StringWriter();
      record.getThrown().printStackTrace(new PrintWriter(writer));
      buffer.append(writer);
    }

    return buffer.toString();
  }

  protected String getSourceClassSimpleName(final String loggerName) {
    if (loggerName == null)
      return null;
    return loggerName.substring(loggerName.lastIndexOf('.') + 1);
  }
}
