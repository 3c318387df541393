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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes. Error codes are organized in categories based on the thousands digit:
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>2xxx - Transaction and horizon oracle errors</li>
 *   <li>5xxx - Storage errors (page images, redo log)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see HotPruneException
 */
public enum ErrorCode {

  // ========== Configuration Errors (1xxx) ==========
  /** Invalid configuration value */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  // ========== Transaction Errors (2xxx) ==========
  /** Unknown transaction id or illegal state transition */
  TRANSACTION_ERROR(2001, "Transaction error"),

  /** Cleanup lock could not be obtained */
  LOCK_TIMEOUT(2002, "Lock acquisition timeout"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Page image contains an inconsistent structure */
  CORRUPTION_DETECTED(5002, "Data corruption detected"),

  /** Redo log operation failed */
  WAL_ERROR(5003, "Redo log error"),

  /** Redo payload could not be encoded or decoded */
  SERIALIZATION_ERROR(5004, "Serialization error"),

  /** Page has no room for another tuple */
  PAGE_FULL(5005, "Page is full"),

  // ========== General Errors (99xxx) ==========
  /** A structural invariant of a page was violated while pruning */
  INVARIANT_VIOLATION(99001, "Invariant violation"),

  /** Unclassified error */
  UNKNOWN_ERROR(99998, "Unknown error"),

  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    return switch (code / 1000) {
      case 1 -> ErrorCategory.CONFIGURATION;
      case 2 -> ErrorCategory.TRANSACTION;
      case 5 -> ErrorCategory.STORAGE;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
