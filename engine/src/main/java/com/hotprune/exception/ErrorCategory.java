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

/**
 * Categories for organizing error codes in the exception hierarchy. Each {@link ErrorCode} belongs to exactly one category, derived
 * from the thousands digit of its numeric code.
 *
 * @see ErrorCode
 * @see HotPruneException
 */
public enum ErrorCategory {
  CONFIGURATION("Configuration"),
  TRANSACTION("Transaction"),
  STORAGE("Storage"),
  INTERNAL("Internal");

  private final String displayName;

  ErrorCategory(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the human-readable display name for this category, as used in messages and JSON output.
   */
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
