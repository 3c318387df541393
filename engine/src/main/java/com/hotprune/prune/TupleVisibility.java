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

/**
 * Visibility of a tuple with respect to the transactions that are running or may start in the future.
 */
public enum TupleVisibility {
  /** Visible, or may be visible, to somebody. */
  LIVE,
  /** Invisible to everybody: the space can be reclaimed. */
  DEAD,
  /** Deleted, but some running transaction may still see it. */
  RECENTLY_DEAD,
  /** Inserted by a transaction that is still running. */
  INSERT_IN_PROGRESS,
  /** Deleted by a transaction that is still running. */
  DELETE_IN_PROGRESS
}
