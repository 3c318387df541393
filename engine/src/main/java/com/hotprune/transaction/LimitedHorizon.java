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
package com.hotprune.transaction;

/**
 * Horizon lowered by the old snapshot protection: transactions older than the threshold are not considered when computing it, so
 * versions they could still see may be removed.
 */
public class LimitedHorizon {
  private final long xmin;
  private final long timestamp;

  public LimitedHorizon(final long xmin, final long timestamp) {
    this.xmin = xmin;
    this.timestamp = timestamp;
  }

  /**
   * Versions deleted by transactions older than this id can be removed.
   */
  public long getXmin() {
    return xmin;
  }

  /**
   * Time the horizon was computed at. Snapshots taken before it may find removed versions missing.
   */
  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "LimitedHorizon(xmin=" + xmin + " timestamp=" + timestamp + ")";
  }
}
