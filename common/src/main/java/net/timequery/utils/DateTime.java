// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timequery.utils;

import java.util.concurrent.TimeUnit;

/**
 * Duration helpers. All engine times are epoch nanoseconds.
 */
public final class DateTime {
  private DateTime() { }
  
  /**
   * Parses a duration literal into nanoseconds. Supported suffixes are 
   * {@code ns}, {@code u} or {@code µ}, {@code ms}, {@code s}, {@code m}, 
   * {@code h}, {@code d} and {@code w}. Compound literals such as 
   * {@code 1h30m} are summed.
   * @param duration The non-null duration string.
   * @return The duration in nanoseconds, greater than zero.
   * @throws IllegalArgumentException if the string can't be parsed.
   */
  public static long parseDuration(final String duration) {
    if (duration == null || duration.isEmpty()) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long total = 0;
    int idx = 0;
    while (idx < duration.length()) {
      final int start = idx;
      while (idx < duration.length() && Character.isDigit(duration.charAt(idx))) {
        idx++;
      }
      if (start == idx) {
        throw new IllegalArgumentException("Invalid duration (number): " + duration);
      }
      final long interval;
      try {
        interval = Long.parseLong(duration.substring(start, idx));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid duration (number): " + duration, e);
      }
      final int unit_start = idx;
      while (idx < duration.length() && !Character.isDigit(duration.charAt(idx))) {
        idx++;
      }
      final String unit = duration.substring(unit_start, idx).toLowerCase();
      total += interval * unitNanos(unit, duration);
    }
    if (total <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " + duration);
    }
    return total;
  }
  
  private static long unitNanos(final String unit, final String duration) {
    switch (unit) {
    case "ns":
      return 1;
    case "u":
    case "µ":
    case "us":
      return TimeUnit.MICROSECONDS.toNanos(1);
    case "ms":
      return TimeUnit.MILLISECONDS.toNanos(1);
    case "s":
      return TimeUnit.SECONDS.toNanos(1);
    case "m":
      return TimeUnit.MINUTES.toNanos(1);
    case "h":
      return TimeUnit.HOURS.toNanos(1);
    case "d":
      return TimeUnit.DAYS.toNanos(1);
    case "w":
      return TimeUnit.DAYS.toNanos(7);
    default:
      throw new IllegalArgumentException("Invalid duration (suffix): " + duration);
    }
  }
  
  /** @return Seconds converted to nanoseconds. */
  public static long seconds(final long seconds) {
    return TimeUnit.SECONDS.toNanos(seconds);
  }
}
