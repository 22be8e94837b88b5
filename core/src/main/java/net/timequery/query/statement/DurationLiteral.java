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
package net.timequery.query.statement;

import net.timequery.data.Value;
import net.timequery.utils.DateTime;

/**
 * A duration constant such as {@code 10s}, stored in nanoseconds. Used for
 * the unit arguments of derivative and elapsed.
 * 
 * @since 3.0
 */
public class DurationLiteral extends Literal {
  private static final long[] UNITS = { 
      DateTime.seconds(7 * 86400), DateTime.seconds(86400), 
      DateTime.seconds(3600), DateTime.seconds(60), DateTime.seconds(1), 
      1000000L, 1000L, 1L };
  private static final String[] SUFFIXES = { 
      "w", "d", "h", "m", "s", "ms", "u", "ns" };
  
  private final long nanos;
  
  public DurationLiteral(final long nanos) {
    this.nanos = nanos;
  }
  
  /**
   * @param duration A duration literal like "1h30m".
   * @return The parsed literal.
   */
  public static DurationLiteral parse(final String duration) {
    return new DurationLiteral(DateTime.parseDuration(duration));
  }
  
  public long nanos() {
    return nanos;
  }
  
  @Override
  public Value toValue() {
    return Value.ofLong(nanos);
  }
  
  @Override
  public String toString() {
    if (nanos == 0) {
      return "0s";
    }
    for (int i = 0; i < UNITS.length; i++) {
      if (nanos % UNITS[i] == 0) {
        return (nanos / UNITS[i]) + SUFFIXES[i];
      }
    }
    return nanos + "ns";
  }
}
