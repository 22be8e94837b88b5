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
package net.timequery.data;

/**
 * An inclusive nanosecond time range. {@link Long#MIN_VALUE} and 
 * {@link Long#MAX_VALUE} mark an open bound.
 * 
 * @since 3.0
 */
public final class TimeRange {
  
  public static final TimeRange UNBOUNDED = 
      new TimeRange(Long.MIN_VALUE, Long.MAX_VALUE);
  
  private final long start;
  private final long end;
  
  public TimeRange(final long start, final long end) {
    if (end < start) {
      throw new IllegalArgumentException("End time " + end 
          + " cannot be before the start time " + start);
    }
    this.start = start;
    this.end = end;
  }
  
  /** @return The inclusive start. */
  public long start() {
    return start;
  }
  
  /** @return The inclusive end. */
  public long end() {
    return end;
  }
  
  public boolean hasStart() {
    return start != Long.MIN_VALUE;
  }
  
  public boolean hasEnd() {
    return end != Long.MAX_VALUE;
  }
  
  public boolean contains(final long timestamp) {
    return timestamp >= start && timestamp <= end;
  }
  
  public boolean overlaps(final TimeRange other) {
    return start <= other.end && other.start <= end;
  }
  
  /**
   * @param other Another range.
   * @return The overlap of both ranges or null if they don't overlap.
   */
  public TimeRange intersect(final TimeRange other) {
    final long s = Math.max(start, other.start);
    final long e = Math.min(end, other.end);
    if (e < s) {
      return null;
    }
    return new TimeRange(s, e);
  }
  
  /** @return A copy with a new start. */
  public TimeRange withStart(final long start) {
    return new TimeRange(start, Math.max(start, end));
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeRange)) {
      return false;
    }
    return start == ((TimeRange) o).start && end == ((TimeRange) o).end;
  }
  
  @Override
  public int hashCode() {
    return Long.hashCode(start) * 31 + Long.hashCode(end);
  }
  
  @Override
  public String toString() {
    return "[" + (hasStart() ? String.valueOf(start) : "-inf") + ", " 
        + (hasEnd() ? String.valueOf(end) : "+inf") + "]";
  }
}
