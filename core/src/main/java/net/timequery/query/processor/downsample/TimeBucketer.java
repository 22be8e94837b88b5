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
package net.timequery.query.processor.downsample;

import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

/**
 * Computes {@code GROUP BY time(interval, offset)} bucket boundaries. The 
 * offset is normalized into {@code [0, interval)} so any two offsets that 
 * are congruent modulo the interval produce identical buckets. With a zone
 * the buckets align to local wall clock time and a bucket spanning a DST 
 * transition grows or shrinks by the change, as long as the change is 
 * smaller than the interval.
 * 
 * @since 3.0
 */
public class TimeBucketer {
  private final long interval;
  private final long offset;
  private final ZoneId zone;
  
  /**
   * @param interval The bucket width in nanoseconds.
   * @param offset The offset in nanoseconds, may be negative or larger 
   * than the interval.
   * @param zone An optional zone, null for UTC.
   * @throws IllegalArgumentException if the interval is not positive.
   */
  public TimeBucketer(final long interval, final long offset, final ZoneId zone) {
    if (interval <= 0) {
      throw new IllegalArgumentException("Interval must be greater than 0: " 
          + interval);
    }
    this.interval = interval;
    this.offset = normalize(offset, interval);
    this.zone = zone;
  }
  
  /**
   * @param offset An offset.
   * @param interval A positive interval.
   * @return The offset modulo the interval in {@code [0, interval)}.
   */
  public static long normalize(final long offset, final long interval) {
    return ((offset % interval) + interval) % interval;
  }
  
  public long interval() {
    return interval;
  }
  
  /** @return The normalized offset. */
  public long offset() {
    return offset;
  }
  
  public ZoneId zone() {
    return zone;
  }
  
  /**
   * @param timestamp A timestamp in nanoseconds.
   * @return The start of the bucket containing the timestamp.
   */
  public long start(final long timestamp) {
    final long t = timestamp - offset;
    final long zone_offset = zoneOffset(t);
    long start = Math.floorDiv(t + zone_offset, interval) * interval - zone_offset;
    if (zone != null) {
      // the zone may have shifted between the bucket start and t
      final long adjust = zone_offset - zoneOffset(start);
      if (adjust != 0 && Math.abs(adjust) < interval) {
        start += adjust;
      }
    }
    return start + offset;
  }
  
  /**
   * @param start A bucket start.
   * @return The start of the following bucket, i.e. the exclusive end.
   */
  public long next(final long start) {
    long end = start + interval;
    if (zone != null) {
      final long adjust = zoneOffset(start - offset) - zoneOffset(end - offset);
      if (adjust != 0 && Math.abs(adjust) < interval) {
        end += adjust;
      }
    }
    return end;
  }
  
  /**
   * @param start A bucket start.
   * @return The start of the preceding bucket.
   */
  public long previous(final long start) {
    return start(start - 1);
  }
  
  private long zoneOffset(final long timestamp) {
    if (zone == null) {
      return 0;
    }
    final Instant instant = Instant.ofEpochSecond(
        Math.floorDiv(timestamp, 1000000000L));
    return TimeUnit.SECONDS.toNanos(
        zone.getRules().getOffset(instant).getTotalSeconds());
  }
  
  @Override
  public String toString() {
    return "TimeBucketer{interval=" + interval + ", offset=" + offset 
        + ", zone=" + zone + "}";
  }
}
