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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import net.timequery.utils.DateTime;

public class TestTimeBucketer {
  private static final long S = DateTime.seconds(1);
  
  @Test
  public void ctor() {
    final TimeBucketer bucketer = new TimeBucketer(10 * S, 35 * S, null);
    assertEquals(10 * S, bucketer.interval());
    assertEquals(5 * S, bucketer.offset());
    
    try {
      new TimeBucketer(0, 0, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void normalize() {
    assertEquals(5, TimeBucketer.normalize(35, 10));
    assertEquals(5, TimeBucketer.normalize(-5, 10));
    assertEquals(5, TimeBucketer.normalize(5, 10));
    assertEquals(0, TimeBucketer.normalize(20, 10));
  }
  
  @Test
  public void start() {
    final TimeBucketer bucketer = new TimeBucketer(10 * S, 0, null);
    assertEquals(0, bucketer.start(0));
    assertEquals(0, bucketer.start(9 * S));
    assertEquals(10 * S, bucketer.start(10 * S));
    assertEquals(-10 * S, bucketer.start(-1));
    assertEquals(20 * S, bucketer.next(10 * S));
    assertEquals(0, bucketer.previous(10 * S));
  }
  
  @Test
  public void congruentOffsetsProduceIdenticalBuckets() {
    final long[] offsets = new long[] { 5 * S, 35 * S, -5 * S, -15 * S };
    for (long ts = -30 * S; ts < 60 * S; ts += 700000000L) {
      final long expected = new TimeBucketer(10 * S, offsets[0], null).start(ts);
      for (final long offset : offsets) {
        final TimeBucketer bucketer = new TimeBucketer(10 * S, offset, null);
        assertEquals(expected, bucketer.start(ts));
        assertEquals(expected + 10 * S, bucketer.next(expected));
      }
      assertEquals(5 * S, Math.floorMod(expected, 10 * S));
    }
  }
  
  @Test
  public void zoneAlignsToLocalMidnight() {
    final ZoneId zone = ZoneId.of("America/New_York");
    final TimeBucketer bucketer = new TimeBucketer(
        TimeUnit.DAYS.toNanos(1), 0, zone);
    final long noon = toNanos(ZonedDateTime.of(2020, 6, 15, 12, 0, 0, 0, zone));
    final long midnight = toNanos(ZonedDateTime.of(2020, 6, 15, 0, 0, 0, 0, zone));
    assertEquals(midnight, bucketer.start(noon));
    assertEquals(toNanos(ZonedDateTime.of(2020, 6, 16, 0, 0, 0, 0, zone)), 
        bucketer.next(midnight));
  }
  
  @Test
  public void zoneBucketAcrossDstIsShorter() {
    final ZoneId zone = ZoneId.of("America/New_York");
    final TimeBucketer bucketer = new TimeBucketer(
        TimeUnit.DAYS.toNanos(1), 0, zone);
    // 2020-03-08 springs forward, the local day is 23 hours
    final long start = toNanos(ZonedDateTime.of(2020, 3, 8, 0, 0, 0, 0, zone));
    final long end = toNanos(ZonedDateTime.of(2020, 3, 9, 0, 0, 0, 0, zone));
    assertEquals(start, bucketer.start(start + TimeUnit.HOURS.toNanos(12)));
    assertEquals(end, bucketer.next(start));
    assertEquals(TimeUnit.HOURS.toNanos(23), end - start);
  }
  
  private static long toNanos(final ZonedDateTime time) {
    return TimeUnit.SECONDS.toNanos(time.toEpochSecond());
  }
}
