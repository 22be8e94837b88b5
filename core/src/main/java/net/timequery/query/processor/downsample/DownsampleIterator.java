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

import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.TimeRange;
import net.timequery.data.aggregators.Reducer;
import net.timequery.data.iterators.PeekingPointIterator;
import net.timequery.exceptions.LimitExceededException;
import net.timequery.query.QueryContext;

/**
 * Reduces an ascending point stream into time buckets following these 
 * rules:
 * <ul>
 * <li>With an explicit start, the first bucket is the one containing the 
 * start, moved back by the configured number of look-back buckets. 
 * Without one it's the bucket of the first point.</li>
 * <li>With an explicit end, every bucket up to the one containing the end
 * is emitted, empty or not. Without one, iteration stops after the last 
 * bucket that received a point.</li>
 * <li>Without a bucketer the whole stream is one bucket stamped with the 
 * range start, or epoch zero for an open range. An empty stream emits 
 * nothing.</li>
 * <li>Derived values carry the bucket start. Selected points are 
 * re-stamped with the bucket start too unless {@code keep_point_time} is 
 * set.</li>
 * </ul>
 * The number of buckets is bounded by the context's max select buckets.
 * 
 * @since 3.0
 */
public class DownsampleIterator implements CloseableIterator<Bucket> {
  private static final Logger LOG = LoggerFactory.getLogger(
      DownsampleIterator.class);
  
  private final PeekingPointIterator source;
  private final Reducer reducer;
  private final TimeBucketer bucketer;
  private final TimeRange range;
  private final int lookback;
  private final boolean keep_point_time;
  private final QueryContext context;
  
  private boolean initialized;
  private boolean done;
  private long current;
  private long last = Long.MAX_VALUE;
  private boolean implicit_end;
  private long buckets;
  private Bucket next;
  
  /**
   * Default ctor.
   * @param source A non-null ascending source.
   * @param reducer A non-null reducer.
   * @param bucketer The bucketer, null for a single whole-range bucket.
   * @param range The query time range.
   * @param lookback Extra buckets to emit ahead of the range start.
   * @param keep_point_time Whether selected points keep their own time.
   * @param context The query context.
   */
  public DownsampleIterator(final PointIterator source, 
                            final Reducer reducer, 
                            final TimeBucketer bucketer, 
                            final TimeRange range,
                            final int lookback,
                            final boolean keep_point_time,
                            final QueryContext context) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    if (reducer == null) {
      throw new IllegalArgumentException("Reducer cannot be null.");
    }
    this.source = source instanceof PeekingPointIterator ? 
        (PeekingPointIterator) source : new PeekingPointIterator(source);
    this.reducer = reducer;
    this.bucketer = bucketer;
    this.range = range == null ? TimeRange.UNBOUNDED : range;
    this.lookback = lookback;
    this.keep_point_time = keep_point_time;
    this.context = context == null ? QueryContext.unlimited() : context;
  }
  
  /**
   * @param bucketer A bucketer.
   * @param range A range with an explicit start.
   * @param lookback The number of buckets to move back.
   * @return The first bucket start including look-back.
   */
  public static long firstBucket(final TimeBucketer bucketer, 
                                 final TimeRange range, 
                                 final int lookback) {
    long first = bucketer.start(range.start());
    for (int i = 0; i < lookback; i++) {
      first = bucketer.previous(first);
    }
    return first;
  }
  
  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (done) {
      return false;
    }
    context.checkCancelled();
    if (!initialized) {
      initialize();
      if (done) {
        return false;
      }
    }
    
    if (bucketer == null) {
      reduceAll();
    } else {
      reduceNextBucket();
    }
    return next != null;
  }

  @Override
  public Bucket next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Bucket result = next;
    next = null;
    return result;
  }
  
  @Override
  public void close() {
    done = true;
    source.close();
  }
  
  private void initialize() {
    initialized = true;
    if (bucketer == null) {
      if (!source.hasNext()) {
        done = true;
      }
      return;
    }
    
    if (range.hasStart()) {
      current = firstBucket(bucketer, range, lookback);
    } else if (source.hasNext()) {
      current = bucketer.start(source.peek().timestamp());
    } else {
      done = true;
      return;
    }
    
    if (range.hasEnd()) {
      last = bucketer.start(range.end());
      final long max = context.limits().maxSelectBuckets();
      if (max > 0 && last >= current) {
        final long count = (last - current) / bucketer.interval() + 1;
        if (count > max) {
          LOG.warn("Rejecting query with " + count + " buckets over " 
              + range + ", limit is " + max);
          throw LimitExceededException.guard("max-select-buckets", count, max);
        }
      }
    } else {
      implicit_end = true;
    }
    
    // anything before the first bucket is out of range
    while (source.hasNext() && source.peek().timestamp() < current) {
      source.next();
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Downsampling with " + reducer.name() + " from " + current 
          + " to " + (implicit_end ? "last point" : last) + " using " 
          + bucketer);
    }
  }
  
  private void reduceAll() {
    reducer.reset();
    while (source.hasNext()) {
      reducer.add(source.next());
    }
    final long timestamp = range.hasStart() ? range.start() : 0;
    next = new Bucket(timestamp, stamp(reducer.emit(timestamp), timestamp), 
        reducer.count() == 0);
    done = true;
  }
  
  private void reduceNextBucket() {
    if (current > last || (implicit_end && !source.hasNext())) {
      done = true;
      return;
    }
    final long end = bucketer.next(current);
    reducer.reset();
    while (source.hasNext() && source.peek().timestamp() < end) {
      reducer.add(source.next());
    }
    next = new Bucket(current, stamp(reducer.emit(current), current), 
        reducer.count() == 0);
    buckets++;
    if (implicit_end) {
      final long max = context.limits().maxSelectBuckets();
      if (max > 0 && buckets > max) {
        LOG.warn("Rejecting query after " + buckets + " buckets, limit is " 
            + max);
        throw LimitExceededException.guard("max-select-buckets", buckets, max);
      }
    }
    current = end;
  }
  
  private List<Point> stamp(final List<Point> points, final long timestamp) {
    if (keep_point_time || !reducer.isSelector()) {
      return points;
    }
    final List<Point> stamped = Lists.newArrayListWithCapacity(points.size());
    for (final Point point : points) {
      stamped.add(point.withTimestamp(timestamp));
    }
    return stamped;
  }
}
