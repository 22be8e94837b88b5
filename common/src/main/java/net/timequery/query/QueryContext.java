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
package net.timequery.query;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.timequery.exceptions.LimitExceededException;
import net.timequery.exceptions.QueryCancelledException;

/**
 * Per execution state shared by every iterator in one statement's tree: the
 * limits, the cancellation signal with an optional deadline and the raw
 * point counter. Leaf and merge iterators call {@link #checkCancelled()} on
 * every step.
 * <p>
 * The cancel flag and counter are thread safe since shard scan workers run
 * concurrently with the consumer.
 * 
 * @since 3.0
 */
public class QueryContext {
  private static final Logger LOG = LoggerFactory.getLogger(QueryContext.class);
  
  private final QueryLimits limits;
  
  /** Deadline in {@link System#nanoTime()} units, 0 for none. */
  private final long deadline;
  
  private final AtomicBoolean cancelled;
  
  private final AtomicLong points_read;
  
  private volatile String reason;
  
  /**
   * Default ctor.
   * @param limits The non-null limits for this execution.
   */
  public QueryContext(final QueryLimits limits) {
    if (limits == null) {
      throw new IllegalArgumentException("Limits cannot be null.");
    }
    this.limits = limits;
    deadline = limits.timeoutMs() > 0 ? 
        System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(limits.timeoutMs()) : 0;
    cancelled = new AtomicBoolean();
    points_read = new AtomicLong();
  }
  
  /** @return A context with default limits. */
  public static QueryContext unlimited() {
    return new QueryContext(QueryLimits.DEFAULT);
  }
  
  public QueryLimits limits() {
    return limits;
  }
  
  /**
   * Signals cancellation. Iterators notice on their next call.
   * @param reason A description for the error.
   */
  public void cancel(final String reason) {
    if (cancelled.compareAndSet(false, true)) {
      this.reason = reason;
      LOG.warn("Query cancelled: " + reason);
    }
  }
  
  /** @return True if cancelled or past the deadline. */
  public boolean isCancelled() {
    if (cancelled.get()) {
      return true;
    }
    if (deadline > 0 && System.nanoTime() - deadline > 0) {
      cancel("query timeout of " + limits.timeoutMs() + "ms exceeded");
      return true;
    }
    return false;
  }
  
  /**
   * @throws QueryCancelledException if the query was cancelled.
   */
  public void checkCancelled() {
    if (isCancelled()) {
      throw new QueryCancelledException(reason == null ? 
          "query cancelled" : reason);
    }
  }
  
  /**
   * Records raw points read from storage and enforces the point guard.
   * @param count The number of points just read.
   * @throws LimitExceededException if the guard trips.
   */
  public void addPointsRead(final long count) {
    final long total = points_read.addAndGet(count);
    if (limits.maxSelectPoints() > 0 && total > limits.maxSelectPoints()) {
      throw new LimitExceededException("max-select-point limit exceeed: (" 
          + total + "/" + limits.maxSelectPoints() + ")");
    }
  }
  
  /** @return The raw points read so far. */
  public long pointsRead() {
    return points_read.get();
  }
}
