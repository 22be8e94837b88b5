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
package net.timequery.query.processor.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.SeriesKey;
import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;
import net.timequery.exceptions.QueryExecutionException;
import net.timequery.query.QueryContext;
import net.timequery.storage.ShardReader;

/**
 * Opens one series across every shard covering the query range and merges
 * the shard streams into a single deduplicated stream.
 * <p>
 * With an executor and more than one shard, every shard is read by its own
 * worker that fills a bounded buffer ahead of the merge. A worker that 
 * hasn't been scheduled by the time the merge needs its first point is 
 * claimed by the consuming thread and read inline, so a saturated pool 
 * can't stall the merge. Worker failures surface on the consuming thread.
 * 
 * @since 3.0
 */
public class ShardScanner {
  private static final Logger LOG = LoggerFactory.getLogger(ShardScanner.class);
  
  /** How long to wait on a buffer between cancellation checks. */
  private static final long POLL_MS = 50;
  
  private final ExecutorService executor;
  private final QueryContext context;
  
  /**
   * @param executor The pool for shard workers, null to read inline.
   * @param context The query context.
   */
  public ShardScanner(final ExecutorService executor, 
                      final QueryContext context) {
    this.executor = executor;
    this.context = context == null ? QueryContext.unlimited() : context;
  }
  
  /**
   * @param shards The shards to read.
   * @param key The series key.
   * @param range The query range.
   * @param ascending The read direction.
   * @param type The field type.
   * @return A merged, deduplicated stream.
   */
  public PointIterator scan(final List<ShardReader> shards, 
                            final SeriesKey key, 
                            final TimeRange range, 
                            final boolean ascending,
                            final ValueType type) {
    final List<ShardReader> overlapping = Lists.newArrayList();
    for (final ShardReader shard : shards) {
      if (shard.timeRange().overlaps(range)) {
        overlapping.add(shard);
      }
    }
    
    final List<PointIterator> iterators = 
        Lists.newArrayListWithCapacity(overlapping.size());
    if (executor == null || overlapping.size() < 2) {
      for (final ShardReader shard : overlapping) {
        iterators.add(shard.openSeriesIterator(key, 
            range.intersect(shard.timeRange()), ascending));
      }
    } else {
      final List<Deferred<Long>> completions = 
          Lists.newArrayListWithCapacity(overlapping.size());
      for (final ShardReader shard : overlapping) {
        final ShardWorker worker = new ShardWorker(shard, key, 
            range.intersect(shard.timeRange()), ascending, type);
        try {
          executor.execute(worker);
        } catch (RejectedExecutionException e) {
          LOG.debug("Pool rejected the worker for " + shard.id() 
              + ", it will be read inline");
        }
        completions.add(worker.completion);
        iterators.add(worker);
      }
      
      class CompleteCB implements Callback<Object, ArrayList<Long>> {
        @Override
        public Object call(final ArrayList<Long> counts) throws Exception {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Finished scanning " + key + " across " 
                + counts.size() + " shards: " + counts);
          }
          return null;
        }
      }
      
      class ErrorCB implements Callback<Object, Exception> {
        @Override
        public Object call(final Exception e) throws Exception {
          LOG.debug("Scan of " + key + " failed", e);
          return null;
        }
      }
      
      Deferred.group(completions)
        .addCallback(new CompleteCB())
        .addErrback(new ErrorCB());
    }
    
    return new DedupePointIterator(
        new SortedMergeIterator<Point>(iterators, PointOrder.points(ascending), 
            context), type, context);
  }
  
  /** Marks the end of a shard stream. */
  private static final Object END = new Object();
  
  /** Carries a worker failure to the consumer. */
  private static class Failure {
    private final Exception exception;
    
    Failure(final Exception exception) {
      this.exception = exception;
    }
  }
  
  /**
   * Reads one shard into a bounded buffer, or inline if the consumer gets 
   * to it first.
   */
  class ShardWorker implements PointIterator, Runnable {
    private final ShardReader shard;
    private final SeriesKey key;
    private final TimeRange range;
    private final boolean ascending;
    private final ValueType type;
    private final BlockingQueue<Object> buffer;
    private final AtomicBoolean started = new AtomicBoolean();
    private final Deferred<Long> completion = new Deferred<Long>();
    private volatile boolean closed;
    private PointIterator inline;
    private Object head;
    
    ShardWorker(final ShardReader shard, 
                final SeriesKey key, 
                final TimeRange range, 
                final boolean ascending,
                final ValueType type) {
      this.shard = shard;
      this.key = key;
      this.range = range;
      this.ascending = ascending;
      this.type = type;
      buffer = new ArrayBlockingQueue<Object>(
          Math.max(1, context.limits().scanBufferSize()));
    }
    
    @Override
    public void run() {
      if (!started.compareAndSet(false, true)) {
        return;
      }
      long count = 0;
      try (final PointIterator iterator = 
          shard.openSeriesIterator(key, range, ascending)) {
        while (!closed && !context.isCancelled() && iterator.hasNext()) {
          if (!put(iterator.next())) {
            break;
          }
          count++;
        }
        put(END);
        completion.callback(count);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        completion.callback(e);
      } catch (Exception e) {
        LOG.warn("Failed reading " + key + " from shard " + shard.id(), e);
        buffer.clear();
        buffer.offer(new Failure(e));
        completion.callback(e);
      }
    }
    
    @Override
    public boolean hasNext() {
      if (inline != null) {
        return inline.hasNext();
      }
      if (closed) {
        return false;
      }
      if (head == null) {
        if (buffer.isEmpty() && started.compareAndSet(false, true)) {
          if (LOG.isTraceEnabled()) {
            LOG.trace("Reading " + key + " from " + shard.id() + " inline");
          }
          inline = shard.openSeriesIterator(key, range, ascending);
          completion.callback(0L);
          return inline.hasNext();
        }
        head = take();
      }
      if (head instanceof Failure) {
        final Exception e = ((Failure) head).exception;
        if (e instanceof RuntimeException) {
          throw (RuntimeException) e;
        }
        throw new QueryExecutionException("Failed reading shard " + shard.id(), 
            500, e);
      }
      return head != END;
    }

    @Override
    public Point next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (inline != null) {
        return inline.next();
      }
      final Point point = (Point) head;
      head = null;
      return point;
    }
    
    @Override
    public ValueType type() {
      return type;
    }
    
    @Override
    public void close() {
      closed = true;
      // unblock a worker waiting on a full buffer
      buffer.clear();
      if (inline != null) {
        inline.close();
      }
    }
    
    private boolean put(final Object item) throws InterruptedException {
      while (!closed) {
        if (buffer.offer(item, POLL_MS, TimeUnit.MILLISECONDS)) {
          return true;
        }
      }
      return false;
    }
    
    private Object take() {
      try {
        while (true) {
          context.checkCancelled();
          final Object item = buffer.poll(POLL_MS, TimeUnit.MILLISECONDS);
          if (item != null) {
            return item;
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new QueryExecutionException("Interrupted while reading shard " 
            + shard.id(), 500, e);
      }
    }
  }
}
