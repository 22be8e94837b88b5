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
package net.timequery.query.execution;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Deferred;

import net.timequery.query.QueryContext;
import net.timequery.query.QueryLimits;
import net.timequery.query.statement.SelectStatement;
import net.timequery.storage.SchemaCatalog;
import net.timequery.utils.Config;

/**
 * Executes batches of select statements against a catalog. Each statement
 * gets its own {@link QueryContext} and fails independently: errors are 
 * recorded on that statement's result and the batch carries on.
 * <p>
 * {@link #stream(int, SelectStatement)} hands out a statement's series as 
 * they are produced; {@link #execute(int, SelectStatement)} collects them.
 * <p>
 * When more than one scan thread is configured a shared daemon pool runs 
 * the shard scan workers and the asynchronous entry point.
 * 
 * @since 3.0
 */
public class QueryExecutor implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      QueryExecutor.class);
  
  private final SchemaCatalog catalog;
  private final QueryLimits limits;
  private final ExecutorService pool;
  
  /**
   * @param catalog A non-null catalog.
   * @param config A non-null config to read the limits from.
   */
  public QueryExecutor(final SchemaCatalog catalog, final Config config) {
    this(catalog, QueryLimits.fromConfig(config));
  }
  
  /**
   * @param catalog A non-null catalog.
   * @param limits Non-null limits.
   */
  public QueryExecutor(final SchemaCatalog catalog, final QueryLimits limits) {
    if (catalog == null) {
      throw new IllegalArgumentException("Catalog cannot be null.");
    }
    if (limits == null) {
      throw new IllegalArgumentException("Limits cannot be null.");
    }
    this.catalog = catalog;
    this.limits = limits;
    if (limits.scanThreads() > 1) {
      pool = Executors.newFixedThreadPool(limits.scanThreads(), 
          new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("timequery-scan-%d")
            .build());
    } else {
      pool = null;
    }
    LOG.info("Instantiated query executor with " + limits);
  }
  
  public QueryLimits limits() {
    return limits;
  }
  
  /**
   * Runs every statement in order.
   * @param statements The statements, ids are their indices.
   * @return One result per statement.
   */
  public List<StatementResult> execute(final List<SelectStatement> statements) {
    final List<StatementResult> results = 
        Lists.newArrayListWithCapacity(statements.size());
    for (int i = 0; i < statements.size(); i++) {
      results.add(execute(i, statements.get(i)));
    }
    return results;
  }
  
  /**
   * Runs the batch on the pool, or inline without one.
   * @param statements The statements.
   * @return A deferred resolving to one result per statement.
   */
  public Deferred<List<StatementResult>> executeAsync(
      final List<SelectStatement> statements) {
    if (pool == null) {
      return Deferred.fromResult(execute(statements));
    }
    final Deferred<List<StatementResult>> deferred = 
        new Deferred<List<StatementResult>>();
    try {
      pool.execute(new Runnable() {
        @Override
        public void run() {
          try {
            deferred.callback(execute(statements));
          } catch (Exception e) {
            LOG.error("Unexpected exception executing batch", e);
            deferred.callback(e);
          }
        }
      });
    } catch (RejectedExecutionException e) {
      return Deferred.fromError(e);
    }
    return deferred;
  }
  
  /**
   * @param id The statement id.
   * @param statement The statement.
   * @return The result, never null.
   */
  public StatementResult execute(final int id, final SelectStatement statement) {
    return execute(id, statement, new QueryContext(limits));
  }
  
  /**
   * Drains {@link #stream(int, SelectStatement, QueryContext)} into a 
   * result held in memory.
   * @param id The statement id.
   * @param statement The statement.
   * @param context The context, e.g. to cancel from another thread.
   * @return The result, never null.
   */
  public StatementResult execute(final int id, 
                                 final SelectStatement statement,
                                 final QueryContext context) {
    final ResultStream stream = stream(id, statement, context);
    try {
      final List<ResultSeries> series = Lists.newArrayList();
      while (stream.hasNext()) {
        series.add(stream.next());
      }
      if (stream.hasError()) {
        return StatementResult.error(id, stream.error());
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Statement " + id + " returned " + series.size() 
            + " series after reading " + context.pointsRead() + " points");
      }
      return StatementResult.success(id, series);
    } finally {
      stream.close();
    }
  }
  
  /**
   * Plans a statement and returns its series as a lazy stream. Planning 
   * errors are reported by the returned stream.
   * @param id The statement id.
   * @param statement The statement.
   * @return The stream, owned by the caller.
   */
  public ResultStream stream(final int id, final SelectStatement statement) {
    return stream(id, statement, new QueryContext(limits));
  }
  
  /**
   * @param id The statement id.
   * @param statement The statement.
   * @param context The context, e.g. to cancel from another thread.
   * @return The stream, owned by the caller.
   */
  public ResultStream stream(final int id, 
                             final SelectStatement statement,
                             final QueryContext context) {
    try {
      return new ResultStream(id, 
          new StatementPlanner(catalog, pool, context).plan(statement), 
          limits.chunkSize());
    } catch (RuntimeException e) {
      return ResultStream.failed(id, ResultStream.describe(id, e));
    }
  }
  
  /**
   * Streams a batch. Each statement is planned when the iterator reaches
   * it; the caller closes every stream it pulls.
   * @param statements The statements, ids are their indices.
   * @return One stream per statement.
   */
  public Iterator<ResultStream> stream(final List<SelectStatement> statements) {
    return new Iterator<ResultStream>() {
      private int index;
      
      @Override
      public boolean hasNext() {
        return index < statements.size();
      }

      @Override
      public ResultStream next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        final int id = index++;
        return stream(id, statements.get(id));
      }
    };
  }
  
  @Override
  public void close() {
    if (pool != null) {
      pool.shutdownNow();
    }
  }
}
