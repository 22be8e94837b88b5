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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Row;
import net.timequery.data.Value;
import net.timequery.exceptions.NotFoundException;
import net.timequery.exceptions.QueryExecutionException;

/**
 * Pulls the output series of one statement lazily. A group's iterator 
 * tree is opened only once the previous group is drained, and with a 
 * chunk size each chunk is handed out as soon as it fills, so at most one
 * chunk of rows is held at a time. Empty series are skipped.
 * <p>
 * Failures don't escape {@link #hasNext()}: the stream closes, ends and 
 * reports the message through {@link #error()}. Series already pulled 
 * stay valid.
 * 
 * @since 3.0
 */
public class ResultStream implements CloseableIterator<ResultSeries> {
  private static final Logger LOG = LoggerFactory.getLogger(
      ResultStream.class);
  
  private final int statement_id;
  private final StatementPlan plan;
  private final GroupEvaluator evaluator;
  private final Iterator<SeriesGroup> groups;
  private final List<String> columns;
  private final int chunk_size;
  
  private String error;
  private SeriesGroup group;
  private CloseableIterator<Row> rows;
  private ResultSeries next;
  private boolean done;
  
  /**
   * @param statement_id The statement id.
   * @param plan A non-null plan, possibly empty.
   * @param chunk_size The maximum rows per series chunk, 0 or less to 
   * return whole series.
   */
  public ResultStream(final int statement_id, 
                      final StatementPlan plan, 
                      final int chunk_size) {
    if (plan == null) {
      throw new IllegalArgumentException("Plan cannot be null.");
    }
    this.statement_id = statement_id;
    this.plan = plan;
    this.chunk_size = chunk_size;
    if (plan.isEmpty()) {
      evaluator = null;
      groups = Collections.<SeriesGroup>emptyIterator();
      columns = Collections.emptyList();
    } else {
      evaluator = new GroupEvaluator(plan);
      groups = plan.groups().iterator();
      columns = Lists.newArrayList("time");
      columns.addAll(plan.columns());
    }
  }
  
  private ResultStream(final int statement_id, final String error) {
    this.statement_id = statement_id;
    this.error = error;
    plan = null;
    evaluator = null;
    groups = Collections.<SeriesGroup>emptyIterator();
    columns = Collections.emptyList();
    chunk_size = 0;
    done = true;
  }
  
  /**
   * @param statement_id The statement id.
   * @param error The message, null for a statement with no results.
   * @return A stream that yields nothing.
   */
  public static ResultStream failed(final int statement_id, 
                                    final String error) {
    return new ResultStream(statement_id, error);
  }
  
  public int statementId() {
    return statement_id;
  }
  
  /** @return The failure message once the stream ended, null if none. */
  public String error() {
    return error;
  }
  
  public boolean hasError() {
    return error != null;
  }
  
  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (done) {
      return false;
    }
    try {
      next = advance();
    } catch (RuntimeException e) {
      error = describe(statement_id, e);
    }
    if (next == null) {
      close();
    }
    return next != null;
  }

  @Override
  public ResultSeries next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final ResultSeries series = next;
    next = null;
    return series;
  }
  
  @Override
  public void close() {
    done = true;
    if (rows != null) {
      final CloseableIterator<Row> open = rows;
      rows = null;
      open.close();
    }
  }
  
  /**
   * Turns an execution failure into the statement's error message. A soft
   * not found error means an empty result and yields null.
   * @param statement_id The statement id, for logging.
   * @param e The failure.
   * @return The message or null.
   */
  static String describe(final int statement_id, final RuntimeException e) {
    if (e instanceof NotFoundException && !((NotFoundException) e).isHard()) {
      LOG.debug("Statement " + statement_id + ": " + e.getMessage());
      return null;
    }
    if (e instanceof QueryExecutionException) {
      LOG.error("Statement " + statement_id + " failed: " + e.getMessage());
      return e.getMessage();
    }
    final QueryExecutionException ex = new QueryExecutionException(
        "internal error: " + e.getMessage(), 500, e);
    LOG.error("Unexpected exception executing statement " + statement_id, 
        ex);
    return ex.getMessage();
  }
  
  /** @return The next non-empty series or chunk, null when done. */
  private ResultSeries advance() {
    while (true) {
      if (rows == null) {
        if (!groups.hasNext()) {
          return null;
        }
        group = groups.next();
        rows = evaluator.open(group);
      }
      
      final List<List<Object>> values = Lists.newArrayList();
      while (rows.hasNext()) {
        values.add(toLine(rows.next()));
        if (chunk_size > 0 && values.size() >= chunk_size) {
          break;
        }
      }
      final boolean partial = rows.hasNext();
      if (!partial) {
        final CloseableIterator<Row> drained = rows;
        rows = null;
        drained.close();
      }
      if (!values.isEmpty()) {
        return new ResultSeries(plan.name(), group.tags().asMap(), columns, 
            values, partial);
      }
    }
  }
  
  private List<Object> toLine(final Row row) {
    final List<Object> line = Lists.newArrayListWithCapacity(columns.size());
    line.add(row.timestamp());
    for (final String column : plan.columns()) {
      final Value value = row.get(column);
      line.add(value == null ? null : value.toObject());
    }
    return line;
  }
  
  @Override
  public String toString() {
    return "ResultStream{id=" + statement_id + ", plan=" + plan 
        + ", error=" + error + "}";
  }
}
