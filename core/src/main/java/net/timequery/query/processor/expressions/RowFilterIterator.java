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
package net.timequery.query.processor.expressions;

import java.util.NoSuchElementException;
import java.util.Set;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Row;
import net.timequery.query.statement.Expr;

/**
 * Drops rows that don't satisfy a WHERE condition.
 * 
 * @since 3.0
 */
public class RowFilterIterator implements CloseableIterator<Row> {
  private final CloseableIterator<Row> source;
  private final Expr condition;
  private final RowResolver resolver;
  private Row next;
  
  /**
   * @param source The rows.
   * @param condition The condition.
   * @param tag_keys The tag keys of the source.
   */
  public RowFilterIterator(final CloseableIterator<Row> source, 
                           final Expr condition, 
                           final Set<String> tag_keys) {
    this.source = source;
    this.condition = condition;
    resolver = new RowResolver(tag_keys);
  }
  
  @Override
  public boolean hasNext() {
    while (next == null && source.hasNext()) {
      final Row row = source.next();
      if (ExpressionEvaluator.matches(condition, resolver.reset(row))) {
        next = row;
      }
    }
    return next != null;
  }

  @Override
  public Row next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Row row = next;
    next = null;
    return row;
  }
  
  @Override
  public void close() {
    source.close();
  }
}
