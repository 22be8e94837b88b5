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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.query.processor.expressions.ExpressionEvaluator;
import net.timequery.query.processor.expressions.RowResolver;
import net.timequery.query.statement.Exprs;
import net.timequery.query.statement.Field;
import net.timequery.query.statement.VarRef;

/**
 * Evaluates the select list of a raw statement against each row. Rows 
 * where every column reading a field comes out null are dropped.
 * 
 * @since 3.0
 */
public class ProjectionIterator implements CloseableIterator<Row> {
  private final CloseableIterator<Row> source;
  private final List<Field> fields;
  private final List<String> columns;
  private final boolean[] reads_field;
  private final TagSet tags;
  private final RowResolver resolver;
  private Row next;
  
  /**
   * @param source The filtered rows.
   * @param plan The raw plan.
   * @param tags The output series tags.
   */
  public ProjectionIterator(final CloseableIterator<Row> source,
                            final StatementPlan plan,
                            final TagSet tags) {
    this.source = source;
    this.tags = tags;
    fields = plan.fields();
    columns = plan.columns();
    resolver = new RowResolver(plan.source().tagKeys());
    reads_field = new boolean[fields.size()];
    for (int i = 0; i < fields.size(); i++) {
      for (final VarRef ref : Exprs.allRefs(fields.get(i).expr())) {
        if (plan.source().fieldTypes().containsKey(ref.name())) {
          reads_field[i] = true;
        }
      }
    }
  }
  
  @Override
  public boolean hasNext() {
    while (next == null && source.hasNext()) {
      final Row row = source.next();
      resolver.reset(row);
      final Map<String, Value> values = new LinkedHashMap<String, Value>();
      boolean has_field = false;
      for (int i = 0; i < fields.size(); i++) {
        final Value value = ExpressionEvaluator.evaluate(
            fields.get(i).expr(), resolver);
        if (value == null) {
          continue;
        }
        values.put(columns.get(i), value);
        if (reads_field[i]) {
          has_field = true;
        }
      }
      if (has_field) {
        next = new Row(row.timestamp(), row.sequence(), tags, values);
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
