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

import java.util.List;
import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.Row;
import net.timequery.data.Value;
import net.timequery.data.ValueType;

/**
 * Projects one column of a row stream into points, skipping rows where the
 * column is null. Auxiliary columns are resolved from the same row so a 
 * selector can carry them along with the winning value; a name that isn't
 * a column resolves to the row's tag value.
 * 
 * @since 3.0
 */
public class RowPointIterator implements PointIterator {
  private final CloseableIterator<Row> source;
  private final String field;
  private final List<String> aux;
  private final ValueType type;
  private Point next;
  
  /**
   * @param source The rows.
   * @param field The column to project.
   * @param aux Auxiliary column or tag names, may be empty.
   * @param type The column type, may be null.
   */
  public RowPointIterator(final CloseableIterator<Row> source, 
                          final String field,
                          final List<String> aux,
                          final ValueType type) {
    this.source = source;
    this.field = field;
    this.aux = aux;
    this.type = type;
  }
  
  @Override
  public boolean hasNext() {
    while (next == null && source.hasNext()) {
      final Row row = source.next();
      final Value value = row.get(field);
      if (value == null) {
        continue;
      }
      Value[] aux_values = null;
      if (!aux.isEmpty()) {
        aux_values = new Value[aux.size()];
        for (int i = 0; i < aux.size(); i++) {
          aux_values[i] = row.get(aux.get(i));
          if (aux_values[i] == null && row.tags().get(aux.get(i)) != null) {
            aux_values[i] = Value.ofString(row.tags().get(aux.get(i)));
          }
        }
      }
      next = new Point(row.timestamp(), value, row.sequence(), row.tags(), 
          aux_values);
    }
    return next != null;
  }

  @Override
  public Point next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Point point = next;
    next = null;
    return point;
  }
  
  @Override
  public ValueType type() {
    return type;
  }
  
  @Override
  public void close() {
    source.close();
  }
}
