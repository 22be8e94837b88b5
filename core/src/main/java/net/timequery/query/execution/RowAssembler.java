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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.data.iterators.PointIterators;
import net.timequery.query.processor.downsample.Bucket;
import net.timequery.query.processor.expressions.ExpressionEvaluator;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.Field;
import net.timequery.query.statement.VarRef;

/**
 * Joins the per call bucket streams of an aggregate statement into output
 * rows. Each row takes the earliest pending timestamp across the streams 
 * and at most one point from every stream at that time, so a call with 
 * several points per bucket produces several rows. Select expressions are
 * then evaluated with calls resolving to their point's value. References
 * resolve to the selected point's auxiliary values, or to the group tags.
 * 
 * @since 3.0
 */
public class RowAssembler implements CloseableIterator<Row>, 
    ExpressionEvaluator.Resolver {
  private final List<CloseableIterator<Bucket>> streams;
  private final List<Deque<Point>> pending;
  private final Map<Call, Integer> indices;
  private final List<Field> fields;
  private final List<String> columns;
  private final List<String> aux;
  private final List<String> group_keys;
  private final TagSet tags;
  
  /** The points of the row being assembled, null where a stream is behind. */
  private final Point[] current;
  private Row next;
  
  /**
   * @param streams One stream per plan call, in the same order.
   * @param plan The aggregate plan.
   * @param tags The output series tags.
   */
  public RowAssembler(final List<CloseableIterator<Bucket>> streams,
                      final StatementPlan plan,
                      final TagSet tags) {
    this.streams = streams;
    this.tags = tags;
    fields = plan.fields();
    columns = plan.columns();
    group_keys = plan.groupKeys();
    pending = Lists.newArrayListWithCapacity(streams.size());
    indices = Maps.newHashMap();
    for (int i = 0; i < streams.size(); i++) {
      pending.add(new ArrayDeque<Point>());
      indices.put(plan.calls().get(i).call(), i);
    }
    aux = plan.calls().size() == 1 ? plan.calls().get(0).aux() : 
      Lists.<String>newArrayList();
    current = new Point[streams.size()];
  }
  
  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    long timestamp = Long.MAX_VALUE;
    for (int i = 0; i < streams.size(); i++) {
      final Point head = peek(i);
      if (head != null && head.timestamp() < timestamp) {
        timestamp = head.timestamp();
      }
    }
    if (timestamp == Long.MAX_VALUE) {
      return false;
    }
    
    for (int i = 0; i < streams.size(); i++) {
      final Point head = peek(i);
      current[i] = head != null && head.timestamp() == timestamp ? 
          pending.get(i).poll() : null;
    }
    
    final Map<String, Value> values = new LinkedHashMap<String, Value>();
    for (int i = 0; i < fields.size(); i++) {
      final Value value = ExpressionEvaluator.evaluate(fields.get(i).expr(), 
          this);
      if (value != null) {
        values.put(columns.get(i), value);
      }
    }
    next = new Row(timestamp, 0, tags, values);
    return true;
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
    PointIterators.closeAll(streams);
  }
  
  @Override
  public Value resolve(final VarRef ref) {
    final int idx = aux.indexOf(ref.name());
    if (idx >= 0 && current[0] != null && idx < current[0].aux().length) {
      return current[0].aux()[idx];
    }
    final String tag = tags.get(ref.name());
    if (tag != null) {
      return Value.ofString(tag);
    }
    return group_keys.contains(ref.name()) ? Value.ofString("") : null;
  }

  @Override
  public Value resolve(final Call call) {
    final Integer idx = indices.get(call);
    if (idx == null || current[idx] == null) {
      return null;
    }
    return current[idx].value();
  }
  
  /** @return The next pending point of the stream, pulling a bucket if 
   * needed, or null when the stream is done. */
  private Point peek(final int stream) {
    final Deque<Point> queue = pending.get(stream);
    while (queue.isEmpty() && streams.get(stream).hasNext()) {
      queue.addAll(streams.get(stream).next().points());
    }
    return queue.peek();
  }
}
