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
package net.timequery.data.aggregators;

import java.util.List;
import java.util.TreeSet;

import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.data.ValueType;

/**
 * Emits every distinct value of the bucket in ascending order, all stamped 
 * with the bucket timestamp.
 */
public class DistinctReducer extends BaseReducer {
  private final TreeSet<Value> values = new TreeSet<Value>();
  
  public DistinctReducer(final ValueType input_type) {
    super("distinct", input_type);
  }
  
  @Override
  protected void accumulate(final Point point) {
    values.add(point.value());
  }

  @Override
  protected void clear() {
    values.clear();
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    if (values.isEmpty()) {
      return single(timestamp, null);
    }
    final List<Point> points = Lists.newArrayListWithCapacity(values.size());
    for (final Value value : values) {
      points.add(new Point(timestamp, value));
    }
    return points;
  }
}
