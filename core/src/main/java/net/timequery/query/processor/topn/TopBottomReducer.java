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
package net.timequery.query.processor.topn;

import java.util.List;

import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.ValueType;
import net.timequery.data.aggregators.BaseReducer;
import net.timequery.data.aggregators.Reducers;

/**
 * Buffers the points of a bucket and hands them to a 
 * {@link TopBottomSelector}. The emitted points keep their own timestamps.
 * 
 * @since 3.0
 */
public class TopBottomReducer extends BaseReducer {
  private final TopBottomSelector selector;
  private final List<Point> points = Lists.newArrayList();
  
  public TopBottomReducer(final ValueType input_type, 
                          final TopBottomSelector selector) {
    super(selector.isTop() ? "top" : "bottom", input_type);
    Reducers.checkType(name, input_type);
    this.selector = selector;
  }
  
  @Override
  public boolean isSelector() {
    return true;
  }
  
  @Override
  protected void accumulate(final Point point) {
    points.add(point);
  }

  @Override
  protected void clear() {
    points.clear();
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    if (points.isEmpty()) {
      return single(timestamp, null);
    }
    return selector.select(points);
  }
}
