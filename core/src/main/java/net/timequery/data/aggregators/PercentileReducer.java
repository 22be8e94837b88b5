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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.ValueType;

/**
 * Nearest rank percentile. The bucket's points are sorted by value with a 
 * stable sort so equal values keep their input order, then the point at 
 * rank {@code floor(n * p / 100 + 0.5)} is selected. Out of range ranks 
 * yield null.
 * 
 * @since 3.0
 */
public class PercentileReducer extends BaseReducer {
  private static final Comparator<Point> BY_VALUE = new Comparator<Point>() {
    @Override
    public int compare(final Point a, final Point b) {
      return a.value().compareTo(b.value());
    }
  };
  
  private final double percentile;
  private final List<Point> points = Lists.newArrayList();
  
  /**
   * @param input_type The input type.
   * @param percentile The percentile from 0 to 100.
   * @throws IllegalArgumentException if the percentile is out of range.
   */
  public PercentileReducer(final ValueType input_type, final double percentile) {
    super("percentile", input_type);
    if (percentile < 0 || percentile > 100 || Double.isNaN(percentile)) {
      throw new IllegalArgumentException("Percentile must be between 0 and "
          + "100: " + percentile);
    }
    this.percentile = percentile;
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
    final int index = (int) Math.floor(
        (double) points.size() * percentile / 100.0 + 0.5) - 1;
    if (index < 0 || index >= points.size()) {
      return single(timestamp, null);
    }
    Collections.sort(points, BY_VALUE);
    return Collections.singletonList(points.get(index));
  }
}
