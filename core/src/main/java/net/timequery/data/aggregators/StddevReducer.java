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

import gnu.trove.list.array.TDoubleArrayList;
import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.data.ValueType;

/** Sample standard deviation. Null for fewer than two values. */
public class StddevReducer extends BaseReducer {
  private final TDoubleArrayList values = new TDoubleArrayList();
  
  public StddevReducer(final ValueType input_type) {
    super("stddev", input_type);
  }
  
  @Override
  protected void accumulate(final Point point) {
    values.add(point.value().toDouble());
  }

  @Override
  protected void clear() {
    values.resetQuick();
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    if (values.size() < 2) {
      return single(timestamp, null);
    }
    final double mean = values.sum() / values.size();
    double variance = 0;
    for (int i = 0; i < values.size(); i++) {
      final double delta = values.get(i) - mean;
      variance += delta * delta;
    }
    variance /= values.size() - 1;
    return single(timestamp, Value.ofDouble(Math.sqrt(variance)));
  }
}
