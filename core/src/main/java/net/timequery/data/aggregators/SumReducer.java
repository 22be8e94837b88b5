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

import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.data.ValueType;

/** Sums numeric values. Integers stay integers unless a float shows up. */
public class SumReducer extends BaseReducer {
  private long long_sum;
  private double double_sum;
  private boolean floating;
  
  public SumReducer(final ValueType input_type) {
    super("sum", input_type);
    floating = input_type == ValueType.FLOAT;
  }
  
  @Override
  protected void accumulate(final Point point) {
    final Value value = point.value();
    if (value.isInteger()) {
      long_sum += value.longValue();
    } else {
      floating = true;
    }
    double_sum += value.toDouble();
  }

  @Override
  protected void clear() {
    long_sum = 0;
    double_sum = 0;
    floating = input_type == ValueType.FLOAT;
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    if (count == 0) {
      return single(timestamp, null);
    }
    return single(timestamp, 
        floating ? Value.ofDouble(double_sum) : Value.ofLong(long_sum));
  }
}
