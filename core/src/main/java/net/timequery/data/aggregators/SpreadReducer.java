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

/** The difference between the max and min. Zero for a single value. */
public class SpreadReducer extends BaseReducer {
  private Value min;
  private Value max;
  
  public SpreadReducer(final ValueType input_type) {
    super("spread", input_type);
  }
  
  @Override
  protected void accumulate(final Point point) {
    final Value value = point.value();
    if (min == null || value.compareTo(min) < 0) {
      min = value;
    }
    if (max == null || value.compareTo(max) > 0) {
      max = value;
    }
  }

  @Override
  protected void clear() {
    min = null;
    max = null;
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    if (count == 0) {
      return single(timestamp, null);
    }
    if (min.isInteger() && max.isInteger()) {
      return single(timestamp, Value.ofLong(max.longValue() - min.longValue()));
    }
    return single(timestamp, Value.ofDouble(max.toDouble() - min.toDouble()));
  }
}
