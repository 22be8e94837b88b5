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

/**
 * The middle value of the bucket, or the mean of the two middle values for 
 * an even count.
 */
public class MedianReducer extends BaseReducer {
  private final TDoubleArrayList values = new TDoubleArrayList();
  
  public MedianReducer(final ValueType input_type) {
    super("median", input_type);
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
    if (values.isEmpty()) {
      return single(timestamp, null);
    }
    values.sort();
    final int mid = values.size() / 2;
    if (values.size() % 2 == 1) {
      return single(timestamp, Value.ofDouble(values.get(mid)));
    }
    return single(timestamp, 
        Value.ofDouble((values.get(mid - 1) + values.get(mid)) / 2));
  }
}
