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

/** Counts non-null values of any type. */
public class CountReducer extends BaseReducer {
  
  public CountReducer(final ValueType input_type) {
    super("count", input_type);
  }
  
  @Override
  protected void accumulate(final Point point) {
    // nothing beyond the base count
  }

  @Override
  protected void clear() {
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    return single(timestamp, Value.ofLong(count));
  }
}
