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

import gnu.trove.iterator.TObjectIntIterator;
import gnu.trove.map.hash.TObjectIntHashMap;
import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.data.ValueType;

/**
 * The most frequent value. Ties go to the smallest value so the result 
 * doesn't depend on hash order.
 */
public class ModeReducer extends BaseReducer {
  private final TObjectIntHashMap<Value> counts = new TObjectIntHashMap<Value>();
  
  public ModeReducer(final ValueType input_type) {
    super("mode", input_type);
  }
  
  @Override
  protected void accumulate(final Point point) {
    counts.adjustOrPutValue(point.value(), 1, 1);
  }

  @Override
  protected void clear() {
    counts.clear();
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    Value best = null;
    int best_count = 0;
    final TObjectIntIterator<Value> it = counts.iterator();
    while (it.hasNext()) {
      it.advance();
      if (it.value() > best_count || 
          (it.value() == best_count && it.key().compareTo(best) < 0)) {
        best = it.key();
        best_count = it.value();
      }
    }
    return single(timestamp, best);
  }
}
