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
import java.util.List;

import net.timequery.data.Point;
import net.timequery.data.ValueType;

/**
 * Base for selectors that keep a single winning source point.
 * 
 * @since 3.0
 */
public abstract class SelectorReducer extends BaseReducer {
  protected Point winner;
  
  protected SelectorReducer(final String name, final ValueType input_type) {
    super(name, input_type);
  }
  
  @Override
  public boolean isSelector() {
    return true;
  }
  
  @Override
  protected void accumulate(final Point point) {
    if (winner == null || replaces(point, winner)) {
      winner = point;
    }
  }
  
  /**
   * @param candidate The new point.
   * @param current The current winner.
   * @return True if the candidate should win.
   */
  protected abstract boolean replaces(final Point candidate, 
                                      final Point current);
  
  @Override
  protected void clear() {
    winner = null;
  }
  
  @Override
  public List<Point> emit(final long timestamp) {
    if (winner == null) {
      return single(timestamp, null);
    }
    return Collections.singletonList(winner);
  }
}
