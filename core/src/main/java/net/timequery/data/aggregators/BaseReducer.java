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
import net.timequery.data.Value;
import net.timequery.data.ValueType;

/**
 * Shared plumbing for reducers: null filtering, the point count and the 
 * single point result helpers.
 * 
 * @since 3.0
 */
public abstract class BaseReducer implements Reducer {
  protected final String name;
  protected final ValueType input_type;
  protected int count;
  
  protected BaseReducer(final String name, final ValueType input_type) {
    this.name = name;
    this.input_type = input_type;
  }
  
  @Override
  public String name() {
    return name;
  }
  
  @Override
  public ValueType outputType() {
    return Reducers.outputType(name, input_type);
  }
  
  @Override
  public boolean isSelector() {
    return false;
  }
  
  @Override
  public int count() {
    return count;
  }
  
  @Override
  public void add(final Point point) {
    if (point.isNull()) {
      return;
    }
    count++;
    accumulate(point);
  }
  
  @Override
  public void reset() {
    count = 0;
    clear();
  }
  
  /** @param point A point with a non-null value. */
  protected abstract void accumulate(final Point point);
  
  /** Clears implementation state. */
  protected abstract void clear();
  
  protected static List<Point> single(final long timestamp, final Value value) {
    return Collections.singletonList(new Point(timestamp, value));
  }
}
