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
import net.timequery.data.ValueType;

/**
 * Reduces the points of one time bucket. Implementations are stateful and
 * single threaded: the downsampler calls {@link #add(Point)} for every 
 * point in the bucket, {@link #emit(long)} once at the end and then 
 * {@link #reset()} before the next bucket.
 * <p>
 * Aggregates emit derived values stamped with the timestamp handed to 
 * {@link #emit(long)}. Selectors emit the winning source point with its 
 * original timestamp and auxiliary values; callers re-stamp when needed.
 * 
 * @since 3.0
 */
public interface Reducer {
  
  /** @return The function name, e.g. "mean". */
  public String name();
  
  /** @return The type of emitted values, null if unknown. */
  public ValueType outputType();
  
  /** @return Whether emitted points are source points. */
  public boolean isSelector();
  
  /**
   * Adds a point to the current bucket. Points with a null value are 
   * ignored.
   * @param point A non-null point.
   */
  public void add(final Point point);
  
  /** @return The number of non-null points added since the last reset. */
  public int count();
  
  /**
   * Computes the result for the current bucket. An empty bucket yields a 
   * single point with the function's value for zero inputs: 0 for count, 
   * null for everything else.
   * @param timestamp The timestamp for derived values.
   * @return A non-empty list of points, more than one for distinct and 
   * top/bottom.
   */
  public List<Point> emit(final long timestamp);
  
  /** Clears state for the next bucket. */
  public void reset();
  
}
