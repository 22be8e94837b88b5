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
package net.timequery.query.processor.downsample;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.timequery.data.Point;
import net.timequery.data.Value;

/**
 * The reduced output of one time bucket. Holds one point for most 
 * functions and several for distinct and top/bottom. An empty bucket 
 * received no input points; its single point carries the reducer's value 
 * for zero inputs until the fill stage decides otherwise.
 * 
 * @since 3.0
 */
public class Bucket {
  private final long start;
  private final List<Point> points;
  private final boolean empty;
  
  public Bucket(final long start, final List<Point> points, final boolean empty) {
    if (points == null || points.isEmpty()) {
      throw new IllegalArgumentException("A bucket needs at least one point.");
    }
    this.start = start;
    this.points = ImmutableList.copyOf(points);
    this.empty = empty;
  }
  
  public Bucket(final long start, final Point point, final boolean empty) {
    this(start, ImmutableList.of(point), empty);
  }
  
  /** @return The bucket start, or the point time for raw streams. */
  public long start() {
    return start;
  }
  
  public List<Point> points() {
    return points;
  }
  
  /** @return The first point. */
  public Point first() {
    return points.get(0);
  }
  
  /** @return The value of the first point, may be null. */
  public Value value() {
    return points.get(0).value();
  }
  
  public boolean isEmpty() {
    return empty;
  }
  
  /** @return A copy with the first point's value replaced. */
  public Bucket withValue(final Value value) {
    return new Bucket(start, first().withValue(value), empty);
  }
  
  @Override
  public String toString() {
    return "Bucket{start=" + start + ", empty=" + empty + ", points=" 
        + points + "}";
  }
}
