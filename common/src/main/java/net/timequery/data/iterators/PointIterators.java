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
package net.timequery.data.iterators;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.ValueType;

/**
 * Static helpers for point iterators.
 * 
 * @since 3.0
 */
public final class PointIterators {
  private PointIterators() { }
  
  /** @return An exhausted iterator of the given type. */
  public static PointIterator empty(final ValueType type) {
    return new ListPointIterator(type, Collections.<Point>emptyList());
  }
  
  /**
   * Reads the remainder of the iterator into a list and closes it.
   * @param iterator A non-null iterator.
   * @return The list of points, possibly empty.
   */
  public static List<Point> drain(final PointIterator iterator) {
    final List<Point> points = Lists.newArrayList();
    try {
      while (iterator.hasNext()) {
        points.add(iterator.next());
      }
    } finally {
      iterator.close();
    }
    return points;
  }
  
  /**
   * Closes every non-null iterator in the list, continuing past failures.
   * The first failure is rethrown after all were attempted.
   * @param iterators The iterators to close.
   */
  public static void closeAll(final Iterable<? extends AutoCloseable> iterators) {
    RuntimeException first = null;
    for (final AutoCloseable it : iterators) {
      if (it == null) {
        continue;
      }
      try {
        it.close();
      } catch (RuntimeException e) {
        if (first == null) {
          first = e;
        }
      } catch (Exception e) {
        if (first == null) {
          first = new IllegalStateException("Failed to close iterator", e);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }
}
