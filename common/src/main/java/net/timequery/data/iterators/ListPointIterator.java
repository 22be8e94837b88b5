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

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.ValueType;

/**
 * A point iterator over an in-memory list. Used for buffered stages and in
 * tests.
 * 
 * @since 3.0
 */
public class ListPointIterator implements PointIterator {

  private final ValueType type;
  private final Iterator<Point> iterator;
  private boolean closed;
  
  public ListPointIterator(final ValueType type, final List<Point> points) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    this.type = type;
    iterator = points.iterator();
  }
  
  public ListPointIterator(final ValueType type, final Point... points) {
    this(type, Lists.newArrayList(points));
  }
  
  @Override
  public boolean hasNext() {
    return !closed && iterator.hasNext();
  }

  @Override
  public Point next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return iterator.next();
  }

  @Override
  public ValueType type() {
    return type;
  }

  @Override
  public void close() {
    closed = true;
  }
  
  /** @return Whether or not close was called. */
  public boolean isClosed() {
    return closed;
  }
}
