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

import java.util.NoSuchElementException;

import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.ValueType;

/**
 * Wraps a point iterator with a one point look-ahead.
 * 
 * @since 3.0
 */
public class PeekingPointIterator implements PointIterator {

  private final PointIterator source;
  private Point peeked;
  
  public PeekingPointIterator(final PointIterator source) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    this.source = source;
  }
  
  /** @return The next point without consuming it or null if exhausted. */
  public Point peek() {
    if (peeked == null && source.hasNext()) {
      peeked = source.next();
    }
    return peeked;
  }
  
  @Override
  public boolean hasNext() {
    return peeked != null || source.hasNext();
  }

  @Override
  public Point next() {
    if (peeked != null) {
      final Point p = peeked;
      peeked = null;
      return p;
    }
    if (!source.hasNext()) {
      throw new NoSuchElementException();
    }
    return source.next();
  }

  @Override
  public ValueType type() {
    return source.type();
  }

  @Override
  public void close() {
    peeked = null;
    source.close();
  }
}
