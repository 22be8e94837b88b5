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
package net.timequery.query.processor.merge;

import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.ValueType;
import net.timequery.query.QueryContext;

/**
 * Collapses points of one series that share a timestamp, keeping the one 
 * with the highest write sequence. Expects the source grouped by 
 * timestamp, as produced by merging shards with {@link PointOrder}. Every
 * raw point pulled counts against the context's point budget.
 * 
 * @since 3.0
 */
public class DedupePointIterator implements PointIterator {
  private final CloseableIterator<Point> source;
  private final ValueType type;
  private final QueryContext context;
  private Point pending;
  
  public DedupePointIterator(final CloseableIterator<Point> source, 
                             final ValueType type,
                             final QueryContext context) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    this.source = source;
    this.type = type;
    this.context = context == null ? QueryContext.unlimited() : context;
  }
  
  @Override
  public boolean hasNext() {
    return pending != null || source.hasNext();
  }

  @Override
  public Point next() {
    context.checkCancelled();
    Point winner = pending != null ? pending : pull();
    if (winner == null) {
      throw new NoSuchElementException();
    }
    pending = null;
    while (source.hasNext()) {
      final Point candidate = pull();
      if (candidate.timestamp() != winner.timestamp()) {
        pending = candidate;
        break;
      }
      if (candidate.sequence() > winner.sequence()) {
        winner = candidate;
      }
    }
    return winner;
  }
  
  @Override
  public ValueType type() {
    return type;
  }
  
  @Override
  public void close() {
    pending = null;
    source.close();
  }
  
  private Point pull() {
    if (!source.hasNext()) {
      return null;
    }
    final Point point = source.next();
    context.addPointsRead(1);
    return point;
  }
}
