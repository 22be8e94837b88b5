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

import java.util.Comparator;

import com.google.common.collect.ComparisonChain;

import net.timequery.data.Point;
import net.timequery.data.Row;

/**
 * Orders points and rows by timestamp, then write sequence.
 * 
 * @since 3.0
 */
public final class PointOrder {
  
  public static final Comparator<Point> ASCENDING = new Comparator<Point>() {
    @Override
    public int compare(final Point a, final Point b) {
      return ComparisonChain.start()
          .compare(a.timestamp(), b.timestamp())
          .compare(a.sequence(), b.sequence())
          .result();
    }
  };
  
  /** Descending time, still ascending sequence within a timestamp. */
  public static final Comparator<Point> DESCENDING = new Comparator<Point>() {
    @Override
    public int compare(final Point a, final Point b) {
      return ComparisonChain.start()
          .compare(b.timestamp(), a.timestamp())
          .compare(a.sequence(), b.sequence())
          .result();
    }
  };
  
  public static final Comparator<Row> ROWS_ASCENDING = new Comparator<Row>() {
    @Override
    public int compare(final Row a, final Row b) {
      return ComparisonChain.start()
          .compare(a.timestamp(), b.timestamp())
          .compare(a.sequence(), b.sequence())
          .compare(a.tags(), b.tags())
          .result();
    }
  };
  
  public static final Comparator<Row> ROWS_DESCENDING = new Comparator<Row>() {
    @Override
    public int compare(final Row a, final Row b) {
      return ComparisonChain.start()
          .compare(b.timestamp(), a.timestamp())
          .compare(a.sequence(), b.sequence())
          .compare(a.tags(), b.tags())
          .result();
    }
  };
  
  private PointOrder() {
    // static comparators
  }
  
  /** @return The point order for the direction. */
  public static Comparator<Point> points(final boolean ascending) {
    return ascending ? ASCENDING : DESCENDING;
  }
  
  /** @return The row order for the direction. */
  public static Comparator<Row> rows(final boolean ascending) {
    return ascending ? ROWS_ASCENDING : ROWS_DESCENDING;
  }
}
