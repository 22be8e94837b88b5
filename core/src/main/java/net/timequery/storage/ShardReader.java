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
package net.timequery.storage;

import net.timequery.data.PointIterator;
import net.timequery.data.SeriesKey;
import net.timequery.data.TimeRange;

/**
 * Read access to one storage shard. The engine opens one iterator per 
 * (series, field) pair needed by a statement and merges the iterators of 
 * every shard overlapping the query range.
 * 
 * @since 3.0
 */
public interface ShardReader {

  /** @return A unique id for this shard, used in logs. */
  public String id();
  
  /** @return The time range this shard covers. */
  public TimeRange timeRange();
  
  /**
   * Opens a sorted stream over one series field. Points must carry the 
   * storage write sequence so ties across shards resolve deterministically.
   * @param key The non-null series key.
   * @param range The inclusive time range to read.
   * @param ascending True for ascending time order, false for descending.
   * @return A non-null iterator, empty if the shard lacks the series.
   */
  public PointIterator openSeriesIterator(final SeriesKey key, 
                                          final TimeRange range, 
                                          final boolean ascending);
  
}
