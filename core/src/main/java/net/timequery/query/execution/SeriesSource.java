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
package net.timequery.query.execution;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;

/**
 * Where a statement reads rows from: a stored measurement or the output of
 * a subquery. Each series yields rows carrying the series tags and the 
 * requested columns.
 * 
 * @since 3.0
 */
public interface SeriesSource {
  
  /** @return The name for result series. */
  public String name();
  
  /** @return The tag sets of every series, sorted. */
  public List<TagSet> series();
  
  /** @return The field (column) names and their types. */
  public Map<String, ValueType> fieldTypes();
  
  /** @return The tag keys present on the series. */
  public Set<String> tagKeys();
  
  /**
   * Opens one series.
   * @param series The series tags, one of {@link #series()}.
   * @param fields The fields to read.
   * @param range The time range to read.
   * @param ascending The time order.
   * @return The rows, owned by the caller.
   */
  public CloseableIterator<Row> open(final TagSet series, 
                                     final Collection<String> fields, 
                                     final TimeRange range,
                                     final boolean ascending);
  
}
