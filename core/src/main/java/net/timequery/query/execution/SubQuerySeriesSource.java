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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;
import net.timequery.data.iterators.CloseableIterators;

/**
 * Feeds the rows of an inner statement to an outer one. Each output series
 * of the inner plan is a series here, its GROUP BY tags are the tags and 
 * its columns are the fields.
 * 
 * @since 3.0
 */
public class SubQuerySeriesSource implements SeriesSource {
  private final StatementPlan inner;
  /** Shared so the inner bucket range is resolved once. */
  private final GroupEvaluator evaluator;
  private final Map<TagSet, SeriesGroup> groups;
  private final Map<String, ValueType> field_types;
  private final Set<String> tag_keys;
  
  /** @param inner A non-empty inner plan. */
  public SubQuerySeriesSource(final StatementPlan inner) {
    if (inner == null || inner.isEmpty()) {
      throw new IllegalArgumentException("Inner plan cannot be null or empty.");
    }
    this.inner = inner;
    evaluator = new GroupEvaluator(inner);
    groups = Maps.newHashMap();
    for (final SeriesGroup group : inner.groups()) {
      groups.put(group.tags(), group);
    }
    field_types = new LinkedHashMap<String, ValueType>();
    for (int i = 0; i < inner.columns().size(); i++) {
      field_types.put(inner.columns().get(i), inner.columnTypes().get(i));
    }
    tag_keys = ImmutableSet.copyOf(inner.groupKeys());
  }
  
  @Override
  public String name() {
    return inner.name();
  }

  @Override
  public List<TagSet> series() {
    final List<TagSet> series = 
        Lists.newArrayListWithCapacity(inner.groups().size());
    for (final SeriesGroup group : inner.groups()) {
      series.add(group.tags());
    }
    return series;
  }

  @Override
  public Map<String, ValueType> fieldTypes() {
    return field_types;
  }

  @Override
  public Set<String> tagKeys() {
    return tag_keys;
  }

  @Override
  public CloseableIterator<Row> open(final TagSet series, 
                                     final Collection<String> fields,
                                     final TimeRange range, 
                                     final boolean ascending) {
    final SeriesGroup group = groups.get(series);
    if (group == null) {
      return CloseableIterators.empty();
    }
    final CloseableIterator<Row> rows = 
        new RangeFilter(evaluator.open(group), range);
    if (inner.statement().ascending() == ascending) {
      return rows;
    }
    return CloseableIterators.reverse(rows);
  }
  
  @Override
  public String toString() {
    return "(" + inner.statement() + ")";
  }
  
  /** Drops inner rows outside the outer range. */
  private static class RangeFilter implements CloseableIterator<Row> {
    private final CloseableIterator<Row> source;
    private final TimeRange range;
    private Row next;
    
    RangeFilter(final CloseableIterator<Row> source, final TimeRange range) {
      this.source = source;
      this.range = range;
    }
    
    @Override
    public boolean hasNext() {
      while (next == null && source.hasNext()) {
        final Row row = source.next();
        if (range.contains(row.timestamp())) {
          next = row;
        }
      }
      return next != null;
    }

    @Override
    public Row next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      final Row row = next;
      next = null;
      return row;
    }

    @Override
    public void close() {
      source.close();
    }
  }
}
