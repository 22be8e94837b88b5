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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;
import net.timequery.data.PointIterator;
import net.timequery.data.Row;
import net.timequery.data.SeriesKey;
import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;
import net.timequery.data.iterators.CloseableIterators;
import net.timequery.query.processor.merge.FieldZipIterator;
import net.timequery.query.processor.merge.ShardScanner;
import net.timequery.storage.SchemaCatalog;
import net.timequery.storage.ShardReader;

/**
 * Reads a stored measurement. Each requested field of a series is scanned
 * across the shards and the field streams are zipped into rows.
 * 
 * @since 3.0
 */
public class MeasurementSeriesSource implements SeriesSource {
  private final SchemaCatalog catalog;
  private final String database;
  private final String retention_policy;
  private final String measurement;
  private final ShardScanner scanner;
  private final Map<String, ValueType> field_types;
  private final Set<String> tag_keys;
  
  /**
   * @param catalog The catalog.
   * @param database The database.
   * @param retention_policy The resolved retention policy.
   * @param measurement The measurement.
   * @param scanner The shard scanner for this query.
   */
  public MeasurementSeriesSource(final SchemaCatalog catalog,
                                 final String database, 
                                 final String retention_policy,
                                 final String measurement,
                                 final ShardScanner scanner) {
    this.catalog = catalog;
    this.database = database;
    this.retention_policy = retention_policy;
    this.measurement = measurement;
    this.scanner = scanner;
    field_types = catalog.fields(database, retention_policy, measurement);
    tag_keys = catalog.tagKeys(database, retention_policy, measurement);
  }
  
  @Override
  public String name() {
    return measurement;
  }

  @Override
  public List<TagSet> series() {
    final List<TagSet> series = Lists.newArrayList(
        catalog.series(database, retention_policy, measurement));
    Collections.sort(series);
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
    final List<String> present = Lists.newArrayList();
    for (final String field : fields) {
      if (field_types.containsKey(field)) {
        present.add(field);
      }
    }
    if (present.isEmpty()) {
      return CloseableIterators.empty();
    }
    
    final List<ShardReader> shards = 
        catalog.shards(database, retention_policy, range);
    final List<PointIterator> iterators = 
        Lists.newArrayListWithCapacity(present.size());
    for (final String field : present) {
      iterators.add(scanner.scan(shards, 
          new SeriesKey(measurement, series, field), range, ascending, 
          field_types.get(field)));
    }
    return new FieldZipIterator(series, present, iterators, ascending);
  }
  
  @Override
  public String toString() {
    return database + "." + retention_policy + "." + measurement;
  }
}
