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

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.data.iterators.PeekingPointIterator;
import net.timequery.data.iterators.PointIterators;

/**
 * Joins the per-field point streams of one series into rows by timestamp.
 * A field without a point at a row's timestamp is absent from that row. 
 * The row sequence is the highest sequence among its points.
 * 
 * @since 3.0
 */
public class FieldZipIterator implements CloseableIterator<Row> {
  private final TagSet tags;
  private final List<String> fields;
  private final List<PeekingPointIterator> sources;
  private final boolean ascending;
  
  /**
   * @param tags The series tags.
   * @param fields The field names, parallel to the sources.
   * @param sources The sources, all in the same direction.
   * @param ascending The direction.
   */
  public FieldZipIterator(final TagSet tags, 
                          final List<String> fields, 
                          final List<PointIterator> sources, 
                          final boolean ascending) {
    if (fields.size() != sources.size()) {
      throw new IllegalArgumentException("Fields and sources must be the "
          + "same size.");
    }
    this.tags = tags;
    this.fields = fields;
    this.sources = Lists.newArrayListWithCapacity(sources.size());
    for (final PointIterator source : sources) {
      this.sources.add(new PeekingPointIterator(source));
    }
    this.ascending = ascending;
  }
  
  @Override
  public boolean hasNext() {
    for (final PeekingPointIterator source : sources) {
      if (source.hasNext()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Row next() {
    boolean found = false;
    long timestamp = 0;
    for (final PeekingPointIterator source : sources) {
      if (!source.hasNext()) {
        continue;
      }
      final long ts = source.peek().timestamp();
      if (!found || (ascending ? ts < timestamp : ts > timestamp)) {
        timestamp = ts;
        found = true;
      }
    }
    if (!found) {
      throw new NoSuchElementException();
    }
    
    long sequence = 0;
    final Map<String, Value> values = Maps.newHashMap();
    for (int i = 0; i < sources.size(); i++) {
      final PeekingPointIterator source = sources.get(i);
      if (source.hasNext() && source.peek().timestamp() == timestamp) {
        final Point point = source.next();
        sequence = Math.max(sequence, point.sequence());
        if (point.value() != null) {
          values.put(fields.get(i), point.value());
        }
      }
    }
    return new Row(timestamp, sequence, tags, values);
  }
  
  @Override
  public void close() {
    PointIterators.closeAll(sources);
  }
}
