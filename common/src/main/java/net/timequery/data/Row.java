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
package net.timequery.data;

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Maps;

/**
 * A row of named values sharing one timestamp and series. Rows feed raw
 * selections, WHERE filters and subquery composition where an inner
 * statement's output columns become the outer statement's fields.
 * 
 * @since 3.0
 */
public final class Row {
  
  private final long timestamp;
  private final long sequence;
  private final TagSet tags;
  private final Map<String, Value> values;
  
  /**
   * Default ctor.
   * @param timestamp Epoch nanoseconds.
   * @param sequence The write sequence of the newest contributing point.
   * @param tags The series tags.
   * @param values Column values keyed by name. Null values may be absent.
   */
  public Row(final long timestamp, 
             final long sequence, 
             final TagSet tags, 
             final Map<String, Value> values) {
    this.timestamp = timestamp;
    this.sequence = sequence;
    this.tags = tags == null ? TagSet.EMPTY : tags;
    this.values = values == null ? Collections.<String, Value>emptyMap() : 
      Collections.unmodifiableMap(values);
  }
  
  public long timestamp() {
    return timestamp;
  }
  
  public long sequence() {
    return sequence;
  }
  
  public TagSet tags() {
    return tags;
  }
  
  /** @return The value for the column, null if missing or null. */
  public Value get(final String column) {
    return values.get(column);
  }
  
  public boolean has(final String column) {
    return values.get(column) != null;
  }
  
  public Map<String, Value> values() {
    return values;
  }
  
  /** @return A copy of this row with the tags replaced. */
  public Row withTags(final TagSet tags) {
    return new Row(timestamp, sequence, tags, Maps.newHashMap(values));
  }
  
  @Override
  public String toString() {
    return "Row{ts=" + timestamp + ", tags=" + tags + ", values=" + values + "}";
  }
}
