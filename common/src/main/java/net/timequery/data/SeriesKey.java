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

import java.util.Objects;

import com.google.common.collect.ComparisonChain;

/**
 * Identifies one ordered point stream: a measurement, its tags and a field.
 * 
 * @since 3.0
 */
public final class SeriesKey implements Comparable<SeriesKey> {
  
  private final String measurement;
  private final TagSet tags;
  private final String field;
  
  public SeriesKey(final String measurement, 
                   final TagSet tags, 
                   final String field) {
    if (measurement == null || measurement.isEmpty()) {
      throw new IllegalArgumentException("Measurement cannot be null or empty.");
    }
    if (field == null || field.isEmpty()) {
      throw new IllegalArgumentException("Field cannot be null or empty.");
    }
    this.measurement = measurement;
    this.tags = tags == null ? TagSet.EMPTY : tags;
    this.field = field;
  }
  
  public String measurement() {
    return measurement;
  }
  
  public TagSet tags() {
    return tags;
  }
  
  public String field() {
    return field;
  }
  
  @Override
  public int compareTo(final SeriesKey other) {
    return ComparisonChain.start()
        .compare(measurement, other.measurement)
        .compare(tags, other.tags)
        .compare(field, other.field)
        .result();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesKey)) {
      return false;
    }
    final SeriesKey other = (SeriesKey) o;
    return measurement.equals(other.measurement) 
        && tags.equals(other.tags) 
        && field.equals(other.field);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(measurement, tags, field);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append(measurement)
        .append(tags.isEmpty() ? "" : ",")
        .append(tags)
        .append(' ')
        .append(field)
        .toString();
  }
}
