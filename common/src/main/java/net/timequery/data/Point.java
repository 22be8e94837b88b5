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

import java.util.Arrays;

/**
 * An immutable observation: a nanosecond timestamp and a value that may be
 * null. Points also carry the write sequence assigned by storage (used to 
 * break timestamp ties deterministically), the tags of the series they came
 * from and, for selectors, auxiliary values resolved from the same row.
 * 
 * @since 3.0
 */
public final class Point {
  private static final Value[] NO_AUX = new Value[0];
  
  /** Epoch nanoseconds. */
  private final long timestamp;
  
  /** The value, null for empty buckets. */
  private final Value value;
  
  /** The storage write sequence. */
  private final long sequence;
  
  /** The tags of the source series. */
  private final TagSet tags;
  
  /** Auxiliary values from the same row. */
  private final Value[] aux;
  
  public Point(final long timestamp, final Value value) {
    this(timestamp, value, 0, TagSet.EMPTY, NO_AUX);
  }
  
  public Point(final long timestamp, final Value value, final long sequence) {
    this(timestamp, value, sequence, TagSet.EMPTY, NO_AUX);
  }
  
  public Point(final long timestamp, 
               final Value value, 
               final long sequence,
               final TagSet tags, 
               final Value[] aux) {
    this.timestamp = timestamp;
    this.value = value;
    this.sequence = sequence;
    this.tags = tags == null ? TagSet.EMPTY : tags;
    this.aux = aux == null ? NO_AUX : aux;
  }
  
  public long timestamp() {
    return timestamp;
  }
  
  /** @return The value, possibly null. */
  public Value value() {
    return value;
  }
  
  public boolean isNull() {
    return value == null;
  }
  
  public long sequence() {
    return sequence;
  }
  
  public TagSet tags() {
    return tags;
  }
  
  /** @return The auxiliary values. Callers must not modify the array. */
  public Value[] aux() {
    return aux;
  }
  
  public Point withTimestamp(final long timestamp) {
    if (timestamp == this.timestamp) {
      return this;
    }
    return new Point(timestamp, value, sequence, tags, aux);
  }
  
  public Point withValue(final Value value) {
    return new Point(timestamp, value, sequence, tags, aux);
  }
  
  public Point withAux(final Value[] aux) {
    return new Point(timestamp, value, sequence, tags, aux);
  }
  
  public Point withTags(final TagSet tags) {
    return new Point(timestamp, value, sequence, tags, aux);
  }
  
  /** A null valued point at the given time. */
  public static Point nullAt(final long timestamp) {
    return new Point(timestamp, null);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Point)) {
      return false;
    }
    final Point other = (Point) o;
    return timestamp == other.timestamp
        && (value == null ? other.value == null : value.equals(other.value))
        && Arrays.equals(aux, other.aux);
  }
  
  @Override
  public int hashCode() {
    return Long.hashCode(timestamp) * 31 + (value == null ? 0 : value.hashCode());
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("Point{ts=").append(timestamp)
        .append(", value=").append(value)
        .append(", seq=").append(sequence);
    if (!tags.isEmpty()) {
      buf.append(", tags=").append(tags);
    }
    if (aux.length > 0) {
      buf.append(", aux=").append(Arrays.toString(aux));
    }
    return buf.append('}').toString();
  }
}
