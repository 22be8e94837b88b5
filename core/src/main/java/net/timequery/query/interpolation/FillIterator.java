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
package net.timequery.query.interpolation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Value;
import net.timequery.data.ValueType;
import net.timequery.query.processor.downsample.Bucket;

/**
 * Applies a {@link FillOption} to the empty buckets of a downsampled 
 * stream. Non-empty buckets always pass through untouched.
 * <ul>
 * <li>{@link FillPolicy#NULL} keeps the reducer's own zero-input value.</li>
 * <li>{@link FillPolicy#NONE} drops empty buckets.</li>
 * <li>{@link FillPolicy#PREVIOUS} uses the last non-null value of a 
 * non-empty bucket, or the natural value before there is one.</li>
 * <li>{@link FillPolicy#NUMBER} uses the literal cast to the output type. 
 * Non-numeric outputs keep the natural value.</li>
 * <li>{@link FillPolicy#LINEAR} interpolates between the surrounding 
 * non-empty buckets, holding empties back until the next one arrives. 
 * Leading and trailing empties keep the natural value.</li>
 * </ul>
 * 
 * @since 3.0
 */
public class FillIterator implements CloseableIterator<Bucket> {
  private final CloseableIterator<Bucket> source;
  private final FillOption fill;
  private final ValueType output_type;
  
  /** Previous non-null value for previous and linear fills. */
  private Bucket previous;
  
  /** Buckets ready to emit. */
  private final Deque<Bucket> ready = new ArrayDeque<Bucket>();
  
  /** Empty buckets waiting on the next real value for linear fills. */
  private final Deque<Bucket> gap = new ArrayDeque<Bucket>();
  
  /**
   * @param source A non-null bucket source.
   * @param fill The fill option.
   * @param output_type The reducer output type, may be null.
   */
  public FillIterator(final CloseableIterator<Bucket> source, 
                      final FillOption fill,
                      final ValueType output_type) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    this.source = source;
    this.fill = fill == null ? FillOption.NULL : fill;
    this.output_type = output_type;
  }
  
  @Override
  public boolean hasNext() {
    while (ready.isEmpty()) {
      if (!source.hasNext()) {
        if (gap.isEmpty()) {
          return false;
        }
        // trailing empties have nothing to interpolate towards
        ready.addAll(gap);
        gap.clear();
        break;
      }
      apply(source.next());
    }
    return true;
  }

  @Override
  public Bucket next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return ready.pollFirst();
  }
  
  @Override
  public void close() {
    source.close();
  }
  
  private void apply(final Bucket bucket) {
    if (!bucket.isEmpty()) {
      if (!gap.isEmpty()) {
        interpolateGap(bucket);
      }
      ready.addLast(bucket);
      remember(bucket);
      return;
    }
    
    switch (fill.policy()) {
    case NONE:
      return;
    case PREVIOUS:
      ready.addLast(previous == null ? 
          bucket : bucket.withValue(previous.value()));
      return;
    case NUMBER:
      if (output_type != null && !output_type.isNumeric()) {
        ready.addLast(bucket);
      } else {
        ready.addLast(bucket.withValue(cast(fill.value())));
      }
      return;
    case LINEAR:
      if (previous == null) {
        ready.addLast(bucket);
      } else {
        gap.addLast(bucket);
      }
      return;
    case NULL:
    default:
      ready.addLast(bucket);
    }
  }
  
  private void remember(final Bucket bucket) {
    if (bucket.value() != null) {
      previous = bucket;
    }
  }
  
  private void interpolateGap(final Bucket end) {
    final Value left = previous.value();
    final Value right = end.value();
    while (!gap.isEmpty()) {
      final Bucket empty = gap.pollFirst();
      if (right == null || !left.isNumeric() || !right.isNumeric()) {
        ready.addLast(empty);
        continue;
      }
      final double fraction = (double) (empty.start() - previous.start()) / 
          (double) (end.start() - previous.start());
      final double value = left.toDouble() + 
          (right.toDouble() - left.toDouble()) * fraction;
      ready.addLast(empty.withValue(
          left.isInteger() && right.isInteger() ? 
              Value.ofLong((long) value) : Value.ofDouble(value)));
    }
  }
  
  private Value cast(final Value value) {
    if (output_type == ValueType.INTEGER && !value.isInteger()) {
      return Value.ofLong(value.longValue());
    }
    if (output_type == ValueType.FLOAT && value.isInteger()) {
      return Value.ofDouble(value.toDouble());
    }
    return value;
  }
}
