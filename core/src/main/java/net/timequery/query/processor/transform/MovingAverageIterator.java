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
package net.timequery.query.processor.transform;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.query.processor.downsample.Bucket;

/**
 * Mean of the last N inputs. Nothing is emitted until N inputs were seen 
 * and the result is null while the window holds a null.
 * 
 * @since 3.0
 */
public class MovingAverageIterator extends TransformIterator {
  /** Circular window of the last N input values, nulls included. */
  private final Value[] window;
  private int head;
  private int size;
  private int nulls;
  private double sum;
  
  public MovingAverageIterator(final CloseableIterator<Bucket> source, 
                               final long emit_from,
                               final int n) {
    super(source, emit_from);
    if (n < 1) {
      throw new IllegalArgumentException("N must be greater than 0: " + n);
    }
    window = new Value[n];
  }

  @Override
  protected boolean transform(final Point input) {
    if (size == window.length) {
      remove(window[head]);
    } else {
      size++;
    }
    final Value value = input.value();
    window[head] = value;
    head = (head + 1) % window.length;
    if (value == null) {
      nulls++;
    } else {
      sum += value.toDouble();
    }
    
    if (size < window.length) {
      return false;
    }
    if (nulls > 0) {
      return emit(null);
    }
    return emit(Value.ofDouble(sum / window.length));
  }
  
  private void remove(final Value value) {
    if (value == null) {
      nulls--;
    } else {
      sum -= value.toDouble();
    }
  }
}
