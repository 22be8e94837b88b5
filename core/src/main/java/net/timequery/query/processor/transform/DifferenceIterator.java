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
 * Difference between consecutive inputs, integers stay integers. The 
 * non-negative variant suppresses negative differences.
 * 
 * @since 3.0
 */
public class DifferenceIterator extends TransformIterator {
  private final boolean non_negative;
  private Point previous;
  
  public DifferenceIterator(final CloseableIterator<Bucket> source, 
                            final long emit_from,
                            final boolean non_negative) {
    super(source, emit_from);
    this.non_negative = non_negative;
  }

  @Override
  protected boolean transform(final Point input) {
    final Point prev = previous;
    previous = input;
    if (prev == null) {
      return false;
    }
    if (input.isNull() || prev.isNull()) {
      return emit(null);
    }
    final Value diff;
    if (input.value().isInteger() && prev.value().isInteger()) {
      diff = Value.ofLong(input.value().longValue() - prev.value().longValue());
    } else {
      diff = Value.ofDouble(input.value().toDouble() - prev.value().toDouble());
    }
    if (non_negative && diff.toDouble() < 0) {
      return false;
    }
    return emit(diff);
  }
}
