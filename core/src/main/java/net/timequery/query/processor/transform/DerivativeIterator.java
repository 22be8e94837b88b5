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
 * Rate of change per unit between consecutive inputs:
 * {@code (v[i] - v[i-1]) / ((t[i] - t[i-1]) / unit)}. The non-negative 
 * variant suppresses negative rates.
 * 
 * @since 3.0
 */
public class DerivativeIterator extends TransformIterator {
  private final long unit;
  private final boolean non_negative;
  private Point previous;
  
  public DerivativeIterator(final CloseableIterator<Bucket> source, 
                            final long emit_from,
                            final long unit, 
                            final boolean non_negative) {
    super(source, emit_from);
    if (unit <= 0) {
      throw new IllegalArgumentException("Unit must be greater than 0.");
    }
    this.unit = unit;
    this.non_negative = non_negative;
  }

  @Override
  protected boolean transform(final Point input) {
    final Point prev = previous;
    previous = input;
    if (prev == null || input.timestamp() == prev.timestamp()) {
      return false;
    }
    if (input.isNull() || prev.isNull()) {
      return emit(null);
    }
    final double elapsed = (double) (input.timestamp() - prev.timestamp()) / 
        (double) unit;
    final double rate = (input.value().toDouble() - prev.value().toDouble()) 
        / elapsed;
    if (non_negative && rate < 0) {
      return false;
    }
    return emit(Value.ofDouble(rate));
  }
}
