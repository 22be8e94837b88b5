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
 * Running total from the first input. A null input emits null and leaves 
 * the total unchanged.
 * 
 * @since 3.0
 */
public class CumulativeSumIterator extends TransformIterator {
  private long long_total;
  private double double_total;
  private boolean floating;
  
  public CumulativeSumIterator(final CloseableIterator<Bucket> source, 
                               final long emit_from) {
    super(source, emit_from);
  }

  @Override
  protected boolean transform(final Point input) {
    if (input.isNull()) {
      return emit(null);
    }
    final Value value = input.value();
    if (!value.isInteger()) {
      floating = true;
    } else {
      long_total += value.longValue();
    }
    double_total += value.toDouble();
    return emit(floating ? Value.ofDouble(double_total) : 
      Value.ofLong(long_total));
  }
}
