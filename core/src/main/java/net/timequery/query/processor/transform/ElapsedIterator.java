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

/** Time between consecutive inputs in whole units. */
public class ElapsedIterator extends TransformIterator {
  private final long unit;
  private Point previous;
  
  public ElapsedIterator(final CloseableIterator<Bucket> source, 
                         final long emit_from,
                         final long unit) {
    super(source, emit_from);
    if (unit <= 0) {
      throw new IllegalArgumentException("Unit must be greater than 0.");
    }
    this.unit = unit;
  }

  @Override
  protected boolean transform(final Point input) {
    final Point prev = previous;
    previous = input;
    if (prev == null) {
      return false;
    }
    if (input.isNull()) {
      return emit(null);
    }
    return emit(Value.ofLong(
        (input.timestamp() - prev.timestamp()) / unit));
  }
}
