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

import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.query.processor.downsample.Bucket;

/**
 * Base for window transforms over an ordered sequence of bucket outputs.
 * Each input bucket is handed to {@link #transform(Point)} in order. An
 * input yields an output only when the transform calls 
 * {@link #emit(Value)}; outputs timestamped before {@code emit_from} are
 * consumed as look-back only and not emitted.
 * 
 * @since 3.0
 */
public abstract class TransformIterator implements CloseableIterator<Bucket> {
  protected final CloseableIterator<Bucket> source;
  protected final long emit_from;
  private Bucket next;
  
  /** The output of the current input, may be null. */
  private Value output;
  
  /**
   * @param source A non-null ascending bucket source.
   * @param emit_from The first timestamp to emit, {@link Long#MIN_VALUE}
   * to emit everything.
   */
  protected TransformIterator(final CloseableIterator<Bucket> source, 
                              final long emit_from) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    this.source = source;
    this.emit_from = emit_from;
  }
  
  @Override
  public boolean hasNext() {
    while (next == null && source.hasNext()) {
      final Point input = source.next().first();
      output = null;
      if (transform(input) && input.timestamp() >= emit_from) {
        next = new Bucket(input.timestamp(), 
            new Point(input.timestamp(), output, input.sequence(), 
                input.tags(), null), false);
      }
    }
    return next != null;
  }

  @Override
  public Bucket next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Bucket result = next;
    next = null;
    return result;
  }
  
  @Override
  public void close() {
    source.close();
  }
  
  /**
   * Records the output for the current input.
   * @param value The output, null to emit a null.
   * @return True, for {@code return emit(value);}.
   */
  protected boolean emit(final Value value) {
    output = value;
    return true;
  }
  
  /**
   * @param input The next input point, its value may be null.
   * @return Whether the input produced an output through 
   * {@link #emit(Value)}.
   */
  protected abstract boolean transform(final Point input);
  
}
