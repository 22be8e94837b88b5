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
package net.timequery.query.processor.merge;

import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;

/**
 * Skips the first {@code offset} elements and stops after {@code limit}.
 * The source is closed as soon as the limit is reached.
 * 
 * @param <T> The element type.
 * 
 * @since 3.0
 */
public class LimitOffsetIterator<T> implements CloseableIterator<T> {
  private final CloseableIterator<T> source;
  private final int limit;
  private int to_skip;
  private int emitted;
  private boolean closed;
  
  /**
   * @param source The source.
   * @param limit The max elements, 0 for no limit.
   * @param offset The number of elements to skip.
   */
  public LimitOffsetIterator(final CloseableIterator<T> source, 
                             final int limit, 
                             final int offset) {
    this.source = source;
    this.limit = limit;
    to_skip = offset;
  }
  
  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    if (limit > 0 && emitted >= limit) {
      close();
      return false;
    }
    while (to_skip > 0 && source.hasNext()) {
      source.next();
      to_skip--;
    }
    return source.hasNext();
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    emitted++;
    return source.next();
  }
  
  @Override
  public void close() {
    if (!closed) {
      closed = true;
      source.close();
    }
  }
}
