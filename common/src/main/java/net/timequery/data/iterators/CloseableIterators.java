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
package net.timequery.data.iterators;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;

/**
 * Helpers for iterators that own no resources.
 * 
 * @since 3.0
 */
public final class CloseableIterators {
  
  private CloseableIterators() {
    // static helpers
  }
  
  /** @return An exhausted iterator. */
  public static <T> CloseableIterator<T> empty() {
    return wrap(Collections.<T>emptyIterator());
  }
  
  /**
   * @param iterator An iterator without resources.
   * @return The iterator with a no-op close.
   */
  public static <T> CloseableIterator<T> wrap(final Iterator<T> iterator) {
    return new CloseableIterator<T>() {
      @Override
      public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override
      public T next() {
        return iterator.next();
      }

      @Override
      public void close() {
        // nothing to release
      }
    };
  }
  
  /**
   * Drains and closes the source, then iterates the elements in reverse.
   * @param source The source.
   * @return A reversed iterator.
   */
  public static <T> CloseableIterator<T> reverse(final CloseableIterator<T> source) {
    final List<T> elements = Lists.newArrayList();
    try {
      while (source.hasNext()) {
        elements.add(source.next());
      }
    } finally {
      source.close();
    }
    return wrap(Lists.reverse(elements).iterator());
  }
}
