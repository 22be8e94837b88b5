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

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import net.timequery.data.CloseableIterator;
import net.timequery.data.iterators.PointIterators;
import net.timequery.query.QueryContext;

/**
 * A k-way merge of sorted iterators. Elements that compare equal are 
 * emitted in source order so the output is stable across executions. The
 * query context is checked for cancellation on every call to 
 * {@link #next()}.
 * 
 * @param <T> The element type.
 * 
 * @since 3.0
 */
public class SortedMergeIterator<T> implements CloseableIterator<T> {
  private final List<CloseableIterator<T>> sources;
  private final Comparator<? super T> comparator;
  private final QueryContext context;
  private final PriorityQueue<Head> heads;
  private boolean initialized;
  private boolean closed;
  
  /**
   * @param sources The sorted sources, owned by this iterator.
   * @param comparator The order of every source.
   * @param context The query context.
   */
  public SortedMergeIterator(final List<? extends CloseableIterator<T>> sources,
                             final Comparator<? super T> comparator,
                             final QueryContext context) {
    if (sources == null) {
      throw new IllegalArgumentException("Sources cannot be null.");
    }
    if (comparator == null) {
      throw new IllegalArgumentException("Comparator cannot be null.");
    }
    this.sources = ImmutableList.copyOf(sources);
    this.comparator = comparator;
    this.context = context == null ? QueryContext.unlimited() : context;
    heads = new PriorityQueue<Head>(Math.max(1, sources.size()));
  }
  
  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    if (!initialized) {
      initialized = true;
      for (int i = 0; i < sources.size(); i++) {
        advance(i);
      }
    }
    return !heads.isEmpty();
  }

  @Override
  public T next() {
    context.checkCancelled();
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Head head = heads.poll();
    advance(head.source);
    return head.value;
  }
  
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    heads.clear();
    PointIterators.closeAll(sources);
  }
  
  private void advance(final int source) {
    final CloseableIterator<T> iterator = sources.get(source);
    if (iterator.hasNext()) {
      heads.add(new Head(iterator.next(), source));
    }
  }
  
  /** The current element of one source. */
  private class Head implements Comparable<Head> {
    private final T value;
    private final int source;
    
    Head(final T value, final int source) {
      this.value = value;
      this.source = source;
    }
    
    @Override
    public int compareTo(final Head other) {
      return ComparisonChain.start()
          .compare(value, other.value, comparator)
          .compare(source, other.source)
          .result();
    }
  }
}
