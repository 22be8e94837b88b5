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
package net.timequery.data;

/**
 * A forward only, finite and non-restartable stream of points. Every stage
 * of the engine consumes and produces these. Within one series timestamps 
 * are non-decreasing unless the stream was opened in descending order.
 * <p>
 * An exhausted iterator keeps returning false from {@link #hasNext()}; that
 * is not an error. Implementations that own upstream iterators must close 
 * them from {@link #close()}, which may be called before exhaustion.
 * 
 * @since 3.0
 */
public interface PointIterator extends CloseableIterator<Point> {

  /**
   * The declared type of the non-null values in this stream. Used to reject
   * incompatible functions when the iterator tree is built.
   * @return The type or null if it can't be known up front, e.g. an all null
   * stream.
   */
  public ValueType type();
  
}
