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
package net.timequery.query.processor.downsample;

import java.util.NoSuchElementException;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.PointIterator;

/**
 * Presents each raw point as its own non-empty bucket so window transforms
 * can run directly over a field without GROUP BY time.
 * 
 * @since 3.0
 */
public class RawBucketIterator implements CloseableIterator<Bucket> {
  private final PointIterator source;
  
  public RawBucketIterator(final PointIterator source) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    this.source = source;
  }
  
  @Override
  public boolean hasNext() {
    return source.hasNext();
  }

  @Override
  public Bucket next() {
    if (!source.hasNext()) {
      throw new NoSuchElementException();
    }
    final Point point = source.next();
    return new Bucket(point.timestamp(), point, false);
  }
  
  @Override
  public void close() {
    source.close();
  }
}
