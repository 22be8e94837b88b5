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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.Value;
import net.timequery.data.ValueType;

public class TestCloseableIterators {

  @Test
  public void empty() {
    assertFalse(CloseableIterators.empty().hasNext());
  }
  
  @Test
  public void reverse() {
    final ListPointIterator source = new ListPointIterator(ValueType.INTEGER,
        new Point(1, Value.ofLong(1)),
        new Point(2, Value.ofLong(2)),
        new Point(3, Value.ofLong(3)));
    final CloseableIterator<Point> reversed = 
        CloseableIterators.reverse(source);
    assertTrue(source.isClosed());
    
    final List<Long> timestamps = Lists.newArrayList();
    while (reversed.hasNext()) {
      timestamps.add(reversed.next().timestamp());
    }
    assertEquals(Arrays.asList(3L, 2L, 1L), timestamps);
  }
  
  @Test
  public void drainAndCloseAll() {
    final ListPointIterator a = new ListPointIterator(ValueType.INTEGER,
        new Point(1, Value.ofLong(1)));
    final ListPointIterator b = new ListPointIterator(ValueType.INTEGER);
    assertEquals(1, PointIterators.drain(a).size());
    PointIterators.closeAll(Arrays.asList(a, null, b));
    assertTrue(a.isClosed());
    assertTrue(b.isClosed());
    assertFalse(PointIterators.empty(ValueType.FLOAT).hasNext());
  }
  
  @Test
  public void peeking() {
    final PeekingPointIterator it = new PeekingPointIterator(
        new ListPointIterator(ValueType.INTEGER,
            new Point(1, Value.ofLong(1)),
            new Point(2, Value.ofLong(2))));
    assertEquals(1, it.peek().timestamp());
    assertEquals(1, it.next().timestamp());
    assertEquals(2, it.peek().timestamp());
    assertEquals(2, it.next().timestamp());
    assertFalse(it.hasNext());
    assertEquals(ValueType.INTEGER, it.type());
  }
}
