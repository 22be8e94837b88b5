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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.data.ValueType;
import net.timequery.data.iterators.CloseableIterators;
import net.timequery.data.iterators.ListPointIterator;
import net.timequery.exceptions.QueryCancelledException;
import net.timequery.query.QueryContext;

public class TestSortedMergeIterator {
  
  @Test
  public void ctor() {
    try {
      new SortedMergeIterator<Point>(null, PointOrder.ASCENDING, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new SortedMergeIterator<Point>(
          Lists.<CloseableIterator<Point>>newArrayList(), null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    final SortedMergeIterator<Point> empty = new SortedMergeIterator<Point>(
        Lists.<CloseableIterator<Point>>newArrayList(), PointOrder.ASCENDING, 
        null);
    assertFalse(empty.hasNext());
  }
  
  @Test
  public void mergeAscending() {
    final SortedMergeIterator<Point> it = new SortedMergeIterator<Point>(
        ImmutableList.of(
            points(new Point(1, Value.ofLong(1), 1), 
                   new Point(4, Value.ofLong(4), 4)),
            points(new Point(2, Value.ofLong(2), 2), 
                   new Point(3, Value.ofLong(3), 3))), 
        PointOrder.ASCENDING, QueryContext.unlimited());
    final List<Long> timestamps = Lists.newArrayList();
    while (it.hasNext()) {
      timestamps.add(it.next().timestamp());
    }
    assertEquals(ImmutableList.of(1L, 2L, 3L, 4L), timestamps);
  }
  
  @Test
  public void mergeDescending() {
    final SortedMergeIterator<Point> it = new SortedMergeIterator<Point>(
        ImmutableList.of(
            points(new Point(4, Value.ofLong(4), 1), 
                   new Point(1, Value.ofLong(1), 2)),
            points(new Point(3, Value.ofLong(3), 3))), 
        PointOrder.DESCENDING, QueryContext.unlimited());
    assertEquals(4, it.next().timestamp());
    assertEquals(3, it.next().timestamp());
    assertEquals(1, it.next().timestamp());
    assertFalse(it.hasNext());
  }
  
  @Test
  public void tiesKeepSourceOrder() {
    final Row a = new Row(1, 0, TagSet.EMPTY, 
        ImmutableMap.of("v", Value.ofLong(1)));
    final Row b = new Row(1, 0, TagSet.EMPTY, 
        ImmutableMap.of("v", Value.ofLong(2)));
    final SortedMergeIterator<Row> it = new SortedMergeIterator<Row>(
        ImmutableList.of(
            CloseableIterators.wrap(ImmutableList.of(b).iterator()),
            CloseableIterators.wrap(ImmutableList.of(a).iterator())), 
        PointOrder.ROWS_ASCENDING, null);
    assertEquals(Value.ofLong(2), it.next().get("v"));
    assertEquals(Value.ofLong(1), it.next().get("v"));
  }
  
  @Test
  public void rowsOrderByTagsAfterTime() {
    final Row web02 = new Row(1, 0, TagSet.of("host", "web02"), null);
    final Row web01 = new Row(1, 0, TagSet.of("host", "web01"), null);
    final Row later = new Row(2, 0, TagSet.of("host", "web01"), null);
    assertTrue(PointOrder.rows(true).compare(web01, web02) < 0);
    assertTrue(PointOrder.rows(true).compare(later, web02) > 0);
    assertTrue(PointOrder.rows(false).compare(later, web02) < 0);
    assertTrue(PointOrder.points(false).compare(
        new Point(1, null, 1), new Point(1, null, 2)) < 0);
  }
  
  @Test
  public void cancelled() {
    final QueryContext context = QueryContext.unlimited();
    final SortedMergeIterator<Point> it = new SortedMergeIterator<Point>(
        ImmutableList.of(points(new Point(1, Value.ofLong(1)))), 
        PointOrder.ASCENDING, context);
    context.cancel("stop");
    try {
      it.next();
      fail("Expected QueryCancelledException");
    } catch (QueryCancelledException e) { }
  }
  
  @Test
  public void closeClosesSources() {
    final ListPointIterator a = points(new Point(1, Value.ofLong(1)));
    final ListPointIterator b = points(new Point(2, Value.ofLong(1)));
    final SortedMergeIterator<Point> it = new SortedMergeIterator<Point>(
        ImmutableList.of(a, b), PointOrder.ASCENDING, null);
    assertTrue(it.hasNext());
    it.close();
    assertTrue(a.isClosed());
    assertTrue(b.isClosed());
    assertFalse(it.hasNext());
    // idempotent
    it.close();
  }
  
  @Test
  public void limitOffset() {
    final ListPointIterator source = points(
        new Point(1, Value.ofLong(1)), new Point(2, Value.ofLong(2)), 
        new Point(3, Value.ofLong(3)), new Point(4, Value.ofLong(4)));
    final LimitOffsetIterator<Point> it = 
        new LimitOffsetIterator<Point>(source, 2, 1);
    assertEquals(2, it.next().timestamp());
    assertEquals(3, it.next().timestamp());
    assertFalse(it.hasNext());
    assertTrue(source.isClosed());
    
    LimitOffsetIterator<Point> unlimited = new LimitOffsetIterator<Point>(
        points(new Point(1, Value.ofLong(1)), new Point(2, Value.ofLong(2))), 
        0, 0);
    assertEquals(1, unlimited.next().timestamp());
    assertEquals(2, unlimited.next().timestamp());
    assertFalse(unlimited.hasNext());
    
    unlimited = new LimitOffsetIterator<Point>(
        points(new Point(1, Value.ofLong(1))), 0, 5);
    assertFalse(unlimited.hasNext());
  }
  
  @Test
  public void fieldZip() {
    final List<PointIterator> sources = Lists.newArrayList();
    sources.add(points(new Point(1, Value.ofLong(1), 5), 
        new Point(3, Value.ofLong(3), 7)));
    sources.add(points(new Point(1, Value.ofDouble(0.5), 6), 
        new Point(2, Value.ofDouble(1.5), 8)));
    final FieldZipIterator it = new FieldZipIterator(TagSet.of("host", "a"), 
        ImmutableList.of("a", "b"), sources, true);
    
    Row row = it.next();
    assertEquals(1, row.timestamp());
    assertEquals(6, row.sequence());
    assertEquals(Value.ofLong(1), row.get("a"));
    assertEquals(Value.ofDouble(0.5), row.get("b"));
    assertEquals("a", row.tags().get("host"));
    
    row = it.next();
    assertEquals(2, row.timestamp());
    assertFalse(row.has("a"));
    assertEquals(Value.ofDouble(1.5), row.get("b"));
    
    row = it.next();
    assertEquals(3, row.timestamp());
    assertEquals(Value.ofLong(3), row.get("a"));
    assertFalse(it.hasNext());
    it.close();
    
    try {
      new FieldZipIterator(TagSet.EMPTY, ImmutableList.of("a"), 
          Lists.<PointIterator>newArrayList(), true);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  static ListPointIterator points(final Point... points) {
    return new ListPointIterator(ValueType.INTEGER, points);
  }
}
