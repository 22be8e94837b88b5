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
package net.timequery.query.processor.topn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.data.ValueType;
import net.timequery.exceptions.TypeMismatchException;

public class TestTopBottomSelector {
  
  @Test
  public void ctor() {
    final TopBottomSelector selector = new TopBottomSelector(true, 2, null);
    assertTrue(selector.isTop());
    assertEquals(2, selector.n());
    assertTrue(selector.groupTags().isEmpty());
    
    try {
      new TopBottomSelector(true, 0, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void top() {
    final TopBottomSelector selector = new TopBottomSelector(true, 2, null);
    final List<Point> selected = selector.select(points(
        point(1, 5, TagSet.EMPTY), 
        point(2, 9, TagSet.EMPTY), 
        point(3, 1, TagSet.EMPTY), 
        point(4, 7, TagSet.EMPTY)));
    assertEquals(2, selected.size());
    // time ordered, not rank ordered
    assertEquals(2, selected.get(0).timestamp());
    assertEquals(4, selected.get(1).timestamp());
  }
  
  @Test
  public void bottom() {
    final TopBottomSelector selector = new TopBottomSelector(false, 2, null);
    final List<Point> ranked = selector.rank(points(
        point(1, 5, TagSet.EMPTY), 
        point(2, 9, TagSet.EMPTY), 
        point(3, 1, TagSet.EMPTY), 
        point(4, 7, TagSet.EMPTY)));
    assertEquals(2, ranked.size());
    assertEquals(Value.ofLong(1), ranked.get(0).value());
    assertEquals(Value.ofLong(5), ranked.get(1).value());
  }
  
  @Test
  public void tiesGoToTheEarliestPoint() {
    final TopBottomSelector selector = new TopBottomSelector(true, 1, null);
    List<Point> ranked = selector.rank(points(
        point(5, 9, TagSet.EMPTY), 
        point(2, 9, TagSet.EMPTY)));
    assertEquals(2, ranked.get(0).timestamp());
    
    // same time, input order wins
    ranked = selector.rank(points(
        new Point(2, Value.ofLong(9), 7), 
        new Point(2, Value.ofLong(9), 3)));
    assertEquals(7, ranked.get(0).sequence());
  }
  
  @Test
  public void mixedNumericTypes() {
    final TopBottomSelector selector = new TopBottomSelector(true, 1, null);
    final List<Point> ranked = selector.rank(points(
        point(1, 5, TagSet.EMPTY), 
        new Point(2, Value.ofDouble(5.5))));
    assertEquals(Value.ofDouble(5.5), ranked.get(0).value());
  }
  
  @Test
  public void nullsAreIgnored() {
    final TopBottomSelector selector = new TopBottomSelector(false, 3, null);
    final List<Point> selected = selector.select(points(
        new Point(1, null), 
        point(2, 4, TagSet.EMPTY)));
    assertEquals(1, selected.size());
    assertEquals(2, selected.get(0).timestamp());
    
    assertTrue(selector.select(Collections.<Point>emptyList()).isEmpty());
  }
  
  @Test
  public void groupTagsAllowOnePointPerCombination() {
    final TopBottomSelector selector = new TopBottomSelector(true, 2, 
        ImmutableList.of("host"));
    final List<Point> selected = selector.select(points(
        point(1, 10, TagSet.of("host", "a")), 
        point(2, 9, TagSet.of("host", "a")), 
        point(3, 8, TagSet.of("host", "b")), 
        point(4, 1, TagSet.of("host", "c"))));
    assertEquals(2, selected.size());
    assertEquals(1, selected.get(0).timestamp());
    assertEquals("a", selected.get(0).tags().get("host"));
    assertEquals(3, selected.get(1).timestamp());
    assertEquals("b", selected.get(1).tags().get("host"));
  }
  
  @Test
  public void reducer() {
    final TopBottomReducer reducer = new TopBottomReducer(ValueType.INTEGER, 
        new TopBottomSelector(true, 2, null));
    assertEquals("top", reducer.name());
    assertTrue(reducer.isSelector());
    
    List<Point> emitted = reducer.emit(100);
    assertEquals(1, emitted.size());
    assertEquals(100, emitted.get(0).timestamp());
    assertNull(emitted.get(0).value());
    
    reducer.add(point(10, 3, TagSet.EMPTY));
    reducer.add(point(20, 6, TagSet.EMPTY));
    reducer.add(new Point(25, null));
    reducer.add(point(30, 4, TagSet.EMPTY));
    assertEquals(3, reducer.count());
    emitted = reducer.emit(0);
    assertEquals(2, emitted.size());
    assertEquals(20, emitted.get(0).timestamp());
    assertEquals(30, emitted.get(1).timestamp());
    
    reducer.reset();
    assertEquals(0, reducer.count());
    
    try {
      new TopBottomReducer(ValueType.STRING, 
          new TopBottomSelector(false, 1, null));
      fail("Expected TypeMismatchException");
    } catch (TypeMismatchException e) {
      assertEquals("unsupported bottom iterator type: string", e.getMessage());
    }
  }
  
  static Point point(final long ts, final long value, final TagSet tags) {
    return new Point(ts, Value.ofLong(value), 0, tags, null);
  }
  
  static List<Point> points(final Point... points) {
    return Lists.newArrayList(points);
  }
}
