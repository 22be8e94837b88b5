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
package net.timequery.storage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.timequery.data.Point;
import net.timequery.data.SeriesKey;
import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.Value;
import net.timequery.data.ValueType;
import net.timequery.data.iterators.PointIterators;
import net.timequery.utils.DateTime;

public class TestMockDataStore {
  private static final long HOUR = DateTime.seconds(3600);
  
  private MockDataStore store;
  
  @Before
  public void before() throws Exception {
    store = new MockDataStore(HOUR);
  }
  
  @Test
  public void ctor() throws Exception {
    assertEquals(0, new MockDataStore().writes());
    try {
      new MockDataStore(0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void schema() throws Exception {
    assertFalse(store.databaseExists("db"));
    assertNull(store.defaultRetentionPolicy("db"));
    
    store.write("db", "cpu", TagSet.of("host", "web01", "dc", "lga"), 
        ImmutableMap.<String, Object>of("value", 1L, "idle", 0.5), 0);
    store.write("db", "cpu", TagSet.of("host", "web02"), 
        ImmutableMap.<String, Object>of("value", 2L, "note", "hi"), 1);
    
    assertTrue(store.databaseExists("db"));
    assertEquals(MockDataStore.DEFAULT_RP, store.defaultRetentionPolicy("db"));
    assertTrue(store.retentionPolicyExists("db", MockDataStore.DEFAULT_RP));
    assertFalse(store.retentionPolicyExists("db", "other"));
    assertTrue(store.measurementExists("db", MockDataStore.DEFAULT_RP, "cpu"));
    assertFalse(store.measurementExists("db", MockDataStore.DEFAULT_RP, "mem"));
    
    assertEquals(ImmutableMap.of("idle", ValueType.FLOAT, 
        "note", ValueType.STRING, "value", ValueType.INTEGER), 
        store.fields("db", MockDataStore.DEFAULT_RP, "cpu"));
    assertEquals(ImmutableSet.of("dc", "host"), 
        store.tagKeys("db", MockDataStore.DEFAULT_RP, "cpu"));
    assertEquals(ImmutableList.of(TagSet.of("host", "web01", "dc", "lga"), 
        TagSet.of("host", "web02")), 
        sorted(store.series("db", MockDataStore.DEFAULT_RP, "cpu")));
    assertTrue(store.fields("db", MockDataStore.DEFAULT_RP, "mem").isEmpty());
    assertTrue(store.tagKeys("nope", null, "cpu").isEmpty());
    assertEquals(4, store.writes());
  }
  
  @Test
  public void fieldTypeConflict() throws Exception {
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 1L), 0);
    try {
      store.write("db", "cpu", null, 
          ImmutableMap.<String, Object>of("value", "str"), 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("field type conflict: input field \"value\" on measurement "
          + "\"cpu\" is type string, already exists as type integer", 
          e.getMessage());
    }
    
    try {
      store.write("db", "cpu", null, ImmutableMap.<String, Object>of(), 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void retentionPolicies() throws Exception {
    try {
      store.createRetentionPolicy("db", "rp");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    store.createDatabase("db");
    store.createRetentionPolicy("db", "rp");
    store.write("db", "rp", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 1L), 0, null);
    assertTrue(store.measurementExists("db", "rp", "cpu"));
    assertFalse(store.measurementExists("db", MockDataStore.DEFAULT_RP, "cpu"));
    
    try {
      store.write("db", "missing", "cpu", null, 
          ImmutableMap.<String, Object>of("value", 1L), 0, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void shardsByTime() throws Exception {
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 1L), 0);
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 2L), HOUR + 1);
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 3L), 2 * HOUR + 1);
    
    List<ShardReader> shards = store.shards("db", MockDataStore.DEFAULT_RP, 
        TimeRange.UNBOUNDED);
    assertEquals(3, shards.size());
    assertEquals(new TimeRange(0, HOUR - 1), shards.get(0).timeRange());
    
    shards = store.shards("db", MockDataStore.DEFAULT_RP, 
        new TimeRange(HOUR, 2 * HOUR - 1));
    assertEquals(1, shards.size());
    final List<Point> points = PointIterators.drain(
        shards.get(0).openSeriesIterator(
            new SeriesKey("cpu", TagSet.EMPTY, "value"), 
            shards.get(0).timeRange(), true));
    assertEquals(1, points.size());
    assertEquals(Value.ofLong(2), points.get(0).value());
    assertEquals(2, points.get(0).sequence());
  }
  
  @Test
  public void negativeTimestampsShardBackwards() throws Exception {
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 1L), -1);
    final List<ShardReader> shards = store.shards("db", 
        MockDataStore.DEFAULT_RP, TimeRange.UNBOUNDED);
    assertEquals(new TimeRange(-HOUR, -1), shards.get(0).timeRange());
  }
  
  @Test
  public void overwriteAndDescending() throws Exception {
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 1L), 10);
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 2L), 20);
    store.write("db", "cpu", null, 
        ImmutableMap.<String, Object>of("value", 3L), 10);
    final ShardReader shard = store.shards("db", MockDataStore.DEFAULT_RP, 
        TimeRange.UNBOUNDED).get(0);
    final List<Point> points = PointIterators.drain(shard.openSeriesIterator(
        new SeriesKey("cpu", TagSet.EMPTY, "value"), TimeRange.UNBOUNDED, 
        false));
    assertEquals(2, points.size());
    assertEquals(20, points.get(0).timestamp());
    assertEquals(Value.ofLong(3), points.get(1).value());
    assertEquals(3, points.get(1).sequence());
    
    assertTrue(PointIterators.drain(shard.openSeriesIterator(
        new SeriesKey("cpu", TagSet.EMPTY, "other"), TimeRange.UNBOUNDED, 
        true)).isEmpty());
  }
  
  @Test
  public void namedShardsMayOverlap() throws Exception {
    store.write("db", MockDataStore.DEFAULT_RP, "cpu", null, 
        ImmutableMap.<String, Object>of("value", 1L), 10, "a");
    store.write("db", MockDataStore.DEFAULT_RP, "cpu", null, 
        ImmutableMap.<String, Object>of("value", 2L), 10, "b");
    final List<ShardReader> shards = store.shards("db", 
        MockDataStore.DEFAULT_RP, new TimeRange(0, 100));
    assertEquals(2, shards.size());
    assertEquals("a", shards.get(0).id());
    assertEquals("b", shards.get(1).id());
  }
  
  static List<TagSet> sorted(final List<TagSet> series) {
    final List<TagSet> copy = Lists.newArrayList(series);
    Collections.sort(copy);
    return copy;
  }
}
