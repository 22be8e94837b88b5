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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.timequery.data.Point;
import net.timequery.data.PointIterator;
import net.timequery.data.SeriesKey;
import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.Value;
import net.timequery.data.ValueType;
import net.timequery.data.iterators.ListPointIterator;
import net.timequery.utils.DateTime;

/**
 * A simple store that keeps everything in memory, split into time based
 * shards. It's meant for testing pipelines and for embedding the engine 
 * without real storage. Every write gets a global, increasing sequence; a
 * second write of the same series, field and timestamp to a shard replaces
 * the first.
 * <p>
 * Writes are synchronized, reads take a snapshot of the requested range.
 * 
 * @since 3.0
 */
public class MockDataStore implements SchemaCatalog {
  private static final Logger LOG = LoggerFactory.getLogger(MockDataStore.class);
  
  /** The default retention policy created with each database. */
  public static final String DEFAULT_RP = "autogen";
  
  /** Default shard width, one week like the usual default. */
  public static final long DEFAULT_SHARD_DURATION = DateTime.seconds(7 * 24 * 3600);
  
  private final long shard_duration;
  
  private final AtomicLong sequence = new AtomicLong();
  
  /** database -> rp -> store. */
  private final Map<String, Map<String, RetentionPolicy>> databases = 
      Maps.newTreeMap();
  
  private final Map<String, String> default_rps = Maps.newHashMap();
  
  public MockDataStore() {
    this(DEFAULT_SHARD_DURATION);
  }
  
  /**
   * @param shard_duration The width of each shard in nanoseconds.
   */
  public MockDataStore(final long shard_duration) {
    if (shard_duration <= 0) {
      throw new IllegalArgumentException("Shard duration must be positive.");
    }
    this.shard_duration = shard_duration;
  }
  
  /**
   * Creates a database with the default retention policy.
   * @param database The database name.
   */
  public synchronized void createDatabase(final String database) {
    if (databases.containsKey(database)) {
      return;
    }
    final Map<String, RetentionPolicy> rps = Maps.newTreeMap();
    rps.put(DEFAULT_RP, new RetentionPolicy());
    databases.put(database, rps);
    default_rps.put(database, DEFAULT_RP);
    LOG.debug("Created database " + database);
  }
  
  /**
   * Creates a retention policy in an existing database.
   * @param database The database name.
   * @param rp The retention policy name.
   */
  public synchronized void createRetentionPolicy(final String database, 
                                                 final String rp) {
    final Map<String, RetentionPolicy> rps = databases.get(database);
    if (rps == null) {
      throw new IllegalArgumentException("No such database: " + database);
    }
    if (!rps.containsKey(rp)) {
      rps.put(rp, new RetentionPolicy());
    }
  }
  
  /**
   * Writes one row to the default retention policy, creating the database
   * if needed.
   * @param database The database.
   * @param measurement The measurement.
   * @param tags The series tags, may be null.
   * @param fields Field names to Long, Double, String or Boolean values.
   * @param timestamp Epoch nanoseconds.
   */
  public void write(final String database,
                    final String measurement,
                    final TagSet tags,
                    final Map<String, Object> fields,
                    final long timestamp) {
    write(database, DEFAULT_RP, measurement, tags, fields, timestamp, null);
  }
  
  /**
   * Writes one row.
   * @param database The database.
   * @param rp The retention policy, must exist unless it's the default.
   * @param measurement The measurement.
   * @param tags The series tags, may be null.
   * @param fields Field names to Long, Double, String or Boolean values.
   * @param timestamp Epoch nanoseconds.
   * @param shard_id An explicit shard to write into, null to pick the 
   * time based shard. Lets tests build overlapping shards.
   */
  public synchronized void write(final String database,
                                 final String rp,
                                 final String measurement,
                                 final TagSet tags,
                                 final Map<String, Object> fields,
                                 final long timestamp,
                                 final String shard_id) {
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("At least one field is required.");
    }
    createDatabase(database);
    final RetentionPolicy store = databases.get(database).get(rp);
    if (store == null) {
      throw new IllegalArgumentException("No such retention policy: " + rp);
    }
    final TagSet series_tags = tags == null ? TagSet.EMPTY : tags;
    
    for (final Entry<String, Object> field : fields.entrySet()) {
      final Value value = Value.fromObject(field.getValue());
      if (value == null) {
        continue;
      }
      final ValueType existing = store.fieldTypes(measurement).get(field.getKey());
      if (existing != null && existing != value.type()) {
        throw new IllegalArgumentException("field type conflict: input field \"" 
            + field.getKey() + "\" on measurement \"" + measurement 
            + "\" is type " + value.type() + ", already exists as type " 
            + existing);
      }
      store.fieldTypes(measurement).put(field.getKey(), value.type());
      final MockShard shard = shard_id == null ? 
          store.shardFor(database + "." + rp, timestamp, shard_duration) : 
            store.namedShard(shard_id);
      shard.put(new SeriesKey(measurement, series_tags, field.getKey()), 
          new Point(timestamp, value, sequence.incrementAndGet()));
    }
    store.series(measurement).add(series_tags);
    store.tagKeys(measurement).addAll(series_tags.keys());
  }
  
  @Override
  public synchronized boolean databaseExists(final String database) {
    return databases.containsKey(database);
  }

  @Override
  public synchronized boolean retentionPolicyExists(final String database, 
                                                    final String rp) {
    final Map<String, RetentionPolicy> rps = databases.get(database);
    return rps != null && rps.containsKey(rp);
  }

  @Override
  public synchronized String defaultRetentionPolicy(final String database) {
    return default_rps.get(database);
  }

  @Override
  public synchronized boolean measurementExists(final String database, 
                                                final String rp,
                                                final String measurement) {
    final RetentionPolicy store = store(database, rp);
    return store != null && store.series.containsKey(measurement);
  }

  @Override
  public synchronized Map<String, ValueType> fields(final String database, 
                                                    final String rp,
                                                    final String measurement) {
    final RetentionPolicy store = store(database, rp);
    if (store == null || !store.field_types.containsKey(measurement)) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(
        new TreeMap<String, ValueType>(store.field_types.get(measurement)));
  }

  @Override
  public synchronized Set<String> tagKeys(final String database, 
                                          final String rp, 
                                          final String measurement) {
    final RetentionPolicy store = store(database, rp);
    if (store == null || !store.tag_keys.containsKey(measurement)) {
      return Collections.emptySet();
    }
    return Collections.unmodifiableSet(
        new TreeSet<String>(store.tag_keys.get(measurement)));
  }

  @Override
  public synchronized List<TagSet> series(final String database, 
                                          final String rp, 
                                          final String measurement) {
    final RetentionPolicy store = store(database, rp);
    if (store == null || !store.series.containsKey(measurement)) {
      return Collections.emptyList();
    }
    return Lists.newArrayList(store.series.get(measurement));
  }

  @Override
  public synchronized List<ShardReader> shards(final String database, 
                                               final String rp, 
                                               final TimeRange range) {
    final RetentionPolicy store = store(database, rp);
    if (store == null) {
      return Collections.emptyList();
    }
    final List<ShardReader> shards = Lists.newArrayList();
    for (final MockShard shard : store.shards.values()) {
      if (shard.timeRange().overlaps(range)) {
        shards.add(shard);
      }
    }
    return shards;
  }
  
  /** @return The number of points written so far. */
  public long writes() {
    return sequence.get();
  }
  
  private RetentionPolicy store(final String database, final String rp) {
    final Map<String, RetentionPolicy> rps = databases.get(database);
    if (rps == null) {
      return null;
    }
    return rps.get(rp == null ? default_rps.get(database) : rp);
  }
  
  /** Per retention policy metadata and shards. */
  private static class RetentionPolicy {
    private final Map<String, Map<String, ValueType>> field_types = Maps.newHashMap();
    private final Map<String, Set<String>> tag_keys = Maps.newHashMap();
    private final Map<String, Set<TagSet>> series = Maps.newHashMap();
    /** Keyed on the shard id so iteration is oldest first for time shards. */
    private final Map<String, MockShard> shards = Maps.newTreeMap();
    
    Map<String, ValueType> fieldTypes(final String measurement) {
      Map<String, ValueType> types = field_types.get(measurement);
      if (types == null) {
        types = Maps.newHashMap();
        field_types.put(measurement, types);
      }
      return types;
    }
    
    Set<String> tagKeys(final String measurement) {
      Set<String> keys = tag_keys.get(measurement);
      if (keys == null) {
        keys = Sets.newTreeSet();
        tag_keys.put(measurement, keys);
      }
      return keys;
    }
    
    Set<TagSet> series(final String measurement) {
      Set<TagSet> set = series.get(measurement);
      if (set == null) {
        set = Sets.newTreeSet();
        series.put(measurement, set);
      }
      return set;
    }
    
    MockShard shardFor(final String prefix, 
                       final long timestamp, 
                       final long duration) {
      final long start = Math.floorDiv(timestamp, duration) * duration;
      // unsigned offset from Long.MIN_VALUE so ids sort by time
      final String id = prefix + "." + Strings.padStart(
          Long.toUnsignedString(start - Long.MIN_VALUE), 20, '0');
      MockShard shard = shards.get(id);
      if (shard == null) {
        shard = new MockShard(id, new TimeRange(start, start + duration - 1));
        shards.put(id, shard);
      }
      return shard;
    }
    
    MockShard namedShard(final String id) {
      MockShard shard = shards.get(id);
      if (shard == null) {
        shard = new MockShard(id, TimeRange.UNBOUNDED);
        shards.put(id, shard);
      }
      return shard;
    }
  }
  
  /** An in-memory shard. */
  static class MockShard implements ShardReader {
    private final String id;
    private final TimeRange range;
    private final Map<SeriesKey, NavigableMap<Long, Point>> data = Maps.newHashMap();
    
    MockShard(final String id, final TimeRange range) {
      this.id = id;
      this.range = range;
    }
    
    synchronized void put(final SeriesKey key, final Point point) {
      NavigableMap<Long, Point> points = data.get(key);
      if (points == null) {
        points = new TreeMap<Long, Point>();
        data.put(key, points);
      }
      points.put(point.timestamp(), point);
    }
    
    @Override
    public String id() {
      return id;
    }

    @Override
    public TimeRange timeRange() {
      return range;
    }

    @Override
    public synchronized PointIterator openSeriesIterator(final SeriesKey key,
                                                         final TimeRange range, 
                                                         final boolean ascending) {
      final NavigableMap<Long, Point> points = data.get(key);
      if (points == null) {
        return new ListPointIterator(null, Collections.<Point>emptyList());
      }
      NavigableMap<Long, Point> slice = 
          points.subMap(range.start(), true, range.end(), true);
      if (!ascending) {
        slice = slice.descendingMap();
      }
      final ValueType type = points.isEmpty() ? null : 
        points.firstEntry().getValue().value().type();
      return new ListPointIterator(type, Lists.newArrayList(slice.values()));
    }
    
    @Override
    public String toString() {
      return "MockShard{id=" + id + ", range=" + range + "}";
    }
  }
}
