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
package net.timequery.query.execution;

import static net.timequery.query.execution.TestStatementPlanner.call;
import static net.timequery.query.execution.TestStatementPlanner.ref;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.stumbleupon.async.Deferred;

import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.exceptions.DistinctCombinationException;
import net.timequery.exceptions.MixedAggregateException;
import net.timequery.query.QueryLimits;
import net.timequery.query.interpolation.FillOption;
import net.timequery.query.statement.BinaryExpr;
import net.timequery.query.statement.Dimensions;
import net.timequery.query.statement.IntegerLiteral;
import net.timequery.query.statement.MeasurementSource;
import net.timequery.query.statement.Operator;
import net.timequery.query.statement.SelectStatement;
import net.timequery.query.statement.StringLiteral;
import net.timequery.query.statement.SubQuerySource;
import net.timequery.query.statement.Wildcard;
import net.timequery.storage.MockDataStore;
import net.timequery.utils.DateTime;

public class TestQueryExecutor {
  private static final long T0 = DateTime.seconds(1000);
  private static final long S = DateTime.seconds(1);
  
  private MockDataStore store;
  private QueryExecutor executor;
  
  @Before
  public void before() throws Exception {
    store = new MockDataStore();
    write(store, "web01", "us", T0, 1);
    write(store, "web01", "us", T0 + 5 * S, 3);
    write(store, "web01", "us", T0 + 10 * S, 5);
    write(store, "web01", "us", T0 + 25 * S, 7);
    write(store, "web02", "us", T0, 2);
    write(store, "web02", "us", T0 + 12 * S, 4);
    write(store, "web03", "eu", T0 + 3 * S, 10);
    executor = new QueryExecutor(store, QueryLimits.DEFAULT);
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new QueryExecutor(null, QueryLimits.DEFAULT);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new QueryExecutor(store, (QueryLimits) null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void batchFailsPerStatement() throws Exception {
    final MockDataStore load = new MockDataStore();
    load.write("db", "load", null, 
        ImmutableMap.<String, Object>of("value", 10L), T0);
    load.write("db", "load", null, 
        ImmutableMap.<String, Object>of("value", 15L), T0 + S);
    load.write("db", "load", null, 
        ImmutableMap.<String, Object>of("value", 20L), T0 + 2 * S);
    load.write("db", "load", null, 
        ImmutableMap.<String, Object>of("value", 25L), T0 + 3 * S);
    
    final List<StatementResult> results = 
        new QueryExecutor(load, QueryLimits.DEFAULT).execute(ImmutableList.of(
        SelectStatement.newBuilder()
          .addField(call("derivative", call("count", ref("value"))))
          .setSource(new MeasurementSource("db", null, "load"))
          .setTimeRange(new TimeRange(T0, T0 + 3 * S))
          .setDimensions(Dimensions.newBuilder().setInterval("2s").build())
          .build(),
        SelectStatement.newBuilder()
          .addField(ref("load"))
          .setSource(new MeasurementSource("db", null, "missing"))
          .setDimensions(Dimensions.newBuilder().setWildcard(true).build())
          .build(),
        SelectStatement.newBuilder()
          .addField(call("count", new IntegerLiteral(2)))
          .setSource(new MeasurementSource("db", null, "load"))
          .build()));
    assertEquals(3, results.size());
    
    StatementResult result = results.get(0);
    assertEquals(0, result.statementId());
    assertFalse(result.hasError());
    assertEquals(1, result.series().size());
    final ResultSeries series = result.series().get(0);
    assertEquals("load", series.name());
    assertTrue(series.tags().isEmpty());
    assertEquals(ImmutableList.of("time", "derivative"), series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 2.0), 
        ImmutableList.<Object>of(T0 + 2 * S, 0.0)), series.values());
    assertFalse(series.isPartial());
    
    result = results.get(1);
    assertEquals(1, result.statementId());
    assertFalse(result.hasError());
    assertTrue(result.series().isEmpty());
    
    result = results.get(2);
    assertEquals(2, result.statementId());
    assertTrue(result.hasError());
    assertEquals("expected field argument in count()", result.error());
    assertTrue(result.series().isEmpty());
  }
  
  @Test
  public void seriesLimit() throws Exception {
    final MockDataStore wide = new MockDataStore();
    for (int i = 0; i < 4; i++) {
      wide.write("db", "cpu", TagSet.of("host", "web0" + i), 
          ImmutableMap.<String, Object>of("value", (long) i), 0);
    }
    final QueryExecutor limited = new QueryExecutor(wide, 
        QueryLimits.newBuilder().setMaxSelectSeries(3).build());
    final StatementResult result = limited.execute(0, 
        select().addField(ref("value")).build());
    assertEquals("max-select-series limit exceeded: (4/3)", result.error());
  }
  
  @Test
  public void meanByTime() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(call("mean", ref("value")))
        .setTimeRange(new TimeRange(T0, T0 + 29 * S))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .build());
    assertEquals(1, result.series().size());
    final ResultSeries series = result.series().get(0);
    assertEquals("cpu", series.name());
    assertEquals(ImmutableList.of("time", "mean"), series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 4.0), 
        ImmutableList.<Object>of(T0 + 10 * S, 4.5),
        ImmutableList.<Object>of(T0 + 20 * S, 7.0)), series.values());
  }
  
  @Test
  public void countByHostPaginated() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(call("count", ref("value")))
        .setTimeRange(new TimeRange(T0, T0 + 19 * S))
        .setDimensions(Dimensions.newBuilder().addTag("host").build())
        .setSLimit(2)
        .setSOffset(1)
        .build());
    assertEquals(2, result.series().size());
    assertEquals(ImmutableMap.of("host", "web02"), 
        result.series().get(0).tags());
    assertEquals(ImmutableList.of(ImmutableList.<Object>of(T0, 2L)), 
        result.series().get(0).values());
    assertEquals(ImmutableMap.of("host", "web03"), 
        result.series().get(1).tags());
    assertEquals(ImmutableList.of(ImmutableList.<Object>of(T0, 1L)), 
        result.series().get(1).values());
  }
  
  @Test
  public void binaryOverAggregates() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(new BinaryExpr(Operator.SUB, 
            call("max", ref("value")), call("min", ref("value"))))
        .setCondition(host("web01"))
        .setTimeRange(new TimeRange(T0, T0 + 19 * S))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .build());
    final ResultSeries series = result.series().get(0);
    assertEquals(ImmutableList.of("time", "max_min"), series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 2L), 
        ImmutableList.<Object>of(T0 + 10 * S, 0L)), series.values());
  }
  
  @Test
  public void subQuery() throws Exception {
    final SelectStatement inner = select()
        .addField(call("mean", ref("value")))
        .setDimensions(Dimensions.newBuilder()
            .setInterval("10s")
            .addTag("host")
            .build())
        .build();
    final StatementResult result = executor.execute(0, 
        SelectStatement.newBuilder()
          .addField(call("mean", ref("mean")))
          .setSource(new SubQuerySource(inner))
          .setTimeRange(new TimeRange(T0, T0 + 19 * S))
          .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
          .build());
    assertFalse(result.hasError());
    final List<List<Object>> values = result.series().get(0).values();
    assertEquals(2, values.size());
    assertEquals(T0, values.get(0).get(0));
    assertEquals(14.0 / 3, (Double) values.get(0).get(1), 0.0001);
    assertEquals(T0 + 10 * S, values.get(1).get(0));
    assertEquals(4.5, (Double) values.get(1).get(1), 0.0001);
  }
  
  @Test
  public void topWithTags() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(call("top", ref("value"), ref("host"), new IntegerLiteral(2)))
        .addField(ref("host"))
        .setTimeRange(new TimeRange(T0, T0 + 29 * S))
        .build());
    final ResultSeries series = result.series().get(0);
    assertEquals(ImmutableList.of("time", "top", "host"), series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 3 * S, 10L, "web03"), 
        ImmutableList.<Object>of(T0 + 25 * S, 7L, "web01")), series.values());
  }
  
  @Test
  public void distinct() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(call("distinct", ref("value")))
        .setCondition(host("web01"))
        .build());
    final ResultSeries series = result.series().get(0);
    assertEquals(ImmutableList.of("time", "distinct"), series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(0L, 1L), 
        ImmutableList.<Object>of(0L, 3L),
        ImmutableList.<Object>of(0L, 5L),
        ImmutableList.<Object>of(0L, 7L)), series.values());
  }
  
  @Test
  public void fill() throws Exception {
    StatementResult result = executor.execute(0, select()
        .addField(call("max", ref("value")))
        .setCondition(host("web02"))
        .setTimeRange(new TimeRange(T0, T0 + 14 * S))
        .setDimensions(Dimensions.newBuilder().setInterval("5s").build())
        .setFill(FillOption.PREVIOUS)
        .build());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 2L), 
        ImmutableList.<Object>of(T0 + 5 * S, 2L),
        ImmutableList.<Object>of(T0 + 10 * S, 4L)), 
        result.series().get(0).values());
    
    result = executor.execute(0, select()
        .addField(call("count", ref("value")))
        .setCondition(host("web03"))
        .setTimeRange(new TimeRange(T0, T0 + 29 * S))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .setFill(FillOption.NONE)
        .build());
    assertEquals(ImmutableList.of(ImmutableList.<Object>of(T0, 1L)), 
        result.series().get(0).values());
  }
  
  @Test
  public void fieldsStartingLaterShareTheBuckets() throws Exception {
    final MockDataStore staggered = new MockDataStore();
    staggered.write("db", "io", null, 
        ImmutableMap.<String, Object>of("a", 1L), T0);
    staggered.write("db", "io", null, 
        ImmutableMap.<String, Object>of("a", 1L), T0 + 10 * S);
    staggered.write("db", "io", null, 
        ImmutableMap.<String, Object>of("a", 1L, "b", 1L), T0 + 20 * S);
    final QueryExecutor io = new QueryExecutor(staggered, QueryLimits.DEFAULT);
    
    StatementResult result = io.execute(0, SelectStatement.newBuilder()
        .addField(call("count", ref("a")))
        .addField(call("count", ref("b")))
        .setSource(new MeasurementSource("db", null, "io"))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .build());
    assertEquals(ImmutableList.of("time", "count", "count_1"), 
        result.series().get(0).columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 1L, 0L), 
        ImmutableList.<Object>of(T0 + 10 * S, 1L, 0L),
        ImmutableList.<Object>of(T0 + 20 * S, 1L, 1L)), 
        result.series().get(0).values());
    
    result = io.execute(0, SelectStatement.newBuilder()
        .addField(call("mean", ref("a")))
        .addField(call("mean", ref("b")))
        .setSource(new MeasurementSource("db", null, "io"))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .setFill(FillOption.number(0L))
        .build());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 1.0, 0.0), 
        ImmutableList.<Object>of(T0 + 10 * S, 1.0, 0.0),
        ImmutableList.<Object>of(T0 + 20 * S, 1.0, 1.0)), 
        result.series().get(0).values());
    
    // a later explicit start only closes the open end
    result = io.execute(0, SelectStatement.newBuilder()
        .addField(call("count", ref("b")))
        .setSource(new MeasurementSource("db", null, "io"))
        .setTimeRange(new TimeRange(T0 + 10 * S, Long.MAX_VALUE))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .build());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 10 * S, 0L),
        ImmutableList.<Object>of(T0 + 20 * S, 1L)), 
        result.series().get(0).values());
  }
  
  @Test
  public void groupsShareTheBuckets() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(call("max", ref("value")))
        .setDimensions(Dimensions.newBuilder()
            .setInterval("10s")
            .addTag("host")
            .build())
        .setFill(FillOption.number(0L))
        .build());
    assertEquals(3, result.series().size());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 3L), 
        ImmutableList.<Object>of(T0 + 10 * S, 5L),
        ImmutableList.<Object>of(T0 + 20 * S, 7L)), 
        result.series().get(0).values());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 2L), 
        ImmutableList.<Object>of(T0 + 10 * S, 4L),
        ImmutableList.<Object>of(T0 + 20 * S, 0L)), 
        result.series().get(1).values());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 10L), 
        ImmutableList.<Object>of(T0 + 10 * S, 0L),
        ImmutableList.<Object>of(T0 + 20 * S, 0L)), 
        result.series().get(2).values());
  }
  
  @Test
  public void aggregatesDescending() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(call("max", ref("value")))
        .setCondition(host("web01"))
        .setDimensions(Dimensions.newBuilder().setInterval("10s").build())
        .setAscending(false)
        .setLimit(2)
        .build());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 20 * S, 7L), 
        ImmutableList.<Object>of(T0 + 10 * S, 5L)), 
        result.series().get(0).values());
  }
  
  @Test
  public void streamOpensOneGroupAtATime() throws Exception {
    final MockDataStore catalog = spy(store);
    final QueryExecutor chunking = new QueryExecutor(catalog, 
        QueryLimits.newBuilder().setChunkSize(2).build());
    final ResultStream stream = chunking.stream(0, select()
        .addField(ref("value"))
        .setDimensions(Dimensions.newBuilder().addTag("host").build())
        .build());
    verify(catalog, never()).shards(anyString(), any(), 
        any(TimeRange.class));
    
    assertTrue(stream.hasNext());
    ResultSeries series = stream.next();
    assertEquals(ImmutableMap.of("host", "web01"), series.tags());
    assertTrue(series.isPartial());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0, 1L), 
        ImmutableList.<Object>of(T0 + 5 * S, 3L)), series.values());
    // only web01 was opened so far
    verify(catalog, times(1)).shards(anyString(), any(), 
        any(TimeRange.class));
    
    series = stream.next();
    assertFalse(series.isPartial());
    assertEquals(2, series.values().size());
    series = stream.next();
    assertEquals(ImmutableMap.of("host", "web02"), series.tags());
    assertFalse(series.isPartial());
    series = stream.next();
    assertEquals(ImmutableMap.of("host", "web03"), series.tags());
    assertFalse(stream.hasNext());
    assertFalse(stream.hasError());
    verify(catalog, times(3)).shards(anyString(), any(), 
        any(TimeRange.class));
    stream.close();
  }
  
  @Test
  public void streamReportsErrors() throws Exception {
    ResultStream stream = executor.stream(4, select()
        .addField(call("count", new IntegerLiteral(2)))
        .build());
    assertEquals(4, stream.statementId());
    assertFalse(stream.hasNext());
    assertEquals("expected field argument in count()", stream.error());
    
    // limits hit while pulling end the stream
    final QueryExecutor limited = new QueryExecutor(store, 
        QueryLimits.newBuilder().setMaxSelectPoints(5).build());
    stream = limited.stream(0, select()
        .addField(ref("value"))
        .setDimensions(Dimensions.newBuilder().addTag("host").build())
        .build());
    assertTrue(stream.hasNext());
    assertEquals(4, stream.next().values().size());
    assertFalse(stream.hasNext());
    assertEquals("max-select-point limit exceeed: (6/5)", stream.error());
    try {
      stream.next();
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }
    
    // soft misses are empty
    stream = executor.stream(0, SelectStatement.newBuilder()
        .addField(ref("value"))
        .setSource(new MeasurementSource("db", null, "missing"))
        .build());
    assertFalse(stream.hasNext());
    assertFalse(stream.hasError());
  }
  
  @Test
  public void rawWithCondition() throws Exception {
    final StatementResult result = executor.execute(0, select()
        .addField(ref("value"))
        .setCondition(new BinaryExpr(Operator.GT, ref("value"), 
            new IntegerLiteral(4)))
        .build());
    final ResultSeries series = result.series().get(0);
    assertEquals(ImmutableList.of("time", "value"), series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 3 * S, 10L), 
        ImmutableList.<Object>of(T0 + 10 * S, 5L),
        ImmutableList.<Object>of(T0 + 25 * S, 7L)), series.values());
  }
  
  @Test
  public void rawLimitOffsetAndOrder() throws Exception {
    StatementResult result = executor.execute(0, select()
        .addField(ref("value"))
        .setCondition(host("web01"))
        .setLimit(2)
        .setOffset(1)
        .build());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 5 * S, 3L), 
        ImmutableList.<Object>of(T0 + 10 * S, 5L)), 
        result.series().get(0).values());
    
    result = executor.execute(0, select()
        .addField(ref("value"))
        .setCondition(host("web01"))
        .setAscending(false)
        .build());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 25 * S, 7L), 
        ImmutableList.<Object>of(T0 + 10 * S, 5L),
        ImmutableList.<Object>of(T0 + 5 * S, 3L),
        ImmutableList.<Object>of(T0, 1L)), 
        result.series().get(0).values());
  }
  
  @Test
  public void rawGroupedAndWildcard() throws Exception {
    StatementResult result = executor.execute(0, select()
        .addField(ref("value"))
        .setDimensions(Dimensions.newBuilder().setWildcard(true).build())
        .build());
    assertEquals(3, result.series().size());
    assertEquals(ImmutableMap.of("host", "web01", "region", "us"), 
        result.series().get(0).tags());
    assertEquals(4, result.series().get(0).values().size());
    assertEquals(ImmutableMap.of("host", "web03", "region", "eu"), 
        result.series().get(2).tags());
    
    result = executor.execute(0, select()
        .addField(Wildcard.INSTANCE)
        .setCondition(host("web03"))
        .build());
    final ResultSeries series = result.series().get(0);
    assertEquals(ImmutableList.of("time", "host", "region", "value"), 
        series.columns());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 3 * S, "web03", "eu", 10L)), 
        series.values());
  }
  
  @Test
  public void chunked() throws Exception {
    final QueryExecutor chunking = new QueryExecutor(store, 
        QueryLimits.newBuilder().setChunkSize(2).build());
    final StatementResult result = chunking.execute(0, select()
        .addField(ref("value"))
        .setCondition(host("web01"))
        .build());
    assertEquals(2, result.series().size());
    assertTrue(result.series().get(0).isPartial());
    assertEquals(2, result.series().get(0).values().size());
    assertFalse(result.series().get(1).isPartial());
    assertEquals(ImmutableList.of(
        ImmutableList.<Object>of(T0 + 10 * S, 5L), 
        ImmutableList.<Object>of(T0 + 25 * S, 7L)), 
        result.series().get(1).values());
  }
  
  @Test
  public void errors() throws Exception {
    StatementResult result = executor.execute(0, SelectStatement.newBuilder()
        .addField(ref("value"))
        .setSource(new MeasurementSource("nope", null, "cpu"))
        .build());
    assertEquals("database not found: nope", result.error());
    
    result = executor.execute(1, select()
        .addField(call("mean", ref("value")))
        .addField(ref("value"))
        .build());
    assertEquals(1, result.statementId());
    assertEquals(MixedAggregateException.MESSAGE, result.error());
    
    result = executor.execute(2, select()
        .addField(call("distinct", ref("value")))
        .addField(call("count", ref("value")))
        .build());
    assertEquals(DistinctCombinationException.MESSAGE, result.error());
    
    // a missing field is an empty result
    result = executor.execute(3, select()
        .addField(call("mean", ref("nope")))
        .build());
    assertFalse(result.hasError());
    assertNull(result.error());
    assertTrue(result.series().isEmpty());
  }
  
  @Test
  public void executeAsync() throws Exception {
    final MockDataStore sharded = new MockDataStore(DateTime.seconds(10));
    write(sharded, "web01", "us", T0, 1);
    write(sharded, "web01", "us", T0 + 12 * S, 2);
    write(sharded, "web02", "us", T0 + 25 * S, 3);
    write(sharded, "web02", "us", T0 + 31 * S, 4);
    
    final QueryExecutor pooled = new QueryExecutor(sharded, 
        QueryLimits.newBuilder().setScanThreads(2).build());
    try {
      final Deferred<List<StatementResult>> deferred = pooled.executeAsync(
          ImmutableList.of(
            select().addField(call("sum", ref("value"))).build(),
            select().addField(ref("value")).build()));
      final List<StatementResult> results = deferred.join(10000);
      assertEquals(2, results.size());
      assertEquals(ImmutableList.of(ImmutableList.<Object>of(0L, 10L)), 
          results.get(0).series().get(0).values());
      final List<List<Object>> raw = results.get(1).series().get(0).values();
      assertEquals(4, raw.size());
      assertEquals(T0, raw.get(0).get(0));
      assertEquals(T0 + 31 * S, raw.get(3).get(0));
    } finally {
      pooled.close();
    }
  }
  
  private static void write(final MockDataStore store, 
                            final String host, 
                            final String region, 
                            final long timestamp, 
                            final long value) {
    store.write("db", "cpu", TagSet.of("host", host, "region", region), 
        ImmutableMap.<String, Object>of("value", value), timestamp);
  }
  
  private static BinaryExpr host(final String host) {
    return new BinaryExpr(Operator.EQ, ref("host"), new StringLiteral(host));
  }
  
  private static SelectStatement.Builder select() {
    return TestStatementPlanner.select();
  }
}
