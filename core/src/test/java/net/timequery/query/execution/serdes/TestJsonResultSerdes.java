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
package net.timequery.query.execution.serdes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.timequery.data.TagSet;
import net.timequery.query.QueryLimits;
import net.timequery.query.execution.QueryExecutor;
import net.timequery.query.execution.ResultSeries;
import net.timequery.query.execution.ResultStream;
import net.timequery.query.execution.StatementResult;
import net.timequery.query.statement.Dimensions;
import net.timequery.query.statement.MeasurementSource;
import net.timequery.query.statement.SelectStatement;
import net.timequery.query.statement.VarRef;
import net.timequery.storage.MockDataStore;

public class TestJsonResultSerdes {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  
  @Test
  public void emptyAndError() throws Exception {
    final String json = new JsonResultSerdes().serialize(ImmutableList.of(
        StatementResult.success(0, null),
        StatementResult.error(1, "database not found: nope")));
    assertEquals("{\"results\":[{\"statement_id\":0},{\"statement_id\":1,"
        + "\"error\":\"database not found: nope\"}]}", json);
  }
  
  @Test
  public void series() throws Exception {
    final List<List<Object>> values = ImmutableList.<List<Object>>of(
        Arrays.<Object>asList(0L, 1.5, null),
        Arrays.<Object>asList(10L, 2.0, "x"));
    final ResultSeries series = new ResultSeries("cpu", 
        ImmutableMap.of("host", "web01"), 
        ImmutableList.of("time", "mean", "note"), values, false);
    final String json = new JsonResultSerdes().serialize(ImmutableList.of(
        StatementResult.success(0, ImmutableList.of(series))));
    
    final JsonNode root = MAPPER.readTree(json);
    final JsonNode result = root.get("results").get(0);
    assertEquals(0, result.get("statement_id").asInt());
    assertFalse(result.has("error"));
    final JsonNode node = result.get("series").get(0);
    assertEquals("cpu", node.get("name").asText());
    assertEquals("web01", node.get("tags").get("host").asText());
    assertEquals(3, node.get("columns").size());
    assertEquals("time", node.get("columns").get(0).asText());
    assertEquals(0L, node.get("values").get(0).get(0).asLong());
    assertEquals(1.5, node.get("values").get(0).get(1).asDouble(), 0.0001);
    assertTrue(node.get("values").get(0).get(2).isNull());
    assertEquals("x", node.get("values").get(1).get(2).asText());
    // only set when more chunks follow
    assertFalse(node.has("partial"));
  }
  
  @Test
  public void partialAndUntagged() throws Exception {
    final ResultSeries series = new ResultSeries("cpu", null, 
        ImmutableList.of("time", "value"), 
        ImmutableList.<List<Object>>of(Arrays.<Object>asList(0L, 1L)), true);
    final ByteArrayOutputStream stream = new ByteArrayOutputStream();
    new JsonResultSerdes().serialize(ImmutableList.of(
        StatementResult.success(3, ImmutableList.of(series))), stream);
    final JsonNode node = MAPPER.readTree(
        new String(stream.toByteArray(), StandardCharsets.UTF_8))
        .get("results").get(0).get("series").get(0);
    assertTrue(node.get("partial").asBoolean());
    assertFalse(node.has("tags"));
    assertTrue(node.get("values").get(0).get(1).isIntegralNumber());
  }
  
  @Test
  public void nullStream() throws Exception {
    try {
      new JsonResultSerdes().serialize(
          ImmutableList.<StatementResult>of(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  @Test
  public void streams() throws Exception {
    final MockDataStore store = new MockDataStore();
    store.write("db", "cpu", TagSet.of("host", "web01"), 
        ImmutableMap.<String, Object>of("value", 1L), 0);
    store.write("db", "cpu", TagSet.of("host", "web01"), 
        ImmutableMap.<String, Object>of("value", 2L), 10);
    store.write("db", "cpu", TagSet.of("host", "web02"), 
        ImmutableMap.<String, Object>of("value", 3L), 0);
    final QueryExecutor executor = new QueryExecutor(store, 
        QueryLimits.newBuilder().setChunkSize(1).build());
    final List<SelectStatement> statements = ImmutableList.of(
        SelectStatement.newBuilder()
          .addField(new VarRef("value"))
          .setSource(new MeasurementSource("db", null, "cpu"))
          .setDimensions(Dimensions.newBuilder().addTag("host").build())
          .build(),
        SelectStatement.newBuilder()
          .addField(new VarRef("value"))
          .setSource(new MeasurementSource("nope", null, "cpu"))
          .build());
    
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    new JsonResultSerdes().serializeStreams(executor.stream(statements), out);
    final String json = new String(out.toByteArray(), StandardCharsets.UTF_8);
    assertEquals(new JsonResultSerdes().serialize(
        executor.execute(statements)), json);
    
    final JsonNode results = MAPPER.readTree(json).get("results");
    assertEquals(3, results.get(0).get("series").size());
    assertTrue(results.get(0).get("series").get(0).get("partial")
        .asBoolean());
    assertTrue(results.get(1).has("error"));
  }
  
  @Test
  public void streamsWriteBeforeLaterStatements() throws Exception {
    final MockDataStore store = new MockDataStore();
    store.write("db", "cpu", TagSet.of("host", "web01"), 
        ImmutableMap.<String, Object>of("value", 1L), 0);
    final QueryExecutor executor = new QueryExecutor(store, 
        QueryLimits.DEFAULT);
    final SelectStatement statement = SelectStatement.newBuilder()
        .addField(new VarRef("value"))
        .setSource(new MeasurementSource("db", null, "cpu"))
        .build();
    
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final Iterator<ResultStream> streams = new Iterator<ResultStream>() {
      int pulled;
      
      @Override
      public boolean hasNext() {
        return pulled < 2;
      }

      @Override
      public ResultStream next() {
        if (pulled++ > 0) {
          // the first statement's series is already on the wire
          final String written = 
              new String(out.toByteArray(), StandardCharsets.UTF_8);
          assertTrue(written, written.contains("\"values\":[[0,1]]"));
        }
        return executor.stream(pulled, statement);
      }
    };
    new JsonResultSerdes().serializeStreams(streams, out);
    final JsonNode results = MAPPER.readTree(
        new String(out.toByteArray(), StandardCharsets.UTF_8)).get("results");
    assertEquals(2, results.size());
    assertEquals(2, results.get(1).get("statement_id").asInt());
  }
  
}
