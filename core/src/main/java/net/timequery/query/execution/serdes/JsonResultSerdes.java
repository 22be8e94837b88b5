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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import net.timequery.query.execution.ResultSeries;
import net.timequery.query.execution.ResultStream;
import net.timequery.query.execution.StatementResult;

/**
 * Writes statement results in the row oriented shape:
 * <pre>
 * {"results":[{"statement_id":0,"series":[{"name":"cpu","tags":{...},
 *   "columns":["time","mean"],"values":[[0,1.5]]}]}]}
 * </pre>
 * A failed statement carries {@code "error"} instead of series. Results
 * are written from lists already collected, or from lazy 
 * {@link ResultStream}s chunk by chunk.
 * 
 * @since 3.0
 */
public class JsonResultSerdes {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  
  /**
   * Streams the results.
   * @param results The results in statement order.
   * @param stream A non-null stream, left open.
   * @throws IOException if writing failed.
   */
  public void serialize(final List<StatementResult> results, 
                        final OutputStream stream) throws IOException {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    final JsonGenerator json = MAPPER.getFactory().createGenerator(stream);
    json.writeStartObject();
    json.writeArrayFieldStart("results");
    for (final StatementResult result : results) {
      json.writeStartObject();
      json.writeNumberField("statement_id", result.statementId());
      if (!result.series().isEmpty()) {
        json.writeArrayFieldStart("series");
        for (final ResultSeries series : result.series()) {
          json.writeObject(series);
        }
        json.writeEndArray();
      }
      if (result.hasError()) {
        json.writeStringField("error", result.error());
      }
      json.writeEndObject();
    }
    json.writeEndArray();
    json.writeEndObject();
    json.flush();
  }
  
  /**
   * Writes each series chunk as soon as it is pulled from its stream and 
   * flushes it. A statement that fails part way keeps the series written
   * so far and ends with its {@code "error"}. Every stream is closed.
   * @param streams The streams in statement order.
   * @param stream A non-null stream, left open.
   * @throws IOException if writing failed.
   */
  public void serializeStreams(final Iterator<ResultStream> streams, 
                               final OutputStream stream) throws IOException {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    final JsonGenerator json = MAPPER.getFactory().createGenerator(stream);
    json.writeStartObject();
    json.writeArrayFieldStart("results");
    while (streams.hasNext()) {
      final ResultStream result = streams.next();
      try {
        json.writeStartObject();
        json.writeNumberField("statement_id", result.statementId());
        boolean started = false;
        while (result.hasNext()) {
          if (!started) {
            json.writeArrayFieldStart("series");
            started = true;
          }
          json.writeObject(result.next());
          json.flush();
        }
        if (started) {
          json.writeEndArray();
        }
        if (result.hasError()) {
          json.writeStringField("error", result.error());
        }
        json.writeEndObject();
      } finally {
        result.close();
      }
    }
    json.writeEndArray();
    json.writeEndObject();
    json.flush();
  }
  
  /**
   * @param results The results in statement order.
   * @return The JSON document.
   */
  public String serialize(final List<StatementResult> results) {
    final ByteArrayOutputStream stream = new ByteArrayOutputStream();
    try {
      serialize(results, stream);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialize results", e);
    }
    return new String(stream.toByteArray(), StandardCharsets.UTF_8);
  }
}
