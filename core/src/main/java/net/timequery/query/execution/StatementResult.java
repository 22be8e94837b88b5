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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The outcome of one statement in a batch: its series or its error.
 * 
 * @since 3.0
 */
public class StatementResult {
  private final int statement_id;
  private final List<ResultSeries> series;
  private final String error;
  
  private StatementResult(final int statement_id, 
                          final List<ResultSeries> series, 
                          final String error) {
    this.statement_id = statement_id;
    this.series = series;
    this.error = error;
  }
  
  /**
   * @param statement_id The statement index in the batch.
   * @param series The series, may be empty.
   * @return A successful result.
   */
  public static StatementResult success(final int statement_id, 
                                        final List<ResultSeries> series) {
    return new StatementResult(statement_id, series == null ? 
        Collections.<ResultSeries>emptyList() : series, null);
  }
  
  /**
   * @param statement_id The statement index in the batch.
   * @param error The error message.
   * @return A failed result.
   */
  public static StatementResult error(final int statement_id, 
                                      final String error) {
    return new StatementResult(statement_id, 
        Collections.<ResultSeries>emptyList(), error);
  }
  
  @JsonProperty("statement_id")
  public int statementId() {
    return statement_id;
  }
  
  @JsonInclude(Include.NON_EMPTY)
  @JsonProperty("series")
  public List<ResultSeries> series() {
    return series;
  }
  
  @JsonInclude(Include.NON_NULL)
  @JsonProperty("error")
  public String error() {
    return error;
  }
  
  public boolean hasError() {
    return error != null;
  }
  
  @Override
  public String toString() {
    return "StatementResult{id=" + statement_id + ", series=" + series 
        + ", error=" + error + "}";
  }
}
