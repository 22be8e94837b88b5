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

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * One output series, or one chunk of it: the name, the GROUP BY tags, the
 * column names starting with {@code time} and the rows.
 * 
 * @since 3.0
 */
public class ResultSeries {
  private final String name;
  private final Map<String, String> tags;
  private final List<String> columns;
  private final List<List<Object>> values;
  private final boolean partial;
  
  /**
   * @param name The series name.
   * @param tags The GROUP BY tags, may be empty.
   * @param columns The columns, {@code time} first.
   * @param values The rows, null for missing values.
   * @param partial Whether more chunks of the series follow.
   */
  public ResultSeries(final String name, 
                      final Map<String, String> tags,
                      final List<String> columns,
                      final List<List<Object>> values,
                      final boolean partial) {
    this.name = name;
    this.tags = tags == null ? ImmutableMap.<String, String>of() : tags;
    this.columns = ImmutableList.copyOf(columns);
    this.values = values;
    this.partial = partial;
  }
  
  @JsonProperty("name")
  public String name() {
    return name;
  }
  
  @JsonInclude(Include.NON_EMPTY)
  @JsonProperty("tags")
  public Map<String, String> tags() {
    return tags;
  }
  
  @JsonProperty("columns")
  public List<String> columns() {
    return columns;
  }
  
  @JsonProperty("values")
  public List<List<Object>> values() {
    return values;
  }
  
  @JsonInclude(Include.NON_DEFAULT)
  @JsonProperty("partial")
  public boolean isPartial() {
    return partial;
  }
  
  @Override
  public String toString() {
    return "ResultSeries{name=" + name + ", tags=" + tags + ", columns=" 
        + columns + ", values=" + values + ", partial=" + partial + "}";
  }
}
