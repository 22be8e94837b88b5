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

import com.google.common.collect.ImmutableList;

import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;
import net.timequery.query.QueryContext;
import net.timequery.query.interpolation.FillOption;
import net.timequery.query.processor.downsample.TimeBucketer;
import net.timequery.query.statement.Expr;
import net.timequery.query.statement.Field;
import net.timequery.query.statement.SelectStatement;

/**
 * A validated statement bound to its source: expanded fields, output 
 * columns, compiled calls and the paginated list of output series. An 
 * empty plan reads nothing, e.g. when the measurement doesn't exist.
 * 
 * @since 3.0
 */
public class StatementPlan {
  private final SelectStatement statement;
  private final SeriesSource source;
  private final TimeRange range;
  private final List<Field> fields;
  private final List<String> columns;
  private final List<ValueType> column_types;
  private final List<String> group_keys;
  private final List<SeriesGroup> groups;
  private final List<CallPlan> calls;
  private final Expr condition;
  private final List<String> read_fields;
  private final TimeBucketer bucketer;
  private final FillOption fill;
  private final QueryContext context;
  
  protected StatementPlan(final Builder builder) {
    statement = builder.statement;
    source = builder.source;
    range = builder.range;
    fields = ImmutableList.copyOf(builder.fields);
    columns = ImmutableList.copyOf(builder.columns);
    column_types = Collections.unmodifiableList(builder.column_types);
    group_keys = ImmutableList.copyOf(builder.group_keys);
    groups = ImmutableList.copyOf(builder.groups);
    calls = ImmutableList.copyOf(builder.calls);
    condition = builder.condition;
    read_fields = ImmutableList.copyOf(builder.read_fields);
    bucketer = builder.bucketer;
    fill = builder.fill;
    context = builder.context;
  }
  
  /**
   * @param statement The statement.
   * @param range The effective time range.
   * @param context The query context.
   * @return A plan that yields no series.
   */
  public static StatementPlan empty(final SelectStatement statement, 
                                    final TimeRange range,
                                    final QueryContext context) {
    return newBuilder()
        .setStatement(statement)
        .setRange(range)
        .setContext(context)
        .build();
  }
  
  public SelectStatement statement() {
    return statement;
  }
  
  /** @return The source or null for an empty plan. */
  public SeriesSource source() {
    return source;
  }
  
  /** @return The name for result series. */
  public String name() {
    return source != null ? source.name() : statement.source().name();
  }
  
  public boolean isEmpty() {
    return source == null || groups.isEmpty();
  }
  
  /** @return The effective time range including inherited bounds. */
  public TimeRange range() {
    return range;
  }
  
  /** @return The select list after wildcard expansion. */
  public List<Field> fields() {
    return fields;
  }
  
  /** @return Output column names, parallel to {@link #fields()}. */
  public List<String> columns() {
    return columns;
  }
  
  /** @return Output column types, entries may be null when unknown. */
  public List<ValueType> columnTypes() {
    return column_types;
  }
  
  /** @return The tag keys output series are grouped by. */
  public List<String> groupKeys() {
    return group_keys;
  }
  
  /** @return The output series after SLIMIT and SOFFSET. */
  public List<SeriesGroup> groups() {
    return groups;
  }
  
  /** @return The distinct calls, empty for raw statements. */
  public List<CallPlan> calls() {
    return calls;
  }
  
  public boolean isAggregate() {
    return !calls.isEmpty();
  }
  
  /** @return The row level condition or null. */
  public Expr condition() {
    return condition;
  }
  
  /** @return Fields a raw statement reads, including condition fields. */
  public List<String> readFields() {
    return read_fields;
  }
  
  /** @return The bucketer or null without GROUP BY time. */
  public TimeBucketer bucketer() {
    return bucketer;
  }
  
  public FillOption fill() {
    return fill;
  }
  
  public QueryContext context() {
    return context;
  }
  
  @Override
  public String toString() {
    return "StatementPlan{source=" + source + ", range=" + range 
        + ", columns=" + columns + ", groupKeys=" + group_keys 
        + ", groups=" + groups.size() + ", calls=" + calls 
        + ", condition=" + condition + ", bucketer=" + bucketer 
        + ", fill=" + fill + "}";
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private SelectStatement statement;
    private SeriesSource source;
    private TimeRange range = TimeRange.UNBOUNDED;
    private List<Field> fields = Collections.emptyList();
    private List<String> columns = Collections.emptyList();
    private List<ValueType> column_types = Collections.emptyList();
    private List<String> group_keys = Collections.emptyList();
    private List<SeriesGroup> groups = Collections.emptyList();
    private List<CallPlan> calls = Collections.emptyList();
    private Expr condition;
    private List<String> read_fields = Collections.emptyList();
    private TimeBucketer bucketer;
    private FillOption fill = FillOption.NULL;
    private QueryContext context;
    
    public Builder setStatement(final SelectStatement statement) {
      this.statement = statement;
      return this;
    }
    
    public Builder setSource(final SeriesSource source) {
      this.source = source;
      return this;
    }
    
    public Builder setRange(final TimeRange range) {
      this.range = range;
      return this;
    }
    
    public Builder setFields(final List<Field> fields) {
      this.fields = fields;
      return this;
    }
    
    public Builder setColumns(final List<String> columns) {
      this.columns = columns;
      return this;
    }
    
    public Builder setColumnTypes(final List<ValueType> column_types) {
      this.column_types = column_types;
      return this;
    }
    
    public Builder setGroupKeys(final List<String> group_keys) {
      this.group_keys = group_keys;
      return this;
    }
    
    public Builder setGroups(final List<SeriesGroup> groups) {
      this.groups = groups;
      return this;
    }
    
    public Builder setCalls(final List<CallPlan> calls) {
      this.calls = calls;
      return this;
    }
    
    public Builder setCondition(final Expr condition) {
      this.condition = condition;
      return this;
    }
    
    public Builder setReadFields(final List<String> read_fields) {
      this.read_fields = read_fields;
      return this;
    }
    
    public Builder setBucketer(final TimeBucketer bucketer) {
      this.bucketer = bucketer;
      return this;
    }
    
    public Builder setFill(final FillOption fill) {
      this.fill = fill;
      return this;
    }
    
    public Builder setContext(final QueryContext context) {
      this.context = context;
      return this;
    }
    
    public StatementPlan build() {
      if (statement == null) {
        throw new IllegalArgumentException("Statement cannot be null.");
      }
      if (context == null) {
        context = QueryContext.unlimited();
      }
      return new StatementPlan(this);
    }
  }
}
