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
package net.timequery.query.statement;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.timequery.data.TimeRange;
import net.timequery.query.interpolation.FillOption;

/**
 * A parsed SELECT statement with resolved references. Time bounds from the
 * WHERE clause are lifted into {@link #timeRange()}, the remaining 
 * condition stays in {@link #condition()}.
 * 
 * @since 3.0
 */
public class SelectStatement {
  private final List<Field> fields;
  private final Source source;
  private final Expr condition;
  private final TimeRange time_range;
  private final Dimensions dimensions;
  private final FillOption fill;
  private final int limit;
  private final int offset;
  private final int slimit;
  private final int soffset;
  private final boolean ascending;
  
  protected SelectStatement(final Builder builder) {
    fields = ImmutableList.copyOf(builder.fields);
    source = builder.source;
    condition = builder.condition;
    time_range = builder.time_range;
    dimensions = builder.dimensions;
    fill = builder.fill;
    limit = builder.limit;
    offset = builder.offset;
    slimit = builder.slimit;
    soffset = builder.soffset;
    ascending = builder.ascending;
  }
  
  public List<Field> fields() {
    return fields;
  }
  
  public Source source() {
    return source;
  }
  
  /** @return The non-time part of the WHERE clause, may be null. */
  public Expr condition() {
    return condition;
  }
  
  public TimeRange timeRange() {
    return time_range;
  }
  
  public Dimensions dimensions() {
    return dimensions;
  }
  
  public FillOption fill() {
    return fill;
  }
  
  /** @return Max rows per series, 0 for no limit. */
  public int limit() {
    return limit;
  }
  
  public int offset() {
    return offset;
  }
  
  /** @return Max series, 0 for no limit. */
  public int slimit() {
    return slimit;
  }
  
  public int soffset() {
    return soffset;
  }
  
  /** @return False for ORDER BY time DESC. */
  public boolean ascending() {
    return ascending;
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("SELECT ")
        .append(Joiner.on(", ").join(fields))
        .append(" FROM ")
        .append(source);
    if (condition != null || time_range.hasStart() || time_range.hasEnd()) {
      final List<String> where = Lists.newArrayList();
      if (condition != null) {
        where.add(condition.toString());
      }
      if (time_range.hasStart()) {
        where.add("time >= " + time_range.start());
      }
      if (time_range.hasEnd()) {
        where.add("time <= " + time_range.end());
      }
      buf.append(" WHERE ")
         .append(Joiner.on(" AND ").join(where));
    }
    final String group_by = dimensions.toString();
    if (!group_by.isEmpty()) {
      buf.append(" GROUP BY ")
         .append(group_by);
    }
    if (fill != FillOption.NULL) {
      buf.append(" ")
         .append(fill);
    }
    if (!ascending) {
      buf.append(" ORDER BY time DESC");
    }
    if (limit > 0) {
      buf.append(" LIMIT ")
         .append(limit);
    }
    if (offset > 0) {
      buf.append(" OFFSET ")
         .append(offset);
    }
    if (slimit > 0) {
      buf.append(" SLIMIT ")
         .append(slimit);
    }
    if (soffset > 0) {
      buf.append(" SOFFSET ")
         .append(soffset);
    }
    return buf.toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /**
   * @param statement A statement to copy.
   * @return A builder initialized from the statement.
   */
  public static Builder newBuilder(final SelectStatement statement) {
    return new Builder()
        .setFields(statement.fields)
        .setSource(statement.source)
        .setCondition(statement.condition)
        .setTimeRange(statement.time_range)
        .setDimensions(statement.dimensions)
        .setFill(statement.fill)
        .setLimit(statement.limit)
        .setOffset(statement.offset)
        .setSLimit(statement.slimit)
        .setSOffset(statement.soffset)
        .setAscending(statement.ascending);
  }
  
  public static class Builder {
    private List<Field> fields = Lists.newArrayList();
    private Source source;
    private Expr condition;
    private TimeRange time_range = TimeRange.UNBOUNDED;
    private Dimensions dimensions = Dimensions.NONE;
    private FillOption fill = FillOption.NULL;
    private int limit;
    private int offset;
    private int slimit;
    private int soffset;
    private boolean ascending = true;
    
    public Builder setFields(final List<Field> fields) {
      this.fields = Lists.newArrayList(fields);
      return this;
    }
    
    public Builder addField(final Expr expr) {
      fields.add(new Field(expr));
      return this;
    }
    
    public Builder addField(final Expr expr, final String alias) {
      fields.add(new Field(expr, alias));
      return this;
    }
    
    public Builder setSource(final Source source) {
      this.source = source;
      return this;
    }
    
    public Builder setCondition(final Expr condition) {
      this.condition = condition;
      return this;
    }
    
    public Builder setTimeRange(final TimeRange time_range) {
      this.time_range = time_range;
      return this;
    }
    
    public Builder setDimensions(final Dimensions dimensions) {
      this.dimensions = dimensions;
      return this;
    }
    
    public Builder setFill(final FillOption fill) {
      this.fill = fill;
      return this;
    }
    
    public Builder setLimit(final int limit) {
      this.limit = limit;
      return this;
    }
    
    public Builder setOffset(final int offset) {
      this.offset = offset;
      return this;
    }
    
    public Builder setSLimit(final int slimit) {
      this.slimit = slimit;
      return this;
    }
    
    public Builder setSOffset(final int soffset) {
      this.soffset = soffset;
      return this;
    }
    
    public Builder setAscending(final boolean ascending) {
      this.ascending = ascending;
      return this;
    }
    
    public SelectStatement build() {
      if (fields.isEmpty()) {
        throw new IllegalArgumentException("At least one field is required.");
      }
      if (source == null) {
        throw new IllegalArgumentException("Source cannot be null.");
      }
      if (time_range == null) {
        throw new IllegalArgumentException("Time range cannot be null.");
      }
      if (dimensions == null) {
        throw new IllegalArgumentException("Dimensions cannot be null.");
      }
      if (fill == null) {
        throw new IllegalArgumentException("Fill cannot be null.");
      }
      if (limit < 0 || offset < 0 || slimit < 0 || soffset < 0) {
        throw new IllegalArgumentException("Limits and offsets cannot be "
            + "negative.");
      }
      return new SelectStatement(this);
    }
  }
}
