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

import java.time.ZoneId;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The GROUP BY clause: tag keys (or all of them), and an optional time 
 * interval with offset and time zone.
 * 
 * @since 3.0
 */
public class Dimensions {
  public static final Dimensions NONE = newBuilder().build();
  
  private final List<String> tags;
  private final boolean wildcard;
  private final long interval;
  private final long offset;
  private final ZoneId zone;
  
  protected Dimensions(final Builder builder) {
    tags = ImmutableList.copyOf(builder.tags);
    wildcard = builder.wildcard;
    interval = builder.interval;
    offset = builder.offset;
    zone = builder.zone;
  }
  
  /** @return The explicit GROUP BY tag keys in statement order. */
  public List<String> tags() {
    return tags;
  }
  
  /** @return Whether the statement was {@code GROUP BY *}. */
  public boolean isWildcard() {
    return wildcard;
  }
  
  /** @return The bucket width in nanoseconds, 0 without GROUP BY time. */
  public long interval() {
    return interval;
  }
  
  public boolean hasInterval() {
    return interval > 0;
  }
  
  /** @return The raw bucket offset in nanoseconds, not normalized. */
  public long offset() {
    return offset;
  }
  
  /** @return The zone for wall clock aligned buckets or null for UTC. */
  public ZoneId zone() {
    return zone;
  }
  
  @Override
  public String toString() {
    final List<String> parts = Lists.newArrayList();
    if (wildcard) {
      parts.add("*");
    }
    parts.addAll(tags);
    if (interval > 0) {
      parts.add("time(" + new DurationLiteral(interval) 
          + (offset != 0 ? ", " + new DurationLiteral(offset) : "") + ")");
    }
    return Joiner.on(", ").join(parts) 
        + (zone != null ? " tz('" + zone.getId() + "')" : "");
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private List<String> tags = Lists.newArrayList();
    private boolean wildcard;
    private long interval;
    private long offset;
    private ZoneId zone;
    
    public Builder setTags(final List<String> tags) {
      this.tags = Lists.newArrayList(tags);
      return this;
    }
    
    public Builder addTag(final String tag) {
      tags.add(tag);
      return this;
    }
    
    public Builder setWildcard(final boolean wildcard) {
      this.wildcard = wildcard;
      return this;
    }
    
    /** @param interval The bucket width in nanoseconds. */
    public Builder setInterval(final long interval) {
      this.interval = interval;
      return this;
    }
    
    public Builder setInterval(final String interval) {
      this.interval = DurationLiteral.parse(interval).nanos();
      return this;
    }
    
    /** @param offset The bucket offset in nanoseconds, may be negative. */
    public Builder setOffset(final long offset) {
      this.offset = offset;
      return this;
    }
    
    public Builder setZone(final ZoneId zone) {
      this.zone = zone;
      return this;
    }
    
    public Dimensions build() {
      if (interval < 0) {
        throw new IllegalArgumentException("Interval cannot be negative.");
      }
      if (interval == 0 && offset != 0) {
        throw new IllegalArgumentException("Offset requires an interval.");
      }
      return new Dimensions(this);
    }
  }
}
