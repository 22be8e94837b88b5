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
package net.timequery.query;

import com.google.common.base.MoreObjects;

import net.timequery.utils.Config;

/**
 * Immutable admission control and execution settings handed to each query
 * execution. Zero means "no limit" for every guard.
 * 
 * @since 3.0
 */
public class QueryLimits {
  
  /** No guards, inline scans. */
  public static final QueryLimits DEFAULT = newBuilder().build();
  
  private final int max_select_series;
  private final int max_select_buckets;
  private final long max_select_points;
  private final int scan_threads;
  private final int scan_buffer_size;
  private final long timeout_ms;
  private final int chunk_size;
  
  protected QueryLimits(final Builder builder) {
    if (builder.max_select_series < 0 || builder.max_select_buckets < 0 
        || builder.max_select_points < 0) {
      throw new IllegalArgumentException("Limits cannot be negative.");
    }
    if (builder.scan_threads < 1) {
      throw new IllegalArgumentException("Scan threads must be at least 1.");
    }
    if (builder.scan_buffer_size < 1) {
      throw new IllegalArgumentException("Scan buffer size must be at least 1.");
    }
    max_select_series = builder.max_select_series;
    max_select_buckets = builder.max_select_buckets;
    max_select_points = builder.max_select_points;
    scan_threads = builder.scan_threads;
    scan_buffer_size = builder.scan_buffer_size;
    timeout_ms = builder.timeout_ms;
    chunk_size = builder.chunk_size;
  }
  
  public int maxSelectSeries() {
    return max_select_series;
  }
  
  public int maxSelectBuckets() {
    return max_select_buckets;
  }
  
  public long maxSelectPoints() {
    return max_select_points;
  }
  
  public int scanThreads() {
    return scan_threads;
  }
  
  public int scanBufferSize() {
    return scan_buffer_size;
  }
  
  public long timeoutMs() {
    return timeout_ms;
  }
  
  public int chunkSize() {
    return chunk_size;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("max_select_series", max_select_series)
        .add("max_select_buckets", max_select_buckets)
        .add("max_select_points", max_select_points)
        .add("scan_threads", scan_threads)
        .add("scan_buffer_size", scan_buffer_size)
        .add("timeout_ms", timeout_ms)
        .add("chunk_size", chunk_size)
        .toString();
  }
  
  /**
   * Reads the limits from a config.
   * @param config A non-null config.
   * @return The limits.
   */
  public static QueryLimits fromConfig(final Config config) {
    return newBuilder()
        .setMaxSelectSeries(config.getInt(Config.MAX_SELECT_SERIES))
        .setMaxSelectBuckets(config.getInt(Config.MAX_SELECT_BUCKETS))
        .setMaxSelectPoints(config.getLong(Config.MAX_SELECT_POINTS))
        .setScanThreads(config.getInt(Config.SCAN_THREADS))
        .setScanBufferSize(config.getInt(Config.SCAN_BUFFER_SIZE))
        .setTimeoutMs(config.getLong(Config.TIMEOUT_MS))
        .setChunkSize(config.getInt(Config.CHUNK_SIZE))
        .build();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private int max_select_series;
    private int max_select_buckets;
    private long max_select_points;
    private int scan_threads = 1;
    private int scan_buffer_size = 1024;
    private long timeout_ms;
    private int chunk_size;
    
    public Builder setMaxSelectSeries(final int max_select_series) {
      this.max_select_series = max_select_series;
      return this;
    }
    
    public Builder setMaxSelectBuckets(final int max_select_buckets) {
      this.max_select_buckets = max_select_buckets;
      return this;
    }
    
    public Builder setMaxSelectPoints(final long max_select_points) {
      this.max_select_points = max_select_points;
      return this;
    }
    
    public Builder setScanThreads(final int scan_threads) {
      this.scan_threads = scan_threads;
      return this;
    }
    
    public Builder setScanBufferSize(final int scan_buffer_size) {
      this.scan_buffer_size = scan_buffer_size;
      return this;
    }
    
    public Builder setTimeoutMs(final long timeout_ms) {
      this.timeout_ms = timeout_ms;
      return this;
    }
    
    public Builder setChunkSize(final int chunk_size) {
      this.chunk_size = chunk_size;
      return this;
    }
    
    public QueryLimits build() {
      return new QueryLimits(this);
    }
  }
}
