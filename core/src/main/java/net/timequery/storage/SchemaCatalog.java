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

import java.util.List;
import java.util.Map;
import java.util.Set;

import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;

/**
 * Metadata lookups the engine needs at plan time: which databases, 
 * retention policies and measurements exist, the fields and their types,
 * tag keys, the series of a measurement and the shards covering a range.
 * 
 * @since 3.0
 */
public interface SchemaCatalog {

  public boolean databaseExists(final String database);
  
  public boolean retentionPolicyExists(final String database, final String rp);
  
  /** @return The default retention policy for the database. */
  public String defaultRetentionPolicy(final String database);
  
  public boolean measurementExists(final String database, 
                                   final String rp, 
                                   final String measurement);
  
  /**
   * @return Field names to types, sorted by name. Empty if the measurement 
   * is unknown.
   */
  public Map<String, ValueType> fields(final String database, 
                                       final String rp, 
                                       final String measurement);
  
  /** @return The sorted tag keys of the measurement. */
  public Set<String> tagKeys(final String database, 
                             final String rp, 
                             final String measurement);
  
  /** @return The tag sets of every series in the measurement, sorted. */
  public List<TagSet> series(final String database, 
                             final String rp, 
                             final String measurement);
  
  /** @return The shards overlapping the range, oldest first. */
  public List<ShardReader> shards(final String database, 
                                  final String rp, 
                                  final TimeRange range);
  
}
