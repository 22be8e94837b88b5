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

import com.google.common.base.Strings;

/**
 * A measurement in a database and retention policy.
 * 
 * @since 3.0
 */
public class MeasurementSource extends Source {
  private final String database;
  private final String retention_policy;
  private final String measurement;
  
  /**
   * @param database The database, required.
   * @param retention_policy The retention policy, null for the default.
   * @param measurement The measurement, required.
   */
  public MeasurementSource(final String database, 
                           final String retention_policy,
                           final String measurement) {
    if (Strings.isNullOrEmpty(database)) {
      throw new IllegalArgumentException("Database cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(measurement)) {
      throw new IllegalArgumentException("Measurement cannot be null "
          + "or empty.");
    }
    this.database = database;
    this.retention_policy = retention_policy;
    this.measurement = measurement;
  }
  
  public String database() {
    return database;
  }
  
  /** @return The retention policy or null for the database default. */
  public String retentionPolicy() {
    return retention_policy;
  }
  
  public String measurement() {
    return measurement;
  }
  
  @Override
  public String name() {
    return measurement;
  }
  
  @Override
  public String toString() {
    return database + "." + (retention_policy == null ? "" : retention_policy) 
        + "." + measurement;
  }
}
