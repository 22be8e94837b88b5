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
package net.timequery.exceptions;

/**
 * An unknown database, retention policy, measurement or field. Only the 
 * first two are hard errors; a missing measurement or field produces an 
 * empty successful result and the executor checks {@link #isHard()} to 
 * decide.
 * 
 * @since 3.0
 */
public class NotFoundException extends QueryExecutionException {
  private static final long serialVersionUID = 5193757425683207105L;

  private final boolean hard;
  
  private NotFoundException(final String msg, final boolean hard) {
    super(msg, 404);
    this.hard = hard;
  }
  
  public static NotFoundException database(final String database) {
    return new NotFoundException("database not found: " + database, true);
  }
  
  public static NotFoundException retentionPolicy(final String rp) {
    return new NotFoundException("retention policy not found: " + rp, true);
  }
  
  public static NotFoundException measurement(final String measurement) {
    return new NotFoundException("measurement not found: " + measurement, false);
  }
  
  public static NotFoundException field(final String field) {
    return new NotFoundException("field not found: " + field, false);
  }
  
  /** @return True if the statement must fail, false for an empty result. */
  public boolean isHard() {
    return hard;
  }
}
