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
 * A statement asked for more than a limit allows: a top/bottom N above the
 * outer LIMIT or an admission control guard such as the series fan-out.
 * 
 * @since 3.0
 */
public class LimitExceededException extends QueryExecutionException {
  private static final long serialVersionUID = -1250723016870391532L;

  public LimitExceededException(final String msg) {
    super(msg, 400);
  }
  
  /**
   * Formats the standard guard message, e.g. 
   * {@code max-select-series limit exceeded: (4/3)}.
   * @param guard The name of the guard.
   * @param actual The observed count.
   * @param limit The configured limit.
   * @return The exception.
   */
  public static LimitExceededException guard(final String guard, 
                                             final long actual, 
                                             final long limit) {
    return new LimitExceededException(guard + " limit exceeded: (" 
        + actual + "/" + limit + ")");
  }
}
