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
 * {@code distinct()} must be the only call in its select list.
 * 
 * @since 3.0
 */
public class DistinctCombinationException extends QueryExecutionException {
  private static final long serialVersionUID = 2461093475571409233L;

  public static final String MESSAGE = 
      "aggregate function distinct() cannot be combined with other functions or fields";
  
  public DistinctCombinationException() {
    super(MESSAGE, 400);
  }
}
