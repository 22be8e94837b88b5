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
 * A bare field was selected next to an aggregate without the grouping that
 * would make it constant per series.
 * 
 * @since 3.0
 */
public class MixedAggregateException extends QueryExecutionException {
  private static final long serialVersionUID = 8155313591012541087L;

  public static final String MESSAGE = 
      "mixing aggregate and non-aggregate queries is not supported";
  
  public MixedAggregateException() {
    super(MESSAGE, 400);
  }
}
