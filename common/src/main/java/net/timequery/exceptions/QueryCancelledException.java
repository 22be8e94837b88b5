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
 * The query was cancelled or ran past its deadline. Raised from the next 
 * leaf or merge iterator call after the signal.
 * 
 * @since 3.0
 */
public class QueryCancelledException extends QueryExecutionException {
  private static final long serialVersionUID = 4930155734095327710L;

  public QueryCancelledException(final String msg) {
    super(msg, 408);
  }
}
