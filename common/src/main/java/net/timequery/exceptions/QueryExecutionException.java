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
 * The base for all errors raised while planning or running a statement. The
 * message is what the caller sees on the failed statement's result.
 * 
 * @since 3.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -4561982397215867543L;

  /** An HTTP-like status code. 400 for user errors, 500 for internal. */
  private final int status_code;
  
  public QueryExecutionException(final String msg, final int status_code) {
    super(msg);
    this.status_code = status_code;
  }
  
  public QueryExecutionException(final String msg, 
                                 final int status_code, 
                                 final Throwable cause) {
    super(msg, cause);
    this.status_code = status_code;
  }
  
  /** @return The status code for this error. */
  public int getStatusCode() {
    return status_code;
  }
}
