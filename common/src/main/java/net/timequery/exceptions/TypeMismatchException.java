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
 * Thrown when an iterator of one value type is fed to a function that 
 * cannot consume it, e.g. a string field into {@code mean()}. Raised when
 * the iterator tree is built, never lazily.
 * 
 * @since 3.0
 */
public class TypeMismatchException extends QueryExecutionException {
  private static final long serialVersionUID = 3028610271440651785L;

  public TypeMismatchException(final String msg) {
    super(msg, 400);
  }
}
