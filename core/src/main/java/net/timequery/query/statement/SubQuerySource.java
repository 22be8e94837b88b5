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

/**
 * A nested statement whose result rows feed the outer statement.
 * 
 * @since 3.0
 */
public class SubQuerySource extends Source {
  private final SelectStatement statement;
  
  public SubQuerySource(final SelectStatement statement) {
    if (statement == null) {
      throw new IllegalArgumentException("Statement cannot be null.");
    }
    this.statement = statement;
  }
  
  public SelectStatement statement() {
    return statement;
  }
  
  @Override
  public String name() {
    return statement.source().name();
  }
  
  @Override
  public String toString() {
    return "(" + statement + ")";
  }
}
