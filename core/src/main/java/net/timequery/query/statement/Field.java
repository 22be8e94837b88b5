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
 * One entry of the select list: an expression and an optional alias.
 * 
 * @since 3.0
 */
public class Field {
  private final Expr expr;
  private final String alias;
  
  public Field(final Expr expr) {
    this(expr, null);
  }
  
  public Field(final Expr expr, final String alias) {
    if (expr == null) {
      throw new IllegalArgumentException("Expression cannot be null.");
    }
    this.expr = expr;
    this.alias = alias;
  }
  
  public Expr expr() {
    return expr;
  }
  
  /** @return The alias or null if none was given. */
  public String alias() {
    return alias;
  }
  
  @Override
  public String toString() {
    return alias == null ? expr.toString() : expr + " AS " + alias;
  }
}
