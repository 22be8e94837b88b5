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
 * Binary operators supported in select expressions and WHERE clauses.
 * 
 * @since 3.0
 */
public enum Operator {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  EQ("="),
  NEQ("!="),
  LT("<"),
  LTE("<="),
  GT(">"),
  GTE(">="),
  AND("AND"),
  OR("OR");
  
  private final String symbol;
  
  private Operator(final String symbol) {
    this.symbol = symbol;
  }
  
  public String symbol() {
    return symbol;
  }
  
  public boolean isArithmetic() {
    return this == ADD || this == SUB || this == MUL || this == DIV;
  }
  
  public boolean isComparison() {
    return this == EQ || this == NEQ || this == LT || this == LTE 
        || this == GT || this == GTE;
  }
  
  public boolean isLogical() {
    return this == AND || this == OR;
  }
}
