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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An operator applied to two operands.
 * 
 * @since 3.0
 */
public class BinaryExpr extends Expr {
  private final Operator op;
  private final Expr lhs;
  private final Expr rhs;
  
  public BinaryExpr(final Operator op, final Expr lhs, final Expr rhs) {
    if (op == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    if (lhs == null || rhs == null) {
      throw new IllegalArgumentException("Operands cannot be null.");
    }
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
  }
  
  public Operator op() {
    return op;
  }
  
  public Expr lhs() {
    return lhs;
  }
  
  public Expr rhs() {
    return rhs;
  }
  
  @Override
  public List<Expr> children() {
    return ImmutableList.of(lhs, rhs);
  }
  
  @Override
  public String toString() {
    return render(lhs) + " " + op.symbol() + " " + render(rhs);
  }
  
  private static String render(final Expr expr) {
    return expr instanceof BinaryExpr ? "(" + expr + ")" : expr.toString();
  }
}
