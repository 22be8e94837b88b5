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

import com.google.common.collect.Lists;

/**
 * Static helpers for walking expression trees.
 * 
 * @since 3.0
 */
public final class Exprs {
  
  private Exprs() {
    // static helpers
  }
  
  /**
   * @param expr An expression.
   * @return The outermost calls in the expression, in order. Calls nested 
   * as arguments of other calls are not included.
   */
  public static List<Call> calls(final Expr expr) {
    final List<Call> calls = Lists.newArrayList();
    collectCalls(expr, calls);
    return calls;
  }
  
  /**
   * @param expr An expression.
   * @return The variable references outside of any call, in order.
   */
  public static List<VarRef> bareRefs(final Expr expr) {
    final List<VarRef> refs = Lists.newArrayList();
    collectRefs(expr, refs, false);
    return refs;
  }
  
  /**
   * @param expr An expression.
   * @return Every variable reference, including call arguments.
   */
  public static List<VarRef> allRefs(final Expr expr) {
    final List<VarRef> refs = Lists.newArrayList();
    collectRefs(expr, refs, true);
    return refs;
  }
  
  /**
   * @param expr An expression.
   * @return Whether a wildcard appears anywhere in the expression.
   */
  public static boolean hasWildcard(final Expr expr) {
    if (expr instanceof Wildcard) {
      return true;
    }
    for (final Expr child : expr.children()) {
      if (hasWildcard(child)) {
        return true;
      }
    }
    return false;
  }
  
  /**
   * Splits a condition on its top level ANDs.
   * @param condition A condition, may be null.
   * @return The conjuncts, empty for a null condition.
   */
  public static List<Expr> conjuncts(final Expr condition) {
    final List<Expr> conjuncts = Lists.newArrayList();
    if (condition != null) {
      collectConjuncts(condition, conjuncts);
    }
    return conjuncts;
  }
  
  /**
   * @param conjuncts Conditions to AND together.
   * @return The combined condition or null if the list is empty.
   */
  public static Expr and(final List<Expr> conjuncts) {
    Expr result = null;
    for (final Expr conjunct : conjuncts) {
      result = result == null ? conjunct : 
        new BinaryExpr(Operator.AND, result, conjunct);
    }
    return result;
  }
  
  private static void collectCalls(final Expr expr, final List<Call> calls) {
    if (expr instanceof Call) {
      calls.add((Call) expr);
      return;
    }
    for (final Expr child : expr.children()) {
      collectCalls(child, calls);
    }
  }
  
  private static void collectRefs(final Expr expr, 
                                  final List<VarRef> refs, 
                                  final boolean descend_into_calls) {
    if (expr instanceof VarRef) {
      refs.add((VarRef) expr);
      return;
    }
    if (expr instanceof Call && !descend_into_calls) {
      return;
    }
    for (final Expr child : expr.children()) {
      collectRefs(child, refs, descend_into_calls);
    }
  }
  
  private static void collectConjuncts(final Expr expr, 
                                       final List<Expr> conjuncts) {
    if (expr instanceof BinaryExpr && ((BinaryExpr) expr).op() == Operator.AND) {
      collectConjuncts(((BinaryExpr) expr).lhs(), conjuncts);
      collectConjuncts(((BinaryExpr) expr).rhs(), conjuncts);
    } else {
      conjuncts.add(expr);
    }
  }
}
