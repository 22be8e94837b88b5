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
package net.timequery.query.processor.expressions;

import net.timequery.data.Value;
import net.timequery.data.ValueType;
import net.timequery.query.statement.BinaryExpr;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.Expr;
import net.timequery.query.statement.Literal;
import net.timequery.query.statement.Operator;
import net.timequery.query.statement.VarRef;

/**
 * Evaluates expression trees one row at a time. Arithmetic follows these
 * rules:
 * <ul>
 * <li>Any operand that is null makes the result null.</li>
 * <li>Integer addition, subtraction and multiplication stay integers, 
 * anything involving a float is a float.</li>
 * <li>Division always yields a float and dividing by zero yields 0.</li>
 * <li>Arithmetic on strings or booleans yields null.</li>
 * </ul>
 * Comparisons yield booleans, false when the operand types can't be 
 * compared. Logical operators treat null as false.
 * 
 * @since 3.0
 */
public final class ExpressionEvaluator {
  
  /** Supplies the values of references and calls for the current row. */
  public interface Resolver {
    
    /** @return The value of the reference, null if missing. */
    public Value resolve(final VarRef ref);
    
    /** @return The value of the call, null if missing. */
    public Value resolve(final Call call);
    
  }
  
  private ExpressionEvaluator() {
    // static helpers
  }
  
  /**
   * @param expr A non-null expression.
   * @param resolver A non-null resolver.
   * @return The value, may be null.
   */
  public static Value evaluate(final Expr expr, final Resolver resolver) {
    if (expr instanceof Literal) {
      return ((Literal) expr).toValue();
    }
    if (expr instanceof VarRef) {
      return resolver.resolve((VarRef) expr);
    }
    if (expr instanceof Call) {
      return resolver.resolve((Call) expr);
    }
    if (expr instanceof BinaryExpr) {
      final BinaryExpr binary = (BinaryExpr) expr;
      final Value lhs = evaluate(binary.lhs(), resolver);
      if (binary.op() == Operator.AND && !isTrue(lhs)) {
        return Value.ofBoolean(false);
      }
      if (binary.op() == Operator.OR && isTrue(lhs)) {
        return Value.ofBoolean(true);
      }
      return apply(binary.op(), lhs, evaluate(binary.rhs(), resolver));
    }
    throw new IllegalArgumentException("Unable to evaluate: " + expr);
  }
  
  /**
   * @param condition A condition, null is always true.
   * @param resolver A non-null resolver.
   * @return Whether the condition holds.
   */
  public static boolean matches(final Expr condition, final Resolver resolver) {
    return condition == null || isTrue(evaluate(condition, resolver));
  }
  
  /** @return True only for a boolean true value. */
  public static boolean isTrue(final Value value) {
    return value != null && value.type() == ValueType.BOOLEAN 
        && value.booleanValue();
  }
  
  /**
   * @param op The operator.
   * @param lhs The left value, may be null.
   * @param rhs The right value, may be null.
   * @return The result, may be null.
   */
  public static Value apply(final Operator op, final Value lhs, final Value rhs) {
    if (op.isLogical()) {
      return Value.ofBoolean(op == Operator.AND ? 
          isTrue(lhs) && isTrue(rhs) : isTrue(lhs) || isTrue(rhs));
    }
    if (lhs == null || rhs == null) {
      return null;
    }
    if (op.isComparison()) {
      return Value.ofBoolean(compare(op, lhs, rhs));
    }
    if (!lhs.isNumeric() || !rhs.isNumeric()) {
      return null;
    }
    final boolean integers = lhs.isInteger() && rhs.isInteger();
    switch (op) {
    case ADD:
      return integers ? Value.ofLong(lhs.longValue() + rhs.longValue()) : 
        Value.ofDouble(lhs.toDouble() + rhs.toDouble());
    case SUB:
      return integers ? Value.ofLong(lhs.longValue() - rhs.longValue()) : 
        Value.ofDouble(lhs.toDouble() - rhs.toDouble());
    case MUL:
      return integers ? Value.ofLong(lhs.longValue() * rhs.longValue()) : 
        Value.ofDouble(lhs.toDouble() * rhs.toDouble());
    case DIV:
      if (rhs.toDouble() == 0) {
        return Value.ofDouble(0);
      }
      return Value.ofDouble(lhs.toDouble() / rhs.toDouble());
    default:
      throw new IllegalStateException("Unhandled operator: " + op);
    }
  }
  
  private static boolean compare(final Operator op, 
                                 final Value lhs, 
                                 final Value rhs) {
    final boolean comparable = (lhs.isNumeric() && rhs.isNumeric()) || 
        lhs.type() == rhs.type();
    if (!comparable) {
      return op == Operator.NEQ;
    }
    final int cmp = lhs.compareTo(rhs);
    switch (op) {
    case EQ:
      return cmp == 0;
    case NEQ:
      return cmp != 0;
    case LT:
      return cmp < 0;
    case LTE:
      return cmp <= 0;
    case GT:
      return cmp > 0;
    case GTE:
      return cmp >= 0;
    default:
      throw new IllegalStateException("Not a comparison: " + op);
    }
  }
}
