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
package net.timequery.query.execution;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.timequery.data.ValueType;
import net.timequery.data.aggregators.PercentileReducer;
import net.timequery.data.aggregators.Reducer;
import net.timequery.data.aggregators.Reducers;
import net.timequery.exceptions.InvalidArgumentException;
import net.timequery.query.processor.topn.TopBottomReducer;
import net.timequery.query.processor.topn.TopBottomSelector;
import net.timequery.query.processor.transform.Transforms;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.DurationLiteral;
import net.timequery.query.statement.Expr;
import net.timequery.query.statement.IntegerLiteral;
import net.timequery.query.statement.NumberLiteral;
import net.timequery.query.statement.VarRef;
import net.timequery.query.statement.Wildcard;
import net.timequery.utils.DateTime;

/**
 * The compiled form of one top level call of a select list: the reducer 
 * to run per bucket, the field it reads, auxiliary columns it carries and 
 * an optional window transform applied to its output. A transform over a
 * raw field has no reducer.
 * 
 * @since 3.0
 */
public class CallPlan {
  private final Call call;
  private final String function;
  private final String field;
  private final ValueType input_type;
  private final List<String> aux;
  private final String transform;
  private final long unit;
  private final int window;
  private final double percentile;
  private final int n;
  private final List<String> group_tags;
  private final ValueType output_type;
  
  private CallPlan(final Call call,
                   final String function, 
                   final String field, 
                   final ValueType input_type,
                   final List<String> aux,
                   final String transform,
                   final long unit,
                   final int window,
                   final double percentile,
                   final int n,
                   final List<String> group_tags,
                   final ValueType output_type) {
    this.call = call;
    this.function = function;
    this.field = field;
    this.input_type = input_type;
    this.aux = aux;
    this.transform = transform;
    this.unit = unit;
    this.window = window;
    this.percentile = percentile;
    this.n = n;
    this.group_tags = group_tags;
    this.output_type = output_type;
  }
  
  /**
   * Checks function names, arity and argument kinds without looking at the
   * schema.
   * @param call A top level call.
   * @param has_interval Whether the statement has GROUP BY time.
   * @throws InvalidArgumentException if the call is malformed.
   */
  public static void validate(final Call call, final boolean has_interval) {
    if (Transforms.isTransform(call.name())) {
      validateTransform(call, has_interval);
    } else if (Reducers.isReducer(call.name())) {
      validateReducer(call);
    } else {
      throw new InvalidArgumentException("undefined function " 
          + call.name() + "()");
    }
  }
  
  /**
   * @param call A validated top level call.
   * @param field_types The source field types.
   * @param has_interval Whether the statement has GROUP BY time.
   * @param interval The GROUP BY time interval.
   * @param aux Auxiliary names for a selector, may be empty.
   * @return The plan.
   * @throws net.timequery.exceptions.TypeMismatchException if the field 
   * type doesn't suit the function.
   */
  public static CallPlan compile(final Call call, 
                                 final Map<String, ValueType> field_types,
                                 final boolean has_interval,
                                 final long interval,
                                 final List<String> aux) {
    if (Transforms.isTransform(call.name())) {
      final String transform = call.name();
      long unit = 0;
      int window = 0;
      if (transform.equals("moving_average")) {
        window = (int) ((IntegerLiteral) call.arg(1)).value();
      } else if (call.arg(1) != null) {
        unit = ((DurationLiteral) call.arg(1)).nanos();
      } else if (transform.equals("elapsed")) {
        unit = Transforms.ELAPSED_UNIT;
      } else {
        unit = has_interval ? interval : DateTime.seconds(1);
      }
      
      if (call.arg(0) instanceof VarRef) {
        final String field = ((VarRef) call.arg(0)).name();
        final ValueType type = field_types.get(field);
        Transforms.checkType(transform, type);
        return new CallPlan(call, null, field, type, 
            Collections.<String>emptyList(), transform, unit, window, 0, 0, 
            Collections.<String>emptyList(), 
            Transforms.outputType(transform, type));
      }
      final CallPlan inner = compile((Call) call.arg(0), field_types, 
          has_interval, interval, Collections.<String>emptyList());
      Transforms.checkType(transform, inner.output_type);
      return new CallPlan(call, inner.function, inner.field, inner.input_type, 
          inner.aux, transform, unit, window, inner.percentile, inner.n, 
          inner.group_tags, Transforms.outputType(transform, inner.output_type));
    }
    
    final String field = ((VarRef) call.arg(0)).name();
    final ValueType type = field_types.get(field);
    double percentile = 0;
    int n = 0;
    List<String> group_tags = Collections.emptyList();
    final List<String> all_aux = Lists.newArrayList();
    switch (call.name()) {
    case "percentile":
      percentile = ((Number) literal(call.arg(1))).doubleValue();
      break;
    case "top":
    case "bottom":
      n = (int) ((IntegerLiteral) call.args().get(call.args().size() - 1)).value();
      group_tags = Lists.newArrayList();
      for (int i = 1; i < call.args().size() - 1; i++) {
        group_tags.add(((VarRef) call.arg(i)).name());
      }
      all_aux.addAll(group_tags);
      break;
    default:
      break;
    }
    for (final String name : aux) {
      if (!all_aux.contains(name)) {
        all_aux.add(name);
      }
    }
    Reducers.checkType(call.name(), type);
    return new CallPlan(call, call.name(), field, type, 
        ImmutableList.copyOf(all_aux), null, 0, 0, percentile, n, 
        ImmutableList.copyOf(group_tags), 
        Reducers.outputType(call.name(), type));
  }
  
  /** @return A fresh reducer for one group, null for raw transforms. */
  public Reducer newReducer() {
    if (function == null) {
      return null;
    }
    switch (function) {
    case "percentile":
      return new PercentileReducer(input_type, percentile);
    case "top":
    case "bottom":
      return new TopBottomReducer(input_type, 
          new TopBottomSelector(function.equals("top"), n, group_tags));
    default:
      return Reducers.newReducer(function, input_type);
    }
  }
  
  /** @return The call as written. */
  public Call call() {
    return call;
  }
  
  /** @return The reducer function name, null for raw transforms. */
  public String function() {
    return function;
  }
  
  /** @return The input field. */
  public String field() {
    return field;
  }
  
  public ValueType inputType() {
    return input_type;
  }
  
  /** @return Auxiliary names carried by each selected point. */
  public List<String> aux() {
    return aux;
  }
  
  /** @return The transform name or null. */
  public String transform() {
    return transform;
  }
  
  /** @return The transform unit in nanoseconds. */
  public long unit() {
    return unit;
  }
  
  /** @return The moving average window. */
  public int window() {
    return window;
  }
  
  public ValueType outputType() {
    return output_type;
  }
  
  /** @return Whether a bucket may yield several points. */
  public boolean isMultiPoint() {
    return "distinct".equals(function) || "top".equals(function) 
        || "bottom".equals(function);
  }
  
  /** @return Whether the reducer returns source points. */
  public boolean isSelector() {
    return function != null && transform == null && 
        Reducers.isSelector(function);
  }
  
  /** @return Whether the reducer is top or bottom. */
  public boolean isTopBottom() {
    return "top".equals(function) || "bottom".equals(function);
  }
  
  @Override
  public String toString() {
    return "CallPlan{call=" + call + ", field=" + field + ", type=" 
        + input_type + ", aux=" + aux + ", output=" + output_type + "}";
  }
  
  private static void validateReducer(final Call call) {
    final String name = call.name();
    final List<Expr> args = call.args();
    switch (name) {
    case "percentile":
      checkArity(call, 2);
      checkField(call);
      if (!(args.get(1) instanceof NumberLiteral) && 
          !(args.get(1) instanceof IntegerLiteral)) {
        throw new InvalidArgumentException("expected float argument in "
            + "percentile()");
      }
      final double percentile = ((Number) literal(args.get(1))).doubleValue();
      if (percentile < 0 || percentile > 100) {
        throw new InvalidArgumentException("percentile must be between 0 "
            + "and 100, got " + percentile);
      }
      return;
    case "top":
    case "bottom":
      if (args.size() < 2) {
        throw new InvalidArgumentException("invalid number of arguments for " 
            + name + ", expected at least 2, got " + args.size());
      }
      if (!(args.get(0) instanceof VarRef)) {
        throw new InvalidArgumentException("expected first argument to be a "
            + "field in " + name + "(), found " + args.get(0));
      }
      final Expr limit = args.get(args.size() - 1);
      if (!(limit instanceof IntegerLiteral)) {
        throw new InvalidArgumentException("expected integer as last argument "
            + "in " + name + "(), found " + limit);
      }
      if (((IntegerLiteral) limit).value() <= 0) {
        throw new InvalidArgumentException("limit (" 
            + ((IntegerLiteral) limit).value() + ") in " + name 
            + " function must be at least 1");
      }
      for (int i = 1; i < args.size() - 1; i++) {
        if (!(args.get(i) instanceof VarRef)) {
          throw new InvalidArgumentException("only fields or tags are "
              + "allowed in " + name + "(), found " + args.get(i));
        }
      }
      return;
    default:
      checkArity(call, 1);
      checkField(call);
    }
  }
  
  private static void validateTransform(final Call call, 
                                        final boolean has_interval) {
    final String name = call.name();
    final List<Expr> args = call.args();
    if (args.isEmpty()) {
      throw new InvalidArgumentException("invalid number of arguments for " 
          + name + ", expected at least 1, got 0");
    }
    switch (name) {
    case "moving_average":
      checkArity(call, 2);
      if (!(args.get(1) instanceof IntegerLiteral)) {
        throw new InvalidArgumentException("second argument for moving_average "
            + "must be an integer, got " + args.get(1));
      }
      if (((IntegerLiteral) args.get(1)).value() <= 1) {
        throw new InvalidArgumentException("moving_average window must be "
            + "greater than 1, got " + args.get(1));
      }
      break;
    case "derivative":
    case "non_negative_derivative":
    case "elapsed":
      if (args.size() > 2) {
        throw new InvalidArgumentException("invalid number of arguments for " 
            + name + ", expected at most 2, got " + args.size());
      }
      if (args.size() == 2 && (!(args.get(1) instanceof DurationLiteral) || 
          ((DurationLiteral) args.get(1)).nanos() <= 0)) {
        throw new InvalidArgumentException("second argument to " + name 
            + " must be a duration greater than 0, got " + args.get(1));
      }
      break;
    default:
      checkArity(call, 1);
    }
    
    final Expr input = args.get(0);
    if (input instanceof Call) {
      final Call inner = (Call) input;
      if (!Reducers.isReducer(inner.name()) || inner.name().equals("top") || 
          inner.name().equals("bottom") || inner.name().equals("distinct")) {
        throw new InvalidArgumentException("unsupported call " + inner.name() 
            + "() inside " + name + "()");
      }
      if (!has_interval) {
        throw new InvalidArgumentException(name 
            + " aggregate requires a GROUP BY interval");
      }
      validateReducer(inner);
    } else if (input instanceof VarRef) {
      if (has_interval) {
        throw new InvalidArgumentException("aggregate function required "
            + "inside the call to " + name);
      }
    } else {
      throw new InvalidArgumentException("expected field argument in " 
          + name + "()");
    }
  }
  
  private static void checkArity(final Call call, final int expected) {
    if (call.args().size() != expected) {
      throw new InvalidArgumentException("invalid number of arguments for " 
          + call.name() + ", expected " + expected + ", got " 
          + call.args().size());
    }
  }
  
  private static void checkField(final Call call) {
    final Expr arg = call.arg(0);
    if (!(arg instanceof VarRef) && !(arg instanceof Wildcard)) {
      throw new InvalidArgumentException("expected field argument in " 
          + call.name() + "()");
    }
  }
  
  private static Object literal(final Expr expr) {
    if (expr instanceof NumberLiteral) {
      return ((NumberLiteral) expr).value();
    }
    return ((IntegerLiteral) expr).value();
  }
}
