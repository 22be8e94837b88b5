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
package net.timequery.data.aggregators;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import net.timequery.data.ValueType;
import net.timequery.exceptions.TypeMismatchException;

/**
 * Registry of the bucket reduction functions by name, with the type rules
 * applied when a call is planned.
 * 
 * @since 3.0
 */
public final class Reducers {
  
  /** Functions that derive a value. */
  public static final Set<String> AGGREGATES = ImmutableSet.of(
      "count", "sum", "mean", "median", "mode", "stddev", "spread", 
      "distinct", "percentile");
  
  /** Functions that return a source point. */
  public static final Set<String> SELECTORS = ImmutableSet.of(
      "first", "last", "min", "max", "top", "bottom", "percentile");
  
  /** Functions that only accept integers or floats. */
  private static final Set<String> NUMERIC_ONLY = ImmutableSet.of(
      "sum", "mean", "median", "stddev", "spread", "min", "max", 
      "percentile", "top", "bottom");
  
  private Reducers() {
    // static helpers
  }
  
  /** @return Whether the name is an aggregate or selector. */
  public static boolean isReducer(final String name) {
    return AGGREGATES.contains(name) || SELECTORS.contains(name);
  }
  
  public static boolean isSelector(final String name) {
    return SELECTORS.contains(name);
  }
  
  /**
   * @param name The function name.
   * @param input The input type, may be null if unknown.
   * @return The type emitted by the function, null if unknown.
   */
  public static ValueType outputType(final String name, final ValueType input) {
    switch (name) {
    case "count":
      return ValueType.INTEGER;
    case "mean":
    case "median":
    case "stddev":
      return ValueType.FLOAT;
    default:
      return input;
    }
  }
  
  /**
   * @param name The function name.
   * @param input The input type, null if unknown.
   * @return Whether the function can reduce the type. Unknown types pass.
   */
  public static boolean supports(final String name, final ValueType input) {
    return input == null || input.isNumeric() || !NUMERIC_ONLY.contains(name);
  }
  
  /**
   * Rejects input types the function can't reduce.
   * @param name The function name.
   * @param input The input type, null to skip the check.
   * @throws TypeMismatchException if the type is not supported.
   */
  public static void checkType(final String name, final ValueType input) {
    if (!supports(name, input)) {
      throw new TypeMismatchException("unsupported " + name 
          + " iterator type: " + input);
    }
  }
  
  /**
   * Instantiates a reducer that takes no extra arguments.
   * @param name The function name.
   * @param input The input type, may be null if unknown.
   * @return A new reducer.
   * @throws TypeMismatchException if the type is not supported.
   * @throws IllegalArgumentException if the name is unknown or needs 
   * arguments (percentile, top, bottom).
   */
  public static Reducer newReducer(final String name, final ValueType input) {
    checkType(name, input);
    switch (name) {
    case "count":
      return new CountReducer(input);
    case "sum":
      return new SumReducer(input);
    case "mean":
      return new MeanReducer(input);
    case "median":
      return new MedianReducer(input);
    case "mode":
      return new ModeReducer(input);
    case "stddev":
      return new StddevReducer(input);
    case "spread":
      return new SpreadReducer(input);
    case "distinct":
      return new DistinctReducer(input);
    case "first":
      return new FirstReducer(input);
    case "last":
      return new LastReducer(input);
    case "min":
      return new MinReducer(input);
    case "max":
      return new MaxReducer(input);
    default:
      throw new IllegalArgumentException("No simple reducer named: " + name);
    }
  }
}
