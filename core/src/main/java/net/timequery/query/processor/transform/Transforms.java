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
package net.timequery.query.processor.transform;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import net.timequery.data.CloseableIterator;
import net.timequery.data.ValueType;
import net.timequery.exceptions.TypeMismatchException;
import net.timequery.query.processor.downsample.Bucket;

/**
 * Registry of window transform functions.
 * 
 * @since 3.0
 */
public final class Transforms {
  
  public static final Set<String> NAMES = ImmutableSet.of(
      "derivative", "non_negative_derivative", "difference", 
      "non_negative_difference", "moving_average", "cumulative_sum", 
      "elapsed");
  
  /** Default unit for elapsed. */
  public static final long ELAPSED_UNIT = 1L;
  
  private Transforms() {
    // static helpers
  }
  
  public static boolean isTransform(final String name) {
    return NAMES.contains(name);
  }
  
  /**
   * @param name A transform name.
   * @param input The input type, may be null.
   * @return The output type, null if unknown.
   */
  public static ValueType outputType(final String name, final ValueType input) {
    switch (name) {
    case "derivative":
    case "non_negative_derivative":
    case "moving_average":
      return ValueType.FLOAT;
    case "elapsed":
      return ValueType.INTEGER;
    default:
      return input;
    }
  }
  
  /**
   * @param name A transform name.
   * @param input The input type, null if unknown.
   * @return Whether the transform accepts the type.
   */
  public static boolean supports(final String name, final ValueType input) {
    return input == null || input.isNumeric() || name.equals("elapsed");
  }
  
  /**
   * @param name A transform name.
   * @param input The input type, null to skip the check.
   * @throws TypeMismatchException if the transform can't take the type.
   */
  public static void checkType(final String name, final ValueType input) {
    if (!supports(name, input)) {
      throw new TypeMismatchException("unsupported " + name 
          + " iterator type: " + input);
    }
  }
  
  /**
   * @param name A transform name.
   * @param n The moving average window, ignored otherwise.
   * @return How many buckets ahead of the range start the transform 
   * needs to produce a value at the start.
   */
  public static int lookback(final String name, final int n) {
    switch (name) {
    case "moving_average":
      return n - 1;
    case "cumulative_sum":
      return 0;
    default:
      return 1;
    }
  }
  
  /**
   * @param name A transform name.
   * @param source The ascending input.
   * @param emit_from First timestamp to emit.
   * @param unit The unit for derivative and elapsed in nanoseconds.
   * @param n The moving average window.
   * @return The transform iterator.
   */
  public static TransformIterator newTransform(
      final String name, 
      final CloseableIterator<Bucket> source, 
      final long emit_from,
      final long unit, 
      final int n) {
    switch (name) {
    case "derivative":
      return new DerivativeIterator(source, emit_from, unit, false);
    case "non_negative_derivative":
      return new DerivativeIterator(source, emit_from, unit, true);
    case "difference":
      return new DifferenceIterator(source, emit_from, false);
    case "non_negative_difference":
      return new DifferenceIterator(source, emit_from, true);
    case "moving_average":
      return new MovingAverageIterator(source, emit_from, n);
    case "cumulative_sum":
      return new CumulativeSumIterator(source, emit_from);
    case "elapsed":
      return new ElapsedIterator(source, emit_from, unit);
    default:
      throw new IllegalArgumentException("Unknown transform: " + name);
    }
  }
}
