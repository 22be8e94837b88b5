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
package net.timequery.data;

/**
 * The closed set of value types a point may carry. Every function in the
 * engine switches over this enum instead of inspecting value classes.
 * 
 * @since 3.0
 */
public enum ValueType {
  FLOAT,
  INTEGER,
  STRING,
  BOOLEAN;
  
  /** @return True if the type supports arithmetic. */
  public boolean isNumeric() {
    return this == FLOAT || this == INTEGER;
  }
  
  /**
   * The type produced by combining two numeric types with an arithmetic
   * operator other than division.
   * @param left The left hand type, may be null if unknown.
   * @param right The right hand type, may be null if unknown.
   * @return The widened type or null if either side is unknown.
   */
  public static ValueType widen(final ValueType left, final ValueType right) {
    if (left == null || right == null) {
      return null;
    }
    if (left == INTEGER && right == INTEGER) {
      return INTEGER;
    }
    return FLOAT;
  }
  
  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
