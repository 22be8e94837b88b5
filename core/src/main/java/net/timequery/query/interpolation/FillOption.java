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
package net.timequery.query.interpolation;

import net.timequery.data.Value;

/**
 * A fill policy with its literal for {@link FillPolicy#NUMBER}.
 * 
 * @since 3.0
 */
public class FillOption {
  public static final FillOption NULL = new FillOption(FillPolicy.NULL, null);
  public static final FillOption NONE = new FillOption(FillPolicy.NONE, null);
  public static final FillOption PREVIOUS = 
      new FillOption(FillPolicy.PREVIOUS, null);
  public static final FillOption LINEAR = 
      new FillOption(FillPolicy.LINEAR, null);
  
  private final FillPolicy policy;
  private final Value value;
  
  private FillOption(final FillPolicy policy, final Value value) {
    this.policy = policy;
    this.value = value;
  }
  
  /**
   * @param value A numeric literal.
   * @return A {@link FillPolicy#NUMBER} option.
   * @throws IllegalArgumentException if the value is null or not numeric.
   */
  public static FillOption number(final Value value) {
    if (value == null || !value.isNumeric()) {
      throw new IllegalArgumentException("Fill value must be numeric: " + value);
    }
    return new FillOption(FillPolicy.NUMBER, value);
  }
  
  public static FillOption number(final double value) {
    return number(Value.ofDouble(value));
  }
  
  public static FillOption number(final long value) {
    return number(Value.ofLong(value));
  }
  
  public FillPolicy policy() {
    return policy;
  }
  
  /** @return The literal, null unless the policy is NUMBER. */
  public Value value() {
    return value;
  }
  
  @Override
  public String toString() {
    return policy == FillPolicy.NUMBER ? "fill(" + value + ")" : 
      "fill(" + policy.name().toLowerCase() + ")";
  }
}
