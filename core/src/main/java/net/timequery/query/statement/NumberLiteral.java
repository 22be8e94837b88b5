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

import net.timequery.data.Value;

/** A floating point constant. */
public class NumberLiteral extends Literal {
  private final double value;
  
  public NumberLiteral(final double value) {
    this.value = value;
  }
  
  public double value() {
    return value;
  }
  
  @Override
  public Value toValue() {
    return Value.ofDouble(value);
  }
  
  @Override
  public String toString() {
    return Double.toString(value);
  }
}
