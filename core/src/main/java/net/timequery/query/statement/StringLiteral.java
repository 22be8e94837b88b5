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

/** A quoted string constant. */
public class StringLiteral extends Literal {
  private final String value;
  
  public StringLiteral(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    this.value = value;
  }
  
  public String value() {
    return value;
  }
  
  @Override
  public Value toValue() {
    return Value.ofString(value);
  }
  
  @Override
  public String toString() {
    return "'" + value.replace("'", "\\'") + "'";
  }
}
