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

/** A true or false constant. */
public class BooleanLiteral extends Literal {
  public static final BooleanLiteral TRUE = new BooleanLiteral(true);
  public static final BooleanLiteral FALSE = new BooleanLiteral(false);
  
  private final boolean value;
  
  private BooleanLiteral(final boolean value) {
    this.value = value;
  }
  
  public static BooleanLiteral of(final boolean value) {
    return value ? TRUE : FALSE;
  }
  
  public boolean value() {
    return value;
  }
  
  @Override
  public Value toValue() {
    return Value.ofBoolean(value);
  }
  
  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
