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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A function invocation such as {@code mean(value)} or 
 * {@code top(value, host, 3)}.
 * 
 * @since 3.0
 */
public class Call extends Expr {
  private final String name;
  private final List<Expr> args;
  
  public Call(final String name, final Expr... args) {
    this(name, ImmutableList.copyOf(args));
  }
  
  public Call(final String name, final List<Expr> args) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Function name cannot be null "
          + "or empty.");
    }
    this.name = name.toLowerCase();
    this.args = args == null ? ImmutableList.<Expr>of() : 
      ImmutableList.copyOf(args);
  }
  
  /** @return The lower case function name. */
  public String name() {
    return name;
  }
  
  public List<Expr> args() {
    return args;
  }
  
  /** @return The argument at the index or null if not present. */
  public Expr arg(final int index) {
    return index < args.size() ? args.get(index) : null;
  }
  
  @Override
  public List<Expr> children() {
    return args;
  }
  
  @Override
  public String toString() {
    return name + "(" + Joiner.on(", ").join(args) + ")";
  }
}
