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

import java.util.Collections;
import java.util.List;

/**
 * Base class for the nodes of a parsed expression tree. Nodes are immutable
 * and compare equal when they render to the same text, so identical calls
 * written twice in a select list resolve to the same iterator tree.
 * 
 * @since 3.0
 */
public abstract class Expr {
  
  /** @return The direct children of this node, empty for leaves. */
  public List<Expr> children() {
    return Collections.emptyList();
  }
  
  @Override
  public abstract String toString();
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    return toString().equals(o.toString());
  }
  
  @Override
  public int hashCode() {
    return toString().hashCode();
  }
}
