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
package net.timequery.query.processor.expressions;

import java.util.List;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.timequery.query.statement.BinaryExpr;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.Expr;
import net.timequery.query.statement.Field;
import net.timequery.query.statement.VarRef;

/**
 * Derives output column names. Calls are named after the function, 
 * references after the field and binary expressions join the names of 
 * both sides with an underscore, literals contributing nothing. A name 
 * already taken gets the first free {@code _N} suffix, so a second 
 * {@code sum} becomes {@code sum_1}.
 * 
 * @since 3.0
 */
public final class ColumnNamer {
  
  private ColumnNamer() {
    // static helpers
  }
  
  /**
   * @param expr An expression.
   * @return The default name, possibly empty.
   */
  public static String defaultName(final Expr expr) {
    if (expr instanceof VarRef) {
      return ((VarRef) expr).name();
    }
    if (expr instanceof Call) {
      return ((Call) expr).name();
    }
    if (expr instanceof BinaryExpr) {
      final String lhs = defaultName(((BinaryExpr) expr).lhs());
      final String rhs = defaultName(((BinaryExpr) expr).rhs());
      if (lhs.isEmpty()) {
        return rhs;
      }
      if (rhs.isEmpty()) {
        return lhs;
      }
      return lhs + "_" + rhs;
    }
    return "";
  }
  
  /**
   * @param fields The select list.
   * @return A unique column name per field, in order.
   */
  public static List<String> columnNames(final List<Field> fields) {
    final Set<String> used = Sets.newHashSet();
    for (final Field field : fields) {
      if (field.alias() != null) {
        used.add(field.alias());
      }
    }
    
    final List<String> names = Lists.newArrayListWithCapacity(fields.size());
    for (final Field field : fields) {
      if (field.alias() != null) {
        names.add(field.alias());
        continue;
      }
      final String base = defaultName(field.expr());
      String name = base;
      for (int i = 1; used.contains(name); i++) {
        name = base + "_" + i;
      }
      names.add(name);
      used.add(name);
    }
    return names;
  }
}
