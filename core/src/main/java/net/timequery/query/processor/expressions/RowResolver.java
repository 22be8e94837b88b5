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

import java.util.Set;

import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.VarRef;

/**
 * Resolves references against a row: its values first, then its tags. A 
 * known tag key missing from the row resolves to the empty string.
 * 
 * @since 3.0
 */
public class RowResolver implements ExpressionEvaluator.Resolver {
  private final Set<String> tag_keys;
  private Row row;
  
  /** @param tag_keys The tag keys of the source. */
  public RowResolver(final Set<String> tag_keys) {
    this.tag_keys = tag_keys;
  }
  
  /** @param row The row to resolve against next. */
  public RowResolver reset(final Row row) {
    this.row = row;
    return this;
  }
  
  @Override
  public Value resolve(final VarRef ref) {
    final Value value = row.get(ref.name());
    if (value != null) {
      return value;
    }
    return resolveTag(row.tags(), ref.name(), tag_keys);
  }

  @Override
  public Value resolve(final Call call) {
    throw new IllegalStateException("Calls can't be resolved against raw "
        + "rows: " + call);
  }
  
  static Value resolveTag(final TagSet tags, 
                          final String key, 
                          final Set<String> tag_keys) {
    final String tag = tags.get(key);
    if (tag != null) {
      return Value.ofString(tag);
    }
    return tag_keys.contains(key) ? Value.ofString("") : null;
  }
}
