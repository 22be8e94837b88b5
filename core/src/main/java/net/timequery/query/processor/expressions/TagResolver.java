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

import net.timequery.data.TagSet;
import net.timequery.data.Value;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.VarRef;

/**
 * Resolves references against a series tag set when filtering series at 
 * plan time. Missing tags resolve to the empty string.
 * 
 * @since 3.0
 */
public class TagResolver implements ExpressionEvaluator.Resolver {
  private final TagSet tags;
  
  public TagResolver(final TagSet tags) {
    this.tags = tags;
  }
  
  @Override
  public Value resolve(final VarRef ref) {
    final String value = tags.get(ref.name());
    return Value.ofString(value == null ? "" : value);
  }

  @Override
  public Value resolve(final Call call) {
    throw new IllegalStateException("Calls can't filter series: " + call);
  }
}
