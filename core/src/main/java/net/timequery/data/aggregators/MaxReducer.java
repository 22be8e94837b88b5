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
package net.timequery.data.aggregators;

import net.timequery.data.Point;
import net.timequery.data.ValueType;

/** The largest value. Ties keep the earliest point. */
public class MaxReducer extends SelectorReducer {
  
  public MaxReducer(final ValueType input_type) {
    super("max", input_type);
  }
  
  @Override
  protected boolean replaces(final Point candidate, final Point current) {
    final int cmp = candidate.value().compareTo(current.value());
    return cmp > 0 || (cmp == 0 && candidate.timestamp() < current.timestamp());
  }
}
