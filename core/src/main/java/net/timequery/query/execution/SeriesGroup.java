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
package net.timequery.query.execution;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.timequery.data.TagSet;

/**
 * One output series of a statement: the GROUP BY tag values and the source
 * series that feed it.
 * 
 * @since 3.0
 */
public class SeriesGroup {
  private final TagSet tags;
  private final List<TagSet> members;
  
  public SeriesGroup(final TagSet tags, final List<TagSet> members) {
    this.tags = tags;
    this.members = ImmutableList.copyOf(members);
  }
  
  /** @return The GROUP BY tag values, empty without tag grouping. */
  public TagSet tags() {
    return tags;
  }
  
  /** @return The source series in tag order. */
  public List<TagSet> members() {
    return members;
  }
  
  @Override
  public String toString() {
    return "SeriesGroup{tags=" + tags + ", members=" + members.size() + "}";
  }
}
