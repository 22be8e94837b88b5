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
package net.timequery.query.processor.topn;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.timequery.data.Point;
import net.timequery.data.TagSet;

/**
 * Picks the N largest (top) or smallest (bottom) points of a candidate 
 * list. Candidates are ranked by value, then ascending timestamp, then 
 * input order. With grouping tags only the best point of each distinct tag 
 * combination is eligible. The selected points are returned sorted by 
 * ascending timestamp, ties in rank order.
 * 
 * @since 3.0
 */
public class TopBottomSelector {
  private final boolean top;
  private final int n;
  private final List<String> group_tags;
  
  /**
   * @param top True for top, false for bottom.
   * @param n The number of points to select, at least 1.
   * @param group_tags Tag keys whose combinations may contribute only one
   * point each, may be empty.
   */
  public TopBottomSelector(final boolean top, 
                           final int n, 
                           final List<String> group_tags) {
    if (n < 1) {
      throw new IllegalArgumentException("N must be greater than 0: " + n);
    }
    this.top = top;
    this.n = n;
    this.group_tags = group_tags == null ? 
        Collections.<String>emptyList() : group_tags;
  }
  
  /**
   * @param candidates Points in input order. Null values are ignored.
   * @return The selection in rank order, at most N points.
   */
  public List<Point> rank(final List<Point> candidates) {
    final List<Candidate> eligible = Lists.newArrayList();
    if (group_tags.isEmpty()) {
      for (int i = 0; i < candidates.size(); i++) {
        if (!candidates.get(i).isNull()) {
          eligible.add(new Candidate(candidates.get(i), i));
        }
      }
    } else {
      final Map<TagSet, Candidate> best = Maps.newHashMap();
      for (int i = 0; i < candidates.size(); i++) {
        final Point point = candidates.get(i);
        if (point.isNull()) {
          continue;
        }
        final Candidate candidate = new Candidate(point, i);
        final TagSet key = point.tags().subset(group_tags);
        final Candidate existing = best.get(key);
        if (existing == null || ranking(top).compare(candidate, existing) < 0) {
          best.put(key, candidate);
        }
      }
      eligible.addAll(best.values());
    }
    
    Collections.sort(eligible, ranking(top));
    final List<Point> ranked = Lists.newArrayListWithCapacity(
        Math.min(n, eligible.size()));
    for (int i = 0; i < eligible.size() && i < n; i++) {
      ranked.add(eligible.get(i).point);
    }
    return ranked;
  }
  
  /**
   * @param candidates Points in input order.
   * @return The selection sorted by ascending timestamp.
   */
  public List<Point> select(final Collection<Point> candidates) {
    final List<Point> selected = rank(Lists.newArrayList(candidates));
    // stable, so equal timestamps keep rank order
    Collections.sort(selected, new Comparator<Point>() {
      @Override
      public int compare(final Point a, final Point b) {
        return Long.compare(a.timestamp(), b.timestamp());
      }
    });
    return selected;
  }
  
  public boolean isTop() {
    return top;
  }
  
  public int n() {
    return n;
  }
  
  public List<String> groupTags() {
    return group_tags;
  }
  
  private static Comparator<Candidate> ranking(final boolean top) {
    return new Comparator<Candidate>() {
      @Override
      public int compare(final Candidate a, final Candidate b) {
        final int by_value = a.point.value().compareTo(b.point.value());
        return ComparisonChain.start()
            .compare(top ? -by_value : by_value, 0)
            .compare(a.point.timestamp(), b.point.timestamp())
            .compare(a.index, b.index)
            .result();
      }
    };
  }
  
  /** A point and its input position. */
  private static class Candidate {
    private final Point point;
    private final int index;
    
    Candidate(final Point point, final int index) {
      this.point = point;
      this.index = index;
    }
  }
}
