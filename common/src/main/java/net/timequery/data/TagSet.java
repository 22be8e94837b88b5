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
package net.timequery.data;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSortedMap;

/**
 * An immutable set of tag key/value pairs ordered by key. Tag sets compare 
 * lexicographically, key first then value, case sensitive.
 * 
 * @since 3.0
 */
public final class TagSet implements Comparable<TagSet> {
  
  /** The empty tag set. */
  public static final TagSet EMPTY = new TagSet(ImmutableSortedMap.of());
  
  private final ImmutableSortedMap<String, String> tags;
  
  private TagSet(final ImmutableSortedMap<String, String> tags) {
    this.tags = tags;
  }
  
  /**
   * @param tags A map of tags, may be null or empty.
   * @return A tag set.
   */
  public static TagSet of(final Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) {
      return EMPTY;
    }
    return new TagSet(ImmutableSortedMap.copyOf(tags));
  }
  
  /**
   * Builds a tag set from alternating keys and values.
   * @param pairs Keys and values, must be of even length.
   * @return A tag set.
   */
  public static TagSet of(final String... pairs) {
    if (pairs.length % 2 != 0) {
      throw new IllegalArgumentException("Tags must be given as key/value pairs.");
    }
    if (pairs.length == 0) {
      return EMPTY;
    }
    final ImmutableSortedMap.Builder<String, String> builder = 
        ImmutableSortedMap.naturalOrder();
    for (int i = 0; i < pairs.length; i += 2) {
      builder.put(pairs[i], pairs[i + 1]);
    }
    return new TagSet(builder.build());
  }
  
  /** @return The tag value or null if the key isn't present. */
  public String get(final String key) {
    return tags.get(key);
  }
  
  public boolean isEmpty() {
    return tags.isEmpty();
  }
  
  public int size() {
    return tags.size();
  }
  
  /** @return The sorted tag keys. */
  public Collection<String> keys() {
    return tags.keySet();
  }
  
  /** @return The underlying immutable map. */
  public Map<String, String> asMap() {
    return tags;
  }
  
  /**
   * Projects the tags down to the given keys. Keys missing from this set map
   * to the empty string so that series lacking a grouping tag still share a
   * partition.
   * @param keys The keys to retain.
   * @return The projected tag set.
   */
  public TagSet subset(final Collection<String> keys) {
    if (keys == null || keys.isEmpty()) {
      return EMPTY;
    }
    final ImmutableSortedMap.Builder<String, String> builder = 
        ImmutableSortedMap.naturalOrder();
    for (final String key : keys) {
      final String value = tags.get(key);
      builder.put(key, value == null ? "" : value);
    }
    return new TagSet(builder.build());
  }
  
  /**
   * @param other Tags to merge in. Keys in the other set win.
   * @return A new merged tag set.
   */
  public TagSet merge(final TagSet other) {
    if (other == null || other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    final Map<String, String> merged = new TreeMap<String, String>(tags);
    merged.putAll(other.tags);
    return new TagSet(ImmutableSortedMap.copyOf(merged));
  }
  
  @Override
  public int compareTo(final TagSet other) {
    final Iterator<Entry<String, String>> left = tags.entrySet().iterator();
    final Iterator<Entry<String, String>> right = other.tags.entrySet().iterator();
    while (left.hasNext() && right.hasNext()) {
      final Entry<String, String> l = left.next();
      final Entry<String, String> r = right.next();
      int cmp = l.getKey().compareTo(r.getKey());
      if (cmp != 0) {
        return cmp;
      }
      cmp = l.getValue().compareTo(r.getValue());
      if (cmp != 0) {
        return cmp;
      }
    }
    if (left.hasNext()) {
      return 1;
    }
    return right.hasNext() ? -1 : 0;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TagSet)) {
      return false;
    }
    return tags.equals(((TagSet) o).tags);
  }
  
  @Override
  public int hashCode() {
    return tags.hashCode();
  }
  
  /** @return The tags as {@code k1=v1,k2=v2}. */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (final Entry<String, String> entry : tags.entrySet()) {
      if (buf.length() > 0) {
        buf.append(',');
      }
      buf.append(entry.getKey()).append('=').append(entry.getValue());
    }
    return buf.toString();
  }
}
