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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.timequery.data.CloseableIterator;
import net.timequery.data.Row;
import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.aggregators.Reducer;
import net.timequery.data.iterators.CloseableIterators;
import net.timequery.data.iterators.PointIterators;
import net.timequery.query.interpolation.FillIterator;
import net.timequery.query.processor.downsample.Bucket;
import net.timequery.query.processor.downsample.DownsampleIterator;
import net.timequery.query.processor.downsample.RawBucketIterator;
import net.timequery.query.processor.downsample.TimeBucketer;
import net.timequery.query.processor.expressions.RowFilterIterator;
import net.timequery.query.processor.merge.LimitOffsetIterator;
import net.timequery.query.processor.merge.PointOrder;
import net.timequery.query.processor.merge.SortedMergeIterator;
import net.timequery.query.processor.transform.Transforms;
import net.timequery.query.statement.Exprs;
import net.timequery.query.statement.VarRef;

/**
 * Builds the iterator tree for one output series of a plan. 
 * <p>
 * Raw statements merge the member series in time order, filter and 
 * project each row. Aggregate statements build one pipeline per call:
 * rows, points, buckets, fill and an optional transform, then join the 
 * pipelines on time. Both finish with LIMIT and OFFSET.
 * <p>
 * With GROUP BY time, every call of every group buckets over the same 
 * range so the calls line up in a row and groups share their bucket 
 * times. Bounds the statement leaves open are taken from the earliest and
 * latest matching points across all calls and groups, resolved once per 
 * evaluator.
 * 
 * @since 3.0
 */
public class GroupEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(
      GroupEvaluator.class);
  
  private final StatementPlan plan;
  
  /** The shared bucket range, null until resolved. */
  private TimeRange bucket_range;
  
  /** @param plan A non-empty plan. */
  public GroupEvaluator(final StatementPlan plan) {
    if (plan == null || plan.source() == null) {
      throw new IllegalArgumentException("Plan cannot be null or empty.");
    }
    this.plan = plan;
  }
  
  /**
   * @param group One of the plan's groups.
   * @return The output rows, owned by the caller.
   */
  public CloseableIterator<Row> open(final SeriesGroup group) {
    final CloseableIterator<Row> rows = plan.isAggregate() ? 
        openAggregate(group) : openRaw(group);
    return new LimitOffsetIterator<Row>(rows, plan.statement().limit(), 
        plan.statement().offset());
  }
  
  private CloseableIterator<Row> openRaw(final SeriesGroup group) {
    final boolean ascending = plan.statement().ascending();
    CloseableIterator<Row> rows = openMembers(group, plan.readFields(), 
        plan.range(), ascending);
    if (plan.condition() != null) {
      rows = new RowFilterIterator(rows, plan.condition(), 
          plan.source().tagKeys());
    }
    return new ProjectionIterator(rows, plan, group.tags());
  }
  
  private CloseableIterator<Row> openAggregate(final SeriesGroup group) {
    final List<CloseableIterator<Bucket>> streams = 
        Lists.newArrayListWithCapacity(plan.calls().size());
    try {
      for (final CallPlan call : plan.calls()) {
        streams.add(openCall(group, call));
      }
    } catch (RuntimeException e) {
      PointIterators.closeAll(streams);
      throw e;
    }
    final CloseableIterator<Row> rows = new RowAssembler(streams, plan, 
        group.tags());
    if (plan.statement().ascending()) {
      return rows;
    }
    // buckets are reduced ascending, so a descending group holds its rows
    return CloseableIterators.reverse(rows);
  }
  
  /**
   * @return The range every bucketing call uses: the plan's range with 
   * open bounds closed at the earliest and latest matching points. Bounds 
   * stay open when nothing matches.
   */
  public synchronized TimeRange bucketRange() {
    if (bucket_range != null) {
      return bucket_range;
    }
    final TimeRange range = plan.range();
    if (plan.bucketer() == null || (range.hasStart() && range.hasEnd())) {
      bucket_range = range;
      return bucket_range;
    }
    
    long first = Long.MAX_VALUE;
    long last = Long.MIN_VALUE;
    for (final SeriesGroup group : plan.groups()) {
      for (final CallPlan call : plan.calls()) {
        if (call.function() == null) {
          continue;
        }
        if (!range.hasStart()) {
          first = Math.min(first, edge(group, call, true, Long.MAX_VALUE));
        }
        if (!range.hasEnd()) {
          last = Math.max(last, edge(group, call, false, Long.MIN_VALUE));
        }
      }
    }
    
    if ((!range.hasStart() && first == Long.MAX_VALUE) || 
        (!range.hasEnd() && last == Long.MIN_VALUE)) {
      bucket_range = range;
    } else {
      bucket_range = new TimeRange(range.hasStart() ? range.start() : first, 
          range.hasEnd() ? range.end() : last);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Bucketing " + plan.name() + " over " + bucket_range 
          + " for query range " + range);
    }
    return bucket_range;
  }
  
  /**
   * @return The timestamp of the first matching point of the call in the 
   * given order, or the default if there is none.
   */
  private long edge(final SeriesGroup group, 
                    final CallPlan call, 
                    final boolean ascending, 
                    final long otherwise) {
    final RowPointIterator points = openPoints(group, call, plan.range(), 
        ascending);
    try {
      return points.hasNext() ? points.next().timestamp() : otherwise;
    } finally {
      points.close();
    }
  }
  
  /** Wires one call's pipeline. Reducers always read in ascending order. */
  private CloseableIterator<Bucket> openCall(final SeriesGroup group, 
                                             final CallPlan call) {
    final TimeBucketer bucketer = plan.bucketer();
    final TimeRange range = bucketer == null ? plan.range() : bucketRange();
    int lookback = 0;
    long emit_from = Long.MIN_VALUE;
    TimeRange read_range = range;
    if (call.transform() != null && call.function() != null && 
        bucketer != null && plan.range().hasStart()) {
      lookback = Transforms.lookback(call.transform(), call.window());
      emit_from = bucketer.start(range.start());
      read_range = range.withStart(
          DownsampleIterator.firstBucket(bucketer, range, lookback));
    }
    
    final RowPointIterator points = openPoints(group, call, read_range, true);
    if (call.function() == null) {
      return Transforms.newTransform(call.transform(), 
          new RawBucketIterator(points), emit_from, call.unit(), 
          call.window());
    }
    
    final Reducer reducer = call.newReducer();
    final boolean keep_point_time = call.isTopBottom() || 
        (bucketer == null && plan.calls().size() == 1 && call.isSelector());
    CloseableIterator<Bucket> buckets = new DownsampleIterator(points, 
        reducer, bucketer, range, lookback, keep_point_time, plan.context());
    if (bucketer != null) {
      buckets = new FillIterator(buckets, plan.fill(), reducer.outputType());
    }
    if (call.transform() != null) {
      buckets = Transforms.newTransform(call.transform(), buckets, emit_from, 
          call.unit(), call.window());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Opened " + call + " over " + group + " reading " + read_range 
          + " with " + reducer.name() + " from " + emit_from);
    }
    return buckets;
  }
  
  /** Opens the call's field of every member, filtered by the condition. */
  private RowPointIterator openPoints(final SeriesGroup group, 
                                     final CallPlan call,
                                     final TimeRange range,
                                     final boolean ascending) {
    final Set<String> fields = new LinkedHashSet<String>();
    fields.add(call.field());
    fields.addAll(call.aux());
    if (plan.condition() != null) {
      for (final VarRef ref : Exprs.allRefs(plan.condition())) {
        fields.add(ref.name());
      }
    }
    
    CloseableIterator<Row> rows = openMembers(group, fields, range, ascending);
    if (plan.condition() != null) {
      rows = new RowFilterIterator(rows, plan.condition(), 
          plan.source().tagKeys());
    }
    return new RowPointIterator(rows, call.field(), call.aux(), 
        call.inputType());
  }
  
  /**
   * Opens every member series of the group and merges them into one row
   * stream ordered by time, then write sequence, then tags.
   */
  private CloseableIterator<Row> openMembers(final SeriesGroup group,
                                             final Collection<String> fields,
                                             final TimeRange range,
                                             final boolean ascending) {
    final List<CloseableIterator<Row>> members = 
        Lists.newArrayListWithCapacity(group.members().size());
    try {
      for (final TagSet series : group.members()) {
        members.add(plan.source().open(series, fields, range, ascending));
      }
    } catch (RuntimeException e) {
      PointIterators.closeAll(members);
      throw e;
    }
    if (members.size() == 1) {
      return members.get(0);
    }
    return new SortedMergeIterator<Row>(members, PointOrder.rows(ascending), 
        plan.context());
  }
}
