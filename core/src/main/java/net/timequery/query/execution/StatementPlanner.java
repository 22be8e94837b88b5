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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.timequery.data.TagSet;
import net.timequery.data.TimeRange;
import net.timequery.data.ValueType;
import net.timequery.data.aggregators.Reducers;
import net.timequery.exceptions.DistinctCombinationException;
import net.timequery.exceptions.InvalidArgumentException;
import net.timequery.exceptions.LimitExceededException;
import net.timequery.exceptions.MixedAggregateException;
import net.timequery.exceptions.NotFoundException;
import net.timequery.query.QueryContext;
import net.timequery.query.interpolation.FillOption;
import net.timequery.query.processor.downsample.TimeBucketer;
import net.timequery.query.processor.expressions.ColumnNamer;
import net.timequery.query.processor.expressions.ExpressionEvaluator;
import net.timequery.query.processor.expressions.TagResolver;
import net.timequery.query.processor.merge.ShardScanner;
import net.timequery.query.processor.transform.Transforms;
import net.timequery.query.statement.BinaryExpr;
import net.timequery.query.statement.Call;
import net.timequery.query.statement.Dimensions;
import net.timequery.query.statement.Expr;
import net.timequery.query.statement.Exprs;
import net.timequery.query.statement.Field;
import net.timequery.query.statement.IntegerLiteral;
import net.timequery.query.statement.Literal;
import net.timequery.query.statement.MeasurementSource;
import net.timequery.query.statement.Operator;
import net.timequery.query.statement.SelectStatement;
import net.timequery.query.statement.SubQuerySource;
import net.timequery.query.statement.VarRef;
import net.timequery.query.statement.Wildcard;
import net.timequery.storage.SchemaCatalog;

/**
 * Turns a select statement into a {@link StatementPlan}. Structural checks
 * that don't need the schema run first so malformed statements fail even
 * when the source doesn't exist. Then the source is resolved, wildcards 
 * are expanded against it, calls are compiled and the matching series are
 * grouped and paginated. 
 * <p>
 * A missing measurement, or an aggregate over fields the measurement 
 * doesn't have, plans to an empty result. A missing database or retention
 * policy is an error.
 * 
 * @since 3.0
 */
public class StatementPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      StatementPlanner.class);
  
  private final SchemaCatalog catalog;
  private final ExecutorService executor;
  private final QueryContext context;
  
  /**
   * Default ctor.
   * @param catalog A non-null catalog.
   * @param executor An optional pool for parallel shard scans.
   * @param context A non-null context for this execution.
   */
  public StatementPlanner(final SchemaCatalog catalog, 
                          final ExecutorService executor,
                          final QueryContext context) {
    if (catalog == null) {
      throw new IllegalArgumentException("Catalog cannot be null.");
    }
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    this.catalog = catalog;
    this.executor = executor;
    this.context = context;
  }
  
  /**
   * @param statement A non-null statement.
   * @return The plan, possibly empty.
   * @throws net.timequery.exceptions.QueryExecutionException if the 
   * statement is invalid.
   */
  public StatementPlan plan(final SelectStatement statement) {
    return plan(statement, TimeRange.UNBOUNDED);
  }
  
  /**
   * Plans a statement nested in an outer one, inheriting the outer time 
   * bounds the statement doesn't set itself.
   * @param statement A non-null statement.
   * @param outer The outer statement's range.
   * @return The plan, possibly empty.
   */
  protected StatementPlan plan(final SelectStatement statement, 
                               final TimeRange outer) {
    final TimeRange own = statement.timeRange();
    final TimeRange range = new TimeRange(
        own.hasStart() ? own.start() : outer.start(),
        own.hasEnd() ? own.end() : outer.end());
    final Dimensions dimensions = statement.dimensions();
    
    validate(statement);
    
    final SeriesSource source = resolveSource(statement, range);
    if (source == null) {
      return StatementPlan.empty(statement, range, context);
    }
    
    final Map<String, ValueType> field_types = source.fieldTypes();
    final Set<String> tag_keys = source.tagKeys();
    final List<String> group_keys;
    if (dimensions.isWildcard()) {
      group_keys = Lists.newArrayList(new TreeSet<String>(tag_keys));
    } else {
      group_keys = dimensions.tags();
    }
    
    final List<Field> fields = expand(statement.fields(), field_types, 
        tag_keys, group_keys);
    
    // distinct calls and bare references after expansion
    final Map<Call, CallPlan> calls = new LinkedHashMap<Call, CallPlan>();
    final Set<String> bare = new LinkedHashSet<String>();
    for (final Field field : fields) {
      for (final Call call : Exprs.calls(field.expr())) {
        calls.put(call, null);
      }
      for (final VarRef ref : Exprs.bareRefs(field.expr())) {
        bare.add(ref.name());
      }
    }
    
    // GROUP BY * only allows bare references to the grouped tags
    if (!calls.isEmpty() && dimensions.isWildcard() && 
        !isSelectorWithAux(calls)) {
      for (final String name : bare) {
        if (!group_keys.contains(name)) {
          throw new MixedAggregateException();
        }
      }
    }
    
    final List<String> aux;
    if (isSelectorWithAux(calls)) {
      aux = Lists.newArrayList(bare);
    } else {
      aux = Collections.emptyList();
    }
    
    final Expr[] split = splitCondition(statement.condition(), field_types, 
        tag_keys);
    final Expr tag_condition = split[0];
    final Expr row_condition = split[1];
    
    final List<CallPlan> call_plans = Lists.newArrayList();
    final List<String> read_fields = Lists.newArrayList();
    if (!calls.isEmpty()) {
      boolean any_field = false;
      for (final Call call : calls.keySet()) {
        if (field_types.containsKey(fieldOf(call))) {
          any_field = true;
        }
      }
      if (!any_field) {
        LOG.debug("No fields of " + calls.keySet() + " in " + source 
            + ", returning an empty result");
        return StatementPlan.empty(statement, range, context);
      }
      for (final Entry<Call, CallPlan> entry : calls.entrySet()) {
        final CallPlan plan = CallPlan.compile(entry.getKey(), field_types, 
            dimensions.hasInterval(), dimensions.interval(), aux);
        entry.setValue(plan);
        call_plans.add(plan);
      }
    } else {
      boolean all_tags = !bare.isEmpty();
      for (final String name : bare) {
        if (field_types.containsKey(name)) {
          read_fields.add(name);
          all_tags = false;
        } else if (!tag_keys.contains(name)) {
          all_tags = false;
        }
      }
      if (read_fields.isEmpty()) {
        if (all_tags) {
          throw new InvalidArgumentException("statement must have at least "
              + "one field in select clause");
        }
        LOG.debug("No fields of " + bare + " in " + source 
            + ", returning an empty result");
        return StatementPlan.empty(statement, range, context);
      }
      if (row_condition != null) {
        for (final VarRef ref : Exprs.allRefs(row_condition)) {
          if (field_types.containsKey(ref.name()) && 
              !read_fields.contains(ref.name())) {
            read_fields.add(ref.name());
          }
        }
      }
    }
    
    // series selection
    final List<TagSet> matched = Lists.newArrayList();
    for (final TagSet series : source.series()) {
      if (ExpressionEvaluator.matches(tag_condition, new TagResolver(series))) {
        matched.add(series);
      }
    }
    if (source instanceof MeasurementSeriesSource) {
      final int max = context.limits().maxSelectSeries();
      if (max > 0 && matched.size() > max) {
        LOG.warn("Rejecting statement over " + source + " matching " 
            + matched.size() + " series, limit is " + max);
        throw LimitExceededException.guard("max-select-series", 
            matched.size(), max);
      }
    }
    
    final TreeMap<TagSet, List<TagSet>> grouped = 
        new TreeMap<TagSet, List<TagSet>>();
    for (final TagSet series : matched) {
      final TagSet key = group_keys.isEmpty() ? TagSet.EMPTY : 
        series.subset(group_keys);
      List<TagSet> members = grouped.get(key);
      if (members == null) {
        members = Lists.newArrayList();
        grouped.put(key, members);
      }
      members.add(series);
    }
    final List<SeriesGroup> groups = Lists.newArrayList();
    int skipped = 0;
    for (final Entry<TagSet, List<TagSet>> entry : grouped.entrySet()) {
      if (skipped++ < statement.soffset()) {
        continue;
      }
      if (statement.slimit() > 0 && groups.size() >= statement.slimit()) {
        break;
      }
      groups.add(new SeriesGroup(entry.getKey(), entry.getValue()));
    }
    
    FillOption fill = statement.fill();
    for (final CallPlan plan : call_plans) {
      if (plan.isMultiPoint()) {
        fill = FillOption.NONE;
      }
    }
    
    final List<ValueType> column_types = 
        Lists.newArrayListWithCapacity(fields.size());
    for (final Field field : fields) {
      column_types.add(typeOf(field.expr(), field_types, calls));
    }
    
    final StatementPlan plan = StatementPlan.newBuilder()
        .setStatement(statement)
        .setSource(source)
        .setRange(range)
        .setFields(fields)
        .setColumns(ColumnNamer.columnNames(fields))
        .setColumnTypes(column_types)
        .setGroupKeys(group_keys)
        .setGroups(groups)
        .setCalls(call_plans)
        .setCondition(row_condition)
        .setReadFields(read_fields)
        .setBucketer(dimensions.hasInterval() ? 
            new TimeBucketer(dimensions.interval(), dimensions.offset(), 
                dimensions.zone()) : null)
        .setFill(fill)
        .setContext(context)
        .build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Planned [" + statement + "] as " + plan);
    }
    return plan;
  }
  
  /**
   * Schema independent checks.
   * @param statement The statement.
   */
  void validate(final SelectStatement statement) {
    final Dimensions dimensions = statement.dimensions();
    final List<Field> fields = statement.fields();
    if (fields.isEmpty()) {
      throw new InvalidArgumentException("at least one field is required "
          + "in the select clause");
    }
    
    final List<Call> calls = Lists.newArrayList();
    final List<VarRef> bare = Lists.newArrayList();
    boolean bare_wildcard = false;
    for (final Field field : fields) {
      calls.addAll(Exprs.calls(field.expr()));
      bare.addAll(Exprs.bareRefs(field.expr()));
      if (field.expr() instanceof Wildcard) {
        bare_wildcard = true;
      }
    }
    
    for (final Call call : calls) {
      CallPlan.validate(call, dimensions.hasInterval());
    }
    
    for (final Call call : calls) {
      if (call.name().equals("distinct") && (fields.size() != 1 || 
          !call.equals(fields.get(0).expr()))) {
        throw new DistinctCombinationException();
      }
      if (call.name().equals("top") || call.name().equals("bottom")) {
        if (calls.size() > 1 || !isField(call, fields)) {
          throw new InvalidArgumentException("selector function " 
              + call.name() + "() cannot be combined with other functions");
        }
        final long n = ((IntegerLiteral) 
            call.args().get(call.args().size() - 1)).value();
        if (statement.limit() > 0 && n > statement.limit()) {
          throw new LimitExceededException("limit (" + n + ") in " 
              + call.name() + " function can not be larger than the LIMIT (" 
              + statement.limit() + ") in the select statement");
        }
      }
    }
    
    if (!calls.isEmpty() && (!bare.isEmpty() || bare_wildcard)) {
      final boolean selector = calls.size() == 1 && 
          Reducers.isSelector(calls.get(0).name()) && !bare_wildcard;
      if (!selector && !dimensions.isWildcard()) {
        if (bare_wildcard) {
          throw new MixedAggregateException();
        }
        for (final VarRef ref : bare) {
          if (!dimensions.tags().contains(ref.name())) {
            throw new MixedAggregateException();
          }
        }
      }
    }
    
    if (calls.isEmpty() && dimensions.hasInterval()) {
      throw new InvalidArgumentException("GROUP BY requires at least one "
          + "aggregate function");
    }
    
    if (statement.condition() != null && 
        !Exprs.calls(statement.condition()).isEmpty()) {
      throw new InvalidArgumentException("invalid function call in "
          + "condition: " + statement.condition());
    }
  }
  
  /**
   * @return The source or null if the measurement is missing or a subquery
   * is empty.
   */
  private SeriesSource resolveSource(final SelectStatement statement, 
                                     final TimeRange range) {
    if (statement.source() instanceof SubQuerySource) {
      final StatementPlan inner = plan(
          ((SubQuerySource) statement.source()).statement(), range);
      if (inner.isEmpty()) {
        return null;
      }
      return new SubQuerySeriesSource(inner);
    }
    
    final MeasurementSource source = (MeasurementSource) statement.source();
    if (!catalog.databaseExists(source.database())) {
      throw NotFoundException.database(source.database());
    }
    final String rp = source.retentionPolicy() != null ? 
        source.retentionPolicy() : 
          catalog.defaultRetentionPolicy(source.database());
    if (rp == null) {
      throw NotFoundException.retentionPolicy("default");
    }
    if (!catalog.retentionPolicyExists(source.database(), rp)) {
      throw NotFoundException.retentionPolicy(rp);
    }
    if (!catalog.measurementExists(source.database(), rp, 
        source.measurement())) {
      LOG.debug("Measurement " + source.measurement() 
          + " not found, returning an empty result");
      return null;
    }
    return new MeasurementSeriesSource(catalog, source.database(), rp, 
        source.measurement(), new ShardScanner(executor, context));
  }
  
  /**
   * Replaces {@code *} with the source's columns. A bare wildcard becomes 
   * every field and every tag that isn't grouped on. A call over a 
   * wildcard becomes one call per field the function accepts.
   */
  private List<Field> expand(final List<Field> fields, 
                             final Map<String, ValueType> field_types,
                             final Set<String> tag_keys,
                             final List<String> group_keys) {
    final List<Field> expanded = Lists.newArrayList();
    for (final Field field : fields) {
      final Expr expr = field.expr();
      if (expr instanceof Wildcard) {
        final Set<String> names = new TreeSet<String>(field_types.keySet());
        for (final String tag : tag_keys) {
          if (!group_keys.contains(tag)) {
            names.add(tag);
          }
        }
        for (final String name : names) {
          expanded.add(new Field(new VarRef(name)));
        }
      } else if (expr instanceof Call && Exprs.hasWildcard(expr)) {
        final String base = field.alias() != null ? field.alias() : 
          ColumnNamer.defaultName(expr);
        for (final String name : new TreeSet<String>(field_types.keySet())) {
          if (accepts((Call) expr, field_types.get(name))) {
            expanded.add(new Field(withField((Call) expr, name), 
                base + "_" + name));
          }
        }
      } else if (Exprs.hasWildcard(expr)) {
        throw new InvalidArgumentException("unsupported wildcard in " + expr);
      } else {
        expanded.add(field);
      }
    }
    return expanded;
  }
  
  /** @return Whether the function chain accepts a field of the type. */
  private static boolean accepts(final Call call, final ValueType type) {
    if (Transforms.isTransform(call.name())) {
      if (call.arg(0) instanceof Call) {
        final Call inner = (Call) call.arg(0);
        return accepts(inner, type) && Transforms.supports(call.name(), 
            Reducers.outputType(inner.name(), type));
      }
      return Transforms.supports(call.name(), type);
    }
    return Reducers.supports(call.name(), type);
  }
  
  /** @return A copy of the call reading the given field. */
  private static Call withField(final Call call, final String field) {
    final List<Expr> args = Lists.newArrayList(call.args());
    if (args.get(0) instanceof Call) {
      args.set(0, withField((Call) args.get(0), field));
    } else {
      args.set(0, new VarRef(field));
    }
    return new Call(call.name(), args);
  }
  
  /** @return The field a (possibly nested) call reads. */
  static String fieldOf(final Call call) {
    final Expr arg = call.arg(0);
    if (arg instanceof Call) {
      return fieldOf((Call) arg);
    }
    return arg instanceof VarRef ? ((VarRef) arg).name() : null;
  }
  
  /** @return Whether the only call is a selector that may carry columns. */
  private static boolean isSelectorWithAux(final Map<Call, CallPlan> calls) {
    return calls.size() == 1 && 
        Reducers.isSelector(calls.keySet().iterator().next().name());
  }
  
  private static boolean isField(final Call call, final List<Field> fields) {
    for (final Field field : fields) {
      if (call.equals(field.expr())) {
        return true;
      }
    }
    return false;
  }
  
  /**
   * Splits a condition into the conjuncts over tags only, used to pick 
   * series, and the rest that is evaluated per row.
   * @return The tag condition and the row condition, either may be null.
   */
  private static Expr[] splitCondition(final Expr condition, 
                                       final Map<String, ValueType> field_types,
                                       final Set<String> tag_keys) {
    final List<Expr> tags = Lists.newArrayList();
    final List<Expr> rows = Lists.newArrayList();
    for (final Expr conjunct : Exprs.conjuncts(condition)) {
      final List<VarRef> refs = Exprs.allRefs(conjunct);
      boolean tag_only = !refs.isEmpty();
      for (final VarRef ref : refs) {
        if (field_types.containsKey(ref.name()) || 
            !tag_keys.contains(ref.name())) {
          tag_only = false;
        }
      }
      if (tag_only) {
        tags.add(conjunct);
      } else {
        rows.add(conjunct);
      }
    }
    return new Expr[] { Exprs.and(tags), Exprs.and(rows) };
  }
  
  /** @return The output type of a select expression, null if unknown. */
  private static ValueType typeOf(final Expr expr, 
                                  final Map<String, ValueType> field_types,
                                  final Map<Call, CallPlan> calls) {
    if (expr instanceof Call) {
      final CallPlan plan = calls.get(expr);
      return plan == null ? null : plan.outputType();
    }
    if (expr instanceof VarRef) {
      final ValueType type = field_types.get(((VarRef) expr).name());
      return type != null ? type : ValueType.STRING;
    }
    if (expr instanceof Literal) {
      return ((Literal) expr).toValue().type();
    }
    if (expr instanceof BinaryExpr) {
      final BinaryExpr binary = (BinaryExpr) expr;
      if (!binary.op().isArithmetic()) {
        return ValueType.BOOLEAN;
      }
      if (binary.op() == Operator.DIV) {
        return ValueType.FLOAT;
      }
      return ValueType.widen(typeOf(binary.lhs(), field_types, calls), 
          typeOf(binary.rhs(), field_types, calls));
    }
    return null;
  }
}
