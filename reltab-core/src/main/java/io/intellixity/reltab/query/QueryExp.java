package io.intellixity.reltab.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.reltab.expr.Expr;
import io.intellixity.reltab.schema.ColumnMetadata;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.*;

/**
 * Immutable relational query expression.
 *
 * <p>Every composition method validates its parameters against this node's {@link #schema()} and returns a
 * new node; nothing is evaluated. Invalid parameters fail immediately with {@link QueryBuildException}
 * (or {@link io.intellixity.reltab.expr.ExprTypeException} for expression type errors). Nodes may be shared
 * freely between trees and threads.</p>
 */
@JsonSerialize(using = QueryExpJsonSerializer.class)
@JsonDeserialize(using = QueryExpJsonDeserializer.class)
public interface QueryExp {
  /** Serialized discriminant of this node ("table", "project", ...). */
  String operator();

  /** Schema of the rows this query produces, derived from the children's schemas and this node's parameters. */
  Schema schema();

  List<QueryExp> children();

  <R> R accept(QueryExpVisitor<R> visitor);

  default QueryExp project(List<String> columns) {
    return new ProjectQuery(this, columns);
  }

  default QueryExp project(String... columns) {
    return project(List.of(columns));
  }

  default QueryExp filter(Expr predicate) {
    return new FilterQuery(this, predicate);
  }

  default QueryExp groupBy(List<String> groupColumns, List<AggSpec> aggs) {
    return new GroupByQuery(this, groupColumns, aggs);
  }

  /** Group by {@code groupColumns}, aggregating each of {@code aggColumns} with its type's default. */
  default QueryExp groupBy(List<String> groupColumns, String... aggColumns) {
    List<AggSpec> aggs = new ArrayList<>();
    for (String c : aggColumns) aggs.add(AggSpec.col(c));
    return groupBy(groupColumns, aggs);
  }

  default QueryExp sort(List<SortKey> keys) {
    return new SortQuery(this, keys);
  }

  default QueryExp sort(SortKey... keys) {
    return sort(List.of(keys));
  }

  default QueryExp extend(String columnId, ColumnMetadata metadata, Expr value) {
    return new ExtendQuery(this, columnId, metadata, value);
  }

  default QueryExp extend(String columnId, ColumnType type, Expr value) {
    return extend(columnId, new ColumnMetadata(type, columnId), value);
  }

  default QueryExp mapColumns(Map<String, ColumnMapInfo> mapping) {
    return new MapColumnsQuery(this, mapping);
  }

  default QueryExp mapColumnsByIndex(Map<Integer, ColumnMapInfo> mapping) {
    return new MapColumnsByIndexQuery(this, mapping);
  }

  default QueryExp concat(QueryExp other) {
    return new ConcatQuery(this, other);
  }

  default QueryExp join(QueryExp other, List<String> on) {
    return join(other, on, JoinType.LEFT_OUTER);
  }

  default QueryExp join(QueryExp other, List<String> on, JoinType joinType) {
    return new JoinQuery(this, other, on, joinType);
  }

  /** Append {@code columnId} holding each row's 1-based position under {@code keys}. */
  default QueryExp rowNumber(String columnId, List<SortKey> keys) {
    return new RowNumberQuery(this, columnId, keys);
  }
}
