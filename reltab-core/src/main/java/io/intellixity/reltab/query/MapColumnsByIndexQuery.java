package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.*;
import java.util.function.IntFunction;

/** Rename and/or relabel columns by zero-based position. */
public final class MapColumnsByIndexQuery implements QueryExp {
  private final QueryExp from;
  private final SortedMap<Integer, ColumnMapInfo> mapping;
  private final Schema schema;

  public MapColumnsByIndexQuery(QueryExp from, Map<Integer, ColumnMapInfo> mapping) {
    this.from = Objects.requireNonNull(from, "from");
    Objects.requireNonNull(mapping, "mapping");
    Schema in = from.schema();
    TreeMap<Integer, ColumnMapInfo> sorted = new TreeMap<>();
    for (var e : mapping.entrySet()) {
      int i = Objects.requireNonNull(e.getKey(), "index");
      if (i < 0 || i >= in.size()) {
        throw new QueryBuildException("mapColumnsByIndex: index " + i + " out of range for " + in.size() + " columns");
      }
      sorted.put(i, Objects.requireNonNull(e.getValue(), "mapping value"));
    }
    this.mapping = Collections.unmodifiableSortedMap(sorted);
    this.schema = mapSchema(in, sorted::get, "mapColumnsByIndex");
  }

  public QueryExp from() { return from; }
  public SortedMap<Integer, ColumnMapInfo> mapping() { return mapping; }

  @Override public String operator() { return "mapColumnsByIndex"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  static Schema mapSchema(Schema in, IntFunction<ColumnMapInfo> infoAt, String usage) {
    Schema.Builder b = Schema.builder();
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < in.size(); i++) {
      String c = in.columns().get(i);
      ColumnMapInfo cmi = infoAt.apply(i);
      String id = (cmi == null || cmi.id() == null) ? c : cmi.id();
      String label = (cmi == null || cmi.displayName() == null) ? in.displayName(c) : cmi.displayName();
      if (id.isEmpty()) throw new QueryBuildException(usage + ": blank column id for '" + c + "'");
      if (!seen.add(id)) throw new QueryBuildException(usage + ": column id '" + id + "' would appear twice");
      b.column(id, in.columnType(c), label);
    }
    return b.build();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MapColumnsByIndexQuery m && m.from.equals(from) && m.mapping.equals(mapping);
  }

  @Override
  public int hashCode() { return Objects.hash(from, mapping); }

  @Override
  public String toString() { return from + ".mapColumnsByIndex(" + mapping + ")"; }
}
