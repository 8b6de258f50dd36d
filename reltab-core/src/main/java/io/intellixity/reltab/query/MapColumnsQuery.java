package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.*;

/** Rename and/or relabel columns by id. Column order and values are unchanged. */
public final class MapColumnsQuery implements QueryExp {
  private final QueryExp from;
  private final Map<String, ColumnMapInfo> mapping;
  private final Schema schema;

  public MapColumnsQuery(QueryExp from, Map<String, ColumnMapInfo> mapping) {
    this.from = Objects.requireNonNull(from, "from");
    Objects.requireNonNull(mapping, "mapping");
    Schema in = from.schema();
    QueryChecks.requireColumns(in, mapping.keySet(), "mapColumns");
    // Normalized to schema order so equal mappings compare and serialize equally.
    Map<String, ColumnMapInfo> ordered = new LinkedHashMap<>();
    for (String c : in.columns()) {
      ColumnMapInfo cmi = mapping.get(c);
      if (cmi != null) ordered.put(c, cmi);
    }
    this.mapping = Collections.unmodifiableMap(ordered);
    this.schema = MapColumnsByIndexQuery.mapSchema(in, i -> ordered.get(in.columns().get(i)), "mapColumns");
  }

  public QueryExp from() { return from; }
  public Map<String, ColumnMapInfo> mapping() { return mapping; }

  @Override public String operator() { return "mapColumns"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof MapColumnsQuery m && m.from.equals(from) && m.mapping.equals(mapping);
  }

  @Override
  public int hashCode() { return Objects.hash(from, mapping); }

  @Override
  public String toString() { return from + ".mapColumns(" + mapping + ")"; }
}
