package io.intellixity.reltab.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Ordered column ids plus per-column {@link ColumnMetadata}.
 *
 * <p>Column order is significant: it is display order and the order of values in every row of a
 * {@link io.intellixity.reltab.table.TableRep}. Instances are immutable.</p>
 */
public final class Schema {
  private final List<String> columns;
  private final Map<String, ColumnMetadata> columnMetadata;
  private final Map<String, Integer> index;

  @JsonCreator
  public Schema(@JsonProperty("columns") List<String> columns,
                @JsonProperty("columnMetadata") Map<String, ColumnMetadata> columnMetadata) {
    if (columns == null) throw new SchemaException("Schema columns must not be null");
    Map<String, ColumnMetadata> md = (columnMetadata == null) ? Map.of() : columnMetadata;
    Map<String, Integer> idx = new HashMap<>();
    Map<String, ColumnMetadata> out = new LinkedHashMap<>();
    for (String id : columns) {
      if (id == null || id.isEmpty()) throw new SchemaException("Blank column id in schema: " + columns);
      if (idx.put(id, idx.size()) != null) throw new SchemaException("Duplicate column id '" + id + "'");
      ColumnMetadata cm = md.get(id);
      if (cm == null) throw new SchemaException("No metadata for column '" + id + "'");
      out.put(id, cm.displayName() == null ? cm.withDisplayName(id) : cm);
    }
    for (String k : md.keySet()) {
      if (!idx.containsKey(k)) throw new SchemaException("Metadata for unknown column '" + k + "'");
    }
    this.columns = List.copyOf(columns);
    this.columnMetadata = Collections.unmodifiableMap(out);
    this.index = Map.copyOf(idx);
  }

  /**
   * Build a schema from column ids and external type names.
   *
   * @throws SchemaException on an unrecognized type name or duplicate id
   */
  public static Schema of(List<String> columns, Map<String, String> types) {
    Objects.requireNonNull(types, "types");
    Map<String, ColumnMetadata> md = new LinkedHashMap<>();
    for (String c : columns) {
      String t = types.get(c);
      if (t == null) throw new SchemaException("No type for column '" + c + "'");
      md.put(c, new ColumnMetadata(ColumnType.of(t), c));
    }
    return new Schema(columns, md);
  }

  public static Builder builder() { return new Builder(); }

  @JsonProperty("columns")
  public List<String> columns() { return columns; }

  @JsonProperty("columnMetadata")
  public Map<String, ColumnMetadata> columnMetadata() { return columnMetadata; }

  public int size() { return columns.size(); }

  public boolean hasColumn(String id) { return index.containsKey(id); }

  /** Zero-based position of {@code id}, or -1. */
  public int columnIndex(String id) {
    Integer i = index.get(id);
    return i == null ? -1 : i;
  }

  public ColumnType columnType(String id) { return metadata(id).type(); }

  public String displayName(String id) { return metadata(id).displayName(); }

  public ColumnMetadata metadata(String id) {
    ColumnMetadata cm = columnMetadata.get(id);
    if (cm == null) throw new SchemaException("Unknown column '" + id + "' (columns: " + columns + ")");
    return cm;
  }

  /** Column ids and types match pairwise in order (display names are ignored). */
  @JsonIgnore
  public boolean isCompatibleWith(Schema other) {
    if (other == null || other.columns.size() != columns.size()) return false;
    for (int i = 0; i < columns.size(); i++) {
      String c = columns.get(i);
      if (!c.equals(other.columns.get(i))) return false;
      if (columnType(c) != other.columnType(c)) return false;
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Schema s)) return false;
    return columns.equals(s.columns) && columnMetadata.equals(s.columnMetadata);
  }

  @Override
  public int hashCode() { return Objects.hash(columns, columnMetadata); }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Schema[");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) sb.append(", ");
      String c = columns.get(i);
      sb.append(c).append(':').append(columnType(c).id());
    }
    return sb.append(']').toString();
  }

  /** Incremental construction in column order. */
  public static final class Builder {
    private final List<String> columns = new ArrayList<>();
    private final Map<String, ColumnMetadata> md = new LinkedHashMap<>();

    private Builder() {}

    public Builder column(String id, ColumnType type) {
      return column(id, type, id);
    }

    public Builder column(String id, ColumnType type, String displayName) {
      columns.add(id);
      if (md.put(id, new ColumnMetadata(type, displayName)) != null) {
        throw new SchemaException("Duplicate column id '" + id + "'");
      }
      return this;
    }

    public Builder columns(Schema s) {
      for (String c : s.columns()) column(c, s.columnType(c), s.displayName(c));
      return this;
    }

    public Schema build() { return new Schema(columns, md); }
  }
}
