package io.intellixity.reltab.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.reltab.expr.ExprJson;
import io.intellixity.reltab.schema.ColumnMetadata;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link QueryExp}. Nodes are rebuilt through their constructors, so a
 * document that describes an invalid query fails with the same errors as building it directly. The shape is
 * strict: unknown fields and ids or flags of the wrong JSON type are rejected with {@link QueryBuildException}.
 */
public final class QueryExpJsonDeserializer extends JsonDeserializer<QueryExp> {
  private static final Map<String, Set<String>> FIELDS = Map.ofEntries(
      Map.entry("table", Set.of("tableName", "schema")),
      Map.entry("project", Set.of("from", "columns")),
      Map.entry("filter", Set.of("from", "predicate")),
      Map.entry("groupBy", Set.of("from", "groupCols", "aggs")),
      Map.entry("sort", Set.of("from", "keys")),
      Map.entry("extend", Set.of("from", "column", "columnType", "displayName", "expr")),
      Map.entry("mapColumns", Set.of("from", "mapping")),
      Map.entry("mapColumnsByIndex", Set.of("from", "mapping")),
      Map.entry("concat", Set.of("left", "right")),
      Map.entry("join", Set.of("left", "right", "on", "joinType")),
      Map.entry("rowNumber", Set.of("from", "column", "keys")));

  @Override
  public QueryExp deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseNode(root, codec);
  }

  private static QueryExp parseNode(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject()) throw new QueryBuildException("Query JSON must be an object: " + n);
    String op = text(n, "operator");
    Set<String> allowed = FIELDS.get(op);
    if (allowed == null) throw new QueryBuildException("Unknown query operator: '" + op + "'");
    Iterator<String> names = n.fieldNames();
    while (names.hasNext()) {
      String f = names.next();
      if (!f.equals("operator") && !allowed.contains(f)) {
        throw new QueryBuildException("Unknown field '" + f + "' in " + op + " node");
      }
    }
    return switch (op) {
      case "table" -> new TableQuery(text(n, "tableName"), codec.treeToValue(required(n, "schema"), Schema.class));
      case "project" -> new ProjectQuery(from(n, codec), strings(required(n, "columns")));
      case "filter" -> new FilterQuery(from(n, codec), ExprJson.read(required(n, "predicate")));
      case "groupBy" -> {
        List<AggSpec> aggs = new ArrayList<>();
        JsonNode a = n.get("aggs");
        if (a != null && !a.isNull()) {
          if (!a.isArray()) throw new QueryBuildException("groupBy: 'aggs' must be an array: " + a);
          for (JsonNode x : a) {
            onlyFields(x, "aggregate", "fn", "column");
            String fn = optionalText(x, "fn");
            aggs.add(new AggSpec(fn == null ? null : AggFn.fromId(fn), text(x, "column")));
          }
        }
        yield new GroupByQuery(from(n, codec), strings(required(n, "groupCols")), aggs);
      }
      case "sort" -> new SortQuery(from(n, codec), keys(required(n, "keys")));
      case "extend" -> {
        ColumnType type = ColumnType.of(text(n, "columnType"));
        String dn = optionalText(n, "displayName");
        String column = text(n, "column");
        ColumnMetadata md = new ColumnMetadata(type, dn == null ? column : dn);
        yield new ExtendQuery(from(n, codec), column, md, ExprJson.read(required(n, "expr")));
      }
      case "mapColumns" -> {
        Map<String, ColumnMapInfo> m = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = required(n, "mapping").fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          m.put(e.getKey(), mapInfo(e.getValue()));
        }
        yield new MapColumnsQuery(from(n, codec), m);
      }
      case "mapColumnsByIndex" -> {
        Map<Integer, ColumnMapInfo> m = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = required(n, "mapping").fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          int idx;
          try {
            idx = Integer.parseInt(e.getKey());
          } catch (NumberFormatException ex) {
            throw new QueryBuildException("mapColumnsByIndex: non-numeric index '" + e.getKey() + "'", ex);
          }
          m.put(idx, mapInfo(e.getValue()));
        }
        yield new MapColumnsByIndexQuery(from(n, codec), m);
      }
      case "concat" -> new ConcatQuery(parseNode(required(n, "left"), codec), parseNode(required(n, "right"), codec));
      case "join" -> {
        String jt = optionalText(n, "joinType");
        yield new JoinQuery(parseNode(required(n, "left"), codec), parseNode(required(n, "right"), codec),
            strings(required(n, "on")), jt == null ? JoinType.LEFT_OUTER : JoinType.fromId(jt));
      }
      case "rowNumber" -> new RowNumberQuery(from(n, codec), text(n, "column"), keys(required(n, "keys")));
      default -> throw new IllegalStateException("Unhandled operator " + op);
    };
  }

  private static QueryExp from(JsonNode n, ObjectCodec codec) throws IOException {
    return parseNode(required(n, "from"), codec);
  }

  private static JsonNode required(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) throw new QueryBuildException("Query JSON missing '" + field + "': " + n);
    return v;
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = required(n, field);
    if (!v.isTextual()) throw new QueryBuildException("Query JSON field '" + field + "' must be a string: " + v);
    return v.asText();
  }

  /** String field that may be absent or null. */
  private static String optionalText(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return null;
    if (!v.isTextual()) throw new QueryBuildException("Query JSON field '" + field + "' must be a string: " + v);
    return v.asText();
  }

  private static void onlyFields(JsonNode n, String what, String... allowed) {
    if (!n.isObject()) throw new QueryBuildException("Query JSON " + what + " must be an object: " + n);
    List<String> ok = List.of(allowed);
    Iterator<String> names = n.fieldNames();
    while (names.hasNext()) {
      String f = names.next();
      if (!ok.contains(f)) throw new QueryBuildException("Unknown field '" + f + "' in " + what + ": " + n);
    }
  }

  private static List<String> strings(JsonNode arr) {
    if (!arr.isArray()) throw new QueryBuildException("Expected a JSON array of column ids: " + arr);
    List<String> out = new ArrayList<>();
    for (JsonNode x : arr) {
      if (!x.isTextual()) throw new QueryBuildException("Column id must be a string: " + x);
      out.add(x.asText());
    }
    return out;
  }

  private static List<SortKey> keys(JsonNode arr) {
    if (!arr.isArray()) throw new QueryBuildException("Expected a JSON array of sort keys: " + arr);
    List<SortKey> out = new ArrayList<>();
    for (JsonNode x : arr) {
      onlyFields(x, "sort key", "column", "asc");
      JsonNode asc = x.get("asc");
      if (asc != null && !asc.isNull() && !asc.isBoolean()) {
        throw new QueryBuildException("Sort key 'asc' must be a boolean: " + asc);
      }
      out.add(new SortKey(text(x, "column"), asc == null || asc.isNull() || asc.booleanValue()));
    }
    return out;
  }

  private static ColumnMapInfo mapInfo(JsonNode n) {
    onlyFields(n, "column mapping", "id", "displayName");
    return new ColumnMapInfo(optionalText(n, "id"), optionalText(n, "displayName"));
  }
}
