package io.intellixity.reltab.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.reltab.expr.ExprJson;

import java.io.IOException;
import java.util.Map;

/**
 * Canonical JSON serializer for {@link QueryExp}. Each node is an object tagged with {@code "operator"};
 * children are nested under {@code "from"} or {@code "left"}/{@code "right"}.
 */
public final class QueryExpJsonSerializer extends JsonSerializer<QueryExp> {
  @Override
  public void serialize(QueryExp q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }
    writeNode(q, g, serializers);
  }

  private static void writeNode(QueryExp q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    g.writeStringField("operator", q.operator());

    if (q instanceof TableQuery t) {
      g.writeStringField("tableName", t.tableName());
      g.writeFieldName("schema");
      serializers.defaultSerializeValue(t.schema(), g);
    } else if (q instanceof ProjectQuery p) {
      writeFrom(p.from(), g, serializers);
      g.writeObjectField("columns", p.columns());
    } else if (q instanceof FilterQuery f) {
      writeFrom(f.from(), g, serializers);
      g.writeFieldName("predicate");
      ExprJson.write(f.predicate(), g);
    } else if (q instanceof GroupByQuery gb) {
      writeFrom(gb.from(), g, serializers);
      g.writeObjectField("groupCols", gb.groupColumns());
      g.writeArrayFieldStart("aggs");
      for (AggSpec a : gb.aggs()) {
        g.writeStartObject();
        g.writeStringField("fn", a.fn().id());
        g.writeStringField("column", a.column());
        g.writeEndObject();
      }
      g.writeEndArray();
    } else if (q instanceof SortQuery s) {
      writeFrom(s.from(), g, serializers);
      writeKeys("keys", s.keys(), g);
    } else if (q instanceof ExtendQuery e) {
      writeFrom(e.from(), g, serializers);
      g.writeStringField("column", e.columnId());
      g.writeStringField("columnType", e.metadata().type().id());
      if (e.metadata().displayName() != null) g.writeStringField("displayName", e.metadata().displayName());
      g.writeFieldName("expr");
      ExprJson.write(e.value(), g);
    } else if (q instanceof MapColumnsQuery m) {
      writeFrom(m.from(), g, serializers);
      g.writeObjectFieldStart("mapping");
      for (Map.Entry<String, ColumnMapInfo> en : m.mapping().entrySet()) {
        g.writeFieldName(en.getKey());
        writeMapInfo(en.getValue(), g);
      }
      g.writeEndObject();
    } else if (q instanceof MapColumnsByIndexQuery m) {
      writeFrom(m.from(), g, serializers);
      g.writeObjectFieldStart("mapping");
      for (Map.Entry<Integer, ColumnMapInfo> en : m.mapping().entrySet()) {
        g.writeFieldName(String.valueOf(en.getKey()));
        writeMapInfo(en.getValue(), g);
      }
      g.writeEndObject();
    } else if (q instanceof ConcatQuery c) {
      g.writeFieldName("left");
      writeNode(c.left(), g, serializers);
      g.writeFieldName("right");
      writeNode(c.right(), g, serializers);
    } else if (q instanceof JoinQuery j) {
      g.writeFieldName("left");
      writeNode(j.left(), g, serializers);
      g.writeFieldName("right");
      writeNode(j.right(), g, serializers);
      g.writeObjectField("on", j.on());
      g.writeStringField("joinType", j.joinType().id());
    } else if (q instanceof RowNumberQuery r) {
      writeFrom(r.from(), g, serializers);
      g.writeStringField("column", r.columnId());
      writeKeys("keys", r.keys(), g);
    } else {
      throw new QueryBuildException("Unsupported query node: " + q.getClass().getName());
    }

    g.writeEndObject();
  }

  private static void writeFrom(QueryExp from, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeFieldName("from");
    writeNode(from, g, serializers);
  }

  private static void writeKeys(String field, java.util.List<SortKey> keys, JsonGenerator g) throws IOException {
    g.writeArrayFieldStart(field);
    for (SortKey k : keys) {
      g.writeStartObject();
      g.writeStringField("column", k.column());
      g.writeBooleanField("asc", k.ascending());
      g.writeEndObject();
    }
    g.writeEndArray();
  }

  private static void writeMapInfo(ColumnMapInfo cmi, JsonGenerator g) throws IOException {
    g.writeStartObject();
    if (cmi.id() != null) g.writeStringField("id", cmi.id());
    if (cmi.displayName() != null) g.writeStringField("displayName", cmi.displayName());
    g.writeEndObject();
  }
}
