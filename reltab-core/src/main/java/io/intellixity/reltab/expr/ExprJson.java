package io.intellixity.reltab.expr;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.reltab.query.QueryBuildException;
import io.intellixity.reltab.schema.ColumnType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Canonical JSON form of {@link Expr}:
 * <pre>
 *   {"col": "Base"}
 *   {"const": 100000, "type": "integer"}
 *   {"op": "gt", "args": [ ... ]}
 * </pre>
 */
public final class ExprJson {
  private ExprJson() {}

  public static void write(Expr e, JsonGenerator g) throws IOException {
    g.writeStartObject();
    if (e instanceof ColumnRef ref) {
      g.writeStringField("col", ref.columnId());
    } else if (e instanceof Const c) {
      g.writeFieldName("const");
      writeScalar(c.value(), g);
      g.writeStringField("type", c.type().id());
    } else if (e instanceof Combinator c) {
      g.writeStringField("op", c.op().id());
      g.writeArrayFieldStart("args");
      for (Expr arg : c.operands()) write(arg, g);
      g.writeEndArray();
    } else {
      throw new ExprTypeException("Unsupported expression: " + e);
    }
    g.writeEndObject();
  }

  /**
   * @throws QueryBuildException on a malformed node: not an object, an unknown field, or an id of the wrong
   *                             JSON type
   * @throws ExprTypeException   on an unknown operator or a constant that does not fit its type
   */
  public static Expr read(JsonNode n) {
    if (n == null || !n.isObject()) throw new QueryBuildException("Expression JSON must be an object: " + n);
    if (n.has("col")) {
      onlyFields(n, "col");
      return new ColumnRef(text(n, "col"));
    }
    if (n.has("const")) {
      onlyFields(n, "const", "type");
      ColumnType type = ColumnType.of(text(n, "type"));
      return new Const(scalar(n.get("const")), type);
    }
    if (n.has("op")) {
      onlyFields(n, "op", "args");
      ExprOp op = ExprOp.fromId(text(n, "op"));
      JsonNode a = n.get("args");
      if (a == null || !a.isArray()) throw new QueryBuildException("Expression 'args' must be an array: " + n);
      List<Expr> args = new ArrayList<>();
      for (JsonNode x : a) args.add(read(x));
      return new Combinator(op, args);
    }
    throw new QueryBuildException("Unrecognized expression JSON: " + n);
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || !v.isTextual()) throw new QueryBuildException("Expression field '" + field + "' must be a string: " + n);
    return v.asText();
  }

  private static void onlyFields(JsonNode n, String... allowed) {
    List<String> ok = List.of(allowed);
    Iterator<String> names = n.fieldNames();
    while (names.hasNext()) {
      String f = names.next();
      if (!ok.contains(f)) throw new QueryBuildException("Unknown field '" + f + "' in expression: " + n);
    }
  }

  private static void writeScalar(Object v, JsonGenerator g) throws IOException {
    if (v == null) g.writeNull();
    else if (v instanceof Long l) g.writeNumber(l);
    else if (v instanceof Double d) g.writeNumber(d);
    else if (v instanceof Boolean b) g.writeBoolean(b);
    else g.writeString(v.toString());
  }

  private static Object scalar(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (n.isTextual()) return n.asText();
    if (n.isBoolean()) return n.booleanValue();
    if (n.isIntegralNumber()) return n.bigIntegerValue();
    if (n.isNumber()) return n.doubleValue();
    throw new QueryBuildException("Constant must be a scalar: " + n);
  }
}
