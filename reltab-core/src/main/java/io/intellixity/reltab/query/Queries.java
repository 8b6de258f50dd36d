package io.intellixity.reltab.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.reltab.ReltabException;
import io.intellixity.reltab.schema.Schema;

/** Entry points for building and transporting queries. */
public final class Queries {
  private static final ObjectMapper JSON = new ObjectMapper();

  private Queries() {}

  /** Leaf query over a named base table with a known schema. */
  public static QueryExp table(String tableName, Schema schema) {
    return new TableQuery(tableName, schema);
  }

  public static String toJson(QueryExp q) {
    try {
      return JSON.writeValueAsString(q);
    } catch (JsonProcessingException e) {
      throw new QueryBuildException("Failed to serialize query: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Rebuild a query from its canonical JSON form.
   *
   * @throws QueryBuildException on malformed JSON or a document describing an invalid query
   */
  public static QueryExp fromJson(String json) {
    try {
      return JSON.readValue(json, QueryExp.class);
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof ReltabException re) throw re;
      throw new QueryBuildException("Failed to parse query JSON: " + e.getOriginalMessage(), e);
    }
  }
}
