package io.intellixity.reltab.query;

public enum JoinType {
  INNER("inner"),
  LEFT_OUTER("leftOuter");

  private final String id;

  JoinType(String id) {
    this.id = id;
  }

  public String id() { return id; }

  public static JoinType fromId(String id) {
    for (JoinType t : values()) {
      if (t.id.equals(id) || t.name().equalsIgnoreCase(id)) return t;
    }
    throw new QueryBuildException("Unknown join type: '" + id + "'");
  }
}
