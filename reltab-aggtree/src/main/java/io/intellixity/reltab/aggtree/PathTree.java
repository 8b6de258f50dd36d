package io.intellixity.reltab.aggtree;

import java.util.*;

/**
 * Immutable set of open pivot-tree paths, stored as a nested mapping from the pivot value at depth d to
 * the open children at depth d+1. The root (empty path) has its own open state: {@link #empty()} has
 * nothing open, {@link #root()} only the root, and opening any path opens the root as well.
 *
 * <pre>
 *   {"Executive Management": {"General Manager": {}}, "Safety": {}}
 * </pre>
 * Child order is insertion order. Values are the pivot column values (String, Long, Double, Boolean or null).
 */
public final class PathTree {
  private static final PathTree EMPTY = new PathTree(false, Collections.emptyMap());
  private static final PathTree ROOT = new PathTree(true, Collections.emptyMap());

  private final boolean open;
  private final Map<Object, PathTree> children;

  private PathTree(boolean open, Map<Object, PathTree> children) {
    this.open = open;
    this.children = children;
  }

  /** Nothing open, not even the root. */
  public static PathTree empty() { return EMPTY; }

  /** Only the root open. */
  public static PathTree root() { return ROOT; }

  /**
   * Build from the nested-map form. Keys become path values; every value must itself be a map
   * (an empty map marks an open node with no open children). A non-empty map opens the root; an empty
   * one is {@link #empty()}.
   */
  public static PathTree fromMap(Map<?, ?> nested) {
    Objects.requireNonNull(nested, "nested");
    if (nested.isEmpty()) return EMPTY;
    return new PathTree(true, childrenOf(nested));
  }

  private static Map<Object, PathTree> childrenOf(Map<?, ?> nested) {
    Map<Object, PathTree> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : nested.entrySet()) {
      Object v = e.getValue();
      if (v == null) {
        out.put(e.getKey(), ROOT);
      } else if (v instanceof Map<?, ?> m) {
        out.put(e.getKey(), m.isEmpty() ? ROOT : new PathTree(true, childrenOf(m)));
      } else {
        throw new IllegalArgumentException("Open path entry '" + e.getKey() + "' must map to a nested map, got " + v);
      }
    }
    return Collections.unmodifiableMap(out);
  }

  /** Nested-map form, the inverse of {@link #fromMap(Map)}. {@link #root()} maps to an empty map as well. */
  public Map<Object, Object> toMap() {
    Map<Object, Object> out = new LinkedHashMap<>();
    for (Map.Entry<Object, PathTree> e : children.entrySet()) out.put(e.getKey(), e.getValue().toMap());
    return out;
  }

  /** Open {@code path} and every prefix of it, the root included. */
  public PathTree open(List<?> path) {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) return open ? this : (children.isEmpty() ? ROOT : new PathTree(true, children));
    Object head = path.get(0);
    PathTree child = children.getOrDefault(head, ROOT);
    Map<Object, PathTree> out = new LinkedHashMap<>(children);
    out.put(head, child.open(path.subList(1, path.size())));
    return new PathTree(true, Collections.unmodifiableMap(out));
  }

  /** Close {@code path} together with all of its descendants. Closing the root closes everything. */
  public PathTree close(List<?> path) {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) return EMPTY;
    Object head = path.get(0);
    PathTree child = children.get(head);
    if (child == null && !children.containsKey(head)) return this;
    Map<Object, PathTree> out = new LinkedHashMap<>(children);
    if (path.size() == 1) {
      out.remove(head);
    } else {
      out.put(head, child.close(path.subList(1, path.size())));
    }
    return out.isEmpty() ? ROOT : new PathTree(true, Collections.unmodifiableMap(out));
  }

  public boolean isOpen(List<?> path) {
    PathTree t = subtree(path);
    return t != null && t.open;
  }

  /** Open child values directly below {@code path}; empty if the path is not open. */
  public Set<Object> children(List<?> path) {
    PathTree t = subtree(path);
    return t == null || !t.open ? Set.of() : Collections.unmodifiableSet(t.children.keySet());
  }

  /** Every open path except the root, depth-first, parents before children. */
  public List<List<Object>> openPaths() {
    List<List<Object>> out = new ArrayList<>();
    collect(new ArrayList<>(), out);
    return out;
  }

  /** True when no node below the root is open; the root itself may be. */
  public boolean isEmpty() { return children.isEmpty(); }

  private void collect(List<Object> prefix, List<List<Object>> out) {
    for (Map.Entry<Object, PathTree> e : children.entrySet()) {
      prefix.add(e.getKey());
      out.add(Collections.unmodifiableList(new ArrayList<>(prefix)));
      e.getValue().collect(prefix, out);
      prefix.remove(prefix.size() - 1);
    }
  }

  private PathTree subtree(List<?> path) {
    Objects.requireNonNull(path, "path");
    PathTree t = this;
    for (Object v : path) {
      if (!t.children.containsKey(v)) return null;
      t = t.children.get(v);
    }
    return t;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PathTree p && p.open == open && p.children.equals(children);
  }

  @Override
  public int hashCode() { return Objects.hash(open, children); }

  @Override
  public String toString() { return open ? toMap().toString() : "closed"; }
}
