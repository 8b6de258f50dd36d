package io.intellixity.reltab.jdbc.dialect;

import io.intellixity.reltab.exec.CompileException;
import io.intellixity.reltab.expr.ColumnRef;
import io.intellixity.reltab.expr.Combinator;
import io.intellixity.reltab.expr.Const;
import io.intellixity.reltab.expr.Expr;
import io.intellixity.reltab.expr.ExprVisitor;
import io.intellixity.reltab.jdbc.Bind;
import io.intellixity.reltab.jdbc.SqlStatement;
import io.intellixity.reltab.query.*;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.*;

/**
 * ANSI SQL rendering shared by the JDBC dialects.
 *
 * <p>Nodes fold into one SELECT while they can: filters, projections, renames and computed columns over
 * the same source become a single level with their expressions inlined, a groupBy or rowNumber over such a
 * level adds its GROUP BY or window to it, and a chain of concats becomes one flat UNION ALL list. A node
 * that cannot fold (a filter over an aggregate, any join) closes the level into a derived table.</p>
 *
 * <p>Ordering is not rendered inside derived tables (engines may drop it); instead every level carries the
 * ordering its rows logically have, and that ordering is applied once, at the outermost level. Sort columns
 * removed by a projection are kept as hidden columns until then. Operators that do not preserve row order
 * (groupBy, concat, join) reset it.</p>
 *
 * DB-specific dialects override hooks for quoting, type names, aggregates and paging.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  /** Aggregate argument placeholder; identifiers cannot contain NUL and constants are always bound. */
  private static final String ARG = "\0";

  /** SQL text with its binds in placeholder order. */
  private record Part(String sql, List<Bind> binds) {
    Part {
      binds = List.copyOf(binds);
    }

    static Part of(String sql) {
      return new Part(sql, List.of());
    }
  }

  /** One SELECT level under construction. */
  private static final class Select {
    /** Output columns in schema order. */
    final LinkedHashMap<String, Part> items = new LinkedHashMap<>();
    /** Ordering columns dropped by a projection, selected only for the final ORDER BY. */
    final LinkedHashMap<String, Part> hidden = new LinkedHashMap<>();
    final List<Part> where = new ArrayList<>();
    Part from;
    /** GROUP BY expressions; null unless the level aggregates. */
    List<Part> groupBy;
    boolean windowed;
    /** UNION ALL branches; null unless the level is a concat. */
    List<Part> branches;
    List<SortKey> ordering = List.of();

    boolean isUnion() {
      return branches != null;
    }
  }

  private static final class RenderCtx {
    private int aliases = 0;
    private int hiddenColumns = 0;

    /** Fresh derived-table alias, unique within one statement. */
    String alias() {
      return "t" + (aliases++);
    }

    String hiddenColumn() {
      return "reltab_sort" + (hiddenColumns++);
    }
  }

  @Override
  public final SqlStatement compile(QueryExp query) {
    return compile(query, null);
  }

  @Override
  public final SqlStatement compile(QueryExp query, OffsetPage page) {
    Objects.requireNonNull(query, "query");
    RenderCtx ctx = new RenderCtx();
    Select s = query.accept(new NodeRenderer(ctx));
    if (s.ordering.isEmpty() && page == null) {
      Part p = render(s, false);
      return new SqlStatement(p.sql(), p.binds());
    }
    Part inner = render(s, true);
    StringBuilder sql = new StringBuilder()
        .append("SELECT ").append(columnList(query.schema().columns()))
        .append(" FROM (").append(inner.sql()).append(") ").append(ctx.alias());
    if (!s.ordering.isEmpty()) sql.append(" ORDER BY ").append(orderByList(s.ordering));
    String out = (page == null) ? sql.toString() : applyOffsetPage(sql.toString(), page);
    return new SqlStatement(out, inner.binds());
  }

  @Override
  public final SqlStatement compileCount(QueryExp query) {
    Objects.requireNonNull(query, "query");
    Part p = render(query.accept(new NodeRenderer(new RenderCtx())), false);
    return new SqlStatement("SELECT COUNT(1) FROM (" + p.sql() + ") reltab_count", p.binds());
  }

  // ---- hooks ----

  /**
   * Quote an identifier, doubling embedded quotes.
   *
   * @throws CompileException for blank identifiers or identifiers containing NUL
   */
  protected String quoteIdent(String ident) {
    if (ident == null || ident.isBlank()) throw new CompileException("Blank SQL identifier");
    if (ident.indexOf('\0') >= 0) throw new CompileException("SQL identifier contains NUL: '" + ident.replace('\0', '?') + "'");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  protected String sqlType(ColumnType type) {
    return switch (type) {
      case TEXT -> "VARCHAR";
      case INTEGER -> "BIGINT";
      case REAL -> "DOUBLE PRECISION";
      case BOOLEAN -> "BOOLEAN";
    };
  }

  /** ANSI OFFSET/FETCH; dialects override (Postgres LIMIT/OFFSET). */
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }

  /** Nulls order as the smallest value in either direction. */
  protected String orderItem(String expr, boolean ascending) {
    return expr + (ascending ? " ASC NULLS FIRST" : " DESC NULLS LAST");
  }

  protected String aggregate(AggFn fn, String col, ColumnType inputType) {
    boolean bool = inputType == ColumnType.BOOLEAN;
    return switch (fn) {
      // integer sums widen to NUMERIC in most engines; keep the declared type
      case SUM -> inputType == ColumnType.INTEGER ? "CAST(SUM(" + col + ") AS " + sqlType(ColumnType.INTEGER) + ")" : "SUM(" + col + ")";
      case AVG -> "AVG(CAST(" + col + " AS " + sqlType(ColumnType.REAL) + "))";
      case COUNT -> "COUNT(" + col + ")";
      case MIN -> bool ? "BOOL_AND(" + col + ")" : "MIN(" + col + ")";
      case MAX -> bool ? "BOOL_OR(" + col + ")" : "MAX(" + col + ")";
      case UNIQ -> {
        String lo = bool ? "BOOL_AND(" + col + ")" : "MIN(" + col + ")";
        String hi = bool ? "BOOL_OR(" + col + ")" : "MAX(" + col + ")";
        yield "CASE WHEN " + lo + " = " + hi + " THEN " + lo + " ELSE NULL END";
      }
      case NULL -> nullLiteral(inputType);
    };
  }

  protected String nullLiteral(ColumnType type) {
    return "CAST(NULL AS " + sqlType(type) + ")";
  }

  protected String joinKeyword(JoinType type) {
    return type == JoinType.INNER ? "INNER JOIN" : "LEFT OUTER JOIN";
  }

  /** Key match; null keys match each other, the way groupBy puts nulls in one group. */
  protected String joinCondition(String left, String right) {
    return left + " IS NOT DISTINCT FROM " + right;
  }

  // ---- helpers ----

  protected final String columnList(List<String> columns) {
    List<String> parts = new ArrayList<>(columns.size());
    for (String c : columns) parts.add(quoteIdent(c));
    return String.join(", ", parts);
  }

  protected final String orderByList(List<SortKey> keys) {
    List<String> parts = new ArrayList<>(keys.size());
    for (SortKey k : keys) parts.add(orderItem(quoteIdent(k.column()), k.ascending()));
    return String.join(", ", parts);
  }

  /** SQL of one level; hidden columns follow the visible ones when {@code withHidden}. */
  private Part render(Select s, boolean withHidden) {
    List<Bind> binds = new ArrayList<>();
    if (s.isUnion()) {
      List<String> parts = new ArrayList<>(s.branches.size());
      for (Part b : s.branches) {
        parts.add(b.sql());
        binds.addAll(b.binds());
      }
      return new Part(String.join(" UNION ALL ", parts), binds);
    }
    List<String> cols = new ArrayList<>();
    s.items.forEach((name, p) -> cols.add(selectItem(name, p, binds)));
    if (withHidden) s.hidden.forEach((name, p) -> cols.add(selectItem(name, p, binds)));
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", cols))
        .append(" FROM ").append(s.from.sql());
    binds.addAll(s.from.binds());
    if (!s.where.isEmpty()) {
      List<String> preds = new ArrayList<>(s.where.size());
      for (Part w : s.where) {
        preds.add(w.sql());
        binds.addAll(w.binds());
      }
      sql.append(" WHERE ").append(String.join(" AND ", preds));
    }
    if (s.groupBy != null && !s.groupBy.isEmpty()) {
      List<String> keys = new ArrayList<>(s.groupBy.size());
      for (Part g : s.groupBy) keys.add(g.sql());
      sql.append(" GROUP BY ").append(String.join(", ", keys));
    }
    return new Part(sql.toString(), binds);
  }

  private String selectItem(String name, Part p, List<Bind> binds) {
    binds.addAll(p.binds());
    String q = quoteIdent(name);
    String sql = p.sql();
    boolean sameName = sql.equals(q) || (sql.endsWith("." + q) && sql.substring(0, sql.length() - q.length() - 1).matches("t\\d+"));
    return sameName ? sql : sql + " AS " + q;
  }

  private final class ExprRenderer implements ExprVisitor<String> {
    /** Column expressions of the enclosing level; constants append to {@code binds} in textual order. */
    private final Map<String, Part> scope;
    private final List<Bind> binds;

    ExprRenderer(Map<String, Part> scope, List<Bind> binds) {
      this.scope = scope;
      this.binds = binds;
    }

    @Override
    public String visit(ColumnRef ref) {
      Part p = scope.get(ref.columnId());
      if (p == null) throw new CompileException("Unknown column '" + ref.columnId() + "' in expression");
      binds.addAll(p.binds());
      return p.sql();
    }

    @Override
    public String visit(Const c) {
      if (c.value() == null) return nullLiteral(c.type());
      binds.add(new Bind(c.value(), c.type()));
      return "CAST(? AS " + sqlType(c.type()) + ")";
    }

    @Override
    public String visit(Combinator c) {
      List<String> args = new ArrayList<>(c.operands().size());
      for (Expr operand : c.operands()) args.add(operand.accept(this));
      return switch (c.op()) {
        case AND -> "(" + String.join(" AND ", args) + ")";
        case OR -> "(" + String.join(" OR ", args) + ")";
        case NOT -> "(NOT " + args.get(0) + ")";
        case EQ -> binary(args, "=");
        case NE -> binary(args, "<>");
        case LT -> binary(args, "<");
        case LE -> binary(args, "<=");
        case GT -> binary(args, ">");
        case GE -> binary(args, ">=");
        case IS_NULL -> "(" + args.get(0) + " IS NULL)";
        case IS_NOT_NULL -> "(" + args.get(0) + " IS NOT NULL)";
        case LIKE -> binary(args, "LIKE");
        case ADD -> binary(args, "+");
        case SUB -> binary(args, "-");
        case MUL -> binary(args, "*");
        case DIV -> "(CAST(" + args.get(0) + " AS " + sqlType(ColumnType.REAL) + ") / " + args.get(1) + ")";
        case TO_TEXT -> "CAST(" + args.get(0) + " AS " + sqlType(ColumnType.TEXT) + ")";
      };
    }

    private String binary(List<String> args, String op) {
      return "(" + args.get(0) + " " + op + " " + args.get(1) + ")";
    }
  }

  private final class NodeRenderer implements QueryExpVisitor<Select> {
    private final RenderCtx ctx;

    NodeRenderer(RenderCtx ctx) {
      this.ctx = ctx;
    }

    @Override
    public Select visit(TableQuery q) {
      Select s = new Select();
      s.from = Part.of(quoteIdent(q.tableName()));
      for (String c : q.schema().columns()) s.items.put(c, Part.of(quoteIdent(c)));
      return s;
    }

    @Override
    public Select visit(ProjectQuery q) {
      Select s = q.from().accept(this);
      if (s.isUnion()) s = derived(s, true);
      Map<String, String> moved = new HashMap<>();
      for (SortKey k : s.ordering) {
        if (!q.columns().contains(k.column()) && s.items.containsKey(k.column()) && !moved.containsKey(k.column())) {
          String h = ctx.hiddenColumn();
          moved.put(k.column(), h);
          s.hidden.put(h, s.items.get(k.column()));
        }
      }
      LinkedHashMap<String, Part> kept = new LinkedHashMap<>();
      for (String c : q.columns()) kept.put(c, s.items.get(c));
      s.items.clear();
      s.items.putAll(kept);
      s.ordering = renameKeys(s.ordering, moved);
      return s;
    }

    @Override
    public Select visit(FilterQuery q) {
      Select s = q.from().accept(this);
      if (s.isUnion() || s.groupBy != null || s.windowed) s = derived(s, true);
      s.where.add(inline(q.predicate(), s.items));
      return s;
    }

    @Override
    public Select visit(GroupByQuery q) {
      Select s = q.from().accept(this);
      boolean fold = !s.isUnion() && s.groupBy == null && !s.windowed;
      for (String g : q.groupColumns()) {
        if (fold && !isColumnRef(s.items.get(g))) fold = false;
      }
      if (!fold) s = derived(s, false);
      Schema src = q.from().schema();
      LinkedHashMap<String, Part> out = new LinkedHashMap<>();
      List<Part> keys = new ArrayList<>();
      for (String g : q.groupColumns()) {
        out.put(g, s.items.get(g));
        keys.add(s.items.get(g));
      }
      for (AggSpec a : q.aggs()) {
        out.put(a.column(), substitute(aggregate(a.fn(), ARG, src.columnType(a.column())), s.items.get(a.column())));
      }
      s.items.clear();
      s.items.putAll(out);
      s.hidden.clear();
      s.groupBy = keys;
      s.ordering = List.of();
      return s;
    }

    @Override
    public Select visit(SortQuery q) {
      Select s = q.from().accept(this);
      // earlier sorts survive as tie-breakers (stable multi-pass sort)
      List<SortKey> ordering = new ArrayList<>(q.keys());
      Set<String> seen = new HashSet<>();
      for (SortKey k : q.keys()) seen.add(k.column());
      for (SortKey k : s.ordering) {
        if (seen.add(k.column())) ordering.add(k);
      }
      s.ordering = ordering;
      return s;
    }

    @Override
    public Select visit(ExtendQuery q) {
      Select s = q.from().accept(this);
      if (s.isUnion()) s = derived(s, true);
      s.items.put(q.columnId(), inline(q.value(), s.items));
      return s;
    }

    @Override
    public Select visit(MapColumnsQuery q) {
      return renamed(q.from(), q.schema());
    }

    @Override
    public Select visit(MapColumnsByIndexQuery q) {
      return renamed(q.from(), q.schema());
    }

    private Select renamed(QueryExp from, Schema out) {
      Select s = from.accept(this);
      if (s.isUnion()) s = derived(s, true);
      List<String> before = from.schema().columns();
      List<String> after = out.columns();
      Map<String, String> renames = new HashMap<>();
      LinkedHashMap<String, Part> items = new LinkedHashMap<>();
      for (int i = 0; i < before.size(); i++) {
        renames.put(before.get(i), after.get(i));
        items.put(after.get(i), s.items.get(before.get(i)));
      }
      s.items.clear();
      s.items.putAll(items);
      s.ordering = renameKeys(s.ordering, renames);
      return s;
    }

    @Override
    public Select visit(ConcatQuery q) {
      Select l = q.left().accept(this);
      Select r = q.right().accept(this);
      Select s = new Select();
      s.branches = new ArrayList<>();
      s.branches.addAll(branches(l));
      s.branches.addAll(branches(r));
      for (String c : q.schema().columns()) s.items.put(c, Part.of(quoteIdent(c)));
      return s;
    }

    @Override
    public Select visit(JoinQuery q) {
      Select l = derived(q.left().accept(this), false);
      Select r = derived(q.right().accept(this), false);
      String la = alias(l);
      String ra = alias(r);
      Schema ls = q.left().schema();
      Select s = new Select();
      for (String c : q.schema().columns()) {
        s.items.put(c, Part.of((ls.hasColumn(c) ? la : ra) + "." + quoteIdent(c)));
      }
      List<String> on = new ArrayList<>();
      for (String k : q.on()) on.add(joinCondition(la + "." + quoteIdent(k), ra + "." + quoteIdent(k)));
      List<Bind> binds = new ArrayList<>(l.from.binds());
      binds.addAll(r.from.binds());
      s.from = new Part(l.from.sql() + " " + joinKeyword(q.joinType()) + " " + r.from.sql()
          + " ON " + String.join(" AND ", on), binds);
      return s;
    }

    @Override
    public Select visit(RowNumberQuery q) {
      Select s = q.from().accept(this);
      if (s.isUnion() || s.windowed) s = derived(s, true);
      List<Bind> binds = new ArrayList<>();
      ExprRenderer r = new ExprRenderer(s.items, binds);
      List<String> keys = new ArrayList<>(q.keys().size());
      for (SortKey k : q.keys()) keys.add(orderItem(r.visit(new ColumnRef(k.column())), k.ascending()));
      s.items.put(q.columnId(), new Part("ROW_NUMBER() OVER (ORDER BY " + String.join(", ", keys) + ")", binds));
      s.windowed = true;
      return s;
    }

    private Part inline(Expr e, Map<String, Part> scope) {
      List<Bind> binds = new ArrayList<>();
      String sql = e.accept(new ExprRenderer(scope, binds));
      return new Part(sql, binds);
    }

    /** Close {@code s} into a derived table; ordering and hidden columns carry over when {@code keepOrder}. */
    private Select derived(Select s, boolean keepOrder) {
      Part inner = render(s, keepOrder);
      Select out = new Select();
      out.from = new Part("(" + inner.sql() + ") " + ctx.alias(), inner.binds());
      for (String c : s.items.keySet()) out.items.put(c, Part.of(quoteIdent(c)));
      if (keepOrder) {
        for (String c : s.hidden.keySet()) out.hidden.put(c, Part.of(quoteIdent(c)));
        out.ordering = s.ordering;
      }
      return out;
    }

    private List<Part> branches(Select s) {
      return s.isUnion() ? s.branches : List.of(render(s, false));
    }
  }

  /** Bare or alias-qualified column name; the only group keys folded into a level. */
  private static boolean isColumnRef(Part p) {
    return p.binds().isEmpty() && p.sql().matches("(t\\d+\\.)?\"([^\"]|\"\")*\"");
  }

  private static String alias(Select derived) {
    String from = derived.from.sql();
    return from.substring(from.lastIndexOf(' ') + 1);
  }

  /** Expand the {@link #ARG} placeholders of an aggregate template, one copy of the argument's binds each. */
  private static Part substitute(String template, Part arg) {
    String[] pieces = template.split(ARG, -1);
    StringBuilder sql = new StringBuilder(pieces[0]);
    List<Bind> binds = new ArrayList<>();
    for (int i = 1; i < pieces.length; i++) {
      sql.append(arg.sql()).append(pieces[i]);
      binds.addAll(arg.binds());
    }
    return new Part(sql.toString(), binds);
  }

  private static List<SortKey> renameKeys(List<SortKey> ordering, Map<String, String> renames) {
    List<SortKey> out = new ArrayList<>(ordering.size());
    for (SortKey k : ordering) out.add(k.withColumn(renames.getOrDefault(k.column(), k.column())));
    return out;
  }
}
