package io.intellixity.reltab.jdbc;

import io.intellixity.reltab.ReltabException;
import io.intellixity.reltab.exec.EvalException;
import io.intellixity.reltab.exec.ReltabConnection;
import io.intellixity.reltab.jdbc.dialect.SqlDialect;
import io.intellixity.reltab.query.OffsetPage;
import io.intellixity.reltab.query.QueryExp;
import io.intellixity.reltab.query.TableQuery;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;
import io.intellixity.reltab.table.TableRep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link ReltabConnection} over a JDBC {@link DataSource}.
 *
 * <p>Queries compile on the calling thread (so compile errors surface as an already-failed future) and
 * execute on {@code executor}, each on its own pooled JDBC connection. Evaluation failures complete the
 * future with {@link EvalException}; {@code join()} wraps it in a {@code CompletionException}.</p>
 */
public final class JdbcConnection implements ReltabConnection, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnection.class);

  private final DataSource ds;
  private final SqlDialect dialect;
  private final Executor executor;
  private final TableSchemaCache schemaCache;
  private final List<AutoCloseable> owned;

  public JdbcConnection(DataSource ds, SqlDialect dialect, Executor executor) {
    this(ds, dialect, executor, new TableSchemaCache(256, 600_000L), List.of());
  }

  JdbcConnection(DataSource ds, SqlDialect dialect, Executor executor, TableSchemaCache schemaCache,
                 List<AutoCloseable> owned) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.schemaCache = Objects.requireNonNull(schemaCache, "schemaCache");
    this.owned = List.copyOf(owned);
  }

  public SqlDialect dialect() { return dialect; }

  @Override
  public CompletableFuture<TableRep> evalQuery(QueryExp query) {
    return evalQuery(query, null);
  }

  @Override
  public CompletableFuture<TableRep> evalQuery(QueryExp query, OffsetPage page) {
    Objects.requireNonNull(query, "query");
    final SqlStatement ss;
    try {
      ss = dialect.compile(query, page);
    } catch (ReltabException e) {
      return CompletableFuture.failedFuture(e);
    }
    Schema schema = query.schema();
    return CompletableFuture.supplyAsync(() -> select(schema, ss), executor);
  }

  @Override
  public CompletableFuture<Long> rowCount(QueryExp query) {
    Objects.requireNonNull(query, "query");
    final SqlStatement ss;
    try {
      ss = dialect.compileCount(query);
    } catch (ReltabException e) {
      return CompletableFuture.failedFuture(e);
    }
    return CompletableFuture.supplyAsync(() -> count(ss), executor);
  }

  @Override
  public CompletableFuture<QueryExp> tableQuery(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    Schema cached = schemaCache.get(tableName);
    if (cached != null) return CompletableFuture.completedFuture(new TableQuery(tableName, cached));
    return CompletableFuture.supplyAsync(() -> {
      Schema s = discoverSchema(tableName);
      schemaCache.put(tableName, s);
      return new TableQuery(tableName, s);
    }, executor);
  }

  /** Drop a cached table schema, e.g. after DDL. */
  public void invalidateTable(String tableName) {
    schemaCache.invalidate(tableName);
  }

  @Override
  public void close() {
    RuntimeException failure = null;
    for (AutoCloseable c : owned) {
      try {
        c.close();
      } catch (Exception e) {
        if (failure == null) failure = new IllegalStateException("Failed to close " + c, e);
        else failure.addSuppressed(e);
      }
    }
    if (failure != null) throw failure;
  }

  private TableRep select(Schema schema, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("SELECT", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        int n = rs.getMetaData().getColumnCount();
        if (n != schema.size()) {
          throw new EvalException("Statement returned " + n + " columns, expected " + schema.size(), ss.sql(), null);
        }
        List<ColumnType> types = new ArrayList<>(n);
        for (String col : schema.columns()) types.add(schema.columnType(col));
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) rows.add(readRow(rs, types));
        debugDone("SELECT", rows.size(), System.nanoTime() - start);
        return new TableRep(schema, rows);
      }
    } catch (SQLException e) {
      throw failed("SELECT", ss, e);
    }
  }

  private long count(SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("COUNT", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        long v = rs.next() ? rs.getLong(1) : 0L;
        debugDone("COUNT", v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw failed("COUNT", ss, e);
    }
  }

  private Schema discoverSchema(String tableName) {
    long start = System.nanoTime();
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      String esc = md.getSearchStringEscape();
      String pattern = (esc == null || esc.isEmpty())
          ? tableName
          : tableName.replace(esc, esc + esc).replace("_", esc + "_").replace("%", esc + "%");
      String currentSchema = c.getSchema();

      // TABLE_SCHEM -> (ordinal -> column)
      Map<String, TreeMap<Integer, String[]>> bySchema = new LinkedHashMap<>();
      try (ResultSet rs = md.getColumns(c.getCatalog(), null, pattern, null)) {
        while (rs.next()) {
          if (!tableName.equals(rs.getString("TABLE_NAME"))) continue;
          String schem = String.valueOf(rs.getString("TABLE_SCHEM"));
          String[] col = {
              rs.getString("COLUMN_NAME"),
              String.valueOf(rs.getInt("DATA_TYPE")),
              String.valueOf(rs.getInt("DECIMAL_DIGITS")),
              rs.getString("TYPE_NAME")
          };
          bySchema.computeIfAbsent(schem, k -> new TreeMap<>()).put(rs.getInt("ORDINAL_POSITION"), col);
        }
      }
      if (bySchema.isEmpty()) throw new EvalException("Table not found: '" + tableName + "'", null, null);
      TreeMap<Integer, String[]> cols = bySchema.containsKey(currentSchema)
          ? bySchema.get(currentSchema)
          : bySchema.values().iterator().next();

      Schema.Builder b = Schema.builder();
      for (String[] col : cols.values()) {
        ColumnType t = columnType(Integer.parseInt(col[1]), Integer.parseInt(col[2]));
        if (t == null) {
          throw new EvalException("Column '" + col[0] + "' of table '" + tableName + "' has unsupported SQL type "
              + col[3], null, null);
        }
        b.column(col[0], t);
      }
      Schema s = b.build();
      if (log.isDebugEnabled()) {
        log.debug("reltab.jdbc_done op=DESCRIBE table={} columns={} durationMs={}",
            tableName, s.size(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return s;
    } catch (SQLException e) {
      throw new EvalException("Failed to read metadata for table '" + tableName + "': " + e.getMessage(), null, e);
    }
  }

  static ColumnType columnType(int jdbcType, int scale) {
    return switch (jdbcType) {
      case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR,
          Types.CLOB, Types.NCLOB, Types.DATE, Types.TIME, Types.TIMESTAMP,
          Types.TIME_WITH_TIMEZONE, Types.TIMESTAMP_WITH_TIMEZONE -> ColumnType.TEXT;
      case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> ColumnType.INTEGER;
      case Types.NUMERIC, Types.DECIMAL -> scale == 0 ? ColumnType.INTEGER : ColumnType.REAL;
      case Types.REAL, Types.FLOAT, Types.DOUBLE -> ColumnType.REAL;
      case Types.BIT, Types.BOOLEAN -> ColumnType.BOOLEAN;
      default -> null;
    };
  }

  private static List<Object> readRow(ResultSet rs, List<ColumnType> types) throws SQLException {
    List<Object> row = new ArrayList<>(types.size());
    for (int i = 0; i < types.size(); i++) {
      int idx = i + 1;
      Object v = switch (types.get(i)) {
        case INTEGER -> rs.getLong(idx);
        case REAL -> rs.getDouble(idx);
        case BOOLEAN -> rs.getBoolean(idx);
        case TEXT -> rs.getString(idx);
      };
      row.add(rs.wasNull() ? null : v);
    }
    return row;
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    int idx = 1;
    for (Bind b : ss.binds()) {
      Object v = b.value();
      if (v == null) {
        ps.setNull(idx++, sqlTypeCode(b.type()));
        continue;
      }
      switch (b.type()) {
        case TEXT -> ps.setString(idx, (String) v);
        case INTEGER -> ps.setLong(idx, (Long) v);
        case REAL -> ps.setDouble(idx, (Double) v);
        case BOOLEAN -> ps.setBoolean(idx, (Boolean) v);
      }
      idx++;
    }
  }

  private static int sqlTypeCode(ColumnType t) {
    return switch (t) {
      case TEXT -> Types.VARCHAR;
      case INTEGER -> Types.BIGINT;
      case REAL -> Types.DOUBLE;
      case BOOLEAN -> Types.BOOLEAN;
    };
  }

  private EvalException failed(String op, SqlStatement ss, SQLException e) {
    if (log.isDebugEnabled()) {
      log.debug("reltab.jdbc_failed op={} dialect={} sqlState={} errorCode={}",
          op, dialect.id(), e.getSQLState(), e.getErrorCode());
    }
    return new EvalException(op + " failed: " + e.getMessage(), ss.sql(), e);
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("reltab.jdbc op={} dialect={} bindCount={} sql={}", op, dialect.id(), ss.binds().size(), ss.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("reltab.jdbc bind index={} type={} isNull={} valueLen={}", idx++, b.type().id(), v == null, vLen);
      }
    }
  }

  private void debugDone(String op, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("reltab.jdbc_done op={} dialect={} durationMs={} result={}",
        op, dialect.id(), durationNanos / 1_000_000.0, result);
  }
}
