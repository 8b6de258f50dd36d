package io.intellixity.reltab.jdbc.dialect;

import io.intellixity.reltab.jdbc.SqlStatement;
import io.intellixity.reltab.query.OffsetPage;
import io.intellixity.reltab.query.QueryExp;

/**
 * Renders {@link QueryExp} trees as SQL for one backing engine.
 *
 * <p>Compiled statements return exactly the query's schema: same column names, same order. Implementations
 * are stateless and may be shared between threads.</p>
 */
public interface SqlDialect {
  /** Identifier used to select the dialect from configuration ("h2", "postgres", ...). */
  String id();

  /** @throws io.intellixity.reltab.exec.CompileException if the query cannot be rendered */
  SqlStatement compile(QueryExp query);

  /** Like {@link #compile(QueryExp)}, restricted to one window of the ordered result. */
  SqlStatement compile(QueryExp query, OffsetPage page);

  /** Statement returning a single row with the number of rows {@code query} produces. */
  SqlStatement compileCount(QueryExp query);
}
