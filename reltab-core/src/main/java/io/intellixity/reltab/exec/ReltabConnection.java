package io.intellixity.reltab.exec;

import io.intellixity.reltab.query.OffsetPage;
import io.intellixity.reltab.query.QueryExp;
import io.intellixity.reltab.table.TableRep;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous evaluator for {@link QueryExp} trees.
 *
 * <p>Every method returns immediately. Failures complete the future exceptionally with
 * {@link CompileException} (the query cannot be rendered) or {@link EvalException} (the engine failed).
 * Concurrent calls are independent; the result of one never depends on another being in flight.</p>
 */
public interface ReltabConnection {
  /** Evaluate {@code query}; the result schema equals {@code query.schema()}. */
  CompletableFuture<TableRep> evalQuery(QueryExp query);

  /** Evaluate one window of {@code query}'s rows, after its own ordering is applied. */
  CompletableFuture<TableRep> evalQuery(QueryExp query, OffsetPage page);

  /** Number of rows {@code query} would return. */
  CompletableFuture<Long> rowCount(QueryExp query);

  /** A {@link io.intellixity.reltab.query.TableQuery} for a base table, with its schema read from the engine. */
  CompletableFuture<QueryExp> tableQuery(String tableName);
}
