package io.intellixity.reltab.aggtree;

import io.intellixity.reltab.ReltabException;
import io.intellixity.reltab.exec.ReltabConnection;
import io.intellixity.reltab.query.QueryExp;
import io.intellixity.reltab.query.SortKey;
import io.intellixity.reltab.table.TableRep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Session state for one pivot table: pivot configuration, open paths and sort key, plus the last
 * materialized view.
 *
 * <p>Mutators only record state and mark the view stale; {@link #refresh()} is the single point that
 * evaluates. Each refresh snapshots the state when it is called, so mutating while a refresh is in flight
 * never produces a torn view. When refreshes overlap, the most recently started one wins: an older
 * refresh that completes later still returns its own result but does not replace {@link #currentView()}.</p>
 */
public final class PivotTreeModel {
  private static final Logger log = LoggerFactory.getLogger(PivotTreeModel.class);

  /** Notified after a refresh installs a new current view. */
  @FunctionalInterface
  public interface Listener {
    void viewChanged(PivotTreeModel model, TableRep view);
  }

  private final ReltabConnection conn;
  private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

  private QueryExp baseQuery;
  private List<String> pivots;
  private String leafColumn;
  private boolean showRoot;
  private boolean showLeafRows = true;
  private List<SortKey> sortKey = List.of();
  private PathTree openPaths = PathTree.root();

  private AggTree tree;
  private TableRep currentView;
  private long stateVersion;
  private long viewVersion = -1;
  private long refreshGeneration;

  public PivotTreeModel(ReltabConnection conn, QueryExp baseQuery, List<String> pivots, String leafColumn,
                        boolean showRoot) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.baseQuery = Objects.requireNonNull(baseQuery, "baseQuery");
    this.pivots = List.copyOf(Objects.requireNonNull(pivots, "pivots"));
    this.leafColumn = leafColumn;
    this.showRoot = showRoot;
  }

  public void addListener(Listener l) {
    listeners.add(Objects.requireNonNull(l, "listener"));
  }

  public void removeListener(Listener l) {
    listeners.remove(l);
  }

  public synchronized void openPath(List<?> path) {
    PathTree next = openPaths.open(path);
    if (!next.equals(openPaths)) {
      openPaths = next;
      changed("openPath " + path, false);
    }
  }

  public synchronized void closePath(List<?> path) {
    PathTree next = openPaths.close(path);
    if (!next.equals(openPaths)) {
      openPaths = next;
      changed("closePath " + path, false);
    }
  }

  public synchronized void setOpenPaths(PathTree paths) {
    openPaths = Objects.requireNonNull(paths, "paths");
    changed("setOpenPaths", false);
  }

  public synchronized PathTree openPaths() { return openPaths; }

  public synchronized boolean isOpen(List<?> path) { return openPaths.isOpen(path); }

  public synchronized void setSort(List<SortKey> keys) {
    sortKey = List.copyOf(Objects.requireNonNull(keys, "keys"));
    changed("setSort " + sortKey, true);
  }

  public synchronized List<SortKey> sortKey() { return sortKey; }

  /** Replace the pivot columns. Open paths refer to the old levels, so only the root stays open. */
  public synchronized void setPivots(List<String> pivots) {
    this.pivots = List.copyOf(Objects.requireNonNull(pivots, "pivots"));
    openPaths = PathTree.root();
    changed("setPivots " + this.pivots, true);
  }

  public synchronized List<String> pivots() { return pivots; }

  public synchronized void setLeafColumn(String leafColumn) {
    this.leafColumn = leafColumn;
    changed("setLeafColumn " + leafColumn, true);
  }

  public synchronized void setShowRoot(boolean showRoot) {
    this.showRoot = showRoot;
    changed("setShowRoot " + showRoot, true);
  }

  public synchronized void setShowLeafRows(boolean showLeafRows) {
    this.showLeafRows = showLeafRows;
    changed("setShowLeafRows " + showLeafRows, true);
  }

  /** Replace the base query; pivots and open paths are kept and validated on the next refresh. */
  public synchronized void setBaseQuery(QueryExp baseQuery) {
    this.baseQuery = Objects.requireNonNull(baseQuery, "baseQuery");
    changed("setBaseQuery", true);
  }

  /**
   * The pivot tree for the current configuration.
   *
   * @throws io.intellixity.reltab.query.QueryBuildException if the configuration is invalid for the base query
   */
  public synchronized AggTree aggTree() {
    if (tree == null) {
      tree = new AggTree(baseQuery, pivots, leafColumn, showRoot, showLeafRows, sortKey);
    }
    return tree;
  }

  /** Last view installed by {@link #refresh()}, or null before the first one completes. */
  public synchronized TableRep currentView() { return currentView; }

  /** True when state changed since the current view was computed (or no view exists yet). */
  public synchronized boolean isStale() { return viewVersion != stateVersion; }

  /**
   * Evaluate the sorted tree for the current state. Fails with the build error if the configuration is
   * invalid, or with the evaluation error from the connection.
   */
  public CompletableFuture<TableRep> refresh() {
    final QueryExp query;
    final long generation;
    final long version;
    synchronized (this) {
      try {
        query = aggTree().getSortedTreeQuery(openPaths);
      } catch (ReltabException e) {
        return CompletableFuture.failedFuture(e);
      }
      generation = ++refreshGeneration;
      version = stateVersion;
    }
    log.debug("reltab.pivot refresh generation={} stateVersion={}", generation, version);
    return conn.evalQuery(query).thenApply(view -> {
      boolean installed;
      synchronized (this) {
        installed = generation == refreshGeneration;
        if (installed) {
          currentView = view;
          viewVersion = version;
        }
      }
      if (installed) {
        for (Listener l : listeners) l.viewChanged(this, view);
      } else {
        log.debug("reltab.pivot refresh generation={} superseded; view not installed", generation);
      }
      return view;
    });
  }

  private void changed(String what, boolean rebuildTree) {
    stateVersion++;
    if (rebuildTree) tree = null;
    log.debug("reltab.pivot state change={} stateVersion={}", what, stateVersion);
  }
}
