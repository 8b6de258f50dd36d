package io.intellixity.reltab.jdbc;

import io.intellixity.reltab.schema.Schema;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache of discovered table schemas with expire-after-write.
 * A ttl of 0 disables expiry.
 */
final class TableSchemaCache {
  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<String, Entry> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry(Schema schema, long writtenAt) {}

  TableSchemaCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  TableSchemaCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  synchronized Schema get(String table) {
    Entry e = map.get(table);
    if (e == null) return null;
    if (ttlMillis > 0 && nowMillis.getAsLong() - e.writtenAt() >= ttlMillis) {
      map.remove(table);
      return null;
    }
    return e.schema();
  }

  synchronized void put(String table, Schema schema) {
    map.put(table, new Entry(schema, nowMillis.getAsLong()));
    Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
    while (map.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
    }
  }

  synchronized void invalidate(String table) {
    map.remove(table);
  }

  synchronized int size() {
    return map.size();
  }
}
