package io.intellixity.reltab.jdbc;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionSettingsTest {
  @Test
  void loadsFromClasspathResource() {
    ConnectionSettings s = ConnectionSettings.load("reltab-test.properties");
    assertEquals("jdbc:h2:mem:settings", s.url());
    assertEquals("sa", s.username());
    assertEquals(3, s.maxPoolSize());
    assertEquals(2, s.evalThreads());
    assertEquals("h2", s.dialect());
    assertEquals(256, s.schemaCacheMaxEntries());
    assertEquals(0L, s.schemaCacheTtlMillis());
  }

  @Test
  void missingUrlIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConnectionSettings.fromProperties(new Properties()));
  }

  @Test
  void invalidNumberIsRejected() {
    Properties p = new Properties();
    p.setProperty("reltab.jdbc.url", "jdbc:h2:mem:x");
    p.setProperty("reltab.eval.threads", "many");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ConnectionSettings.fromProperties(p));
    assertTrue(ex.getMessage().contains("reltab.eval.threads"));
  }

  @Test
  void toStringOmitsPassword() {
    ConnectionSettings s = ConnectionSettings.of("jdbc:h2:mem:x", "sa", "s3cret").withDialect("postgres");
    assertEquals("postgres", s.dialect());
    assertFalse(s.toString().contains("s3cret"));
  }

  @Test
  void unknownDialectFailsOpen() {
    ConnectionSettings s = ConnectionSettings.of("jdbc:h2:mem:x", "sa", "").withDialect("oracle");
    assertThrows(IllegalArgumentException.class, () -> JdbcConnections.open(s));
  }
}
