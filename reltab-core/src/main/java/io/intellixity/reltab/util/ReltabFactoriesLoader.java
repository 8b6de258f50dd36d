package io.intellixity.reltab.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads implementations listed in every {@code META-INF/reltab.factories} resource on the classpath.
 *
 * <p>Each resource is a Properties file mapping an interface name to comma-separated implementation
 * class names:</p>
 * <pre>
 * io.intellixity.reltab.jdbc.dialect.SqlDialect=io.intellixity.reltab.jdbc.dialect.H2Dialect
 * </pre>
 * Implementations need a public no-arg constructor. Duplicate names across resources load once.
 */
public final class ReltabFactoriesLoader {
  public static final String RESOURCE = "META-INF/reltab.factories";

  private ReltabFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl == null) ? ReltabFactoriesLoader.class.getClassLoader() : cl;

    Set<String> names = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = loader.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(spiType.getName());
      if (v == null) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }

    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(name, spiType, loader));
    return out;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for " + spiType.getName() + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
