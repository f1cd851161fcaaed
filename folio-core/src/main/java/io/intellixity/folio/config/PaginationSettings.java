package io.intellixity.folio.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Objects;
import java.util.Properties;

/**
 * Pagination defaults shared by every paginator.
 *
 * <p>Loaded from the optional classpath resource {@code folio.properties}:</p>
 * <pre>
 * folio.pagination.id-field=_id
 * folio.pagination.default-limit=10
 * folio.pagination.max-limit=0
 * </pre>
 *
 * @param idField      identifier field appended to every sort as tiebreaker and encoded in cursors
 * @param defaultLimit limit used when a query carries no page
 * @param maxLimit     largest accepted limit; {@code 0} means unbounded
 */
public record PaginationSettings(String idField, int defaultLimit, int maxLimit) {
  public static final String RESOURCE = "folio.properties";

  public static final String ID_FIELD = "folio.pagination.id-field";
  public static final String DEFAULT_LIMIT = "folio.pagination.default-limit";
  public static final String MAX_LIMIT = "folio.pagination.max-limit";

  public PaginationSettings {
    Objects.requireNonNull(idField, "idField");
    if (idField.isBlank()) throw new IllegalArgumentException("idField must not be blank");
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    if (maxLimit < 0) throw new IllegalArgumentException("maxLimit must be >= 0");
    if (maxLimit > 0 && defaultLimit > maxLimit) {
      throw new IllegalArgumentException("defaultLimit must not exceed maxLimit");
    }
  }

  public static PaginationSettings defaults() {
    return new PaginationSettings("_id", 10, 0);
  }

  public PaginationSettings withIdField(String idField) {
    return new PaginationSettings(idField, defaultLimit, maxLimit);
  }

  public PaginationSettings withDefaultLimit(int defaultLimit) {
    return new PaginationSettings(idField, defaultLimit, maxLimit);
  }

  public PaginationSettings withMaxLimit(int maxLimit) {
    return new PaginationSettings(idField, defaultLimit, maxLimit);
  }

  public boolean exceedsMax(int limit) {
    return maxLimit > 0 && limit > maxLimit;
  }

  public static PaginationSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  /** Reads {@link #RESOURCE} when present; missing keys keep their defaults. */
  public static PaginationSettings load(ClassLoader cl) {
    if (cl == null) cl = PaginationSettings.class.getClassLoader();
    URL url = cl.getResource(RESOURCE);
    if (url == null) return defaults();

    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return fromProperties(p);
  }

  public static PaginationSettings fromProperties(Properties p) {
    PaginationSettings d = defaults();
    String idField = p.getProperty(ID_FIELD, d.idField()).trim();
    int defaultLimit = intProperty(p, DEFAULT_LIMIT, d.defaultLimit());
    int maxLimit = intProperty(p, MAX_LIMIT, d.maxLimit());
    return new PaginationSettings(idField, defaultLimit, maxLimit);
  }

  private static int intProperty(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " must be an integer but was: " + v, e);
    }
  }
}
