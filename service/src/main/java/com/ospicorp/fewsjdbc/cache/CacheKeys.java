package com.ospicorp.fewsjdbc.cache;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds keys of the form {@code namespace::slug::part...}. Slug and parts are URL-encoded
 * so a {@code ::} inside a user supplied id cannot make two lookups share a key.
 */
public final class CacheKeys {
  public static final String FILTER_TREE = "fewsjdbc.filter-tree";
  public static final String PARAMETERS = "fewsjdbc.parameters";
  public static final String PARAMETER_NAME = "fewsjdbc.parameter-name";
  public static final String LOCATIONS = "fewsjdbc.locations";
  public static final String UNIT = "fewsjdbc.unit";

  private static final String SEPARATOR = "::";

  private CacheKeys() {
  }

  public static String key(String namespace, String slug, String... parts) {
    StringBuilder builder = new StringBuilder(namespace).append(SEPARATOR).append(encode(slug));
    for (String part : parts) {
      builder.append(SEPARATOR).append(encode(part));
    }
    return builder.toString();
  }

  public static boolean belongsTo(String key, String slug) {
    int start = key.indexOf(SEPARATOR);
    if (start < 0) {
      return false;
    }
    int from = start + SEPARATOR.length();
    int end = key.indexOf(SEPARATOR, from);
    String encodedSlug = end < 0 ? key.substring(from) : key.substring(from, end);
    return encodedSlug.equals(encode(slug));
  }

  // URLEncoder escapes "~", so it can stand for null without colliding.
  private static String encode(String value) {
    return value == null ? "~" : URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
