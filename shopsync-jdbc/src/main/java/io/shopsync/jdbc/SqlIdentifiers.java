package io.shopsync.jdbc;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation of table names, column names and order-by clauses spliced into SQL text.
 */
final class SqlIdentifiers {
  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
  private static final Pattern ORDER_TERM = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)(\\s+(ASC|DESC))?",
      Pattern.CASE_INSENSITIVE);

  static String require(String name) {
    if (name == null || !IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid SQL identifier: " + name);
    }
    return name.toLowerCase(Locale.ROOT);
  }

  /**
   * Validates a {@code column [ASC|DESC], ...} list and returns it normalized.
   */
  static String orderBy(String clause) {
    StringBuilder normalized = new StringBuilder();
    for (String term : clause.split(",")) {
      String trimmed = term.trim();
      if (!ORDER_TERM.matcher(trimmed).matches()) {
        throw new IllegalArgumentException("Invalid order by clause: " + clause);
      }
      if (normalized.length() > 0) {
        normalized.append(", ");
      }
      normalized.append(trimmed.replaceAll("\\s+", " "));
    }
    return normalized.toString();
  }

  private SqlIdentifiers() {}
}
