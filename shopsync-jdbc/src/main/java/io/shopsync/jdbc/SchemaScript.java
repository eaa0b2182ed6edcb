package io.shopsync.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script into statements. Supports {@code --} line comments and
 * {@code ;} terminators; string literals must not contain {@code ;}.
 */
final class SchemaScript {

  static List<String> parse(String script) {
    StringBuilder text = new StringBuilder();
    for (String line : script.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.startsWith("--")) {
        continue;
      }
      text.append(line).append('\n');
    }
    List<String> statements = new ArrayList<>();
    for (String statement : text.toString().split(";")) {
      String sql = statement.trim();
      if (!sql.isEmpty()) {
        statements.add(sql);
      }
    }
    return statements;
  }

  private SchemaScript() {}
}
