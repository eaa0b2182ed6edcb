package io.shopsync.jdbc;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaScriptTest {

  @Test
  void splitsOnSemicolonsAndDropsCommentLines() {
    String script = "-- tables\n"
        + "CREATE TABLE a (id INT);\n"
        + "\n"
        + "  -- indexes\n"
        + "CREATE INDEX IF NOT EXISTS idx_a ON a (id);\n";

    List<String> statements = SchemaScript.parse(script);

    assertEquals(List.of("CREATE TABLE a (id INT)", "CREATE INDEX IF NOT EXISTS idx_a ON a (id)"), statements);
  }

  @Test
  void multiLineStatementStaysWhole() {
    List<String> statements = SchemaScript.parse("CREATE TABLE b (\r\n  id INT,\r\n  name VARCHAR(10)\r\n)");

    assertEquals(1, statements.size());
    assertTrue(statements.get(0).contains("name VARCHAR(10)"));
  }

  @Test
  void blankScriptHasNoStatements() {
    assertTrue(SchemaScript.parse("  \n-- nothing here\n").isEmpty());
  }

  @Test
  void bundledSchemaParses() throws Exception {
    try (var in = SchemaScriptTest.class.getClassLoader().getResourceAsStream(JdbcLocalStore.DEFAULT_SCHEMA)) {
      assertNotNull(in);
      List<String> statements = SchemaScript.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
      assertTrue(statements.stream().anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS sync_queue")));
    }
  }
}
