package io.intellixity.strata.postgres.jdbc;

import java.util.Locale;
import java.util.Set;

/**
 * Derives the command keyword of a statement the way Postgres reports it in its command tag
 * (INSERT, UPDATE, SELECT, ...). JDBC does not expose the server's tag, so it is read from the SQL.
 */
public final class CommandTags {
  /** Words that can follow a CTE name or column list before its body. */
  private static final Set<String> CTE_KEYWORDS = Set.of("AS", "NOT", "MATERIALIZED");

  private CommandTags() {}

  /** Leading command keyword in upper case, or null when the text has none. */
  public static String commandOf(String sql) {
    if (sql == null) return null;
    int i = skipNoise(sql, 0, true);
    String word = wordAt(sql, i);
    if (!"WITH".equals(word)) return word;
    return commandAfterWith(sql, i + word.length());
  }

  /**
   * Skips the CTE list of {@code WITH [RECURSIVE] a [(cols)] AS [[NOT] MATERIALIZED] (...), ...}.
   */
  private static String commandAfterWith(String sql, int from) {
    int depth = 0;
    boolean inSingleQuote = false;
    for (int i = from; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (inSingleQuote) {
        if (ch == '\'') inSingleQuote = false;
        continue;
      }
      if (ch == '\'') {
        inSingleQuote = true;
      } else if (ch == '(') {
        depth++;
      } else if (ch == ')') {
        depth--;
        if (depth == 0) {
          int next = skipNoise(sql, i + 1, false);
          if (next < sql.length() && sql.charAt(next) == ',') {
            i = next;
            continue;
          }
          String word = wordAt(sql, next);
          if (word == null) {
            // Parenthesized main statement.
            word = wordAt(sql, skipNoise(sql, next, true));
            if (word != null) return word;
          } else if (CTE_KEYWORDS.contains(word)) {
            i = next + word.length() - 1;
          } else {
            return word;
          }
        }
      }
    }
    return null;
  }

  private static int skipNoise(String sql, int from, boolean skipParens) {
    int i = from;
    while (i < sql.length()) {
      char ch = sql.charAt(i);
      if (Character.isWhitespace(ch) || (skipParens && ch == '(')) {
        i++;
      } else if (ch == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        i = (end < 0) ? sql.length() : end + 1;
      } else if (ch == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = (end < 0) ? sql.length() : end + 2;
      } else {
        break;
      }
    }
    return i;
  }

  private static String wordAt(String sql, int from) {
    int end = from;
    while (end < sql.length() && Character.isLetter(sql.charAt(end))) end++;
    return (end == from) ? null : sql.substring(from, end).toUpperCase(Locale.ROOT);
  }
}
