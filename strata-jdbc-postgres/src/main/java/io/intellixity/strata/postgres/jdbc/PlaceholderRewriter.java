package io.intellixity.strata.postgres.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites Postgres {@code $n} placeholders into JDBC {@code ?} binds.
 *
 * Rules:
 * - {@code $} followed by digits is a placeholder; {@code $n} may repeat and may appear out of order.
 * - String literals (including {@code E'...'} escape strings and {@code $tag$...$tag$} bodies),
 *   double-quoted identifiers, {@code --} comments and (nested) block comments are copied as-is.
 * - A literal {@code ?} outside quotes (jsonb operators) is escaped as {@code ??} for pgjdbc.
 */
public final class PlaceholderRewriter {
  private PlaceholderRewriter() {}

  /** JDBC SQL plus the parameters re-ordered to match its {@code ?} binds. */
  public record JdbcStatement(String sql, List<Object> parameters) {}

  public static JdbcStatement rewrite(String sql, List<Object> parameters) {
    if (sql == null) return new JdbcStatement("", List.of());
    List<Object> params = (parameters == null) ? List.of() : parameters;
    StringBuilder out = new StringBuilder(sql.length() + 8);
    List<Object> ordered = new ArrayList<>();
    boolean inSingleQuote = false;
    boolean backslashEscapes = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (inSingleQuote) {
        out.append(ch);
        if (backslashEscapes && ch == '\\' && i + 1 < sql.length()) {
          out.append(sql.charAt(++i));
        } else if (ch == '\'') {
          // '' escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
            out.append('\'');
            i++;
          } else {
            inSingleQuote = false;
          }
        }
        continue;
      }
      if (inDoubleQuote) {
        out.append(ch);
        if (ch == '"') inDoubleQuote = false;
        continue;
      }

      if (ch == '\'') {
        inSingleQuote = true;
        backslashEscapes = i > 0 && (sql.charAt(i - 1) == 'E' || sql.charAt(i - 1) == 'e')
            && (i < 2 || !isIdentifierPart(sql.charAt(i - 2)));
        out.append(ch);
        continue;
      }
      if (ch == '"') {
        inDoubleQuote = true;
        out.append(ch);
        continue;
      }
      if (ch == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        if (end < 0) end = sql.length();
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }
      if (ch == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
        int end = blockCommentEnd(sql, i);
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }
      if (ch == '$' && (i == 0 || !isIdentifierPart(sql.charAt(i - 1)))) {
        int end = dollarQuoteEnd(sql, i);
        if (end > i) {
          out.append(sql, i, end);
          i = end - 1;
          continue;
        }
      }
      if (ch == '?') {
        out.append("??");
        continue;
      }
      if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
        int index = Integer.parseInt(sql.substring(i + 1, end));
        if (index < 1 || index > params.size()) {
          throw new IllegalArgumentException("Placeholder $" + index + " has no parameter (parameters=" + params.size() + ")");
        }
        ordered.add(params.get(index - 1));
        out.append('?');
        i = end - 1;
        continue;
      }
      out.append(ch);
    }

    return new JdbcStatement(out.toString(), ordered);
  }

  /** End (exclusive) of the block comment starting at {@code from}; Postgres comments nest. */
  private static int blockCommentEnd(String sql, int from) {
    int depth = 0;
    int i = from;
    while (i < sql.length()) {
      if (sql.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (sql.startsWith("*/", i)) {
        depth--;
        i += 2;
        if (depth == 0) return i;
      } else {
        i++;
      }
    }
    return sql.length();
  }

  /**
   * End (exclusive) of the dollar-quoted string starting at {@code from}, or {@code from} when
   * the text there is not an opening {@code $tag$} (for instance a {@code $n} placeholder).
   */
  private static int dollarQuoteEnd(String sql, int from) {
    int i = from + 1;
    if (i < sql.length() && Character.isDigit(sql.charAt(i))) return from;
    while (i < sql.length() && isIdentifierPart(sql.charAt(i)) && sql.charAt(i) != '$') i++;
    if (i >= sql.length() || sql.charAt(i) != '$') return from;
    String tag = sql.substring(from, i + 1);
    int close = sql.indexOf(tag, i + 1);
    return (close < 0) ? sql.length() : close + tag.length();
  }

  private static boolean isIdentifierPart(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
  }
}
