package io.github.wphillipmoore.edgegrid.retry;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style path pattern, matched against the whole request path.
 *
 * <pre>
 * pattern:
 *     { term }
 * term:
 *     '*'         matches any sequence of non-/ characters
 *     '?'         matches any single non-/ character
 *     '[' [ '^' ] { character-range } ']'
 *                 character class (must be non-empty)
 *     c           matches character c (c != '*', '?', '\\', '[')
 *     '\\' c      matches character c
 *
 * character-range:
 *     c           matches character c (c != '\\', '-', ']')
 *     '\\' c      matches character c
 *     lo '-' hi   matches character c for lo &lt;= c &lt;= hi
 * </pre>
 */
public final class PathPattern {

  static final String SYNTAX_ERROR = "syntax error in pattern";

  private final String source;
  private final Pattern regex;

  private PathPattern(String source, Pattern regex) {
    this.source = source;
    this.regex = regex;
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern the shell pattern
   * @return the compiled pattern
   * @throws IllegalArgumentException with message {@value #SYNTAX_ERROR} if malformed
   */
  public static PathPattern compile(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return new PathPattern(pattern, Pattern.compile(translate(pattern)));
  }

  /** Returns {@code true} if {@code path} matches this pattern in full. */
  public boolean matches(String path) {
    return regex.matcher(path).matches();
  }

  /** Returns the source pattern. */
  public String source() {
    return source;
  }

  @Override
  public String toString() {
    return source;
  }

  private static String translate(String pattern) {
    StringBuilder out = new StringBuilder();
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      switch (c) {
        case '*':
          out.append("[^/]*");
          i++;
          break;
        case '?':
          out.append("[^/]");
          i++;
          break;
        case '\\':
          if (i + 1 >= pattern.length()) {
            throw new IllegalArgumentException(SYNTAX_ERROR);
          }
          out.append(Pattern.quote(String.valueOf(pattern.charAt(i + 1))));
          i += 2;
          break;
        case '[':
          i = translateClass(pattern, i + 1, out);
          break;
        default:
          out.append(Pattern.quote(String.valueOf(c)));
          i++;
          break;
      }
    }
    return out.toString();
  }

  /** Translates a character class starting after '['; returns the index after the closing ']'. */
  private static int translateClass(String pattern, int start, StringBuilder out) {
    int i = start;
    boolean negated = i < pattern.length() && pattern.charAt(i) == '^';
    if (negated) {
      i++;
    }
    StringBuilder ranges = new StringBuilder();
    int count = 0;
    while (true) {
      if (i >= pattern.length()) {
        throw new IllegalArgumentException(SYNTAX_ERROR);
      }
      if (pattern.charAt(i) == ']' && count > 0) {
        i++;
        break;
      }
      int[] lo = rangeChar(pattern, i);
      i = lo[1];
      int hi = lo[0];
      if (pattern.charAt(i) == '-') {
        int[] upper = rangeChar(pattern, i + 1);
        hi = upper[0];
        i = upper[1];
      }
      if (lo[0] > hi) {
        throw new IllegalArgumentException(SYNTAX_ERROR);
      }
      ranges.append(escapeClassChar(lo[0])).append('-').append(escapeClassChar(hi));
      count++;
    }
    out.append(negated ? "[^" : "[").append(ranges).append(']');
    return i;
  }

  /**
   * Reads one range character at {@code i}. Returns {char, next index}; the next index always has
   * a character after it.
   */
  private static int[] rangeChar(String pattern, int i) {
    if (i >= pattern.length() || pattern.charAt(i) == '-' || pattern.charAt(i) == ']') {
      throw new IllegalArgumentException(SYNTAX_ERROR);
    }
    int at = i;
    if (pattern.charAt(at) == '\\') {
      at++;
      if (at >= pattern.length()) {
        throw new IllegalArgumentException(SYNTAX_ERROR);
      }
    }
    int next = at + 1;
    if (next >= pattern.length()) {
      throw new IllegalArgumentException(SYNTAX_ERROR);
    }
    return new int[] {pattern.charAt(at), next};
  }

  private static String escapeClassChar(int c) {
    return String.format("\\x{%x}", c);
  }
}
