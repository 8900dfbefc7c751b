package dscript;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A parsed script: the ordered top-level elements, with blocks nested beneath the lines they
 * belong to.
 *
 * <p>{@link #format()} reproduces the parsed text exactly, except for whitespace-only lines,
 * which the parser drops. Lines are terminated with the separator the text was parsed with,
 * {@code "\n"} or {@code "\r\n"}.
 */
public final class Script {
  private final String file;
  private final ImmutableList<Element> elements;
  private final boolean endsWithNewline;
  private final String lineSeparator;
  // Source positions of every line and comment, in document order.
  private final ImmutableList<ScriptParser.Pos> positions;

  Script(
      String file,
      List<Element> elements,
      boolean endsWithNewline,
      String lineSeparator,
      List<ScriptParser.Pos> positions) {
    this.file = file;
    this.elements = ImmutableList.copyOf(elements);
    this.endsWithNewline = endsWithNewline;
    this.lineSeparator = lineSeparator;
    this.positions = ImmutableList.copyOf(positions);
  }

  public static Script of(Iterable<Element> elements) {
    return new Script(
        ScriptParser.Pos.internal().file(),
        ImmutableList.copyOf(elements),
        true,
        "\n",
        ImmutableList.of());
  }

  public static Script of(Element... elements) {
    return of(Arrays.asList(elements));
  }

  public String file() {
    return file;
  }

  public ImmutableList<Element> elements() {
    return elements;
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public boolean endsWithNewline() {
    return endsWithNewline;
  }

  public String lineSeparator() {
    return lineSeparator;
  }

  /**
   * Returns the position of the {@code ordinal}-th line or comment in document order. Scripts
   * that were not parsed from text report the ordinal as the line number.
   */
  public ScriptParser.Pos positionOf(int ordinal) {
    if (ordinal < positions.size()) {
      return positions.get(ordinal);
    }
    return new ScriptParser.Pos(file, ordinal, 0);
  }

  public String format() {
    StringBuilder sb = new StringBuilder();
    formatElements(elements, 0, lineSeparator, sb);
    if (!endsWithNewline && sb.length() > 0) {
      sb.setLength(sb.length() - lineSeparator.length());
    }
    return sb.toString();
  }

  static void formatElements(
      List<Element> elements, int level, String lineSeparator, StringBuilder sb) {
    for (Element element : elements) {
      switch (element.kind()) {
        case BLOCK:
          formatElements(element.block().elements(), level + 1, lineSeparator, sb);
          break;
        case LINE:
          indent(level, sb).append(element.line().format()).append(lineSeparator);
          break;
        case COMMENT:
          indent(level, sb).append(element.comment()).append(lineSeparator);
          break;
      }
    }
  }

  private static StringBuilder indent(int level, StringBuilder sb) {
    for (int i = 0; i < level; i++) {
      sb.append(ScriptParser.INDENT);
    }
    return sb;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Script)) return false;
    Script that = (Script) o;
    return elements.equals(that.elements)
        && endsWithNewline == that.endsWithNewline
        && lineSeparator.equals(that.lineSeparator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elements, endsWithNewline, lineSeparator);
  }

  @Override
  public String toString() {
    return format();
  }
}
