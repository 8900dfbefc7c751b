package dscript;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Parses script text into a {@link Script}.
 *
 * <p>Each non-blank line is a command, a marker or a comment, indented by {@link #INDENT_WIDTH}
 * spaces per level. A line indented one level deeper than its predecessor opens a {@link Block}
 * beneath it; dedenting closes blocks back to the matching level. Lines may end with
 * {@code "\n"} or {@code "\r\n"}; the first line terminator decides which one the parsed
 * script formats with.
 */
public class ScriptParser {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    /** Zero-based. */
    public int lineNumber() {
      return lineNumber;
    }

    /** Zero-based. */
    public int column() {
      return column;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(p -> p.file())
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public static final int INDENT_WIDTH = 4;
  public static final String INDENT = "    ";

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private final String file;
  private final ImmutableList<String> lines;
  private final String lineSeparator;

  // The innermost open container is at the head; the script itself is at the tail.
  private final Deque<List<Element>> open = new ArrayDeque<>();
  private final ImmutableList.Builder<Pos> positions = ImmutableList.builder();

  public ScriptParser(String file, String content) {
    this.file = file;

    List<String> split = Splitter.on('\n').splitToList(content);
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    String lineSeparator = null;
    for (int i = 0; i < split.size(); i++) {
      String line = split.get(i);
      // The last piece has no terminator.
      if (i == split.size() - 1) {
        lines.add(line);
        continue;
      }
      boolean crlf = line.endsWith("\r");
      if (lineSeparator == null) {
        lineSeparator = crlf ? "\r\n" : "\n";
      }
      lines.add(crlf ? line.substring(0, line.length() - 1) : line);
    }
    this.lines = lines.build();
    this.lineSeparator = lineSeparator == null ? "\n" : lineSeparator;
  }

  public static Script parse(String file, String content) throws ParseException {
    return new ScriptParser(file, content).parse();
  }

  public static Script parse(String content) throws ParseException {
    return parse("<input>", content);
  }

  /** Parses a single unindented command or marker. */
  public static Line parseLine(String text) throws ParseException {
    if (text.isEmpty() || WHITESPACE.matches(text.charAt(0))) {
      throw new ParseException(new Pos("<input>", 0, 0), "expected an unindented line");
    }
    Element element = new ScriptParser("<input>", text).parseContent(text, 0, 0);
    if (!element.isLine()) {
      throw new ParseException(new Pos("<input>", 0, 0), "expected a command or a marker");
    }
    return element.line();
  }

  public static Command parseCommand(String text) throws ParseException {
    Line line = parseLine(text);
    if (!line.isCommand()) {
      throw new ParseException(new Pos("<input>", 0, 0), "expected a command");
    }
    return line.command();
  }

  public Script parse() throws ParseException {
    open.push(new ArrayList<>());

    int lastContentLine = -1;
    for (int lineNumber = 0; lineNumber < lines.size(); lineNumber++) {
      String line = lines.get(lineNumber);
      if (WHITESPACE.matchesAllOf(line)) {
        continue;
      }
      lastContentLine = lineNumber;

      int indent = readIndent(line, lineNumber);
      enterLevel(indent / INDENT_WIDTH, lineNumber, indent);

      Element element = parseContent(line.substring(indent), lineNumber, indent);
      open.peek().add(element);
      positions.add(new Pos(file, lineNumber, indent));
    }

    while (open.size() > 1) {
      closeBlock();
    }

    boolean endsWithNewline = lastContentLine >= 0 && lastContentLine < lines.size() - 1;
    return new Script(file, open.pop(), endsWithNewline, lineSeparator, positions.build());
  }

  private int readIndent(String line, int lineNumber) throws ParseException {
    int indent = 0;
    while (indent < line.length() && line.charAt(indent) == ' ') {
      indent++;
    }
    if (WHITESPACE.matches(line.charAt(indent))) {
      throw error(lineNumber, indent, "indentation must use spaces only");
    }
    if (indent % INDENT_WIDTH != 0) {
      throw error(
          lineNumber,
          indent,
          String.format("indentation must be a multiple of %d spaces", INDENT_WIDTH));
    }
    return indent;
  }

  private void enterLevel(int level, int lineNumber, int indent) throws ParseException {
    int depth = open.size() - 1;
    if (level > depth + 1) {
      throw error(lineNumber, indent, "unexpected indentation: blocks open one level at a time");
    }

    if (level == depth + 1) {
      List<Element> container = open.peek();
      if (container.isEmpty() || container.get(container.size() - 1).isBlock()) {
        throw error(lineNumber, indent, "an indented block must follow a line or a comment");
      }
      open.push(new ArrayList<>());
      return;
    }

    while (open.size() - 1 > level) {
      closeBlock();
    }
  }

  private void closeBlock() {
    List<Element> elements = open.pop();
    open.peek().add(Element.of(Block.of(elements)));
  }

  private Element parseContent(String text, int lineNumber, int column) throws ParseException {
    if (text.startsWith(Comment.PREFIX)) {
      return Element.of(Comment.create(text.substring(Comment.PREFIX.length())));
    } else if (text.charAt(0) == Marker.DELIMITER) {
      return Element.of(parseMarker(text, lineNumber, column));
    } else {
      return Element.of(parseCommand(text, lineNumber, column));
    }
  }

  private Marker parseMarker(String text, int lineNumber, int column) throws ParseException {
    int close = text.indexOf(Marker.DELIMITER, 1);
    if (close < 0) {
      throw error(lineNumber, column, "unterminated marker: expected a closing '%'");
    } else if (close != text.length() - 1) {
      throw error(lineNumber, column + close + 1, "unexpected text after marker");
    }

    String name = text.substring(1, close);
    if (!Marker.isValidName(name)) {
      throw error(
          lineNumber,
          column + 1,
          String.format(
              "illegal marker name '%s': markers may only contain uppercase letters and hyphens",
              name));
    }
    return Marker.create(name);
  }

  private Command parseCommand(String text, int lineNumber, int column) throws ParseException {
    int start = text.indexOf(Command.DELIMITER);
    if (start < 0) {
      throw error(lineNumber, column, "expected a command, a marker or a comment");
    }
    int close = text.indexOf(Command.DELIMITER, start + 1);
    if (close < 0) {
      throw error(lineNumber, column + start, "unterminated command name: expected a closing '|'");
    }
    int extra = text.indexOf(Command.DELIMITER, close + 1);
    if (extra >= 0) {
      throw error(
          lineNumber, column + extra, "unexpected '|': only a command name is delimited by pipes");
    }

    String name = text.substring(start + 1, close);
    if (!Marker.isValidName(name)) {
      throw error(
          lineNumber,
          column + start + 1,
          String.format(
              "illegal command name '%s': commands may only contain uppercase letters and hyphens",
              name));
    }

    Optional<String> prefix = Optional.empty();
    if (start > 0) {
      if (text.charAt(start - 1) != ' ') {
        throw error(lineNumber, column + start, "expected a space between the prefix and '|'");
      }
      String p = text.substring(0, start - 1);
      if (p.isEmpty() || WHITESPACE.matches(p.charAt(p.length() - 1))) {
        throw error(lineNumber, column, "expected a single space between the prefix and '|'");
      }
      prefix = Optional.of(p);
    }

    Optional<String> suffix = Optional.empty();
    if (close < text.length() - 1) {
      if (text.charAt(close + 1) != ' ') {
        throw error(lineNumber, column + close + 1, "expected a space between '|' and the suffix");
      }
      String s = text.substring(close + 2);
      if (s.isEmpty() || WHITESPACE.matches(s.charAt(0))) {
        throw error(
            lineNumber, column + close + 1, "expected a single space between '|' and the suffix");
      }
      suffix = Optional.of(s);
    }

    return Command.create(name, prefix, suffix);
  }

  private ParseException error(int lineNumber, int column, String msg) {
    return new ParseException(new Pos(file, lineNumber, column), msg);
  }
}
