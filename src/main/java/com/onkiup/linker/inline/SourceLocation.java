package com.onkiup.linker.inline;

import java.util.Objects;

/**
 * Position in tokenizer input, with zero-based line and column
 */
public class SourceLocation {

  private final int line, column, position;
  private final String name;

  public static SourceLocation start(String name) {
    return new SourceLocation(name, 0, 0, 0);
  }

  public static SourceLocation endOf(String name, CharSequence text) {
    return start(name).advance(text);
  }

  public SourceLocation(String name, int position, int line, int column) {
    if (position < 0) {
      throw new IllegalArgumentException("Position cannot be negative");
    }

    if (line < 0) {
      throw new IllegalArgumentException("Line cannot be negative");
    }

    if (column < 0) {
      throw new IllegalArgumentException("Column cannot be negative");
    }

    this.name = name;
    this.position = position;
    this.line = line;
    this.column = column;
  }

  public String name() {
    return name;
  }

  public int position() {
    return position;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /**
   * @param text characters that follow this location
   * @return location right after the given characters
   */
  public SourceLocation advance(CharSequence text) {
    int line = this.line;
    int column = this.column;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        line++;
        column = 0;
      } else {
        column++;
      }
    }
    return new SourceLocation(name, position + text.length(), line, column);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SourceLocation)) {
      return false;
    }
    SourceLocation that = (SourceLocation) other;
    return position == that.position && line == that.line && column == that.column && Objects.equals(name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, position, line, column);
  }

  @Override
  public String toString() {
    return new StringBuilder()
      .append(name == null ? "<input>" : name)
      .append(" - ")
      .append(line)
      .append(':')
      .append(column)
      .toString();
  }
}
