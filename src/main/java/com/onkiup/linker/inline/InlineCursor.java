package com.onkiup.linker.inline;

import java.io.IOException;
import java.io.Reader;

import com.google.common.io.CharStreams;

/**
 * Cursor over tokenizer input.
 * <p>
 * A token always starts at {@link #start()}. Resolvers {@link #advance()} over characters they want to inspect and
 * {@link #markEnd()} the commit point; characters advanced over past the last commit point are not part of the token.
 * {@link #peek(int)} looks further ahead without moving the cursor at all.
 */
public class InlineCursor {

  public static final int EOF = -1;

  private final String name;
  private final CharSequence source;
  private SourceLocation startLocation;
  private int start;
  private int position;
  private int markedEnd = -1;

  public InlineCursor(CharSequence source) {
    this(null, source);
  }

  public InlineCursor(String name, CharSequence source) {
    if (source == null) {
      throw new IllegalArgumentException("source cannot be null");
    }
    this.name = name;
    this.source = source;
    this.startLocation = SourceLocation.start(name);
  }

  public static InlineCursor read(String name, Reader reader) throws IOException {
    return new InlineCursor(name, CharStreams.toString(reader));
  }

  public String name() {
    return name;
  }

  public CharSequence source() {
    return source;
  }

  /**
   * @return character at the cursor or {@link #EOF}
   */
  public int lookahead() {
    return position < source.length() ? source.charAt(position) : EOF;
  }

  /**
   * Looks at a character after the cursor without moving it
   * @param offset distance from the cursor; 0 is the same as {@link #lookahead()}
   * @return character at the given offset or {@link #EOF}
   */
  public int peek(int offset) {
    int index = position + offset;
    return index >= 0 && index < source.length() ? source.charAt(index) : EOF;
  }

  public boolean eof() {
    return position >= source.length();
  }

  /**
   * Moves the cursor one character forward; does nothing at the end of input
   */
  public void advance() {
    if (position < source.length()) {
      position++;
    }
  }

  /**
   * Marks current cursor position as the end of the token being recognized
   */
  public void markEnd() {
    markedEnd = position;
  }

  public int start() {
    return start;
  }

  public int position() {
    return position;
  }

  /**
   * @return position right after the last character of the pending token
   */
  public int tokenEnd() {
    return markedEnd < 0 ? position : markedEnd;
  }

  public int tokenLength() {
    return tokenEnd() - start;
  }

  public CharSequence token() {
    return source.subSequence(start, tokenEnd());
  }

  /**
   * @return text preceding the cursor, at most {@code limit} characters
   */
  public CharSequence before(int limit) {
    return source.subSequence(Math.max(0, position - limit), position);
  }

  /**
   * Accepts the pending token: the next token will start where this one ended
   * @return the accepted characters
   */
  public CharSequence accept() {
    CharSequence accepted = token();
    startLocation = startLocation.advance(accepted);
    start = tokenEnd();
    position = start;
    markedEnd = -1;
    return accepted;
  }

  /**
   * Drops any lookahead and returns to the start of the pending token
   */
  public void rewind() {
    position = start;
    markedEnd = -1;
  }

  /**
   * Accepts {@code count} characters as a token, regardless of what the tokenizer did
   * @return the skipped characters
   */
  public CharSequence skip(int count) {
    rewind();
    for (int i = 0; i < count; i++) {
      advance();
    }
    markEnd();
    return accept();
  }

  /**
   * Moves token start to an arbitrary input position, dropping any pending token
   * @param offset new token start
   */
  public void seek(int offset) {
    if (offset < 0 || offset > source.length()) {
      throw new TokenizerError("Cannot seek to position " + offset + " of " + source.length() + "-char input", location());
    }
    startLocation = SourceLocation.endOf(name, source.subSequence(0, offset));
    start = offset;
    position = offset;
    markedEnd = -1;
  }

  /**
   * @return location of the pending token start
   */
  public SourceLocation location() {
    return startLocation;
  }

  @Override
  public String toString() {
    return "InlineCursor[" + startLocation + ", start=" + start + ", position=" + position + ", end=" + tokenEnd() + "]";
  }
}
