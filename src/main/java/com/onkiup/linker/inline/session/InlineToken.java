package com.onkiup.linker.inline.session;

import java.util.Objects;

import com.onkiup.linker.inline.SourceLocation;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.util.CursorLayout;

/**
 * A piece of scanned input: either a recognized delimiter or a run of literal text
 */
public final class InlineToken {

  private final TokenKind kind;
  private final String text;
  private final SourceLocation location;

  public InlineToken(TokenKind kind, CharSequence text, SourceLocation location) {
    this.kind = kind;
    this.text = text.toString();
    this.location = location;
  }

  public static InlineToken text(CharSequence text, SourceLocation location) {
    return new InlineToken(null, text, location);
  }

  /**
   * @return recognized kind or null for literal text
   */
  public TokenKind kind() {
    return kind;
  }

  public boolean isText() {
    return kind == null;
  }

  public String text() {
    return text;
  }

  public SourceLocation location() {
    return location;
  }

  public int position() {
    return location.position();
  }

  public int length() {
    return text.length();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof InlineToken)) {
      return false;
    }
    InlineToken that = (InlineToken) other;
    return kind == that.kind && text.equals(that.text) && Objects.equals(location, that.location);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text, location);
  }

  @Override
  public String toString() {
    return (isText() ? "TEXT" : kind.name()) + "('" + CursorLayout.sanitize(text) + "' @" + location.position() + ")";
  }
}
