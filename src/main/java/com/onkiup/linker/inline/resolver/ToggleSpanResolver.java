package com.onkiup.linker.inline.resolver;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.InlineResolver;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.ScanStatus;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

/**
 * Open/close logic shared by strikeout, superscript, subscript and smart quotes
 */
public class ToggleSpanResolver implements InlineResolver {

  private final ToggleSpan span;

  public ToggleSpanResolver(ToggleSpan span) {
    this.span = span;
  }

  @Override
  public ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state) {
    String marker = span.marker();
    for (int i = 0; i < marker.length(); i++) {
      if (cursor.lookahead() != marker.charAt(i)) {
        return ScanStatus.declined();
      }
      cursor.advance();
    }
    cursor.markEnd();

    if (span.isQuote() && !state.lexicalMode().quotesAllowed()) {
      return ScanStatus.declined();
    }
    // ^[ starts an inline footnote
    if (span == ToggleSpan.SUPERSCRIPT && cursor.lookahead() == '[') {
      return ScanStatus.declined();
    }

    TokenKind close = span.closeKind();
    if (valid.isValid(close)) {
      span.setOpen(state, false);
      return ScanStatus.match(close, cursor);
    }

    if (valid.isValid(span.openKind()) && !span.isOpen(state) && canOpen(cursor)) {
      span.setOpen(state, true);
      return ScanStatus.match(span.openKind(), cursor);
    }
    return ScanStatus.declined();
  }

  private boolean canOpen(InlineCursor cursor) {
    return span != ToggleSpan.SINGLE_QUOTE || !InlineResolver.isWhitespace(cursor.lookahead());
  }

  @Override
  public String toString() {
    return "ToggleSpanResolver[" + span + "]";
  }
}
