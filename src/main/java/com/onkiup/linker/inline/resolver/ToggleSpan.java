package com.onkiup.linker.inline.resolver;

import java.util.function.BiConsumer;
import java.util.function.Predicate;

import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;

/**
 * Inline spans that are either open or closed, with no nesting and no run-length sensitivity
 */
public enum ToggleSpan {
  STRIKEOUT("~~", TokenKind.STRIKEOUT_OPEN, TokenKind.STRIKEOUT_CLOSE,
      ScannerState::strikeoutOpen, ScannerState::strikeoutOpen),
  SUPERSCRIPT("^", TokenKind.SUPERSCRIPT_OPEN, TokenKind.SUPERSCRIPT_CLOSE,
      ScannerState::superscriptOpen, ScannerState::superscriptOpen),
  SUBSCRIPT("~", TokenKind.SUBSCRIPT_OPEN, TokenKind.SUBSCRIPT_CLOSE,
      ScannerState::subscriptOpen, ScannerState::subscriptOpen),
  SINGLE_QUOTE("'", TokenKind.SINGLE_QUOTE_OPEN, TokenKind.SINGLE_QUOTE_CLOSE,
      ScannerState::singleQuoteOpen, ScannerState::singleQuoteOpen),
  DOUBLE_QUOTE("\"", TokenKind.DOUBLE_QUOTE_OPEN, TokenKind.DOUBLE_QUOTE_CLOSE,
      ScannerState::doubleQuoteOpen, ScannerState::doubleQuoteOpen);

  private final String marker;
  private final TokenKind openKind, closeKind;
  private final Predicate<ScannerState> open;
  private final BiConsumer<ScannerState, Boolean> toggle;

  ToggleSpan(String marker, TokenKind openKind, TokenKind closeKind,
      Predicate<ScannerState> open, BiConsumer<ScannerState, Boolean> toggle) {
    this.marker = marker;
    this.openKind = openKind;
    this.closeKind = closeKind;
    this.open = open;
    this.toggle = toggle;
  }

  public String marker() {
    return marker;
  }

  public TokenKind openKind() {
    return openKind;
  }

  public TokenKind closeKind() {
    return closeKind;
  }

  public boolean isOpen(ScannerState state) {
    return open.test(state);
  }

  public void setOpen(ScannerState state, boolean isOpen) {
    toggle.accept(state, isOpen);
  }

  public boolean isQuote() {
    return this == SINGLE_QUOTE || this == DOUBLE_QUOTE;
  }
}
