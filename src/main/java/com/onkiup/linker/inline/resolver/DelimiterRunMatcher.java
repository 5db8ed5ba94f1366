package com.onkiup.linker.inline.resolver;

import java.util.function.ObjIntConsumer;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.InlineResolver;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.ScanStatus;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

/**
 * Matches symmetric, length-sensitive delimiter runs: a span opened with N delimiters is only closed by another
 * run of exactly N delimiters.
 */
public class DelimiterRunMatcher implements InlineResolver {

  private static final Logger logger = LoggerFactory.getLogger(DelimiterRunMatcher.class);

  private final char delimiter;
  private final TokenKind openKind, closeKind;
  private final ToIntFunction<ScannerState> openLength;
  private final ObjIntConsumer<ScannerState> storeLength;

  public DelimiterRunMatcher(char delimiter, TokenKind openKind, TokenKind closeKind,
      ToIntFunction<ScannerState> openLength, ObjIntConsumer<ScannerState> storeLength) {
    this.delimiter = delimiter;
    this.openKind = openKind;
    this.closeKind = closeKind;
    this.openLength = openLength;
    this.storeLength = storeLength;
  }

  public static DelimiterRunMatcher codeSpan() {
    return new DelimiterRunMatcher('`', TokenKind.CODE_SPAN_OPEN, TokenKind.CODE_SPAN_CLOSE,
        ScannerState::codeSpanRunLength, ScannerState::codeSpanRunLength);
  }

  public static DelimiterRunMatcher mathSpan() {
    return new DelimiterRunMatcher('$', TokenKind.MATH_SPAN_OPEN, TokenKind.MATH_SPAN_CLOSE,
        ScannerState::mathSpanRunLength, ScannerState::mathSpanRunLength);
  }

  @Override
  public ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state) {
    int level = 0;
    while (cursor.lookahead() == delimiter) {
      cursor.advance();
      level++;
    }
    cursor.markEnd();

    if (level == openLength.applyAsInt(state) && valid.isValid(closeKind)) {
      storeLength.accept(state, 0);
      return ScanStatus.match(closeKind, cursor);
    }

    if (valid.isValid(openKind)) {
      if (level <= ScannerState.MAX_VALUE && hasClosingRun(cursor, level)) {
        storeLength.accept(state, level);
        return ScanStatus.match(openKind, cursor);
      }
      logger.debug("No closing run of {} '{}' found", level, delimiter);
      if (valid.isValid(TokenKind.UNCLOSED_SPAN)) {
        return ScanStatus.match(TokenKind.UNCLOSED_SPAN, cursor);
      }
    }
    return ScanStatus.declined();
  }

  /**
   * Looks through the rest of the input, without consuming it, for a run of exactly {@code level} delimiters
   */
  // TODO: remember the positions of runs already scanned so repeated unmatched openers stop rescanning the input
  protected boolean hasClosingRun(InlineCursor cursor, int level) {
    int run = 0;
    for (int offset = 0; ; offset++) {
      int character = cursor.peek(offset);
      if (character == delimiter) {
        run++;
      } else if (run == level) {
        return true;
      } else if (character == InlineCursor.EOF) {
        return false;
      } else {
        run = 0;
      }
    }
  }

  @Override
  public String toString() {
    return "DelimiterRunMatcher[" + delimiter + "]";
  }
}
