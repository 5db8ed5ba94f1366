package com.onkiup.linker.inline.resolver;

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
 * Resolves star and underscore delimiter runs using the CommonMark flanking rules.
 * <p>
 * The direction of a run is decided once, on its first delimiter; the remaining delimiters of the run are then
 * emitted one per invocation in that same direction, so that the grammar can nest emphasis one delimiter at a time.
 */
public class EmphasisRunResolver implements InlineResolver {

  private static final Logger logger = LoggerFactory.getLogger(EmphasisRunResolver.class);

  private final char delimiter;
  private final TokenKind openKind, closeKind;

  public EmphasisRunResolver(char delimiter, TokenKind openKind, TokenKind closeKind) {
    this.delimiter = delimiter;
    this.openKind = openKind;
    this.closeKind = closeKind;
  }

  public static EmphasisRunResolver star() {
    return new EmphasisRunResolver('*', TokenKind.EMPHASIS_OPEN_STAR, TokenKind.EMPHASIS_CLOSE_STAR);
  }

  public static EmphasisRunResolver underscore() {
    return new EmphasisRunResolver('_', TokenKind.EMPHASIS_OPEN_UNDERSCORE, TokenKind.EMPHASIS_CLOSE_UNDERSCORE);
  }

  @Override
  public ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state) {
    cursor.advance();
    cursor.markEnd();

    int remaining = state.emphasisRemaining();
    if (remaining > 0) {
      TokenKind continued = state.emphasisOpening() ? openKind : closeKind;
      if (valid.isValid(continued)) {
        state.emphasisRemaining(remaining - 1);
        return ScanStatus.match(continued, cursor);
      }
      logger.debug("{} is not valid for the rest of '{}' run; classifying again", continued, delimiter);
    }

    if (!valid.isAnyValid(openKind, closeKind)) {
      return ScanStatus.declined();
    }

    int count = 1;
    while (cursor.lookahead() == delimiter) {
      count++;
      cursor.advance();
    }

    int next = cursor.lookahead();
    boolean nextWhitespace = InlineResolver.isWhitespace(next);
    boolean nextPunctuation = InlineResolver.isPunctuation(next);
    boolean lastWhitespace = valid.lastTokenWhitespace();
    boolean lastPunctuation = valid.lastTokenPunctuation();

    // closing wins when both are possible
    if (valid.isValid(closeKind) && !lastWhitespace &&
        (!lastPunctuation || nextPunctuation || nextWhitespace)) {
      return decide(state, false, count, closeKind, cursor);
    }
    if (valid.isValid(openKind) && !nextWhitespace &&
        (!nextPunctuation || lastPunctuation || lastWhitespace)) {
      return decide(state, true, count, openKind, cursor);
    }
    return ScanStatus.declined();
  }

  private ScanResult decide(ScannerState state, boolean opening, int count, TokenKind kind, InlineCursor cursor) {
    state.emphasisOpening(opening);
    state.emphasisRemaining(Math.min(count - 1, ScannerState.MAX_VALUE));
    logger.debug("'{}' run of {} resolves as {}", delimiter, count, opening ? "opening" : "closing");
    return ScanStatus.match(kind, cursor);
  }

  @Override
  public String toString() {
    return "EmphasisRunResolver[" + delimiter + "]";
  }
}
