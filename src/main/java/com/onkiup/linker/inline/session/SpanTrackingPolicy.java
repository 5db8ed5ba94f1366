package com.onkiup.linker.inline.session;

import java.util.EnumSet;

import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

/**
 * Approximates the inline grammar: closers are only offered while a matching span is open, and nothing but the
 * closer is offered inside code and math spans.
 */
public class SpanTrackingPolicy implements CandidatePolicy {

  private int openStars, openUnderscores;

  @Override
  public ValidTokens candidates(ScannerState state, boolean lastWhitespace, boolean lastPunctuation) {
    EnumSet<TokenKind> result = EnumSet.noneOf(TokenKind.class);
    if (lastWhitespace) {
      result.add(TokenKind.LAST_TOKEN_WHITESPACE);
    }
    if (lastPunctuation) {
      result.add(TokenKind.LAST_TOKEN_PUNCTUATION);
    }

    if (state.codeSpanRunLength() > 0) {
      result.add(TokenKind.CODE_SPAN_CLOSE);
      return ValidTokens.of(result);
    }
    if (state.mathSpanRunLength() > 0) {
      result.add(TokenKind.MATH_SPAN_CLOSE);
      return ValidTokens.of(result);
    }

    result.add(TokenKind.CODE_SPAN_OPEN);
    result.add(TokenKind.MATH_SPAN_OPEN);
    result.add(TokenKind.EMPHASIS_OPEN_STAR);
    result.add(TokenKind.EMPHASIS_OPEN_UNDERSCORE);
    if (openStars > 0) {
      result.add(TokenKind.EMPHASIS_CLOSE_STAR);
    }
    if (openUnderscores > 0) {
      result.add(TokenKind.EMPHASIS_CLOSE_UNDERSCORE);
    }

    toggle(result, state.strikeoutOpen(), TokenKind.STRIKEOUT_OPEN, TokenKind.STRIKEOUT_CLOSE);
    toggle(result, state.superscriptOpen(), TokenKind.SUPERSCRIPT_OPEN, TokenKind.SUPERSCRIPT_CLOSE);
    toggle(result, state.subscriptOpen(), TokenKind.SUBSCRIPT_OPEN, TokenKind.SUBSCRIPT_CLOSE);
    toggle(result, state.singleQuoteOpen(), TokenKind.SINGLE_QUOTE_OPEN, TokenKind.SINGLE_QUOTE_CLOSE);
    toggle(result, state.doubleQuoteOpen(), TokenKind.DOUBLE_QUOTE_OPEN, TokenKind.DOUBLE_QUOTE_CLOSE);

    result.add(TokenKind.CITATION_AUTHOR);
    result.add(TokenKind.CITATION_AUTHOR_BRACKETED);
    result.add(TokenKind.CITATION_SUPPRESS_AUTHOR);
    result.add(TokenKind.CITATION_SUPPRESS_AUTHOR_BRACKETED);

    result.add(TokenKind.SHORTCODE_OPEN);
    result.add(TokenKind.SHORTCODE_OPEN_ESCAPED);
    if (state.shortcodeDepth() > 0) {
      result.add(TokenKind.SHORTCODE_CLOSE);
      result.add(TokenKind.SHORTCODE_CLOSE_ESCAPED);
    }
    return ValidTokens.of(result);
  }

  private static void toggle(EnumSet<TokenKind> result, boolean open, TokenKind openKind, TokenKind closeKind) {
    result.add(open ? closeKind : openKind);
  }

  @Override
  public void accepted(TokenKind kind) {
    switch (kind) {
      case EMPHASIS_OPEN_STAR:
        openStars++;
        break;
      case EMPHASIS_CLOSE_STAR:
        openStars = Math.max(0, openStars - 1);
        break;
      case EMPHASIS_OPEN_UNDERSCORE:
        openUnderscores++;
        break;
      case EMPHASIS_CLOSE_UNDERSCORE:
        openUnderscores = Math.max(0, openUnderscores - 1);
        break;
      default:
        break;
    }
  }

  @Override
  public void reset() {
    openStars = 0;
    openUnderscores = 0;
  }

  public int openEmphasis(TokenKind openKind) {
    return openKind == TokenKind.EMPHASIS_OPEN_STAR ? openStars : openUnderscores;
  }
}
