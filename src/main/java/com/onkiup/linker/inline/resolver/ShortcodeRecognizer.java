package com.onkiup.linker.inline.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.InlineResolver;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.ScanStatus;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.ShortcodeCloseMarker;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

/**
 * Recognizes shortcode delimiters and keeps track of shortcode nesting depth.
 * Openers are <code>{{&lt;</code> and <code>{{{&lt;</code>; closers depend on the configured {@link ShortcodeCloseMarker}.
 */
public abstract class ShortcodeRecognizer implements InlineResolver {

  private static final Logger logger = LoggerFactory.getLogger(ShortcodeRecognizer.class);

  public static ShortcodeRecognizer opener() {
    return new Opener();
  }

  public static ShortcodeRecognizer closer(ShortcodeCloseMarker marker) {
    return new Closer(marker);
  }

  /**
   * Advances over the given text
   * @return false if input does not continue with that text
   */
  protected static boolean expect(InlineCursor cursor, CharSequence text) {
    for (int i = 0; i < text.length(); i++) {
      if (cursor.lookahead() != text.charAt(i)) {
        return false;
      }
      cursor.advance();
    }
    return true;
  }

  private static class Opener extends ShortcodeRecognizer {
    @Override
    public ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state) {
      // depth is stored in a single byte
      if (state.shortcodeDepth() == ScannerState.MAX_VALUE) {
        logger.debug("Shortcode nesting limit of {} reached at {}", ScannerState.MAX_VALUE, cursor.location());
        return ScanStatus.declined();
      }
      if (!expect(cursor, "{{")) {
        return ScanStatus.declined();
      }
      if (cursor.lookahead() == '<') {
        if (!valid.isValid(TokenKind.SHORTCODE_OPEN)) {
          return ScanStatus.declined();
        }
        return open(cursor, state, TokenKind.SHORTCODE_OPEN);
      }
      if (expect(cursor, "{") && cursor.lookahead() == '<' && valid.isValid(TokenKind.SHORTCODE_OPEN_ESCAPED)) {
        return open(cursor, state, TokenKind.SHORTCODE_OPEN_ESCAPED);
      }
      return ScanStatus.declined();
    }

    private ScanResult open(InlineCursor cursor, ScannerState state, TokenKind kind) {
      cursor.advance();
      cursor.markEnd();
      state.enterShortcode();
      return ScanStatus.match(kind, cursor);
    }

    @Override
    public String toString() {
      return "ShortcodeRecognizer[open]";
    }
  }

  private static class Closer extends ShortcodeRecognizer {
    private final ShortcodeCloseMarker marker;

    private Closer(ShortcodeCloseMarker marker) {
      this.marker = marker;
    }

    @Override
    public ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state) {
      if (!expect(cursor, marker.lead()) || !expect(cursor, "}}")) {
        return ScanStatus.declined();
      }
      if (cursor.lookahead() == '}' && valid.isValid(TokenKind.SHORTCODE_CLOSE_ESCAPED)) {
        cursor.advance();
        return close(cursor, state, TokenKind.SHORTCODE_CLOSE_ESCAPED);
      }
      if (valid.isValid(TokenKind.SHORTCODE_CLOSE)) {
        return close(cursor, state, TokenKind.SHORTCODE_CLOSE);
      }
      return ScanStatus.declined();
    }

    private ScanResult close(InlineCursor cursor, ScannerState state, TokenKind kind) {
      cursor.markEnd();
      state.leaveShortcode();
      return ScanStatus.match(kind, cursor);
    }

    @Override
    public String toString() {
      return "ShortcodeRecognizer[close " + marker + "]";
    }
  }
}
