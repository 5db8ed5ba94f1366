package com.onkiup.linker.inline.resolver;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.InlineResolver;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.ScanStatus;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

/**
 * Recognizes citation markers: {@code @key} and {@code -@key}, optionally followed by an opening brace
 */
public class CitationRecognizer implements InlineResolver {

  private final boolean suppressAuthor;
  private final TokenKind bracketedKind, plainKind;

  private CitationRecognizer(boolean suppressAuthor, TokenKind bracketedKind, TokenKind plainKind) {
    this.suppressAuthor = suppressAuthor;
    this.bracketedKind = bracketedKind;
    this.plainKind = plainKind;
  }

  public static CitationRecognizer authorInText() {
    return new CitationRecognizer(false, TokenKind.CITATION_AUTHOR_BRACKETED, TokenKind.CITATION_AUTHOR);
  }

  public static CitationRecognizer suppressAuthor() {
    return new CitationRecognizer(true, TokenKind.CITATION_SUPPRESS_AUTHOR_BRACKETED, TokenKind.CITATION_SUPPRESS_AUTHOR);
  }

  @Override
  public ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state) {
    if (suppressAuthor) {
      if (cursor.lookahead() != '-') {
        return ScanStatus.declined();
      }
      cursor.advance();
    }
    if (cursor.lookahead() != '@') {
      return ScanStatus.declined();
    }
    cursor.advance();

    if (cursor.lookahead() == '{' && valid.isValid(bracketedKind)) {
      cursor.advance();
      cursor.markEnd();
      return ScanStatus.match(bracketedKind, cursor);
    }
    if (valid.isValid(plainKind)) {
      cursor.markEnd();
      return ScanStatus.match(plainKind, cursor);
    }
    return ScanStatus.declined();
  }

  @Override
  public String toString() {
    return suppressAuthor ? "CitationRecognizer[-@]" : "CitationRecognizer[@]";
  }
}
