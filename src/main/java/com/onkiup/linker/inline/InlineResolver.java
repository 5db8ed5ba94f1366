package com.onkiup.linker.inline;

/**
 * Recognizes one family of inline delimiters
 */
@FunctionalInterface
public interface InlineResolver {

  /**
   * Attempts to recognize a token at the cursor.
   * Implementations only mutate the state when they commit to a token.
   * @param cursor input cursor positioned at the token start
   * @param valid token kinds accepted by the embedding parser here
   * @param state tokenizer state
   * @return recognized token or {@link ScanStatus#declined()}
   */
  ScanResult attempt(InlineCursor cursor, ValidTokens valid, ScannerState state);

  /**
   * ASCII punctuation, as used by the flanking rules
   */
  static boolean isPunctuation(int character) {
    return (character >= '!' && character <= '/') || (character >= ':' && character <= '@') ||
        (character >= '[' && character <= '`') || (character >= '{' && character <= '~');
  }

  static boolean isLineEnd(int character) {
    return character == '\n' || character == '\r' || character == InlineCursor.EOF;
  }

  static boolean isWhitespace(int character) {
    return character == ' ' || character == '\t' || isLineEnd(character);
  }
}
