package com.onkiup.linker.inline.resolver;

import static org.junit.Assert.*;

import org.junit.Test;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

public class EmphasisRunResolverTest {

  private static final ValidTokens STARS = ValidTokens.of(TokenKind.EMPHASIS_OPEN_STAR, TokenKind.EMPHASIS_CLOSE_STAR);

  private final EmphasisRunResolver subject = EmphasisRunResolver.star();

  @Test
  public void testRunDecomposesIntoSingleDelimiters() {
    ScannerState state = new ScannerState();
    InlineCursor cursor = new InlineCursor("***word");
    ValidTokens valid = STARS.with(TokenKind.LAST_TOKEN_WHITESPACE);

    for (int left = 2; left >= 0; left--) {
      ScanResult result = subject.attempt(cursor, valid, state);
      assertEquals(TokenKind.EMPHASIS_OPEN_STAR, result.kind());
      assertEquals(1, result.length());
      assertEquals(left, state.emphasisRemaining());
      assertTrue(state.emphasisOpening());
      cursor.accept();
    }
    assertEquals('w', cursor.lookahead());
  }

  @Test
  public void testClosingRun() {
    ScannerState state = new ScannerState();
    InlineCursor cursor = new InlineCursor("**");

    ScanResult first = subject.attempt(cursor, STARS, state);
    assertEquals(TokenKind.EMPHASIS_CLOSE_STAR, first.kind());
    assertEquals(1, first.length());
    assertEquals(1, state.emphasisRemaining());
    assertFalse(state.emphasisOpening());
    cursor.accept();

    ScanResult second = subject.attempt(cursor, STARS, state);
    assertEquals(TokenKind.EMPHASIS_CLOSE_STAR, second.kind());
    assertEquals(0, state.emphasisRemaining());
  }

  @Test
  public void testCloseWinsWhenBothFlank() {
    ScannerState state = new ScannerState();
    ScanResult result = subject.attempt(new InlineCursor("*b"), STARS, state);
    assertEquals(TokenKind.EMPHASIS_CLOSE_STAR, result.kind());
  }

  @Test
  public void testWhitespaceOnBothSidesDeclines() {
    ScannerState state = new ScannerState();
    ScanResult result = subject.attempt(new InlineCursor("* b"), STARS.with(TokenKind.LAST_TOKEN_WHITESPACE), state);
    assertTrue(result.isDeclined());
    assertEquals(new ScannerState(), state);
  }

  @Test
  public void testPunctuationBeforeLetterOpens() {
    ScannerState state = new ScannerState();
    ScanResult result = subject.attempt(new InlineCursor("*b"), STARS.with(TokenKind.LAST_TOKEN_PUNCTUATION), state);
    assertEquals(TokenKind.EMPHASIS_OPEN_STAR, result.kind());
  }

  @Test
  public void testPunctuationOnBothSidesCloses() {
    ScannerState state = new ScannerState();
    ScanResult result = subject.attempt(new InlineCursor("*."), STARS.with(TokenKind.LAST_TOKEN_PUNCTUATION), state);
    assertEquals(TokenKind.EMPHASIS_CLOSE_STAR, result.kind());
  }

  @Test
  public void testOpenBeforePunctuationNeedsPunctuationOrWhitespaceBefore() {
    ScannerState state = new ScannerState();
    ValidTokens openOnly = ValidTokens.of(TokenKind.EMPHASIS_OPEN_STAR);
    assertTrue(subject.attempt(new InlineCursor("*."), openOnly, state).isDeclined());
    assertEquals(TokenKind.EMPHASIS_OPEN_STAR,
        subject.attempt(new InlineCursor("*."), openOnly.with(TokenKind.LAST_TOKEN_WHITESPACE), state).kind());
  }

  @Test
  public void testContinuationKeepsDirection() {
    ScannerState state = new ScannerState();
    state.emphasisOpening(true);
    state.emphasisRemaining(2);

    // a lone star before a space would never open on its own
    ScanResult result = subject.attempt(new InlineCursor("* "), STARS, state);
    assertEquals(TokenKind.EMPHASIS_OPEN_STAR, result.kind());
    assertEquals(1, state.emphasisRemaining());
    assertTrue(state.emphasisOpening());
  }

  @Test
  public void testContinuationReclassifiesWhenDirectionNotValid() {
    ScannerState state = new ScannerState();
    state.emphasisOpening(true);
    state.emphasisRemaining(1);

    ScanResult result = subject.attempt(new InlineCursor("*"), ValidTokens.of(TokenKind.EMPHASIS_CLOSE_STAR), state);
    assertEquals(TokenKind.EMPHASIS_CLOSE_STAR, result.kind());
    assertEquals(0, state.emphasisRemaining());
    assertFalse(state.emphasisOpening());
  }

  @Test
  public void testDeclinesWithoutEmphasisCandidates() {
    ScannerState state = new ScannerState();
    assertTrue(subject.attempt(new InlineCursor("*a*"), ValidTokens.of(TokenKind.CODE_SPAN_OPEN), state).isDeclined());
  }

  @Test
  public void testUnderscoreKinds() {
    ScannerState state = new ScannerState();
    ScanResult result = EmphasisRunResolver.underscore().attempt(new InlineCursor("__init"),
        ValidTokens.of(TokenKind.EMPHASIS_OPEN_UNDERSCORE, TokenKind.LAST_TOKEN_WHITESPACE), state);
    assertEquals(TokenKind.EMPHASIS_OPEN_UNDERSCORE, result.kind());
    assertEquals(1, result.length());
    assertEquals(1, state.emphasisRemaining());
  }

  @Test
  public void testRemainingCountIsCapped() {
    StringBuilder input = new StringBuilder();
    for (int i = 0; i < 300; i++) {
      input.append('*');
    }
    input.append("word");
    ScannerState state = new ScannerState();

    ScanResult result = subject.attempt(new InlineCursor(input), STARS.with(TokenKind.LAST_TOKEN_WHITESPACE), state);
    assertEquals(TokenKind.EMPHASIS_OPEN_STAR, result.kind());
    assertEquals(1, result.length());
    assertEquals(ScannerState.MAX_VALUE, state.emphasisRemaining());
    assertTrue(state.emphasisOpening());
  }
}
