package com.onkiup.linker.inline.resolver;

import org.junit.Assert;
import org.junit.Test;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

public class CitationRecognizerTest {

  private static final ValidTokens ALL = ValidTokens.of(TokenKind.CITATION_AUTHOR, TokenKind.CITATION_AUTHOR_BRACKETED,
      TokenKind.CITATION_SUPPRESS_AUTHOR, TokenKind.CITATION_SUPPRESS_AUTHOR_BRACKETED);

  @Test
  public void testAuthorInText() {
    ScanResult result = CitationRecognizer.authorInText().attempt(new InlineCursor("@knuth84"), ALL, new ScannerState());
    Assert.assertEquals(TokenKind.CITATION_AUTHOR, result.kind());
    Assert.assertEquals(1, result.length());
  }

  @Test
  public void testBracketedAuthorInText() {
    ScanResult result = CitationRecognizer.authorInText().attempt(new InlineCursor("@{knuth 84}"), ALL, new ScannerState());
    Assert.assertEquals(TokenKind.CITATION_AUTHOR_BRACKETED, result.kind());
    Assert.assertEquals(2, result.length());
  }

  @Test
  public void testBraceWithoutBracketedCandidate() {
    ScanResult result = CitationRecognizer.authorInText()
        .attempt(new InlineCursor("@{knuth}"), ValidTokens.of(TokenKind.CITATION_AUTHOR), new ScannerState());
    Assert.assertEquals(TokenKind.CITATION_AUTHOR, result.kind());
    Assert.assertEquals(1, result.length());
  }

  @Test
  public void testSuppressAuthor() {
    CitationRecognizer subject = CitationRecognizer.suppressAuthor();
    ScanResult plain = subject.attempt(new InlineCursor("-@knuth"), ALL, new ScannerState());
    Assert.assertEquals(TokenKind.CITATION_SUPPRESS_AUTHOR, plain.kind());
    Assert.assertEquals(2, plain.length());

    ScanResult bracketed = subject.attempt(new InlineCursor("-@{knuth}"), ALL, new ScannerState());
    Assert.assertEquals(TokenKind.CITATION_SUPPRESS_AUTHOR_BRACKETED, bracketed.kind());
    Assert.assertEquals(3, bracketed.length());
  }

  @Test
  public void testDashWithoutAt() {
    Assert.assertTrue(CitationRecognizer.suppressAuthor()
        .attempt(new InlineCursor("- item"), ALL, new ScannerState()).isDeclined());
  }

  @Test
  public void testNothingValid() {
    Assert.assertTrue(CitationRecognizer.authorInText()
        .attempt(new InlineCursor("@knuth"), ValidTokens.none(), new ScannerState()).isDeclined());
  }
}
