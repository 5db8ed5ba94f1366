package com.onkiup.linker.inline.session;

import static org.junit.Assert.*;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.SimpleLayout;
import org.apache.log4j.WriterAppender;
import org.junit.Test;
import org.mockito.Mockito;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.InlineTokenizer;
import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.TokenizerError;
import com.onkiup.linker.inline.TokenizerOptions;
import com.onkiup.linker.inline.ValidTokens;

public class InlineScanSessionTest {

  private static List<String> describe(List<InlineToken> tokens) {
    return tokens.stream()
        .map(token -> (token.isText() ? "TEXT" : token.kind().name()) + ":" + token.text())
        .collect(Collectors.toList());
  }

  @Test
  public void testStrongEmphasis() {
    InlineScanSession session = new InlineScanSession("**bold**");
    List<InlineToken> tokens = session.run();

    assertEquals(Arrays.asList(
        "EMPHASIS_OPEN_STAR:*", "EMPHASIS_OPEN_STAR:*", "TEXT:bold", "EMPHASIS_CLOSE_STAR:*", "EMPHASIS_CLOSE_STAR:*"),
        describe(tokens));
    assertEquals(0, tokens.get(0).position());
    assertEquals(1, tokens.get(1).position());
    assertEquals(6, tokens.get(3).position());
    assertEquals(new ScannerState(), session.tokenizer().state());
  }

  @Test
  public void testCodeSpan() {
    List<InlineToken> tokens = new InlineScanSession("`code`").run();
    assertEquals(Arrays.asList("CODE_SPAN_OPEN:`", "TEXT:code", "CODE_SPAN_CLOSE:`"), describe(tokens));
    assertEquals(5, tokens.get(2).position());
  }

  @Test
  public void testCodeSpanWithInnerBacktick() {
    InlineScanSession session = new InlineScanSession("``code with ` backtick``");
    List<InlineToken> tokens = session.run();
    assertEquals(Arrays.asList("CODE_SPAN_OPEN:``", "TEXT:code with ` backtick", "CODE_SPAN_CLOSE:``"),
        describe(tokens));
    assertEquals(0, session.tokenizer().state().codeSpanRunLength());
  }

  @Test
  public void testSmartQuotes() {
    List<InlineToken> tokens = new InlineScanSession("'quoted'").run();
    assertEquals(Arrays.asList("SINGLE_QUOTE_OPEN:'", "TEXT:quoted", "SINGLE_QUOTE_CLOSE:'"), describe(tokens));
  }

  @Test
  public void testApostropheIsText() {
    List<InlineToken> tokens = new InlineScanSession("it's").run();
    assertEquals(Arrays.asList("TEXT:it's"), describe(tokens));
  }

  @Test
  public void testShortcode() {
    InlineScanSession session = new InlineScanSession("{{< shortcode-name >}}");
    List<InlineToken> tokens = session.run();
    assertEquals(Arrays.asList("SHORTCODE_OPEN:{{<", "TEXT: shortcode-name >", "SHORTCODE_CLOSE:}}"),
        describe(tokens));
    assertEquals(0, session.tokenizer().state().shortcodeDepth());
  }

  @Test
  public void testQuotesInsideShortcodeAreText() {
    List<InlineToken> tokens = new InlineScanSession("{{< meta 'title' >}}").run();
    assertEquals(Arrays.asList("SHORTCODE_OPEN:{{<", "TEXT: meta 'title' >", "SHORTCODE_CLOSE:}}"),
        describe(tokens));
  }

  @Test
  public void testShortcodeNestingLimitFallsBackToText() {
    StringBuilder input = new StringBuilder();
    for (int i = 0; i <= ScannerState.MAX_VALUE; i++) {
      input.append("{{<");
    }
    InlineScanSession session = new InlineScanSession(input);
    List<InlineToken> tokens = session.run();

    assertEquals(ScannerState.MAX_VALUE + 1, tokens.size());
    assertEquals(TokenKind.SHORTCODE_OPEN, tokens.get(ScannerState.MAX_VALUE - 1).kind());
    assertEquals("TEXT:{{<", describe(tokens).get(ScannerState.MAX_VALUE));
    assertEquals(ScannerState.MAX_VALUE, session.tokenizer().state().shortcodeDepth());
  }

  @Test
  public void testFootnoteCaretIsText() {
    List<InlineToken> tokens = new InlineScanSession("^[note]").run();
    assertEquals(Arrays.asList("TEXT:^[note]"), describe(tokens));
  }

  @Test
  public void testScriptsAndStrikeout() {
    List<InlineToken> tokens = new InlineScanSession("H~2~O ~~x~~ e^x^").run();
    assertEquals(Arrays.asList(
        "TEXT:H", "SUBSCRIPT_OPEN:~", "TEXT:2", "SUBSCRIPT_CLOSE:~", "TEXT:O ",
        "STRIKEOUT_OPEN:~~", "TEXT:x", "STRIKEOUT_CLOSE:~~", "TEXT: e",
        "SUPERSCRIPT_OPEN:^", "TEXT:x", "SUPERSCRIPT_CLOSE:^"), describe(tokens));
  }

  @Test
  public void testCitations() {
    List<InlineToken> tokens = new InlineScanSession("see @doe99 and -@{smith}").run();
    assertEquals(Arrays.asList("TEXT:see ", "CITATION_AUTHOR:@", "TEXT:doe99 and ",
        "CITATION_SUPPRESS_AUTHOR_BRACKETED:-@{", "TEXT:smith}"), describe(tokens));
  }

  @Test
  public void testMathSpan() {
    List<InlineToken> tokens = new InlineScanSession("$$e=mc^2$$").run();
    assertEquals(Arrays.asList("MATH_SPAN_OPEN:$$", "TEXT:e=mc^2", "MATH_SPAN_CLOSE:$$"), describe(tokens));
  }

  @Test
  public void testForcedErrorStopsScanning() {
    CandidatePolicy policy = Mockito.mock(CandidatePolicy.class);
    Mockito.when(policy.candidates(Mockito.any(), Mockito.anyBoolean(), Mockito.anyBoolean()))
        .thenReturn(ValidTokens.none())
        .thenReturn(ValidTokens.of(TokenKind.FORCED_ERROR));
    InlineScanSession session = new InlineScanSession(new InlineCursor("abc"), new InlineTokenizer(), policy);

    List<InlineToken> tokens = session.run();
    assertEquals(Arrays.asList("TEXT:a", "ERROR:", "TEXT:bc"), describe(tokens));
    assertEquals(1, tokens.get(1).position());
    assertTrue(session.isFinished());
    Mockito.verify(policy, Mockito.never()).accepted(TokenKind.ERROR);
  }

  @Test
  public void testCheckpointsAfterEveryToken() {
    InlineScanSession session = new InlineScanSession("*a* `b`");
    session.run();

    List<Checkpoint> checkpoints = session.checkpoints();
    assertEquals(4, checkpoints.size());
    assertEquals(1, checkpoints.get(0).position());
    assertEquals(3, checkpoints.get(1).position());
    assertEquals(5, checkpoints.get(2).position());
    assertEquals(7, checkpoints.get(3).position());
    assertEquals(1, ScannerState.deserialize(checkpoints.get(2).state()).codeSpanRunLength());
    assertEquals(0, ScannerState.deserialize(checkpoints.get(3).state()).codeSpanRunLength());
    assertEquals(checkpoints.get(1), session.checkpointBefore(4).get());
    assertFalse(session.checkpointBefore(0).isPresent());
  }

  @Test
  public void testResumeReproducesTokens() {
    InlineScanSession session = new InlineScanSession("**a** and `b` with ~~c~~");
    List<InlineToken> expected = session.run();

    for (Checkpoint checkpoint : session.checkpoints()) {
      InlineScanSession resumed = new InlineScanSession("**a** and `b` with ~~c~~");
      resumed.run();
      resumed.resume(checkpoint);
      assertEquals(checkpoint.tokenCount(), resumed.tokens().size());
      assertEquals(expected, resumed.run());
    }
  }

  @Test
  public void testCheckpointsCanBeDisabled() {
    TokenizerOptions options = TokenizerOptions.builder().checkpoints(false).build();
    InlineScanSession session = new InlineScanSession(new InlineCursor("`a`"), new InlineTokenizer(options),
        new SpanTrackingPolicy());
    session.run();
    assertEquals(3, session.tokens().size());
    assertTrue(session.checkpoints().isEmpty());
  }

  @Test(expected = TokenizerError.class)
  public void testResumePastEnd() {
    new InlineScanSession("ab").resume(new Checkpoint(5, 0, new byte[ScannerState.SIZE]));
  }

  @Test
  public void testLogLinesShowInputDuringRun() {
    StringWriter output = new StringWriter();
    SimpleLayout layout = new SimpleLayout();
    WriterAppender appender = new WriterAppender(layout, output);
    Logger root = Logger.getRootLogger();
    Logger tokenizerLogger = Logger.getLogger(InlineTokenizer.class);
    Level level = tokenizerLogger.getLevel();
    root.addAppender(appender);
    tokenizerLogger.setLevel(Level.DEBUG);
    try {
      new InlineScanSession("`x`").run();
    } finally {
      tokenizerLogger.setLevel(level);
      root.removeAppender(appender);
    }

    assertSame(layout, appender.getLayout());
    assertTrue(output.toString(), output.toString().contains("`x`' || "));
  }
}
