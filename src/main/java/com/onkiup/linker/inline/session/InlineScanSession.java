package com.onkiup.linker.inline.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

import org.apache.log4j.Appender;
import org.apache.log4j.Layout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.inline.InlineCursor;
import com.onkiup.linker.inline.InlineResolver;
import com.onkiup.linker.inline.InlineTokenizer;
import com.onkiup.linker.inline.ScanResult;
import com.onkiup.linker.inline.SourceLocation;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.TokenizerError;
import com.onkiup.linker.inline.TokenizerOptions;
import com.onkiup.linker.inline.ValidTokens;
import com.onkiup.linker.inline.util.CursorLayout;

/**
 * Drives an {@link InlineTokenizer} over a whole input the way an embedding parser would: characters the tokenizer
 * declines become literal text, and the tokenizer state is checkpointed after every recognized token.
 */
public class InlineScanSession {

  private static final Logger logger = LoggerFactory.getLogger(InlineScanSession.class);

  private final InlineTokenizer tokenizer;
  private final CandidatePolicy policy;
  private final InlineCursor cursor;
  private final List<InlineToken> tokens = new ArrayList<>();
  private final List<Checkpoint> checkpoints = new ArrayList<>();
  private StringBuilder text;
  private SourceLocation textStart;
  private boolean finished;

  public InlineScanSession(CharSequence input) {
    this(new InlineCursor(input), new InlineTokenizer(TokenizerOptions.load()), new SpanTrackingPolicy());
  }

  public InlineScanSession(InlineCursor cursor, InlineTokenizer tokenizer, CandidatePolicy policy) {
    this.cursor = cursor;
    this.tokenizer = tokenizer;
    this.policy = policy;
  }

  /**
   * Scans the rest of the input
   * @return all tokens scanned by this session so far
   */
  public List<InlineToken> run() {
    setupLoggingLayouts();
    try {
      while (step()) {
        // keep scanning
      }
    } finally {
      restoreLoggingLayouts();
    }
    return tokens();
  }

  /**
   * Performs a single tokenizer invocation, or consumes one literal character when the tokenizer declines
   * @return false when there is nothing left to scan
   */
  public boolean step() {
    if (finished || cursor.eof()) {
      finish();
      return false;
    }

    int start = cursor.start();
    CharSequence source = cursor.source();
    boolean lastWhitespace = start == 0 || InlineResolver.isWhitespace(source.charAt(start - 1));
    boolean lastPunctuation = start > 0 && InlineResolver.isPunctuation(source.charAt(start - 1));
    ValidTokens valid = policy.candidates(tokenizer.state(), lastWhitespace, lastPunctuation);

    ScanResult result = tokenizer.scan(cursor, valid);
    if (result.isDeclined()) {
      SourceLocation location = cursor.location();
      appendText(cursor.skip(1), location);
      return true;
    }

    flushText();
    SourceLocation location = cursor.location();
    if (result.kind() == TokenKind.ERROR) {
      cursor.accept();
      tokens.add(new InlineToken(TokenKind.ERROR, "", location));
      logger.debug("Scan stopped by an error token at {}", location);
      appendText(cursor.skip(source.length() - cursor.start()), location);
      finish();
      return false;
    }
    if (result.length() == 0) {
      throw new TokenizerError("Tokenizer recognized an empty " + result.kind() + " token", location);
    }

    tokens.add(new InlineToken(result.kind(), cursor.accept(), location));
    policy.accepted(result.kind());
    if (tokenizer.options().checkpoints()) {
      Checkpoint checkpoint = new Checkpoint(cursor.start(), tokens.size(), tokenizer.serialize());
      checkpoints.add(checkpoint);
      logger.debug("Recorded {}", checkpoint);
    }
    return true;
  }

  /**
   * Restarts scanning from a checkpoint, dropping every token and checkpoint recorded after it
   * @param checkpoint a checkpoint recorded by this session or by a session over an earlier version of the input
   */
  public void resume(Checkpoint checkpoint) {
    if (checkpoint.position() > cursor.source().length()) {
      throw new TokenizerError("Checkpoint at " + checkpoint.position() + " is past the end of input", cursor.location());
    }
    cursor.seek(checkpoint.position());
    tokenizer.deserialize(checkpoint.state());

    int keep = Math.min(checkpoint.tokenCount(), tokens.size());
    tokens.subList(keep, tokens.size()).clear();
    checkpoints.removeIf(saved -> saved.position() > checkpoint.position() || saved.tokenCount() > keep);
    policy.reset();
    tokens.stream()
        .filter(token -> !token.isText())
        .forEach(token -> policy.accepted(token.kind()));

    text = null;
    textStart = null;
    finished = false;
    logger.debug("Resumed at {} with {} tokens", cursor.location(), keep);
  }

  /**
   * @return last checkpoint recorded at or before the given input position
   */
  public Optional<Checkpoint> checkpointBefore(int position) {
    Checkpoint result = null;
    for (Checkpoint checkpoint : checkpoints) {
      if (checkpoint.position() <= position) {
        result = checkpoint;
      }
    }
    return Optional.ofNullable(result);
  }

  public List<InlineToken> tokens() {
    return Collections.unmodifiableList(new ArrayList<>(tokens));
  }

  public List<Checkpoint> checkpoints() {
    return Collections.unmodifiableList(new ArrayList<>(checkpoints));
  }

  public InlineTokenizer tokenizer() {
    return tokenizer;
  }

  public InlineCursor cursor() {
    return cursor;
  }

  public boolean isFinished() {
    return finished;
  }

  /**
   * Wraps layouts of root log4j appenders with {@link CursorLayout} so that log lines show the scanned input
   */
  @SuppressWarnings("unchecked")
  private void setupLoggingLayouts() {
    Enumeration<Appender> appenders = org.apache.log4j.Logger.getRootLogger().getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender appender = appenders.nextElement();
      Layout layout = appender.getLayout();
      if (layout != null && !(layout instanceof CursorLayout)) {
        appender.setLayout(new CursorLayout(layout, cursor));
      }
    }
  }

  /**
   * Puts back the layouts replaced by {@link #setupLoggingLayouts()}
   */
  @SuppressWarnings("unchecked")
  private void restoreLoggingLayouts() {
    Enumeration<Appender> appenders = org.apache.log4j.Logger.getRootLogger().getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender appender = appenders.nextElement();
      Layout layout = appender.getLayout();
      if (layout instanceof CursorLayout && ((CursorLayout) layout).cursor() == cursor) {
        appender.setLayout(((CursorLayout) layout).parent());
      }
    }
  }

  private void appendText(CharSequence characters, SourceLocation location) {
    if (characters.length() == 0) {
      return;
    }
    if (text == null) {
      text = new StringBuilder();
      textStart = location;
    }
    text.append(characters);
  }

  private void flushText() {
    if (text != null) {
      tokens.add(InlineToken.text(text, textStart));
      text = null;
      textStart = null;
    }
  }

  private void finish() {
    flushText();
    finished = true;
  }
}
