package com.onkiup.linker.inline;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.onkiup.linker.inline.resolver.CitationRecognizer;
import com.onkiup.linker.inline.resolver.DelimiterRunMatcher;
import com.onkiup.linker.inline.resolver.EmphasisRunResolver;
import com.onkiup.linker.inline.resolver.ShortcodeRecognizer;
import com.onkiup.linker.inline.resolver.ToggleSpan;
import com.onkiup.linker.inline.resolver.ToggleSpanResolver;
import com.onkiup.linker.inline.util.CursorLayout;

/**
 * Entry point of the inline tokenizer.
 * <p>
 * Each {@link #scan(InlineCursor, ValidTokens)} call picks a resolver by the character at the cursor and lets it
 * either recognize a token or decline. One instance owns one {@link ScannerState} and must only be driven by a
 * single parser at a time.
 */
public class InlineTokenizer {

  private static final Logger logger = LoggerFactory.getLogger(InlineTokenizer.class);

  private final TokenizerOptions options;
  private final ScannerState state;
  private final Map<Character, InlineResolver> resolvers = new HashMap<>();
  private final InlineResolver strikeout = new ToggleSpanResolver(ToggleSpan.STRIKEOUT);
  private final InlineResolver subscript = new ToggleSpanResolver(ToggleSpan.SUBSCRIPT);
  private final InlineResolver singleQuote = new ToggleSpanResolver(ToggleSpan.SINGLE_QUOTE);
  private final InlineResolver doubleQuote = new ToggleSpanResolver(ToggleSpan.DOUBLE_QUOTE);

  public InlineTokenizer() {
    this(TokenizerOptions.defaults());
  }

  public InlineTokenizer(TokenizerOptions options) {
    this(options, new ScannerState());
  }

  public InlineTokenizer(TokenizerOptions options, ScannerState state) {
    this.options = options;
    this.state = state;

    register('{', ShortcodeRecognizer.opener());
    register(options.shortcodeCloseMarker().trigger(), ShortcodeRecognizer.closer(options.shortcodeCloseMarker()));
    register('@', CitationRecognizer.authorInText());
    register('-', CitationRecognizer.suppressAuthor());
    register('^', new ToggleSpanResolver(ToggleSpan.SUPERSCRIPT));
    register('`', DelimiterRunMatcher.codeSpan());
    register('$', DelimiterRunMatcher.mathSpan());
    register('*', EmphasisRunResolver.star());
    register('_', EmphasisRunResolver.underscore());
  }

  @VisibleForTesting
  void register(char trigger, InlineResolver resolver) {
    resolvers.put(trigger, resolver);
  }

  public TokenizerOptions options() {
    return options;
  }

  public ScannerState state() {
    return state;
  }

  /**
   * Attempts to recognize a token at the cursor.
   * On a match the cursor's pending token spans exactly the recognized characters; when declined the cursor is
   * rewound to the token start.
   * @param cursor input positioned at the token start
   * @param valid token kinds accepted by the embedding parser at this point
   * @return recognized token or a declined result
   */
  public ScanResult scan(InlineCursor cursor, ValidTokens valid) {
    cursor.rewind();
    // the parser asks for an error to stop an invalid branch
    if (valid.isValid(TokenKind.FORCED_ERROR)) {
      cursor.markEnd();
      logger.debug("Forced error at {}", cursor.location());
      return ScanStatus.MATCH.result(TokenKind.ERROR, 0);
    }

    Optional<InlineResolver> resolver = resolverFor(cursor, valid);
    if (!resolver.isPresent()) {
      return ScanStatus.declined();
    }

    ScanResult result = resolver.get().attempt(cursor, valid, state);
    if (result.isDeclined()) {
      cursor.rewind();
    }
    if (logger.isDebugEnabled()) {
      logger.debug("{} at {} on '{}': {} -> {}", resolver.get(), cursor.location(),
          CursorLayout.sanitize(String.valueOf(cursor.source().charAt(cursor.start()))), result, state);
    }
    return result;
  }

  /**
   * @return resolver responsible for the character at the cursor, if any
   */
  protected Optional<InlineResolver> resolverFor(InlineCursor cursor, ValidTokens valid) {
    int character = cursor.lookahead();
    if (character == InlineCursor.EOF) {
      return Optional.empty();
    }
    if (character == '~') {
      return Optional.of(cursor.peek(1) == '~' ? strikeout : subscript);
    }
    InlineResolver resolver = resolvers.get((char) character);
    if (resolver != null) {
      return Optional.of(resolver);
    }

    // inside shortcodes quotes delimit string literals, which the grammar lexes itself
    if (state.lexicalMode().quotesAllowed()) {
      if (character == '\'' && (valid.lastTokenWhitespace() || state.singleQuoteOpen())) {
        return Optional.of(singleQuote);
      }
      if (character == '"' && (valid.lastTokenWhitespace() || state.doubleQuoteOpen())) {
        return Optional.of(doubleQuote);
      }
    }
    return Optional.empty();
  }

  /**
   * @return state checkpoint, see {@link ScannerState#serialize()}
   */
  public byte[] serialize() {
    return state.serialize();
  }

  /**
   * Restores state from a checkpoint produced by {@link #serialize()}
   */
  public void deserialize(byte[] buffer) {
    state.restore(buffer);
  }

  @Override
  public String toString() {
    return "InlineTokenizer[" + state + "]";
  }
}
