package com.onkiup.linker.inline;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

// NB: the order of these constants must match the externals declared by the inline grammar
/**
 * Token kinds that the inline tokenizer may be asked about.
 * Ordinals are part of the contract with the embedding grammar and must not be reordered.
 */
public enum TokenKind {
  ERROR("_error"),
  FORCED_ERROR("_trigger_error"),
  CODE_SPAN_OPEN("_code_span_start"),
  CODE_SPAN_CLOSE("_code_span_close"),
  EMPHASIS_OPEN_STAR("_emphasis_open_star"),
  EMPHASIS_OPEN_UNDERSCORE("_emphasis_open_underscore"),
  EMPHASIS_CLOSE_STAR("_emphasis_close_star"),
  EMPHASIS_CLOSE_UNDERSCORE("_emphasis_close_underscore"),
  LAST_TOKEN_WHITESPACE("_last_token_whitespace", true),
  LAST_TOKEN_PUNCTUATION("_last_token_punctuation", true),
  STRIKEOUT_OPEN("_strikeout_open"),
  STRIKEOUT_CLOSE("_strikeout_close"),
  MATH_SPAN_OPEN("_latex_span_start"),
  MATH_SPAN_CLOSE("_latex_span_close"),
  SINGLE_QUOTE_OPEN("_single_quote_open"),
  SINGLE_QUOTE_CLOSE("_single_quote_close"),
  DOUBLE_QUOTE_OPEN("_double_quote_open"),
  DOUBLE_QUOTE_CLOSE("_double_quote_close"),
  SUPERSCRIPT_OPEN("_superscript_open"),
  SUPERSCRIPT_CLOSE("_superscript_close"),
  SUBSCRIPT_OPEN("_subscript_open"),
  SUBSCRIPT_CLOSE("_subscript_close"),
  CITATION_AUTHOR_BRACKETED("_cite_author_in_text_with_open_bracket"),
  CITATION_SUPPRESS_AUTHOR_BRACKETED("_cite_suppress_author_with_open_bracket"),
  CITATION_AUTHOR("_cite_author_in_text"),
  CITATION_SUPPRESS_AUTHOR("_cite_suppress_author"),
  SHORTCODE_OPEN_ESCAPED("_shortcode_open_escaped"),
  SHORTCODE_CLOSE_ESCAPED("_shortcode_close_escaped"),
  SHORTCODE_OPEN("_shortcode_open"),
  SHORTCODE_CLOSE("_shortcode_close"),
  UNCLOSED_SPAN("_unclosed_span");

  private static final Map<String, TokenKind> BY_GRAMMAR_NAME = Arrays.stream(values())
      .collect(Collectors.toMap(TokenKind::grammarName, Function.identity()));

  private final String grammarName;
  private final boolean flag;

  TokenKind(String grammarName) {
    this(grammarName, false);
  }

  TokenKind(String grammarName, boolean flag) {
    this.grammarName = grammarName;
    this.flag = flag;
  }

  /**
   * @return name of the external token that represents this kind in the inline grammar
   */
  public String grammarName() {
    return grammarName;
  }

  /**
   * @return true for kinds that only carry information about the previous token and are never emitted
   */
  public boolean isFlag() {
    return flag;
  }

  public static Optional<TokenKind> forGrammarName(String name) {
    return Optional.ofNullable(BY_GRAMMAR_NAME.get(name));
  }
}
