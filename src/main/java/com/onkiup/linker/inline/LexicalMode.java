package com.onkiup.linker.inline;

/**
 * Lexical mode the tokenizer is in; decides who owns quote characters
 */
public enum LexicalMode {
  /**
   * Regular markdown text: quotes are smart quotes
   */
  NORMAL,
  /**
   * Inside at least one shortcode: quotes delimit string literals and are left to the grammar
   */
  SHORTCODE;

  public boolean quotesAllowed() {
    return this == NORMAL;
  }
}
