package com.onkiup.linker.inline;

import java.util.Collection;
import java.util.EnumSet;
import java.util.stream.Collectors;

/**
 * Immutable set of token kinds that the embedding parser accepts at the current position
 */
public final class ValidTokens {

  private static final TokenKind[] KINDS = TokenKind.values();

  private final EnumSet<TokenKind> kinds;

  private ValidTokens(EnumSet<TokenKind> kinds) {
    this.kinds = kinds;
  }

  public static ValidTokens none() {
    return new ValidTokens(EnumSet.noneOf(TokenKind.class));
  }

  public static ValidTokens of(TokenKind first, TokenKind... rest) {
    return new ValidTokens(EnumSet.of(first, rest));
  }

  public static ValidTokens of(Collection<TokenKind> kinds) {
    return kinds.isEmpty() ? none() : new ValidTokens(EnumSet.copyOf(kinds));
  }

  /**
   * Builds a candidate set from a positional array, as handed over by table-driven parsers
   * @param valid array indexed by {@link TokenKind#ordinal()}
   * @return candidate set with every kind whose slot is true
   */
  public static ValidTokens fromArray(boolean[] valid) {
    if (valid == null || valid.length != KINDS.length) {
      throw new IllegalArgumentException("Expected " + KINDS.length + " validity slots but got " +
          (valid == null ? "null" : String.valueOf(valid.length)));
    }
    EnumSet<TokenKind> result = EnumSet.noneOf(TokenKind.class);
    for (int i = 0; i < valid.length; i++) {
      if (valid[i]) {
        result.add(KINDS[i]);
      }
    }
    return new ValidTokens(result);
  }

  public boolean isValid(TokenKind kind) {
    return kinds.contains(kind);
  }

  public boolean isAnyValid(TokenKind first, TokenKind second) {
    return kinds.contains(first) || kinds.contains(second);
  }

  public boolean lastTokenWhitespace() {
    return kinds.contains(TokenKind.LAST_TOKEN_WHITESPACE);
  }

  public boolean lastTokenPunctuation() {
    return kinds.contains(TokenKind.LAST_TOKEN_PUNCTUATION);
  }

  public ValidTokens with(TokenKind kind) {
    EnumSet<TokenKind> result = EnumSet.copyOf(kinds);
    result.add(kind);
    return new ValidTokens(result);
  }

  public ValidTokens without(TokenKind kind) {
    EnumSet<TokenKind> result = EnumSet.copyOf(kinds);
    result.remove(kind);
    return new ValidTokens(result);
  }

  public boolean[] toArray() {
    boolean[] result = new boolean[KINDS.length];
    kinds.forEach(kind -> result[kind.ordinal()] = true);
    return result;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ValidTokens && kinds.equals(((ValidTokens) other).kinds);
  }

  @Override
  public int hashCode() {
    return kinds.hashCode();
  }

  @Override
  public String toString() {
    return kinds.stream().map(TokenKind::name).collect(Collectors.joining(", ", "ValidTokens[", "]"));
  }
}
