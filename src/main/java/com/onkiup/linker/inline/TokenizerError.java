package com.onkiup.linker.inline;

/**
 * Signals misuse of the tokenizer API (never a declined token)
 */
public class TokenizerError extends RuntimeException {

  private final SourceLocation location;

  public TokenizerError(String msg, SourceLocation location) {
    super(msg);
    this.location = location;
  }

  public TokenizerError(String msg, SourceLocation location, Throwable cause) {
    super(msg, cause);
    this.location = location;
  }

  public SourceLocation location() {
    return location;
  }

  @Override
  public String toString() {
    return new StringBuilder("Tokenizer error at ")
      .append(location == null ? "<unknown>" : location)
      .append(": ")
      .append(getMessage())
      .toString();
  }
}
