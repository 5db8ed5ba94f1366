package com.onkiup.linker.inline;

import java.util.Objects;

/**
 * Outcome of a single tokenizer invocation
 */
public class ScanResult {

  static final ScanResult DECLINED = new ScanResult(ScanStatus.DECLINED, null, 0);

  private final ScanStatus status;
  private final TokenKind kind;
  private final int length;

  protected ScanResult(ScanStatus status, TokenKind kind, int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Token length cannot be negative");
    }
    this.status = status;
    this.kind = kind;
    this.length = length;
  }

  /**
   * @return recognized token kind or null when declined
   */
  public TokenKind kind() {
    return kind;
  }

  /**
   * @return number of consumed characters
   */
  public int length() {
    return length;
  }

  public boolean isMatch() {
    return status == ScanStatus.MATCH;
  }

  public boolean isDeclined() {
    return status == ScanStatus.DECLINED;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof ScanResult)) {
      return false;
    }
    ScanResult that = (ScanResult) other;
    return status == that.status && kind == that.kind && length == that.length;
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, kind, length);
  }

  @Override
  public String toString() {
    return isMatch() ? "ScanResult: " + kind + " (" + length + ")" : "ScanResult: " + status;
  }
}
