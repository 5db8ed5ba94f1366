package com.onkiup.linker.inline;

public enum ScanStatus {
  DECLINED, MATCH;

  public static ScanResult declined() {
    return ScanResult.DECLINED;
  }

  /**
   * @param kind recognized token kind
   * @param cursor cursor positioned by the resolver; its pending token becomes the recognized one
   */
  public static ScanResult match(TokenKind kind, InlineCursor cursor) {
    return MATCH.result(kind, cursor.tokenLength());
  }

  /**
   * @throws IllegalArgumentException when a declined result is given a token kind or length
   */
  ScanResult result(TokenKind kind, int length) {
    if (this == DECLINED && (kind != null || length != 0)) {
      throw new IllegalArgumentException("Declined results carry no token");
    }
    return new ScanResult(this, kind, length);
  }
}
