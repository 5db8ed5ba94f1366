package com.onkiup.linker.inline.session;

import com.onkiup.linker.inline.ScannerState;
import com.onkiup.linker.inline.TokenKind;
import com.onkiup.linker.inline.ValidTokens;

/**
 * Decides which token kinds a scan session offers to the tokenizer, standing in for a parse table
 */
public interface CandidatePolicy {

  /**
   * @param state current tokenizer state
   * @param lastWhitespace true if the previous token ended with whitespace or nothing was scanned yet
   * @param lastPunctuation true if the previous token ended with punctuation
   * @return candidate set for the next invocation
   */
  ValidTokens candidates(ScannerState state, boolean lastWhitespace, boolean lastPunctuation);

  /**
   * Informs the policy about every token the tokenizer committed to
   */
  default void accepted(TokenKind kind) {
  }

  /**
   * Informs the policy that the session restarted from a checkpoint and any bookkeeping should be dropped
   */
  default void reset() {
  }

  /**
   * @return policy that always offers the same kinds, plus the previous-token flags
   */
  static CandidatePolicy fixed(ValidTokens kinds) {
    return (state, lastWhitespace, lastPunctuation) -> {
      ValidTokens result = kinds;
      if (lastWhitespace) {
        result = result.with(TokenKind.LAST_TOKEN_WHITESPACE);
      }
      if (lastPunctuation) {
        result = result.with(TokenKind.LAST_TOKEN_PUNCTUATION);
      }
      return result;
    };
  }
}
