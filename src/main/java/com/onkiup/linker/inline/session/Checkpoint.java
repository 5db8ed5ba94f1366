package com.onkiup.linker.inline.session;

import java.util.Arrays;

/**
 * Tokenizer state saved at an input position, allowing a session to resume there
 */
public final class Checkpoint {

  private final int position;
  private final int tokenCount;
  private final byte[] state;

  public Checkpoint(int position, int tokenCount, byte[] state) {
    if (position < 0) {
      throw new IllegalArgumentException("Position cannot be negative");
    }
    this.position = position;
    this.tokenCount = tokenCount;
    this.state = state.clone();
  }

  /**
   * @return input position right after the token that produced this checkpoint
   */
  public int position() {
    return position;
  }

  /**
   * @return number of tokens emitted before this checkpoint
   */
  public int tokenCount() {
    return tokenCount;
  }

  public byte[] state() {
    return state.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Checkpoint)) {
      return false;
    }
    Checkpoint that = (Checkpoint) other;
    return position == that.position && tokenCount == that.tokenCount && Arrays.equals(state, that.state);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * position + tokenCount) + Arrays.hashCode(state);
  }

  @Override
  public String toString() {
    return "Checkpoint[" + position + ", tokens=" + tokenCount + ", state=" + Arrays.toString(state) + "]";
  }
}
