package com.onkiup.linker.inline;

import java.io.Serializable;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent tokenizer state carried between invocations.
 * Every field is an unsigned byte so that the whole state fits into a fixed {@link #SIZE}-byte checkpoint.
 */
public class ScannerState implements Serializable {

  private static final Logger logger = LoggerFactory.getLogger(ScannerState.class);

  /**
   * Number of bytes produced by {@link #serialize()}
   */
  public static final int SIZE = 10;
  public static final int MAX_VALUE = 0xFF;
  /**
   * Set in {@link #flags()} while the current emphasis delimiter run resolves as opening
   */
  public static final int EMPHASIS_OPENING = 0x1;

  private int flags;
  private int codeSpanRunLength;
  private int mathSpanRunLength;
  private int emphasisRemaining;
  private int shortcodeDepth;
  private int superscriptOpen;
  private int subscriptOpen;
  private int strikeoutOpen;
  private int singleQuoteOpen;
  private int doubleQuoteOpen;

  public ScannerState() {
  }

  /**
   * Reads state from a checkpoint
   * @param buffer checkpoint bytes; null or anything shorter than {@link #SIZE} yields the initial state
   * @return restored state
   */
  public static ScannerState deserialize(byte[] buffer) {
    ScannerState result = new ScannerState();
    result.restore(buffer);
    return result;
  }

  /**
   * @return checkpoint bytes in the fixed field order
   */
  public byte[] serialize() {
    return new byte[] {
      (byte) flags,
      (byte) codeSpanRunLength,
      (byte) mathSpanRunLength,
      (byte) emphasisRemaining,
      (byte) shortcodeDepth,
      (byte) superscriptOpen,
      (byte) subscriptOpen,
      (byte) strikeoutOpen,
      (byte) singleQuoteOpen,
      (byte) doubleQuoteOpen
    };
  }

  /**
   * Overwrites this state with the one stored in the given checkpoint
   * @param buffer checkpoint bytes; extra trailing bytes are ignored
   */
  public void restore(byte[] buffer) {
    reset();
    if (buffer == null || buffer.length < SIZE) {
      if (buffer != null && buffer.length > 0) {
        logger.warn("Ignoring truncated state checkpoint of {} bytes", buffer.length);
      }
      return;
    }
    int index = 0;
    flags = Byte.toUnsignedInt(buffer[index++]);
    codeSpanRunLength = Byte.toUnsignedInt(buffer[index++]);
    mathSpanRunLength = Byte.toUnsignedInt(buffer[index++]);
    emphasisRemaining = Byte.toUnsignedInt(buffer[index++]);
    shortcodeDepth = Byte.toUnsignedInt(buffer[index++]);
    superscriptOpen = Byte.toUnsignedInt(buffer[index++]);
    subscriptOpen = Byte.toUnsignedInt(buffer[index++]);
    strikeoutOpen = Byte.toUnsignedInt(buffer[index++]);
    singleQuoteOpen = Byte.toUnsignedInt(buffer[index++]);
    doubleQuoteOpen = Byte.toUnsignedInt(buffer[index]);
  }

  public void reset() {
    flags = 0;
    codeSpanRunLength = 0;
    mathSpanRunLength = 0;
    emphasisRemaining = 0;
    shortcodeDepth = 0;
    superscriptOpen = 0;
    subscriptOpen = 0;
    strikeoutOpen = 0;
    singleQuoteOpen = 0;
    doubleQuoteOpen = 0;
  }

  public ScannerState copy() {
    return deserialize(serialize());
  }

  public LexicalMode lexicalMode() {
    return shortcodeDepth > 0 ? LexicalMode.SHORTCODE : LexicalMode.NORMAL;
  }

  public int flags() {
    return flags;
  }

  public void flags(int flags) {
    this.flags = checkByte("flags", flags);
  }

  public boolean emphasisOpening() {
    return (flags & EMPHASIS_OPENING) != 0;
  }

  public void emphasisOpening(boolean opening) {
    flags = opening ? flags | EMPHASIS_OPENING : flags & ~EMPHASIS_OPENING;
  }

  public int codeSpanRunLength() {
    return codeSpanRunLength;
  }

  public void codeSpanRunLength(int length) {
    codeSpanRunLength = checkByte("codeSpanRunLength", length);
  }

  public int mathSpanRunLength() {
    return mathSpanRunLength;
  }

  public void mathSpanRunLength(int length) {
    mathSpanRunLength = checkByte("mathSpanRunLength", length);
  }

  public int emphasisRemaining() {
    return emphasisRemaining;
  }

  public void emphasisRemaining(int remaining) {
    emphasisRemaining = checkByte("emphasisRemaining", remaining);
  }

  public int shortcodeDepth() {
    return shortcodeDepth;
  }

  public void shortcodeDepth(int depth) {
    shortcodeDepth = checkByte("shortcodeDepth", depth);
  }

  /**
   * Increments shortcode depth; never goes above {@link #MAX_VALUE}
   */
  public void enterShortcode() {
    if (shortcodeDepth == MAX_VALUE) {
      logger.warn("Shortcode nesting is deeper than {}; depth stays at {}", MAX_VALUE, MAX_VALUE);
      return;
    }
    shortcodeDepth++;
  }

  /**
   * Decrements shortcode depth; never goes below zero
   */
  public void leaveShortcode() {
    if (shortcodeDepth == 0) {
      logger.warn("Shortcode closed without a matching open shortcode; depth stays at 0");
      return;
    }
    shortcodeDepth--;
  }

  public boolean superscriptOpen() {
    return superscriptOpen != 0;
  }

  public void superscriptOpen(boolean open) {
    superscriptOpen = open ? 1 : 0;
  }

  public boolean subscriptOpen() {
    return subscriptOpen != 0;
  }

  public void subscriptOpen(boolean open) {
    subscriptOpen = open ? 1 : 0;
  }

  public boolean strikeoutOpen() {
    return strikeoutOpen != 0;
  }

  public void strikeoutOpen(boolean open) {
    strikeoutOpen = open ? 1 : 0;
  }

  public boolean singleQuoteOpen() {
    return singleQuoteOpen != 0;
  }

  public void singleQuoteOpen(boolean open) {
    singleQuoteOpen = open ? 1 : 0;
  }

  public boolean doubleQuoteOpen() {
    return doubleQuoteOpen != 0;
  }

  public void doubleQuoteOpen(boolean open) {
    doubleQuoteOpen = open ? 1 : 0;
  }

  private static int checkByte(String field, int value) {
    if (value < 0 || value > MAX_VALUE) {
      throw new IllegalArgumentException(field + " must be within 0.." + MAX_VALUE + " but was " + value);
    }
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ScannerState && Arrays.equals(serialize(), ((ScannerState) other).serialize());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialize());
  }

  @Override
  public String toString() {
    return new StringBuilder("ScannerState[")
      .append("flags=").append(flags)
      .append(", code=").append(codeSpanRunLength)
      .append(", math=").append(mathSpanRunLength)
      .append(", emphasisLeft=").append(emphasisRemaining)
      .append(", shortcodes=").append(shortcodeDepth)
      .append(", sup=").append(superscriptOpen)
      .append(", sub=").append(subscriptOpen)
      .append(", strike=").append(strikeoutOpen)
      .append(", squote=").append(singleQuoteOpen)
      .append(", dquote=").append(doubleQuoteOpen)
      .append(']')
      .toString();
  }
}
