package com.onkiup.linker.inline;

import java.util.Locale;

/**
 * Text that closes a shortcode, as expected by the embedding grammar
 */
public enum ShortcodeCloseMarker {
  /**
   * <code>}}</code> and <code>}}}</code>; the grammar lexes the preceding {@code >} itself
   */
  BRACES(""),
  /**
   * <code>&gt;}}</code> and <code>&gt;}}}</code>
   */
  ANGLE_BRACES(">");

  private final String lead;

  ShortcodeCloseMarker(String lead) {
    this.lead = lead;
  }

  /**
   * @return characters preceding the closing braces
   */
  public String lead() {
    return lead;
  }

  /**
   * @return first character of any shortcode closer
   */
  public char trigger() {
    return lead.isEmpty() ? '}' : lead.charAt(0);
  }

  public static ShortcodeCloseMarker parse(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown shortcode close marker: '" + value + "'", e);
    }
  }
}
