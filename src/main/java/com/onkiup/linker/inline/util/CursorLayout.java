package com.onkiup.linker.inline.util;

import org.apache.log4j.Layout;
import org.apache.log4j.spi.LoggingEvent;

import com.onkiup.linker.inline.InlineCursor;

/**
 * Log4j layout that prefixes every event with the input preceding the tokenizer cursor
 */
public class CursorLayout extends Layout {

  private static final int CONTEXT = 50;

  private final Layout parent;
  private final InlineCursor cursor;

  public CursorLayout(Layout parent, InlineCursor cursor) {
    this.parent = parent;
    this.cursor = cursor;
  }

  @Override
  public String format(LoggingEvent event) {
    CharSequence context = String.format("'%s'", ralign(sanitize(cursor.before(CONTEXT - 2)), CONTEXT - 2));
    return String.format("%50.50s || %s :: %s\n", context, ralign(event.getLoggerName(), CONTEXT),
        event.getRenderedMessage());
  }

  @Override
  public boolean ignoresThrowable() {
    return parent.ignoresThrowable();
  }

  @Override
  public void activateOptions() {
    parent.activateOptions();
  }

  public Layout parent() {
    return parent;
  }

  public InlineCursor cursor() {
    return cursor;
  }

  public static String sanitize(Object what) {
    return what == null ? "null" : sanitize(what.toString());
  }

  public static String sanitize(String what) {
    return what == null ? null : what.replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
  }

  /**
   * Right-aligns text in a column of the given width, keeping its tail when it does not fit
   */
  public static String ralign(CharSequence what, int width) {
    if (what.length() >= width) {
      return what.subSequence(what.length() - width, what.length()).toString();
    }
    StringBuilder result = new StringBuilder(width);
    for (int i = what.length(); i < width; i++) {
      result.append(' ');
    }
    return result.append(what).toString();
  }
}
