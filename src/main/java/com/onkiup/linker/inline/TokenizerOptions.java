package com.onkiup.linker.inline;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer configuration.
 * Use {@link #builder()}, {@link #fromProperties(Properties)} or {@link #load()} to create instances.
 */
public final class TokenizerOptions {

  private static final Logger logger = LoggerFactory.getLogger(TokenizerOptions.class);

  public static final String RESOURCE = "linker-inline.properties";
  public static final String SHORTCODE_CLOSE = "linker.inline.shortcode.close";
  public static final String SESSION_CHECKPOINTS = "linker.inline.session.checkpoints";

  private static final TokenizerOptions DEFAULTS = builder().build();

  private final ShortcodeCloseMarker shortcodeCloseMarker;
  private final boolean checkpoints;

  private TokenizerOptions(Builder builder) {
    this.shortcodeCloseMarker = builder.shortcodeCloseMarker;
    this.checkpoints = builder.checkpoints;
  }

  public static TokenizerOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads options from {@value #RESOURCE} on the context class path; defaults are used when it is missing
   */
  public static TokenizerOptions load() {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = TokenizerOptions.class.getClassLoader();
    }
    return load(classLoader);
  }

  public static TokenizerOptions load(ClassLoader classLoader) {
    try (InputStream stream = classLoader.getResourceAsStream(RESOURCE)) {
      if (stream == null) {
        logger.debug("No {} found, using default tokenizer options", RESOURCE);
        return defaults();
      }
      Properties properties = new Properties();
      properties.load(stream);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new TokenizerError("Failed to read " + RESOURCE, null, e);
    }
  }

  public static TokenizerOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String closeMarker = properties.getProperty(SHORTCODE_CLOSE);
    if (closeMarker != null) {
      builder.shortcodeCloseMarker(ShortcodeCloseMarker.parse(closeMarker));
    }
    String checkpoints = properties.getProperty(SESSION_CHECKPOINTS);
    if (checkpoints != null) {
      builder.checkpoints(parseBoolean(SESSION_CHECKPOINTS, checkpoints));
    }
    TokenizerOptions result = builder.build();
    logger.debug("Loaded tokenizer options: {}", result);
    return result;
  }

  private static boolean parseBoolean(String key, String value) {
    String normalized = value.trim();
    if ("true".equalsIgnoreCase(normalized)) {
      return true;
    } else if ("false".equalsIgnoreCase(normalized)) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be 'true' or 'false' but was '" + value + "'");
  }

  public ShortcodeCloseMarker shortcodeCloseMarker() {
    return shortcodeCloseMarker;
  }

  /**
   * @return true if scan sessions should record a state checkpoint after every token
   */
  public boolean checkpoints() {
    return checkpoints;
  }

  @Override
  public String toString() {
    return "TokenizerOptions[shortcodeClose=" + shortcodeCloseMarker + ", checkpoints=" + checkpoints + "]";
  }

  public static final class Builder {
    private ShortcodeCloseMarker shortcodeCloseMarker = ShortcodeCloseMarker.BRACES;
    private boolean checkpoints = true;

    private Builder() {
    }

    public Builder shortcodeCloseMarker(ShortcodeCloseMarker marker) {
      if (marker == null) {
        throw new IllegalArgumentException("Shortcode close marker cannot be null");
      }
      this.shortcodeCloseMarker = marker;
      return this;
    }

    public Builder checkpoints(boolean checkpoints) {
      this.checkpoints = checkpoints;
      return this;
    }

    public TokenizerOptions build() {
      return new TokenizerOptions(this);
    }
  }
}
