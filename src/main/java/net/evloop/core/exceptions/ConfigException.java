package net.evloop.core.exceptions;

/**
 * Thrown when a configuration option is missing or cannot be parsed.
 */
public class ConfigException extends EventLoopException {
  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
