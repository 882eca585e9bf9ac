package net.evloop.core.exceptions;

/**
 * Generic event loop related exception.
 */
public class EventLoopException extends RuntimeException {
  public EventLoopException(String message) {
    super(message);
  }

  public EventLoopException(String message, Throwable cause) {
    super(message, cause);
  }
}
