package net.evloop.core.exceptions;

/**
 * Thrown when an output sink can no longer render results. Not recoverable by the loop.
 */
public class OutputSinkException extends EventLoopException {
  public OutputSinkException(String message) {
    super(message);
  }
}
