package net.evloop.core;

import net.evloop.core.data.EventResult;

/**
 * Renders completed results. A sink that can no longer render throws
 * {@link net.evloop.core.exceptions.OutputSinkException}, which the loop treats as fatal.
 */
@FunctionalInterface
public interface OutputSink {
  void emit(EventResult result);

  static String format(EventResult result) {
    return String.format("Output for Event \"%s\": %s", result.key(), result.result());
  }
}
