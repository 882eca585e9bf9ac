package net.evloop.core;

/**
 * Computes a result from an event payload. Handlers are expected to encode failures in the
 * returned string rather than throw.
 */
@FunctionalInterface
public interface Handler {
  String handle(String payload);
}
