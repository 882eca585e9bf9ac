package net.evloop.core.data;

import com.google.common.base.Preconditions;
import org.immutables.value.Value;

/**
 * A unit of submitted work. The {@link #key()} selects the handler, the {@link #payload()} is
 * passed to it, and the {@link #mode()} decides whether it runs inline or on a worker.
 */
@Value.Immutable
public interface Event {
  @Value.Parameter
  String key();

  @Value.Parameter
  String payload();

  @Value.Parameter
  Mode mode();

  default boolean isAsync() {
    return mode() == Mode.ASYNC;
  }

  @Value.Check
  default void check() {
    Preconditions.checkArgument(!key().isEmpty(), "event key must not be empty");
  }

  static Event sync(String key, String payload) {
    return ImmutableEvent.of(key, payload, Mode.SYNC);
  }

  static Event async(String key, String payload) {
    return ImmutableEvent.of(key, payload, Mode.ASYNC);
  }

  enum Mode {
    // Runs on the driver thread, blocking it for the duration of the handler.
    SYNC,
    // Runs on a worker. The result arrives later through the completed queue.
    ASYNC
  }
}
