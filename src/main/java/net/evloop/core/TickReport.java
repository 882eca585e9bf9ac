package net.evloop.core;

import java.util.Optional;
import net.evloop.core.data.EventResult;
import org.immutables.value.Value;

/**
 * What a single {@link EventLoop#tick()} did.
 */
@Value.Immutable
public interface TickReport {
  TickReport IDLE = ImmutableTickReport.builder().build();

  /**
   * The event taken from the pending queue, if any.
   */
  Optional<Dispatch> dispatch();

  /**
   * The asynchronous result taken from the completed queue and emitted, if any.
   */
  Optional<EventResult> drained();

  default boolean isIdle() {
    return dispatch().isEmpty() && drained().isEmpty();
  }
}
