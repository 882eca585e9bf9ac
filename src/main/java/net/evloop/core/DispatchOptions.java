package net.evloop.core;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Per-dispatch hints for asynchronous execution. Ignored for synchronous events.
 */
@Value.Immutable
public interface DispatchOptions {
  DispatchOptions DEFAULT = ImmutableDispatchOptions.builder().build();

  /**
   * Upper bound on the time from dispatch until an asynchronous task completes, including time
   * spent waiting for a worker. A task still queued when the deadline passes never runs. One still
   * running is allowed to finish but its result is discarded. Absent means unbounded.
   */
  Optional<Duration> deadline();

  @Value.Check
  default void check() {
    deadline().ifPresent(d ->
        Preconditions.checkArgument(!d.isNegative() && !d.isZero(), "deadline must be positive"));
  }

  static DispatchOptions withDeadline(Duration deadline) {
    return ImmutableDispatchOptions.builder().deadline(deadline).build();
  }
}
