package net.evloop.core;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.google.common.base.MoreObjects;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;
import net.evloop.core.data.Event;
import net.evloop.core.data.EventResult;

/**
 * Outcome of executing a single event.
 */
public class Dispatch {
  private final Event event;
  private final Outcome outcome;
  @Nullable
  private final EventResult result;
  private final Duration elapsed;
  @Nullable
  private final ExecutionEngine.Handle handle;

  private Dispatch(
      Event event,
      Outcome outcome,
      @Nullable EventResult result,
      Duration elapsed,
      @Nullable ExecutionEngine.Handle handle
  ) {
    this.event = event;
    this.outcome = outcome;
    this.result = result;
    this.elapsed = elapsed;
    this.handle = handle;
  }

  static Dispatch completed(Event event, EventResult result, Duration elapsed) {
    return new Dispatch(event, Outcome.COMPLETED, result, elapsed, null);
  }

  static Dispatch deferred(Event event, ExecutionEngine.Handle handle, Duration elapsed) {
    return new Dispatch(event, Outcome.DEFERRED, null, elapsed, handle);
  }

  static Dispatch noHandler(Event event) {
    return new Dispatch(event, Outcome.NO_HANDLER, null, Duration.ZERO, null);
  }

  public Event event() {
    return event;
  }

  public Outcome outcome() {
    return outcome;
  }

  /**
   * The result of a synchronous execution. Empty for deferred and unhandled events.
   */
  public Optional<EventResult> result() {
    return Optional.ofNullable(result);
  }

  /**
   * Time the dispatching thread was blocked by this execution. Covers the full handler run for
   * synchronous events and only the cost of spawning for asynchronous ones.
   */
  public Duration elapsed() {
    return elapsed;
  }

  /**
   * Completes once the execution has terminated. For asynchronous events this is after the
   * result has been appended to the completed queue, or discarded following cancellation.
   */
  public CompletableFuture<Void> completion() {
    return handle == null ? completedFuture(null) : handle.completion();
  }

  /**
   * Cancels a deferred execution. A task that has not started never runs its handler. A running
   * task is allowed to finish but its result is discarded. Has no effect on synchronous or
   * unhandled events. The returned future completes once the task has terminated.
   */
  public CompletableFuture<Void> cancel() {
    return handle == null ? completedFuture(null) : handle.cancel();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", event.key())
        .add("outcome", outcome)
        .add("elapsed", elapsed)
        .omitNullValues()
        .add("result", result)
        .toString();
  }

  public enum Outcome {
    COMPLETED,
    DEFERRED,
    NO_HANDLER,
  }
}
