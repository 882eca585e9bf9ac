package net.evloop.core;

import java.util.concurrent.CompletableFuture;
import net.evloop.core.data.Event;
import net.evloop.core.data.EventResult;

/**
 * Runs the handler for an event, either inline or as an independent concurrent task.
 */
public interface ExecutionEngine {
  /**
   * Executes the given event. Synchronous events run on the calling thread and the returned
   * dispatch carries their result. Asynchronous events are handed off and this method returns
   * immediately; their result is appended to {@code completed} once the handler finishes. If no
   * handler is registered for the event's key nothing is executed.
   *
   * <p>Never throws for handler failures. Those are encoded in the result string.
   */
  Dispatch execute(
      Event event,
      HandlerRegistry registry,
      FifoQueue<EventResult> completed,
      DispatchOptions options);

  /**
   * Number of asynchronous executions that have been started and have not yet terminated.
   */
  long inFlightCount();

  /**
   * Handle for a deferred execution.
   */
  interface Handle {
    CompletableFuture<Void> completion();

    CompletableFuture<Void> cancel();
  }
}
