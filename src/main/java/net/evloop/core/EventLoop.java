package net.evloop.core;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import net.evloop.core.data.Event;
import net.evloop.core.data.EventResult;
import net.evloop.core.data.ImmutableLoopStats;
import net.evloop.core.data.LoopStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative event loop. Callers {@link #register register} handlers, {@link #submit submit}
 * events and then drive the loop forward by calling {@link #tick()}.
 *
 * <p>Each tick dispatches at most one pending event and emits at most one completed asynchronous
 * result, regardless of how many are waiting. The loop never blocks waiting for asynchronous
 * work; only synchronous handlers block the calling thread.
 *
 * <p>{@code tick()} is intended to be called from a single driver thread. {@code register} and
 * {@code submit} may be called from any thread.
 */
public class EventLoop {
  private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

  private final HandlerRegistry registry = new HandlerRegistry();
  private final FifoQueue<Event> pending = new FifoQueue<>();

  @VisibleForTesting
  final FifoQueue<EventResult> completed = new FifoQueue<>();

  private final ExecutionEngine engine;
  private final OutputSink sink;
  private final DispatchOptions options;

  public EventLoop(ExecutionEngine engine, OutputSink sink) {
    this(engine, sink, DispatchOptions.DEFAULT);
  }

  public EventLoop(ExecutionEngine engine, OutputSink sink, DispatchOptions options) {
    this.engine = Preconditions.checkNotNull(engine);
    this.sink = Preconditions.checkNotNull(sink);
    this.options = Preconditions.checkNotNull(options);
  }

  public EventLoop register(String key, Handler handler) {
    registry.register(key, handler);
    return this;
  }

  public EventLoop submit(Event event) {
    pending.enqueue(event);
    return this;
  }

  /**
   * Runs one step of the loop: dispatches the oldest pending event, if any, then emits the
   * oldest completed asynchronous result, if any.
   *
   * @throws net.evloop.core.exceptions.OutputSinkException if the output sink fails
   */
  public TickReport tick() {
    var report = ImmutableTickReport.builder();

    var maybeEvent = pending.dequeue();
    if (maybeEvent.isPresent()) {
      var event = maybeEvent.get();
      log.info("Received Event: {}", event.key());

      var dispatch = engine.execute(event, registry, completed, options);
      dispatch.result().ifPresent(sink::emit);

      if (dispatch.outcome() != Dispatch.Outcome.NO_HANDLER) {
        log.info("Event loop was blocked for {} ms due to this operation",
            dispatch.elapsed().toMillis());
      }

      report.dispatch(dispatch);
    }

    var maybeResult = completed.dequeue();
    if (maybeResult.isPresent()) {
      var result = maybeResult.get();
      sink.emit(result);
      report.drained(result);
    }

    return report.build();
  }

  public LoopStats stats() {
    return ImmutableLoopStats.builder()
        .pendingCount(pending.size())
        .completedCount(completed.size())
        .inFlightCount(engine.inFlightCount())
        .build();
  }
}
