package net.evloop.core;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.base.Stopwatch;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import net.evloop.core.data.Event;
import net.evloop.core.data.EventResult;
import net.evloop.core.exceptions.EventLoopException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution engine which runs synchronous events on the calling thread and hands asynchronous
 * events to an {@link Executor}.
 */
public class ExecutorExecutionEngine implements ExecutionEngine {
  private static final Logger log = LoggerFactory.getLogger(ExecutorExecutionEngine.class);

  private static final Histogram handlerTime = Histogram.build()
      .name("evloop_handler_duration_seconds")
      .help("time spent running event handlers")
      .labelNames("mode")
      .buckets(
          100e-6, 500e-6,
          1e-3, 5e-3,
          10e-3, 50e-3,
          100e-3, 500e-3,
          1, 5, 10)
      .register();

  private static final Counter dispatches = Counter.build()
      .name("evloop_dispatch_total")
      .help("number of dispatched events")
      .labelNames("outcome")
      .register();

  private final Executor executor;
  private final AtomicLong inFlight = new AtomicLong();

  public ExecutorExecutionEngine(Executor executor) {
    this.executor = executor;
  }

  @Override
  public Dispatch execute(
      Event event,
      HandlerRegistry registry,
      FifoQueue<EventResult> completed,
      DispatchOptions options
  ) {
    var maybeHandler = registry.lookup(event.key());
    if (maybeHandler.isEmpty()) {
      log.info("No handler found for {}", event.key());
      dispatches.labels(Dispatch.Outcome.NO_HANDLER.name()).inc();
      return Dispatch.noHandler(event);
    }

    var handler = maybeHandler.get();
    var sw = Stopwatch.createStarted();

    if (event.isAsync()) {
      var task = new AsyncTask(event, handler, completed);
      inFlight.incrementAndGet();
      try {
        executor.execute(task);
      } catch (RejectedExecutionException e) {
        inFlight.decrementAndGet();
        throw new EventLoopException("executor rejected async event " + event.key(), e);
      }
      options.deadline().ifPresent(task::expireAfter);
      dispatches.labels(Dispatch.Outcome.DEFERRED.name()).inc();
      return Dispatch.deferred(event, task, sw.stop().elapsed());
    }

    var result = invoke(event, handler);
    dispatches.labels(Dispatch.Outcome.COMPLETED.name()).inc();
    return Dispatch.completed(event, result, sw.stop().elapsed());
  }

  @Override
  public long inFlightCount() {
    return inFlight.get();
  }

  private static EventResult invoke(Event event, Handler handler) {
    var timer = handlerTime.labels(event.mode().name()).startTimer();
    String result;
    try {
      result = handler.handle(event.payload());
    } catch (RuntimeException e) {
      log.warn("Handler failed; key={}", event.key(), e);
      result = "Error running handler: " + e;
    } finally {
      timer.observeDuration();
    }

    return EventResult.of(event.key(), result == null ? "" : result);
  }

  private class AsyncTask implements Handle, Runnable {
    private final Event event;
    private final Handler handler;
    private final FifoQueue<EventResult> completed;

    private TaskState state = TaskState.SCHEDULED;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private AsyncTask(Event event, Handler handler, FifoQueue<EventResult> completed) {
      this.event = event;
      this.handler = handler;
      this.completed = completed;
    }

    private void expireAfter(Duration deadline) {
      var delayed = CompletableFuture.delayedExecutor(deadline.toMillis(), MILLISECONDS);
      delayed.execute(() -> {
        if (!terminated.isDone()) {
          log.warn("Async event exceeded its deadline, result will be discarded; key={}, "
              + "deadline={}", event.key(), deadline);
          cancel();
        }
      });
    }

    @Override
    public CompletableFuture<Void> completion() {
      return terminated.copy();
    }

    @Override
    public synchronized CompletableFuture<Void> cancel() {
      switch (state) {
        case SCHEDULED:
          // Never started. If the executor still runs us, run() observes the cancellation.
          state = TaskState.CANCELED;
          inFlight.decrementAndGet();
          terminated.complete(null);
          break;

        case RUNNING:
          // Allowed to finish. run() discards the result and signals termination.
          state = TaskState.CANCELED;
          break;

        case COMPLETED:
        case CANCELED:
          // No-op.
          break;
      }

      return terminated.copy();
    }

    @Override
    public void run() {
      synchronized (this) {
        if (state == TaskState.CANCELED) {
          return;
        }

        state = TaskState.RUNNING;
      }

      try {
        var result = invoke(event, handler);

        synchronized (this) {
          if (state == TaskState.CANCELED) {
            log.info("Discarding result of canceled event {}", event.key());
          } else {
            completed.enqueue(result);
            state = TaskState.COMPLETED;
          }
          inFlight.decrementAndGet();
          terminated.complete(null);
        }
      } catch (Error e) {
        synchronized (this) {
          state = TaskState.CANCELED;
          inFlight.decrementAndGet();
          terminated.completeExceptionally(e);
        }
        throw e;
      }
    }
  }

  private enum TaskState {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    CANCELED,
  }
}
