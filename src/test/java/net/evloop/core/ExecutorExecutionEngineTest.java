package net.evloop.core;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static com.google.common.util.concurrent.Uninterruptibles.awaitUninterruptibly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import net.evloop.core.data.Event;
import net.evloop.core.data.EventResult;
import net.evloop.core.exceptions.EventLoopException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ExecutorExecutionEngineTest {
  private HandlerRegistry registry;
  private FifoQueue<EventResult> completed;
  private ExecutorService pool;

  @Before
  public void setUp() {
    registry = new HandlerRegistry();
    completed = new FifoQueue<>();
    pool = Executors.newCachedThreadPool();
  }

  @After
  public void tearDown() {
    pool.shutdownNow();
  }

  @Test
  public void testExecute_sync() {
    var engine = new ExecutorExecutionEngine(pool);
    registry.register("upper", String::toUpperCase);

    var dispatch = engine.execute(
        Event.sync("upper", "hello"), registry, completed, DispatchOptions.DEFAULT);

    assertThat(dispatch.outcome()).isEqualTo(Dispatch.Outcome.COMPLETED);
    assertThat(dispatch.result()).contains(EventResult.of("upper", "HELLO"));
    assertThat(dispatch.completion()).isDone();
    assertThat(completed.isEmpty()).isTrue();
  }

  @Test
  public void testExecute_noHandler() {
    var engine = new ExecutorExecutionEngine(pool);

    var dispatch = engine.execute(
        Event.async("missing", "x"), registry, completed, DispatchOptions.DEFAULT);

    assertThat(dispatch.outcome()).isEqualTo(Dispatch.Outcome.NO_HANDLER);
    assertThat(dispatch.result()).isEmpty();
    assertThat(dispatch.elapsed()).isEqualTo(Duration.ZERO);
    assertThat(engine.inFlightCount()).isZero();
    assertThat(completed.isEmpty()).isTrue();
  }

  @Test
  public void testExecute_async() {
    var engine = new ExecutorExecutionEngine(pool);
    registry.register("upper", String::toUpperCase);

    var dispatch = engine.execute(
        Event.async("upper", "hello"), registry, completed, DispatchOptions.DEFAULT);
    assertThat(dispatch.outcome()).isEqualTo(Dispatch.Outcome.DEFERRED);
    assertThat(dispatch.result()).isEmpty();

    dispatch.completion().join();
    assertThat(completed.dequeue()).contains(EventResult.of("upper", "HELLO"));
    assertThat(engine.inFlightCount()).isZero();
  }

  @Test
  public void testExecute_handlerThrows() {
    var engine = new ExecutorExecutionEngine(directExecutor());
    registry.register("boom", payload -> {
      throw new IllegalStateException("boom");
    });

    var sync = engine.execute(
        Event.sync("boom", "x"), registry, completed, DispatchOptions.DEFAULT);
    assertThat(sync.result().orElseThrow().result())
        .isEqualTo("Error running handler: java.lang.IllegalStateException: boom");

    var async = engine.execute(
        Event.async("boom", "x"), registry, completed, DispatchOptions.DEFAULT);
    async.completion().join();
    assertThat(completed.dequeue().orElseThrow().result())
        .startsWith("Error running handler:");
  }

  @Test
  public void testExecute_manyAsyncResultsAllAppended() {
    var engine = new ExecutorExecutionEngine(pool);
    registry.register("echo", payload -> payload);

    var completions = new ArrayList<CompletableFuture<Void>>();
    for (int i = 0; i < 500; i++) {
      var dispatch = engine.execute(
          Event.async("echo", Integer.toString(i)), registry, completed, DispatchOptions.DEFAULT);
      completions.add(dispatch.completion());
    }
    CompletableFuture.allOf(completions.toArray(new CompletableFuture<?>[0])).join();

    var payloads = new HashSet<String>();
    while (!completed.isEmpty()) {
      payloads.add(completed.dequeue().orElseThrow().result());
    }
    assertThat(payloads).hasSize(500);
    assertThat(engine.inFlightCount()).isZero();
  }

  @Test
  public void testCancel_beforeStart() {
    List<Runnable> held = new ArrayList<>();
    var engine = new ExecutorExecutionEngine(held::add);
    var invoked = new AtomicBoolean();
    registry.register("k", payload -> {
      invoked.set(true);
      return payload;
    });

    var dispatch = engine.execute(
        Event.async("k", "x"), registry, completed, DispatchOptions.DEFAULT);
    assertThat(engine.inFlightCount()).isEqualTo(1);

    dispatch.cancel().join();
    assertThat(engine.inFlightCount()).isZero();

    // The executor gets around to running the task after it was canceled.
    held.forEach(Runnable::run);
    assertThat(invoked).isFalse();
    assertThat(completed.isEmpty()).isTrue();
    assertThat(dispatch.completion()).isDone();
  }

  @Test
  public void testCancel_whileRunning() throws InterruptedException {
    var engine = new ExecutorExecutionEngine(pool);
    var started = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    registry.register("slow", payload -> {
      started.countDown();
      awaitUninterruptibly(release);
      return payload;
    });

    var dispatch = engine.execute(
        Event.async("slow", "x"), registry, completed, DispatchOptions.DEFAULT);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    var terminated = dispatch.cancel();
    assertThat(terminated).isNotDone();

    release.countDown();
    terminated.join();
    assertThat(completed.isEmpty()).isTrue();
    assertThat(engine.inFlightCount()).isZero();
  }

  @Test
  public void testCancel_afterCompletionIsNoOp() {
    var engine = new ExecutorExecutionEngine(directExecutor());
    registry.register("k", payload -> payload);

    var dispatch = engine.execute(
        Event.async("k", "x"), registry, completed, DispatchOptions.DEFAULT);
    dispatch.cancel().join();

    assertThat(completed.dequeue()).contains(EventResult.of("k", "x"));
  }

  @Test
  public void testDeadline_discardsLateResult() throws InterruptedException {
    var engine = new ExecutorExecutionEngine(pool);
    var release = new CountDownLatch(1);
    registry.register("slow", payload -> {
      awaitUninterruptibly(release);
      return payload;
    });

    var dispatch = engine.execute(
        Event.async("slow", "x"),
        registry,
        completed,
        DispatchOptions.withDeadline(Duration.ofMillis(50)));

    Thread.sleep(500);
    release.countDown();
    dispatch.completion().join();

    assertThat(completed.isEmpty()).isTrue();
    assertThat(engine.inFlightCount()).isZero();
  }

  @Test
  public void testDeadline_measuredFromDispatch() {
    List<Runnable> held = new ArrayList<>();
    var engine = new ExecutorExecutionEngine(held::add);
    var invoked = new AtomicBoolean();
    registry.register("k", payload -> {
      invoked.set(true);
      return payload;
    });

    var dispatch = engine.execute(
        Event.async("k", "x"),
        registry,
        completed,
        DispatchOptions.withDeadline(Duration.ofMillis(50)));

    // Expires while still waiting for a worker.
    dispatch.completion().join();
    assertThat(engine.inFlightCount()).isZero();

    held.forEach(Runnable::run);
    assertThat(invoked).isFalse();
    assertThat(completed.isEmpty()).isTrue();
  }

  @Test
  public void testDeadline_notReached() {
    var engine = new ExecutorExecutionEngine(pool);
    registry.register("fast", payload -> payload);

    var dispatch = engine.execute(
        Event.async("fast", "x"),
        registry,
        completed,
        DispatchOptions.withDeadline(Duration.ofSeconds(30)));
    dispatch.completion().join();

    assertThat(completed.dequeue()).contains(EventResult.of("fast", "x"));
  }

  @Test
  public void testExecute_rejected() {
    var engine = new ExecutorExecutionEngine(command -> {
      throw new RejectedExecutionException("shut down");
    });
    registry.register("k", payload -> payload);

    assertThatThrownBy(() -> engine.execute(
        Event.async("k", "x"), registry, completed, DispatchOptions.DEFAULT))
        .isInstanceOf(EventLoopException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
    assertThat(engine.inFlightCount()).isZero();
  }

  @Test
  public void testDispatchOptions_nonPositiveDeadline() {
    assertThatThrownBy(() -> DispatchOptions.withDeadline(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
