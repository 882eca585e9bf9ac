package net.evloop.core;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.time.Duration;
import java.util.concurrent.Executors;
import net.evloop.core.handlers.FileContentHandler;
import net.evloop.core.handlers.KeyGenerator;
import net.evloop.core.handlers.RemoteRecordHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws IOException {
    Thread.setDefaultUncaughtExceptionHandler((thread, ex) -> {
      log.error("Caught unhandled exception. Terminating; thread={}", thread, ex);
      System.exit(1);
    });

    var config = Config.load();
    log.info("Config {}", config);

    var asyncWorkers = Executors.newFixedThreadPool(config.loopAsyncWorkers(),
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("EventLoop-AsyncWorker-%d")
            .build());

    var options = config.loopAsyncDeadline()
        .map(DispatchOptions::withDeadline)
        .orElse(DispatchOptions.DEFAULT);

    var loop = new EventLoop(
        new ExecutorExecutionEngine(asyncWorkers),
        new PrintStreamOutputSink(System.out),
        options);

    var driver = new ConsoleDriver(
        new BufferedReader(new InputStreamReader(System.in, UTF_8)),
        System.out,
        loop,
        new KeyGenerator(),
        new FileContentHandler(config.filesDir(), config.filesPlaceholder()),
        new RemoteRecordHandler(config.fetchBaseUri(), config.fetchConnectTimeout()));

    try {
      driver.run();
    } finally {
      log.info("Shutting down; stats={}", loop.stats());
      MoreExecutors.shutdownAndAwaitTermination(asyncWorkers, Duration.ofSeconds(1));
    }
  }
}
