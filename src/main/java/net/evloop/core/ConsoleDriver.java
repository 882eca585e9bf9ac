package net.evloop.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Set;
import javax.annotation.Nullable;
import net.evloop.core.data.Event;
import net.evloop.core.data.ImmutableEvent;
import net.evloop.core.handlers.KeyGenerator;

/**
 * Interactive menu driving an {@link EventLoop}. Every accepted menu choice other than exit
 * submits at most one event and then ticks the loop exactly once.
 */
public class ConsoleDriver {
  static final String GREETING_PAYLOAD = "How are you doing today?";
  static final String FILE_NAME = "hello.txt";
  static final String RECORD_ID = "2";

  private static final Set<String> TASK_CHOICES = Set.of("1", "2", "3", "4", "5");
  private static final Set<String> MODE_CHOICES = Set.of("1", "2");

  private final BufferedReader in;
  private final PrintStream out;
  private final EventLoop loop;
  private final KeyGenerator keys;
  private final Handler fileHandler;
  private final Handler fetchHandler;

  public ConsoleDriver(
      BufferedReader in,
      PrintStream out,
      EventLoop loop,
      KeyGenerator keys,
      Handler fileHandler,
      Handler fetchHandler
  ) {
    this.in = in;
    this.out = out;
    this.loop = loop;
    this.keys = keys;
    this.fileHandler = fileHandler;
    this.fetchHandler = fetchHandler;
  }

  /**
   * Runs the menu until the user exits or input ends.
   */
  public void run() throws IOException {
    while (true) {
      var choice = promptTask();
      if (choice == null || choice.equals("5")) {
        return;
      }

      // "4" only ticks the loop so a previously submitted async result can be printed.
      if (!choice.equals("4")) {
        var mode = promptMode();
        if (mode == null) {
          return;
        }
        submit(choice, mode);
      }

      loop.tick();
    }
  }

  private void submit(String choice, Event.Mode mode) {
    switch (choice) {
      case "1": {
        var key = keys.next("hello");
        loop.register(key, payload -> "Hello! " + payload)
            .submit(ImmutableEvent.of(key, GREETING_PAYLOAD, mode));
        break;
      }
      case "2": {
        var key = keys.next("read-file");
        loop.register(key, fileHandler)
            .submit(ImmutableEvent.of(key, FILE_NAME, mode));
        break;
      }
      case "3": {
        var key = keys.next("fetch-from-api");
        loop.register(key, fetchHandler)
            .submit(ImmutableEvent.of(key, RECORD_ID, mode));
        break;
      }
      default:
        throw new IllegalArgumentException("unexpected choice: " + choice);
    }
  }

  @Nullable
  private String promptTask() throws IOException {
    while (true) {
      out.println("What kind of task would you like to submit to the Event Loop?");
      out.println(" 1. Wish me Hello");
      out.println(" 2. Print the contents of a file named " + FILE_NAME);
      out.println(" 3. Retrieve data from API & print it");
      out.println(" 4. Print output of previously submitted Async task");
      out.println(" 5. Exit!");
      out.print(" > ");
      out.flush();

      var line = in.readLine();
      if (line == null) {
        return null;
      }

      var choice = line.strip();
      if (TASK_CHOICES.contains(choice)) {
        return choice;
      }
      out.println("Invalid input. Please select a valid option (1-5).");
    }
  }

  @Nullable
  private Event.Mode promptMode() throws IOException {
    while (true) {
      out.println("How would you like to execute this operation?");
      out.println(" 1. Synchronously (this would block the Event Loop until the operation "
          + "completes)");
      out.println(" 2. Asynchronously (this won't block Event Loop in any way)");
      out.print(" > ");
      out.flush();

      var line = in.readLine();
      if (line == null) {
        return null;
      }

      var choice = line.strip();
      if (MODE_CHOICES.contains(choice)) {
        return choice.equals("2") ? Event.Mode.ASYNC : Event.Mode.SYNC;
      }
      out.println("Invalid input. Please select a valid option (1 or 2).");
    }
  }
}
