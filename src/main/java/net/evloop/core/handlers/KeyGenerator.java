package net.evloop.core.handlers;

import com.google.common.base.Preconditions;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates event keys of the form {@code "{base}-{counter}"}. The counter is shared across
 * bases, so keys from one generator never repeat.
 */
public class KeyGenerator {
  private final AtomicLong counter;

  public KeyGenerator() {
    this(0);
  }

  public KeyGenerator(long start) {
    Preconditions.checkArgument(start >= 0, "start must be non-negative");
    counter = new AtomicLong(start);
  }

  public static String key(String base, long counter) {
    return base + "-" + counter;
  }

  public String next(String base) {
    Preconditions.checkNotNull(base);
    return key(base, counter.getAndIncrement());
  }
}
