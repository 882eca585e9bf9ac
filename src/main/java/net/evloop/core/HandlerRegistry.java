package net.evloop.core;

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps event keys to handlers. Registering under an existing key replaces the previous handler.
 */
public class HandlerRegistry {
  private final Map<String, Handler> handlers = new HashMap<>();

  public synchronized void register(String key, Handler handler) {
    Preconditions.checkNotNull(key, "key");
    Preconditions.checkNotNull(handler, "handler");
    handlers.put(key, handler);
  }

  public synchronized Optional<Handler> lookup(String key) {
    return Optional.ofNullable(handlers.get(key));
  }

  public synchronized int size() {
    return handlers.size();
  }
}
