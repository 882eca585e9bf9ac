package net.evloop.core.data;

import org.immutables.value.Value;

@Value.Immutable
public interface LoopStats {
  long pendingCount();

  long completedCount();

  long inFlightCount();
}
