package net.evloop.core.data;

import org.immutables.value.Value;

@Value.Immutable
public interface EventResult {
  @Value.Parameter
  String key();

  @Value.Parameter
  String result();

  static EventResult of(String key, String result) {
    return ImmutableEventResult.of(key, result);
  }
}
