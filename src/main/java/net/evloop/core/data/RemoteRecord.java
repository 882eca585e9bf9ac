package net.evloop.core.data;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A post as served by the remote record API.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRemoteRecord.class)
@JsonDeserialize(as = ImmutableRemoteRecord.class)
public interface RemoteRecord {
  long id();

  long userId();

  String title();

  String body();
}
