package fsc;

import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** One placed instance of a block kind. */
@AutoValue
public abstract class Block {

  public abstract String id();

  public abstract String kindId();

  /** Values are String, Long, Double or Boolean; anything else is a schema error. */
  public abstract ImmutableMap<String, Object> properties();

  public final Optional<Object> property(String name) {
    return Optional.ofNullable(properties().get(name));
  }

  public static Block create(String id, String kindId, Map<String, ?> properties) {
    return new AutoValue_Block(id, kindId, ImmutableMap.<String, Object>copyOf(properties));
  }

  public static Block create(String id, String kindId) {
    return create(id, kindId, ImmutableMap.of());
  }
}
