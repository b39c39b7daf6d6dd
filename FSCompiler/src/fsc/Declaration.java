package fsc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A program-level declaration requested by a block template. Declarations sharing a key are
 * emitted once; the key identifies the declared entity, so two declarations with the same key must
 * render identically.
 */
@AutoValue
public abstract class Declaration {

  public enum Kind {
    INCLUDE,
    FIELD,
    FUNCTION;
  }

  public abstract String key();

  public abstract Kind kind();

  public abstract ImmutableList<String> lines();

  public static Declaration create(String key, Kind kind, Iterable<String> lines) {
    return new AutoValue_Declaration(key, kind, ImmutableList.copyOf(lines));
  }

  public static Declaration create(String key, Kind kind, String line) {
    return create(key, kind, ImmutableList.of(line));
  }
}
