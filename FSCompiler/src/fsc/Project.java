package fsc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** Everything one compilation consumes. Metadata is carried through untouched. */
@AutoValue
public abstract class Project {

  public abstract ImmutableMap<String, Object> metadata();

  public abstract Manifest manifest();

  public abstract BlockGraph graph();

  public static Project create(Manifest manifest, BlockGraph graph) {
    return create(ImmutableMap.of(), manifest, graph);
  }

  public static Project create(
      ImmutableMap<String, Object> metadata, Manifest manifest, BlockGraph graph) {
    return new AutoValue_Project(metadata, manifest, graph);
  }
}
