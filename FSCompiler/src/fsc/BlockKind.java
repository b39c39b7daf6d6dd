package fsc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.ForOverride;

/** The contract of one kind of block: connectors, property schema and code template. */
@AutoValue
public abstract class BlockKind {

  public abstract String kindId();

  public abstract String name();

  public abstract String category();

  public abstract String description();

  public abstract ImmutableList<String> inputs();

  public abstract ImmutableList<String> outputs();

  public abstract ImmutableMap<String, PropertySpec> properties();

  /** The program's starting block. Exactly one kind in a registry has this set. */
  public abstract boolean entry();

  /** Ends the program; teardowns are emitted ahead of its statements. */
  public abstract boolean exit();

  /** Subsystem brought up by this kind. */
  public abstract Optional<String> initializes();

  /** Subsystems that must be initialized on every path reaching this kind. */
  public abstract ImmutableSet<String> requires();

  public abstract CodeTemplate template();

  public final boolean isBranch() {
    return outputs().size() > 1;
  }

  public final boolean hasInput(String connector) {
    return inputs().contains(connector);
  }

  public final boolean hasOutput(String connector) {
    return outputs().contains(connector);
  }

  public final Optional<PropertySpec> property(String name) {
    return Optional.ofNullable(properties().get(name));
  }

  /** Subsystems needed before this kind, counting the one an explicit release closes. */
  @Memoized
  public ImmutableSet<String> dependencies() {
    return ImmutableSet.<String>builder()
        .addAll(requires())
        .addAll(template().releases().map(ImmutableSet::of).orElse(ImmutableSet.of()))
        .build();
  }

  public static Builder builder(String kindId) {
    return new AutoValue_BlockKind.Builder()
        .setKindId(kindId)
        .setName(kindId)
        .setCategory("")
        .setDescription("")
        .setEntry(false)
        .setExit(false)
        .setTemplate(CodeTemplate.empty());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setKindId(String kindId);

    public abstract Builder setName(String name);

    public abstract Builder setCategory(String category);

    public abstract Builder setDescription(String description);

    public abstract ImmutableList.Builder<String> inputsBuilder();

    public abstract ImmutableList.Builder<String> outputsBuilder();

    public abstract ImmutableMap.Builder<String, PropertySpec> propertiesBuilder();

    public abstract Builder setEntry(boolean entry);

    public abstract Builder setExit(boolean exit);

    public abstract Builder setInitializes(String subsystem);

    public abstract ImmutableSet.Builder<String> requiresBuilder();

    public abstract Builder setTemplate(CodeTemplate template);

    public final Builder addInput(String connector) {
      inputsBuilder().add(connector);
      return this;
    }

    public final Builder addOutput(String connector) {
      outputsBuilder().add(connector);
      return this;
    }

    public final Builder addProperty(PropertySpec spec) {
      propertiesBuilder().put(spec.name(), spec);
      return this;
    }

    public final Builder addRequirement(String subsystem) {
      requiresBuilder().add(subsystem);
      return this;
    }

    @ForOverride
    abstract BlockKind autoBuild();

    public final BlockKind build() {
      BlockKind kind = autoBuild();
      if (kind.entry() && !kind.inputs().isEmpty())
        throw new RegistryMisconfiguredException(
            String.format("entry kind '%s' must not declare inputs", kind.kindId()));
      if (kind.exit() && !kind.outputs().isEmpty())
        throw new RegistryMisconfiguredException(
            String.format("exit kind '%s' must not declare outputs", kind.kindId()));
      if (ImmutableSet.copyOf(kind.inputs()).size() != kind.inputs().size()
          || ImmutableSet.copyOf(kind.outputs()).size() != kind.outputs().size())
        throw new RegistryMisconfiguredException(
            String.format("kind '%s' declares a connector twice", kind.kindId()));
      checkConditions(kind);
      checkTemplate(kind);
      return kind;
    }

    private static void checkConditions(BlockKind kind) {
      CodeTemplate template = kind.template();
      if (!kind.isBranch()) {
        if (!template.conditions().isEmpty())
          throw new RegistryMisconfiguredException(
              String.format("kind '%s' has conditions but is not a branch", kind.kindId()));
        return;
      }

      ImmutableList<String> outputs = kind.outputs();
      for (int i = 0; i < outputs.size() - 1; i++) {
        if (!template.condition(outputs.get(i)).isPresent())
          throw new RegistryMisconfiguredException(
              String.format(
                  "branch kind '%s' has no condition for output '%s'",
                  kind.kindId(), outputs.get(i)));
      }
      if (template.condition(outputs.get(outputs.size() - 1)).isPresent())
        throw new RegistryMisconfiguredException(
            String.format(
                "the last output of branch kind '%s' is its else arm and takes no condition",
                kind.kindId()));
      for (String connector : template.conditions().keySet()) {
        if (!kind.hasOutput(connector))
          throw new RegistryMisconfiguredException(
              String.format(
                  "kind '%s' has a condition for unknown output '%s'",
                  kind.kindId(), connector));
      }
    }

    private static void checkTemplate(BlockKind kind) {
      for (String name : kind.properties().keySet()) {
        if (CodeTemplate.BUILTINS.contains(name))
          throw new RegistryMisconfiguredException(
              String.format("kind '%s' property '%s' shadows a built-in", kind.kindId(), name));
      }
      for (String placeholder : kind.template().placeholders()) {
        if (!CodeTemplate.BUILTINS.contains(placeholder)
            && !kind.properties().containsKey(placeholder))
          throw new RegistryMisconfiguredException(
              String.format(
                  "template of kind '%s' references unknown placeholder '${%s}'",
                  kind.kindId(), placeholder));
        PropertySpec spec = kind.properties().get(placeholder);
        if (spec != null && !spec.required() && !spec.defaultValue().isPresent())
          throw new RegistryMisconfiguredException(
              String.format(
                  "template of kind '%s' uses optional property '%s', which has no default",
                  kind.kindId(), placeholder));
      }
      kind.template()
          .acquires()
          .filter(a -> a.teardown().isEmpty())
          .ifPresent(
              a -> {
                throw new RegistryMisconfiguredException(
                    String.format(
                        "kind '%s' acquires '%s' without a teardown",
                        kind.kindId(), a.resourceKey()));
              });
      for (PropertySpec spec : kind.properties().values()) {
        if (!spec.defaultValue().isPresent()) continue;
        try {
          spec.check(kind.kindId(), spec.defaultValue().get());
        } catch (DiagnosticException ex) {
          throw new RegistryMisconfiguredException(
              String.format("default of kind '%s': %s", kind.kindId(), ex.getMessage()), ex);
        }
      }
    }
  }
}
