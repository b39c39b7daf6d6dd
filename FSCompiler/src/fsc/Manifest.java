package fsc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Application manifest: identity, entry symbol and declared subsystem requirements. */
@AutoValue
public abstract class Manifest {

  public abstract String name();

  /** Application id. Also prefixes the generated C symbols. */
  public abstract String appid();

  public abstract String version();

  public abstract String entryPoint();

  public abstract ImmutableList<String> requires();

  public abstract long stackSize();

  public abstract Optional<String> icon();

  public abstract Builder toBuilder();

  public static Manifest defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_Manifest.Builder()
        .setName("New Flipper App")
        .setAppid("new_flipper_app")
        .setVersion("1.0")
        .setEntryPoint("app_main")
        .setRequires(ImmutableList.of("gui"))
        .setStackSize(1024);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setAppid(String appid);

    public abstract Builder setVersion(String version);

    public abstract Builder setEntryPoint(String entryPoint);

    public abstract Builder setRequires(Iterable<String> requires);

    public final Builder setRequires(String... requires) {
      return setRequires(ImmutableList.copyOf(requires));
    }

    public abstract Builder setStackSize(long stackSize);

    public abstract Builder setIcon(String icon);

    public abstract Manifest build();
  }
}
