package fsc;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** How one block kind renders into C. Lines may reference {@code ${placeholder}}s. */
@AutoValue
public abstract class CodeTemplate {
  static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

  /** Placeholder for the manifest application id. */
  public static final String APP = "app";

  /** Placeholder for an identifier unique to the block instance. */
  public static final String ID = "id";

  public static final ImmutableSet<String> BUILTINS = ImmutableSet.of(APP, ID);

  /** A resource acquired by the block, with the lines that release it. */
  @AutoValue
  public abstract static class Acquisition {
    public abstract String resourceKey();

    public abstract ImmutableList<String> teardown();

    public static Acquisition create(String resourceKey, Iterable<String> teardown) {
      return new AutoValue_CodeTemplate_Acquisition(resourceKey, ImmutableList.copyOf(teardown));
    }
  }

  public abstract ImmutableList<String> statements();

  public abstract ImmutableList<Declaration> declarations();

  /** Condition expression per output connector; the last output of a branch is the else arm. */
  public abstract ImmutableMap<String, String> conditions();

  public abstract Optional<Acquisition> acquires();

  public abstract Optional<String> releases();

  public final Optional<String> condition(String outputConnector) {
    return Optional.ofNullable(conditions().get(outputConnector));
  }

  @Memoized
  public ImmutableSet<String> placeholders() {
    return Stream.of(
            statements().stream(),
            declarations().stream().flatMap(d -> d.lines().stream()),
            conditions().values().stream(),
            acquires().map(a -> a.teardown().stream()).orElse(Stream.empty()))
        .flatMap(s -> s)
        .flatMap(CodeTemplate::placeholdersIn)
        .collect(ImmutableSet.toImmutableSet());
  }

  private static Stream<String> placeholdersIn(String line) {
    Stream.Builder<String> names = Stream.builder();
    Matcher m = PLACEHOLDER.matcher(line);
    while (m.find()) names.add(m.group(1));
    return names.build();
  }

  public static CodeTemplate empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CodeTemplate.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ImmutableList.Builder<String> statementsBuilder();

    public abstract ImmutableList.Builder<Declaration> declarationsBuilder();

    public abstract ImmutableMap.Builder<String, String> conditionsBuilder();

    public abstract Builder setAcquires(Acquisition acquires);

    public abstract Builder setReleases(String resourceKey);

    public final Builder addStatement(String line) {
      statementsBuilder().add(line);
      return this;
    }

    public final Builder addDeclaration(Declaration declaration) {
      declarationsBuilder().add(declaration);
      return this;
    }

    public final Builder putCondition(String outputConnector, String expression) {
      conditionsBuilder().put(outputConnector, expression);
      return this;
    }

    public abstract CodeTemplate build();
  }
}
