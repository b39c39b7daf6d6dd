package fsc;

import java.io.IOException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Immutable catalog of block kinds, looked up by kind id. Built once and shared by every
 * compilation.
 */
public final class BlockRegistry {
  private static final String STANDARD_CATALOG = "blocks.json";

  private final ImmutableMap<String, BlockKind> kindsById;
  private final String entryKind;

  private BlockRegistry(ImmutableMap<String, BlockKind> kindsById) {
    this.kindsById = kindsById;
    this.entryKind = findEntryKind(kindsById.values());
  }

  private static String findEntryKind(Iterable<BlockKind> kinds) {
    ImmutableList<String> entries =
        ImmutableList.copyOf(kinds)
            .stream()
            .filter(BlockKind::entry)
            .map(BlockKind::kindId)
            .collect(ImmutableList.toImmutableList());
    if (entries.size() != 1)
      throw new RegistryMisconfiguredException(
          String.format("expected exactly one entry kind, found %s", entries));
    return entries.get(0);
  }

  public BlockKind lookup(String kindId) throws UnknownBlockKindException {
    BlockKind kind = kindsById.get(kindId);
    if (kind == null) throw new UnknownBlockKindException(kindId);
    return kind;
  }

  public Optional<BlockKind> find(String kindId) {
    return Optional.ofNullable(kindsById.get(kindId));
  }

  public String entryKind() {
    return entryKind;
  }

  public ImmutableSet<String> kindIds() {
    return kindsById.keySet();
  }

  public ImmutableList<BlockKind> kinds() {
    return kindsById.values().asList();
  }

  /** Every subsystem some kind initializes. */
  public ImmutableSet<String> subsystems() {
    return kindsById
        .values()
        .stream()
        .flatMap(k -> k.initializes().stream())
        .collect(ImmutableSet.toImmutableSet());
  }

  /** The catalog shipped with the compiler. */
  public static BlockRegistry standard() {
    URL url = Resources.getResource(BlockRegistry.class, STANDARD_CATALOG);
    try {
      return BlockRegistryLoader.load(url);
    } catch (IOException ex) {
      throw new RegistryMisconfiguredException("cannot read the built-in block catalog", ex);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, BlockKind> kindsById = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(BlockKind kind) {
      if (kindsById.putIfAbsent(kind.kindId(), kind) != null)
        throw new RegistryMisconfiguredException(
            String.format("duplicate block kind '%s'", kind.kindId()));
      return this;
    }

    public BlockRegistry build() {
      ImmutableMap<String, BlockKind> kinds = ImmutableMap.copyOf(kindsById);
      ImmutableSet<String> initialized =
          kinds
              .values()
              .stream()
              .flatMap(k -> k.initializes().stream())
              .collect(ImmutableSet.toImmutableSet());
      for (BlockKind kind : kinds.values()) {
        for (String subsystem : kind.dependencies()) {
          if (!initialized.contains(subsystem))
            throw new RegistryMisconfiguredException(
                String.format(
                    "kind '%s' depends on subsystem '%s', which no kind initializes",
                    kind.kindId(), subsystem));
        }
      }
      return new BlockRegistry(kinds);
    }
  }
}
