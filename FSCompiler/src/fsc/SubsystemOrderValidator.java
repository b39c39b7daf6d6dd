package fsc;

import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graphs;

/**
 * Checks that subsystems are initialized before use on every path, initialized at most once per
 * path and not used after they are explicitly released. Runs on acyclic graphs only.
 */
final class SubsystemOrderValidator extends ErrorCollectingValidator {
  private final BlockRegistry registry;
  private final String entryBlock;

  SubsystemOrderValidator(BlockRegistry registry, String entryBlock) {
    this.registry = registry;
    this.entryBlock = entryBlock;
  }

  @Override
  void validate(BlockGraph graph) {
    Dominators<String> dominators = new Dominators<>(graph.flowGraph(), entryBlock);
    ImmutableList<String> reachable =
        graph
            .blocks()
            .stream()
            .map(Block::id)
            .distinct()
            .filter(dominators::isReachable)
            .collect(ImmutableList.toImmutableList());

    for (String blockId : reachable) {
      Optional<BlockKind> kind = kindOf(graph, blockId);
      if (!kind.isPresent()) continue;

      for (String subsystem : kind.get().dependencies()) {
        boolean dominated =
            initsOf(graph, reachable, subsystem)
                .stream()
                .anyMatch(init -> dominators.dominates(init, blockId));
        if (!dominated)
          logError(
              Diagnostic.Kind.INIT_DOES_NOT_DOMINATE,
              blockId,
              String.format(
                  "'%s' uses subsystem '%s', which is not initialized on every path reaching it",
                  blockId, subsystem));
      }

      if (kind.get().initializes().isPresent()) {
        String subsystem = kind.get().initializes().get();
        initsOf(graph, reachable, subsystem)
            .stream()
            .filter(init -> dominators.strictlyDominates(init, blockId))
            .findFirst()
            .ifPresent(
                init ->
                    logError(
                        Diagnostic.Kind.DUPLICATE_INIT,
                        blockId,
                        String.format(
                            "subsystem '%s' is already initialized by '%s'", subsystem, init)));
      }
    }

    checkReleases(graph, reachable);
  }

  private void checkReleases(BlockGraph graph, ImmutableList<String> reachable) {
    for (String releaseId : reachable) {
      Optional<String> released =
          kindOf(graph, releaseId).flatMap(k -> k.template().releases());
      if (!released.isPresent()) continue;

      Set<String> after = Graphs.reachableNodes(graph.flowGraph(), releaseId);
      for (String blockId : reachable) {
        if (blockId.equals(releaseId) || !after.contains(blockId)) continue;
        Optional<BlockKind> kind = kindOf(graph, blockId);
        if (kind.isPresent() && kind.get().dependencies().contains(released.get()))
          logError(
              Diagnostic.Kind.USE_AFTER_RELEASE,
              blockId,
              String.format(
                  "'%s' uses subsystem '%s' after '%s' released it",
                  blockId, released.get(), releaseId));
      }
    }
  }

  private ImmutableList<String> initsOf(
      BlockGraph graph, ImmutableList<String> reachable, String subsystem) {
    return reachable
        .stream()
        .filter(
            id ->
                kindOf(graph, id)
                    .flatMap(BlockKind::initializes)
                    .filter(subsystem::equals)
                    .isPresent())
        .collect(ImmutableList.toImmutableList());
  }

  private Optional<BlockKind> kindOf(BlockGraph graph, String blockId) {
    return graph.block(blockId).flatMap(b -> registry.find(b.kindId()));
  }
}
