package fsc;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * Checks block ids, the entry block, connection endpoints and connector arity. Records the entry
 * block when there is exactly one.
 */
final class StructureValidator extends ErrorCollectingValidator {
  private final BlockRegistry registry;
  private Optional<String> entryBlock = Optional.empty();
  private ImmutableList<Connection> resolvedConnections = ImmutableList.of();

  StructureValidator(BlockRegistry registry) {
    this.registry = registry;
  }

  @Override
  void validate(BlockGraph graph) {
    checkBlockIds(graph);
    checkEntry(graph);
    checkConnections(graph);
  }

  /** The sole entry block, if the graph has exactly one. */
  Optional<String> entryBlock() {
    return entryBlock;
  }

  /** Connections with both endpoints on existing blocks, without repeats. */
  ImmutableList<Connection> resolvedConnections() {
    return resolvedConnections;
  }

  private void checkBlockIds(BlockGraph graph) {
    Set<String> seen = new HashSet<>();
    for (Block block : graph.blocks()) {
      if (!seen.add(block.id()))
        logError(
            Diagnostic.Kind.DUPLICATE_BLOCK_ID,
            block.id(),
            String.format("block id '%s' is used by more than one block", block.id()));
    }
  }

  private void checkEntry(BlockGraph graph) {
    String entryKind = registry.entryKind();
    List<Block> entries =
        graph
            .blocks()
            .stream()
            .filter(b -> b.kindId().equals(entryKind))
            .collect(ImmutableList.toImmutableList());
    if (entries.isEmpty()) {
      logError(
          Diagnostic.Kind.MISSING_ENTRY,
          "graph",
          String.format("the program has no '%s' block", entryKind));
      return;
    }

    Block first = entries.get(0);
    for (Block extra : entries.subList(1, entries.size())) {
      logError(
          Diagnostic.Kind.DUPLICATE_ENTRY,
          extra.id(),
          String.format("the program already starts at '%s'", first.id()));
    }
    for (Block entry : entries) {
      if (!graph.incoming().get(entry.id()).isEmpty())
        logError(
            Diagnostic.Kind.ENTRY_HAS_INPUT,
            entry.id(),
            "the entry block cannot have incoming connections");
    }
    if (entries.size() == 1) entryBlock = Optional.of(first.id());
  }

  private void checkConnections(BlockGraph graph) {
    Set<Connection> seen = new HashSet<>();
    ImmutableList.Builder<Connection> resolved = ImmutableList.builder();
    for (Connection connection : graph.connections()) {
      boolean dangling = false;
      for (ConnectorRef end : ImmutableList.of(connection.source(), connection.destination())) {
        if (!graph.contains(end.blockId())) {
          logError(
              Diagnostic.Kind.DANGLING_CONNECTION,
              connection.id(),
              String.format("connection refers to missing block '%s'", end.blockId()));
          dangling = true;
        }
      }
      if (dangling) continue;

      if (!seen.add(connection)) {
        logError(
            Diagnostic.Kind.DUPLICATE_CONNECTION,
            connection.id(),
            "the same connection appears more than once");
        continue;
      }
      resolved.add(connection);
    }
    resolvedConnections = resolved.build();

    checkArity(resolvedConnections, Connection::destination, "input", "incoming");
    checkArity(resolvedConnections, Connection::source, "output", "outgoing");
  }

  private void checkArity(
      List<Connection> connections,
      Function<Connection, ConnectorRef> end,
      String connectorType,
      String direction) {
    Map<ConnectorRef, Integer> counts = new LinkedHashMap<>();
    for (Connection connection : connections) counts.merge(end.apply(connection), 1, Integer::sum);
    counts.forEach(
        (ref, count) -> {
          if (count > 1)
            logError(
                Diagnostic.Kind.CONNECTOR_ARITY,
                ref.blockId(),
                String.format(
                    "%s '%s' has %d %s connections, at most one is allowed",
                    connectorType, ref.connector(), count, direction));
        });
  }
}
