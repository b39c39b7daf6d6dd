package fsc;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** Checks that every block names a registered kind and every connection a declared connector. */
final class SchemaValidator extends ErrorCollectingValidator {
  private final BlockRegistry registry;
  private final ImmutableList<Connection> connections;

  SchemaValidator(BlockRegistry registry, ImmutableList<Connection> connections) {
    this.registry = registry;
    this.connections = connections;
  }

  @Override
  void validate(BlockGraph graph) {
    for (Block block : graph.blocks()) {
      if (!registry.find(block.kindId()).isPresent())
        logError(
            Diagnostic.Kind.UNKNOWN_BLOCK_KIND,
            block.id(),
            String.format("unknown block kind '%s'", block.kindId()));
    }

    for (Connection connection : connections) {
      checkEnd(graph, connection, connection.source());
      checkEnd(graph, connection, connection.destination());
    }
  }

  private void checkEnd(BlockGraph graph, Connection connection, ConnectorRef end) {
    Optional<BlockKind> kind =
        graph.block(end.blockId()).flatMap(b -> registry.find(b.kindId()));
    if (!kind.isPresent()) return;

    boolean isOut = end.direction() == ConnectorRef.Direction.OUT;
    if (isOut ? kind.get().hasOutput(end.connector()) : kind.get().hasInput(end.connector()))
      return;

    if (isOut ? kind.get().hasInput(end.connector()) : kind.get().hasOutput(end.connector())) {
      logError(
          Diagnostic.Kind.WRONG_CONNECTOR_DIRECTION,
          connection.id(),
          String.format(
              "'%s' is an %s of '%s' and cannot %s a connection",
              end.connector(),
              isOut ? "input" : "output",
              kind.get().kindId(),
              isOut ? "start" : "end"));
    } else {
      logError(
          Diagnostic.Kind.UNKNOWN_CONNECTOR,
          connection.id(),
          String.format(
              "block kind '%s' has no %s named '%s'",
              kind.get().kindId(), isOut ? "output" : "input", end.connector()));
    }
  }
}
