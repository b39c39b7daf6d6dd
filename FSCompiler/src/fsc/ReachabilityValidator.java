package fsc;

import java.util.Set;

import com.google.common.graph.Graphs;

final class ReachabilityValidator extends ErrorCollectingValidator {
  private final String entryBlock;

  ReachabilityValidator(String entryBlock) {
    this.entryBlock = entryBlock;
  }

  @Override
  void validate(BlockGraph graph) {
    Set<String> reachable = Graphs.reachableNodes(graph.flowGraph(), entryBlock);
    for (Block block : graph.blocks()) {
      if (!reachable.contains(block.id()))
        logError(
            Diagnostic.Kind.UNREACHABLE_BLOCK,
            block.id(),
            String.format("block cannot be reached from the entry block '%s'", entryBlock));
    }
  }
}
