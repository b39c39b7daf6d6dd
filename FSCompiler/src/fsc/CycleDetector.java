package fsc;

final class CycleDetector extends ErrorCollectingValidator {

  @Override
  void validate(BlockGraph graph) {
    detectCycles(
        graph.flowGraph(),
        blockId ->
            logError(
                Diagnostic.Kind.CYCLE,
                blockId,
                "block is part of a cycle; loops must be expressed inside a single block"));
  }
}
