package fsc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;

abstract class ErrorCollectingValidator {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  abstract void validate(BlockGraph graph);

  protected ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  protected void logError(Diagnostic.Kind kind, String elementId, String msg) {
    logError(Diagnostic.create(kind, elementId, msg));
  }

  protected void logError(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  // Returns true if cycles were detected.
  protected <T> boolean detectCycles(Graph<T> graph, Consumer<T> logError) {
    Graph<T> closure = Graphs.transitiveClosure(graph);
    Set<T> logged = new HashSet<>();
    for (T node : graph.nodes()) {
      if (graph.successors(node).contains(node)) {
        if (logged.add(node)) logError.accept(node);
        continue;
      }
      for (T node2 : closure.successors(node)) {
        if (!node2.equals(node) && closure.successors(node2).contains(node)) {
          if (logged.add(node)) logError.accept(node);
          break;
        }
      }
    }

    return !logged.isEmpty();
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    diagnostics.addAll(other.diagnostics);
  }

  /** Whether any error-severity diagnostic was logged. Warnings do not count. */
  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  public void printErrors() {
    diagnostics.stream().forEach(Diagnostic::print);
  }
}
