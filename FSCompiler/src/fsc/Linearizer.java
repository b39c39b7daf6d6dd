package fsc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Turns a validated graph into a {@link StatementTree}. Walks from the entry block in connector
 * declaration order; at a branch, each arm is walked up to the join point of the arms, where the
 * enclosing sequence resumes.
 */
public final class Linearizer {
  private final ValidatedGraph graph;

  private Linearizer(ValidatedGraph graph) {
    this.graph = graph;
  }

  public static StatementTree linearize(ValidatedGraph graph) throws CompilerException {
    Linearizer linearizer = new Linearizer(graph);
    Sequence main = linearizer.sequence(graph.entry().id(), Optional.empty());
    return StatementTree.create(graph.manifest(), main.statements);
  }

  private static final class Sequence {
    final ImmutableList<StatementTree.Statement> statements;
    final boolean reachedTarget;

    Sequence(ImmutableList<StatementTree.Statement> statements, boolean reachedTarget) {
      this.statements = statements;
      this.reachedTarget = reachedTarget;
    }
  }

  /** Walks from {@code start} until {@code target}, a dead end or an exit. */
  private Sequence sequence(String start, Optional<String> target) throws CompilerException {
    ImmutableList.Builder<StatementTree.Statement> statements = ImmutableList.builder();
    Optional<String> current = Optional.of(start);
    while (current.isPresent()) {
      if (current.equals(target)) return new Sequence(statements.build(), true);

      Block block = graph.graph().block(current.get()).get();
      BlockKind kind = graph.kindOf(block);
      int index = graph.graph().indexOf(block.id());
      if (!kind.isBranch()) {
        statements.add(StatementTree.BlockStatement.create(block, kind, index));
        current =
            kind.outputs().isEmpty() ? Optional.empty() : next(block.id(), kind.outputs().get(0));
        continue;
      }

      List<Optional<String>> armStarts = new ArrayList<>();
      for (String output : kind.outputs()) armStarts.add(next(block.id(), output));
      Optional<String> join = findJoin(armStarts, target);
      Optional<String> armTarget = join.isPresent() ? join : target;

      ImmutableList.Builder<StatementTree.Arm> arms = ImmutableList.builder();
      boolean anyFallsThrough = false;
      for (int i = 0; i < armStarts.size(); i++) {
        Sequence arm =
            armStarts.get(i).isPresent()
                ? sequence(armStarts.get(i).get(), armTarget)
                : new Sequence(ImmutableList.of(), false);
        arms.add(
            StatementTree.Arm.create(kind.outputs().get(i), arm.statements, arm.reachedTarget));
        anyFallsThrough |= arm.reachedTarget;
      }

      boolean resumes = join.isPresent() && !join.equals(target);
      statements.add(
          StatementTree.Branch.create(
              block, kind, index, arms.build(), resumes ? join : Optional.empty()));
      if (!resumes) return new Sequence(statements.build(), anyFallsThrough);
      current = join;
    }
    return new Sequence(statements.build(), false);
  }

  private Optional<String> next(String blockId, String output) {
    return graph.graph().connectionFrom(blockId, output).map(c -> c.destination().blockId());
  }

  /**
   * The block common to every arm that is nearest to the branch, measured by the longest of the
   * per-arm distances. Ties go to the block the first arm discovers first. Searches stop at {@code
   * target}, so it can be the join but nothing beyond it can.
   */
  private Optional<String> findJoin(List<Optional<String>> armStarts, Optional<String> target)
      throws CompilerException {
    List<Map<String, Integer>> distances = new ArrayList<>();
    for (Optional<String> start : armStarts) {
      if (!start.isPresent()) return Optional.empty();
      distances.add(distancesFrom(start.get(), target));
    }

    Map<String, Integer> first = distances.get(0);
    List<String> order = new ArrayList<>(first.keySet());
    return order
        .stream()
        .filter(id -> distances.stream().allMatch(d -> d.containsKey(id)))
        .min(
            Comparator.<String>comparingInt(
                    id -> distances.stream().mapToInt(d -> d.get(id)).max().getAsInt())
                .thenComparingInt(order::indexOf));
  }

  /** Breadth-first distances from {@code start} in discovery order. Stops at {@code target}. */
  private Map<String, Integer> distancesFrom(String start, Optional<String> target)
      throws CompilerException {
    Map<String, Integer> distances = new LinkedHashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    distances.put(start, 0);
    queue.add(start);
    while (!queue.isEmpty()) {
      String blockId = queue.poll();
      if (target.isPresent() && target.get().equals(blockId)) continue;

      Block block = graph.graph().block(blockId).get();
      for (String output : graph.kindOf(block).outputs()) {
        Optional<String> successor = next(blockId, output);
        if (successor.isPresent() && !distances.containsKey(successor.get())) {
          distances.put(successor.get(), distances.get(blockId) + 1);
          queue.add(successor.get());
        }
      }
    }
    return distances;
  }
}
