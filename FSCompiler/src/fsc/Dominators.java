package fsc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.graph.Graph;

/**
 * Dominator tree of the nodes reachable from a root. Node {@code a} dominates {@code b} when every
 * path from the root to {@code b} passes through {@code a}; every node dominates itself.
 *
 * <p>Immediate dominators are found by iterating dom(n) = {n} ∪ ∩ dom(p) over the predecessors
 * {@code p} of {@code n} in reverse postorder until nothing changes, with the intersection done by
 * walking both candidates up the partial tree.
 */
final class Dominators<T> {
  private final T root;
  private final ImmutableList<T> reversePostorder;
  private final Map<T, Integer> postorderIndex = new HashMap<>();
  private final Map<T, T> idom = new HashMap<>();

  Dominators(Graph<T> graph, T root) {
    this.root = root;
    List<T> postorder = new ArrayList<>();
    visit(graph, root, new HashSet<>(), postorder);
    for (int i = 0; i < postorder.size(); i++) postorderIndex.put(postorder.get(i), i);
    this.reversePostorder = ImmutableList.copyOf(Lists.reverse(postorder));
    compute(graph);
  }

  private static <T> void visit(Graph<T> graph, T node, Set<T> seen, List<T> postorder) {
    if (!seen.add(node)) return;
    for (T successor : graph.successors(node)) visit(graph, successor, seen, postorder);
    postorder.add(node);
  }

  private void compute(Graph<T> graph) {
    idom.put(root, root);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (T node : reversePostorder) {
        if (node.equals(root)) continue;

        T newIdom = null;
        for (T pred : graph.predecessors(node)) {
          if (!idom.containsKey(pred)) continue;
          newIdom = newIdom == null ? pred : intersect(pred, newIdom);
        }
        if (newIdom != null && !newIdom.equals(idom.get(node))) {
          idom.put(node, newIdom);
          changed = true;
        }
      }
    }
  }

  private T intersect(T a, T b) {
    while (!a.equals(b)) {
      while (postorderIndex.get(a) < postorderIndex.get(b)) a = idom.get(a);
      while (postorderIndex.get(b) < postorderIndex.get(a)) b = idom.get(b);
    }
    return a;
  }

  public boolean isReachable(T node) {
    return idom.containsKey(node);
  }

  /** Reachable nodes, root first, in reverse postorder. */
  public ImmutableList<T> reachable() {
    return reversePostorder;
  }

  public Optional<T> immediateDominator(T node) {
    if (node.equals(root) || !idom.containsKey(node)) return Optional.empty();
    return Optional.of(idom.get(node));
  }

  public boolean dominates(T a, T b) {
    if (!isReachable(a) || !isReachable(b)) return false;
    T current = b;
    while (true) {
      if (current.equals(a)) return true;
      if (current.equals(root)) return false;
      current = idom.get(current);
    }
  }

  public boolean strictlyDominates(T a, T b) {
    return !a.equals(b) && dominates(a, b);
  }
}
