package fsc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimaps;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;

/**
 * Blocks and the connections between them. Blocks live in an arena: a block's position in {@link
 * #blocks()} is its index, and connections refer to blocks by id only.
 */
@AutoValue
public abstract class BlockGraph {

  public abstract ImmutableList<Block> blocks();

  public abstract ImmutableList<Connection> connections();

  /** Arena index of each block id. Later blocks reusing an id are not indexed. */
  @Memoized
  public ImmutableMap<String, Integer> indexById() {
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < blocks().size(); i++) index.putIfAbsent(blocks().get(i).id(), i);
    return ImmutableMap.copyOf(index);
  }

  @Memoized
  public ImmutableListMultimap<String, Connection> outgoing() {
    return Multimaps.index(connections(), c -> c.source().blockId());
  }

  @Memoized
  public ImmutableListMultimap<String, Connection> incoming() {
    return Multimaps.index(connections(), c -> c.destination().blockId());
  }

  /**
   * Block-level flow graph over the connections whose endpoints both name existing blocks,
   * regardless of connector validity.
   */
  @Memoized
  public ImmutableGraph<String> flowGraph() {
    ImmutableGraph.Builder<String> graph =
        GraphBuilder.directed().allowsSelfLoops(true).<String>immutable();
    indexById().keySet().forEach(graph::addNode);
    for (Connection c : connections()) {
      if (contains(c.source().blockId()) && contains(c.destination().blockId()))
        graph.putEdge(c.source().blockId(), c.destination().blockId());
    }
    return graph.build();
  }

  public final boolean contains(String blockId) {
    return indexById().containsKey(blockId);
  }

  public final Optional<Block> block(String blockId) {
    Integer index = indexById().get(blockId);
    return index == null ? Optional.empty() : Optional.of(blocks().get(index));
  }

  public final int indexOf(String blockId) {
    Integer index = indexById().get(blockId);
    if (index == null) throw new IllegalArgumentException("no block " + blockId);
    return index;
  }

  /** The first connection leaving {@code blockId} through {@code connector}. */
  public final Optional<Connection> connectionFrom(String blockId, String connector) {
    return outgoing()
        .get(blockId)
        .stream()
        .filter(c -> c.source().connector().equals(connector))
        .findFirst();
  }

  public static BlockGraph create(Iterable<Block> blocks, Iterable<Connection> connections) {
    return new AutoValue_BlockGraph(
        ImmutableList.copyOf(blocks), ImmutableList.copyOf(connections));
  }

  public static Builder builder() {
    return new AutoValue_BlockGraph.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ImmutableList.Builder<Block> blocksBuilder();

    public abstract ImmutableList.Builder<Connection> connectionsBuilder();

    public final Builder addBlock(Block block) {
      blocksBuilder().add(block);
      return this;
    }

    public final Builder addBlock(String id, String kindId) {
      return addBlock(Block.create(id, kindId));
    }

    public final Builder connect(
        String sourceBlock, String sourceConnector, String destBlock, String destConnector) {
      connectionsBuilder()
          .add(Connection.create(sourceBlock, sourceConnector, destBlock, destConnector));
      return this;
    }

    public abstract BlockGraph build();
  }
}
