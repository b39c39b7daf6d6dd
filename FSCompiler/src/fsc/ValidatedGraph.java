package fsc;

/**
 * A project that passed validation, with its resolved entry block. Only {@link GraphValidator}
 * creates these.
 */
public final class ValidatedGraph {
  private final BlockRegistry registry;
  private final Project project;
  private final String entryBlock;

  ValidatedGraph(BlockRegistry registry, Project project, String entryBlock) {
    this.registry = registry;
    this.project = project;
    this.entryBlock = entryBlock;
  }

  public BlockRegistry registry() {
    return registry;
  }

  public BlockGraph graph() {
    return project.graph();
  }

  public Manifest manifest() {
    return project.manifest();
  }

  public Block entry() {
    return graph().block(entryBlock).get();
  }

  public BlockKind kindOf(Block block) throws UnknownBlockKindException {
    return registry.lookup(block.kindId());
  }
}
