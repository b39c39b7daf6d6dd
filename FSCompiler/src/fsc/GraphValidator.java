package fsc;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Runs every check over a project and collects all diagnostics from one pass. Checks that need a
 * single entry block, or an acyclic graph, are skipped when those do not hold.
 */
public class GraphValidator extends ErrorCollectingValidator {

  private final BlockRegistry registry;
  private final Project project;

  private boolean validated = false;
  private Optional<String> entryBlock = Optional.empty();

  public GraphValidator(BlockRegistry registry, Project project) {
    this.registry = registry;
    this.project = project;
  }

  public ImmutableList<Diagnostic> computeDiagnostics() {
    if (!validated) {
      validated = true;
      validate(project.graph());
    }
    return diagnostics();
  }

  /** Present when validation found no errors. Warnings do not prevent compilation. */
  public Optional<ValidatedGraph> validatedGraph() {
    computeDiagnostics();
    if (hasErrors() || !entryBlock.isPresent()) return Optional.empty();
    return Optional.of(new ValidatedGraph(registry, project, entryBlock.get()));
  }

  @Override
  void validate(BlockGraph graph) {
    StructureValidator structure = new StructureValidator(registry);
    run(structure, graph);
    run(new SchemaValidator(registry, structure.resolvedConnections()), graph);
    run(new PropertyValidator(registry), graph);
    run(new ManifestValidator(registry, project.manifest()), graph);

    entryBlock = structure.entryBlock();
    if (!entryBlock.isPresent()) return;

    run(new ReachabilityValidator(entryBlock.get()), graph);
    if (run(new CycleDetector(), graph))
      run(new SubsystemOrderValidator(registry, entryBlock.get()), graph);
  }

  private boolean run(ErrorCollectingValidator validator, BlockGraph graph) {
    validator.validate(graph);
    takeErrors(validator);
    return !validator.hasErrors();
  }
}
