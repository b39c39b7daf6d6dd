package fsc;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Validate, linearize and emit. Holds only the immutable registry, so one instance can serve
 * concurrent compilations.
 */
public final class FlipperScriptCompiler {
  private final BlockRegistry registry;

  public FlipperScriptCompiler(BlockRegistry registry) {
    this.registry = registry;
  }

  public static FlipperScriptCompiler standard() {
    return new FlipperScriptCompiler(BlockRegistry.standard());
  }

  public BlockRegistry registry() {
    return registry;
  }

  public ImmutableList<Diagnostic> validate(Project project) {
    return new GraphValidator(registry, project).computeDiagnostics();
  }

  /**
   * Compiles {@code project}, or returns its diagnostics if it has errors.
   *
   * @throws CompilerException if a valid project cannot be emitted, which indicates a defect in
   *     the block catalog
   */
  public CompileResult compile(Project project) throws CompilerException {
    GraphValidator validator = new GraphValidator(registry, project);
    ImmutableList<Diagnostic> diagnostics = validator.computeDiagnostics();
    Optional<ValidatedGraph> validated = validator.validatedGraph();
    if (!validated.isPresent()) return CompileResult.failure(diagnostics);

    StatementTree tree = Linearizer.linearize(validated.get());
    return CompileResult.success(CodeEmitter.emit(tree), diagnostics);
  }
}
