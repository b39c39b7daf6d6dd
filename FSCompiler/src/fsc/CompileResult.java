package fsc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The program, present when validation found no errors, and every diagnostic found. */
@AutoValue
public abstract class CompileResult {

  public abstract Optional<CompiledProgram> program();

  public abstract ImmutableList<Diagnostic> diagnostics();

  public final boolean succeeded() {
    return program().isPresent();
  }

  public final ImmutableList<Diagnostic> errors() {
    return diagnostics()
        .stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  static CompileResult success(CompiledProgram program, ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_CompileResult(Optional.of(program), diagnostics);
  }

  static CompileResult failure(ImmutableList<Diagnostic> diagnostics) {
    return new AutoValue_CompileResult(Optional.empty(), diagnostics);
  }
}
