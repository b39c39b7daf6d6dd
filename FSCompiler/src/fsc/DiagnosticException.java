package fsc;

/** Carries a single {@link Diagnostic} out of a helper so a validator can log it. */
public class DiagnosticException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Diagnostic diagnostic;

  public DiagnosticException(Diagnostic diagnostic) {
    super(diagnostic.message());
    this.diagnostic = diagnostic;
  }

  public Diagnostic diagnostic() {
    return diagnostic;
  }
}
