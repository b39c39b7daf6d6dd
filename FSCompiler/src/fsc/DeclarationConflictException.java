package fsc;

public class DeclarationConflictException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public DeclarationConflictException(String blockId, String declarationKey) {
    super(
        blockId,
        String.format(
            "declaration '%s' conflicts with an earlier declaration of the same key",
            declarationKey));
  }
}
