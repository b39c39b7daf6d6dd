package fsc;

/**
 * An internal compilation failure. Thrown by the linearizer and emitter on graphs that already
 * passed validation, so it always points at a registry or template defect rather than a user error.
 */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String elementId;
  private final String errorMsg;

  public CompilerException(String elementId, String errorMsg) {
    super(String.format("%s: %s", elementId, errorMsg));
    this.elementId = elementId;
    this.errorMsg = errorMsg;
  }

  public String elementId() {
    return elementId;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    System.out.println(String.format("INTERNAL ERROR: %s %s", elementId, errorMsg));
  }
}
