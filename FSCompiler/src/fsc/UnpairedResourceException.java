package fsc;

/** A resource release with no matching acquisition on the path, or a double acquisition. */
public class UnpairedResourceException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String resourceKey;

  public UnpairedResourceException(String blockId, String resourceKey, String errorMsg) {
    super(blockId, errorMsg);
    this.resourceKey = resourceKey;
  }

  public String resourceKey() {
    return resourceKey;
  }
}
