package fsc;

/** The block catalog itself is broken. Raised while loading it, never per graph. */
public class RegistryMisconfiguredException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public RegistryMisconfiguredException(String message) {
    super(message);
  }

  public RegistryMisconfiguredException(String message, Throwable cause) {
    super(message, cause);
  }
}
