package fsc;

public class UnknownBlockKindException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final String kindId;

  public UnknownBlockKindException(String kindId) {
    super(kindId, String.format("unknown block kind '%s'", kindId));
    this.kindId = kindId;
  }

  public String kindId() {
    return kindId;
  }
}
