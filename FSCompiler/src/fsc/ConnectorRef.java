package fsc;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ConnectorRef {

  public enum Direction {
    IN,
    OUT;
  }

  public abstract String blockId();

  public abstract String connector();

  public abstract Direction direction();

  public static ConnectorRef in(String blockId, String connector) {
    return new AutoValue_ConnectorRef(blockId, connector, Direction.IN);
  }

  public static ConnectorRef out(String blockId, String connector) {
    return new AutoValue_ConnectorRef(blockId, connector, Direction.OUT);
  }

  @Override
  public final String toString() {
    return blockId() + "." + connector();
  }
}
