package fsc;

import com.google.auto.value.AutoValue;

/** A control-flow link from an output connector to an input connector. */
@AutoValue
public abstract class Connection {

  public abstract ConnectorRef source();

  public abstract ConnectorRef destination();

  /** How diagnostics name this connection, e.g. {@code start.next -> init.in}. */
  public final String id() {
    return source() + " -> " + destination();
  }

  public static Connection create(ConnectorRef source, ConnectorRef destination) {
    return new AutoValue_Connection(source, destination);
  }

  public static Connection create(
      String sourceBlock, String sourceConnector, String destBlock, String destConnector) {
    return create(
        ConnectorRef.out(sourceBlock, sourceConnector), ConnectorRef.in(destBlock, destConnector));
  }
}
