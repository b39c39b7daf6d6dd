package fsc;

import com.google.auto.value.AutoValue;

/** One validation problem, reported against a block, a connection or a manifest field. */
@AutoValue
public abstract class Diagnostic {

  public enum Category {
    STRUCTURAL,
    SCHEMA,
    ORDERING;
  }

  public enum Severity {
    ERROR,
    WARNING;
  }

  public enum Kind {
    DUPLICATE_BLOCK_ID(Category.STRUCTURAL),
    MISSING_ENTRY(Category.STRUCTURAL),
    DUPLICATE_ENTRY(Category.STRUCTURAL),
    ENTRY_HAS_INPUT(Category.STRUCTURAL),
    DANGLING_CONNECTION(Category.STRUCTURAL),
    DUPLICATE_CONNECTION(Category.STRUCTURAL),
    CONNECTOR_ARITY(Category.STRUCTURAL),
    UNREACHABLE_BLOCK(Category.STRUCTURAL),
    CYCLE(Category.STRUCTURAL),

    UNKNOWN_BLOCK_KIND(Category.SCHEMA),
    UNKNOWN_CONNECTOR(Category.SCHEMA),
    WRONG_CONNECTOR_DIRECTION(Category.SCHEMA),
    PROPERTY_MISSING(Category.SCHEMA),
    PROPERTY_TYPE(Category.SCHEMA),
    PROPERTY_RANGE(Category.SCHEMA),
    UNKNOWN_PROPERTY(Category.SCHEMA, Severity.WARNING),
    INVALID_MANIFEST(Category.SCHEMA),
    UNDECLARED_REQUIREMENT(Category.SCHEMA),
    UNUSED_REQUIREMENT(Category.SCHEMA, Severity.WARNING),

    INIT_DOES_NOT_DOMINATE(Category.ORDERING),
    DUPLICATE_INIT(Category.ORDERING),
    USE_AFTER_RELEASE(Category.ORDERING);

    private final Category category;
    private final Severity severity;

    Kind(Category category) {
      this(category, Severity.ERROR);
    }

    Kind(Category category, Severity severity) {
      this.category = category;
      this.severity = severity;
    }

    public Category category() {
      return category;
    }

    public Severity severity() {
      return severity;
    }
  }

  public abstract Kind kind();

  public abstract String elementId();

  public abstract String message();

  public final Category category() {
    return kind().category();
  }

  public final Severity severity() {
    return kind().severity();
  }

  public final boolean isError() {
    return severity() == Severity.ERROR;
  }

  public static Diagnostic create(Kind kind, String elementId, String message) {
    return new AutoValue_Diagnostic(kind, elementId, message);
  }

  public void print() {
    System.out.println(
        String.format(
            "%s: [%s/%s] %s: %s",
            severity(), category(), kind().name().toLowerCase(), elementId(), message()));
  }
}
