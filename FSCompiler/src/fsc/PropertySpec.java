package fsc;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Schema of one named block property. */
@AutoValue
public abstract class PropertySpec {

  public enum Type {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    ENUM;

    public static Optional<Type> parse(String name) {
      for (Type type : values()) {
        if (type.name().equalsIgnoreCase(name)) return Optional.of(type);
      }
      return Optional.empty();
    }
  }

  public abstract String name();

  public abstract Type type();

  public abstract Optional<Object> defaultValue();

  public abstract boolean required();

  public abstract Optional<Double> min();

  public abstract Optional<Double> max();

  public abstract Optional<Integer> maxLength();

  public abstract ImmutableList<String> enumValues();

  /** Throws if {@code value} does not satisfy this spec; {@code blockId} names the offender. */
  public final void check(String blockId, Object value) throws DiagnosticException {
    switch (type()) {
      case STRING:
        {
          if (!(value instanceof String)) throw typeError(blockId, "a string", value);
          // Measured in UTF-8 bytes, the size of the C buffer it is copied into.
          int length = ((String) value).getBytes(StandardCharsets.UTF_8).length;
          if (maxLength().isPresent() && length > maxLength().get())
            throw rangeError(
                blockId,
                String.format(
                    "is %d bytes long in UTF-8, longer than the %d allowed",
                    length, maxLength().get()));
          return;
        }
      case INTEGER:
        {
          if (!(value instanceof Long)) throw typeError(blockId, "an integer", value);
          checkBounds(blockId, (Long) value);
          return;
        }
      case FLOAT:
        {
          if (!(value instanceof Long) && !(value instanceof Double))
            throw typeError(blockId, "a number", value);
          if (!Double.isFinite(((Number) value).doubleValue()))
            throw rangeError(blockId, "is not a finite number");
          checkBounds(blockId, ((Number) value).doubleValue());
          return;
        }
      case BOOLEAN:
        if (!(value instanceof Boolean)) throw typeError(blockId, "a boolean", value);
        return;
      case ENUM:
        if (!(value instanceof String)) throw typeError(blockId, "one of " + enumValues(), value);
        if (!enumValues().contains(value))
          throw rangeError(
              blockId, String.format("'%s' is not one of %s", value, enumValues()));
        return;
    }
    throw new AssertionError(type());
  }

  private void checkBounds(String blockId, double value) throws DiagnosticException {
    if (min().isPresent() && value < min().get())
      throw rangeError(blockId, String.format("is below the minimum %s", format(min().get())));
    if (max().isPresent() && value > max().get())
      throw rangeError(blockId, String.format("is above the maximum %s", format(max().get())));
  }

  private String format(double bound) {
    return type() == Type.INTEGER ? Long.toString((long) bound) : Double.toString(bound);
  }

  private DiagnosticException typeError(String blockId, String expected, Object value) {
    return new DiagnosticException(
        Diagnostic.create(
            Diagnostic.Kind.PROPERTY_TYPE,
            blockId,
            String.format(
                "property '%s' must be %s, but was %s", name(), expected, describe(value))));
  }

  private DiagnosticException rangeError(String blockId, String problem) {
    return new DiagnosticException(
        Diagnostic.create(
            Diagnostic.Kind.PROPERTY_RANGE,
            blockId,
            String.format("property '%s' %s", name(), problem)));
  }

  private static String describe(Object value) {
    if (value instanceof String) return String.format("the string \"%s\"", value);
    if (value instanceof Long) return "an integer";
    if (value instanceof Double) return "a floating point number";
    if (value instanceof Boolean) return "a boolean";
    return "a structured value";
  }

  public static Builder builder(String name, Type type) {
    return new AutoValue_PropertySpec.Builder()
        .setName(name)
        .setType(type)
        .setRequired(false)
        .setEnumValues(ImmutableList.of());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setType(Type type);

    public abstract Builder setDefaultValue(Object defaultValue);

    public abstract Builder setRequired(boolean required);

    public abstract Builder setMin(Double min);

    public abstract Builder setMax(Double max);

    public abstract Builder setMaxLength(Integer maxLength);

    public abstract Builder setEnumValues(ImmutableList<String> enumValues);

    public abstract PropertySpec build();
  }
}
