package fsc;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;

import com.google.common.collect.ImmutableList;

/**
 * Substitutes {@code ${placeholder}}s in template lines for one block. Strings become C string
 * literals; numbers, booleans and enum values are written as they are.
 */
final class TemplateRenderer {
  private final Manifest manifest;
  private final StatementTree.Statement statement;

  TemplateRenderer(Manifest manifest, StatementTree.Statement statement) {
    this.manifest = manifest;
    this.statement = statement;
  }

  /** C identifier unique to the block at {@code index} within one program. */
  static String instanceId(int index) {
    return "b" + index;
  }

  ImmutableList<String> render(Iterable<String> lines) throws CompilerException {
    ImmutableList.Builder<String> rendered = ImmutableList.builder();
    for (String line : lines) rendered.add(render(line));
    return rendered.build();
  }

  String render(String line) throws CompilerException {
    Matcher m = CodeTemplate.PLACEHOLDER.matcher(line);
    StringBuilder sb = new StringBuilder();
    int last = 0;
    while (m.find()) {
      sb.append(line, last, m.start());
      sb.append(value(m.group(1)));
      last = m.end();
    }
    sb.append(line, last, line.length());
    return sb.toString();
  }

  private String value(String name) throws CompilerException {
    if (name.equals(CodeTemplate.APP)) return manifest.appid();
    if (name.equals(CodeTemplate.ID)) return instanceId(statement.index());

    Block block = statement.block();
    Optional<PropertySpec> spec = statement.kind().property(name);
    if (!spec.isPresent())
      throw new CompilerException(
          block.id(), String.format("template refers to unknown property '%s'", name));
    Optional<Object> value = block.property(name);
    if (!value.isPresent()) value = spec.get().defaultValue();
    if (!value.isPresent())
      throw new CompilerException(
          block.id(), String.format("property '%s' has no value and no default", name));
    return format(spec.get(), value.get());
  }

  private static String format(PropertySpec spec, Object value) {
    switch (spec.type()) {
      case STRING:
        return cStringLiteral((String) value);
      case INTEGER:
      case FLOAT:
      case BOOLEAN:
      case ENUM:
        return String.valueOf(value);
    }
    throw new AssertionError(spec.type());
  }

  /**
   * Quotes {@code text} as a C string literal over its UTF-8 bytes. Quotes, backslashes and
   * question marks (trigraphs) are escaped; bytes outside printable ASCII become three digit octal
   * escapes.
   */
  static String cStringLiteral(String text) {
    StringBuilder sb = new StringBuilder("\"");
    for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
      int c = b & 0xff;
      if (c == '"' || c == '\\' || c == '?') {
        sb.append('\\').append((char) c);
      } else if (c >= 0x20 && c < 0x7f) {
        sb.append((char) c);
      } else {
        sb.append(String.format("\\%03o", c));
      }
    }
    return sb.append('"').toString();
  }
}
