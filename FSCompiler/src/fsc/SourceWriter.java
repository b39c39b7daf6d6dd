package fsc;

/** Accumulates indented C source lines. */
final class SourceWriter {
  private static final String INDENT = "    ";

  private final StringBuilder out = new StringBuilder();
  private int indentation;

  void increaseIndentation() {
    indentation++;
  }

  void decreaseIndentation() {
    if (indentation == 0) throw new IllegalStateException("indentation is already zero");
    indentation--;
  }

  /** Writes one line at the current indentation. Empty lines carry no indentation. */
  void emit(String line) {
    if (!line.isEmpty()) {
      for (int i = 0; i < indentation; i++) out.append(INDENT);
      out.append(line);
    }
    out.append('\n');
  }

  void emitNewLine() {
    emit("");
  }

  void emitClikeBlockComment(Iterable<String> lines) {
    emit("/*");
    for (String line : lines) emit((" * " + line.replace("*/", "* /")).replaceAll("\\s+$", ""));
    emit(" */");
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
