package fsc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Renders a {@link StatementTree} into one C translation unit. Declarations requested by templates
 * are hoisted above the entry function; every path out of the entry function first runs the
 * teardown of the resources it still holds, last acquired first.
 */
public final class CodeEmitter implements StatementVisitor<ImmutableList<CodeEmitter.Path>> {

  /** Lines that can still grow after later lines were added, so join teardown can be inserted. */
  static final class CodeBuffer {
    private final List<Object> parts = new ArrayList<>();
    private final boolean indented;

    CodeBuffer(boolean indented) {
      this.indented = indented;
    }

    void line(String line) {
      parts.add(line);
    }

    void lines(Iterable<String> lines) {
      lines.forEach(this::line);
    }

    CodeBuffer indented() {
      CodeBuffer child = new CodeBuffer(true);
      parts.add(child);
      return child;
    }

    void writeTo(SourceWriter writer) {
      if (indented) writer.increaseIndentation();
      for (Object part : parts) {
        if (part instanceof CodeBuffer) {
          ((CodeBuffer) part).writeTo(writer);
        } else {
          writer.emit((String) part);
        }
      }
      if (indented) writer.decreaseIndentation();
    }
  }

  /** A live control-flow path: where its code goes and what it holds. */
  static final class Path {
    final CodeBuffer buffer;
    final ReleaseSet releases;

    Path(CodeBuffer buffer, ReleaseSet releases) {
      this.buffer = buffer;
      this.releases = releases;
    }
  }

  private final Manifest manifest;
  private final DeclarationTable declarations = new DeclarationTable();

  private CodeEmitter(Manifest manifest) {
    this.manifest = manifest;
  }

  public static CompiledProgram emit(StatementTree tree) throws CompilerException {
    CodeEmitter emitter = new CodeEmitter(tree.manifest());
    CodeBuffer body = new CodeBuffer(true);
    for (Path path : emitter.emitSequence(tree.statements(), new Path(body, new ReleaseSet()))) {
      emitter.closeImplicitly(path);
    }
    return CompiledProgram.create(emitter.render(body), emitter.declarations.all());
  }

  private ImmutableList<Path> emitSequence(
      ImmutableList<StatementTree.Statement> statements, Path start) throws CompilerException {
    ImmutableList<Path> live = ImmutableList.of(start);
    for (StatementTree.Statement statement : statements) {
      if (live.size() != 1)
        throw new CompilerException(
            statement.block().id(),
            String.format("statement is reached by %d unjoined paths", live.size()));
      live = statement.accept(this, live);
    }
    return live;
  }

  @Override
  public ImmutableList<Path> visit(StatementTree.BlockStatement statement, ImmutableList<Path> live)
      throws CompilerException {
    Path path = live.get(0);
    String blockId = statement.block().id();
    CodeTemplate template = statement.kind().template();
    TemplateRenderer renderer = hoist(statement);

    if (statement.kind().exit()) {
      path.buffer.lines(path.releases.releaseAll());
      path.buffer.lines(renderer.render(template.statements()));
      return ImmutableList.of();
    }

    if (template.releases().isPresent())
      path.buffer.lines(path.releases.release(blockId, template.releases().get()));
    path.buffer.lines(renderer.render(template.statements()));
    if (template.acquires().isPresent()) {
      CodeTemplate.Acquisition acquisition = template.acquires().get();
      path.releases.acquire(
          blockId, acquisition.resourceKey(), renderer.render(acquisition.teardown()));
    }
    return live;
  }

  @Override
  public ImmutableList<Path> visit(StatementTree.Branch branch, ImmutableList<Path> live)
      throws CompilerException {
    Path path = live.get(0);
    TemplateRenderer renderer = hoist(branch);
    CodeTemplate template = branch.kind().template();

    List<Path> fallThrough = new ArrayList<>();
    ImmutableList<StatementTree.Arm> arms = branch.arms();
    for (int i = 0; i < arms.size(); i++) {
      StatementTree.Arm arm = arms.get(i);
      if (i == arms.size() - 1) {
        path.buffer.line("} else {");
      } else {
        String condition =
            renderer.render(
                template
                    .condition(arm.connector())
                    .orElseThrow(
                        () ->
                            new CompilerException(
                                branch.block().id(),
                                String.format("no condition for output '%s'", arm.connector()))));
        path.buffer.line(String.format(i == 0 ? "if(%s) {" : "} else if(%s) {", condition));
      }

      Path armStart = new Path(path.buffer.indented(), path.releases.fork());
      ImmutableList<Path> armLive = emitSequence(arm.statements(), armStart);
      if (arm.fallsThrough()) {
        fallThrough.addAll(armLive);
      } else {
        for (Path dead : armLive) closeImplicitly(dead);
      }
    }
    path.buffer.line("}");

    if (!branch.join().isPresent()) return ImmutableList.copyOf(fallThrough);
    if (fallThrough.isEmpty()) return ImmutableList.of();

    // Resources held before the branch survive the join only if every arm still holds them.
    Set<String> keep =
        path.releases
            .keys()
            .stream()
            .filter(key -> fallThrough.stream().allMatch(p -> p.releases.contains(key)))
            .collect(ImmutableSet.toImmutableSet());
    for (Path arm : fallThrough) arm.buffer.lines(arm.releases.releaseAllExcept(keep));
    ReleaseSet joined = path.releases.fork();
    joined.releaseAllExcept(keep);
    return ImmutableList.of(new Path(path.buffer, joined));
  }

  private TemplateRenderer hoist(StatementTree.Statement statement) throws CompilerException {
    TemplateRenderer renderer = new TemplateRenderer(manifest, statement);
    for (Declaration declaration : statement.kind().template().declarations()) {
      declarations.add(
          statement.block().id(),
          Declaration.create(
              declaration.key(), declaration.kind(), renderer.render(declaration.lines())));
    }
    return renderer;
  }

  private void closeImplicitly(Path path) {
    path.buffer.lines(path.releases.releaseAll());
    path.buffer.line("return 0;");
  }

  private String render(CodeBuffer body) {
    SourceWriter writer = new SourceWriter();
    writer.emitClikeBlockComment(
        ImmutableList.of(
            String.format("%s v%s", manifest.name(), manifest.version()),
            "Generated by the FlipperScript compiler. Do not edit."));
    writer.emitNewLine();

    ImmutableList<Declaration> includes = declarations.ofKind(Declaration.Kind.INCLUDE);
    includes.forEach(d -> d.lines().forEach(writer::emit));
    if (!includes.isEmpty()) writer.emitNewLine();

    writer.emit("typedef struct {");
    writer.increaseIndentation();
    ImmutableList<Declaration> fields = declarations.ofKind(Declaration.Kind.FIELD);
    if (fields.isEmpty()) writer.emit("uint8_t reserved;");
    fields.forEach(d -> d.lines().forEach(writer::emit));
    writer.decreaseIndentation();
    writer.emit(String.format("} %s_state_t;", manifest.appid()));
    writer.emitNewLine();

    for (Declaration function : declarations.ofKind(Declaration.Kind.FUNCTION)) {
      function.lines().forEach(writer::emit);
      writer.emitNewLine();
    }

    writer.emit(String.format("int32_t %s(void* p) {", manifest.entryPoint()));
    body.writeTo(writer);
    writer.emit("}");
    return writer.toString();
  }
}
