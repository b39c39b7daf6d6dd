package fsc;

import static com.google.common.truth.Truth.assertThat;
import static fsc.TestProjects.block;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class CodeEmitterTest {

  private static BlockRegistry registry;

  private static String lines(String... lines) {
    return Arrays.asList(lines).stream().collect(Collectors.joining("\n", "", "\n"));
  }

  @BeforeAll
  public static void loadCatalog() throws IOException {
    registry =
        BlockRegistryLoader.parse(
            String.join(
                    "\n",
                    "{'blockCategories': [{'name': 'Test', 'blocks': [",
                    " {'id': 'start', 'entry': true, 'outputs': ['next'],",
                    "  'template': {",
                    "   'declarations': [",
                    "     {'key': 'include.stdio', 'kind': 'include',",
                    "      'lines': '#include <stdio.h>'},",
                    "     {'key': 'field.count', 'kind': 'field', 'lines': 'int count;'}],",
                    "   'statements': ['char* buf = malloc(8);'],",
                    "   'acquires': {'key': 'buf', 'teardown': ['free(buf);']}}},",
                    " {'id': 'say', 'inputs': ['in'], 'outputs': ['next'],",
                    "  'properties': [{'name': 'text', 'type': 'string', 'default': 'hi'}],",
                    "  'template': {",
                    "   'declarations': [{'key': 'function.helper', 'kind': 'function',",
                    "                     'lines': ['static void ${app}_helper(void) {', '}']}],",
                    "   'statements': ['puts(${text});']}},",
                    " {'id': 'flag', 'inputs': ['in'], 'outputs': ['yes', 'no'],",
                    "  'properties': [{'name': 'on', 'type': 'boolean', 'default': true}],",
                    "  'template': {'conditions': {'yes': '${on}'}}},",
                    " {'id': 'open', 'inputs': ['in'], 'outputs': ['next'], 'initializes': 'res',",
                    "  'template': {'statements': ['open_res();'],",
                    "               'acquires': {'key': 'res', 'teardown': ['close_res();']}}},",
                    " {'id': 'shut', 'inputs': ['in'], 'outputs': ['next'],",
                    "  'template': {'releases': 'res'}},",
                    " {'id': 'merge', 'inputs': ['in_a', 'in_b'], 'outputs': ['next']},",
                    " {'id': 'gain', 'inputs': ['in'], 'outputs': ['next'],",
                    "  'properties': [{'name': 'level', 'type': 'float', 'default': 1.0}],",
                    "  'template': {'statements': ['volume = ${level};']}},",
                    " {'id': 'end', 'exit': true, 'inputs': ['in'],",
                    "  'properties': [{'name': 'code', 'type': 'integer', 'default': 0}],",
                    "  'template': {'statements': ['return ${code};']}}",
                    "]}]}")
                .replace('\'', '"'));
  }

  private static Manifest manifest(String... requires) {
    return Manifest.builder()
        .setName("Demo")
        .setAppid("demo")
        .setVersion("2.0")
        .setEntryPoint("demo_main")
        .setRequires(requires)
        .build();
  }

  private static String compile(BlockGraph.Builder graph, String... requires)
      throws CompilerException {
    CompileResult result =
        new FlipperScriptCompiler(registry)
            .compile(Project.create(manifest(requires), graph.build()));
    assertThat(result.errors()).isEmpty();
    return result.program().get().source();
  }

  private static void assertBody(String source, String... body) {
    String entry = "int32_t demo_main(void* p) {\n";
    assertThat(source).contains(entry);
    assertThat(source.substring(source.indexOf(entry) + entry.length()))
        .isEqualTo(lines(body) + "}\n");
  }

  @Test
  public void linearProgramLayout() throws CompilerException {
    String source =
        compile(
            BlockGraph.builder()
                .addBlock("s", "start")
                .addBlock(block("a", "say", "text", "a\"b"))
                .addBlock(block("e", "end", "code", 3L))
                .connect("s", "next", "a", "in")
                .connect("a", "next", "e", "in"),
            "gui");

    assertThat(source)
        .isEqualTo(
            lines(
                "/*",
                " * Demo v2.0",
                " * Generated by the FlipperScript compiler. Do not edit.",
                " */",
                "",
                "#include <stdio.h>",
                "",
                "typedef struct {",
                "    int count;",
                "} demo_state_t;",
                "",
                "static void demo_helper(void) {",
                "}",
                "",
                "int32_t demo_main(void* p) {",
                "    char* buf = malloc(8);",
                "    puts(\"a\\\"b\");",
                "    free(buf);",
                "    return 3;",
                "}"));
  }

  @Test
  public void implicitReturnWhenThePathEndsWithoutExit() throws CompilerException {
    String source =
        compile(
            BlockGraph.builder()
                .addBlock("s", "start")
                .addBlock("a", "say")
                .connect("s", "next", "a", "in"),
            "gui");
    assertBody(
        source,
        "    char* buf = malloc(8);",
        "    puts(\"hi\");",
        "    free(buf);",
        "    return 0;");
  }

  @Test
  public void everyExitPathGetsTeardown() throws CompilerException {
    String source =
        compile(
            BlockGraph.builder()
                .addBlock("s", "start")
                .addBlock("f", "flag")
                .addBlock("a", "say")
                .addBlock("e", "end")
                .addBlock(block("e2", "end", "code", 1L))
                .connect("s", "next", "f", "in")
                .connect("f", "yes", "a", "in")
                .connect("a", "next", "e", "in")
                .connect("f", "no", "e2", "in"),
            "gui");
    assertBody(
        source,
        "    char* buf = malloc(8);",
        "    if(true) {",
        "        puts(\"hi\");",
        "        free(buf);",
        "        return 0;",
        "    } else {",
        "        free(buf);",
        "        return 1;",
        "    }");
  }

  @Test
  public void resourcesHeldOnOnlySomeArmsAreReleasedBeforeTheJoin() throws CompilerException {
    String source =
        compile(
            BlockGraph.builder()
                .addBlock("s", "start")
                .addBlock("o", "open")
                .addBlock(block("f", "flag", "on", false))
                .addBlock("sh", "shut")
                .addBlock("m", "merge")
                .addBlock("e", "end")
                .connect("s", "next", "o", "in")
                .connect("o", "next", "f", "in")
                .connect("f", "yes", "sh", "in")
                .connect("sh", "next", "m", "in_a")
                .connect("f", "no", "m", "in_b")
                .connect("m", "next", "e", "in"),
            "res");
    assertBody(
        source,
        "    char* buf = malloc(8);",
        "    open_res();",
        "    if(false) {",
        "        close_res();",
        "    } else {",
        "        close_res();",
        "    }",
        "    free(buf);",
        "    return 0;");
  }

  @Test
  public void resourcesHeldOnEveryArmSurviveTheJoin() throws CompilerException {
    String source =
        compile(
            BlockGraph.builder()
                .addBlock("s", "start")
                .addBlock("o", "open")
                .addBlock("f", "flag")
                .addBlock("a", "say")
                .addBlock("m", "merge")
                .connect("s", "next", "o", "in")
                .connect("o", "next", "f", "in")
                .connect("f", "yes", "a", "in")
                .connect("a", "next", "m", "in_a")
                .connect("f", "no", "m", "in_b"),
            "res");
    assertBody(
        source,
        "    char* buf = malloc(8);",
        "    open_res();",
        "    if(true) {",
        "        puts(\"hi\");",
        "    } else {",
        "    }",
        "    close_res();",
        "    free(buf);",
        "    return 0;");
  }

  @Test
  public void releaseWithoutAcquisition() {
    BlockKind shut =
        BlockKind.builder("shut")
            .addInput("in")
            .addOutput("next")
            .setTemplate(CodeTemplate.builder().setReleases("res").build())
            .build();
    StatementTree tree =
        StatementTree.create(
            Manifest.defaults(),
            ImmutableList.of(
                StatementTree.BlockStatement.create(Block.create("s1", "shut"), shut, 0)));

    UnpairedResourceException ex =
        assertThrows(UnpairedResourceException.class, () -> CodeEmitter.emit(tree));
    assertThat(ex.elementId()).isEqualTo("s1");
    assertThat(ex.resourceKey()).isEqualTo("res");
    assertThat(ex).hasMessageThat().contains("not held on this path");
  }

  @Test
  public void acquiringTwice() {
    BlockKind open =
        BlockKind.builder("open")
            .addInput("in")
            .addOutput("next")
            .setTemplate(
                CodeTemplate.builder()
                    .setAcquires(CodeTemplate.Acquisition.create("res", ImmutableList.of("x();")))
                    .build())
            .build();
    StatementTree tree =
        StatementTree.create(
            Manifest.defaults(),
            ImmutableList.of(
                StatementTree.BlockStatement.create(Block.create("o1", "open"), open, 0),
                StatementTree.BlockStatement.create(Block.create("o2", "open"), open, 1)));

    UnpairedResourceException ex =
        assertThrows(UnpairedResourceException.class, () -> CodeEmitter.emit(tree));
    assertThat(ex.elementId()).isEqualTo("o2");
    assertThat(ex).hasMessageThat().contains("acquired again");
  }

  @Test
  public void conflictingDeclarations() {
    BlockKind a =
        BlockKind.builder("a")
            .setTemplate(
                CodeTemplate.builder()
                    .addDeclaration(Declaration.create("field.x", Declaration.Kind.FIELD, "int x;"))
                    .build())
            .build();
    BlockKind b =
        BlockKind.builder("b")
            .setTemplate(
                CodeTemplate.builder()
                    .addDeclaration(
                        Declaration.create("field.x", Declaration.Kind.FIELD, "long x;"))
                    .build())
            .build();
    StatementTree tree =
        StatementTree.create(
            Manifest.defaults(),
            ImmutableList.of(
                StatementTree.BlockStatement.create(Block.create("first", "a"), a, 0),
                StatementTree.BlockStatement.create(Block.create("second", "b"), b, 1)));

    DeclarationConflictException ex =
        assertThrows(DeclarationConflictException.class, () -> CodeEmitter.emit(tree));
    assertThat(ex.elementId()).isEqualTo("second");
    assertThat(ex).hasMessageThat().contains("'field.x'");
  }

  @Test
  public void identicalDeclarationsAreHoistedOnce() throws CompilerException {
    BlockKind a =
        BlockKind.builder("a")
            .setTemplate(
                CodeTemplate.builder()
                    .addDeclaration(Declaration.create("field.x", Declaration.Kind.FIELD, "int x;"))
                    .addStatement("x = ${id};")
                    .build())
            .build();
    StatementTree tree =
        StatementTree.create(
            Manifest.defaults(),
            ImmutableList.of(
                StatementTree.BlockStatement.create(Block.create("first", "a"), a, 0),
                StatementTree.BlockStatement.create(Block.create("second", "a"), a, 1)));

    CompiledProgram program = CodeEmitter.emit(tree);
    assertThat(program.declarations())
        .containsExactly(Declaration.create("field.x", Declaration.Kind.FIELD, "int x;"));
    assertThat(program.source())
        .contains("typedef struct {\n    int x;\n} new_flipper_app_state_t;");
    assertThat(program.source()).contains("    x = b0;\n    x = b1;\n    return 0;\n}\n");
  }

  @Test
  public void emptyStateStructStillCompiles() throws CompilerException {
    StatementTree tree = StatementTree.create(Manifest.defaults(), ImmutableList.of());
    assertThat(CodeEmitter.emit(tree).source())
        .contains("typedef struct {\n    uint8_t reserved;\n} new_flipper_app_state_t;");
  }

  @Test
  public void headerCommentCannotBeClosedByTheName() throws CompilerException {
    Manifest manifest = Manifest.builder().setName("evil */ int x;").build();
    String source = CodeEmitter.emit(StatementTree.create(manifest, ImmutableList.of())).source();
    assertThat(source).startsWith("/*\n * evil * / int x; v1.0\n");
  }

  private static Project gainProject(String level) throws IOException {
    return ProjectReader.parse(
        ("{'manifest': {'appid': 'demo', 'requires': ['gui']},"
                + " 'canvas': {'blocks': [{'id': 's', 'type': 'start'},"
                + " {'id': 'g', 'type': 'gain', 'properties': {'level': "
                + level
                + "}}],"
                + " 'connections': [{'from': {'block': 's', 'port': 'next'},"
                + " 'to': {'block': 'g', 'port': 'in'}}]}}")
            .replace('\'', '"'));
  }

  @Test
  public void numbersAreWrittenAsCLiterals() throws IOException, CompilerException {
    CompileResult result = new FlipperScriptCompiler(registry).compile(gainProject("2.5"));
    assertThat(result.errors()).isEmpty();
    assertThat(result.program().get().source()).contains("    volume = 2.5;\n");
  }

  @Test
  public void numbersWithoutACLiteralAreRejected() throws IOException, CompilerException {
    CompileResult result = new FlipperScriptCompiler(registry).compile(gainProject("1e400"));
    assertThat(result.succeeded()).isFalse();
    assertThat(result.errors()).hasSize(1);
    Diagnostic d = result.errors().get(0);
    assertThat(d.kind()).isEqualTo(Diagnostic.Kind.PROPERTY_RANGE);
    assertThat(d.elementId()).isEqualTo("g");
    assertThat(d.message()).contains("not a finite number");
  }

  @Test
  public void stringLiterals() {
    assertThat(TemplateRenderer.cStringLiteral("plain")).isEqualTo("\"plain\"");
    assertThat(TemplateRenderer.cStringLiteral("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
    assertThat(TemplateRenderer.cStringLiteral("C:\\dir")).isEqualTo("\"C:\\\\dir\"");
    assertThat(TemplateRenderer.cStringLiteral("line\nbreak\t"))
        .isEqualTo("\"line\\012break\\011\"");
    assertThat(TemplateRenderer.cStringLiteral("??=")).isEqualTo("\"\\?\\?=\"");
    assertThat(TemplateRenderer.cStringLiteral("é")).isEqualTo("\"\\303\\251\"");
    assertThat(TemplateRenderer.cStringLiteral("\0" + "1")).isEqualTo("\"\\0001\"");
  }

  @Test
  public void injectedTextStaysInsideTheLiteral() throws CompilerException {
    String source =
        compile(
            BlockGraph.builder()
                .addBlock("s", "start")
                .addBlock(block("a", "say", "text", "\"); system(\"rm -rf /\"); //\n"))
                .connect("s", "next", "a", "in"),
            "gui");
    assertThat(source).contains("    puts(\"\\\"); system(\\\"rm -rf /\\\"); //\\012\");\n");
  }
}
