package fsc;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;

public class ProjectReaderTest {

  static Project readFixture() throws IOException {
    try (InputStream in = ProjectReaderTest.class.getResourceAsStream("hello_flipper.fsp")) {
      assertThat(in).isNotNull();
      return ProjectReader.read(in);
    }
  }

  private static String json(String json) {
    return json.replace('\'', '"');
  }

  @Test
  public void readsManifest() throws IOException {
    Manifest manifest = readFixture().manifest();
    assertThat(manifest.name()).isEqualTo("Hello Flipper");
    assertThat(manifest.appid()).isEqualTo("hello_flipper");
    assertThat(manifest.version()).isEqualTo("1.2");
    assertThat(manifest.entryPoint()).isEqualTo("hello_flipper_app");
    assertThat(manifest.requires()).containsExactly("gui");
    assertThat(manifest.stackSize()).isEqualTo(2048L);
    assertThat(manifest.icon()).hasValue("hello_10px.png");
  }

  @Test
  public void readsCanvasInOrder() throws IOException {
    BlockGraph graph = readFixture().graph();
    assertThat(graph.blocks().stream().map(Block::id).collect(toImmutableList()))
        .containsExactly("start", "init", "show", "refresh", "wait", "exit")
        .inOrder();
    assertThat(graph.connections()).hasSize(5);
    assertThat(graph.connections().get(0).id()).isEqualTo("start.next -> init.in");
  }

  @Test
  public void propertyValuesKeepTheirJsonTypes() throws IOException {
    BlockGraph graph = readFixture().graph();
    Block show = graph.block("show").get();
    assertThat(show.property("text")).hasValue("Hello \"Flipper\"!");
    assertThat(show.property("x")).hasValue(4L);
    Block wait = graph.block("wait").get();
    assertThat(wait.property("any_key")).hasValue(false);
    // null means "use the default"
    assertThat(wait.property("timeout_ms")).isEmpty();
    assertThat(graph.block("init").get().properties()).isEmpty();
  }

  @Test
  public void metadataIsCarriedThrough() throws IOException {
    Project project = readFixture();
    assertThat(project.metadata()).containsEntry("author", "flipper-dev");
    assertThat(project.metadata()).containsEntry("revision", 3L);
  }

  @Test
  public void missingSectionsUseDefaults() throws IOException {
    Project project = ProjectReader.parse("{}");
    assertThat(project.manifest()).isEqualTo(Manifest.defaults());
    assertThat(project.graph().blocks()).isEmpty();
    assertThat(project.metadata()).isEmpty();
  }

  @Test
  public void floatingPointProperties() throws IOException {
    Project project =
        ProjectReader.parse(
            json(
                "{'canvas': {'blocks': [{'id': 'a', 'type': 'delay',"
                    + " 'properties': {'duration_ms': 2.5}}]}}"));
    assertThat(project.graph().blocks().get(0).property("duration_ms")).hasValue(2.5);
  }

  @Test
  public void malformedJson() {
    ProjectFormatException ex =
        assertThrows(ProjectFormatException.class, () -> ProjectReader.parse("{\"canvas\": "));
    assertThat(ex).hasMessageThat().contains("not a JSON document");
  }

  @Test
  public void notAnObject() {
    assertThrows(ProjectFormatException.class, () -> ProjectReader.parse("[1, 2]"));
  }

  @Test
  public void blockWithoutId() {
    ProjectFormatException ex =
        assertThrows(
            ProjectFormatException.class,
            () -> ProjectReader.parse(json("{'canvas': {'blocks': [{'type': 'delay'}]}}")));
    assertThat(ex).hasMessageThat().contains("'canvas.blocks[0].id' must be a string");
  }

  @Test
  public void connectionWithoutTarget() {
    ProjectFormatException ex =
        assertThrows(
            ProjectFormatException.class,
            () ->
                ProjectReader.parse(
                    json(
                        "{'canvas': {'connections':"
                            + " [{'from': {'block': 'a', 'port': 'next'}}]}}")));
    assertThat(ex).hasMessageThat().contains("'canvas.connections[0].to.block'");
  }

  @Test
  public void wrongManifestTypes() {
    assertThrows(
        ProjectFormatException.class,
        () -> ProjectReader.parse(json("{'manifest': {'requires': 'gui'}}")));
    assertThrows(
        ProjectFormatException.class,
        () -> ProjectReader.parse(json("{'manifest': {'stack_size': '1k'}}")));
    assertThrows(
        ProjectFormatException.class,
        () -> ProjectReader.parse(json("{'manifest': {'appid': 7}}")));
  }
}
