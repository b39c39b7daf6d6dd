package fsc;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

/**
 * Reads a saved project:
 *
 * <pre>
 * {"version": ..., "metadata": {...}, "manifest": {...},
 *  "canvas": {"blocks": [{"id", "type", "x", "y", "properties"}],
 *             "connections": [{"from": {"block", "port"}, "to": {"block", "port"}}]}}
 * </pre>
 *
 * Block positions and any top-level keys besides these are ignored.
 */
public final class ProjectReader {

  private ProjectReader() {}

  public static Project read(File file) throws IOException {
    return parse(Files.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  public static Project read(InputStream in) throws IOException {
    return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
  }

  public static Project parse(String json) throws ProjectFormatException {
    JsonNode root;
    try {
      root = JsonValues.MAPPER.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new ProjectFormatException("not a JSON document: " + ex.getOriginalMessage());
    }
    if (root == null || !root.isObject())
      throw new ProjectFormatException("project must be a JSON object");

    return Project.create(
        readMetadata(root.path("metadata")),
        readManifest(root.path("manifest")),
        readCanvas(root.path("canvas")));
  }

  private static ImmutableMap<String, Object> readMetadata(JsonNode node) {
    ImmutableMap.Builder<String, Object> metadata = ImmutableMap.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonValues.toValue(field.getValue()).ifPresent(v -> metadata.put(field.getKey(), v));
    }
    return metadata.build();
  }

  private static Manifest readManifest(JsonNode node) throws ProjectFormatException {
    Manifest.Builder manifest = Manifest.builder();
    if (node.isMissingNode()) return manifest.build();
    if (!node.isObject()) throw new ProjectFormatException("'manifest' must be an object");

    if (node.hasNonNull("name")) manifest.setName(string(node, "name", "manifest.name"));
    if (node.hasNonNull("appid")) manifest.setAppid(string(node, "appid", "manifest.appid"));
    if (node.hasNonNull("version"))
      manifest.setVersion(string(node, "version", "manifest.version"));
    if (node.hasNonNull("entry_point"))
      manifest.setEntryPoint(string(node, "entry_point", "manifest.entry_point"));
    if (node.hasNonNull("requires")) {
      JsonNode requires = node.get("requires");
      if (!requires.isArray())
        throw new ProjectFormatException("'manifest.requires' must be an array of strings");
      ImmutableList.Builder<String> subsystems = ImmutableList.builder();
      for (JsonNode subsystem : requires) {
        if (!subsystem.isTextual())
          throw new ProjectFormatException("'manifest.requires' must be an array of strings");
        subsystems.add(subsystem.textValue());
      }
      manifest.setRequires(subsystems.build());
    }
    if (node.hasNonNull("stack_size")) {
      JsonNode stackSize = node.get("stack_size");
      if (!stackSize.isIntegralNumber() || !stackSize.canConvertToLong())
        throw new ProjectFormatException("'manifest.stack_size' must be an integer");
      manifest.setStackSize(stackSize.longValue());
    }
    if (node.hasNonNull("icon")) manifest.setIcon(string(node, "icon", "manifest.icon"));
    return manifest.build();
  }

  private static BlockGraph readCanvas(JsonNode node) throws ProjectFormatException {
    BlockGraph.Builder graph = BlockGraph.builder();
    if (node.isMissingNode()) return graph.build();

    int i = 0;
    for (JsonNode block : array(node, "blocks", "canvas.blocks")) {
      String where = String.format("canvas.blocks[%d]", i++);
      Map<String, Object> properties = new LinkedHashMap<>();
      JsonNode props = block.path("properties");
      if (!props.isMissingNode() && !props.isNull() && !props.isObject())
        throw new ProjectFormatException(String.format("'%s.properties' must be an object", where));
      Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        JsonValues.toValue(field.getValue()).ifPresent(v -> properties.put(field.getKey(), v));
      }
      graph.addBlock(
          Block.create(
              string(block, "id", where + ".id"),
              string(block, "type", where + ".type"),
              properties));
    }

    i = 0;
    for (JsonNode connection : array(node, "connections", "canvas.connections")) {
      String where = String.format("canvas.connections[%d]", i++);
      JsonNode from = connection.path("from");
      JsonNode to = connection.path("to");
      graph.connect(
          string(from, "block", where + ".from.block"),
          string(from, "port", where + ".from.port"),
          string(to, "block", where + ".to.block"),
          string(to, "port", where + ".to.port"));
    }
    return graph.build();
  }

  private static JsonNode array(JsonNode parent, String field, String where)
      throws ProjectFormatException {
    JsonNode node = parent.path(field);
    if (node.isMissingNode() || node.isNull()) return JsonValues.MAPPER.createArrayNode();
    if (!node.isArray())
      throw new ProjectFormatException(String.format("'%s' must be an array", where));
    return node;
  }

  private static String string(JsonNode parent, String field, String where)
      throws ProjectFormatException {
    JsonNode node = parent.get(field);
    if (node == null || !node.isTextual())
      throw new ProjectFormatException(String.format("'%s' must be a string", where));
    return node.textValue();
  }
}
