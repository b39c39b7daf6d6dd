package fsc;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

/**
 * Reads a block catalog of the form {@code {"blockCategories": [{"name": ..., "blocks": [...]}]}}
 * into a {@link BlockRegistry}.
 */
public final class BlockRegistryLoader {

  private BlockRegistryLoader() {}

  public static BlockRegistry load(URL url) throws IOException {
    try (InputStream in = url.openStream()) {
      return load(in);
    }
  }

  public static BlockRegistry load(InputStream in) throws IOException {
    return parse(JsonValues.MAPPER.readTree(in));
  }

  public static BlockRegistry parse(String json) throws IOException {
    return parse(JsonValues.MAPPER.readTree(json));
  }

  private static BlockRegistry parse(JsonNode root) {
    JsonNode categories = root.path("blockCategories");
    if (!categories.isArray())
      throw new RegistryMisconfiguredException("catalog has no 'blockCategories' array");

    BlockRegistry.Builder registry = BlockRegistry.builder();
    for (JsonNode category : categories) {
      String categoryName = category.path("name").asText("");
      for (JsonNode block : category.path("blocks")) {
        registry.add(parseKind(categoryName, block));
      }
    }
    return registry.build();
  }

  private static BlockKind parseKind(String category, JsonNode node) {
    String kindId =
        JsonValues.text(node, "id")
            .orElseThrow(() -> new RegistryMisconfiguredException("block kind without an 'id'"));

    BlockKind.Builder builder =
        BlockKind.builder(kindId)
            .setCategory(category)
            .setName(node.path("name").asText(kindId))
            .setDescription(node.path("description").asText(""))
            .setEntry(node.path("entry").asBoolean(false))
            .setExit(node.path("exit").asBoolean(false));
    JsonValues.toLines(node.get("inputs")).forEach(builder::addInput);
    JsonValues.toLines(node.get("outputs")).forEach(builder::addOutput);
    JsonValues.toLines(node.get("requires")).forEach(builder::addRequirement);
    JsonValues.text(node, "initializes").ifPresent(builder::setInitializes);

    for (JsonNode property : node.path("properties")) {
      builder.addProperty(parseProperty(kindId, property));
    }
    builder.setTemplate(parseTemplate(kindId, node.path("template")));
    return builder.build();
  }

  private static PropertySpec parseProperty(String kindId, JsonNode node) {
    String name =
        JsonValues.text(node, "name")
            .orElseThrow(
                () ->
                    new RegistryMisconfiguredException(
                        String.format("kind '%s' has a property without a name", kindId)));
    String typeName = node.path("type").asText("");
    PropertySpec.Type type =
        PropertySpec.Type.parse(typeName)
            .orElseThrow(
                () ->
                    new RegistryMisconfiguredException(
                        String.format(
                            "kind '%s' property '%s' has unknown type '%s'",
                            kindId, name, typeName)));

    PropertySpec.Builder builder =
        PropertySpec.builder(name, type)
            .setRequired(node.path("required").asBoolean(false))
            .setEnumValues(JsonValues.toLines(node.get("options")));
    JsonValues.toValue(node.get("default")).ifPresent(builder::setDefaultValue);
    if (node.path("min").isNumber()) builder.setMin(node.get("min").doubleValue());
    if (node.path("max").isNumber()) builder.setMax(node.get("max").doubleValue());
    if (node.path("maxLength").canConvertToInt()
        && node.path("maxLength").isIntegralNumber())
      builder.setMaxLength(node.get("maxLength").intValue());
    return builder.build();
  }

  private static CodeTemplate parseTemplate(String kindId, JsonNode node) {
    CodeTemplate.Builder builder = CodeTemplate.builder();
    if (node.isMissingNode()) return builder.build();

    JsonValues.toLines(node.get("statements")).forEach(builder::addStatement);
    for (JsonNode declaration : node.path("declarations")) {
      builder.addDeclaration(parseDeclaration(kindId, declaration));
    }
    Iterator<Map.Entry<String, JsonNode>> conditions = node.path("conditions").fields();
    while (conditions.hasNext()) {
      Map.Entry<String, JsonNode> condition = conditions.next();
      builder.putCondition(condition.getKey(), condition.getValue().asText());
    }
    JsonNode acquires = node.get("acquires");
    if (acquires != null && !acquires.isNull()) {
      String key =
          JsonValues.text(acquires, "key")
              .orElseThrow(
                  () ->
                      new RegistryMisconfiguredException(
                          String.format("kind '%s' acquires a resource without a key", kindId)));
      builder.setAcquires(
          CodeTemplate.Acquisition.create(key, JsonValues.toLines(acquires.get("teardown"))));
    }
    JsonValues.text(node, "releases").ifPresent(builder::setReleases);
    return builder.build();
  }

  private static Declaration parseDeclaration(String kindId, JsonNode node) {
    String key =
        JsonValues.text(node, "key")
            .orElseThrow(
                () ->
                    new RegistryMisconfiguredException(
                        String.format("kind '%s' has a declaration without a key", kindId)));
    String kindName = node.path("kind").asText("");
    Declaration.Kind kind;
    try {
      kind = Declaration.Kind.valueOf(kindName.toUpperCase());
    } catch (IllegalArgumentException ex) {
      throw new RegistryMisconfiguredException(
          String.format("kind '%s' declaration '%s' has unknown kind '%s'", kindId, key, kindName),
          ex);
    }
    ImmutableList<String> lines = JsonValues.toLines(node.get("lines"));
    if (lines.isEmpty())
      throw new RegistryMisconfiguredException(
          String.format("kind '%s' declaration '%s' is empty", kindId, key));
    return Declaration.create(key, kind, lines);
  }
}
