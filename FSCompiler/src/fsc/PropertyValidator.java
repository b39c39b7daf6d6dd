package fsc;

import java.util.Optional;

/** Checks block properties against their kind's schema. */
final class PropertyValidator extends ErrorCollectingValidator {
  private final BlockRegistry registry;

  PropertyValidator(BlockRegistry registry) {
    this.registry = registry;
  }

  @Override
  void validate(BlockGraph graph) {
    for (Block block : graph.blocks()) {
      registry.find(block.kindId()).ifPresent(kind -> validateBlock(block, kind));
    }
  }

  private void validateBlock(Block block, BlockKind kind) {
    for (PropertySpec spec : kind.properties().values()) {
      Optional<Object> value = block.property(spec.name());
      if (!value.isPresent()) {
        if (spec.required())
          logError(
              Diagnostic.Kind.PROPERTY_MISSING,
              block.id(),
              String.format("required property '%s' is not set", spec.name()));
        continue;
      }

      try {
        spec.check(block.id(), value.get());
      } catch (DiagnosticException ex) {
        logError(ex.diagnostic());
      }
    }

    for (String name : block.properties().keySet()) {
      if (!kind.property(name).isPresent())
        logError(
            Diagnostic.Kind.UNKNOWN_PROPERTY,
            block.id(),
            String.format("block kind '%s' has no property '%s'", kind.kindId(), name));
    }
  }
}
