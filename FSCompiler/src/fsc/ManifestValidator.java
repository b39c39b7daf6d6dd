package fsc;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** Checks the manifest fields and cross-checks its requirements against the blocks present. */
final class ManifestValidator extends ErrorCollectingValidator {
  private static final Pattern APPID = Pattern.compile("[a-z][a-z0-9_]*");
  private static final Pattern C_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final BlockRegistry registry;
  private final Manifest manifest;

  ManifestValidator(BlockRegistry registry, Manifest manifest) {
    this.registry = registry;
    this.manifest = manifest;
  }

  @Override
  void validate(BlockGraph graph) {
    if (manifest.name().trim().isEmpty()) logInvalid("name", "application name is empty");
    if (!APPID.matcher(manifest.appid()).matches())
      logInvalid(
          "appid",
          String.format(
              "'%s' is not a valid application id; use lowercase letters, digits and underscores,"
                  + " starting with a letter",
              manifest.appid()));
    if (manifest.version().trim().isEmpty()) logInvalid("version", "version is empty");
    if (!C_IDENTIFIER.matcher(manifest.entryPoint()).matches())
      logInvalid(
          "entry_point",
          String.format("'%s' is not a valid C identifier", manifest.entryPoint()));
    if (manifest.requires().isEmpty())
      logInvalid("requires", "at least one required subsystem must be listed");
    if (manifest.stackSize() <= 0)
      logInvalid(
          "stack_size", String.format("stack size must be positive, was %d", manifest.stackSize()));

    Set<String> initialized = new LinkedHashSet<>();
    for (Block block : graph.blocks()) {
      registry
          .find(block.kindId())
          .flatMap(BlockKind::initializes)
          .ifPresent(
              subsystem -> {
                initialized.add(subsystem);
                if (!manifest.requires().contains(subsystem))
                  logError(
                      Diagnostic.Kind.UNDECLARED_REQUIREMENT,
                      block.id(),
                      String.format(
                          "'%s' initializes subsystem '%s', which the manifest does not require",
                          block.id(), subsystem));
              });
    }
    for (String subsystem : manifest.requires()) {
      if (!initialized.contains(subsystem))
        logError(
            Diagnostic.Kind.UNUSED_REQUIREMENT,
            "manifest.requires",
            String.format("subsystem '%s' is required but no block initializes it", subsystem));
    }
  }

  private void logInvalid(String field, String msg) {
    logError(Diagnostic.Kind.INVALID_MANIFEST, "manifest." + field, msg);
  }
}
