package fsc;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/** Rendered declarations keyed by declaration key, in first-use order. */
final class DeclarationTable {
  private final Map<String, Declaration> declarations = new LinkedHashMap<>();

  void add(String blockId, Declaration declaration) throws DeclarationConflictException {
    Declaration previous = declarations.putIfAbsent(declaration.key(), declaration);
    if (previous != null && !previous.equals(declaration))
      throw new DeclarationConflictException(blockId, declaration.key());
  }

  ImmutableList<Declaration> all() {
    return ImmutableList.copyOf(declarations.values());
  }

  ImmutableList<Declaration> ofKind(Declaration.Kind kind) {
    return declarations
        .values()
        .stream()
        .filter(d -> d.kind() == kind)
        .collect(ImmutableList.toImmutableList());
  }
}
