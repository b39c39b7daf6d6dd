package fsc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Generated C source and the declarations hoisted into it, in first-use order. */
@AutoValue
public abstract class CompiledProgram {

  public abstract String source();

  public abstract ImmutableList<Declaration> declarations();

  public static CompiledProgram create(String source, Iterable<Declaration> declarations) {
    return new AutoValue_CompiledProgram(source, ImmutableList.copyOf(declarations));
  }
}
