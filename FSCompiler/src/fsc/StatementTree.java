package fsc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Structured form of a validated graph: a sequence of block statements and branches. */
@AutoValue
public abstract class StatementTree {

  public interface Statement {
    Block block();

    BlockKind kind();

    /** Arena index of the block, used to derive its {@code ${id}}. */
    int index();

    <V> V accept(StatementVisitor<V> visitor, V value) throws CompilerException;
  }

  /** One non-branching block. */
  @AutoValue
  public abstract static class BlockStatement implements Statement {
    @Override
    public abstract Block block();

    @Override
    public abstract BlockKind kind();

    @Override
    public abstract int index();

    public static BlockStatement create(Block block, BlockKind kind, int index) {
      return new AutoValue_StatementTree_BlockStatement(block, kind, index);
    }

    @Override
    public final <V> V accept(StatementVisitor<V> visitor, V value) throws CompilerException {
      return visitor.visit(this, value);
    }
  }

  /** The code following one output connector of a branch. */
  @AutoValue
  public abstract static class Arm {
    public abstract String connector();

    public abstract ImmutableList<Statement> statements();

    /** Control leaves the arm by continuing after the enclosing branch rather than exiting. */
    public abstract boolean fallsThrough();

    public static Arm create(
        String connector, Iterable<Statement> statements, boolean fallsThrough) {
      return new AutoValue_StatementTree_Arm(
          connector, ImmutableList.copyOf(statements), fallsThrough);
    }
  }

  /**
   * A block with several outputs. Arms are in output declaration order; the last one is the else
   * arm.
   */
  @AutoValue
  public abstract static class Branch implements Statement {
    @Override
    public abstract Block block();

    @Override
    public abstract BlockKind kind();

    @Override
    public abstract int index();

    public abstract ImmutableList<Arm> arms();

    /** Where sequencing resumes after the arms, when they reconverge inside this sequence. */
    public abstract Optional<String> join();

    public final boolean anyArmFallsThrough() {
      return arms().stream().anyMatch(Arm::fallsThrough);
    }

    public static Branch create(
        Block block, BlockKind kind, int index, Iterable<Arm> arms, Optional<String> join) {
      return new AutoValue_StatementTree_Branch(
          block, kind, index, ImmutableList.copyOf(arms), join);
    }

    @Override
    public final <V> V accept(StatementVisitor<V> visitor, V value) throws CompilerException {
      return visitor.visit(this, value);
    }
  }

  public abstract Manifest manifest();

  public abstract ImmutableList<Statement> statements();

  public static StatementTree create(Manifest manifest, Iterable<Statement> statements) {
    return new AutoValue_StatementTree(manifest, ImmutableList.copyOf(statements));
  }
}
