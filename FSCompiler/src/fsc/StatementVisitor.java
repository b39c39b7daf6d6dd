package fsc;

public interface StatementVisitor<V> {
  V visit(StatementTree.BlockStatement statement, V value) throws CompilerException;

  V visit(StatementTree.Branch branch, V value) throws CompilerException;
}
