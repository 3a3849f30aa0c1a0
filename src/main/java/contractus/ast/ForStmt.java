package contractus.ast;

public record ForStmt(String variable, boolean mutable, Expr iterable, Block body, Span span) implements Stmt {
}
