package contractus.ast;

public record WhileStmt(Expr condition, Block body, Span span) implements Stmt {
}
