package contractus.ast;

public record ExprStmt(Expr expr, Span span) implements Stmt {
}
