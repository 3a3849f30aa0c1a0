package contractus.ast;

public record ReturnStmt(Expr value, Span span) implements Stmt {
}
