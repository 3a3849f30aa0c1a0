package contractus.ast;

public record IndexExpr(Expr target, Expr index, Span span) implements Expr {
}
