package contractus.ast;

public record UnaryExpr(UnaryOp op, Expr operand, Span span) implements Expr {
}
