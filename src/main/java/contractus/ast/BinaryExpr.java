package contractus.ast;

public record BinaryExpr(BinaryOp op, Expr left, Expr right, Span span) implements Expr {
}
