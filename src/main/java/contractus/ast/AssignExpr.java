package contractus.ast;

/**
 * {@code target = value}, or {@code target op= value} when {@code compoundOp}
 * is not null.
 */
public record AssignExpr(Expr target, BinaryOp compoundOp, Expr value, Span span) implements Expr {
}
