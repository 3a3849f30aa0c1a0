package contractus.ast;

public record RangeExpr(Expr start, Expr end, boolean inclusive, Span span) implements Expr {
}
