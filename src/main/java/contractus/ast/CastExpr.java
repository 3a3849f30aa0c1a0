package contractus.ast;

public record CastExpr(Expr operand, TypeRef type, Span span) implements Expr {
}
