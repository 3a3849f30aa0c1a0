package contractus.ast;

public record FieldExpr(Expr target, String field, Span span) implements Expr {
}
