package contractus.ast;

public record NameExpr(String name, Span span) implements Expr {
}
