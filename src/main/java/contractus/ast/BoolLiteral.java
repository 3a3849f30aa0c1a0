package contractus.ast;

public record BoolLiteral(boolean value, Span span) implements Expr {
}
