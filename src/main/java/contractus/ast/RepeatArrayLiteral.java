package contractus.ast;

public record RepeatArrayLiteral(Expr element, int count, Span span) implements Expr {
}
