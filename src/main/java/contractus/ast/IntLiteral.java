package contractus.ast;

public record IntLiteral(long value, Span span) implements Expr {
}
