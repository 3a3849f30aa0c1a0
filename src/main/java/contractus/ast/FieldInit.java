package contractus.ast;

public record FieldInit(String name, Expr value, Span span) implements Node {
}
