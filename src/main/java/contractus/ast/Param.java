package contractus.ast;

public record Param(String name, boolean mutable, TypeRef type, Span span) implements Node {
}
