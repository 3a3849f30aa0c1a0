package contractus.ast;

public record NamedTypeRef(String name, Span span) implements TypeRef {
}
