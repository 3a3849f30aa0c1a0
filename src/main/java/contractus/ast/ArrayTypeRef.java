package contractus.ast;

public record ArrayTypeRef(TypeRef element, int length, Span span) implements TypeRef {
}
