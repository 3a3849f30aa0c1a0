package contractus.ast;

public record SliceTypeRef(TypeRef element, Span span) implements TypeRef {
}
