package contractus.ast;

public record PointerTypeRef(TypeRef pointee, Span span) implements TypeRef {
}
