package contractus.ast;

public record UnitTypeRef(Span span) implements TypeRef {
}
