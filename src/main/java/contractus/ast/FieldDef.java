package contractus.ast;

public record FieldDef(String name, TypeRef type, Span span) implements Node {
}
