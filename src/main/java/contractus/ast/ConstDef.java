package contractus.ast;

/**
 * {@code const NAME: T = value;} at the top level.
 */
public record ConstDef(String name, TypeRef type, Expr value, Span span) implements Item {
}
