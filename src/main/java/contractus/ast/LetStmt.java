package contractus.ast;

/**
 * {@code let mut? name (: type)? (= init)?;}. Both {@code type} and
 * {@code init} may be null, but not at the same time.
 */
public record LetStmt(String name, boolean mutable, TypeRef type, Expr init, Span span) implements Stmt {
}
