package contractus.ast;

/**
 * Root of the closed AST node set. Every node carries the span covering its
 * tokens.
 */
public sealed interface Node permits Program, Item, Param, FieldDef, FieldInit, Block, Stmt, Expr, TypeRef {
	Span span();
}
