package contractus.ast;

/**
 * A type as written in source, before resolution.
 */
public sealed interface TypeRef extends Node
		permits NamedTypeRef, ArrayTypeRef, SliceTypeRef, PointerTypeRef, FunctionTypeRef, UnitTypeRef {
}
