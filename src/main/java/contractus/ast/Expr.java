package contractus.ast;

public sealed interface Expr extends Node
		permits IntLiteral, BoolLiteral, NameExpr, BinaryExpr, UnaryExpr, AssignExpr, CallExpr, FieldExpr, IndexExpr,
		StructLiteral, ArrayLiteral, RepeatArrayLiteral, RangeExpr, CastExpr {
}
