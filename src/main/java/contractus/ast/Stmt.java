package contractus.ast;

public sealed interface Stmt extends Node
		permits LetStmt, ExprStmt, ReturnStmt, IfStmt, WhileStmt, ForStmt, BreakStmt, ContinueStmt, BlockStmt {
}
