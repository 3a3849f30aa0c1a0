package contractus.ast;

public record IfStmt(Expr condition, Block thenBlock, Block elseBlock, Span span) implements Stmt {
}
