package contractus.ast;

public record BlockStmt(Block block, Span span) implements Stmt {
}
