package contractus.ast;

public record BreakStmt(Span span) implements Stmt {
}
