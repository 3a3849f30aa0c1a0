package contractus.ast;

public record ContinueStmt(Span span) implements Stmt {
}
