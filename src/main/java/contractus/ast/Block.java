package contractus.ast;

import java.util.List;

public record Block(List<Stmt> stmts, Span span) implements Node {
}
