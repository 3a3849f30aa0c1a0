package contractus.ast;

import java.util.List;

public record CallExpr(String callee, List<Expr> args, Span span) implements Expr {
}
