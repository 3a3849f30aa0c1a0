package contractus.ast;

import java.util.List;

public record ArrayLiteral(List<Expr> elements, Span span) implements Expr {
}
