package contractus.ast;

import java.util.List;

public record StructLiteral(String name, List<FieldInit> fields, Span span) implements Expr {
}
