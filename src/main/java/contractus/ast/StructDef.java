package contractus.ast;

import java.util.List;

public record StructDef(String name, List<FieldDef> fields, Span span) implements Item {
}
