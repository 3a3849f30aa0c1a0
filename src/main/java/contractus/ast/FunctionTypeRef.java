package contractus.ast;

import java.util.List;

public record FunctionTypeRef(List<TypeRef> params, TypeRef returnType, Span span) implements TypeRef {
}
