package contractus.semantic;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableMap;
import contractus.ast.Expr;
import contractus.ast.LetStmt;
import contractus.ast.Program;
import contractus.types.FunctionType;
import contractus.types.Type;

import java.util.Map;
import java.util.Set;

/**
 * A checked program: the AST plus struct layouts, function signatures,
 * constant values and the resolved type of every expression. Expression-keyed tables use identity.
 */
public record TypedProgram(
		Program program,
		LayoutTable layouts,
		ImmutableMap<String, FunctionType> signatures,
		ImmutableMap<String, Constant> constants,
		Map<Expr, Type> expressionTypes,
		Map<LetStmt, Type> bindingTypes,
		Set<Expr> sliceCoercions) {

	public Type typeOf(Expr expr) {
		return Verify.verifyNotNull(expressionTypes.get(expr), "no type recorded for %s", expr);
	}

	public Type typeOf(LetStmt let) {
		return Verify.verifyNotNull(bindingTypes.get(let), "no type recorded for let %s", let.name());
	}

	/**
	 * Whether this array-typed expression is used where a slice is expected.
	 */
	public boolean coercesToSlice(Expr expr) {
		return sliceCoercions.contains(expr);
	}
}
