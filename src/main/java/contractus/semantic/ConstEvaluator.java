package contractus.semantic;

import com.google.common.collect.ImmutableMap;
import contractus.ast.BinaryExpr;
import contractus.ast.BinaryOp;
import contractus.ast.BoolLiteral;
import contractus.ast.ConstDef;
import contractus.ast.Expr;
import contractus.ast.IntLiteral;
import contractus.ast.NameExpr;
import contractus.ast.UnaryExpr;
import contractus.ast.UnaryOp;
import contractus.types.ScalarType;
import contractus.types.Type;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds constant initializers at compile time. An initializer may use integer
 * and bool literals, other constants in any order, {@code -}, {@code !} and
 * the binary operators. Arithmetic wraps exactly as it does at run time.
 */
final class ConstEvaluator {
	private record Value(Type type, long bits) {
	}

	private final Map<String, ConstDef> defs;
	private final Map<String, Type> declaredTypes;
	private final Set<String> functions;
	private final List<SemanticError> errors;

	private final Map<String, Constant> done = new LinkedHashMap<>();
	private final Set<String> failed = new HashSet<>();
	private final Set<String> visiting = new HashSet<>();

	/**
	 * @param declaredTypes resolved type of each constant, absent when the
	 *                      type was rejected
	 * @param functions     names that are functions rather than constants
	 */
	ConstEvaluator(Map<String, ConstDef> defs, Map<String, Type> declaredTypes, Set<String> functions,
			List<SemanticError> errors) {
		this.defs = defs;
		this.declaredTypes = declaredTypes;
		this.functions = functions;
		this.errors = errors;
	}

	ImmutableMap<String, Constant> evaluate() {
		defs.keySet().forEach(this::constant);
		ImmutableMap.Builder<String, Constant> ordered = ImmutableMap.builder();
		for (String name : defs.keySet()) {
			Constant constant = done.get(name);
			if (constant != null) {
				ordered.put(name, constant);
			}
		}
		return ordered.build();
	}

	private Constant constant(String name) {
		if (done.containsKey(name)) {
			return done.get(name);
		}
		if (failed.contains(name)) {
			return null;
		}
		ConstDef def = defs.get(name);
		if (!visiting.add(name)) {
			errors.add(SemanticError.semantic("constant `" + name + "` depends on itself", def.span()));
			failed.add(name);
			return null;
		}
		Type type = declaredTypes.get(name);
		Value value = type == null ? null : eval(def.value(), type);
		visiting.remove(name);

		if (failed.contains(name)) {
			return null;
		}
		if (value == null) {
			failed.add(name);
			return null;
		}
		if (!value.type().equals(type)) {
			errors.add(SemanticError.typeMismatch(type, value.type(), def.value().span()));
			failed.add(name);
			return null;
		}
		Constant constant = new Constant(name, type, value.bits());
		done.put(name, constant);
		return constant;
	}

	private Value eval(Expr expr, Type hint) {
		if (expr instanceof IntLiteral literal) {
			return literal(literal.value(), hint, expr);
		}
		if (expr instanceof BoolLiteral literal) {
			return new Value(ScalarType.BOOL, literal.value() ? 1 : 0);
		}
		if (expr instanceof NameExpr name) {
			return named(name);
		}
		if (expr instanceof UnaryExpr unary) {
			return unary(unary);
		}
		if (expr instanceof BinaryExpr binary) {
			return binary(binary, hint);
		}
		errors.add(SemanticError.semantic("constant initializers may only use literals, constants and operators",
				expr.span()));
		return null;
	}

	private Value literal(long value, Type hint, Expr at) {
		if (hint == ScalarType.U8 && value >= 0 && value <= 255) {
			return new Value(ScalarType.U8, value);
		}
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			errors.add(SemanticError.typeError("integer literal `" + value + "` does not fit in `i32`", at.span()));
			return null;
		}
		return new Value(ScalarType.I32, value);
	}

	private Value named(NameExpr name) {
		if (defs.containsKey(name.name())) {
			Constant constant = constant(name.name());
			return constant == null ? null : new Value(constant.type(), constant.value());
		}
		if (functions.contains(name.name())) {
			errors.add(SemanticError.semantic("`" + name.name() + "` is a function, not a constant", name.span()));
		} else {
			errors.add(SemanticError.undefinedVariable(name.name(), name.span()));
		}
		return null;
	}

	private Value unary(UnaryExpr unary) {
		if (unary.op() == UnaryOp.NEG && unary.operand() instanceof IntLiteral literal) {
			return literal(-literal.value(), null, unary);
		}
		if (unary.op() == UnaryOp.NEG) {
			Value operand = eval(unary.operand(), ScalarType.I32);
			if (operand == null) {
				return null;
			}
			if (operand.type() != ScalarType.I32) {
				errors.add(SemanticError.typeError("cannot negate a value of type `" + operand.type() + "`",
						unary.span()));
				return null;
			}
			return new Value(ScalarType.I32, (int) -operand.bits());
		}
		if (unary.op() == UnaryOp.NOT) {
			Value operand = eval(unary.operand(), ScalarType.BOOL);
			if (operand == null) {
				return null;
			}
			if (operand.type() != ScalarType.BOOL) {
				errors.add(SemanticError.typeMismatch(ScalarType.BOOL, operand.type(), unary.operand().span()));
				return null;
			}
			return new Value(ScalarType.BOOL, 1 - operand.bits());
		}
		errors.add(SemanticError.semantic("constant initializers may only use literals, constants and operators",
				unary.span()));
		return null;
	}

	private Value binary(BinaryExpr binary, Type hint) {
		BinaryOp op = binary.op();
		Type operandHint = (op.isArithmetic() || op.isBitwise()) && hint != null && hint.isInteger() ? hint : null;
		if (op.isLogical()) {
			operandHint = ScalarType.BOOL;
		}
		Value left;
		Value right;
		if (isIntLiteral(binary.left()) && !isIntLiteral(binary.right())) {
			right = eval(binary.right(), operandHint);
			left = right == null ? null : eval(binary.left(), right.type());
		} else {
			left = eval(binary.left(), operandHint);
			right = left == null ? null : eval(binary.right(), left.type());
		}
		if (left == null || right == null) {
			return null;
		}
		if (!right.type().equals(left.type())) {
			errors.add(SemanticError.typeMismatch(left.type(), right.type(), binary.right().span()));
			return null;
		}

		Type type = left.type();
		boolean bools = type == ScalarType.BOOL;
		boolean allowed;
		if (op.isLogical()) {
			allowed = bools;
		} else if (op.isEquality() || op.isBitwise() && !op.isShift()) {
			allowed = bools || type.isInteger();
		} else {
			allowed = type.isInteger();
		}
		if (!allowed) {
			errors.add(SemanticError.typeError("operator `" + op.symbol() + "` cannot be applied to `" + type + "`",
					binary.left().span()));
			return null;
		}

		long a = left.bits();
		long b = right.bits();
		if ((op == BinaryOp.DIV || op == BinaryOp.REM) && b == 0) {
			errors.add(SemanticError.semantic("division by zero in constant", binary.span()));
			return null;
		}
		return switch (op) {
			case EQ -> bool(a == b);
			case NE -> bool(a != b);
			case LT -> bool(a < b);
			case LE -> bool(a <= b);
			case GT -> bool(a > b);
			case GE -> bool(a >= b);
			case AND -> bool(a != 0 && b != 0);
			case OR -> bool(a != 0 || b != 0);
			default -> new Value(type, wrap(type, arithmetic(op, type, a, b)));
		};
	}

	private static boolean isIntLiteral(Expr expr) {
		return expr instanceof IntLiteral
				|| expr instanceof UnaryExpr unary && unary.op() == UnaryOp.NEG && unary.operand() instanceof IntLiteral;
	}

	private static long arithmetic(BinaryOp op, Type type, long a, long b) {
		int width = type == ScalarType.I32 ? 32 : 8;
		return switch (op) {
			case ADD -> a + b;
			case SUB -> a - b;
			case MUL -> a * b;
			// the quotient of the minimum and -1 wraps back to the minimum
			case DIV -> a / b;
			case REM -> a % b;
			case BIT_AND -> a & b;
			case BIT_OR -> a | b;
			case BIT_XOR -> a ^ b;
			case SHL -> a << (b & (width - 1));
			case SHR -> a >> (b & (width - 1));
			default -> throw new IllegalArgumentException("not an arithmetic operator: " + op);
		};
	}

	private static long wrap(Type type, long value) {
		if (type == ScalarType.I32) {
			return (int) value;
		}
		if (type == ScalarType.U8) {
			return value & 0xFF;
		}
		return value;
	}

	private static Value bool(boolean value) {
		return new Value(ScalarType.BOOL, value ? 1 : 0);
	}
}
