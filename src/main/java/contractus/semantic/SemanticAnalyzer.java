package contractus.semantic;

import com.google.common.collect.ImmutableMap;
import contractus.ast.ArrayLiteral;
import contractus.ast.ArrayTypeRef;
import contractus.ast.AssignExpr;
import contractus.ast.BinaryExpr;
import contractus.ast.BinaryOp;
import contractus.ast.Block;
import contractus.ast.BlockStmt;
import contractus.ast.BoolLiteral;
import contractus.ast.BreakStmt;
import contractus.ast.CallExpr;
import contractus.ast.CastExpr;
import contractus.ast.ConstDef;
import contractus.ast.ContinueStmt;
import contractus.ast.Expr;
import contractus.ast.ExprStmt;
import contractus.ast.FieldDef;
import contractus.ast.FieldExpr;
import contractus.ast.FieldInit;
import contractus.ast.ForStmt;
import contractus.ast.FunctionDef;
import contractus.ast.FunctionTypeRef;
import contractus.ast.IfStmt;
import contractus.ast.IndexExpr;
import contractus.ast.IntLiteral;
import contractus.ast.LetStmt;
import contractus.ast.NameExpr;
import contractus.ast.NamedTypeRef;
import contractus.ast.Param;
import contractus.ast.PointerTypeRef;
import contractus.ast.Program;
import contractus.ast.RangeExpr;
import contractus.ast.RepeatArrayLiteral;
import contractus.ast.ReturnStmt;
import contractus.ast.SliceTypeRef;
import contractus.ast.Span;
import contractus.ast.Stmt;
import contractus.ast.StructDef;
import contractus.ast.StructLiteral;
import contractus.ast.TypeRef;
import contractus.ast.UnaryExpr;
import contractus.ast.UnaryOp;
import contractus.ast.UnitTypeRef;
import contractus.ast.WhileStmt;
import contractus.types.ArrayType;
import contractus.types.FunctionType;
import contractus.types.PointerType;
import contractus.types.RangeType;
import contractus.types.ScalarType;
import contractus.types.SliceType;
import contractus.types.StructType;
import contractus.types.Type;
import contractus.types.UnitType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name resolution, type checking and struct layout.
 *
 * Runs four passes: struct collection, layout, function signatures, then one
 * body check per function. Errors accumulate across all of them; a type that
 * could not be resolved is carried as {@code null} so one mistake is reported
 * once.
 */
public final class SemanticAnalyzer {
	public static final String LENGTH_FIELD = "len";

	private final String entryPoint;

	private List<SemanticError> errors;
	private Map<String, List<ResolvedField>> structFields;
	private Map<String, FunctionType> signatures;
	private Map<Expr, Type> expressionTypes;
	private Map<LetStmt, Type> bindingTypes;
	private Set<Expr> sliceCoercions;
	private Set<String> brokenFunctions;
	private LayoutTable layouts;
	private Map<String, ConstDef> constantDefs;
	private ImmutableMap<String, Constant> constants;

	public SemanticAnalyzer() {
		this("main");
	}

	public SemanticAnalyzer(String entryPoint) {
		this.entryPoint = entryPoint;
	}

	public AnalysisResult analyze(Program program) {
		this.errors = new ArrayList<>();
		this.structFields = new LinkedHashMap<>();
		this.signatures = new LinkedHashMap<>();
		this.expressionTypes = new IdentityHashMap<>();
		this.bindingTypes = new IdentityHashMap<>();
		this.sliceCoercions = Collections.newSetFromMap(new IdentityHashMap<>());
		this.brokenFunctions = new HashSet<>();
		this.constantDefs = new LinkedHashMap<>();

		Map<String, Span> structSpans = collectStructs(program.structs());
		Map<String, List<ResolvedField>> layoutInput = new LinkedHashMap<>();
		structFields.forEach((name, fields) -> layoutInput.put(name,
				fields.stream().filter(f -> f.type() != null).toList()));
		this.layouts = new LayoutCalculator(layoutInput, structSpans, errors).compute();

		Map<String, Type> constantTypes = collectConstants(program.constants());
		Map<FunctionDef, FunctionChecker> checked = new LinkedHashMap<>();
		collectSignatures(program.functions(), checked);
		Set<String> functionNames = new HashSet<>(signatures.keySet());
		functionNames.addAll(brokenFunctions);
		this.constants = new ConstEvaluator(constantDefs, constantTypes, functionNames, errors).evaluate();
		checked.values().forEach(FunctionChecker::check);

		TypedProgram typed = new TypedProgram(program, layouts, ImmutableMap.copyOf(signatures), constants,
				Collections.unmodifiableMap(expressionTypes), Collections.unmodifiableMap(bindingTypes),
				Collections.unmodifiableSet(sliceCoercions));
		return new AnalysisResult(typed, errors);
	}

	// ------------------------------------------------------------- structs

	private Map<String, Span> collectStructs(List<StructDef> structs) {
		Map<String, Span> spans = new LinkedHashMap<>();
		for (StructDef struct : structs) {
			if (ScalarType.fromKeyword(struct.name()) != null) {
				errors.add(SemanticError.semantic("`" + struct.name() + "` is a builtin type name", struct.span()));
			} else if (spans.containsKey(struct.name())) {
				errors.add(SemanticError.semantic("struct `" + struct.name() + "` is defined more than once",
						struct.span()));
			} else {
				spans.put(struct.name(), struct.span());
				structFields.put(struct.name(), List.of());
			}
		}

		// field types may name structs declared later in the file
		for (StructDef struct : structs) {
			if (spans.get(struct.name()) != struct.span()) {
				continue;
			}
			if (struct.fields().isEmpty()) {
				errors.add(SemanticError.semantic("struct `" + struct.name() + "` has no fields", struct.span()));
			}
			Set<String> seen = new HashSet<>();
			List<ResolvedField> fields = new ArrayList<>();
			for (FieldDef field : struct.fields()) {
				if (!seen.add(field.name())) {
					errors.add(SemanticError.semantic("field `" + field.name() + "` is already declared in `"
							+ struct.name() + "`", field.span()));
					continue;
				}
				Type type = resolveStorable(field.type(), "field");
				fields.add(new ResolvedField(field.name(), type, field.span()));
			}
			structFields.put(struct.name(), List.copyOf(fields));
		}
		return spans;
	}

	private ResolvedField lookupField(String struct, String field) {
		for (ResolvedField candidate : structFields.getOrDefault(struct, List.of())) {
			if (candidate.name().equals(field)) {
				return candidate;
			}
		}
		return null;
	}

	// ----------------------------------------------------------- constants

	private Map<String, Type> collectConstants(List<ConstDef> defs) {
		Map<String, Type> types = new LinkedHashMap<>();
		for (ConstDef def : defs) {
			String name = def.name();
			if (constantDefs.containsKey(name)) {
				errors.add(SemanticError.semantic("constant `" + name + "` is defined more than once", def.span()));
				continue;
			}
			if (structFields.containsKey(name)) {
				errors.add(SemanticError.semantic("constant `" + name + "` has the same name as a struct",
						def.span()));
				continue;
			}
			constantDefs.put(name, def);
			Type type = resolveType(def.type());
			if (type != null && !type.isScalar()) {
				errors.add(SemanticError.typeError("constant `" + name + "` must have type `i32`, `u8` or `bool`, found `"
						+ type + "`", def.type().span()));
				type = null;
			}
			if (type != null) {
				types.put(name, type);
			}
		}
		return types;
	}

	// ---------------------------------------------------------- signatures

	private void collectSignatures(List<FunctionDef> functions, Map<FunctionDef, FunctionChecker> checked) {
		for (FunctionDef function : functions) {
			String name = function.name();
			if (Builtins.isBuiltin(name)) {
				errors.add(SemanticError.semantic("`" + name + "` is a builtin function and cannot be redefined",
						function.span()));
				continue;
			}
			if (signatures.containsKey(name) || brokenFunctions.contains(name)) {
				errors.add(SemanticError.semantic("function `" + name + "` is defined more than once",
						function.span()));
				continue;
			}
			if (structFields.containsKey(name)) {
				errors.add(SemanticError.semantic("function `" + name + "` has the same name as a struct",
						function.span()));
				continue;
			}
			if (constantDefs.containsKey(name)) {
				errors.add(SemanticError.semantic("function `" + name + "` has the same name as a constant",
						function.span()));
				continue;
			}

			List<Type> params = new ArrayList<>();
			Set<String> paramNames = new HashSet<>();
			for (Param param : function.params()) {
				if (!paramNames.add(param.name())) {
					errors.add(SemanticError.semantic("parameter `" + param.name() + "` is bound more than once",
							param.span()));
				}
				Type type = resolveStorable(param.type(), "parameter");
				params.add(checkFits(type, param.span()) ? type : null);
			}
			Type returnType = function.returnType() == null ? UnitType.INSTANCE : resolveType(function.returnType());
			checked.put(function, new FunctionChecker(function, params, returnType));
			if (params.contains(null) || returnType == null) {
				// already reported; calls to it are checked loosely
				brokenFunctions.add(name);
			} else {
				signatures.put(name, new FunctionType(params, returnType));
			}

			if (name.equals(entryPoint)) {
				checkEntryPoint(function, returnType);
			}
		}
	}

	private void checkEntryPoint(FunctionDef function, Type returnType) {
		if (!function.params().isEmpty()) {
			errors.add(SemanticError.semantic("`" + entryPoint + "` cannot take parameters", function.span()));
		}
		if (returnType != null && returnType != ScalarType.I32 && !(returnType instanceof UnitType)) {
			errors.add(SemanticError.typeError("`" + entryPoint + "` must return `()` or `i32`, found `" + returnType
					+ "`", function.span()));
		}
	}

	// --------------------------------------------------------------- types

	private Type resolveType(TypeRef ref) {
		if (ref instanceof NamedTypeRef named) {
			ScalarType scalar = ScalarType.fromKeyword(named.name());
			if (scalar != null) {
				return scalar;
			}
			if (structFields.containsKey(named.name())) {
				return new StructType(named.name());
			}
			errors.add(SemanticError.undefinedStruct(named.name(), named.span()));
			return null;
		}
		if (ref instanceof ArrayTypeRef array) {
			Type element = resolveStorable(array.element(), "array element");
			if (array.length() <= 0) {
				errors.add(SemanticError.semantic("array length must be positive", array.span()));
				return null;
			}
			return element == null ? null : new ArrayType(element, array.length());
		}
		if (ref instanceof SliceTypeRef slice) {
			Type element = resolveStorable(slice.element(), "slice element");
			return element == null ? null : new SliceType(element);
		}
		if (ref instanceof PointerTypeRef pointer) {
			Type pointee = resolveStorable(pointer.pointee(), "pointee");
			return pointee == null ? null : new PointerType(pointee);
		}
		if (ref instanceof FunctionTypeRef function) {
			List<Type> params = new ArrayList<>();
			boolean ok = true;
			for (TypeRef param : function.params()) {
				Type type = resolveStorable(param, "parameter");
				ok &= type != null;
				params.add(type);
			}
			Type returnType = resolveType(function.returnType());
			return ok && returnType != null ? new FunctionType(params, returnType) : null;
		}
		if (ref instanceof UnitTypeRef) {
			return UnitType.INSTANCE;
		}
		throw new IllegalStateException("unknown type reference " + ref);
	}

	private boolean checkFits(Type type, Span span) {
		if (type == null || layouts.fits(type)) {
			return true;
		}
		errors.add(SemanticError.semantic("type `" + type + "` is too large", span));
		return false;
	}

	private Type resolveStorable(TypeRef ref, String what) {
		Type type = resolveType(ref);
		if (type instanceof UnitType) {
			errors.add(SemanticError.typeError(what + " cannot have type `()`", ref.span()));
			return null;
		}
		return type;
	}

	// --------------------------------------------------------- divergence

	private static boolean alwaysReturns(Block block) {
		for (Stmt stmt : block.stmts()) {
			if (diverges(stmt)) {
				return true;
			}
		}
		return false;
	}

	private static boolean diverges(Stmt stmt) {
		if (stmt instanceof ReturnStmt) {
			return true;
		}
		if (stmt instanceof BlockStmt block) {
			return alwaysReturns(block.block());
		}
		if (stmt instanceof IfStmt ifStmt) {
			return ifStmt.elseBlock() != null && alwaysReturns(ifStmt.thenBlock())
					&& alwaysReturns(ifStmt.elseBlock());
		}
		if (stmt instanceof WhileStmt loop) {
			return loop.condition() instanceof BoolLiteral literal && literal.value() && !breaksOut(loop.body());
		}
		return false;
	}

	/**
	 * Whether a {@code break} in this block leaves the loop that owns it.
	 * Breaks inside nested loops target those loops.
	 */
	private static boolean breaksOut(Block block) {
		for (Stmt stmt : block.stmts()) {
			if (stmt instanceof BreakStmt) {
				return true;
			}
			if (stmt instanceof BlockStmt nested && breaksOut(nested.block())) {
				return true;
			}
			if (stmt instanceof IfStmt ifStmt && (breaksOut(ifStmt.thenBlock())
					|| ifStmt.elseBlock() != null && breaksOut(ifStmt.elseBlock()))) {
				return true;
			}
		}
		return false;
	}

	private static boolean isIntLiteral(Expr expr) {
		return expr instanceof IntLiteral
				|| expr instanceof UnaryExpr unary && unary.op() == UnaryOp.NEG && unary.operand() instanceof IntLiteral;
	}

	/**
	 * Whether control cannot fall off the end of {@code block}: it returns,
	 * or it ends by leaving the enclosing loop.
	 */
	private static boolean leaves(Block block) {
		if (alwaysReturns(block)) {
			return true;
		}
		List<Stmt> stmts = block.stmts();
		if (stmts.isEmpty()) {
			return false;
		}
		Stmt last = stmts.get(stmts.size() - 1);
		if (last instanceof BreakStmt || last instanceof ContinueStmt) {
			return true;
		}
		if (last instanceof BlockStmt nested) {
			return leaves(nested.block());
		}
		return last instanceof IfStmt ifStmt && ifStmt.elseBlock() != null && leaves(ifStmt.thenBlock())
				&& leaves(ifStmt.elseBlock());
	}

	/**
	 * Checks one function body against its signature.
	 *
	 * Definite assignment is tracked along the control flow: {@code assigned}
	 * holds the bindings that have a value on every path to the current
	 * point, {@code maybeAssigned} those that have one on some path. A branch
	 * that leaves does not constrain the merge; a loop body may run zero times.
	 */
	private final class FunctionChecker {
		private final FunctionDef function;
		private final List<Type> params;
		private final Type returnType;
		private final Scope scope = new Scope();

		private Set<Scope.Binding> assigned = new HashSet<>();
		private Set<Scope.Binding> maybeAssigned = new HashSet<>();
		private int loopDepth;

		/**
		 * Parameter and return types may be null where they failed to resolve.
		 */
		FunctionChecker(FunctionDef function, List<Type> params, Type returnType) {
			this.function = function;
			this.params = params;
			this.returnType = returnType;
		}

		void check() {
			scope.push();
			for (int i = 0; i < function.params().size(); i++) {
				Param param = function.params().get(i);
				markAssigned(scope.declare(param.name(), params.get(i), param.mutable(), loopDepth));
			}
			checkBlock(function.body());
			scope.pop();

			if (returnType != null && !(returnType instanceof UnitType) && !alwaysReturns(function.body())) {
				errors.add(SemanticError.semantic("function `" + function.name() + "` must return a value of type `"
						+ returnType + "` on every path", function.span()));
			}
		}

		private void checkBlock(Block block) {
			scope.push();
			for (Stmt stmt : block.stmts()) {
				checkStmt(stmt);
			}
			scope.pop();
		}

		private void checkStmt(Stmt stmt) {
			if (stmt instanceof LetStmt let) {
				checkLet(let);
			} else if (stmt instanceof ExprStmt exprStmt) {
				checkExpr(exprStmt.expr(), null);
			} else if (stmt instanceof ReturnStmt ret) {
				checkReturn(ret);
			} else if (stmt instanceof IfStmt ifStmt) {
				checkIf(ifStmt);
			} else if (stmt instanceof WhileStmt loop) {
				checkLoopBody(() -> {
					checkCondition(loop.condition());
					checkBlock(loop.body());
				});
			} else if (stmt instanceof ForStmt loop) {
				checkFor(loop);
			} else if (stmt instanceof BlockStmt block) {
				checkBlock(block.block());
			} else if (!(stmt instanceof BreakStmt) && !(stmt instanceof ContinueStmt)) {
				throw new IllegalStateException("unknown statement " + stmt);
			}
		}

		private void checkLet(LetStmt let) {
			Type declared = let.type() == null ? null : resolveType(let.type());
			Type type = declared;
			if (let.init() != null) {
				Type found = checkExpr(let.init(), declared);
				if (let.type() == null) {
					type = found;
				} else {
					assignCompatible(declared, found, let.init());
				}
			}
			if (type instanceof UnitType || type instanceof RangeType) {
				errors.add(SemanticError.typeError("cannot bind `" + let.name() + "` to a value of type `" + type + "`",
						let.span()));
				type = null;
			}
			if (!checkFits(type, let.span())) {
				type = null;
			}
			if (type != null) {
				bindingTypes.put(let, type);
			}
			Scope.Binding binding = scope.declare(let.name(), type, let.mutable(), loopDepth);
			if (let.init() != null) {
				markAssigned(binding);
			}
		}

		private void checkIf(IfStmt ifStmt) {
			checkCondition(ifStmt.condition());
			Set<Scope.Binding> before = new HashSet<>(assigned);
			Set<Scope.Binding> maybeBefore = new HashSet<>(maybeAssigned);

			checkBlock(ifStmt.thenBlock());
			Set<Scope.Binding> afterThen = assigned;
			Set<Scope.Binding> maybeAfterThen = maybeAssigned;
			boolean thenLeaves = leaves(ifStmt.thenBlock());

			assigned = before;
			maybeAssigned = maybeBefore;
			boolean elseLeaves = false;
			if (ifStmt.elseBlock() != null) {
				checkBlock(ifStmt.elseBlock());
				elseLeaves = leaves(ifStmt.elseBlock());
			}

			maybeAssigned.addAll(maybeAfterThen);
			if (elseLeaves && !thenLeaves) {
				assigned = afterThen;
			} else if (!thenLeaves || elseLeaves) {
				assigned.retainAll(afterThen);
			}
		}

		/**
		 * Checks a loop body, which may run any number of times: nothing it
		 * assigns counts as assigned after the loop.
		 */
		private void checkLoopBody(Runnable body) {
			Set<Scope.Binding> before = new HashSet<>(assigned);
			loopDepth++;
			body.run();
			loopDepth--;
			assigned = before;
		}

		private void markAssigned(Scope.Binding binding) {
			assigned.add(binding);
			maybeAssigned.add(binding);
		}

		private void checkReturn(ReturnStmt ret) {
			Type expected = returnType;
			if (ret.value() == null) {
				if (expected != null && !(expected instanceof UnitType)) {
					errors.add(SemanticError.typeMismatch(expected, UnitType.INSTANCE, ret.span()));
				}
				return;
			}
			Type found = checkExpr(ret.value(), expected);
			if (expected instanceof UnitType) {
				if (found != null && !(found instanceof UnitType)) {
					errors.add(SemanticError.typeMismatch(expected, found, ret.value().span()));
				}
				return;
			}
			assignCompatible(expected, found, ret.value());
		}

		private void checkCondition(Expr condition) {
			Type type = checkExpr(condition, ScalarType.BOOL);
			if (type != null && type != ScalarType.BOOL) {
				errors.add(SemanticError.typeMismatch(ScalarType.BOOL, type, condition.span()));
			}
		}

		private void checkFor(ForStmt loop) {
			Type element;
			if (loop.iterable() instanceof RangeExpr range) {
				element = checkRange(range);
			} else {
				Type iterable = checkExpr(loop.iterable(), null);
				if (iterable instanceof ArrayType array) {
					element = array.element();
				} else if (iterable instanceof SliceType slice) {
					element = slice.element();
				} else {
					if (iterable != null) {
						errors.add(SemanticError.invalidIterable(iterable, loop.iterable().span()));
					}
					element = null;
				}
			}
			checkLoopBody(() -> {
				scope.push();
				markAssigned(scope.declare(loop.variable(), element, loop.mutable(), loopDepth));
				checkBlock(loop.body());
				scope.pop();
			});
		}

		/**
		 * Checks {@code a..b} where a range is allowed and returns the element
		 * type, always {@code i32}.
		 */
		private Type checkRange(RangeExpr range) {
			for (Expr bound : List.of(range.start(), range.end())) {
				Type type = checkExpr(bound, ScalarType.I32);
				if (type != null && type != ScalarType.I32) {
					errors.add(SemanticError.typeMismatch(ScalarType.I32, type, bound.span()));
				}
			}
			expressionTypes.put(range, new RangeType(ScalarType.I32));
			return ScalarType.I32;
		}

		// --------------------------------------------------------- expressions

		Type checkExpr(Expr expr, Type hint) {
			Type type = computeType(expr, hint);
			if (type != null) {
				expressionTypes.put(expr, type);
			}
			return type;
		}

		private Type computeType(Expr expr, Type hint) {
			if (expr instanceof IntLiteral literal) {
				return literalType(literal.value(), hint, literal.span());
			}
			if (expr instanceof BoolLiteral) {
				return ScalarType.BOOL;
			}
			if (expr instanceof NameExpr name) {
				return checkName(name);
			}
			if (expr instanceof BinaryExpr binary) {
				return checkBinary(binary, hint);
			}
			if (expr instanceof UnaryExpr unary) {
				return checkUnary(unary, hint);
			}
			if (expr instanceof AssignExpr assign) {
				return checkAssign(assign);
			}
			if (expr instanceof CallExpr call) {
				return checkCall(call);
			}
			if (expr instanceof FieldExpr field) {
				return checkField(field);
			}
			if (expr instanceof IndexExpr index) {
				return checkIndex(index);
			}
			if (expr instanceof StructLiteral literal) {
				return checkStructLiteral(literal);
			}
			if (expr instanceof ArrayLiteral literal) {
				return checkArrayLiteral(literal, hint);
			}
			if (expr instanceof RepeatArrayLiteral literal) {
				Type element = checkExpr(literal.element(), elementHint(hint));
				if (literal.count() <= 0) {
					errors.add(SemanticError.semantic("array length must be positive", literal.span()));
					return null;
				}
				return storableElement(element, literal.element()) ? new ArrayType(element, literal.count()) : null;
			}
			if (expr instanceof RangeExpr range) {
				checkRange(range);
				errors.add(SemanticError.typeError("a range can only be used as a `for` iterable or to slice an array",
						range.span()));
				return null;
			}
			if (expr instanceof CastExpr cast) {
				return checkCast(cast);
			}
			throw new IllegalStateException("unknown expression " + expr);
		}

		private Type literalType(long value, Type hint, Span span) {
			if (hint == ScalarType.U8 && value >= 0 && value <= 255) {
				return ScalarType.U8;
			}
			if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
				errors.add(SemanticError.typeError("integer literal `" + value + "` does not fit in `i32`", span));
				return null;
			}
			return ScalarType.I32;
		}

		private Type checkName(NameExpr name) {
			Scope.Binding binding = scope.lookup(name.name());
			if (binding != null) {
				if (!assigned.contains(binding)) {
					errors.add(SemanticError.semantic("use of possibly uninitialized variable `" + name.name() + "`",
							name.span()));
				}
				return binding.type;
			}
			FunctionType function = signatures.get(name.name());
			if (function != null) {
				return function;
			}
			if (constantDefs.containsKey(name.name())) {
				// a constant that failed to evaluate has been reported
				Constant constant = constants.get(name.name());
				return constant == null ? null : constant.type();
			}
			if (brokenFunctions.contains(name.name())) {
				return null;
			}
			errors.add(SemanticError.undefinedVariable(name.name(), name.span()));
			return null;
		}

		private Type checkBinary(BinaryExpr binary, Type hint) {
			BinaryOp op = binary.op();
			if (op.isLogical()) {
				checkCondition(binary.left());
				// the right operand may not run
				Set<Scope.Binding> before = new HashSet<>(assigned);
				checkCondition(binary.right());
				assigned = before;
				return ScalarType.BOOL;
			}

			boolean valued = op.isArithmetic() || op.isBitwise();
			Type operandHint = valued && hint != null && hint.isInteger() ? hint : null;
			Type left;
			Type right;
			if (isIntLiteral(binary.left()) && !isIntLiteral(binary.right())) {
				right = checkExpr(binary.right(), operandHint);
				left = checkExpr(binary.left(), right);
			} else {
				left = checkExpr(binary.left(), operandHint);
				right = checkExpr(binary.right(), left instanceof PointerType ? ScalarType.I32 : left);
			}
			if (left == null || right == null) {
				return valued ? null : ScalarType.BOOL;
			}

			if (op.isArithmetic()) {
				if (left instanceof PointerType && (op == BinaryOp.ADD || op == BinaryOp.SUB)) {
					if (right != ScalarType.I32) {
						errors.add(SemanticError.typeMismatch(ScalarType.I32, right, binary.right().span()));
					}
					return left;
				}
				if (!left.isInteger()) {
					errors.add(SemanticError.typeError("operator `" + op.symbol() + "` cannot be applied to `" + left
							+ "`", binary.left().span()));
					return null;
				}
				if (!right.equals(left)) {
					errors.add(SemanticError.typeMismatch(left, right, binary.right().span()));
					return null;
				}
				return left;
			}

			if (op.isBitwise()) {
				boolean bools = left == ScalarType.BOOL && !op.isShift();
				if (!left.isInteger() && !bools) {
					errors.add(SemanticError.typeError("operator `" + op.symbol() + "` cannot be applied to `" + left
							+ "`", binary.left().span()));
					return null;
				}
				if (!right.equals(left)) {
					errors.add(SemanticError.typeMismatch(left, right, binary.right().span()));
					return null;
				}
				return left;
			}

			if (op.isEquality()) {
				if (!(left.isScalar() || left instanceof PointerType)) {
					errors.add(SemanticError.typeError("values of type `" + left + "` cannot be compared",
							binary.span()));
				} else if (!right.equals(left)) {
					errors.add(SemanticError.typeMismatch(left, right, binary.right().span()));
				}
				return ScalarType.BOOL;
			}

			if (!left.isInteger()) {
				errors.add(SemanticError.typeError("operator `" + op.symbol() + "` cannot be applied to `" + left + "`",
						binary.left().span()));
			} else if (!right.equals(left)) {
				errors.add(SemanticError.typeMismatch(left, right, binary.right().span()));
			}
			return ScalarType.BOOL;
		}

		private Type checkUnary(UnaryExpr unary, Type hint) {
			switch (unary.op()) {
				case NEG: {
					if (unary.operand() instanceof IntLiteral literal) {
						Type type = literalType(-literal.value(), null, unary.span());
						if (type != null) {
							expressionTypes.put(literal, type);
						}
						return type;
					}
					Type operand = checkExpr(unary.operand(), ScalarType.I32);
					if (operand != null && operand != ScalarType.I32) {
						errors.add(SemanticError.typeError("cannot negate a value of type `" + operand + "`",
								unary.span()));
						return null;
					}
					return operand;
				}
				case NOT:
					checkCondition(unary.operand());
					return ScalarType.BOOL;
				case DEREF: {
					Type operand = checkExpr(unary.operand(), hint == null ? null : new PointerType(hint));
					if (operand == null) {
						return null;
					}
					if (operand instanceof PointerType pointer) {
						return pointer.pointee();
					}
					errors.add(SemanticError.typeError("type `" + operand + "` cannot be dereferenced", unary.span()));
					return null;
				}
				case ADDRESS_OF: {
					Type operand = checkExpr(unary.operand(),
							hint instanceof PointerType pointer ? pointer.pointee() : null);
					if (operand == null) {
						return null;
					}
					if (!operand.isStorable()) {
						errors.add(SemanticError.typeError("cannot take the address of a value of type `" + operand
								+ "`", unary.span()));
						return null;
					}
					return new PointerType(operand);
				}
				default:
					throw new IllegalStateException("unknown unary operator " + unary.op());
			}
		}

		private Type checkAssign(AssignExpr assign) {
			Expr target = assign.target();
			Type targetType = checkPlace(target, assign.compoundOp() != null);
			Type value = checkExpr(assign.value(), targetType instanceof PointerType && assign.compoundOp() != null
					? ScalarType.I32
					: targetType);
			if (targetType == null || value == null) {
				return targetType;
			}

			BinaryOp op = assign.compoundOp();
			if (op == null) {
				assignCompatible(targetType, value, assign.value());
			} else if (targetType instanceof PointerType && (op == BinaryOp.ADD || op == BinaryOp.SUB)) {
				if (value != ScalarType.I32) {
					errors.add(SemanticError.typeMismatch(ScalarType.I32, value, assign.value().span()));
				}
			} else if (!targetType.isInteger()) {
				errors.add(SemanticError.typeError("operator `" + op.symbol() + "=` cannot be applied to `"
						+ targetType + "`", target.span()));
			} else if (!value.equals(targetType)) {
				errors.add(SemanticError.typeMismatch(targetType, value, assign.value().span()));
			}
			return targetType;
		}

		/**
		 * Type of an assignment target, after checking that it names writable
		 * storage.
		 */
		private Type checkPlace(Expr target, boolean reads) {
			if (target instanceof NameExpr name) {
				Scope.Binding binding = scope.lookup(name.name());
				if (binding == null) {
					if (signatures.containsKey(name.name()) || brokenFunctions.contains(name.name())) {
						errors.add(SemanticError.semantic("cannot assign to function `" + name.name() + "`",
								name.span()));
					} else if (constantDefs.containsKey(name.name())) {
						errors.add(SemanticError.semantic("cannot assign to constant `" + name.name() + "`",
								name.span()));
					} else {
						errors.add(SemanticError.undefinedVariable(name.name(), name.span()));
					}
					return null;
				}
				if (reads && !assigned.contains(binding)) {
					errors.add(SemanticError.semantic("use of possibly uninitialized variable `" + name.name() + "`",
							name.span()));
				}
				if (!binding.mutable && maybeAssigned.contains(binding)) {
					errors.add(SemanticError.semantic("cannot assign twice to immutable variable `" + name.name()
							+ "`", name.span()));
				} else if (!binding.mutable && loopDepth > binding.loopDepth) {
					errors.add(SemanticError.semantic("cannot assign to immutable variable `" + name.name()
							+ "` inside a loop", name.span()));
				}
				markAssigned(binding);
				if (binding.type != null) {
					expressionTypes.put(name, binding.type);
				}
				return binding.type;
			}

			boolean place = target instanceof FieldExpr || target instanceof IndexExpr
					|| target instanceof UnaryExpr unary && unary.op() == UnaryOp.DEREF;
			if (!place) {
				checkExpr(target, null);
				errors.add(SemanticError.semantic("invalid left-hand side of assignment", target.span()));
				return null;
			}
			Type type = checkExpr(target, null);
			if (type == null) {
				return null;
			}
			if (target instanceof IndexExpr index && index.index() instanceof RangeExpr) {
				errors.add(SemanticError.semantic("cannot assign to a slice expression", target.span()));
				return null;
			}
			if (target instanceof FieldExpr field && !(expressionTypes.get(field.target()) instanceof StructType
					|| expressionTypes.get(field.target()) instanceof PointerType)) {
				errors.add(SemanticError.semantic("cannot assign to `" + field.field() + "`", target.span()));
				return null;
			}
			if (!writable(target)) {
				errors.add(SemanticError.semantic("cannot assign through an immutable binding", target.span()));
			}
			return type;
		}

		private boolean writable(Expr place) {
			if (place instanceof NameExpr name) {
				Scope.Binding binding = scope.lookup(name.name());
				return binding != null && binding.mutable;
			}
			if (place instanceof FieldExpr field) {
				return expressionTypes.get(field.target()) instanceof PointerType || writable(field.target());
			}
			if (place instanceof IndexExpr index) {
				Type base = expressionTypes.get(index.target());
				return base instanceof SliceType || base instanceof PointerType || writable(index.target());
			}
			return place instanceof UnaryExpr unary && unary.op() == UnaryOp.DEREF;
		}

		private Type checkCall(CallExpr call) {
			String callee = call.callee();
			Scope.Binding binding = scope.lookup(callee);
			FunctionType function;
			if (binding != null) {
				if (!assigned.contains(binding)) {
					errors.add(SemanticError.semantic("use of possibly uninitialized variable `" + callee + "`",
							call.span()));
				}
				if (binding.type == null) {
					call.args().forEach(arg -> checkExpr(arg, null));
					return null;
				}
				if (!(binding.type instanceof FunctionType local)) {
					errors.add(SemanticError.typeError("`" + callee + "` of type `" + binding.type
							+ "` is not a function", call.span()));
					call.args().forEach(arg -> checkExpr(arg, null));
					return null;
				}
				function = local;
			} else if (signatures.containsKey(callee)) {
				function = signatures.get(callee);
			} else if (brokenFunctions.contains(callee)) {
				call.args().forEach(arg -> checkExpr(arg, null));
				return null;
			} else if (Builtins.isBuiltin(callee)) {
				return checkPrint(call);
			} else if (constantDefs.containsKey(callee)) {
				errors.add(SemanticError.typeError("constant `" + callee + "` is not a function", call.span()));
				call.args().forEach(arg -> checkExpr(arg, null));
				return null;
			} else {
				errors.add(SemanticError.undefinedFunction(callee, call.span()));
				call.args().forEach(arg -> checkExpr(arg, null));
				return null;
			}

			List<Type> params = function.params();
			if (params.size() != call.args().size()) {
				errors.add(SemanticError.typeError("function `" + callee + "` takes " + params.size()
						+ " argument(s) but " + call.args().size() + " were supplied", call.span()));
			}
			for (int i = 0; i < call.args().size(); i++) {
				Expr arg = call.args().get(i);
				Type expected = i < params.size() ? params.get(i) : null;
				Type found = checkExpr(arg, expected);
				if (expected != null) {
					assignCompatible(expected, found, arg);
				}
			}
			return function.returnType();
		}

		private Type checkPrint(CallExpr call) {
			if (call.args().size() != 1) {
				errors.add(SemanticError.typeError("`print` takes 1 argument but " + call.args().size()
						+ " were supplied", call.span()));
				call.args().forEach(arg -> checkExpr(arg, null));
				return UnitType.INSTANCE;
			}
			Expr arg = call.args().get(0);
			Type type = checkExpr(arg, null);
			if (type != null && !type.isScalar()) {
				errors.add(SemanticError.typeError("`print` cannot print a value of type `" + type + "`", arg.span()));
			}
			return UnitType.INSTANCE;
		}

		private Type checkField(FieldExpr field) {
			Type target = checkExpr(field.target(), null);
			if (target == null) {
				return null;
			}
			if (LENGTH_FIELD.equals(field.field()) && (target instanceof ArrayType || target instanceof SliceType)) {
				return ScalarType.I32;
			}
			Type owner = target instanceof PointerType pointer ? pointer.pointee() : target;
			if (owner instanceof StructType struct) {
				ResolvedField resolved = lookupField(struct.name(), field.field());
				if (resolved != null) {
					return resolved.type();
				}
			}
			errors.add(SemanticError.undefinedField(owner, field.field(), field.span()));
			return null;
		}

		private Type checkIndex(IndexExpr index) {
			Type target = checkExpr(index.target(), null);
			if (index.index() instanceof RangeExpr range) {
				checkRange(range);
				if (target instanceof ArrayType array) {
					return new SliceType(array.element());
				}
				if (target instanceof SliceType) {
					return target;
				}
				if (target != null) {
					errors.add(SemanticError.typeError("type `" + target + "` cannot be sliced", index.span()));
				}
				return null;
			}

			Type position = checkExpr(index.index(), ScalarType.I32);
			if (position != null && position != ScalarType.I32) {
				errors.add(SemanticError.typeMismatch(ScalarType.I32, position, index.index().span()));
			}
			if (target instanceof ArrayType array) {
				return array.element();
			}
			if (target instanceof SliceType slice) {
				return slice.element();
			}
			if (target instanceof PointerType pointer) {
				return pointer.pointee();
			}
			if (target != null) {
				errors.add(SemanticError.typeError("type `" + target + "` cannot be indexed", index.span()));
			}
			return null;
		}

		private Type checkStructLiteral(StructLiteral literal) {
			if (!structFields.containsKey(literal.name())) {
				errors.add(SemanticError.undefinedStruct(literal.name(), literal.span()));
				literal.fields().forEach(init -> checkExpr(init.value(), null));
				return null;
			}
			StructType type = new StructType(literal.name());
			Set<String> seen = new HashSet<>();
			for (FieldInit init : literal.fields()) {
				ResolvedField field = lookupField(literal.name(), init.name());
				if (field == null) {
					errors.add(SemanticError.undefinedField(type, init.name(), init.span()));
					checkExpr(init.value(), null);
					continue;
				}
				if (!seen.add(init.name())) {
					errors.add(SemanticError.semantic("field `" + init.name() + "` specified more than once",
							init.span()));
				}
				Type found = checkExpr(init.value(), field.type());
				assignCompatible(field.type(), found, init.value());
			}
			for (ResolvedField field : structFields.get(literal.name())) {
				if (!seen.contains(field.name())) {
					errors.add(SemanticError.semantic("missing field `" + field.name() + "` in initializer of `"
							+ literal.name() + "`", literal.span()));
				}
			}
			return type;
		}

		private Type checkArrayLiteral(ArrayLiteral literal, Type hint) {
			if (literal.elements().isEmpty()) {
				errors.add(SemanticError.typeError("cannot infer the element type of an empty array literal",
						literal.span()));
				return null;
			}
			Type expected = elementHint(hint);
			Type element = null;
			for (Expr item : literal.elements()) {
				Type found = checkExpr(item, expected);
				if (expected == null) {
					expected = found;
					element = found;
				} else if (element == null) {
					element = expected;
					assignCompatible(expected, found, item);
				} else {
					assignCompatible(expected, found, item);
				}
			}
			if (!storableElement(element, literal.elements().get(0))) {
				return null;
			}
			return new ArrayType(element, literal.elements().size());
		}

		private Type elementHint(Type hint) {
			if (hint instanceof ArrayType array) {
				return array.element();
			}
			if (hint instanceof SliceType slice) {
				return slice.element();
			}
			return null;
		}

		private boolean storableElement(Type element, Expr first) {
			if (element == null) {
				return false;
			}
			if (!element.isStorable()) {
				errors.add(SemanticError.typeError("array elements cannot have type `" + element + "`",
						first.span()));
				return false;
			}
			return true;
		}

		private Type checkCast(CastExpr cast) {
			Type operand = checkExpr(cast.operand(), null);
			Type target = resolveType(cast.type());
			if (operand == null || target == null) {
				return target;
			}
			boolean allowed = operand.equals(target)
					|| target.isInteger() && (operand.isInteger() || operand == ScalarType.BOOL);
			if (!allowed) {
				errors.add(SemanticError.typeError("cannot cast `" + operand + "` as `" + target + "`",
						cast.span()));
			}
			return target;
		}

		/**
		 * Accepts {@code found} where {@code expected} is required, recording an
		 * array-to-slice coercion when one applies.
		 */
		private void assignCompatible(Type expected, Type found, Expr expr) {
			if (expected == null || found == null || expected.equals(found)) {
				return;
			}
			if (expected instanceof SliceType slice && found instanceof ArrayType array
					&& slice.element().equals(array.element())) {
				sliceCoercions.add(expr);
				return;
			}
			errors.add(SemanticError.typeMismatch(expected, found, expr.span()));
		}
	}
}
