package contractus.mir;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import contractus.ast.ArrayLiteral;
import contractus.ast.AssignExpr;
import contractus.ast.BinaryExpr;
import contractus.ast.BinaryOp;
import contractus.ast.Block;
import contractus.ast.BlockStmt;
import contractus.ast.BoolLiteral;
import contractus.ast.BreakStmt;
import contractus.ast.CallExpr;
import contractus.ast.CastExpr;
import contractus.ast.ContinueStmt;
import contractus.ast.Expr;
import contractus.ast.ExprStmt;
import contractus.ast.FieldExpr;
import contractus.ast.FieldInit;
import contractus.ast.ForStmt;
import contractus.ast.FunctionDef;
import contractus.ast.IfStmt;
import contractus.ast.IndexExpr;
import contractus.ast.IntLiteral;
import contractus.ast.LetStmt;
import contractus.ast.NameExpr;
import contractus.ast.RangeExpr;
import contractus.ast.RepeatArrayLiteral;
import contractus.ast.ReturnStmt;
import contractus.ast.Stmt;
import contractus.ast.StructLiteral;
import contractus.ast.UnaryExpr;
import contractus.ast.UnaryOp;
import contractus.ast.WhileStmt;
import contractus.mir.Instruction.Alloc;
import contractus.mir.Instruction.BinOp;
import contractus.mir.Instruction.Call;
import contractus.mir.Instruction.CallIndirect;
import contractus.mir.Instruction.Cast;
import contractus.mir.Instruction.Const;
import contractus.mir.Instruction.FuncRef;
import contractus.mir.Instruction.GetElementPtr;
import contractus.mir.Instruction.GetFieldPtr;
import contractus.mir.Instruction.Jump;
import contractus.mir.Instruction.JumpIf;
import contractus.mir.Instruction.Label;
import contractus.mir.Instruction.Load;
import contractus.mir.Instruction.MakeSlice;
import contractus.mir.Instruction.Return;
import contractus.mir.Instruction.SliceLen;
import contractus.mir.Instruction.Store;
import contractus.mir.Instruction.UnOp;
import contractus.semantic.Builtins;
import contractus.semantic.Constant;
import contractus.semantic.FieldLayout;
import contractus.semantic.SemanticAnalyzer;
import contractus.semantic.StructLayout;
import contractus.semantic.TypedProgram;
import contractus.types.ArrayType;
import contractus.types.FunctionType;
import contractus.types.PointerType;
import contractus.types.ScalarType;
import contractus.types.SliceType;
import contractus.types.StructType;
import contractus.types.Type;
import contractus.types.UnitType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowering state for one function: register and label counters, the local
 * environment and the enclosing loops.
 *
 * A local lives in a register when it is never written after its
 * initialization, and in a stack slot accessed with Load/Store otherwise.
 * Struct and array locals always get a slot.
 */
final class FunctionLowering {
	private record Local(Register register, boolean inSlot) {
	}

	private record LoopTargets(int breakLabel, int continueLabel) {
	}

	private final TypedProgram program;
	private final FunctionDef function;
	private final FunctionType signature;

	private final List<Register> registers = new ArrayList<>();
	private final List<Instruction> code = new ArrayList<>();
	private final Deque<Map<String, Local>> env = new ArrayDeque<>();
	private final Deque<LoopTargets> loops = new ArrayDeque<>();
	private final Set<String> written = new HashSet<>();
	private int nextLabel;

	FunctionLowering(TypedProgram program, FunctionDef function) {
		this.program = program;
		this.function = function;
		this.signature = Verify.verifyNotNull(program.signatures().get(function.name()),
				"no signature for %s", function.name());
	}

	MirFunction lower() {
		scanBlock(function.body());

		env.push(new HashMap<>());
		List<Register> params = new ArrayList<>();
		for (Type type : signature.params()) {
			params.add(newRegister(type));
		}
		for (int i = 0; i < params.size(); i++) {
			String name = function.params().get(i).name();
			Register param = params.get(i);
			if (needsSlot(name, param.type())) {
				Register slot = alloc(param.type());
				store(slot, param);
				bind(name, slot, true);
			} else {
				bind(name, param, false);
			}
		}

		lowerBlock(function.body());
		if (signature.returnType() instanceof UnitType
				&& (code.isEmpty() || !(code.get(code.size() - 1) instanceof Return))) {
			emit(new Return(null));
		}
		env.pop();

		return new MirFunction(function.name(), ImmutableList.copyOf(params), signature.returnType(),
				ImmutableList.copyOf(registers), ImmutableList.copyOf(code));
	}

	// ------------------------------------------------------------- prescan

	private void scanBlock(Block block) {
		block.stmts().forEach(this::scanStmt);
	}

	private void scanStmt(Stmt stmt) {
		if (stmt instanceof LetStmt let && let.init() != null) {
			scanExpr(let.init());
		} else if (stmt instanceof ExprStmt exprStmt) {
			scanExpr(exprStmt.expr());
		} else if (stmt instanceof ReturnStmt ret && ret.value() != null) {
			scanExpr(ret.value());
		} else if (stmt instanceof IfStmt ifStmt) {
			scanExpr(ifStmt.condition());
			scanBlock(ifStmt.thenBlock());
			if (ifStmt.elseBlock() != null) {
				scanBlock(ifStmt.elseBlock());
			}
		} else if (stmt instanceof WhileStmt loop) {
			scanExpr(loop.condition());
			scanBlock(loop.body());
		} else if (stmt instanceof ForStmt loop) {
			scanExpr(loop.iterable());
			scanBlock(loop.body());
		} else if (stmt instanceof BlockStmt block) {
			scanBlock(block.block());
		}
	}

	private void scanExpr(Expr expr) {
		if (expr instanceof AssignExpr assign) {
			markWritten(assign.target());
			scanExpr(assign.target());
			scanExpr(assign.value());
		} else if (expr instanceof UnaryExpr unary) {
			if (unary.op() == UnaryOp.ADDRESS_OF) {
				markWritten(unary.operand());
			}
			scanExpr(unary.operand());
		} else if (expr instanceof BinaryExpr binary) {
			scanExpr(binary.left());
			scanExpr(binary.right());
		} else if (expr instanceof CallExpr call) {
			call.args().forEach(this::scanExpr);
		} else if (expr instanceof FieldExpr field) {
			scanExpr(field.target());
		} else if (expr instanceof IndexExpr index) {
			scanExpr(index.target());
			scanExpr(index.index());
		} else if (expr instanceof StructLiteral literal) {
			literal.fields().forEach(init -> scanExpr(init.value()));
		} else if (expr instanceof ArrayLiteral literal) {
			literal.elements().forEach(this::scanExpr);
		} else if (expr instanceof RepeatArrayLiteral literal) {
			scanExpr(literal.element());
		} else if (expr instanceof RangeExpr range) {
			scanExpr(range.start());
			scanExpr(range.end());
		} else if (expr instanceof CastExpr cast) {
			scanExpr(cast.operand());
		}
	}

	/**
	 * Marks the local at the root of a written or address-taken place. Names
	 * are tracked per function, so every shadowing binding gets a slot too.
	 */
	private void markWritten(Expr place) {
		Expr root = place;
		while (true) {
			if (root instanceof FieldExpr field) {
				root = field.target();
			} else if (root instanceof IndexExpr index) {
				root = index.target();
			} else {
				break;
			}
		}
		if (root instanceof NameExpr name) {
			written.add(name.name());
		}
	}

	private boolean needsSlot(String name, Type type) {
		return type instanceof StructType || type instanceof ArrayType || written.contains(name);
	}

	// ---------------------------------------------------------- statements

	private void lowerBlock(Block block) {
		env.push(new HashMap<>());
		block.stmts().forEach(this::lowerStmt);
		env.pop();
	}

	private void lowerStmt(Stmt stmt) {
		if (stmt instanceof LetStmt let) {
			lowerLet(let);
		} else if (stmt instanceof ExprStmt exprStmt) {
			lowerExpr(exprStmt.expr());
		} else if (stmt instanceof ReturnStmt ret) {
			emit(new Return(ret.value() == null ? null : lowerExpr(ret.value())));
		} else if (stmt instanceof IfStmt ifStmt) {
			lowerIf(ifStmt);
		} else if (stmt instanceof WhileStmt loop) {
			lowerWhile(loop);
		} else if (stmt instanceof ForStmt loop) {
			if (loop.iterable() instanceof RangeExpr range) {
				lowerRangeFor(loop, range);
			} else {
				lowerCollectionFor(loop);
			}
		} else if (stmt instanceof BreakStmt) {
			emit(new Jump(currentLoop().breakLabel()));
		} else if (stmt instanceof ContinueStmt) {
			emit(new Jump(currentLoop().continueLabel()));
		} else if (stmt instanceof BlockStmt block) {
			lowerBlock(block.block());
		} else {
			throw new IllegalStateException("unknown statement " + stmt);
		}
	}

	private void lowerLet(LetStmt let) {
		Type type = program.typeOf(let);
		if (let.init() == null || needsSlot(let.name(), type)) {
			Register slot = alloc(type);
			if (let.init() != null) {
				store(slot, lowerExpr(let.init()));
			}
			bind(let.name(), slot, true);
		} else {
			bind(let.name(), lowerExpr(let.init()), false);
		}
	}

	private void lowerIf(IfStmt ifStmt) {
		int thenLabel = newLabel();
		int elseLabel = newLabel();
		int endLabel = newLabel();

		Register condition = lowerExpr(ifStmt.condition());
		emit(new JumpIf(condition, thenLabel));
		emit(new Jump(ifStmt.elseBlock() == null ? endLabel : elseLabel));
		emit(new Label(thenLabel));
		lowerBlock(ifStmt.thenBlock());
		if (ifStmt.elseBlock() != null) {
			emit(new Jump(endLabel));
			emit(new Label(elseLabel));
			lowerBlock(ifStmt.elseBlock());
		}
		emit(new Label(endLabel));
	}

	private void lowerWhile(WhileStmt loop) {
		int head = newLabel();
		int body = newLabel();
		int exit = newLabel();

		emit(new Label(head));
		Register condition = lowerExpr(loop.condition());
		emit(new JumpIf(condition, body));
		emit(new Jump(exit));
		emit(new Label(body));
		loops.push(new LoopTargets(exit, head));
		lowerBlock(loop.body());
		loops.pop();
		emit(new Jump(head));
		emit(new Label(exit));
	}

	/**
	 * {@code for v in a..b}: both bounds are evaluated once before the loop;
	 * a hidden counter slot drives the iteration so writes to a {@code mut}
	 * loop variable do not change the trip count. Inclusive ranges stop
	 * before incrementing past the end.
	 */
	private void lowerRangeFor(ForStmt loop, RangeExpr range) {
		Register start = lowerExpr(range.start());
		Register end = lowerExpr(range.end());
		Register counter = alloc(ScalarType.I32);
		store(counter, start);

		int head = newLabel();
		int body = newLabel();
		int step = newLabel();
		int exit = newLabel();

		emit(new Label(head));
		Register current = load(counter);
		Register inBounds = binary(range.inclusive() ? MirBinaryOp.LE : MirBinaryOp.LT, current, end);
		emit(new JumpIf(inBounds, body));
		emit(new Jump(exit));
		emit(new Label(body));
		lowerLoopBody(loop, current, step, exit);

		emit(new Label(step));
		Register last = load(counter);
		if (range.inclusive()) {
			emit(new JumpIf(binary(MirBinaryOp.EQ, last, end), exit));
		}
		store(counter, binary(MirBinaryOp.ADD, last, constant(ScalarType.I32, 1)));
		emit(new Jump(head));
		emit(new Label(exit));
	}

	/**
	 * {@code for v in collection}: index loop over an array or slice. The
	 * element is loaded into {@code v} each iteration, so writes to {@code v}
	 * never reach the collection.
	 */
	private void lowerCollectionFor(ForStmt loop) {
		Type iterable = program.typeOf(loop.iterable());
		Register base;
		Register length;
		if (iterable instanceof ArrayType array) {
			base = address(loop.iterable());
			length = constant(ScalarType.I32, array.length());
		} else {
			base = lowerExpr(loop.iterable());
			length = newRegister(ScalarType.I32);
			emit(new SliceLen(length, base));
		}
		Type element = elementOf(iterable);
		Register index = alloc(ScalarType.I32);
		store(index, constant(ScalarType.I32, 0));

		int head = newLabel();
		int body = newLabel();
		int step = newLabel();
		int exit = newLabel();

		emit(new Label(head));
		Register current = load(index);
		emit(new JumpIf(binary(MirBinaryOp.LT, current, length), body));
		emit(new Jump(exit));
		emit(new Label(body));
		Register value = load(elementPtr(base, current, element));
		lowerLoopBody(loop, value, step, exit);

		emit(new Label(step));
		Register last = load(index);
		store(index, binary(MirBinaryOp.ADD, last, constant(ScalarType.I32, 1)));
		emit(new Jump(head));
		emit(new Label(exit));
	}

	private void lowerLoopBody(ForStmt loop, Register value, int continueLabel, int breakLabel) {
		env.push(new HashMap<>());
		if (loop.mutable() || needsSlot(loop.variable(), value.type())) {
			Register slot = alloc(value.type());
			store(slot, value);
			bind(loop.variable(), slot, true);
		} else {
			bind(loop.variable(), value, false);
		}
		loops.push(new LoopTargets(breakLabel, continueLabel));
		lowerBlock(loop.body());
		loops.pop();
		env.pop();
	}

	private LoopTargets currentLoop() {
		return Verify.verifyNotNull(loops.peek(), "break or continue outside a loop in %s", function.name());
	}

	// --------------------------------------------------------- expressions

	/**
	 * Lowers an expression to the register holding its value, or null for a
	 * unit-typed call. Applies array-to-slice coercion where the analyzer
	 * recorded one.
	 */
	private Register lowerExpr(Expr expr) {
		if (program.coercesToSlice(expr)) {
			return arrayToSlice(expr);
		}
		return lowerValue(expr);
	}

	private Register lowerValue(Expr expr) {
		if (expr instanceof IntLiteral literal) {
			return constant(program.typeOf(expr), literal.value());
		}
		if (expr instanceof BoolLiteral literal) {
			return constant(ScalarType.BOOL, literal.value() ? 1 : 0);
		}
		if (expr instanceof NameExpr name) {
			Local local = lookup(name.name());
			Constant folded = program.constants().get(name.name());
			if (local == null && folded != null) {
				return constant(folded.type(), folded.value());
			}
			if (local == null) {
				Register dest = newRegister(program.typeOf(expr));
				emit(new FuncRef(dest, name.name()));
				return dest;
			}
			return local.inSlot() ? load(local.register()) : local.register();
		}
		if (expr instanceof BinaryExpr binary) {
			return lowerBinary(binary);
		}
		if (expr instanceof UnaryExpr unary) {
			return lowerUnary(unary);
		}
		if (expr instanceof AssignExpr assign) {
			return lowerAssign(assign);
		}
		if (expr instanceof CallExpr call) {
			return lowerCall(call);
		}
		if (expr instanceof FieldExpr field) {
			Type target = program.typeOf(field.target());
			if (target instanceof ArrayType array && SemanticAnalyzer.LENGTH_FIELD.equals(field.field())) {
				return constant(ScalarType.I32, array.length());
			}
			if (target instanceof SliceType) {
				Register length = newRegister(ScalarType.I32);
				emit(new SliceLen(length, lowerExpr(field.target())));
				return length;
			}
			return load(address(field));
		}
		if (expr instanceof IndexExpr index) {
			if (index.index() instanceof RangeExpr range) {
				return lowerSlicing(index, range);
			}
			return load(address(index));
		}
		if (expr instanceof StructLiteral literal) {
			return load(lowerStructLiteral(literal));
		}
		if (expr instanceof ArrayLiteral literal) {
			return load(lowerArrayLiteral(literal));
		}
		if (expr instanceof RepeatArrayLiteral literal) {
			return load(lowerRepeatLiteral(literal));
		}
		if (expr instanceof CastExpr cast) {
			Register operand = lowerExpr(cast.operand());
			Type target = program.typeOf(cast);
			if (operand.type().equals(target)) {
				return operand;
			}
			Register dest = newRegister(target);
			emit(new Cast(dest, operand));
			return dest;
		}
		throw new IllegalStateException("cannot lower " + expr.getClass().getSimpleName() + " at " + expr.span());
	}

	private Register lowerBinary(BinaryExpr binary) {
		if (binary.op().isLogical()) {
			return lowerShortCircuit(binary);
		}
		Register left = lowerExpr(binary.left());
		Register right = lowerExpr(binary.right());
		if (left.type() instanceof PointerType pointer) {
			if (binary.op() == BinaryOp.ADD) {
				return elementPtr(left, right, pointer.pointee());
			}
			if (binary.op() == BinaryOp.SUB) {
				return elementPtr(left, unary(MirUnaryOp.NEG, right), pointer.pointee());
			}
		}
		return binary(binaryOp(binary.op()), left, right);
	}

	/**
	 * {@code a && b} and {@code a || b}: the right operand only runs when the
	 * left one does not decide the result.
	 */
	private Register lowerShortCircuit(BinaryExpr binary) {
		Register result = alloc(ScalarType.BOOL);
		int right = newLabel();
		int end = newLabel();

		Register left = lowerExpr(binary.left());
		store(result, left);
		if (binary.op() == BinaryOp.AND) {
			emit(new JumpIf(left, right));
			emit(new Jump(end));
		} else {
			emit(new JumpIf(left, end));
			emit(new Jump(right));
		}
		emit(new Label(right));
		store(result, lowerExpr(binary.right()));
		emit(new Label(end));
		return load(result);
	}

	private Register lowerUnary(UnaryExpr unary) {
		switch (unary.op()) {
			case NEG:
				if (unary.operand() instanceof IntLiteral literal) {
					return constant(program.typeOf(unary), -literal.value());
				}
				return unary(MirUnaryOp.NEG, lowerExpr(unary.operand()));
			case NOT:
				return unary(MirUnaryOp.NOT, lowerExpr(unary.operand()));
			case DEREF:
				return load(lowerExpr(unary.operand()));
			case ADDRESS_OF:
				return address(unary.operand());
			default:
				throw new IllegalStateException("unknown unary operator " + unary.op());
		}
	}

	private Register lowerAssign(AssignExpr assign) {
		if (assign.compoundOp() == null) {
			Register value = lowerExpr(assign.value());
			store(address(assign.target()), value);
			return value;
		}
		Register target = address(assign.target());
		Register current = load(target);
		Register operand = lowerExpr(assign.value());
		Register result;
		if (current.type() instanceof PointerType pointer) {
			if (assign.compoundOp() == BinaryOp.SUB) {
				operand = unary(MirUnaryOp.NEG, operand);
			}
			result = elementPtr(current, operand, pointer.pointee());
		} else {
			result = binary(binaryOp(assign.compoundOp()), current, operand);
		}
		store(target, result);
		return result;
	}

	private Register lowerCall(CallExpr call) {
		Local local = lookup(call.callee());
		if (local != null) {
			Register callee = local.inSlot() ? load(local.register()) : local.register();
			List<Register> args = lowerArgs(call.args());
			Register dest = resultRegister(((FunctionType) callee.type()).returnType());
			emit(new CallIndirect(dest, callee, args));
			return dest;
		}
		if (Builtins.isBuiltin(call.callee())) {
			Register value = lowerExpr(call.args().get(0));
			emit(new Call(null, Builtins.printFunction((ScalarType) value.type()), List.of(value), true));
			return null;
		}
		FunctionType callee = program.signatures().get(call.callee());
		List<Register> args = lowerArgs(call.args());
		Register dest = resultRegister(callee.returnType());
		emit(new Call(dest, call.callee(), args, false));
		return dest;
	}

	private List<Register> lowerArgs(List<Expr> args) {
		List<Register> registers = new ArrayList<>();
		for (Expr arg : args) {
			registers.add(lowerExpr(arg));
		}
		return registers;
	}

	private Register resultRegister(Type returnType) {
		return returnType instanceof UnitType ? null : newRegister(returnType);
	}

	/**
	 * Field values are evaluated in source order, then stored in declaration
	 * order. Returns the slot holding the struct.
	 */
	private Register lowerStructLiteral(StructLiteral literal) {
		Map<String, Register> values = new HashMap<>();
		for (FieldInit init : literal.fields()) {
			values.put(init.name(), lowerExpr(init.value()));
		}
		StructLayout layout = program.layouts().get(literal.name());
		Register slot = alloc(new StructType(literal.name()));
		for (FieldLayout field : layout.fields()) {
			store(fieldPtr(slot, field), values.get(field.name()));
		}
		return slot;
	}

	private Register lowerArrayLiteral(ArrayLiteral literal) {
		ArrayType type = (ArrayType) program.typeOf(literal);
		List<Register> values = new ArrayList<>();
		for (Expr element : literal.elements()) {
			values.add(lowerExpr(element));
		}
		Register slot = alloc(type);
		for (int i = 0; i < values.size(); i++) {
			store(elementPtr(slot, constant(ScalarType.I32, i), type.element()), values.get(i));
		}
		return slot;
	}

	private Register lowerRepeatLiteral(RepeatArrayLiteral literal) {
		ArrayType type = (ArrayType) program.typeOf(literal);
		Register value = lowerExpr(literal.element());
		Register slot = alloc(type);
		Register index = alloc(ScalarType.I32);
		store(index, constant(ScalarType.I32, 0));
		Register count = constant(ScalarType.I32, type.length());

		int head = newLabel();
		int body = newLabel();
		int exit = newLabel();
		emit(new Label(head));
		Register current = load(index);
		emit(new JumpIf(binary(MirBinaryOp.LT, current, count), body));
		emit(new Jump(exit));
		emit(new Label(body));
		store(elementPtr(slot, current, type.element()), value);
		store(index, binary(MirBinaryOp.ADD, current, constant(ScalarType.I32, 1)));
		emit(new Jump(head));
		emit(new Label(exit));
		return slot;
	}

	/**
	 * {@code a[i..j]}: a slice starting at element {@code i} with length
	 * {@code j - i}, plus one when inclusive.
	 */
	private Register lowerSlicing(IndexExpr index, RangeExpr range) {
		Type target = program.typeOf(index.target());
		Register base = target instanceof ArrayType ? address(index.target()) : lowerExpr(index.target());
		Register start = lowerExpr(range.start());
		Register end = lowerExpr(range.end());
		Type element = elementOf(target);

		Register first = elementPtr(base, start, element);
		Register length = binary(MirBinaryOp.SUB, end, start);
		if (range.inclusive()) {
			length = binary(MirBinaryOp.ADD, length, constant(ScalarType.I32, 1));
		}
		Register dest = newRegister(new SliceType(element));
		emit(new MakeSlice(dest, first, length));
		return dest;
	}

	private Register arrayToSlice(Expr expr) {
		ArrayType array = (ArrayType) program.typeOf(expr);
		Register first = elementPtr(address(expr), constant(ScalarType.I32, 0), array.element());
		Register length = constant(ScalarType.I32, array.length());
		Register dest = newRegister(new SliceType(array.element()));
		emit(new MakeSlice(dest, first, length));
		return dest;
	}

	// --------------------------------------------------------------- places

	/**
	 * Pointer to the storage named by {@code place}. Values that have no
	 * storage of their own are spilled to a fresh slot.
	 */
	private Register address(Expr place) {
		if (place instanceof NameExpr name) {
			Local local = lookup(name.name());
			if (local != null && local.inSlot()) {
				return local.register();
			}
		} else if (place instanceof FieldExpr field) {
			Type target = program.typeOf(field.target());
			if (target instanceof PointerType pointer) {
				return fieldPtr(lowerExpr(field.target()), field((StructType) pointer.pointee(), field.field()));
			}
			if (target instanceof StructType struct) {
				return fieldPtr(address(field.target()), field(struct, field.field()));
			}
		} else if (place instanceof IndexExpr index && !(index.index() instanceof RangeExpr)) {
			Type target = program.typeOf(index.target());
			Register base = target instanceof ArrayType ? address(index.target()) : lowerExpr(index.target());
			Register position = lowerExpr(index.index());
			return elementPtr(base, position, elementOf(target));
		} else if (place instanceof UnaryExpr unary && unary.op() == UnaryOp.DEREF) {
			return lowerExpr(unary.operand());
		} else if (place instanceof StructLiteral literal) {
			return lowerStructLiteral(literal);
		} else if (place instanceof ArrayLiteral literal) {
			return lowerArrayLiteral(literal);
		} else if (place instanceof RepeatArrayLiteral literal) {
			return lowerRepeatLiteral(literal);
		}
		Register value = lowerValue(place);
		Register slot = alloc(value.type());
		store(slot, value);
		return slot;
	}

	private FieldLayout field(StructType struct, String name) {
		return program.layouts().get(struct.name()).field(name)
				.orElseThrow(() -> new IllegalStateException("no field " + name + " in " + struct));
	}

	private Register fieldPtr(Register base, FieldLayout field) {
		Register dest = newRegister(new PointerType(field.type()));
		emit(new GetFieldPtr(dest, base, field.name(), field.offset()));
		return dest;
	}

	private Register elementPtr(Register base, Register index, Type element) {
		Register dest = newRegister(new PointerType(element));
		emit(new GetElementPtr(dest, base, index, program.layouts().sizeOf(element)));
		return dest;
	}

	private static Type elementOf(Type collection) {
		if (collection instanceof ArrayType array) {
			return array.element();
		}
		if (collection instanceof SliceType slice) {
			return slice.element();
		}
		if (collection instanceof PointerType pointer) {
			return pointer.pointee();
		}
		throw new IllegalStateException("not indexable: " + collection);
	}

	// ----------------------------------------------------------- emission

	private Register newRegister(Type type) {
		Register register = new Register(registers.size(), type);
		registers.add(register);
		return register;
	}

	private int newLabel() {
		return nextLabel++;
	}

	private void emit(Instruction instruction) {
		code.add(instruction);
	}

	private void bind(String name, Register register, boolean inSlot) {
		env.peek().put(name, new Local(register, inSlot));
	}

	private Local lookup(String name) {
		for (Map<String, Local> scope : env) {
			Local local = scope.get(name);
			if (local != null) {
				return local;
			}
		}
		return null;
	}

	private Register constant(Type type, long value) {
		Register dest = newRegister(type);
		emit(new Const(dest, value));
		return dest;
	}

	private Register alloc(Type type) {
		Register dest = newRegister(new PointerType(type));
		emit(new Alloc(dest, type));
		return dest;
	}

	private Register load(Register address) {
		Register dest = newRegister(((PointerType) address.type()).pointee());
		emit(new Load(dest, address));
		return dest;
	}

	private void store(Register address, Register value) {
		emit(new Store(address, value));
	}

	private Register binary(MirBinaryOp op, Register left, Register right) {
		Register dest = newRegister(op.isComparison() ? ScalarType.BOOL : left.type());
		emit(new BinOp(dest, op, left, right));
		return dest;
	}

	private Register unary(MirUnaryOp op, Register operand) {
		Register dest = newRegister(operand.type());
		emit(new UnOp(dest, op, operand));
		return dest;
	}

	private static MirBinaryOp binaryOp(BinaryOp op) {
		return switch (op) {
			case ADD -> MirBinaryOp.ADD;
			case SUB -> MirBinaryOp.SUB;
			case MUL -> MirBinaryOp.MUL;
			case DIV -> MirBinaryOp.DIV;
			case REM -> MirBinaryOp.REM;
			case BIT_AND -> MirBinaryOp.BIT_AND;
			case BIT_OR -> MirBinaryOp.BIT_OR;
			case BIT_XOR -> MirBinaryOp.BIT_XOR;
			case SHL -> MirBinaryOp.SHL;
			case SHR -> MirBinaryOp.SHR;
			case EQ -> MirBinaryOp.EQ;
			case NE -> MirBinaryOp.NE;
			case LT -> MirBinaryOp.LT;
			case LE -> MirBinaryOp.LE;
			case GT -> MirBinaryOp.GT;
			case GE -> MirBinaryOp.GE;
			case AND, OR -> throw new IllegalArgumentException("short-circuit operator " + op);
		};
	}
}
