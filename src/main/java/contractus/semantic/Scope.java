package contractus.semantic;

import contractus.types.Type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Lexical scope stack. A scope is pushed on block entry and popped on exit;
 * lookups go innermost to outermost.
 */
final class Scope {
	/**
	 * One declared name. Whether it holds a value is flow state kept by the
	 * checker, not by the binding. {@code loopDepth} counts the loops around
	 * the declaration.
	 */
	static final class Binding {
		final Type type;
		final boolean mutable;
		final int loopDepth;

		Binding(Type type, boolean mutable, int loopDepth) {
			this.type = type;
			this.mutable = mutable;
			this.loopDepth = loopDepth;
		}
	}

	private final Deque<Map<String, Binding>> frames = new ArrayDeque<>();

	void push() {
		frames.push(new HashMap<>());
	}

	void pop() {
		frames.pop();
	}

	Binding declare(String name, Type type, boolean mutable, int loopDepth) {
		Binding binding = new Binding(type, mutable, loopDepth);
		frames.peek().put(name, binding);
		return binding;
	}

	Binding lookup(String name) {
		for (Map<String, Binding> frame : frames) {
			Binding binding = frame.get(name);
			if (binding != null) {
				return binding;
			}
		}
		return null;
	}
}
