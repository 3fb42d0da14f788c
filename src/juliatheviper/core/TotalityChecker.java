// This file is part of the Julia the Viper Interpreter (jtv).
//
// The Julia the Viper Interpreter is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Julia the Viper Interpreter is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Julia the Viper Interpreter. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.

package juliatheviper.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import juliatheviper.core.Syntax.Block;
import juliatheviper.core.Syntax.Control;
import juliatheviper.core.Syntax.Data;
import juliatheviper.core.Syntax.Expr;
import juliatheviper.core.Syntax.FunctionDef;
import juliatheviper.core.Syntax.Guard;
import juliatheviper.core.Syntax.Parameter;
import juliatheviper.core.Syntax.Program;
import juliatheviper.core.Syntax.ReverseBlock;
import juliatheviper.core.Syntax.Reversible;
import juliatheviper.core.Syntax.SymbolTable;
import juliatheviper.util.AbstractTransformer;
import juliatheviper.util.Diagnostic;
import juliatheviper.util.SyntacticElement;

/**
 * Responsible for establishing that every function declared
 * <code>@pure</code> is both pure (it has no observable effect beyond its own
 * frame) and total (it terminates on all inputs). Functions which pass are
 * marked total, and only then may they be called from Data position at
 * runtime. Ordinary functions belong to the Control language and are never
 * checked.
 *
 * @author David J. Pearce
 *
 */
public class TotalityChecker extends AbstractTransformer<TotalityChecker.Scope, Void, Void> {
	private static final Logger log = LoggerFactory.getLogger(TotalityChecker.class);
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;
	// Error messages
	public final static String LOOP_IN_PURE_FUNCTION = "unbounded iteration in pure function";
	public final static String RECURSIVE_PURE_FUNCTION = "recursive call cycle through pure function";
	public final static String IO_IN_PURE_FUNCTION = "I/O in pure function";
	public final static String IMPURE_CALL_IN_PURE_FUNCTION = "call to impure function from pure function";
	public final static String OUTER_READ_IN_PURE_FUNCTION = "read of variable outside frame of pure function";

	/**
	 * Check every pure function in a given program, marking those which pass as
	 * total.
	 *
	 * @param program
	 * @return The list of diagnostics, which is empty if the program passed.
	 */
	public List<Diagnostic> check(Program program) {
		SymbolTable table = program.functions();
		final int n = table.size();
		List<Diagnostic> diagnostics = new ArrayList<>();
		// Call graph over pure functions, addressed by symbol table index
		List<BitSet> callees = new ArrayList<>();
		BitSet failed = new BitSet(n);
		for (int i = 0; i != n; ++i) {
			FunctionDef fn = table.get(i);
			Scope scope = new Scope(fn, table);
			if (fn.isPure()) {
				check(scope, fn.body());
				if (!scope.diagnostics.isEmpty()) {
					failed.set(i);
					diagnostics.addAll(scope.diagnostics);
				}
			}
			callees.add(scope.callees);
		}
		// Detect call cycles
		for (int i = 0; i != n; ++i) {
			FunctionDef fn = table.get(i);
			if (fn.isPure() && reaches(callees, i, i)) {
				failed.set(i);
				diagnostics.add(new Diagnostic(Diagnostic.Kind.TOTALITY_VIOLATION,
						RECURSIVE_PURE_FUNCTION + " " + fn.name(), fn.name(), fn));
			}
		}
		// A pure function is total only when all of its callees are
		boolean changed = true;
		while (changed) {
			changed = false;
			for (int i = 0; i != n; ++i) {
				if (table.get(i).isPure() && !failed.get(i) && callees.get(i).intersects(failed)) {
					failed.set(i);
					changed = true;
				}
			}
		}
		for (int i = 0; i != n; ++i) {
			FunctionDef fn = table.get(i);
			if (fn.isPure() && !failed.get(i)) {
				fn.markTotal();
			}
		}
		if (DEBUG) {
			for (FunctionDef fn : table.functions()) {
				System.err.println(fn + " : total=" + fn.isTotal() + ", calls=" + callees.get(fn.index()));
			}
		}
		if (!diagnostics.isEmpty()) {
			log.info("program {} rejected with {} diagnostic(s)", program.filename(), diagnostics.size());
		}
		return diagnostics;
	}

	/**
	 * Determine whether one function can reach another through the call graph.
	 * This uses an explicit worklist rather than recursion.
	 *
	 * @param callees
	 * @param from
	 * @param to
	 * @return
	 */
	private static boolean reaches(List<BitSet> callees, int from, int to) {
		BitSet visited = new BitSet(callees.size());
		Deque<Integer> worklist = new ArrayDeque<>();
		worklist.push(from);
		while (!worklist.isEmpty()) {
			int f = worklist.pop();
			BitSet next = callees.get(f);
			for (int g = next.nextSetBit(0); g >= 0; g = next.nextSetBit(g + 1)) {
				if (g == to) {
					return true;
				} else if (!visited.get(g)) {
					visited.set(g);
					worklist.push(g);
				}
			}
		}
		return false;
	}

	private void check(Scope scope, Block block) {
		for (int i = 0; i != block.size(); ++i) {
			apply(scope, block.get(i));
		}
	}

	private void check(Scope scope, Guard guard) {
		apply(scope, guard.leftOperand());
		apply(scope, guard.rightOperand());
	}

	@Override
	protected Void apply(Scope scope, Control.Assignment stmt) {
		apply(scope, stmt.rightOperand());
		scope.assigned.add(stmt.variable());
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.If stmt) {
		check(scope, stmt.guard());
		Scope trueScope = scope.branch();
		check(trueScope, stmt.trueBranch());
		Scope falseScope = scope.branch();
		if (stmt.falseBranch() != null) {
			check(falseScope, stmt.falseBranch());
		}
		// Only variables assigned on both branches are definitely local afterwards
		Set<String> both = new HashSet<>(trueScope.assigned);
		both.retainAll(falseScope.assigned);
		scope.assigned.addAll(both);
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.While stmt) {
		scope.report(Diagnostic.Kind.TOTALITY_VIOLATION, LOOP_IN_PURE_FUNCTION + " " + scope.function.name(),
				"while", stmt);
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.For stmt) {
		scope.report(Diagnostic.Kind.TOTALITY_VIOLATION, LOOP_IN_PURE_FUNCTION + " " + scope.function.name(), "for",
				stmt);
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.Return stmt) {
		if (stmt.operand() != null) {
			apply(scope, stmt.operand());
		}
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.FunctionDecl stmt) {
		// Functions are only declared at the top level
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.Call stmt) {
		apply(scope, stmt.invocation());
		return null;
	}

	@Override
	protected Void apply(Scope scope, Control.Print stmt) {
		scope.report(Diagnostic.Kind.PURITY_VIOLATION, IO_IN_PURE_FUNCTION + " " + scope.function.name(), "print",
				stmt);
		return null;
	}

	@Override
	protected Void apply(Scope scope, ReverseBlock stmt) {
		for (int i = 0; i != stmt.size(); ++i) {
			apply(scope, stmt.get(i));
		}
		return null;
	}

	@Override
	protected Void apply(Scope scope, Reversible.Increment stmt) {
		scope.read(stmt.variable(), stmt);
		apply(scope, stmt.operand());
		return null;
	}

	@Override
	protected Void apply(Scope scope, Reversible.Conditional stmt) {
		check(scope, stmt.guard());
		for (Reversible r : stmt.trueBranch()) {
			apply(scope, r);
		}
		for (Reversible r : stmt.falseBranch()) {
			apply(scope, r);
		}
		return null;
	}

	@Override
	protected Void apply(Scope scope, Expr.Arithmetic expr) {
		apply(scope, expr.leftOperand());
		apply(scope, expr.rightOperand());
		return null;
	}

	@Override
	protected Void apply(Scope scope, Expr.Invoke expr) {
		for (Expr arg : expr.arguments()) {
			apply(scope, arg);
		}
		scope.call(expr.name(), expr);
		return null;
	}

	@Override
	protected Void apply(Scope scope, Data.Literal expr) {
		return null;
	}

	@Override
	protected Void apply(Scope scope, Data.Identifier expr) {
		scope.read(expr.name(), expr);
		return null;
	}

	@Override
	protected Void apply(Scope scope, Data.Add expr) {
		apply(scope, expr.leftOperand());
		apply(scope, expr.rightOperand());
		return null;
	}

	@Override
	protected Void apply(Scope scope, Data.PureCall expr) {
		for (Data arg : expr.arguments()) {
			apply(scope, arg);
		}
		scope.call(expr.name(), expr);
		return null;
	}

	/**
	 * The state of checking a single function body. This tracks the variables
	 * definitely assigned within the function's own frame, and the functions it
	 * calls.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Scope {
		private final FunctionDef function;
		private final SymbolTable table;
		private final Set<String> assigned;
		private final BitSet callees;
		private final List<Diagnostic> diagnostics;

		public Scope(FunctionDef function, SymbolTable table) {
			this.function = function;
			this.table = table;
			this.assigned = new HashSet<>();
			this.callees = new BitSet(table.size());
			this.diagnostics = new ArrayList<>();
			for (Parameter p : function.parameters()) {
				assigned.add(p.name());
			}
		}

		private Scope(Scope parent) {
			this.function = parent.function;
			this.table = parent.table;
			this.assigned = new HashSet<>(parent.assigned);
			this.callees = parent.callees;
			this.diagnostics = parent.diagnostics;
		}

		/**
		 * Create a scope for checking one branch of a conditional. Assignments made
		 * in the branch are not visible in this scope.
		 *
		 * @return
		 */
		public Scope branch() {
			return new Scope(this);
		}

		private void read(String variable, SyntacticElement element) {
			if (function.isPure() && !assigned.contains(variable)) {
				report(Diagnostic.Kind.PURITY_VIOLATION,
						OUTER_READ_IN_PURE_FUNCTION + " " + function.name() + ": " + variable, variable, element);
			}
		}

		private void call(String name, SyntacticElement element) {
			FunctionDef callee = table.get(name);
			if (callee == null) {
				// Unknown functions are rejected by the parser
				return;
			}
			callees.set(callee.index());
			if (function.isPure() && !callee.isPure()) {
				report(Diagnostic.Kind.PURITY_VIOLATION,
						IMPURE_CALL_IN_PURE_FUNCTION + " " + function.name() + ": " + name, name, element);
			}
		}

		private void report(Diagnostic.Kind kind, String message, String construct, SyntacticElement element) {
			diagnostics.add(new Diagnostic(kind, message, construct, element));
		}
	}
}
