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
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

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
import juliatheviper.util.AbstractTransformer;
import juliatheviper.util.CheckError;
import juliatheviper.util.Diagnostic;
import juliatheviper.util.RuntimeError;
import juliatheviper.util.SyntacticElement;

/**
 * A session for executing a single program. The program (and its symbol
 * table) is shared read-only, whilst everything else (the global frame, the
 * output, the step counter, the reversal logs and the warnings) belongs to the
 * session. Hence, independent sessions can safely run in parallel on the same
 * program.
 *
 * A session can only be created for a program which passes the totality and
 * purity checker.
 *
 * @author David J. Pearce
 *
 */
public class Interpreter extends AbstractTransformer<Environment, Interpreter.Exit, NumericValue> {
	private static final Logger log = LoggerFactory.getLogger(Interpreter.class);
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	private final Program program;
	private final Budget budget;
	private final Tracer tracer;
	private final Consumer<String> sink;
	private final ReversibilityEngine engine;
	// Session state
	private Environment globals = new Environment();
	private final List<String> output = new ArrayList<>();
	private final List<Diagnostic> warnings = new ArrayList<>();
	private final Map<Integer, Deque<ReversalLog>> logs = new HashMap<>();
	private long steps;
	private long deadline;
	private int depth;

	public Interpreter(Program program) {
		this(program, Budget.UNLIMITED, Tracer.NONE, null);
	}

	public Interpreter(Program program, Budget budget) {
		this(program, budget, Tracer.NONE, null);
	}

	/**
	 * Construct a new session.
	 *
	 * @param program The program to execute
	 * @param budget  Bounds on steps, time and call depth for each run
	 * @param tracer  Receives execution events
	 * @param sink    Receives each printed line as it is produced (may be
	 *                <code>null</code>)
	 * @throws CheckError if the program fails the totality and purity checker.
	 */
	public Interpreter(Program program, Budget budget, Tracer tracer, Consumer<String> sink) {
		List<Diagnostic> diagnostics = new TotalityChecker().check(program);
		List<Diagnostic> fatal = new ArrayList<>();
		for (Diagnostic d : diagnostics) {
			if (d.isFatal()) {
				fatal.add(d);
			}
		}
		if (!fatal.isEmpty()) {
			throw new CheckError(fatal);
		}
		this.program = program;
		this.budget = budget;
		this.tracer = tracer;
		this.sink = sink;
		this.engine = new ReversibilityEngine(this, program.functions());
	}

	/**
	 * Execute the top-level statements of the program in source order, starting
	 * from an empty global frame.
	 *
	 * @return
	 */
	public ExecutionResult run() {
		globals = new Environment();
		output.clear();
		warnings.clear();
		logs.clear();
		begin();
		log.debug("running {} with budget {}", program.filename(), budget);
		for (Control stmt : program.statements()) {
			apply(globals, stmt);
		}
		if (DEBUG) {
			System.err.println(globals);
		}
		log.debug("finished {} after {} steps", program.filename(), steps);
		return new ExecutionResult(globals.bindings(), new ArrayList<>(output), steps, new ArrayList<>(warnings));
	}

	/**
	 * Read the value of a global variable.
	 *
	 * @param name
	 * @return
	 */
	public NumericValue getVariable(String name) {
		return globals.read(name);
	}

	/**
	 * Invoke a declared function directly with a given set of arguments. This
	 * executes in a fresh frame whose parent is the global frame.
	 *
	 * @param name
	 * @param arguments
	 * @return The returned value, or <code>null</code> if none.
	 */
	public NumericValue invoke(String name, NumericValue... arguments) {
		FunctionDef fn = program.functions().get(name);
		if (fn == null) {
			throw new RuntimeError.UndefinedReference(name);
		}
		begin();
		return invoke(globals, fn, arguments, fn);
	}

	public List<ReverseBlock> reverseBlocks() {
		return program.reverseBlocks();
	}

	/**
	 * Execute a reverse block forwards against the global frame.
	 *
	 * @param block
	 */
	public void runReverse(ReverseBlock block) {
		begin();
		forward(globals, block);
	}

	public void runReverse(int index) {
		runReverse(program.reverseBlocks().get(index));
	}

	/**
	 * Undo the most recent forward execution of a reverse block, whether it was
	 * executed as part of a run or through <code>runReverse</code>.
	 *
	 * @param block
	 */
	public void rollback(ReverseBlock block) {
		Deque<ReversalLog> stack = logs.get(block.index());
		if (stack == null || stack.isEmpty()) {
			throw ReversibilityEngine.nothingToRollback(block);
		}
		tracer.reverse(block, false);
		engine.rollback(stack.peek());
		stack.pop();
	}

	public void rollback(int index) {
		rollback(program.reverseBlocks().get(index));
	}

	/**
	 * The lines printed so far by this session.
	 *
	 * @return
	 */
	public List<String> output() {
		return Collections.unmodifiableList(output);
	}

	public List<Diagnostic> warnings() {
		return Collections.unmodifiableList(warnings);
	}

	public Program program() {
		return program;
	}

	// ================================================================================
	// Statements
	// ================================================================================

	@Override
	public Exit apply(Environment frame, Control stmt) {
		step(stmt);
		tracer.statement(stmt, frame);
		try {
			return super.apply(frame, stmt);
		} catch (RuntimeError e) {
			throw e.at(stmt);
		}
	}

	private Exit execute(Environment frame, Block block) {
		for (int i = 0; i != block.size(); ++i) {
			Exit r = apply(frame, block.get(i));
			if (r != null) {
				return r;
			}
		}
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.Assignment stmt) {
		NumericValue v = value(apply(frame, stmt.rightOperand()), stmt.rightOperand());
		frame.bind(stmt.variable(), v);
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.If stmt) {
		if (test(frame, stmt.guard())) {
			return execute(frame, stmt.trueBranch());
		} else if (stmt.falseBranch() != null) {
			return execute(frame, stmt.falseBranch());
		}
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.While stmt) {
		while (test(frame, stmt.guard())) {
			Exit r = execute(frame, stmt.body());
			if (r != null) {
				return r;
			}
			step(stmt);
		}
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.For stmt) {
		// Bounds are fixed on entry
		long from = evaluate(frame, stmt.from()).longValue();
		long to = evaluate(frame, stmt.to()).longValue();
		for (long i = from; i < to; ++i) {
			frame.bind(stmt.variable(), new NumericValue.Int(i));
			Exit r = execute(frame, stmt.body());
			if (r != null) {
				return r;
			}
			step(stmt);
		}
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.Return stmt) {
		if (stmt.operand() == null) {
			return Exit.UNIT;
		}
		return new Exit(value(apply(frame, stmt.operand()), stmt.operand()));
	}

	@Override
	protected Exit apply(Environment frame, Control.FunctionDecl stmt) {
		// Declarations are resolved through the symbol table
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.Call stmt) {
		apply(frame, stmt.invocation());
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Control.Print stmt) {
		String line = "";
		Expr[] operands = stmt.operands();
		for (int i = 0; i != operands.length; ++i) {
			if (i != 0) {
				line += " ";
			}
			line += value(apply(frame, operands[i]), operands[i]);
		}
		output.add(line);
		if (sink != null) {
			sink.accept(line);
		}
		return null;
	}

	@Override
	protected Exit apply(Environment frame, ReverseBlock stmt) {
		forward(frame, stmt);
		return null;
	}

	@Override
	protected Exit apply(Environment frame, Reversible.Increment stmt) {
		// Reversible statements are executed by the engine
		throw new RuntimeError.NonReversibleOperationError(ReversibilityEngine.INVALID_REVERSIBLE + ": " + stmt);
	}

	@Override
	protected Exit apply(Environment frame, Reversible.Conditional stmt) {
		throw new RuntimeError.NonReversibleOperationError(ReversibilityEngine.INVALID_REVERSIBLE + ": " + stmt);
	}

	private void forward(Environment frame, ReverseBlock block) {
		tracer.reverse(block, true);
		ReversalLog rlog = engine.apply(frame, block, warnings);
		logs.computeIfAbsent(block.index(), k -> new ArrayDeque<>()).push(rlog);
	}

	// ================================================================================
	// Expressions
	// ================================================================================

	@Override
	public NumericValue apply(Environment frame, Expr expr) {
		try {
			return super.apply(frame, expr);
		} catch (RuntimeError e) {
			throw e.at(expr);
		}
	}

	@Override
	public NumericValue apply(Environment frame, Data data) {
		try {
			return super.apply(frame, data);
		} catch (RuntimeError e) {
			throw e.at(data);
		}
	}

	/**
	 * Evaluate a Data expression in a given frame.
	 *
	 * @param frame
	 * @param data
	 * @return
	 */
	public NumericValue evaluate(Environment frame, Data data) {
		return apply(frame, data);
	}

	/**
	 * Evaluate a guard in a given frame.
	 *
	 * @param frame
	 * @param guard
	 * @return
	 */
	public boolean test(Environment frame, Guard guard) {
		NumericValue lhs = evaluate(frame, guard.leftOperand());
		NumericValue rhs = evaluate(frame, guard.rightOperand());
		try {
			switch (guard.comparator()) {
			case EQ:
				return lhs.equalTo(rhs);
			case LT:
				return lhs.compare(rhs) < 0;
			case GT:
				return lhs.compare(rhs) > 0;
			case LTEQ:
				return lhs.compare(rhs) <= 0;
			default:
				return lhs.compare(rhs) >= 0;
			}
		} catch (RuntimeError e) {
			throw e.at(guard);
		}
	}

	@Override
	protected NumericValue apply(Environment frame, Expr.Arithmetic expr) {
		NumericValue lhs = value(apply(frame, expr.leftOperand()), expr.leftOperand());
		NumericValue rhs = value(apply(frame, expr.rightOperand()), expr.rightOperand());
		return NumericValue.apply(expr.operator(), lhs, rhs);
	}

	@Override
	protected NumericValue apply(Environment frame, Expr.Invoke expr) {
		FunctionDef fn = program.functions().get(expr.name());
		if (fn == null) {
			throw new RuntimeError.UndefinedReference(expr.name());
		}
		Expr[] args = expr.arguments();
		NumericValue[] values = new NumericValue[args.length];
		for (int i = 0; i != args.length; ++i) {
			values[i] = value(apply(frame, args[i]), args[i]);
		}
		return invoke(frame, fn, values, expr);
	}

	@Override
	protected NumericValue apply(Environment frame, Data.Literal expr) {
		return expr.value();
	}

	@Override
	protected NumericValue apply(Environment frame, Data.Identifier expr) {
		return frame.read(expr.name());
	}

	@Override
	protected NumericValue apply(Environment frame, Data.Add expr) {
		NumericValue lhs = apply(frame, expr.leftOperand());
		NumericValue rhs = apply(frame, expr.rightOperand());
		return lhs.add(rhs);
	}

	@Override
	protected NumericValue apply(Environment frame, Data.PureCall expr) {
		FunctionDef fn = program.functions().get(expr.name());
		if (fn == null) {
			throw new RuntimeError.UndefinedReference(expr.name());
		}
		NumericValue[] values = new NumericValue[expr.size()];
		for (int i = 0; i != values.length; ++i) {
			values[i] = apply(frame, expr.get(i));
		}
		NumericValue r = invoke(frame, fn, values, expr);
		return value(r, expr);
	}

	/**
	 * Invoke a function with a given set of (already evaluated) arguments. The
	 * body executes in a fresh frame, which cannot see the caller's locals.
	 *
	 * @return The returned value, or <code>null</code> if none.
	 */
	private NumericValue invoke(Environment caller, FunctionDef fn, NumericValue[] arguments,
			SyntacticElement site) {
		Parameter[] params = fn.parameters();
		if (params.length != arguments.length) {
			throw new RuntimeError.TypeMismatch(
					"function " + fn.name() + " expects " + params.length + " argument(s), found " + arguments.length)
							.at(site);
		}
		if (depth >= budget.maxCallDepth()) {
			log.warn("call depth {} exceeded calling {}", budget.maxCallDepth(), fn.name());
			throw new RuntimeError.ResourceExhausted("maximum call depth " + budget.maxCallDepth() + " exceeded")
					.at(site);
		}
		Environment frame = caller.push();
		for (int i = 0; i != params.length; ++i) {
			NumericValue v = arguments[i];
			if (params[i].kind() != null) {
				v = v.coerce(params[i].kind());
			}
			frame.bind(params[i].name(), v);
		}
		tracer.enter(fn, frame);
		depth = depth + 1;
		Exit exit;
		try {
			exit = execute(frame, fn.body());
		} finally {
			depth = depth - 1;
		}
		NumericValue result = exit == null ? null : exit.value;
		if (fn.returnKind() != null) {
			if (result == null) {
				throw new RuntimeError.TypeMismatch("function " + fn.name() + " must return " + fn.returnKind())
						.at(site);
			}
			result = result.coerce(fn.returnKind());
		}
		tracer.exit(fn, result);
		return result;
	}

	// ================================================================================
	// Helpers
	// ================================================================================

	private static NumericValue value(NumericValue v, SyntacticElement element) {
		if (v == null) {
			throw new RuntimeError.TypeMismatch("expression has no value: " + element).at(element);
		}
		return v;
	}

	private void begin() {
		steps = 0;
		depth = 0;
		long timeout = budget.timeoutMillis();
		long now = System.currentTimeMillis();
		deadline = timeout > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + timeout;
	}

	private void step(SyntacticElement element) {
		steps = steps + 1;
		if (steps > budget.maxSteps()) {
			log.warn("step limit {} exhausted at line {}", budget.maxSteps(), element.line());
			throw new RuntimeError.ResourceExhausted("step limit " + budget.maxSteps() + " exhausted").at(element);
		} else if (System.currentTimeMillis() > deadline) {
			log.warn("time limit {}ms exhausted at line {}", budget.timeoutMillis(), element.line());
			throw new RuntimeError.ResourceExhausted("time limit " + budget.timeoutMillis() + "ms exhausted")
					.at(element);
		}
	}

	/**
	 * Signals that a <code>return</code> statement has unwound the current frame.
	 */
	public static final class Exit {
		public static final Exit UNIT = new Exit(null);

		private final NumericValue value;

		private Exit(NumericValue value) {
			this.value = value;
		}

		/**
		 * The returned value, or <code>null</code> if no value was returned.
		 *
		 * @return
		 */
		public NumericValue value() {
			return value;
		}
	}
}
