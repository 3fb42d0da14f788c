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

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import juliatheviper.core.Syntax.Data;
import juliatheviper.core.Syntax.FunctionDef;
import juliatheviper.core.Syntax.Guard;
import juliatheviper.core.Syntax.ReverseBlock;
import juliatheviper.core.Syntax.Reversible;
import juliatheviper.core.Syntax.SymbolTable;
import juliatheviper.util.Diagnostic;
import juliatheviper.util.RuntimeError;

/**
 * Applies reverse blocks and rolls them back. Applying a block executes its
 * increments forwards, whilst recording each delta in a log. Rolling back
 * replays the log in reverse order with each delta negated. Only variables
 * touched within the block are affected by a rollback; values copied out of
 * the block beforehand are retained.
 *
 * @author David J. Pearce
 *
 */
public class ReversibilityEngine {
	private static final Logger log = LoggerFactory.getLogger(ReversibilityEngine.class);

	public final static String INVALID_REVERSIBLE = "statement is not reversible";
	public final static String NONTOTAL_CALL = "call to non-total function in reverse block";
	public final static String NOTHING_TO_ROLLBACK = "no recorded execution to roll back for reverse block";
	public final static String DEGRADED = "reversal of inexact value is not guaranteed to restore it";

	private final Interpreter interpreter;
	private final SymbolTable functions;

	public ReversibilityEngine(Interpreter interpreter, SymbolTable functions) {
		this.interpreter = interpreter;
		this.functions = functions;
	}

	/**
	 * Execute a reverse block forwards in a given frame.
	 *
	 * @param frame
	 * @param block
	 * @param warnings Collects any warnings of degraded reversibility
	 * @return The log of deltas applied
	 */
	public ReversalLog apply(Environment frame, ReverseBlock block, List<Diagnostic> warnings) {
		// Revalidate before anything is changed
		for (int i = 0; i != block.size(); ++i) {
			validate(block.get(i));
		}
		ReversalLog rlog = new ReversalLog(block);
		for (int i = 0; i != block.size(); ++i) {
			apply(frame, block.get(i), rlog, warnings);
		}
		return rlog;
	}

	/**
	 * Undo the effect of a previous forward execution. Every restored value is
	 * computed before any variable is rebound, so a failure part way leaves all
	 * variables (and the log) untouched.
	 *
	 * @param rlog
	 */
	public void rollback(ReversalLog rlog) {
		IdentityHashMap<Environment, Map<String, NumericValue>> restored = new IdentityHashMap<>();
		for (int i = rlog.size() - 1; i >= 0; --i) {
			ReversalLog.Entry e = rlog.get(i);
			Map<String, NumericValue> frame = restored.computeIfAbsent(e.frame(), k -> new LinkedHashMap<>());
			NumericValue current = frame.get(e.variable());
			if (current == null) {
				current = e.frame().read(e.variable());
			}
			frame.put(e.variable(), current.subtract(e.delta()).narrow(e.prior()));
		}
		for (Map.Entry<Environment, Map<String, NumericValue>> f : restored.entrySet()) {
			for (Map.Entry<String, NumericValue> b : f.getValue().entrySet()) {
				f.getKey().bind(b.getKey(), b.getValue());
			}
		}
	}

	public static RuntimeError nothingToRollback(ReverseBlock block) {
		return new RuntimeError.NonReversibleOperationError(NOTHING_TO_ROLLBACK + " #" + block.index()).at(block);
	}

	private void apply(Environment frame, Reversible stmt, ReversalLog rlog, List<Diagnostic> warnings) {
		try {
			if (stmt instanceof Reversible.Increment) {
				Reversible.Increment inc = (Reversible.Increment) stmt;
				// Increments, like assignments, only touch the current frame
				if (!frame.isBound(inc.variable())) {
					throw new RuntimeError.UndefinedReference(inc.variable());
				}
				NumericValue before = frame.read(inc.variable());
				NumericValue delta = interpreter.evaluate(frame, inc.operand());
				if (inc.isDecrement()) {
					delta = delta.negate();
				}
				NumericValue after = before.add(delta);
				if (isInexact(before) || isInexact(after)) {
					String msg = DEGRADED + ": " + inc.variable() + " (" + after.kind() + ")";
					log.warn("line {}: {}", inc.line(), msg);
					warnings.add(new Diagnostic(Diagnostic.Kind.DEGRADED_REVERSIBILITY, msg, inc.variable(), inc));
				}
				frame.bind(inc.variable(), after);
				rlog.record(frame, inc.variable(), delta, before.kind());
			} else {
				Reversible.Conditional c = (Reversible.Conditional) stmt;
				Reversible[] branch = interpreter.test(frame, c.guard()) ? c.trueBranch() : c.falseBranch();
				for (Reversible r : branch) {
					apply(frame, r, rlog, warnings);
				}
			}
		} catch (RuntimeError e) {
			throw e.at(stmt);
		}
	}

	private static boolean isInexact(NumericValue v) {
		switch (v.kind()) {
		case FLOAT:
		case COMPLEX:
		case SYMBOLIC:
			return true;
		default:
			return false;
		}
	}

	private void validate(Reversible stmt) {
		if (stmt instanceof Reversible.Increment) {
			validate(((Reversible.Increment) stmt).operand());
		} else if (stmt instanceof Reversible.Conditional) {
			Reversible.Conditional c = (Reversible.Conditional) stmt;
			validate(c.guard());
			for (Reversible r : c.trueBranch()) {
				validate(r);
			}
			for (Reversible r : c.falseBranch()) {
				validate(r);
			}
		} else {
			throw new RuntimeError.NonReversibleOperationError(INVALID_REVERSIBLE + ": " + stmt).at(stmt);
		}
	}

	private void validate(Guard guard) {
		validate(guard.leftOperand());
		validate(guard.rightOperand());
	}

	private void validate(Data data) {
		if (data instanceof Data.Add) {
			validate(((Data.Add) data).leftOperand());
			validate(((Data.Add) data).rightOperand());
		} else if (data instanceof Data.PureCall) {
			Data.PureCall call = (Data.PureCall) data;
			FunctionDef fn = functions.get(call.name());
			if (fn == null || !fn.isTotal()) {
				throw new RuntimeError.NonReversibleOperationError(NONTOTAL_CALL + ": " + call.name()).at(call);
			}
			for (Data arg : call.arguments()) {
				validate(arg);
			}
		}
	}
}
