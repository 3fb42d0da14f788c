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

package juliatheviper.util;

import juliatheviper.core.Syntax;
import juliatheviper.core.Syntax.Control;
import juliatheviper.core.Syntax.Data;
import juliatheviper.core.Syntax.Expr;
import juliatheviper.core.Syntax.Reversible;

/**
 * Dispatches over the three syntactic families of a program using their
 * opcodes. Statements of the Control language produce results of type
 * <code>T</code>, whilst expressions of either language produce results of
 * type <code>V</code>. Both are computed with respect to some state of type
 * <code>S</code> (e.g. a checking scope or a runtime environment).
 *
 * @author David J. Pearce
 *
 * @param <S> The state threaded through the transformation.
 * @param <T> The result of transforming a statement.
 * @param <V> The result of transforming an expression.
 */
public abstract class AbstractTransformer<S, T, V> {

	public T apply(S state, Control stmt) {
		switch (stmt.getOpcode()) {
		case Syntax.STMT_assignment:
			return apply(state, (Control.Assignment) stmt);
		case Syntax.STMT_if:
			return apply(state, (Control.If) stmt);
		case Syntax.STMT_while:
			return apply(state, (Control.While) stmt);
		case Syntax.STMT_for:
			return apply(state, (Control.For) stmt);
		case Syntax.STMT_return:
			return apply(state, (Control.Return) stmt);
		case Syntax.STMT_fndecl:
			return apply(state, (Control.FunctionDecl) stmt);
		case Syntax.STMT_call:
			return apply(state, (Control.Call) stmt);
		case Syntax.STMT_print:
			return apply(state, (Control.Print) stmt);
		case Syntax.STMT_reverse:
			return apply(state, (Syntax.ReverseBlock) stmt);
		}
		throw new IllegalArgumentException("Invalid statement encountered: " + stmt);
	}

	public V apply(S state, Expr expr) {
		switch (expr.getOpcode()) {
		case Syntax.EXPR_data:
			return apply(state, ((Expr.Pure) expr).data());
		case Syntax.EXPR_arithmetic:
			return apply(state, (Expr.Arithmetic) expr);
		case Syntax.EXPR_invoke:
			return apply(state, (Expr.Invoke) expr);
		}
		throw new IllegalArgumentException("Invalid expression encountered: " + expr);
	}

	public V apply(S state, Data data) {
		switch (data.getOpcode()) {
		case Syntax.DATA_literal:
			return apply(state, (Data.Literal) data);
		case Syntax.DATA_identifier:
			return apply(state, (Data.Identifier) data);
		case Syntax.DATA_add:
			return apply(state, (Data.Add) data);
		case Syntax.DATA_purecall:
			return apply(state, (Data.PureCall) data);
		}
		throw new IllegalArgumentException("Invalid data expression encountered: " + data);
	}

	/**
	 * Apply this transformer to a statement of a reverse block.
	 *
	 * @param state The current state (e.g. checking scope or runtime store)
	 * @param stmt  The statement being transformed.
	 * @return
	 */
	public T apply(S state, Reversible stmt) {
		switch (stmt.getOpcode()) {
		case Syntax.REV_increment:
			return apply(state, (Reversible.Increment) stmt);
		case Syntax.REV_conditional:
			return apply(state, (Reversible.Conditional) stmt);
		}
		throw new IllegalArgumentException("Invalid reversible statement encountered: " + stmt);
	}

	protected abstract T apply(S state, Control.Assignment stmt);

	protected abstract T apply(S state, Control.If stmt);

	protected abstract T apply(S state, Control.While stmt);

	protected abstract T apply(S state, Control.For stmt);

	protected abstract T apply(S state, Control.Return stmt);

	protected abstract T apply(S state, Control.FunctionDecl stmt);

	protected abstract T apply(S state, Control.Call stmt);

	protected abstract T apply(S state, Control.Print stmt);

	protected abstract T apply(S state, Syntax.ReverseBlock stmt);

	protected abstract T apply(S state, Reversible.Increment stmt);

	protected abstract T apply(S state, Reversible.Conditional stmt);

	protected abstract V apply(S state, Expr.Arithmetic expr);

	protected abstract V apply(S state, Expr.Invoke expr);

	protected abstract V apply(S state, Data.Literal expr);

	protected abstract V apply(S state, Data.Identifier expr);

	protected abstract V apply(S state, Data.Add expr);

	protected abstract V apply(S state, Data.PureCall expr);
}
