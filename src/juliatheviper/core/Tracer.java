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

import juliatheviper.core.Syntax.Control;
import juliatheviper.core.Syntax.FunctionDef;
import juliatheviper.core.Syntax.ReverseBlock;

/**
 * Receives events from an interpreter session as it executes. Tracing is
 * purely observational and has no effect on the outcome of a run.
 *
 * @author David J. Pearce
 *
 */
public interface Tracer {

	public static final Tracer NONE = new Tracer() {
	};

	public default void statement(Control stmt, Environment frame) {
	}

	public default void enter(FunctionDef function, Environment frame) {
	}

	public default void exit(FunctionDef function, NumericValue result) {
	}

	/**
	 * A reverse block was applied in a given direction.
	 *
	 * @param block
	 * @param forward <code>true</code> for forward execution,
	 *                <code>false</code> for rollback.
	 */
	public default void reverse(ReverseBlock block, boolean forward) {
	}
}
