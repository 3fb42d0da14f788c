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

import juliatheviper.util.SyntacticElement.Attribute;

/**
 * A diagnostic produced by a static or dynamic check of a program. Fatal
 * diagnostics block execution; warnings are reported alongside a result.
 *
 * @author David J. Pearce
 *
 */
public final class Diagnostic {

	public enum Kind {
		/**
		 * A <code>@pure</code> function which cannot be shown to terminate (it
		 * contains a loop, or is part of a call cycle).
		 */
		TOTALITY_VIOLATION(true),
		/**
		 * A <code>@pure</code> function with an observable effect beyond its own
		 * frame (I/O, impure calls or reads of outer variables).
		 */
		PURITY_VIOLATION(true),
		/**
		 * A reverse block mutated a variable whose kind is not exactly invertible.
		 */
		DEGRADED_REVERSIBILITY(false);

		private final boolean fatal;

		private Kind(boolean fatal) {
			this.fatal = fatal;
		}

		public boolean isFatal() {
			return fatal;
		}
	}

	private final Kind kind;
	private final String message;
	private final String construct;
	private final int line;
	private final int start;
	private final int end;

	public Diagnostic(Kind kind, String message, String construct, SyntacticElement element) {
		Attribute.Source src = element == null ? null : element.attribute(Attribute.Source.class);
		this.kind = kind;
		this.message = message;
		this.construct = construct;
		this.line = src == null ? -1 : src.line;
		this.start = src == null ? -1 : src.start;
		this.end = src == null ? -1 : src.end;
	}

	public Kind kind() {
		return kind;
	}

	public boolean isFatal() {
		return kind.isFatal();
	}

	public String message() {
		return message;
	}

	/**
	 * The name of the offending construct (e.g. <code>for</code>, or the name of
	 * a function).
	 *
	 * @return
	 */
	public String construct() {
		return construct;
	}

	/**
	 * The (one-based) source line of the offending construct.
	 *
	 * @return
	 */
	public int line() {
		return line;
	}

	public int start() {
		return start;
	}

	public int end() {
		return end;
	}

	@Override
	public String toString() {
		return kind + " (line " + line + "): " + message;
	}
}
