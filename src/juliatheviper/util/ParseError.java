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

/**
 * Raised by the parser when a token sequence has no derivation in the grammar.
 * This includes every attempt to cross the boundary between the Control and
 * Data languages, such as a statement in Data position or a call from Data
 * position to a function which is not declared <code>@pure</code>.
 *
 * @author David J. Pearce
 *
 */
public class ParseError extends SyntaxError {
	/**
	 * The identifier responsible for this error, if any.
	 */
	private final String identifier;

	public ParseError(String msg, String filename, String source, int start, int end) {
		this(msg, null, filename, source, start, end);
	}

	public ParseError(String msg, String identifier, String filename, String source, int start, int end) {
		super(msg, filename, source, start, end);
		this.identifier = identifier;
	}

	/**
	 * Get the offending identifier (e.g. the name of an impure function called
	 * from Data position), or <code>null</code> if none.
	 *
	 * @return
	 */
	public String identifier() {
		return identifier;
	}

	public static final long serialVersionUID = 1l;
}
