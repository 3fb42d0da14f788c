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
 * Raised by the lexer when the source text contains a character sequence which
 * does not form a token, such as a malformed numeric literal (e.g.
 * <code>0x</code> with no trailing digits) or a string literal.
 *
 * @author David J. Pearce
 *
 */
public class LexError extends SyntaxError {

	public LexError(String msg, String filename, String source, int offset) {
		super(msg, filename, source, offset, offset);
	}

	public LexError(String msg, String filename, String source, int start, int end) {
		super(msg, filename, source, start, end);
	}

	/**
	 * The offset of the first offending character.
	 *
	 * @return
	 */
	public int offset() {
		return start();
	}

	public static final long serialVersionUID = 1l;
}
