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

import java.io.PrintStream;


/**
 * This exception is thrown when a program is rejected before execution begins.
 * It identifies the offending region of the source text by its (inclusive)
 * character offsets.
 *
 * @author David J. Pearce
 */
public class SyntaxError extends RuntimeException {

	private final String msg;
	private final String filename;
	private final String source;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in a file.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param filename
	 *            The name of the source file this error is referring to.
	 * @param source
	 *            The program source this error is referring to.
	 * @param start
	 *            Offset of first character of offending location.
	 * @param end
	 *            Offset of last character of offending location.
	 */
	public SyntaxError(String msg, String filename, String source, int start, int end) {
		super(msg);
		this.msg = msg;
		this.filename = filename;
		this.source = source;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		if (msg != null) {
			return msg;
		} else {
			return "";
		}
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * Filename for file where the error arose (may be <code>null</code>).
	 *
	 * @return
	 */
	public String filename() {
		return filename;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Determine the (one-based) line containing the start of the offending
	 * location.
	 *
	 * @return
	 */
	public int line() {
		if (source == null || start < 0) {
			return -1;
		}
		int line = 1;
		for (int i = 0; i < start && i < source.length(); ++i) {
			if (source.charAt(i) == '\n') {
				line = line + 1;
			}
		}
		return line;
	}

	/**
	 * Output the syntax error to a given output stream, underlining the offending
	 * region of the source line.
	 */
	public void outputSourceError(PrintStream output) {
		String prefix = filename == null ? "" : filename + ":";
		if (source == null || start < 0) {
			output.println(prefix + "error: " + getMessage());
			return;
		}
		int lineStart = start;
		while (lineStart > 0 && lineStart <= source.length() && source.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = Math.min(start, source.length());
		while (lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		output.println(prefix + line() + ": " + getMessage());
		output.println(source.substring(Math.min(lineStart, lineEnd), lineEnd));
		StringBuilder str = new StringBuilder();
		for (int i = lineStart; i < start; ++i) {
			str.append(source.charAt(i) == '\t' ? '\t' : ' ');
		}
		for (int i = start; i <= Math.min(end, lineEnd - 1); ++i) {
			str.append('^');
		}
		output.println(str);
	}

	public static final long serialVersionUID = 1l;
}
