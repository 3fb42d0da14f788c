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

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a program is submitted for execution whilst the totality and
 * purity checker reports one or more fatal diagnostics.
 *
 * @author David J. Pearce
 *
 */
public class CheckError extends RuntimeException {
	private final List<Diagnostic> diagnostics;

	public CheckError(List<Diagnostic> diagnostics) {
		super(summarise(diagnostics));
		this.diagnostics = Collections.unmodifiableList(diagnostics);
	}

	/**
	 * The fatal diagnostics which prevented execution.
	 *
	 * @return
	 */
	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}

	private static String summarise(List<Diagnostic> diagnostics) {
		if (diagnostics.size() == 1) {
			return diagnostics.get(0).toString();
		}
		return diagnostics.size() + " fatal diagnostics, first: " + diagnostics.get(0);
	}

	public static final long serialVersionUID = 1l;
}
