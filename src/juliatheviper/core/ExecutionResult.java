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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import juliatheviper.util.Diagnostic;

/**
 * The outcome of a successful run: the final global bindings, the lines
 * printed, the number of steps taken and any warnings raised on the way.
 *
 * @author David J. Pearce
 *
 */
public final class ExecutionResult {
	private final Map<String, NumericValue> variables;
	private final List<String> output;
	private final long steps;
	private final List<Diagnostic> warnings;

	public ExecutionResult(Map<String, NumericValue> variables, List<String> output, long steps,
			List<Diagnostic> warnings) {
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
		this.output = Collections.unmodifiableList(output);
		this.steps = steps;
		this.warnings = Collections.unmodifiableList(warnings);
	}

	/**
	 * The global variables, in the order they were first assigned.
	 *
	 * @return
	 */
	public Map<String, NumericValue> variables() {
		return variables;
	}

	public NumericValue get(String variable) {
		return variables.get(variable);
	}

	public List<String> output() {
		return output;
	}

	public long steps() {
		return steps;
	}

	public List<Diagnostic> warnings() {
		return warnings;
	}

	@Override
	public String toString() {
		return variables.toString();
	}
}
