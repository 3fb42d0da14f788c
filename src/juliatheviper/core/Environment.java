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
import java.util.Map;

import juliatheviper.util.RuntimeError;

/**
 * A single frame of variable bindings. Each function invocation executes in a
 * fresh frame whose only parent is the global frame, so callee code never sees
 * the locals of its caller. Assignments always bind in the frame they execute
 * in.
 *
 * @author David J. Pearce
 *
 */
public class Environment {
	private final Environment global;
	private final LinkedHashMap<String, NumericValue> bindings;

	/**
	 * Construct a new global frame.
	 */
	public Environment() {
		this(null);
	}

	private Environment(Environment global) {
		this.global = global;
		this.bindings = new LinkedHashMap<>();
	}

	/**
	 * Create a fresh frame for a function invocation.
	 *
	 * @return
	 */
	public Environment push() {
		return new Environment(global == null ? this : global);
	}

	public boolean isGlobal() {
		return global == null;
	}

	/**
	 * Read the value of a given variable, falling back to the global frame when
	 * it is not bound locally.
	 *
	 * @param name
	 * @return
	 */
	public NumericValue read(String name) {
		NumericValue v = bindings.get(name);
		if (v == null && global != null) {
			v = global.bindings.get(name);
		}
		if (v == null) {
			throw new RuntimeError.UndefinedReference(name);
		}
		return v;
	}

	/**
	 * Determine whether a given variable is bound in this frame, ignoring the
	 * global frame.
	 *
	 * @param name
	 * @return
	 */
	public boolean isBound(String name) {
		return bindings.containsKey(name);
	}

	public void bind(String name, NumericValue value) {
		bindings.put(name, value);
	}

	/**
	 * Get the bindings of this frame, in the order they were first made.
	 *
	 * @return
	 */
	public Map<String, NumericValue> bindings() {
		return Collections.unmodifiableMap(bindings);
	}

	@Override
	public String toString() {
		return bindings.toString();
	}
}
