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

import java.util.ArrayList;
import java.util.List;

import juliatheviper.core.Syntax.ReverseBlock;

/**
 * Records the exact deltas applied by one forward execution of a reverse
 * block, in the order they were applied.
 *
 * @author David J. Pearce
 *
 */
public final class ReversalLog {
	private final ReverseBlock block;
	private final List<Entry> entries = new ArrayList<>();

	public ReversalLog(ReverseBlock block) {
		this.block = block;
	}

	public ReverseBlock block() {
		return block;
	}

	public void record(Environment frame, String variable, NumericValue delta, NumericValue.Kind prior) {
		entries.add(new Entry(frame, variable, delta, prior));
	}

	public int size() {
		return entries.size();
	}

	public Entry get(int i) {
		return entries.get(i);
	}

	@Override
	public String toString() {
		return entries.toString();
	}

	/**
	 * A single increment (or decrement) of a variable. The delta is signed, so
	 * a decrement of <code>d</code> is recorded as <code>-d</code>.
	 */
	public static final class Entry {
		private final Environment frame;
		private final String variable;
		private final NumericValue delta;
		private final NumericValue.Kind prior;

		private Entry(Environment frame, String variable, NumericValue delta, NumericValue.Kind prior) {
			this.frame = frame;
			this.variable = variable;
			this.delta = delta;
			this.prior = prior;
		}

		public Environment frame() {
			return frame;
		}

		public String variable() {
			return variable;
		}

		public NumericValue delta() {
			return delta;
		}

		/**
		 * The kind of the variable before the delta was applied.
		 *
		 * @return
		 */
		public NumericValue.Kind prior() {
			return prior;
		}

		@Override
		public String toString() {
			return variable + (delta.toString().startsWith("-") ? " " : " +") + delta;
		}
	}
}
