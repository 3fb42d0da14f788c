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

import java.util.Properties;

/**
 * Bounds the resources available to a single run of the interpreter. Since
 * the Control language is Turing-complete, a host running untrusted code must
 * be able to abort a runaway loop or recursion.
 *
 * @author David J. Pearce
 *
 */
public final class Budget {
	public static final String MAX_STEPS = "jtv.maxSteps";
	public static final String TIMEOUT_MILLIS = "jtv.timeoutMillis";
	public static final String MAX_CALL_DEPTH = "jtv.maxCallDepth";

	public static final int DEFAULT_CALL_DEPTH = 512;

	/**
	 * No limit on steps or time. The call depth is still bounded to avoid
	 * exhausting the Java stack.
	 */
	public static final Budget UNLIMITED = new Budget(Long.MAX_VALUE, Long.MAX_VALUE, DEFAULT_CALL_DEPTH);

	private final long maxSteps;
	private final long timeoutMillis;
	private final int maxCallDepth;

	private Budget(long maxSteps, long timeoutMillis, int maxCallDepth) {
		this.maxSteps = maxSteps;
		this.timeoutMillis = timeoutMillis;
		this.maxCallDepth = maxCallDepth;
	}

	public long maxSteps() {
		return maxSteps;
	}

	public long timeoutMillis() {
		return timeoutMillis;
	}

	public int maxCallDepth() {
		return maxCallDepth;
	}

	@Override
	public String toString() {
		return "{steps=" + maxSteps + ", timeout=" + timeoutMillis + "ms, depth=" + maxCallDepth + "}";
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Read a budget from a set of properties. Missing properties are unlimited,
	 * except for the call depth.
	 *
	 * @param properties
	 * @return
	 */
	public static Budget fromProperties(Properties properties) {
		Builder b = new Builder();
		String steps = properties.getProperty(MAX_STEPS);
		String timeout = properties.getProperty(TIMEOUT_MILLIS);
		String depth = properties.getProperty(MAX_CALL_DEPTH);
		try {
			if (steps != null) {
				b.maxSteps(Long.parseLong(steps.trim()));
			}
			if (timeout != null) {
				b.timeoutMillis(Long.parseLong(timeout.trim()));
			}
			if (depth != null) {
				b.maxCallDepth(Integer.parseInt(depth.trim()));
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("invalid budget property: " + e.getMessage(), e);
		}
		return b.build();
	}

	public static final class Builder {
		private long maxSteps = Long.MAX_VALUE;
		private long timeoutMillis = Long.MAX_VALUE;
		private int maxCallDepth = DEFAULT_CALL_DEPTH;

		private Builder() {
		}

		public Builder maxSteps(long steps) {
			if (steps <= 0) {
				throw new IllegalArgumentException("step limit must be positive");
			}
			this.maxSteps = steps;
			return this;
		}

		public Builder timeoutMillis(long millis) {
			if (millis <= 0) {
				throw new IllegalArgumentException("timeout must be positive");
			}
			this.timeoutMillis = millis;
			return this;
		}

		public Builder maxCallDepth(int depth) {
			if (depth <= 0) {
				throw new IllegalArgumentException("call depth must be positive");
			}
			this.maxCallDepth = depth;
			return this;
		}

		public Budget build() {
			return new Budget(maxSteps, timeoutMillis, maxCallDepth);
		}
	}
}
