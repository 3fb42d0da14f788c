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
 * The base class of all errors raised whilst a program is running. A runtime
 * error aborts the current run and is surfaced to the caller unchanged; it is
 * never replaced by a default value.
 *
 * @author David J. Pearce
 *
 */
public abstract class RuntimeError extends RuntimeException {

	public enum Kind {
		UNDEFINED_REFERENCE,
		OVERFLOW,
		DIVISION_BY_ZERO,
		TYPE_MISMATCH,
		INCOMPARABLE,
		NON_REVERSIBLE_OPERATION,
		RESOURCE_EXHAUSTED
	}

	private final Kind kind;
	private int start = -1;
	private int end = -1;
	private int line = -1;

	protected RuntimeError(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Get the (one-based) line of the construct being evaluated when this error
	 * arose, or <code>-1</code> if unknown.
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

	/**
	 * Attach the location of a given element to this error, unless a more
	 * specific location has already been attached.
	 *
	 * @param element
	 * @return
	 */
	public RuntimeError at(SyntacticElement element) {
		Attribute.Source src = element == null ? null : element.attribute(Attribute.Source.class);
		if (line < 0 && src != null) {
			this.start = src.start;
			this.end = src.end;
			this.line = src.line;
		}
		return this;
	}

	@Override
	public String toString() {
		String loc = line < 0 ? "" : " (line " + line + ")";
		return getClass().getSimpleName() + loc + ": " + getMessage();
	}

	/**
	 * A variable was read before it was bound, or a function was named which does
	 * not exist.
	 */
	public static class UndefinedReference extends RuntimeError {
		private final String name;

		public UndefinedReference(String name) {
			super(Kind.UNDEFINED_REFERENCE, "undefined reference: " + name);
			this.name = name;
		}

		public String name() {
			return name;
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * An exact arithmetic operation exceeded its representable range.
	 */
	public static class OverflowError extends RuntimeError {
		public OverflowError(String message) {
			super(Kind.OVERFLOW, message);
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * A division (which only exists in the Control language) with a zero divisor.
	 */
	public static class DivisionByZero extends RuntimeError {
		public DivisionByZero() {
			super(Kind.DIVISION_BY_ZERO, "division by zero");
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * Operands of incompatible kinds, or a symbolic value used where a concrete
	 * value is required.
	 */
	public static class TypeMismatch extends RuntimeError {
		public TypeMismatch(String message) {
			super(Kind.TYPE_MISMATCH, message);
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * Two values which have no defined ordering were compared.
	 */
	public static class Incomparable extends RuntimeError {
		public Incomparable(String message) {
			super(Kind.INCOMPARABLE, message);
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * A reverse block contained something other than reversible increments,
	 * decrements and conditionals, or a rollback had nothing to undo.
	 */
	public static class NonReversibleOperationError extends RuntimeError {
		public NonReversibleOperationError(String message) {
			super(Kind.NON_REVERSIBLE_OPERATION, message);
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * The externally supplied step, time or call depth budget was exhausted.
	 */
	public static class ResourceExhausted extends RuntimeError {
		public ResourceExhausted(String message) {
			super(Kind.RESOURCE_EXHAUSTED, message);
		}

		public static final long serialVersionUID = 1l;
	}

	public static final long serialVersionUID = 1l;
}
