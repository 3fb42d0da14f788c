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

import java.math.BigInteger;

import juliatheviper.util.RuntimeError;

/**
 * An immutable number in one of seven representations. Operations never mutate
 * their operands; every arithmetic operation produces a fresh value whose kind
 * is fixed by the promotion lattice:
 *
 * <pre>
 * Int --> Float ---\
 *   \              +--> Complex --> Symbolic
 *    --> Rational -/
 * </pre>
 *
 * <code>Hex</code> and <code>Binary</code> are integers with a different
 * display radix. Any operation involving a <code>Symbolic</code> operand
 * produces a symbolic expression tree.
 *
 * @author David J. Pearce
 *
 */
public abstract class NumericValue {

	public enum Kind {
		INT("Int"), FLOAT("Float"), RATIONAL("Rational"), COMPLEX("Complex"), HEX("Hex"), BINARY("Binary"),
		SYMBOLIC("Symbolic");

		private final String label;

		private Kind(String label) {
			this.label = label;
		}

		/**
		 * Determine whether values of this kind are integers.
		 *
		 * @return
		 */
		public boolean isInteger() {
			return this == INT || this == HEX || this == BINARY;
		}

		/**
		 * Get the name of this kind as written in type annotations.
		 *
		 * @return
		 */
		public String label() {
			return label;
		}

		/**
		 * Look up a kind from its annotation name, returning <code>null</code> if
		 * there is no such kind.
		 *
		 * @param label
		 * @return
		 */
		public static Kind fromLabel(String label) {
			for (Kind k : values()) {
				if (k.label.equals(label)) {
					return k;
				}
			}
			return null;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	/**
	 * Display radix of an integer value.
	 */
	public enum Radix {
		DECIMAL, HEX, BINARY
	}

	public static final Int ZERO = new Int(0);

	public abstract Kind kind();

	// ================================================================================
	// Arithmetic
	// ================================================================================

	public NumericValue add(NumericValue rhs) {
		return apply(Operator.ADD, this, rhs);
	}

	public NumericValue subtract(NumericValue rhs) {
		return apply(Operator.SUB, this, rhs);
	}

	public NumericValue multiply(NumericValue rhs) {
		return apply(Operator.MUL, this, rhs);
	}

	public NumericValue divide(NumericValue rhs) {
		return apply(Operator.DIV, this, rhs);
	}

	public NumericValue negate() {
		return ZERO.withRadix(radixOf(this)).subtract(this);
	}

	/**
	 * The four arithmetic operators. Only <code>ADD</code> is available in Data
	 * position; the others exist for the Control language and reverse blocks.
	 */
	public enum Operator {
		ADD("+"), SUB("-"), MUL("*"), DIV("/");

		private final String symbol;

		private Operator(String symbol) {
			this.symbol = symbol;
		}

		public String symbol() {
			return symbol;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	/**
	 * Apply a given operator to two operands, promoting both to their join in the
	 * lattice first.
	 *
	 * @param op
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static NumericValue apply(Operator op, NumericValue lhs, NumericValue rhs) {
		Kind join = join(lhs.kind(), rhs.kind());
		switch (join) {
		case SYMBOLIC:
			return new Symbolic(new Symbolic.Binary(op, Symbolic.lift(lhs), Symbolic.lift(rhs)));
		case COMPLEX:
			return ((Complex) promote(lhs, join)).apply(op, (Complex) promote(rhs, join));
		case FLOAT:
			return ((Float) promote(lhs, join)).apply(op, (Float) promote(rhs, join));
		case RATIONAL:
			return ((Rational) promote(lhs, join)).apply(op, (Rational) promote(rhs, join));
		default:
			return ((Int) lhs).apply(op, (Int) rhs);
		}
	}

	/**
	 * Determine the least upper bound of two kinds in the promotion lattice.
	 *
	 * @param l
	 * @param r
	 * @return
	 */
	public static Kind join(Kind l, Kind r) {
		if (l == Kind.SYMBOLIC || r == Kind.SYMBOLIC) {
			return Kind.SYMBOLIC;
		} else if (l == Kind.COMPLEX || r == Kind.COMPLEX) {
			return Kind.COMPLEX;
		} else if ((l == Kind.FLOAT && r == Kind.RATIONAL) || (l == Kind.RATIONAL && r == Kind.FLOAT)) {
			return Kind.COMPLEX;
		} else if (l == Kind.FLOAT || r == Kind.FLOAT) {
			return Kind.FLOAT;
		} else if (l == Kind.RATIONAL || r == Kind.RATIONAL) {
			return Kind.RATIONAL;
		} else {
			return Kind.INT;
		}
	}

	/**
	 * Promote a value upwards through the lattice to a given kind.
	 *
	 * @param v
	 * @param target
	 * @return
	 */
	public static NumericValue promote(NumericValue v, Kind target) {
		Kind from = v.kind();
		if (from == target || (from.isInteger() && target.isInteger())) {
			return target.isInteger() && from != target ? ((Int) v).withRadix(radixOf(target)) : v;
		} else if (target == Kind.SYMBOLIC) {
			return new Symbolic(Symbolic.lift(v));
		} else if (from.isInteger()) {
			long n = ((Int) v).value;
			switch (target) {
			case FLOAT:
				return new Float(n);
			case RATIONAL:
				return new Rational(n, 1);
			case COMPLEX:
				return new Complex(n, 0);
			default:
				break;
			}
		} else if (target == Kind.COMPLEX) {
			if (from == Kind.FLOAT) {
				return new Complex(((Float) v).value, 0);
			} else if (from == Kind.RATIONAL) {
				return new Complex(((Rational) v).doubleValue(), 0);
			}
		}
		throw new RuntimeError.TypeMismatch("cannot promote " + from + " to " + target);
	}

	/**
	 * Coerce a value to a declared kind (e.g. of a parameter). This succeeds when
	 * the declared kind lies at or above the value's kind in the lattice.
	 *
	 * @param target
	 * @return
	 */
	public NumericValue coerce(Kind target) {
		Kind from = kind();
		if (from == target) {
			return this;
		} else if (from.isInteger() && target.isInteger()) {
			return ((Int) this).withRadix(radixOf(target));
		} else if (join(from, target) == target) {
			return promote(this, target);
		}
		throw new RuntimeError.TypeMismatch("expected " + target + ", found " + from + " (" + this + ")");
	}

	/**
	 * Convert this value back down to a given kind where that is lossless (e.g.
	 * <code>5/1</code> to <code>5</code>). Otherwise, this value is returned
	 * unchanged.
	 *
	 * @param target
	 * @return
	 */
	public NumericValue narrow(Kind target) {
		if (kind() == target) {
			return this;
		} else if (target.isInteger()) {
			if (this instanceof Int) {
				return ((Int) this).withRadix(radixOf(target));
			} else if (this instanceof Rational && ((Rational) this).denominator == 1) {
				return new Int(((Rational) this).numerator, radixOf(target));
			}
		} else if (target == Kind.RATIONAL && this instanceof Int) {
			return new Rational(((Int) this).value, 1);
		} else if (target == Kind.FLOAT && this instanceof Complex && ((Complex) this).imaginary == 0) {
			return new Float(((Complex) this).real);
		}
		return this;
	}

	// ================================================================================
	// Comparison
	// ================================================================================

	/**
	 * Determine whether two values are numerically equal, after promotion. Two
	 * symbolic values are equal only when structurally identical; comparing
	 * distinct symbolic values, or a symbolic value with a concrete one, is an
	 * error.
	 *
	 * @param rhs
	 * @return
	 */
	public boolean equalTo(NumericValue rhs) {
		Kind join = join(kind(), rhs.kind());
		if (join == Kind.SYMBOLIC) {
			return compareSymbolic(this, rhs) == 0;
		} else if (join == Kind.COMPLEX) {
			Complex l = (Complex) promote(this, join);
			Complex r = (Complex) promote(rhs, join);
			return l.real == r.real && l.imaginary == r.imaginary;
		}
		return compare(rhs) == 0;
	}

	/**
	 * Compare two values under the ordering of their join. Complex values are only
	 * ordered when both have a zero imaginary part.
	 *
	 * @param rhs
	 * @return negative, zero or positive integer
	 */
	public int compare(NumericValue rhs) {
		Kind join = join(kind(), rhs.kind());
		NumericValue l = promote(this, join);
		NumericValue r = promote(rhs, join);
		switch (join) {
		case SYMBOLIC:
			return compareSymbolic(this, rhs);
		case COMPLEX: {
			Complex cl = (Complex) l;
			Complex cr = (Complex) r;
			if (cl.imaginary != 0 || cr.imaginary != 0) {
				throw new RuntimeError.TypeMismatch("complex numbers are not ordered: " + this + ", " + rhs);
			}
			return compare(cl.real, cr.real);
		}
		case FLOAT:
			return compare(((Float) l).value, ((Float) r).value);
		case RATIONAL: {
			Rational rl = (Rational) l;
			Rational rr = (Rational) r;
			BigInteger lhs = BigInteger.valueOf(rl.numerator).multiply(BigInteger.valueOf(rr.denominator));
			BigInteger rhs2 = BigInteger.valueOf(rr.numerator).multiply(BigInteger.valueOf(rl.denominator));
			return lhs.compareTo(rhs2);
		}
		default:
			return Long.compare(((Int) l).value, ((Int) r).value);
		}
	}

	// Numeric ordering, so that -0.0 and 0.0 are equal
	private static int compare(double lhs, double rhs) {
		return lhs < rhs ? -1 : (lhs == rhs ? 0 : 1);
	}

	private static int compareSymbolic(NumericValue lhs, NumericValue rhs) {
		if (lhs instanceof Symbolic && rhs instanceof Symbolic && lhs.equals(rhs)) {
			return 0;
		}
		throw new RuntimeError.Incomparable("cannot compare " + lhs + " with " + rhs);
	}

	/**
	 * Extract the value of an integer, as required for loop bounds.
	 *
	 * @return
	 */
	public long longValue() {
		if (this instanceof Int) {
			return ((Int) this).value;
		} else if (this instanceof Symbolic) {
			throw new RuntimeError.TypeMismatch("concrete value required, found symbolic " + this);
		}
		throw new RuntimeError.TypeMismatch("integer required, found " + kind() + " (" + this + ")");
	}

	private static Radix radixOf(NumericValue v) {
		return v instanceof Int ? ((Int) v).radix : Radix.DECIMAL;
	}

	private static Radix radixOf(Kind k) {
		switch (k) {
		case HEX:
			return Radix.HEX;
		case BINARY:
			return Radix.BINARY;
		default:
			return Radix.DECIMAL;
		}
	}

	private static RuntimeError.OverflowError overflow(Operator op, Object lhs, Object rhs, ArithmeticException cause) {
		RuntimeError.OverflowError e = new RuntimeError.OverflowError(lhs + " " + op + " " + rhs + " overflows");
		e.initCause(cause);
		return e;
	}

	// ================================================================================
	// Representations
	// ================================================================================

	/**
	 * A 64-bit signed integer. Arithmetic is checked: results outside the
	 * representable range raise an overflow error rather than wrapping.
	 */
	public static final class Int extends NumericValue {
		private final long value;
		private final Radix radix;

		public Int(long value) {
			this(value, Radix.DECIMAL);
		}

		public Int(long value, Radix radix) {
			this.value = value;
			this.radix = radix;
		}

		public long value() {
			return value;
		}

		public Radix radix() {
			return radix;
		}

		public Int withRadix(Radix radix) {
			return radix == this.radix ? this : new Int(value, radix);
		}

		@Override
		public Kind kind() {
			switch (radix) {
			case HEX:
				return Kind.HEX;
			case BINARY:
				return Kind.BINARY;
			default:
				return Kind.INT;
			}
		}

		private NumericValue apply(Operator op, Int rhs) {
			try {
				switch (op) {
				case ADD:
					return new Int(Math.addExact(value, rhs.value), radix);
				case SUB:
					return new Int(Math.subtractExact(value, rhs.value), radix);
				case MUL:
					return new Int(Math.multiplyExact(value, rhs.value), radix);
				default:
					if (rhs.value == 0) {
						throw new RuntimeError.DivisionByZero();
					}
					NumericValue r = Rational.of(value, rhs.value);
					return r instanceof Int ? ((Int) r).withRadix(radix) : r;
				}
			} catch (ArithmeticException e) {
				throw overflow(op, this, rhs, e);
			}
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Int && ((Int) o).value == value;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(value);
		}

		@Override
		public String toString() {
			switch (radix) {
			case HEX:
				return (value < 0 ? "-0x" : "0x") + Long.toHexString(Math.abs(value));
			case BINARY:
				return (value < 0 ? "-0b" : "0b") + Long.toBinaryString(Math.abs(value));
			default:
				return Long.toString(value);
			}
		}
	}

	/**
	 * A 64-bit IEEE floating point number.
	 */
	public static final class Float extends NumericValue {
		private final double value;

		public Float(double value) {
			this.value = value;
		}

		public double value() {
			return value;
		}

		@Override
		public Kind kind() {
			return Kind.FLOAT;
		}

		private NumericValue apply(Operator op, Float rhs) {
			double r;
			switch (op) {
			case ADD:
				r = value + rhs.value;
				break;
			case SUB:
				r = value - rhs.value;
				break;
			case MUL:
				r = value * rhs.value;
				break;
			default:
				if (rhs.value == 0) {
					throw new RuntimeError.DivisionByZero();
				}
				r = value / rhs.value;
			}
			return new Float(checkFinite(r, op, this, rhs));
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Float && Double.compare(((Float) o).value, value) == 0;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(value);
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}

	/**
	 * An exact fraction, always held in lowest terms with a positive denominator.
	 */
	public static final class Rational extends NumericValue {
		private final long numerator;
		private final long denominator;

		public Rational(long numerator, long denominator) {
			if (denominator == 0) {
				throw new RuntimeError.DivisionByZero();
			}
			try {
				if (denominator < 0) {
					numerator = Math.negateExact(numerator);
					denominator = Math.negateExact(denominator);
				}
			} catch (ArithmeticException e) {
				throw overflow(Operator.DIV, numerator, denominator, e);
			}
			long g = gcd(numerator, denominator);
			this.numerator = numerator / g;
			this.denominator = denominator / g;
		}

		/**
		 * Construct a rational number, demoting it to an integer when the
		 * denominator reduces to one.
		 *
		 * @param numerator
		 * @param denominator
		 * @return
		 */
		public static NumericValue of(long numerator, long denominator) {
			Rational r = new Rational(numerator, denominator);
			return r.denominator == 1 ? new Int(r.numerator) : r;
		}

		public long numerator() {
			return numerator;
		}

		public long denominator() {
			return denominator;
		}

		public double doubleValue() {
			return (double) numerator / (double) denominator;
		}

		@Override
		public Kind kind() {
			return Kind.RATIONAL;
		}

		private NumericValue apply(Operator op, Rational rhs) {
			try {
				switch (op) {
				case ADD:
					return of(Math.addExact(Math.multiplyExact(numerator, rhs.denominator),
							Math.multiplyExact(rhs.numerator, denominator)),
							Math.multiplyExact(denominator, rhs.denominator));
				case SUB:
					return of(Math.subtractExact(Math.multiplyExact(numerator, rhs.denominator),
							Math.multiplyExact(rhs.numerator, denominator)),
							Math.multiplyExact(denominator, rhs.denominator));
				case MUL:
					return of(Math.multiplyExact(numerator, rhs.numerator),
							Math.multiplyExact(denominator, rhs.denominator));
				default:
					if (rhs.numerator == 0) {
						throw new RuntimeError.DivisionByZero();
					}
					return of(Math.multiplyExact(numerator, rhs.denominator),
							Math.multiplyExact(denominator, rhs.numerator));
				}
			} catch (ArithmeticException e) {
				throw overflow(op, this, rhs, e);
			}
		}

		/**
		 * Greatest common divisor of two values, where the second is positive. The
		 * result is always positive, even for <code>Long.MIN_VALUE</code>.
		 */
		private static long gcd(long a, long b) {
			return BigInteger.valueOf(a).gcd(BigInteger.valueOf(b)).longValueExact();
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Rational) {
				Rational r = (Rational) o;
				return r.numerator == numerator && r.denominator == denominator;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(numerator) * 31 + Long.hashCode(denominator);
		}

		@Override
		public String toString() {
			return numerator + "/" + denominator;
		}
	}

	/**
	 * A complex number with floating point components.
	 */
	public static final class Complex extends NumericValue {
		private final double real;
		private final double imaginary;

		public Complex(double real, double imaginary) {
			this.real = real;
			this.imaginary = imaginary;
		}

		public double real() {
			return real;
		}

		public double imaginary() {
			return imaginary;
		}

		@Override
		public Kind kind() {
			return Kind.COMPLEX;
		}

		private NumericValue apply(Operator op, Complex rhs) {
			double re;
			double im;
			switch (op) {
			case ADD:
				re = real + rhs.real;
				im = imaginary + rhs.imaginary;
				break;
			case SUB:
				re = real - rhs.real;
				im = imaginary - rhs.imaginary;
				break;
			case MUL:
				re = real * rhs.real - imaginary * rhs.imaginary;
				im = real * rhs.imaginary + imaginary * rhs.real;
				break;
			default: {
				double d = rhs.real * rhs.real + rhs.imaginary * rhs.imaginary;
				if (d == 0) {
					throw new RuntimeError.DivisionByZero();
				}
				re = (real * rhs.real + imaginary * rhs.imaginary) / d;
				im = (imaginary * rhs.real - real * rhs.imaginary) / d;
			}
			}
			return new Complex(checkFinite(re, op, this, rhs), checkFinite(im, op, this, rhs));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Complex) {
				Complex c = (Complex) o;
				return Double.compare(c.real, real) == 0 && Double.compare(c.imaginary, imaginary) == 0;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(real) * 31 + Double.hashCode(imaginary);
		}

		@Override
		public String toString() {
			String sign = imaginary < 0 ? "-" : "+";
			return compact(real) + sign + compact(Math.abs(imaginary)) + "i";
		}

		private static String compact(double d) {
			if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
				return Long.toString((long) d);
			}
			return Double.toString(d);
		}
	}

	/**
	 * An opaque symbolic expression. Symbolic arithmetic only builds expression
	 * trees, and no algebraic simplification is ever applied.
	 */
	public static final class Symbolic extends NumericValue {
		private final Node expression;

		public Symbolic(String atom) {
			this(new Atom(atom));
		}

		public Symbolic(Node expression) {
			this.expression = expression;
		}

		public Node expression() {
			return expression;
		}

		@Override
		public Kind kind() {
			return Kind.SYMBOLIC;
		}

		private static Node lift(NumericValue v) {
			if (v instanceof Symbolic) {
				return ((Symbolic) v).expression;
			}
			return new Constant(v);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Symbolic && ((Symbolic) o).expression.equals(expression);
		}

		@Override
		public int hashCode() {
			return expression.hashCode();
		}

		@Override
		public String toString() {
			return expression.toString();
		}

		/**
		 * A node in a symbolic expression tree.
		 */
		public interface Node {
		}

		/**
		 * A named unknown, written <code>'x</code> in source.
		 */
		public static final class Atom implements Node {
			private final String name;

			public Atom(String name) {
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Atom && ((Atom) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return "'" + name;
			}
		}

		/**
		 * A concrete value embedded in a symbolic expression.
		 */
		public static final class Constant implements Node {
			private final NumericValue value;

			public Constant(NumericValue value) {
				this.value = value;
			}

			public NumericValue value() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Constant && ((Constant) o).value.equals(value);
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		/**
		 * A sum, difference, product or quotient of two symbolic subexpressions.
		 */
		public static final class Binary implements Node {
			private final Operator operator;
			private final Node lhs;
			private final Node rhs;

			public Binary(Operator operator, Node lhs, Node rhs) {
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Operator operator() {
				return operator;
			}

			public Node leftOperand() {
				return lhs;
			}

			public Node rightOperand() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Binary) {
					Binary b = (Binary) o;
					return b.operator == operator && b.lhs.equals(lhs) && b.rhs.equals(rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return (operator.hashCode() * 31 + lhs.hashCode()) * 31 + rhs.hashCode();
			}

			@Override
			public String toString() {
				return "(" + lhs + " " + operator + " " + rhs + ")";
			}
		}
	}

	private static double checkFinite(double r, Operator op, NumericValue lhs, NumericValue rhs) {
		if (Double.isNaN(r)) {
			throw new RuntimeError.TypeMismatch(lhs + " " + op + " " + rhs + " is not a number");
		} else if (Double.isInfinite(r)) {
			throw new RuntimeError.OverflowError(lhs + " " + op + " " + rhs + " overflows");
		}
		return r;
	}
}
