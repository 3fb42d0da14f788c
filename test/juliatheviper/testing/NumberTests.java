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

package juliatheviper.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import juliatheviper.core.NumericValue;
import juliatheviper.core.NumericValue.Complex;
import juliatheviper.core.NumericValue.Float;
import juliatheviper.core.NumericValue.Int;
import juliatheviper.core.NumericValue.Kind;
import juliatheviper.core.NumericValue.Radix;
import juliatheviper.core.NumericValue.Rational;
import juliatheviper.core.NumericValue.Symbolic;
import juliatheviper.util.RuntimeError;

/**
 * Test cases for the numeric tower, covering promotion between kinds, exact
 * arithmetic and the errors raised when arithmetic goes wrong.
 *
 * @author David J. Pearce
 *
 */
public class NumberTests {

	// ==============================================================
	// Exact arithmetic
	// ==============================================================

	@Test
	public void test_01() {
		NumericValue r = new Rational(1, 2).add(new Rational(1, 3));
		assertEquals(new Rational(5, 6), r);
		assertEquals("5/6", r.toString());
	}

	@Test
	public void test_02() {
		assertThrows(RuntimeError.OverflowError.class, () -> new Int(Long.MAX_VALUE).add(new Int(1)));
	}

	@Test
	public void test_03() {
		assertThrows(RuntimeError.OverflowError.class, () -> new Int(Long.MIN_VALUE).subtract(new Int(1)));
		assertThrows(RuntimeError.OverflowError.class, () -> new Int(Long.MAX_VALUE).multiply(new Int(2)));
		assertThrows(RuntimeError.OverflowError.class, () -> new Int(Long.MIN_VALUE).divide(new Int(-1)));
	}

	@Test
	public void test_04() {
		// Integer division is exact
		assertEquals(new Rational(1, 3), new Int(1).divide(new Int(3)));
		assertEquals(new Int(2), new Int(6).divide(new Int(3)));
		assertEquals(Kind.INT, new Int(6).divide(new Int(3)).kind());
	}

	@Test
	public void test_05() {
		// Results with a unit denominator are integers
		assertEquals(new Int(1), new Rational(1, 2).add(new Rational(1, 2)));
		assertEquals(new Int(5), Rational.of(10, 2));
		assertEquals(new Rational(-1, 2), new Rational(1, -2));
	}

	@Test
	public void test_06() {
		assertThrows(RuntimeError.OverflowError.class,
				() -> new Rational(Long.MAX_VALUE, 2).add(new Rational(Long.MAX_VALUE, 3)));
	}

	@Test
	public void test_07() {
		assertThrows(RuntimeError.DivisionByZero.class, () -> new Int(1).divide(NumericValue.ZERO));
		assertThrows(RuntimeError.DivisionByZero.class, () -> new Float(1.0).divide(new Float(0)));
		assertThrows(RuntimeError.DivisionByZero.class, () -> new Rational(1, 2).divide(NumericValue.ZERO));
		assertThrows(RuntimeError.DivisionByZero.class, () -> new Complex(1, 1).divide(new Complex(0, 0)));
	}

	@Test
	public void test_08() {
		assertThrows(RuntimeError.OverflowError.class,
				() -> new Float(Double.MAX_VALUE).multiply(new Float(2)));
		assertThrows(RuntimeError.TypeMismatch.class, () -> new Float(Double.POSITIVE_INFINITY)
				.subtract(new Float(Double.POSITIVE_INFINITY)));
	}

	@Test
	public void test_09() {
		// Long.MIN_VALUE has no positive counterpart
		NumericValue r = new Rational(Long.MIN_VALUE, 6);
		assertEquals(new Rational(Long.MIN_VALUE / 2, 3), r);
		assertEquals(3, ((Rational) r).denominator());
		assertTrue(r.compare(NumericValue.ZERO) < 0);
		assertEquals(new Int(Long.MIN_VALUE), Rational.of(Long.MIN_VALUE, 1));
		assertEquals("-4611686018427387904/3", r.toString());
	}

	// ==============================================================
	// Promotion
	// ==============================================================

	@Test
	public void test_10() {
		assertEquals(Kind.INT, NumericValue.join(Kind.INT, Kind.HEX));
		assertEquals(Kind.FLOAT, NumericValue.join(Kind.INT, Kind.FLOAT));
		assertEquals(Kind.RATIONAL, NumericValue.join(Kind.BINARY, Kind.RATIONAL));
		assertEquals(Kind.COMPLEX, NumericValue.join(Kind.FLOAT, Kind.RATIONAL));
		assertEquals(Kind.COMPLEX, NumericValue.join(Kind.COMPLEX, Kind.INT));
		assertEquals(Kind.SYMBOLIC, NumericValue.join(Kind.COMPLEX, Kind.SYMBOLIC));
	}

	@Test
	public void test_11() {
		assertEquals(new Float(3.5), new Int(3).add(new Float(0.5)));
		assertEquals(new Rational(7, 2), new Int(3).add(new Rational(1, 2)));
	}

	@Test
	public void test_12() {
		NumericValue r = new Float(0.5).add(new Rational(1, 2));
		assertEquals(Kind.COMPLEX, r.kind());
		assertEquals(new Complex(1.0, 0), r);
	}

	@Test
	public void test_13() {
		// The radix of the left operand is kept
		NumericValue h = new Int(16, Radix.HEX).add(new Int(1));
		assertEquals(Kind.HEX, h.kind());
		assertEquals("0x11", h.toString());
		NumericValue d = new Int(1).add(new Int(16, Radix.HEX));
		assertEquals(Kind.INT, d.kind());
		assertEquals("0b101", new Int(4, Radix.BINARY).add(new Int(1)).toString());
		assertEquals("-0x10", new Int(16, Radix.HEX).negate().toString());
	}

	@Test
	public void test_14() {
		NumericValue r = new Complex(3, 4).multiply(new Complex(3, -4));
		assertEquals(new Complex(25, 0), r);
		assertEquals("25+0i", r.toString());
		assertEquals("2-1i", new Complex(2, -1).toString());
	}

	@Test
	public void test_15() {
		assertEquals(new Float(5.0), new Int(5).coerce(Kind.FLOAT));
		assertEquals(Kind.HEX, new Int(5).coerce(Kind.HEX).kind());
		assertEquals(new Complex(1.5, 0), new Float(1.5).coerce(Kind.COMPLEX));
		assertThrows(RuntimeError.TypeMismatch.class, () -> new Float(1.5).coerce(Kind.INT));
		assertThrows(RuntimeError.TypeMismatch.class, () -> new Rational(1, 2).coerce(Kind.FLOAT));
	}

	@Test
	public void test_16() {
		assertEquals(new Int(5), new Rational(5, 1).narrow(Kind.INT));
		assertEquals(new Rational(1, 2), new Rational(1, 2).narrow(Kind.INT));
		assertEquals(new Float(2.0), new Complex(2, 0).narrow(Kind.FLOAT));
	}

	// ==============================================================
	// Comparison
	// ==============================================================

	@Test
	public void test_20() {
		assertTrue(new Rational(1, 3).compare(new Rational(1, 2)) < 0);
		assertTrue(new Int(1).compare(new Rational(1, 2)) > 0);
		assertTrue(new Int(2).equalTo(new Float(2.0)));
		assertTrue(new Int(31).equalTo(new Int(0x1f, Radix.HEX)));
	}

	@Test
	public void test_21() {
		assertTrue(new Complex(2, 0).compare(new Int(1)) > 0);
		assertTrue(new Complex(1, 2).equalTo(new Complex(1, 2)));
		assertFalse(new Complex(1, 2).equalTo(new Complex(1, -2)));
		assertThrows(RuntimeError.TypeMismatch.class, () -> new Complex(1, 2).compare(new Int(1)));
	}

	@Test
	public void test_22() {
		assertThrows(RuntimeError.TypeMismatch.class, () -> new Rational(1, 2).longValue());
		assertThrows(RuntimeError.TypeMismatch.class, () -> new Symbolic("n").longValue());
		assertEquals(42, new Int(42).longValue());
	}

	@Test
	public void test_23() {
		// Negative zero is numerically zero
		NumericValue nz = new Float(-0.0);
		assertTrue(nz.equalTo(NumericValue.ZERO));
		assertEquals(0, nz.compare(new Float(0.0)));
		assertEquals(0, new Complex(-0.0, 0).compare(new Complex(0.0, 0)));
		assertTrue(new Complex(-0.0, 0).equalTo(new Float(0.0)));
	}

	// ==============================================================
	// Symbolic
	// ==============================================================

	@Test
	public void test_30() {
		NumericValue x = new Symbolic("x");
		NumericValue r = x.add(new Int(1));
		assertEquals(Kind.SYMBOLIC, r.kind());
		assertEquals("('x + 1)", r.toString());
	}

	@Test
	public void test_31() {
		// No simplification is applied
		NumericValue x = new Symbolic("x");
		NumericValue r = x.add(x);
		assertEquals("('x + 'x)", r.toString());
		assertFalse(r.equals(x.multiply(new Int(2))));
	}

	@Test
	public void test_32() {
		NumericValue x = new Symbolic("x");
		assertTrue(x.equalTo(new Symbolic("x")));
		assertTrue(x.add(new Int(1)).equalTo(new Symbolic("x").add(new Int(1))));
		assertThrows(RuntimeError.Incomparable.class, () -> x.equalTo(new Symbolic("y")));
		assertThrows(RuntimeError.Incomparable.class, () -> x.compare(new Int(1)));
		assertThrows(RuntimeError.Incomparable.class, () -> new Int(1).equalTo(x));
	}

	@Test
	public void test_33() {
		NumericValue r = new Int(2).multiply(new Symbolic("x"));
		assertEquals("(2 * 'x)", r.toString());
	}
}
