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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.List;

import org.junit.jupiter.api.Test;

import juliatheviper.core.NumericValue;
import juliatheviper.io.Lexer;
import juliatheviper.io.Lexer.Kind;
import juliatheviper.io.Lexer.Token;
import juliatheviper.util.LexError;

/**
 * Test cases for the lexer, covering each of the literal forms and the
 * inputs which must be rejected before parsing begins.
 *
 * @author David J. Pearce
 *
 */
public class LexerTests {

	@Test
	public void test_01() {
		List<Token> tokens = scan("x = 42");
		assertEquals(3, tokens.size());
		checkToken(tokens.get(0), Kind.IDENTIFIER, "x");
		checkToken(tokens.get(1), Kind.OPERATOR, "=");
		checkLiteral(tokens.get(2), Kind.INT, new NumericValue.Int(42));
	}

	@Test
	public void test_02() {
		Token t = single("0x1F");
		checkLiteral(t, Kind.HEX, new NumericValue.Int(31));
		assertEquals(NumericValue.Kind.HEX, ((Lexer.Literal) t).value.kind());
		assertEquals("0x1f", ((Lexer.Literal) t).value.toString());
	}

	@Test
	public void test_03() {
		Token t = single("0b1011");
		checkLiteral(t, Kind.BINARY, new NumericValue.Int(11));
		assertEquals(NumericValue.Kind.BINARY, ((Lexer.Literal) t).value.kind());
	}

	@Test
	public void test_04() {
		checkLiteral(single("3.14"), Kind.FLOAT, new NumericValue.Float(3.14));
		checkLiteral(single("1.5e3"), Kind.FLOAT, new NumericValue.Float(1500.0));
	}

	@Test
	public void test_05() {
		checkLiteral(single("1/3"), Kind.RATIONAL, new NumericValue.Rational(1, 3));
		// Rationals are held in lowest terms
		checkLiteral(single("2/6"), Kind.RATIONAL, new NumericValue.Rational(1, 3));
		checkLiteral(single("4/2"), Kind.RATIONAL, new NumericValue.Int(2));
	}

	@Test
	public void test_06() {
		checkLiteral(single("3+4i"), Kind.COMPLEX, new NumericValue.Complex(3, 4));
		checkLiteral(single("2-1i"), Kind.COMPLEX, new NumericValue.Complex(2, -1));
		checkLiteral(single("4i"), Kind.COMPLEX, new NumericValue.Complex(0, 4));
	}

	@Test
	public void test_07() {
		checkLiteral(single("'x"), Kind.SYMBOLIC, new NumericValue.Symbolic("x"));
	}

	@Test
	public void test_08() {
		// A range is not a float
		List<Token> tokens = scan("0..10");
		assertEquals(3, tokens.size());
		checkLiteral(tokens.get(0), Kind.INT, new NumericValue.Int(0));
		checkToken(tokens.get(1), Kind.OPERATOR, "..");
		checkLiteral(tokens.get(2), Kind.INT, new NumericValue.Int(10));
	}

	@Test
	public void test_09() {
		// Complex literals cannot contain whitespace
		List<Token> tokens = scan("1 + 2i");
		assertEquals(3, tokens.size());
		checkLiteral(tokens.get(2), Kind.COMPLEX, new NumericValue.Complex(0, 2));
	}

	@Test
	public void test_10() {
		List<Token> tokens = scan("x = 1 // comment\n/* block\ncomment */ y = 2");
		assertEquals(6, tokens.size());
		checkToken(tokens.get(3), Kind.IDENTIFIER, "y");
		assertEquals(3, tokens.get(3).line);
	}

	@Test
	public void test_11() {
		List<Token> tokens = scan("@pure fn f(a: Int): Int { return a }");
		checkToken(tokens.get(0), Kind.ANNOTATION, "@pure");
		checkToken(tokens.get(1), Kind.KEYWORD, "fn");
		checkToken(tokens.get(2), Kind.IDENTIFIER, "f");
		checkToken(tokens.get(5), Kind.PUNCTUATION, ":");
	}

	@Test
	public void test_12() {
		List<Token> tokens = scan("x += 1; y -= 2; a <= b; c >= d; e == f");
		checkToken(tokens.get(1), Kind.OPERATOR, "+=");
		checkToken(tokens.get(5), Kind.OPERATOR, "-=");
		checkToken(tokens.get(9), Kind.OPERATOR, "<=");
		checkToken(tokens.get(13), Kind.OPERATOR, ">=");
		checkToken(tokens.get(17), Kind.OPERATOR, "==");
	}

	@Test
	public void test_13() {
		// in and print are ordinary identifiers
		List<Token> tokens = scan("for i in 0..n { print(i) }");
		checkToken(tokens.get(0), Kind.KEYWORD, "for");
		checkToken(tokens.get(2), Kind.IDENTIFIER, "in");
		checkToken(tokens.get(7), Kind.IDENTIFIER, "print");
	}

	@Test
	public void test_14() {
		checkInvalid("x = \"rm -rf /\"");
	}

	@Test
	public void test_15() {
		checkInvalid("x = 1/0");
	}

	@Test
	public void test_16() {
		checkInvalid("x = 0x");
	}

	@Test
	public void test_17() {
		checkInvalid("x = 12abc");
	}

	@Test
	public void test_18() {
		checkInvalid("x = 99999999999999999999");
	}

	@Test
	public void test_19() {
		checkInvalid("x = 1 /* unterminated");
	}

	@Test
	public void test_20() {
		checkInvalid("x = 1 # 2");
	}

	@Test
	public void test_21() {
		checkInvalid("x = 1.5e");
	}

	@Test
	public void test_22() {
		LexError e = assertThrows(LexError.class, () -> scan("x = 1\ny = ?"));
		assertEquals(2, e.line());
		assertEquals(10, e.offset());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static List<Token> scan(String input) {
		return new Lexer(input).scan();
	}

	private static Token single(String input) {
		List<Token> tokens = scan(input);
		assertEquals(1, tokens.size(), "expected single token: " + tokens);
		return tokens.get(0);
	}

	private static void checkToken(Token t, Kind kind, String text) {
		assertEquals(kind, t.kind);
		assertEquals(text, t.text);
	}

	private static void checkLiteral(Token t, Kind kind, NumericValue value) {
		assertEquals(kind, t.kind);
		if (!(t instanceof Lexer.Literal)) {
			fail("expected literal, got: " + t);
		}
		assertEquals(value, ((Lexer.Literal) t).value);
	}

	private static void checkInvalid(String input) {
		try {
			scan(input);
			fail("test shouldn't have passed lexing");
		} catch (LexError e) {
			// If we get here, then the lexer raised an exception
			e.outputSourceError(System.out);
		}
	}
}
