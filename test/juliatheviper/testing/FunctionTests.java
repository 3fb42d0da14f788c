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

import static juliatheviper.testing.InterpreterTests.check;
import static juliatheviper.testing.InterpreterTests.checkRuntimeError;
import static juliatheviper.testing.InterpreterTests.run;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import juliatheviper.Jtv;
import juliatheviper.core.ExecutionResult;
import juliatheviper.core.Interpreter;
import juliatheviper.core.NumericValue;
import juliatheviper.core.NumericValue.Float;
import juliatheviper.core.NumericValue.Int;
import juliatheviper.core.NumericValue.Rational;
import juliatheviper.util.RuntimeError;

/**
 * Runtime test cases for function declarations and calls, in both the Control
 * and Data languages.
 *
 * @author David J. Pearce
 *
 */
public class FunctionTests {

	@Test
	public void test_01() {
		check("fn add(a, b) { return a + b }\nx = add(2, 3)", "x", new Int(5));
	}

	@Test
	public void test_02() {
		check("@pure fn calculate(a: Int, b: Int): Int { return a + b }\nresult = calculate(5, 3)", "result",
				new Int(8));
	}

	@Test
	public void test_03() {
		String input = "@pure fn double(a: Int): Int { return a + a }\n" //
				+ "x = 5\n" //
				+ "if double(x) > 8 { y = 1 } else { y = 0 }";
		check(input, "y", new Int(1));
	}

	@Test
	public void test_04() {
		// Pure calls can be nested in Data position
		String input = "@pure fn inc(a) { return a + 1 }\n" //
				+ "x = inc(inc(1)) + inc(0)";
		check(input, "x", new Int(4));
	}

	@Test
	public void test_05() {
		String input = "fn fact(n) {\n" //
				+ "  if n <= 1 { return 1 }\n" //
				+ "  return n * fact(n - 1)\n" //
				+ "}\n" //
				+ "x = fact(10)";
		check(input, "x", new Int(3628800));
	}

	@Test
	public void test_06() {
		String input = "fn fib(n) {\n" //
				+ "  a = 0\n" //
				+ "  b = 1\n" //
				+ "  for i in 0..n {\n" //
				+ "    t = a + b\n" //
				+ "    a = b\n" //
				+ "    b = t\n" //
				+ "  }\n" //
				+ "  return a\n" //
				+ "}\n" //
				+ "x = fib(10)";
		check(input, "x", new Int(55));
	}

	@Test
	public void test_07() {
		String input = "fn even(n) {\n" //
				+ "  if n == 0 { return 1 }\n" //
				+ "  return odd(n - 1)\n" //
				+ "}\n" //
				+ "fn odd(n) {\n" //
				+ "  if n == 0 { return 0 }\n" //
				+ "  return even(n - 1)\n" //
				+ "}\n" //
				+ "x = even(10)";
		check(input, "x", new Int(1));
	}

	@Test
	public void test_08() {
		String input = "fn find(n) {\n" //
				+ "  i = 0\n" //
				+ "  while i < 100 {\n" //
				+ "    if i * i >= n { return i }\n" //
				+ "    i = i + 1\n" //
				+ "  }\n" //
				+ "  return 0 - 1\n" //
				+ "}\n" //
				+ "x = find(50)";
		// Only addition is permitted in a guard
		checkInvalidGuard(input);
		String valid = "fn find(n) {\n" //
				+ "  i = 0\n" //
				+ "  while i < 100 {\n" //
				+ "    sq = i * i\n" //
				+ "    if sq >= n { return i }\n" //
				+ "    i = i + 1\n" //
				+ "  }\n" //
				+ "  return -1\n" //
				+ "}\n" //
				+ "x = find(50)";
		check(valid, "x", new Int(8));
	}

	// ==============================================================
	// Frames
	// ==============================================================

	@Test
	public void test_10() {
		// Callee cannot see caller locals
		String input = "fn g() {\n  z = 5\n  return h()\n}\nfn h() { return z }\nx = g()";
		RuntimeError e = checkRuntimeError(input, RuntimeError.UndefinedReference.class);
		assertEquals(5, e.line());
	}

	@Test
	public void test_11() {
		check("rate = 3\nfn f(a) { return a * rate }\nx = f(2)", "x", new Int(6));
	}

	@Test
	public void test_12() {
		ExecutionResult r = run("x = 1\nfn f() {\n  x = 2\n  return x\n}\ny = f()");
		assertEquals(new Int(2), r.get("y"));
		assertEquals(new Int(1), r.get("x"));
	}

	@Test
	public void test_13() {
		ExecutionResult r = run("fn show(a) { print(a) }\nshow(1)\nshow(2/3)");
		assertEquals(Arrays.asList("1", "2/3"), r.output());
	}

	// ==============================================================
	// Kinds
	// ==============================================================

	@Test
	public void test_20() {
		check("@pure fn half(a: Rational): Rational { return a / 2 }\nx = half(3)", "x", new Rational(3, 2));
		NumericValue v = run("@pure fn half(a: Rational): Rational { return a / 2 }\nx = half(4)").get("x");
		assertEquals(NumericValue.Kind.RATIONAL, v.kind());
	}

	@Test
	public void test_21() {
		check("fn f(a: Float) { return a }\nx = f(2)", "x", new Float(2.0));
	}

	@Test
	public void test_22() {
		checkRuntimeError("fn f(a: Int) { return a }\nx = f(1.5)", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_23() {
		checkRuntimeError("fn f(): Int { return 1.5 }\nx = f()", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_24() {
		checkRuntimeError("fn f(): Int { x = 1 }\ny = f()", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_25() {
		check("fn f(a: Hex): Hex { return a + 1 }\nx = f(255)", "x", new Int(256));
		assertEquals("0x100", run("fn f(a: Hex): Hex { return a + 1 }\nx = f(255)").get("x").toString());
	}

	// ==============================================================
	// Direct invocation
	// ==============================================================

	@Test
	public void test_30() {
		Interpreter session = Jtv.newSession(Jtv.parse("@pure fn add(a, b) { return a + b }"));
		session.run();
		assertEquals(new Int(5), session.invoke("add", new Int(2), new Int(3)));
	}

	@Test
	public void test_31() {
		Interpreter session = Jtv.newSession(Jtv.parse("fn f(a) { print(a) }"));
		assertNull(session.invoke("f", new Int(1)));
		assertEquals(Arrays.asList("1"), session.output());
	}

	@Test
	public void test_32() {
		Interpreter session = Jtv.newSession(Jtv.parse("fn f(a) { return a }"));
		assertThrows(RuntimeError.TypeMismatch.class, () -> session.invoke("f"));
		assertThrows(RuntimeError.UndefinedReference.class, () -> session.invoke("g"));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static void checkInvalidGuard(String input) {
		ParserTests.checkInvalid(input);
	}
}
