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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.File;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import juliatheviper.Jtv;
import juliatheviper.core.Budget;
import juliatheviper.core.ExecutionResult;
import juliatheviper.core.Interpreter;
import juliatheviper.core.LoggingTracer;
import juliatheviper.core.NumericValue;
import juliatheviper.core.NumericValue.Complex;
import juliatheviper.core.NumericValue.Float;
import juliatheviper.core.NumericValue.Int;
import juliatheviper.core.NumericValue.Rational;
import juliatheviper.core.Syntax.Program;
import juliatheviper.util.LexError;
import juliatheviper.util.RuntimeError;
import juliatheviper.util.SyntaxError;

/**
 * Runtime test cases for top-level programs. Each valid test should pass
 * checking and execute without raising an error.
 *
 * @author David J. Pearce
 *
 */
public class InterpreterTests {
	private static final Int Eight = new Int(8);

	// ==============================================================
	// Straightforward Examples
	// ==============================================================

	@Test
	public void test_01() {
		check("x = 5; y = 3; result = x + y", "result", Eight);
	}

	@Test
	public void test_02() {
		check("user_value = 5; safe_result = user_value + 10", "safe_result", new Int(15));
	}

	@Test
	public void test_03() {
		check("x = 7 - 2 * 3", "x", new Int(1));
	}

	@Test
	public void test_04() {
		check("x = 7 / 2", "x", new Rational(7, 2));
		check("x = 8 / 2", "x", new Int(4));
	}

	@Test
	public void test_05() {
		check("x = 1/2 + 1/3", "x", new Rational(5, 6));
	}

	@Test
	public void test_06() {
		check("x = 1.5 + 2", "x", new Float(3.5));
		check("x = 1.5 + 1/2", "x", new Complex(2.0, 0));
	}

	@Test
	public void test_07() {
		check("z = 3+4i\nw = z * 2", "w", new Complex(6, 8));
	}

	@Test
	public void test_08() {
		NumericValue v = run("x = 0xff + 1").get("x");
		assertEquals(NumericValue.Kind.HEX, v.kind());
		assertEquals("0x100", v.toString());
	}

	@Test
	public void test_09() {
		check("x = (1 + 2) * (3 + 4)", "x", new Int(21));
	}

	// ==============================================================
	// Control Flow
	// ==============================================================

	@Test
	public void test_10() {
		check("x = 5\nif x > 3 { y = 1 } else { y = 2 }", "y", new Int(1));
		check("x = 2\nif x > 3 { y = 1 } else { y = 2 }", "y", new Int(2));
	}

	@Test
	public void test_11() {
		String input = "x = 5\n" //
				+ "if x < 3 { y = 1 }\n" //
				+ "else if x < 6 { y = 2 }\n" //
				+ "else { y = 3 }";
		check(input, "y", new Int(2));
	}

	@Test
	public void test_12() {
		String input = "i = 0\n" //
				+ "s = 0\n" //
				+ "while i < 5 {\n" //
				+ "  s = s + i\n" //
				+ "  i = i + 1\n" //
				+ "}";
		check(input, "s", new Int(10));
	}

	@Test
	public void test_13() {
		ExecutionResult r = run("s = 0\nfor i in 1..5 { s = s + i }");
		assertEquals(new Int(10), r.get("s"));
		assertEquals(new Int(4), r.get("i"));
	}

	@Test
	public void test_14() {
		// Loop bounds are fixed on entry
		String input = "n = 3\n" //
				+ "c = 0\n" //
				+ "for i in 0..n {\n" //
				+ "  n = n + 1\n" //
				+ "  c = c + 1\n" //
				+ "}";
		ExecutionResult r = run(input);
		assertEquals(new Int(3), r.get("c"));
		assertEquals(new Int(6), r.get("n"));
	}

	@Test
	public void test_15() {
		check("c = 0\nfor i in 5..2 { c = c + 1 }", "c", new Int(0));
	}

	@Test
	public void test_16() {
		check("x = 0x0a\nif x == 10 { y = 1 } else { y = 0 }", "y", new Int(1));
	}

	@Test
	public void test_17() {
		check("x = 1/2\nif x < 0.75 { y = 1 } else { y = 0 }", "y", new Int(1));
	}

	@Test
	public void test_18() {
		String input = "x = 0.0 * -1.0\n" //
				+ "if x == 0 { y = 1 } else { y = 2 }\n" //
				+ "if x < 0 { z = 1 } else { z = 2 }";
		ExecutionResult r = run(input);
		assertEquals(new Int(1), r.get("y"));
		assertEquals(new Int(2), r.get("z"));
	}

	@Test
	public void test_19() {
		ExecutionResult r = run("x = 0 - 9223372036854775807 - 1\ny = x / 6");
		assertEquals(new Rational(-4611686018427387904L, 3), r.get("y"));
		assertEquals("-4611686018427387904/3", r.get("y").toString());
	}

	// ==============================================================
	// Output and Results
	// ==============================================================

	@Test
	public void test_20() {
		ExecutionResult r = run("x = 2\nprint(x, x + 1)\nprint(1/3)");
		assertEquals(Arrays.asList("2 3", "1/3"), r.output());
	}

	@Test
	public void test_21() {
		ExecutionResult r = run("b = 1\na = 2\nb = 3");
		assertEquals(Arrays.asList("b", "a"), new ArrayList<>(r.variables().keySet()));
		assertEquals(3, r.steps());
		assertTrue(r.warnings().isEmpty());
	}

	@Test
	public void test_22() {
		List<String> lines = new ArrayList<>();
		Program p = Jtv.parse("for i in 0..3 { print(i) }");
		Interpreter session = new Interpreter(p, Budget.UNLIMITED, new LoggingTracer(), lines::add);
		session.run();
		assertEquals(Arrays.asList("0", "1", "2"), lines);
		assertEquals(lines, session.output());
	}

	@Test
	public void test_23() {
		// Each run starts from an empty global frame
		Interpreter session = Jtv.newSession(Jtv.parse("x = 1\nprint(x)"));
		session.run();
		ExecutionResult r = session.run();
		assertEquals(1, r.output().size());
		assertEquals(new Int(1), session.getVariable("x"));
	}

	@Test
	public void test_24() {
		NumericValue v = run("x = 'a + 1").get("x");
		assertEquals(NumericValue.Kind.SYMBOLIC, v.kind());
		assertEquals("('a + 1)", v.toString());
	}

	@Test
	public void test_25() {
		Program p = Jtv.parse("module demo\nimport other.thing\nx = 1");
		assertEquals(new Int(1), Jtv.run(p).get("x"));
	}

	// ==============================================================
	// Runtime Errors
	// ==============================================================

	@Test
	public void test_30() {
		RuntimeError e = checkRuntimeError("x = 9223372036854775807\ny = x + 1", RuntimeError.OverflowError.class);
		assertEquals(2, e.line());
	}

	@Test
	public void test_31() {
		RuntimeError e = checkRuntimeError("x = 1\ny = 0\nz = x / y", RuntimeError.DivisionByZero.class);
		assertEquals(3, e.line());
	}

	@Test
	public void test_32() {
		RuntimeError e = checkRuntimeError("x = y + 1", RuntimeError.UndefinedReference.class);
		assertEquals("y", ((RuntimeError.UndefinedReference) e).name());
		assertEquals(RuntimeError.Kind.UNDEFINED_REFERENCE, e.kind());
	}

	@Test
	public void test_33() {
		checkRuntimeError("for i in 0..1/2 { x = i }", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_34() {
		checkRuntimeError("x = 'a\nif x < 1 { y = 1 }", RuntimeError.Incomparable.class);
	}

	@Test
	public void test_35() {
		checkRuntimeError("x = 1+2i\nif x > 1 { y = 1 }", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_36() {
		// A function with no return value has no result
		checkRuntimeError("fn f() { x = 1 }\ny = f()", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_37() {
		checkRuntimeError("n = 'n\nfor i in 0..n { x = i }", RuntimeError.TypeMismatch.class);
	}

	@Test
	public void test_38() {
		Interpreter session = Jtv.newSession(Jtv.parse("x = 1"));
		session.run();
		assertThrows(RuntimeError.UndefinedReference.class, () -> session.getVariable("y"));
	}

	@Test
	public void test_39() {
		// Errors leave earlier assignments in place
		Interpreter session = Jtv.newSession(Jtv.parse("x = 1\ny = x / 0\nz = 2"));
		assertThrows(RuntimeError.DivisionByZero.class, () -> session.run());
		assertEquals(new Int(1), session.getVariable("x"));
		assertThrows(RuntimeError.UndefinedReference.class, () -> session.getVariable("z"));
	}

	@Test
	public void test_40() {
		assertThrows(LexError.class, () -> Jtv.run("x = \"import os\""));
	}

	@Test
	public void test_41() throws Exception {
		Program p = Jtv.parse(resource("sum.jtv"));
		assertEquals("sum.jtv", p.filename());
		ExecutionResult r = Jtv.run(p);
		assertEquals(new Int(10), r.get("s"));
		assertEquals(new Int(20), r.get("d"));
	}

	@Test
	public void test_42() throws Exception {
		// Offsets count characters, so the file must be decoded as UTF-8
		File file = resource("invalid.jtv");
		LexError e = assertThrows(LexError.class, () -> Jtv.parse(file));
		assertEquals(2, e.line());
		assertEquals(9, e.offset());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static File resource(String name) throws URISyntaxException {
		return new File(InterpreterTests.class.getResource("/programs/" + name).toURI());
	}

	public static ExecutionResult run(String input) {
		try {
			return Jtv.run(input);
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			e.printStackTrace();
			fail();
			return null;
		}
	}

	public static void check(String input, String variable, NumericValue expected) {
		ExecutionResult r = run(input);
		NumericValue actual = r.get(variable);
		if (!expected.equals(actual)) {
			// Failed
			fail("expected: " + expected + ", got: " + actual);
		}
	}

	public static RuntimeError checkRuntimeError(String input, Class<? extends RuntimeError> kind) {
		try {
			Jtv.run(input);
			fail("test shouldn't have executed successfully");
			return null;
		} catch (RuntimeError e) {
			if (!kind.isInstance(e)) {
				fail("expected " + kind.getSimpleName() + ", got: " + e);
			}
			return e;
		}
	}
}
