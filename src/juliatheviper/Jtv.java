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

package juliatheviper;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import juliatheviper.core.Budget;
import juliatheviper.core.ExecutionResult;
import juliatheviper.core.Interpreter;
import juliatheviper.core.Syntax.Program;
import juliatheviper.core.TotalityChecker;
import juliatheviper.io.Lexer;
import juliatheviper.io.Parser;
import juliatheviper.util.Diagnostic;

/**
 * The entry points used by tools which embed the interpreter.
 *
 * @author David J. Pearce
 *
 */
public class Jtv {

	/**
	 * Parse a given source string into a program.
	 *
	 * @param source
	 * @return
	 */
	public static Program parse(String source) {
		return parse(null, source);
	}

	public static Program parse(String filename, String source) {
		List<Lexer.Token> tokens = new Lexer(filename, source).scan();
		return new Parser(filename, source, tokens).parseProgram();
	}

	/**
	 * Parse a UTF-8 encoded source file into a program.
	 *
	 * @param file
	 * @return
	 * @throws IOException
	 */
	public static Program parse(File file) throws IOException {
		try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
			Lexer lexer = new Lexer(file.getName(), reader);
			return new Parser(file.getName(), lexer.source(), lexer.scan()).parseProgram();
		}
	}

	/**
	 * Check the pure functions of a program for totality and purity. Those
	 * which pass are marked total.
	 *
	 * @param program
	 * @return
	 */
	public static List<Diagnostic> checkTotality(Program program) {
		return new TotalityChecker().check(program);
	}

	public static Interpreter newSession(Program program) {
		return new Interpreter(program);
	}

	public static Interpreter newSession(Program program, Budget budget) {
		return new Interpreter(program, budget);
	}

	/**
	 * Parse, check and run a given source string from start to finish.
	 *
	 * @param source
	 * @return
	 */
	public static ExecutionResult run(String source) {
		return newSession(parse(source)).run();
	}

	public static ExecutionResult run(Program program) {
		return newSession(program).run();
	}
}
