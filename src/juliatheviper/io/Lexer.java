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

package juliatheviper.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import juliatheviper.core.NumericValue;
import juliatheviper.util.LexError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 * Seven literal forms are recognised: decimal integers (<code>42</code>),
 * floats (<code>3.14</code>), rationals (<code>1/3</code>), complex numbers
 * (<code>3+4i</code>), hexadecimal (<code>0x1F</code>) and binary
 * (<code>0b101</code>) integers, and symbolic atoms (<code>'x</code>).
 *
 * @author David J. Pearce
 *
 */
public class Lexer {

	private final String filename;
	private final String input;
	private final int[] lineStarts;
	private int pos;

	public Lexer(String input) {
		this(null, input);
	}

	public Lexer(String filename, Reader reader) throws IOException {
		this(filename, read(reader));
	}

	public Lexer(String filename, String input) {
		this.filename = filename;
		this.input = input;
		this.lineStarts = computeLineStarts(input);
	}

	/**
	 * Get the complete source text being scanned.
	 *
	 * @return
	 */
	public String source() {
		return input;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '/' && (pos + 1) < input.length() && input.charAt(pos + 1) == '/') {
				scanLineComment();
			} else if (c == '/' && (pos + 1) < input.length() && input.charAt(pos + 1) == '*') {
				scanBlockComment();
			} else if (c == '\'') {
				tokens.add(scanSymbolic());
			} else if (c == '@') {
				tokens.add(scanAnnotation());
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else if (c == '"') {
				syntaxError("string literals are not permitted", pos);
			} else {
				syntaxError("unexpected character '" + c + "'", pos);
			}
		}

		return tokens;
	}

	/**
	 * Scan a numeric constant. This begins with a digit and may turn out to be
	 * any of the six concrete literal forms.
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		if (input.charAt(pos) == '0' && (pos + 1) < input.length()) {
			char n = input.charAt(pos + 1);
			if (n == 'x' || n == 'X') {
				return scanRadixConstant(start, 16, Kind.HEX, NumericValue.Radix.HEX);
			} else if (n == 'b' || n == 'B') {
				return scanRadixConstant(start, 2, Kind.BINARY, NumericValue.Radix.BINARY);
			}
		}
		scanDigits();
		boolean isFloat = false;
		if (at('.') && isDigitAt(pos + 1)) {
			// NOTE: "1..n" is a range, not a float
			pos = pos + 1;
			scanDigits();
			isFloat = true;
		}
		if (isFloat && (at('e') || at('E'))) {
			pos = pos + 1;
			if (at('+') || at('-')) {
				pos = pos + 1;
			}
			if (!isDigitAt(pos)) {
				syntaxError("malformed exponent in float literal", start, pos - 1);
			}
			scanDigits();
		}
		String real = input.substring(start, pos);
		if (!isFloat && at('/') && isDigitAt(pos + 1)) {
			// rational literal
			pos = pos + 1;
			int dstart = pos;
			scanDigits();
			long num = parseDecimal(real, start);
			long den = parseDecimal(input.substring(dstart, pos), dstart);
			if (den == 0) {
				syntaxError("rational literal has zero denominator", start, pos - 1);
			}
			checkNotFollowedByIdentifier(start);
			return new Literal(Kind.RATIONAL, input.substring(start, pos), start, lineOf(start),
					NumericValue.Rational.of(num, den));
		} else if (at('i') && !isIdentifierPartAt(pos + 1)) {
			// pure imaginary literal
			pos = pos + 1;
			return new Literal(Kind.COMPLEX, input.substring(start, pos), start, lineOf(start),
					new NumericValue.Complex(0, parseDouble(real, start)));
		} else if ((at('+') || at('-')) && isImaginaryAt(pos + 1)) {
			boolean negative = at('-');
			pos = pos + 1;
			int istart = pos;
			scanDigits();
			if (at('.')) {
				pos = pos + 1;
				scanDigits();
			}
			double im = parseDouble(input.substring(istart, pos), istart);
			pos = pos + 1; // 'i'
			return new Literal(Kind.COMPLEX, input.substring(start, pos), start, lineOf(start),
					new NumericValue.Complex(parseDouble(real, start), negative ? -im : im));
		}
		checkNotFollowedByIdentifier(start);
		if (isFloat) {
			return new Literal(Kind.FLOAT, real, start, lineOf(start), new NumericValue.Float(parseDouble(real, start)));
		} else {
			return new Literal(Kind.INT, real, start, lineOf(start), new NumericValue.Int(parseDecimal(real, start)));
		}
	}

	private Token scanRadixConstant(int start, int radix, Kind kind, NumericValue.Radix display) {
		pos = pos + 2;
		int dstart = pos;
		while (pos < input.length() && Character.digit(input.charAt(pos), radix) >= 0) {
			pos = pos + 1;
		}
		String name = radix == 16 ? "hex" : "binary";
		if (pos == dstart) {
			syntaxError("malformed " + name + " literal (no digits)", start, pos - 1);
		}
		if (isIdentifierPartAt(pos)) {
			syntaxError("malformed " + name + " literal", start, pos);
		}
		BigInteger v = new BigInteger(input.substring(dstart, pos), radix);
		if (v.bitLength() > 63) {
			syntaxError(name + " literal out of range", start, pos - 1);
		}
		return new Literal(kind, input.substring(start, pos), start, lineOf(start),
				new NumericValue.Int(v.longValue(), display));
	}

	/**
	 * Scan a symbolic atom, such as <code>'x</code>.
	 *
	 * @return
	 */
	public Token scanSymbolic() {
		int start = pos;
		pos = pos + 1;
		if (pos >= input.length() || !Character.isJavaIdentifierStart(input.charAt(pos))) {
			syntaxError("symbolic literal requires a name", start);
		}
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		String name = input.substring(start + 1, pos);
		return new Literal(Kind.SYMBOLIC, input.substring(start, pos), start, lineOf(start),
				new NumericValue.Symbolic(name));
	}

	/**
	 * Scan an annotation, such as <code>@pure</code>.
	 *
	 * @return
	 */
	public Token scanAnnotation() {
		int start = pos;
		pos = pos + 1;
		if (pos >= input.length() || !Character.isJavaIdentifierStart(input.charAt(pos))) {
			syntaxError("annotation requires a name", start);
		}
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		return new Token(Kind.ANNOTATION, input.substring(start, pos), start, lineOf(start));
	}

	static final char[] opStarts = { ',', '(', ')', '{', '}', '*', '=', ';', ':', '+', '-', '/', '<', '>', '.' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	public Token scanOperator() {
		char c = input.charAt(pos);
		int start = pos;
		char n = (pos + 1) < input.length() ? input.charAt(pos + 1) : '\0';

		if (c == '=' && n == '=') {
			return operator("==", start);
		} else if (c == '+' && n == '=') {
			return operator("+=", start);
		} else if (c == '-' && n == '=') {
			return operator("-=", start);
		} else if (c == '<' && n == '=') {
			return operator("<=", start);
		} else if (c == '>' && n == '=') {
			return operator(">=", start);
		} else if (c == '.' && n == '.') {
			return operator("..", start);
		} else if (c == '=' || c == '+' || c == '-' || c == '*' || c == '/' || c == '<' || c == '>') {
			return operator(Character.toString(c), start);
		}
		pos = pos + 1;
		return new Token(Kind.PUNCTUATION, Character.toString(c), start, lineOf(start));
	}

	private Token operator(String text, int start) {
		pos = pos + text.length();
		return new Token(Kind.OPERATOR, text, start, lineOf(start));
	}

	public static final String[] keywords = { "fn", "if", "else", "while", "for", "return", "reverse", "module",
			"import" };

	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		if (Arrays.asList(keywords).contains(text)) {
			return new Token(Kind.KEYWORD, text, start, lineOf(start));
		}

		// otherwise, must be identifier
		return new Token(Kind.IDENTIFIER, text, start, lineOf(start));
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	public void scanBlockComment() {
		int start = pos;
		while ((pos + 1) < input.length() && (input.charAt(pos) != '*' || input.charAt(pos + 1) != '/')) {
			pos++;
		}
		if ((pos + 1) >= input.length()) {
			syntaxError("unterminated block comment", start, start + 1);
		}
		pos++;
		pos++;
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Determine the (one-based) line containing a given offset.
	 *
	 * @param offset
	 * @return
	 */
	public int lineOf(int offset) {
		int i = Arrays.binarySearch(lineStarts, offset);
		return i >= 0 ? i + 1 : -(i + 1);
	}

	private void scanDigits() {
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
	}

	private boolean at(char c) {
		return pos < input.length() && input.charAt(pos) == c;
	}

	private boolean isDigitAt(int i) {
		return i < input.length() && Character.isDigit(input.charAt(i));
	}

	private boolean isIdentifierPartAt(int i) {
		return i < input.length() && Character.isJavaIdentifierPart(input.charAt(i));
	}

	/**
	 * Check whether the imaginary part of a complex literal (e.g. <code>4i</code>
	 * or <code>2.5i</code>) begins at a given offset.
	 *
	 * @param i
	 * @return
	 */
	private boolean isImaginaryAt(int i) {
		if (!isDigitAt(i)) {
			return false;
		}
		while (isDigitAt(i)) {
			i++;
		}
		if (i < input.length() && input.charAt(i) == '.' && isDigitAt(i + 1)) {
			i++;
			while (isDigitAt(i)) {
				i++;
			}
		}
		return i < input.length() && input.charAt(i) == 'i' && !isIdentifierPartAt(i + 1);
	}

	private void checkNotFollowedByIdentifier(int start) {
		if (isIdentifierPartAt(pos)) {
			syntaxError("malformed numeric literal", start, pos);
		}
	}

	private long parseDecimal(String text, int start) {
		BigInteger v = new BigInteger(text);
		if (v.bitLength() > 63) {
			syntaxError("integer literal out of range", start, start + text.length() - 1);
		}
		return v.longValue();
	}

	private double parseDouble(String text, int start) {
		double d = Double.parseDouble(text);
		if (Double.isInfinite(d)) {
			syntaxError("float literal out of range", start, start + text.length() - 1);
		}
		return d;
	}

	/**
	 * Raise a lex error with a given message at a given offset.
	 *
	 * @param msg
	 * @param offset
	 */
	private void syntaxError(String msg, int offset) {
		throw new LexError(msg, filename, input, offset);
	}

	private void syntaxError(String msg, int start, int end) {
		throw new LexError(msg, filename, input, start, Math.max(start, end));
	}

	private static int[] computeLineStarts(String input) {
		ArrayList<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i != input.length(); ++i) {
			if (input.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		int[] r = new int[starts.size()];
		for (int i = 0; i != r.length; ++i) {
			r[i] = starts.get(i);
		}
		return r;
	}

	private static String read(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);
		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}
		return text.toString();
	}

	/**
	 * The different kinds of token.
	 */
	public enum Kind {
		INT, FLOAT, RATIONAL, COMPLEX, HEX, BINARY, SYMBOLIC, IDENTIFIER, KEYWORD, ANNOTATION, OPERATOR,
		PUNCTUATION;

		public boolean isLiteral() {
			return ordinal() <= SYMBOLIC.ordinal();
		}
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Token {

		public final Kind kind;
		public final String text;
		public final int start;
		public final int line;

		public Token(Kind kind, String text, int pos, int line) {
			this.kind = kind;
			this.text = text;
			this.start = pos;
			this.line = line;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return kind + "(" + text + ")@" + start;
		}
	}

	/**
	 * Represents a numeric literal in any of the seven forms, along with its
	 * value.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Literal extends Token {

		public final NumericValue value;

		public Literal(Kind kind, String text, int pos, int line, NumericValue value) {
			super(kind, text, pos, line);
			this.value = value;
		}
	}
}
