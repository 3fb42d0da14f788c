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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import juliatheviper.core.NumericValue;
import juliatheviper.core.Syntax.Block;
import juliatheviper.core.Syntax.Control;
import juliatheviper.core.Syntax.Data;
import juliatheviper.core.Syntax.Expr;
import juliatheviper.core.Syntax.FunctionDef;
import juliatheviper.core.Syntax.Guard;
import juliatheviper.core.Syntax.Parameter;
import juliatheviper.core.Syntax.Program;
import juliatheviper.core.Syntax.ReverseBlock;
import juliatheviper.core.Syntax.Reversible;
import juliatheviper.core.Syntax.SymbolTable;
import juliatheviper.io.Lexer.Kind;
import juliatheviper.io.Lexer.Literal;
import juliatheviper.io.Lexer.Token;
import juliatheviper.util.ParseError;
import juliatheviper.util.SyntacticElement.Attribute;

/**
 * Responsible for parsing a sequence of tokens into a program. The parser
 * implements three grammars of decreasing power:
 *
 * <pre>
 * Stmt       ::= Ident '=' CExpr | Ident '(' [CExpr (',' CExpr)*] ')'
 *              | 'if' Guard Block ['else' (Block | If)]
 *              | 'while' Guard Block
 *              | 'for' Ident 'in' DExpr '..' DExpr Block
 *              | 'return' [CExpr] | FnDecl | 'reverse' '{' RStmt* '}'
 * CExpr      ::= CTerm (('+' | '-') CTerm)*
 * CTerm      ::= CFactor (('*' | '/') CFactor)*
 * CFactor    ::= '(' CExpr ')' | Ident '(' [CExpr (',' CExpr)*] ')' | DTerm
 * Guard      ::= DExpr ('==' | '<' | '>' | '<=' | '>=') DExpr
 * DExpr      ::= DTerm ('+' DTerm)*
 * DTerm      ::= Literal | Ident | Ident '(' [DExpr (',' DExpr)*] ')' | '(' DExpr ')'
 * RStmt      ::= Ident ('+=' | '-=') DExpr
 *              | 'if' Guard '{' RStmt* '}' ['else' '{' RStmt* '}']
 * </pre>
 *
 * No Data production refers to a statement or block. Furthermore, a call in
 * Data position only resolves against functions declared <code>@pure</code>.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	public static final String PRINT = "print";
	public static final String PURE = "@pure";
	public static final String TOTAL = "@total";

	private final String filename;
	private final String source;
	private final ArrayList<Token> tokens;
	private int index;
	/**
	 * Signatures of all declared functions, as determined by a pre-pass over the
	 * token stream.
	 */
	private final Map<String, Signature> signatures = new HashMap<>();
	private final List<FunctionDef> functions = new ArrayList<>();
	private final List<ReverseBlock> reverseBlocks = new ArrayList<>();

	public Parser(String source, List<Token> tokens) {
		this(null, source, tokens);
	}

	public Parser(String filename, String source, List<Token> tokens) {
		this.filename = filename;
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parse a complete source file, of the form:
	 *
	 * <pre>
	 * Program ::= ['module' Name] ('import' Name)* Stmt*
	 * </pre>
	 *
	 * @return
	 */
	public Program parseProgram() {
		collectSignatures();
		String module = null;
		List<String> imports = new ArrayList<>();
		if (lookaheadIs("module")) {
			matchKeyword("module");
			module = parseQualifiedName();
			matchOptional(";");
		}
		while (lookaheadIs("import")) {
			matchKeyword("import");
			imports.add(parseQualifiedName());
			matchOptional(";");
		}
		Context context = new Context(null);
		ArrayList<Control> stmts = new ArrayList<>();
		while (index < tokens.size()) {
			stmts.add(parseStatement(context));
		}
		SymbolTable table = new SymbolTable(functions);
		return new Program(filename, source, module, imports, stmts.toArray(new Control[stmts.size()]), table,
				reverseBlocks);
	}

	/**
	 * Scan ahead through all tokens to determine the name and purity of every
	 * declared function. This allows calls (including mutually recursive ones) to
	 * be resolved regardless of declaration order.
	 */
	private void collectSignatures() {
		for (int i = 0; i < tokens.size(); ++i) {
			Token t = tokens.get(i);
			if (t.kind == Kind.ANNOTATION && !t.text.equals(PURE)) {
				if (t.text.equals(TOTAL)) {
					syntaxError("totality cannot be declared, it is established by the checker", t);
				}
				syntaxError("unknown annotation " + t.text, t);
			} else if (t.kind == Kind.KEYWORD && t.text.equals("fn") && (i + 1) < tokens.size()
					&& tokens.get(i + 1).kind == Kind.IDENTIFIER) {
				Token name = tokens.get(i + 1);
				boolean pure = i > 0 && tokens.get(i - 1).kind == Kind.ANNOTATION;
				if (signatures.containsKey(name.text)) {
					syntaxError("function " + name.text + " already declared", name.text, name);
				} else if (name.text.equals(PRINT)) {
					syntaxError("cannot redeclare built-in function " + PRINT, name.text, name);
				}
				signatures.put(name.text, new Signature(signatures.size(), pure, countParameters(i + 2)));
			}
		}
	}

	private int countParameters(int i) {
		if (i >= tokens.size() || !tokens.get(i).text.equals("(")) {
			return -1;
		}
		i = i + 1;
		if (i < tokens.size() && tokens.get(i).text.equals(")")) {
			return 0;
		}
		int count = 1;
		while (i < tokens.size() && !tokens.get(i).text.equals(")")) {
			if (tokens.get(i).text.equals(",")) {
				count++;
			}
			i++;
		}
		return count;
	}

	// ================================================================================
	// Control Language
	// ================================================================================

	/**
	 * Parse a given statement, including any trailing (optional) semi-colon.
	 *
	 * @return
	 */
	public Control parseStatement(Context context) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		Control stmt;
		//
		if (lookahead.kind == Kind.ANNOTATION || lookahead.text.equals("fn")) {
			stmt = parseFunctionDeclaration(context);
		} else if (lookahead.kind == Kind.KEYWORD) {
			switch (lookahead.text) {
			case "if":
				stmt = parseIfElseStmt(context);
				break;
			case "while":
				stmt = parseWhileStmt(context);
				break;
			case "for":
				stmt = parseForStmt(context);
				break;
			case "return":
				stmt = parseReturnStmt(context);
				break;
			case "reverse":
				stmt = parseReverseBlock(context);
				break;
			case "module":
			case "import":
				syntaxError("'" + lookahead.text + "' must appear at the start of the file", lookahead);
				return null; // unreachable
			default:
				syntaxError("unexpected '" + lookahead.text + "'", lookahead);
				return null; // unreachable
			}
		} else if (lookahead.kind == Kind.IDENTIFIER) {
			stmt = parseAssignmentOrCall(context);
		} else {
			syntaxError("expecting statement, found '" + lookahead.text + "'", lookahead);
			return null; // unreachable
		}
		matchOptional(";");
		return stmt;
	}

	/**
	 * Parse an assignment or call statement, both of which begin with an
	 * identifier.
	 *
	 * @return
	 */
	public Control parseAssignmentOrCall(Context context) {
		int start = index;
		Token name = matchIdentifier();
		checkNotEof();
		Token t = tokens.get(index);
		if (t.text.equals("=")) {
			match("=");
			Expr rhs = parseControlExpression(context);
			context.declare(name.text);
			return new Control.Assignment(name.text, rhs, sourceAttr(start, index - 1));
		} else if (t.text.equals("(")) {
			Expr.Invoke call = parseInvocation(context, name);
			if (name.text.equals(PRINT)) {
				return new Control.Print(call.arguments(), sourceAttr(start, index - 1));
			}
			return new Control.Call(call, sourceAttr(start, index - 1));
		} else if (t.text.equals("+=") || t.text.equals("-=")) {
			syntaxError("'" + t.text + "' is only permitted inside a reverse block", t);
		}
		syntaxError("expecting '=' or '(', found '" + t.text + "'", t);
		return null; // unreachable
	}

	/**
	 * Parse a function declaration, of the form:
	 *
	 * <pre>
	 * FnDecl ::= ['@pure'] 'fn' Ident '(' [Param (',' Param)*] ')' [':' Kind] Block
	 * Param  ::= Ident [':' Kind]
	 * </pre>
	 *
	 * @return
	 */
	public Control.FunctionDecl parseFunctionDeclaration(Context context) {
		int start = index;
		boolean pure = false;
		if (tokens.get(index).kind == Kind.ANNOTATION) {
			match(PURE);
			pure = true;
		}
		Token fn = matchKeyword("fn");
		if (context.isFunction()) {
			syntaxError("functions can only be declared at the top level", fn);
		}
		Token name = matchIdentifier();
		Signature signature = signatures.get(name.text);
		match("(");
		ArrayList<Parameter> params = new ArrayList<>();
		Context body = new Context(name.text);
		while (index < tokens.size() && !tokens.get(index).text.equals(")")) {
			if (!params.isEmpty()) {
				match(",");
			}
			int pstart = index;
			Token pname = matchIdentifier();
			NumericValue.Kind kind = null;
			if (lookaheadIs(":")) {
				match(":");
				kind = parseKind();
			}
			if (body.isDeclared(pname.text)) {
				syntaxError("parameter " + pname.text + " already declared", pname.text, pname);
			}
			body.declare(pname.text);
			params.add(new Parameter(pname.text, kind, sourceAttr(pstart, index - 1)));
		}
		match(")");
		NumericValue.Kind returnKind = null;
		if (lookaheadIs(":")) {
			match(":");
			returnKind = parseKind();
		}
		int end = index - 1;
		Block block = parseStatementBlock(body);
		FunctionDef def = new FunctionDef(signature.index, name.text, params.toArray(new Parameter[params.size()]),
				returnKind, pure, block, sourceAttr(start, end));
		functions.add(def);
		functions.sort((f, g) -> Integer.compare(f.index(), g.index()));
		return new Control.FunctionDecl(def, sourceAttr(start, end));
	}

	private NumericValue.Kind parseKind() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t.text.equals("(")) {
			syntaxError("tuple kinds are not supported", t);
		}
		Token id = matchIdentifier();
		NumericValue.Kind kind = NumericValue.Kind.fromLabel(id.text);
		if (kind == null) {
			syntaxError("unknown kind " + id.text, id.text, id);
		}
		return kind;
	}

	/**
	 * Parse a block of zero or more statements, of the form:
	 *
	 * <pre>
	 * Block ::= '{' Stmt* '}'
	 * </pre>
	 *
	 * @return
	 */
	public Block parseStatementBlock(Context context) {
		int start = index;
		match("{");
		ArrayList<Control> stmts = new ArrayList<>();
		while (index < tokens.size() && !tokens.get(index).text.equals("}")) {
			stmts.add(parseStatement(context));
		}
		match("}");
		return new Block(stmts.toArray(new Control[stmts.size()]), sourceAttr(start, index - 1));
	}

	public Control.If parseIfElseStmt(Context context) {
		int start = index;
		matchKeyword("if");
		Guard guard = parseGuard(context);
		Block trueBlock = parseStatementBlock(context);
		Block falseBlock = null;
		if (lookaheadIs("else")) {
			matchKeyword("else");
			if (lookaheadIs("if")) {
				int istart = index;
				Control.If nested = parseIfElseStmt(context);
				falseBlock = new Block(new Control[] { nested }, sourceAttr(istart, index - 1));
			} else {
				falseBlock = parseStatementBlock(context);
			}
		}
		return new Control.If(guard, trueBlock, falseBlock, sourceAttr(start, index - 1));
	}

	public Control.While parseWhileStmt(Context context) {
		int start = index;
		matchKeyword("while");
		Guard guard = parseGuard(context);
		Block body = parseStatementBlock(context);
		return new Control.While(guard, body, sourceAttr(start, index - 1));
	}

	public Control.For parseForStmt(Context context) {
		int start = index;
		matchKeyword("for");
		Token var = matchIdentifier();
		Token in = matchIdentifier();
		if (!in.text.equals("in")) {
			syntaxError("expecting 'in', found '" + in.text + "'", in);
		}
		Data from = parseDataExpression(context);
		match("..");
		Data to = parseDataExpression(context);
		context.declare(var.text);
		Block body = parseStatementBlock(context);
		return new Control.For(var.text, from, to, body, sourceAttr(start, index - 1));
	}

	public Control.Return parseReturnStmt(Context context) {
		int start = index;
		Token ret = matchKeyword("return");
		if (!context.isFunction()) {
			syntaxError("return outside of function", ret);
		}
		Expr operand = null;
		// A return value must begin on the same line as the return
		if (index < tokens.size() && tokens.get(index).line == ret.line && !lookaheadIs("}")
				&& !lookaheadIs(";")) {
			operand = parseControlExpression(context);
		}
		return new Control.Return(operand, sourceAttr(start, index - 1));
	}

	/**
	 * Parse an expression in Control position. Addition between two Data
	 * operands produces a Data node, whilst every other operator produces a
	 * Control node.
	 *
	 * @return
	 */
	public Expr parseControlExpression(Context context) {
		int start = index;
		Expr lhs = parseControlTerm(context);
		while (lookaheadIs("+") || lookaheadIs("-")) {
			Token op = match("+", "-");
			Expr rhs = parseControlTerm(context);
			if (op.text.equals("+") && lhs instanceof Expr.Pure && rhs instanceof Expr.Pure) {
				Data d = new Data.Add(((Expr.Pure) lhs).data(), ((Expr.Pure) rhs).data(),
						sourceAttr(start, index - 1));
				lhs = new Expr.Pure(d);
			} else {
				NumericValue.Operator operator = op.text.equals("+") ? NumericValue.Operator.ADD
						: NumericValue.Operator.SUB;
				lhs = new Expr.Arithmetic(operator, lhs, rhs, sourceAttr(start, index - 1));
			}
		}
		return lhs;
	}

	private Expr parseControlTerm(Context context) {
		int start = index;
		Expr lhs = parseControlFactor(context);
		while (lookaheadIs("*") || lookaheadIs("/")) {
			Token op = match("*", "/");
			Expr rhs = parseControlFactor(context);
			NumericValue.Operator operator = op.text.equals("*") ? NumericValue.Operator.MUL
					: NumericValue.Operator.DIV;
			lhs = new Expr.Arithmetic(operator, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Expr parseControlFactor(Context context) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("(")) {
			match("(");
			Expr e = parseControlExpression(context);
			match(")");
			return e;
		} else if (lookahead.kind == Kind.IDENTIFIER && (index + 1) < tokens.size()
				&& tokens.get(index + 1).text.equals("(")) {
			Token name = matchIdentifier();
			if (name.text.equals(PRINT)) {
				syntaxError(PRINT + " is a statement and has no value", name.text, name);
			}
			Signature sig = signatures.get(name.text);
			if (sig != null && sig.pure) {
				// Calls to pure functions remain in the Data language where possible
				int save = index;
				Expr.Invoke call = parseInvocation(context, name);
				Data[] args = new Data[call.arguments().length];
				boolean allData = true;
				for (int i = 0; i != args.length; ++i) {
					Expr arg = call.arguments()[i];
					if (arg instanceof Expr.Pure) {
						args[i] = ((Expr.Pure) arg).data();
					} else {
						allData = false;
					}
				}
				if (allData) {
					return new Expr.Pure(new Data.PureCall(name.text, args, sourceAttr(save - 1, index - 1)));
				}
				return call;
			}
			return parseInvocation(context, name);
		} else if (lookahead.text.equals("-") && (index + 1) < tokens.size()
				&& !tokens.get(index + 1).kind.isLiteral()) {
			// negation of an arbitrary operand
			int start = index;
			match("-");
			Expr operand = parseControlFactor(context);
			Expr zero = new Expr.Pure(new Data.Literal(NumericValue.ZERO, sourceAttr(start, start)));
			return new Expr.Arithmetic(NumericValue.Operator.SUB, zero, operand, sourceAttr(start, index - 1));
		}
		return new Expr.Pure(parseDataTerm(context));
	}

	/**
	 * Parse the arguments of a call to a named function in Control position.
	 *
	 * @return
	 */
	private Expr.Invoke parseInvocation(Context context, Token name) {
		int start = index - 1;
		Signature sig = signatures.get(name.text);
		if (sig == null && !name.text.equals(PRINT)) {
			syntaxError("unknown function " + name.text, name.text, name);
		}
		match("(");
		ArrayList<Expr> args = new ArrayList<>();
		while (index < tokens.size() && !tokens.get(index).text.equals(")")) {
			if (!args.isEmpty()) {
				match(",");
			}
			args.add(parseControlExpression(context));
		}
		match(")");
		if (sig != null) {
			checkArity(name, sig, args.size());
		}
		return new Expr.Invoke(name.text, args.toArray(new Expr[args.size()]), sourceAttr(start, index - 1));
	}

	// ================================================================================
	// Data Language
	// ================================================================================

	/**
	 * Parse a guard, which compares two Data expressions.
	 *
	 * @return
	 */
	public Guard parseGuard(Context context) {
		int start = index;
		Data lhs = parseDataExpression(context);
		checkNotEof();
		Token op = tokens.get(index);
		Guard.Comparator comparator = op.kind == Kind.OPERATOR ? Guard.Comparator.fromSymbol(op.text) : null;
		if (comparator == null) {
			syntaxError("expecting comparison, found '" + op.text + "'", op);
		}
		index = index + 1;
		Data rhs = parseDataExpression(context);
		return new Guard(comparator, lhs, rhs, sourceAttr(start, index - 1));
	}

	/**
	 * Parse an expression of the Data language, of the form:
	 *
	 * <pre>
	 * DExpr ::= DTerm ('+' DTerm)*
	 * </pre>
	 *
	 * @return
	 */
	public Data parseDataExpression(Context context) {
		int start = index;
		Data lhs = parseDataTerm(context);
		while (lookaheadIs("+")) {
			match("+");
			Data rhs = parseDataTerm(context);
			lhs = new Data.Add(lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	/**
	 * Parse a term of the Data language. Only literals, variables, pure calls and
	 * bracketed Data expressions are permitted here.
	 *
	 * @return
	 */
	public Data parseDataTerm(Context context) {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead.kind.isLiteral()) {
			index = index + 1;
			return new Data.Literal(((Literal) lookahead).value, sourceAttr(start, start));
		} else if (lookahead.text.equals("-") && (index + 1) < tokens.size()
				&& tokens.get(index + 1).kind.isLiteral()) {
			// negative literal
			index = index + 2;
			Literal l = (Literal) tokens.get(index - 1);
			NumericValue value = l.value.negate();
			if (l.kind == Kind.COMPLEX && (l.text.indexOf('+', 1) > 0 || l.text.indexOf('-', 1) > 0)) {
				// The sign only applies to the real part of "a+bi"
				NumericValue.Complex c = (NumericValue.Complex) l.value;
				value = new NumericValue.Complex(0.0 - c.real(), c.imaginary());
			}
			return new Data.Literal(value, sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("(")) {
			match("(");
			Data e = parseDataExpression(context);
			match(")");
			return e;
		} else if (lookahead.kind == Kind.IDENTIFIER) {
			Token name = matchIdentifier();
			if (lookaheadIs("(")) {
				return parsePureCall(context, name);
			}
			return new Data.Identifier(name.text, sourceAttr(start, start));
		} else if (lookahead.kind == Kind.KEYWORD) {
			syntaxError("'" + lookahead.text + "' is not permitted in data position", lookahead);
		}
		syntaxError("expecting data expression, found '" + lookahead.text + "'", lookahead);
		return null; // unreachable
	}

	/**
	 * Parse a call from Data position. This must resolve to a function declared
	 * <code>@pure</code>.
	 *
	 * @return
	 */
	private Data.PureCall parsePureCall(Context context, Token name) {
		int start = index - 1;
		Signature sig = signatures.get(name.text);
		if (name.text.equals(PRINT)) {
			syntaxError("I/O is not permitted in data position: " + name.text, name.text, name);
		} else if (sig == null) {
			syntaxError("unknown function " + name.text + " in data position", name.text, name);
		} else if (!sig.pure) {
			syntaxError("impure function " + name.text + " called in data position", name.text, name);
		}
		match("(");
		ArrayList<Data> args = new ArrayList<>();
		while (index < tokens.size() && !tokens.get(index).text.equals(")")) {
			if (!args.isEmpty()) {
				match(",");
			}
			args.add(parseDataExpression(context));
		}
		match(")");
		checkArity(name, sig, args.size());
		return new Data.PureCall(name.text, args.toArray(new Data[args.size()]), sourceAttr(start, index - 1));
	}

	// ================================================================================
	// Reversible Language
	// ================================================================================

	/**
	 * Parse a reverse block, of the form:
	 *
	 * <pre>
	 * 'reverse' '{' RStmt* '}'
	 * </pre>
	 *
	 * @return
	 */
	public ReverseBlock parseReverseBlock(Context context) {
		int start = index;
		matchKeyword("reverse");
		Reversible[] stmts = parseReversibleBlock(context);
		ReverseBlock block = new ReverseBlock(reverseBlocks.size(), stmts, sourceAttr(start, index - 1));
		reverseBlocks.add(block);
		return block;
	}

	private Reversible[] parseReversibleBlock(Context context) {
		match("{");
		ArrayList<Reversible> stmts = new ArrayList<>();
		while (index < tokens.size() && !tokens.get(index).text.equals("}")) {
			stmts.add(parseReversibleStatement(context));
			matchOptional(";");
		}
		match("}");
		return stmts.toArray(new Reversible[stmts.size()]);
	}

	public Reversible parseReversibleStatement(Context context) {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("if")) {
			matchKeyword("if");
			Guard guard = parseGuard(context);
			Reversible[] trueBranch = parseReversibleBlock(context);
			Reversible[] falseBranch = new Reversible[0];
			if (lookaheadIs("else")) {
				matchKeyword("else");
				falseBranch = parseReversibleBlock(context);
			}
			return new Reversible.Conditional(guard, trueBranch, falseBranch, sourceAttr(start, index - 1));
		} else if (lookahead.kind == Kind.IDENTIFIER) {
			Token name = matchIdentifier();
			checkNotEof();
			Token op = tokens.get(index);
			if (op.text.equals("+=") || op.text.equals("-=")) {
				index = index + 1;
				Data operand = parseDataExpression(context);
				return new Reversible.Increment(name.text, op.text.equals("-="), operand,
						sourceAttr(start, index - 1));
			} else if (op.text.equals("=")) {
				syntaxError("plain assignment is not reversible, use '+=' or '-='", name.text, op);
			} else if (op.text.equals("(")) {
				syntaxError("calls are not permitted in a reverse block: " + name.text, name.text, name);
			}
			syntaxError("expecting '+=' or '-=', found '" + op.text + "'", op);
		}
		syntaxError("'" + lookahead.text + "' is not permitted in a reverse block", lookahead);
		return null; // unreachable
	}

	// ================================================================================
	// Helpers
	// ================================================================================

	private String parseQualifiedName() {
		String name = matchIdentifier().text;
		while (lookaheadIs(".")) {
			match(".");
			name += "." + matchIdentifier().text;
		}
		return name;
	}

	private void checkArity(Token name, Signature sig, int count) {
		if (sig.arity >= 0 && sig.arity != count) {
			syntaxError("function " + name.text + " expects " + sig.arity + " argument(s), found " + count,
					name.text, name);
		}
	}

	private boolean lookaheadIs(String text) {
		return index < tokens.size() && tokens.get(index).text.equals(text);
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
			throw new ParseError("unexpected end-of-file", filename, source, end, end);
		}
	}

	private void matchOptional(String op) {
		if (lookaheadIs(op)) {
			index = index + 1;
		}
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	private Token match(String... options) {
		checkNotEof();
		Token t = tokens.get(index);
		for (int i = 0; i != options.length; ++i) {
			if (t.text.equals(options[i])) {
				index = index + 1;
				return t;
			}
		}
		String s = "";
		for (int i = 0; i != options.length; ++i) {
			if (i != 0) {
				s += " or ";
			}
			s += "'" + options[i] + "'";
		}
		syntaxError("expecting " + s + ", found '" + t.text + "'", t);
		return null;
	}

	private Token matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t.kind == Kind.IDENTIFIER) {
			index = index + 1;
			return t;
		}
		syntaxError("identifier expected, found '" + t.text + "'", t);
		return null; // unreachable.
	}

	private Token matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t.kind == Kind.KEYWORD && t.text.equals(keyword)) {
			index = index + 1;
			return t;
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(Math.max(start, end));
		return new Attribute.Source(t1.start, t2.end(), t1.line);
	}

	private void syntaxError(String msg, Token t) {
		throw new ParseError(msg, filename, source, t.start, t.end());
	}

	private void syntaxError(String msg, String identifier, Token t) {
		throw new ParseError(msg, identifier, filename, source, t.start, t.end());
	}

	/**
	 * The name, purity and arity of a declared function, as determined before its
	 * body is parsed.
	 */
	private static final class Signature {
		private final int index;
		private final boolean pure;
		private final int arity;

		public Signature(int index, boolean pure, int arity) {
			this.index = index;
			this.pure = pure;
			this.arity = arity;
		}
	}

	/**
	 * Provides information about the current context in which the parser is
	 * operating.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Context {
		/**
		 * Name of the enclosing function, or <code>null</code> at the top level.
		 */
		private final String function;
		/**
		 * indicates the set of declared variables within the current context;
		 */
		private final Set<String> environment;

		public Context(String function) {
			this.function = function;
			this.environment = new HashSet<>();
		}

		public boolean isFunction() {
			return function != null;
		}

		/**
		 * Check whether a given variable is declared in this context or not.
		 *
		 * @param variable
		 * @return
		 */
		public boolean isDeclared(String variable) {
			return environment.contains(variable);
		}

		public void declare(String variable) {
			environment.add(variable);
		}
	}
}
