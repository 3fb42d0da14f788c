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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import juliatheviper.util.SyntacticElement;

/**
 * The abstract syntax of Julia the Viper. Programs are built from two disjoint
 * families of nodes:
 *
 * <ul>
 * <li><b>Data</b> nodes (literals, variable references, addition and calls to
 * pure functions). Every constructor of a Data node accepts only other Data
 * nodes, numeric values and names. Hence, there is no way to build a Data node
 * which contains a statement.</li>
 * <li><b>Control</b> nodes (assignments, conditionals, loops, returns, calls,
 * function declarations, output and reverse blocks), which may contain Data
 * nodes but never the other way around.</li>
 * </ul>
 *
 * Reverse blocks use a third, more restricted family (<code>Reversible</code>)
 * which admits only increments, decrements and conditionals over Data.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int DATA_literal = 0;
	public final static int DATA_identifier = 1;
	public final static int DATA_add = 2;
	public final static int DATA_purecall = 3;

	public final static int EXPR_data = 10;
	public final static int EXPR_arithmetic = 11;
	public final static int EXPR_invoke = 12;

	public final static int STMT_assignment = 20;
	public final static int STMT_if = 21;
	public final static int STMT_while = 22;
	public final static int STMT_for = 23;
	public final static int STMT_return = 24;
	public final static int STMT_fndecl = 25;
	public final static int STMT_call = 26;
	public final static int STMT_print = 27;
	public final static int STMT_reverse = 28;

	public final static int REV_increment = 40;
	public final static int REV_conditional = 41;

	/**
	 * A node of the total Data language.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Data extends SyntacticElement.Impl {
		private final int opcode;

		// Only nodes declared here may extend this class
		Data(int opcode, Attribute... attributes) {
			super(attributes);
			this.opcode = opcode;
		}

		/**
		 * Get the opcode associated with the syntactic form of this node.
		 *
		 * @return
		 */
		public int getOpcode() {
			return opcode;
		}

		/**
		 * A numeric literal in any of the seven literal forms.
		 */
		public static final class Literal extends Data {
			private final NumericValue value;

			public Literal(NumericValue value, Attribute... attributes) {
				super(DATA_literal, attributes);
				this.value = value;
			}

			public NumericValue value() {
				return value;
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		/**
		 * A reference to a bound variable.
		 */
		public static final class Identifier extends Data {
			private final String name;

			public Identifier(String name, Attribute... attributes) {
				super(DATA_identifier, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * The only operator of the Data language.
		 *
		 * <pre>
		 * e1 + e2
		 * </pre>
		 */
		public static final class Add extends Data {
			private final Data lhs;
			private final Data rhs;

			public Add(Data lhs, Data rhs, Attribute... attributes) {
				super(DATA_add, attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Data leftOperand() {
				return lhs;
			}

			public Data rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return "(" + lhs + " + " + rhs + ")";
			}
		}

		/**
		 * A call to a function declared <code>@pure</code>, whose arguments are
		 * themselves Data.
		 */
		public static final class PureCall extends Data {
			private final String name;
			private final Data[] arguments;

			public PureCall(String name, Data[] arguments, Attribute... attributes) {
				super(DATA_purecall, attributes);
				this.name = name;
				this.arguments = arguments;
			}

			public String name() {
				return name;
			}

			public int size() {
				return arguments.length;
			}

			public Data get(int i) {
				return arguments[i];
			}

			public Data[] arguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return name + "(" + join(arguments) + ")";
			}
		}
	}

	/**
	 * An expression in Control position (e.g. the right-hand side of an
	 * assignment). This extends the Data language with subtraction,
	 * multiplication, division and calls to arbitrary functions.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Expr extends SyntacticElement.Impl {
		private final int opcode;

		Expr(int opcode, Attribute... attributes) {
			super(attributes);
			this.opcode = opcode;
		}

		public int getOpcode() {
			return opcode;
		}

		/**
		 * A Data expression used in Control position.
		 */
		public static final class Pure extends Expr {
			private final Data data;

			public Pure(Data data) {
				super(EXPR_data, data.attributes());
				this.data = data;
			}

			public Data data() {
				return data;
			}

			@Override
			public String toString() {
				return data.toString();
			}
		}

		/**
		 * An arithmetic operation only permitted in Control position.
		 */
		public static final class Arithmetic extends Expr {
			private final NumericValue.Operator operator;
			private final Expr lhs;
			private final Expr rhs;

			public Arithmetic(NumericValue.Operator operator, Expr lhs, Expr rhs, Attribute... attributes) {
				super(EXPR_arithmetic, attributes);
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public NumericValue.Operator operator() {
				return operator;
			}

			public Expr leftOperand() {
				return lhs;
			}

			public Expr rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return "(" + lhs + " " + operator + " " + rhs + ")";
			}
		}

		/**
		 * A call to any declared function from Control position.
		 */
		public static final class Invoke extends Expr {
			private final String name;
			private final Expr[] arguments;

			public Invoke(String name, Expr[] arguments, Attribute... attributes) {
				super(EXPR_invoke, attributes);
				this.name = name;
				this.arguments = arguments;
			}

			public String name() {
				return name;
			}

			public Expr[] arguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return name + "(" + join(arguments) + ")";
			}
		}
	}

	/**
	 * A comparison between two Data expressions, as used for the guard of a
	 * conditional or loop.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Guard extends SyntacticElement.Impl {
		public enum Comparator {
			EQ("=="), LT("<"), GT(">"), LTEQ("<="), GTEQ(">=");

			private final String symbol;

			private Comparator(String symbol) {
				this.symbol = symbol;
			}

			public static Comparator fromSymbol(String symbol) {
				for (Comparator c : values()) {
					if (c.symbol.equals(symbol)) {
						return c;
					}
				}
				return null;
			}

			@Override
			public String toString() {
				return symbol;
			}
		}

		private final Comparator comparator;
		private final Data lhs;
		private final Data rhs;

		public Guard(Comparator comparator, Data lhs, Data rhs, Attribute... attributes) {
			super(attributes);
			this.comparator = comparator;
			this.lhs = lhs;
			this.rhs = rhs;
		}

		public Comparator comparator() {
			return comparator;
		}

		public Data leftOperand() {
			return lhs;
		}

		public Data rightOperand() {
			return rhs;
		}

		@Override
		public String toString() {
			return lhs + " " + comparator + " " + rhs;
		}
	}

	/**
	 * A statement of the (Turing-complete) Control language.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Control extends SyntacticElement {

		public int getOpcode();

		public static abstract class AbstractControl extends SyntacticElement.Impl implements Control {
			private final int opcode;

			public AbstractControl(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * Represents an assignment such as the following:
		 *
		 * <pre>
		 * x = e
		 * </pre>
		 */
		public final class Assignment extends AbstractControl {
			private final String variable;
			private final Expr rhs;

			public Assignment(String variable, Expr rhs, Attribute... attributes) {
				super(STMT_assignment, attributes);
				this.variable = variable;
				this.rhs = rhs;
			}

			public String variable() {
				return variable;
			}

			public Expr rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return variable + " = " + rhs;
			}
		}

		/**
		 * Represents a conditional with an optional else branch.
		 */
		public final class If extends AbstractControl {
			private final Guard guard;
			private final Block trueBlock;
			private final Block falseBlock;

			public If(Guard guard, Block trueBlock, Block falseBlock, Attribute... attributes) {
				super(STMT_if, attributes);
				this.guard = guard;
				this.trueBlock = trueBlock;
				this.falseBlock = falseBlock;
			}

			public Guard guard() {
				return guard;
			}

			public Block trueBranch() {
				return trueBlock;
			}

			/**
			 * Get the else branch, which may be <code>null</code>.
			 *
			 * @return
			 */
			public Block falseBranch() {
				return falseBlock;
			}

			@Override
			public String toString() {
				String r = "if " + guard + " " + trueBlock;
				return falseBlock == null ? r : r + " else " + falseBlock;
			}
		}

		public final class While extends AbstractControl {
			private final Guard guard;
			private final Block body;

			public While(Guard guard, Block body, Attribute... attributes) {
				super(STMT_while, attributes);
				this.guard = guard;
				this.body = body;
			}

			public Guard guard() {
				return guard;
			}

			public Block body() {
				return body;
			}

			@Override
			public String toString() {
				return "while " + guard + " " + body;
			}
		}

		/**
		 * Represents a counting loop over a half-open range:
		 *
		 * <pre>
		 * for i in e1..e2 { ... }
		 * </pre>
		 */
		public final class For extends AbstractControl {
			private final String variable;
			private final Data from;
			private final Data to;
			private final Block body;

			public For(String variable, Data from, Data to, Block body, Attribute... attributes) {
				super(STMT_for, attributes);
				this.variable = variable;
				this.from = from;
				this.to = to;
				this.body = body;
			}

			public String variable() {
				return variable;
			}

			public Data from() {
				return from;
			}

			public Data to() {
				return to;
			}

			public Block body() {
				return body;
			}

			@Override
			public String toString() {
				return "for " + variable + " in " + from + ".." + to + " " + body;
			}
		}

		public final class Return extends AbstractControl {
			private final Expr operand;

			public Return(Expr operand, Attribute... attributes) {
				super(STMT_return, attributes);
				this.operand = operand;
			}

			/**
			 * Get the returned expression, which is <code>null</code> for a bare
			 * <code>return</code>.
			 *
			 * @return
			 */
			public Expr operand() {
				return operand;
			}

			@Override
			public String toString() {
				return operand == null ? "return" : "return " + operand;
			}
		}

		/**
		 * The position at which a function was declared. Functions are entered into
		 * the symbol table at parse time, hence executing a declaration has no
		 * effect.
		 */
		public final class FunctionDecl extends AbstractControl {
			private final FunctionDef function;

			public FunctionDecl(FunctionDef function, Attribute... attributes) {
				super(STMT_fndecl, attributes);
				this.function = function;
			}

			public FunctionDef function() {
				return function;
			}

			@Override
			public String toString() {
				return function.toString();
			}
		}

		/**
		 * A call evaluated for its effect, with the result discarded.
		 */
		public final class Call extends AbstractControl {
			private final Expr.Invoke invocation;

			public Call(Expr.Invoke invocation, Attribute... attributes) {
				super(STMT_call, attributes);
				this.invocation = invocation;
			}

			public Expr.Invoke invocation() {
				return invocation;
			}

			@Override
			public String toString() {
				return invocation.toString();
			}
		}

		/**
		 * The built-in output statement <code>print(e1, ..., en)</code>.
		 */
		public final class Print extends AbstractControl {
			private final Expr[] operands;

			public Print(Expr[] operands, Attribute... attributes) {
				super(STMT_print, attributes);
				this.operands = operands;
			}

			public Expr[] operands() {
				return operands;
			}

			@Override
			public String toString() {
				return "print(" + join(operands) + ")";
			}
		}
	}

	/**
	 * A sequence of Control statements enclosed in braces.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Block extends SyntacticElement.Impl {
		private final Control[] statements;

		public Block(Control[] statements, Attribute... attributes) {
			super(attributes);
			this.statements = statements;
		}

		public int size() {
			return statements.length;
		}

		public Control get(int i) {
			return statements[i];
		}

		public Control[] toArray() {
			return statements;
		}

		@Override
		public String toString() {
			String contents = "";
			for (int i = 0; i != statements.length; ++i) {
				if (i != 0) {
					contents += " ; ";
				}
				contents += statements[i];
			}
			return "{ " + contents + " }";
		}
	}

	/**
	 * A statement permitted inside a reverse block. There are exactly two forms,
	 * neither of which can embed a plain assignment or an impure call.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Reversible extends SyntacticElement.Impl {
		private final int opcode;

		Reversible(int opcode, Attribute... attributes) {
			super(attributes);
			this.opcode = opcode;
		}

		public int getOpcode() {
			return opcode;
		}

		/**
		 * Represents <code>x += e</code> or <code>x -= e</code>.
		 */
		public static final class Increment extends Reversible {
			private final String variable;
			private final boolean decrement;
			private final Data operand;

			public Increment(String variable, boolean decrement, Data operand, Attribute... attributes) {
				super(REV_increment, attributes);
				this.variable = variable;
				this.decrement = decrement;
				this.operand = operand;
			}

			public String variable() {
				return variable;
			}

			public boolean isDecrement() {
				return decrement;
			}

			public Data operand() {
				return operand;
			}

			@Override
			public String toString() {
				return variable + (decrement ? " -= " : " += ") + operand;
			}
		}

		/**
		 * A conditional whose branches are themselves reversible.
		 */
		public static final class Conditional extends Reversible {
			private final Guard guard;
			private final Reversible[] trueBranch;
			private final Reversible[] falseBranch;

			public Conditional(Guard guard, Reversible[] trueBranch, Reversible[] falseBranch,
					Attribute... attributes) {
				super(REV_conditional, attributes);
				this.guard = guard;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Guard guard() {
				return guard;
			}

			public Reversible[] trueBranch() {
				return trueBranch;
			}

			public Reversible[] falseBranch() {
				return falseBranch;
			}

			@Override
			public String toString() {
				return "if " + guard + " { " + join(trueBranch) + " } else { " + join(falseBranch) + " }";
			}
		}
	}

	/**
	 * Represents a block of reversible statements:
	 *
	 * <pre>
	 * reverse { x += 10; x += 5 }
	 * </pre>
	 *
	 * Executing the block forward records each delta applied, such that it can
	 * subsequently be rolled back.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class ReverseBlock extends Control.AbstractControl {
		private final int index;
		private final Reversible[] statements;

		public ReverseBlock(int index, Reversible[] statements, Attribute... attributes) {
			super(STMT_reverse, attributes);
			this.index = index;
			this.statements = statements;
		}

		/**
		 * The position of this block amongst all reverse blocks of the program (in
		 * source order).
		 *
		 * @return
		 */
		public int index() {
			return index;
		}

		public int size() {
			return statements.length;
		}

		public Reversible get(int i) {
			return statements[i];
		}

		public Reversible[] toArray() {
			return statements;
		}

		@Override
		public String toString() {
			return "reverse { " + join(statements) + " }";
		}
	}

	/**
	 * A declared parameter, with an optional kind annotation.
	 */
	public static final class Parameter extends SyntacticElement.Impl {
		private final String name;
		private final NumericValue.Kind kind;

		public Parameter(String name, NumericValue.Kind kind, Attribute... attributes) {
			super(attributes);
			this.name = name;
			this.kind = kind;
		}

		public String name() {
			return name;
		}

		/**
		 * The declared kind, or <code>null</code> if unannotated.
		 *
		 * @return
		 */
		public NumericValue.Kind kind() {
			return kind;
		}

		@Override
		public String toString() {
			return kind == null ? name : name + ": " + kind;
		}
	}

	/**
	 * Represents a function declaration. The <code>pure</code> flag is written by
	 * the programmer, whilst <code>total</code> can only be established by the
	 * totality checker.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class FunctionDef extends SyntacticElement.Impl {
		private final int index;
		private final String name;
		private final Parameter[] parameters;
		private final NumericValue.Kind returnKind;
		private final boolean pure;
		private final Block body;
		private volatile boolean total;

		public FunctionDef(int index, String name, Parameter[] parameters, NumericValue.Kind returnKind, boolean pure,
				Block body, Attribute... attributes) {
			super(attributes);
			this.index = index;
			this.name = name;
			this.parameters = parameters;
			this.returnKind = returnKind;
			this.pure = pure;
			this.body = body;
		}

		/**
		 * Position of this function in its symbol table.
		 *
		 * @return
		 */
		public int index() {
			return index;
		}

		public String name() {
			return name;
		}

		public Parameter[] parameters() {
			return parameters;
		}

		/**
		 * The declared kind of the return value, or <code>null</code> if
		 * unannotated.
		 *
		 * @return
		 */
		public NumericValue.Kind returnKind() {
			return returnKind;
		}

		public boolean isPure() {
			return pure;
		}

		/**
		 * Determine whether this function has been proven total by the checker.
		 *
		 * @return
		 */
		public boolean isTotal() {
			return total;
		}

		public Block body() {
			return body;
		}

		void markTotal() {
			this.total = true;
		}

		@Override
		public String toString() {
			String r = (pure ? "@pure " : "") + "fn " + name + "(" + join(parameters) + ")";
			return returnKind == null ? r : r + ": " + returnKind;
		}
	}

	/**
	 * The table of functions declared by a program. Functions are addressed both
	 * by name and by index.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class SymbolTable {
		private final List<FunctionDef> functions;
		private final Map<String, FunctionDef> byName;

		public SymbolTable(List<FunctionDef> functions) {
			this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
			this.byName = new HashMap<>();
			for (FunctionDef f : functions) {
				byName.put(f.name(), f);
			}
		}

		/**
		 * Get the function with a given name, or <code>null</code> if no such
		 * function is declared.
		 *
		 * @param name
		 * @return
		 */
		public FunctionDef get(String name) {
			return byName.get(name);
		}

		public FunctionDef get(int index) {
			return functions.get(index);
		}

		public int size() {
			return functions.size();
		}

		public List<FunctionDef> functions() {
			return functions;
		}
	}

	/**
	 * The result of parsing a source file. A program is immutable once
	 * constructed and may be shared freely between interpreter sessions.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Program {
		private final String filename;
		private final String source;
		private final String module;
		private final List<String> imports;
		private final Control[] statements;
		private final SymbolTable functions;
		private final List<ReverseBlock> reverseBlocks;

		public Program(String filename, String source, String module, List<String> imports, Control[] statements,
				SymbolTable functions, List<ReverseBlock> reverseBlocks) {
			this.filename = filename;
			this.source = source;
			this.module = module;
			this.imports = Collections.unmodifiableList(new ArrayList<>(imports));
			this.statements = statements;
			this.functions = functions;
			this.reverseBlocks = Collections.unmodifiableList(new ArrayList<>(reverseBlocks));
		}

		public String filename() {
			return filename;
		}

		public String source() {
			return source;
		}

		/**
		 * The name given in a <code>module</code> header, or <code>null</code>.
		 *
		 * @return
		 */
		public String module() {
			return module;
		}

		/**
		 * The modules named by <code>import</code> headers. These are recorded but
		 * never resolved.
		 *
		 * @return
		 */
		public List<String> imports() {
			return imports;
		}

		/**
		 * The top-level statements, in source order.
		 *
		 * @return
		 */
		public List<Control> statements() {
			return Collections.unmodifiableList(Arrays.asList(statements));
		}

		public SymbolTable functions() {
			return functions;
		}

		/**
		 * Every reverse block in the program (including those within functions), in
		 * source order.
		 *
		 * @return
		 */
		public List<ReverseBlock> reverseBlocks() {
			return reverseBlocks;
		}
	}

	private static String join(Object[] items) {
		String r = "";
		for (int i = 0; i != items.length; ++i) {
			if (i != 0) {
				r += ", ";
			}
			r += items[i];
		}
		return r;
	}
}
