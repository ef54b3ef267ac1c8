// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wpgen.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import wpgen.core.Logic.BinaryOperator;
import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.util.FreeVariables;

/**
 * Writes expressions in SMT-LIB 2 syntax. Integer variables and literals are
 * written over the theory of integers, with each variable constrained to the
 * range of its type. Truncating division and remainder are defined on top of
 * the builtin (euclidean) ones, and the bitwise operators are left
 * uninterpreted. Within a script, every variable is given the prefix
 * <code>v!</code>, so <code>abs</code> is written <code>v!abs</code>.
 */
public class SmtLibPrinter {
	private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[a-zA-Z~!@$%^&*_+=<>.?/\\-][a-zA-Z0-9~!@$%^&*_+=<>.?/\\-]*");

	private static final String[] PRELUDE = {
			"(define-fun tdiv ((a Int) (b Int)) Int (ite (= (>= a 0) (> b 0)) (div (abs a) (abs b)) (- (div (abs a) (abs b)))))",
			"(define-fun trem ((a Int) (b Int)) Int (- a (* b (tdiv a b))))",
			"(declare-fun bitand (Int Int) Int)",
			"(declare-fun bitor (Int Int) Int)",
			"(declare-fun bitxor (Int Int) Int)",
			"(declare-fun bitnot (Int) Int)",
			"(declare-fun shl (Int Int) Int)",
			"(declare-fun shr (Int Int) Int)"
	};

	/**
	 * Prefix given to every variable in a script, so that no variable can clash
	 * with a builtin symbol (e.g. <code>abs</code>) or a prelude function (e.g.
	 * <code>tdiv</code>).
	 */
	private static final String VARIABLE_PREFIX = "v!";

	private final PrintWriter out;

	/**
	 * Whether or not variables are prefixed. This is disabled only when rendering
	 * standalone terms for diagnostics.
	 */
	private final boolean prefixed;

	public SmtLibPrinter(OutputStream output) {
		this(output, true);
	}

	private SmtLibPrinter(OutputStream output, boolean prefixed) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
		this.prefixed = prefixed;
	}

	public void flush() {
		out.flush();
	}

	/**
	 * Write a complete script asking whether the given formula is satisfiable.
	 *
	 * @param formula
	 */
	public void write(Expr formula) {
		for (String line : PRELUDE) {
			println(line);
		}
		for (Expr.VariableMapping v : FreeVariables.of(formula)) {
			writeDeclaration(v);
		}
		out.print("(assert ");
		writeExpression(formula);
		println(")");
		println("(check-sat)");
		out.flush();
	}

	private void writeDeclaration(Expr.VariableMapping v) {
		String name = symbol(v.getName());
		Type type = v.getType();
		if (type == Type.BOOL) {
			println("(declare-const " + name + " Bool)");
		} else {
			println("(declare-const " + name + " Int)");
			println("(assert (<= " + integer(type.getMinimum()) + " " + name + " " + integer(type.getMaximum()) + "))");
		}
	}

	public void writeExpression(Expr e) {
		if (e instanceof Expr.BooleanLiteral) {
			out.print(((Expr.BooleanLiteral) e).getValue() ? "true" : "false");
		} else if (e instanceof Expr.BitVector) {
			out.print(integer(((Expr.BitVector) e).getValue()));
		} else if (e instanceof Expr.VariableMapping) {
			out.print(symbol(((Expr.VariableMapping) e).getName()));
		} else if (e instanceof Expr.UnaryExpression) {
			writeUnaryExpression((Expr.UnaryExpression) e);
		} else if (e instanceof Expr.BinaryExpression) {
			writeBinaryExpression((Expr.BinaryExpression) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeUnaryExpression(Expr.UnaryExpression e) {
		switch (e.getOperator()) {
			case NOT:
				out.print("(not ");
				break;
			case BITWISE_NOT:
				out.print("(bitnot ");
				break;
			case NEGATION:
				out.print("(- ");
				break;
			default:
				throw new IllegalArgumentException("unknown unary operator " + e.getOperator());
		}
		writeExpression(e.getOperand());
		out.print(")");
	}

	private void writeBinaryExpression(Expr.BinaryExpression e) {
		if (e.getOperator() == BinaryOperator.NOT_EQUAL) {
			out.print("(not (= ");
			writeExpression(e.getLeftHandSide());
			out.print(" ");
			writeExpression(e.getRightHandSide());
			out.print("))");
			return;
		}
		out.print("(");
		out.print(operator(e));
		out.print(" ");
		writeExpression(e.getLeftHandSide());
		out.print(" ");
		writeExpression(e.getRightHandSide());
		out.print(")");
	}

	private static String operator(Expr.BinaryExpression e) {
		switch (e.getOperator()) {
			case ADDITION:
				return "+";
			case SUBTRACTION:
				return "-";
			case MULTIPLICATION:
				return "*";
			case DIVISION:
				return "tdiv";
			case MODULO:
				return "trem";
			case BITWISE_AND:
				return "bitand";
			case BITWISE_OR:
				return "bitor";
			case BITWISE_XOR:
				return "bitxor";
			case LEFT_SHIFT:
				return "shl";
			case RIGHT_SHIFT:
				return "shr";
			case LESS_THAN:
				return "<";
			case LESS_THAN_OR_EQUAL:
				return "<=";
			case GREATER_THAN:
				return ">";
			case GREATER_THAN_OR_EQUAL:
				return ">=";
			case EQUAL:
				return "=";
			case AND:
				return "and";
			case OR:
				return "or";
			case IMPLICATION:
				return "=>";
			default:
				throw new IllegalArgumentException("unknown binary operator " + e.getOperator());
		}
	}

	private void println(String line) {
		out.print(line);
		out.print('\n');
	}

	private static String integer(BigInteger i) {
		if (i.signum() < 0) {
			return "(- " + i.negate() + ")";
		}
		return i.toString();
	}

	private String symbol(String name) {
		if (prefixed) {
			name = VARIABLE_PREFIX + name;
		}
		if (SIMPLE_SYMBOL.matcher(name).matches()) {
			return name;
		}
		return "|" + name + "|";
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SmtLibPrinter p = new SmtLibPrinter(buf, false);
		p.writeExpression(expr);
		p.flush();
		return buf.toString(StandardCharsets.UTF_8);
	}

	/**
	 * Render a complete satisfiability script for the given formula.
	 *
	 * @param formula
	 * @return
	 */
	public static String toScript(Expr formula) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		new SmtLibPrinter(buf).write(formula);
		return buf.toString(StandardCharsets.UTF_8);
	}
}
