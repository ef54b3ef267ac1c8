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
package wpgen.util;

import java.util.ArrayList;
import java.util.List;

import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.WpException;

/**
 * Maps declared type text onto the semantic types of the logic, and determines
 * the type at which an expression is evaluated.
 */
public class Types {

	/**
	 * Resolve declared type text such as <code>i32</code> or <code>bool</code>. A
	 * shared or mutable reference resolves to the type it refers to.
	 *
	 * @param text
	 * @return
	 * @throws WpException.TypeResolution if the text names no supported type.
	 */
	public static Type fromText(String text) {
		String t = text.trim();
		if (t.startsWith("&mut ")) {
			return fromText(t.substring(5));
		} else if (t.startsWith("&")) {
			return fromText(t.substring(1));
		}
		Type type = lookup(t);
		if (type == null) {
			throw new WpException.TypeResolution(text);
		}
		return type;
	}

	/**
	 * Resolve the kind of an integer literal (e.g. <code>u8</code>).
	 *
	 * @param kind
	 * @return
	 * @throws WpException.UnsupportedConstruct for kinds outside the supported
	 *                                          widths, such as <code>i128</code>.
	 */
	public static Type fromKind(String kind) {
		Type type = lookup(kind.trim());
		if (type == null || type == Type.BOOL) {
			throw new WpException.UnsupportedConstruct("unsupported integer literal kind \"" + kind + "\"");
		}
		return type;
	}

	/**
	 * Determine the integer type of the given width and signedness.
	 *
	 * @param width
	 * @param signed
	 * @return
	 */
	public static Type ofWidth(int width, boolean signed) {
		switch (width) {
			case 8:
				return signed ? Type.I8 : Type.U8;
			case 16:
				return signed ? Type.I16 : Type.U16;
			case 32:
				return signed ? Type.I32 : Type.U32;
			case 64:
				return signed ? Type.I64 : Type.U64;
			default:
				throw new WpException.UnsupportedConstruct("unsupported bit-vector width " + width);
		}
	}

	public static boolean isTuple(String text) {
		String t = text.trim();
		return t.startsWith("(") && t.endsWith(")") && t.length() > 2;
	}

	/**
	 * Extract the text of the <code>index</code>th element of a tuple type, e.g.
	 * element 1 of <code>(i32, bool)</code> is <code>bool</code>.
	 *
	 * @param text
	 * @param index
	 * @return
	 */
	public static String tupleElement(String text, int index) {
		if (!isTuple(text)) {
			throw new WpException.TypeResolution(text);
		}
		String t = text.trim();
		List<String> elements = splitTopLevel(t.substring(1, t.length() - 1));
		if (index < 0 || index >= elements.size()) {
			throw new WpException.UnsupportedConstruct("no field " + index + " in tuple type " + text);
		}
		return elements.get(index);
	}

	/**
	 * Determine the type at which a given expression is evaluated. Relational,
	 * logical and <code>NOT</code> expressions are boolean; every other composite
	 * takes the type of its (left) operand.
	 *
	 * @param expr
	 * @return
	 */
	public static Type evaluationType(Expr expr) {
		if (expr instanceof Expr.BooleanLiteral) {
			return Type.BOOL;
		} else if (expr instanceof Expr.BitVector) {
			Expr.BitVector bv = (Expr.BitVector) expr;
			return ofWidth(bv.getWidth(), bv.isSigned());
		} else if (expr instanceof Expr.VariableMapping) {
			return ((Expr.VariableMapping) expr).getType();
		} else if (expr instanceof Expr.UnaryExpression) {
			Expr.UnaryExpression u = (Expr.UnaryExpression) expr;
			switch (u.getOperator()) {
				case NOT:
					return Type.BOOL;
				default:
					return evaluationType(u.getOperand());
			}
		} else if (expr instanceof Expr.BinaryExpression) {
			Expr.BinaryExpression b = (Expr.BinaryExpression) expr;
			if (b.getOperator().isRelational() || b.getOperator().isLogical()) {
				return Type.BOOL;
			} else {
				return evaluationType(b.getLeftHandSide());
			}
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
		}
	}

	private static Type lookup(String text) {
		switch (text) {
			case "bool":
				return Type.BOOL;
			case "i8":
				return Type.I8;
			case "i16":
				return Type.I16;
			case "i32":
				return Type.I32;
			case "i64":
				return Type.I64;
			case "u8":
				return Type.U8;
			case "u16":
				return Type.U16;
			case "u32":
				return Type.U32;
			case "u64":
				return Type.U64;
			default:
				return null;
		}
	}

	private static List<String> splitTopLevel(String text) {
		ArrayList<String> elements = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i != text.length(); ++i) {
			char c = text.charAt(i);
			if (c == '(' || c == '[' || c == '<') {
				depth++;
			} else if (c == ')' || c == ']' || c == '>') {
				depth--;
			} else if (c == ',' && depth == 0) {
				elements.add(text.substring(start, i).trim());
				start = i + 1;
			}
		}
		String last = text.substring(start).trim();
		if (!last.isEmpty()) {
			// permits the trailing comma of a 1-tuple
			elements.add(last);
		}
		return elements;
	}
}
