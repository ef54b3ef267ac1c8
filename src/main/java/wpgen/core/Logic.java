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
package wpgen.core;

import java.math.BigInteger;
import java.util.Objects;

import wpgen.io.SmtLibPrinter;

/**
 * The logic in which weakest preconditions are expressed. Expressions are
 * immutable trees built bottom-up through the constructor API at the end of
 * this class. Integer leaves are fixed-width bit-vector literals, but the
 * arithmetic operators are read over unbounded integers: this is what gives the
 * overflow guards their meaning.
 */
public class Logic {

	// =========================================================================
	// Types
	// =========================================================================

	/**
	 * The semantic types of the logic. Every variable and literal carries one.
	 */
	public enum Type {
		BOOL(0, false), I8(8, true), I16(16, true), I32(32, true), I64(64, true), U8(8, false), U16(16, false),
		U32(32, false), U64(64, false);

		private final int width;
		private final boolean signed;

		Type(int width, boolean signed) {
			this.width = width;
			this.signed = signed;
		}

		/**
		 * Get the number of bits in this type. This is <code>0</code> for
		 * {@link #BOOL}.
		 *
		 * @return
		 */
		public int getWidth() {
			return width;
		}

		public boolean isSigned() {
			return signed;
		}

		public boolean isInteger() {
			return this != BOOL;
		}

		/**
		 * Get the smallest value representable in this (integer) type.
		 *
		 * @return
		 */
		public BigInteger getMinimum() {
			checkInteger();
			return signed ? BigInteger.ONE.shiftLeft(width - 1).negate() : BigInteger.ZERO;
		}

		/**
		 * Get the largest value representable in this (integer) type.
		 *
		 * @return
		 */
		public BigInteger getMaximum() {
			checkInteger();
			int bits = signed ? width - 1 : width;
			return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
		}

		public boolean contains(BigInteger value) {
			return getMinimum().compareTo(value) <= 0 && value.compareTo(getMaximum()) <= 0;
		}

		private void checkInteger() {
			if (this == BOOL) {
				throw new IllegalArgumentException("bool has no integer range");
			}
		}

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	public enum UnaryOperator {
		NOT, BITWISE_NOT, NEGATION
	}

	public enum BinaryOperator {
		// Arithmetic
		ADDITION, SUBTRACTION, MULTIPLICATION, DIVISION, MODULO,
		// Bitwise
		BITWISE_AND, BITWISE_OR, BITWISE_XOR, LEFT_SHIFT, RIGHT_SHIFT,
		// Relational
		LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL, EQUAL, NOT_EQUAL,
		// Logical
		AND, OR, IMPLICATION;

		public boolean isArithmetic() {
			return ordinal() <= MODULO.ordinal();
		}

		public boolean isBitwise() {
			return BITWISE_AND.ordinal() <= ordinal() && ordinal() <= RIGHT_SHIFT.ordinal();
		}

		public boolean isRelational() {
			return LESS_THAN.ordinal() <= ordinal() && ordinal() <= NOT_EQUAL.ordinal();
		}

		public boolean isLogical() {
			return ordinal() >= AND.ordinal();
		}
	}

	// =========================================================================
	// Items
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static abstract class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		@Override
		public String toString() {
			return SmtLibPrinter.toString((Expr) this);
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * An expression in the logic. Equality is structural and ignores attributes.
	 */
	public interface Expr extends Item {

		public static class BooleanLiteral extends AbstractItem implements Expr {
			private final boolean value;

			private BooleanLiteral(boolean value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof BooleanLiteral && ((BooleanLiteral) o).value == value;
			}

			@Override
			public int hashCode() {
				return Boolean.hashCode(value);
			}
		}

		/**
		 * A fixed-width integer literal, either signed or unsigned.
		 */
		public static abstract class BitVector extends AbstractItem implements Expr {
			private final int width;
			private final BigInteger value;

			private BitVector(int width, BigInteger value, Attribute[] attributes) {
				super(attributes);
				this.width = width;
				this.value = value;
			}

			public int getWidth() {
				return width;
			}

			public BigInteger getValue() {
				return value;
			}

			public abstract boolean isSigned();

			@Override
			public boolean equals(Object o) {
				if (o instanceof BitVector) {
					BitVector b = (BitVector) o;
					return b.isSigned() == isSigned() && b.width == width && b.value.equals(value);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(isSigned(), width, value);
			}
		}

		public static class SignedBitVector extends BitVector {
			private SignedBitVector(int width, BigInteger value, Attribute[] attributes) {
				super(width, value, attributes);
			}

			@Override
			public boolean isSigned() {
				return true;
			}
		}

		public static class UnsignedBitVector extends BitVector {
			private UnsignedBitVector(int width, BigInteger value, Attribute[] attributes) {
				super(width, value, attributes);
			}

			@Override
			public boolean isSigned() {
				return false;
			}
		}

		/**
		 * A named program variable (argument, temporary, local, return slot or
		 * tuple field) together with its semantic type.
		 */
		public static class VariableMapping extends AbstractItem implements Expr {
			private final String name;
			private final Type type;

			private VariableMapping(String name, Type type, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			/**
			 * Get the mapping for a field of this variable, such as <code>tmp3.0</code>.
			 *
			 * @param field
			 * @param type
			 * @return
			 */
			public VariableMapping field(int field, Type type) {
				return new VariableMapping(name + "." + field, type, new Attribute[0]);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof VariableMapping) {
					VariableMapping v = (VariableMapping) o;
					return v.name.equals(name) && v.type == type;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(name, type);
			}
		}

		public static class UnaryExpression extends AbstractItem implements Expr {
			private final UnaryOperator op;
			private final Expr operand;

			private UnaryExpression(UnaryOperator op, Expr operand, Attribute[] attributes) {
				super(attributes);
				this.op = op;
				this.operand = operand;
			}

			public UnaryOperator getOperator() {
				return op;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof UnaryExpression) {
					UnaryExpression u = (UnaryExpression) o;
					return u.op == op && u.operand.equals(operand);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(op, operand);
			}
		}

		public static class BinaryExpression extends AbstractItem implements Expr {
			private final BinaryOperator op;
			private final Expr lhs;
			private final Expr rhs;

			private BinaryExpression(BinaryOperator op, Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.op = op;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public BinaryOperator getOperator() {
				return op;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof BinaryExpression) {
					BinaryExpression b = (BinaryExpression) o;
					return b.op == op && b.lhs.equals(lhs) && b.rhs.equals(rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(op, lhs, rhs);
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	@SuppressWarnings("unchecked")
	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Leaves

	public static Expr.BooleanLiteral CONST(boolean b, Attribute... attributes) {
		return new Expr.BooleanLiteral(b, attributes);
	}

	public static Expr.SignedBitVector SIGNED(int width, long value, Attribute... attributes) {
		return SIGNED(width, BigInteger.valueOf(value), attributes);
	}

	public static Expr.SignedBitVector SIGNED(int width, BigInteger value, Attribute... attributes) {
		return new Expr.SignedBitVector(width, value, attributes);
	}

	public static Expr.UnsignedBitVector UNSIGNED(int width, long value, Attribute... attributes) {
		return UNSIGNED(width, BigInteger.valueOf(value), attributes);
	}

	public static Expr.UnsignedBitVector UNSIGNED(int width, BigInteger value, Attribute... attributes) {
		if (value.signum() < 0) {
			throw new IllegalArgumentException("negative unsigned literal: " + value);
		}
		return new Expr.UnsignedBitVector(width, value, attributes);
	}

	/**
	 * Construct an integer literal of the given type.
	 *
	 * @param type
	 * @param value
	 * @param attributes
	 * @return
	 */
	public static Expr.BitVector CONST(Type type, BigInteger value, Attribute... attributes) {
		if (type.isSigned()) {
			return SIGNED(type.getWidth(), value, attributes);
		} else {
			return UNSIGNED(type.getWidth(), value, attributes);
		}
	}

	public static Expr.VariableMapping VAR(String name, Type type, Attribute... attributes) {
		return new Expr.VariableMapping(name, type, attributes);
	}

	// Unary operators

	public static Expr.UnaryExpression UNARY(UnaryOperator op, Expr operand, Attribute... attributes) {
		return new Expr.UnaryExpression(op, operand, attributes);
	}

	public static Expr.UnaryExpression NOT(Expr operand, Attribute... attributes) {
		return UNARY(UnaryOperator.NOT, operand, attributes);
	}

	public static Expr.UnaryExpression BITNOT(Expr operand, Attribute... attributes) {
		return UNARY(UnaryOperator.BITWISE_NOT, operand, attributes);
	}

	public static Expr.UnaryExpression NEG(Expr operand, Attribute... attributes) {
		return UNARY(UnaryOperator.NEGATION, operand, attributes);
	}

	// Binary operators

	public static Expr.BinaryExpression BINARY(BinaryOperator op, Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinaryExpression(op, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression AND(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.AND, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression OR(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.OR, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.IMPLICATION, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.EQUAL, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.NOT_EQUAL, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.LESS_THAN, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.LESS_THAN_OR_EQUAL, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.GREATER_THAN, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.GREATER_THAN_OR_EQUAL, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.ADDITION, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.SUBTRACTION, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.MULTIPLICATION, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.DIVISION, lhs, rhs, attributes);
	}

	public static Expr.BinaryExpression REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return BINARY(BinaryOperator.MODULO, lhs, rhs, attributes);
	}
}
