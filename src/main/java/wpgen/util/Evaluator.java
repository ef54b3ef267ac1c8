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

import java.math.BigInteger;
import java.util.Map;

import wpgen.core.Logic.Expr;

/**
 * <p>
 * Evaluates an expression under an assignment of values to its variables.
 * Boolean-typed expressions evaluate to {@link Boolean} and integer-typed ones
 * to {@link BigInteger}.
 * </p>
 * <p>
 * Arithmetic is over unbounded integers, which matches the reading of
 * expressions used by the guards: <code>a + b &lt;= MAX</code> can actually be
 * false. Division truncates towards zero and the remainder takes the sign of
 * the dividend. To keep evaluation total, division or remainder by zero yields
 * zero; any formula where this matters also carries a <code>b != 0</code>
 * guard.
 * </p>
 */
public class Evaluator extends AbstractExpressionVisitor<Object> {
	private static final BigInteger MAX_SHIFT = BigInteger.valueOf(128);

	private final Map<String, ?> environment;

	public Evaluator(Map<String, ?> environment) {
		this.environment = environment;
	}

	public static Object evaluate(Expr expr, Map<String, ?> environment) {
		return new Evaluator(environment).visitExpression(expr);
	}

	public static boolean holds(Expr expr, Map<String, ?> environment) {
		return (Boolean) evaluate(expr, environment);
	}

	@Override
	protected Object constructBoolean(Expr.BooleanLiteral expr) {
		return expr.getValue();
	}

	@Override
	protected Object constructBitVector(Expr.BitVector expr) {
		return expr.getValue();
	}

	@Override
	protected Object constructVariableMapping(Expr.VariableMapping expr) {
		Object value = environment.get(expr.getName());
		if (value == null) {
			throw new IllegalArgumentException("unbound variable " + expr.getName());
		} else if (value instanceof Long || value instanceof Integer) {
			return BigInteger.valueOf(((Number) value).longValue());
		}
		return value;
	}

	@Override
	protected Object constructUnaryExpression(Expr.UnaryExpression expr, Object operand) {
		switch (expr.getOperator()) {
			case NOT:
				return !(Boolean) operand;
			case BITWISE_NOT:
				return ((BigInteger) operand).not();
			case NEGATION:
				return ((BigInteger) operand).negate();
			default:
				throw new IllegalArgumentException("unknown unary operator " + expr.getOperator());
		}
	}

	@Override
	protected Object constructBinaryExpression(Expr.BinaryExpression expr, Object lhs, Object rhs) {
		switch (expr.getOperator()) {
			case AND:
				return (Boolean) lhs && (Boolean) rhs;
			case OR:
				return (Boolean) lhs || (Boolean) rhs;
			case IMPLICATION:
				return !(Boolean) lhs || (Boolean) rhs;
			case EQUAL:
				return lhs.equals(rhs);
			case NOT_EQUAL:
				return !lhs.equals(rhs);
			default:
				break;
		}
		BigInteger l = (BigInteger) lhs;
		BigInteger r = (BigInteger) rhs;
		switch (expr.getOperator()) {
			case LESS_THAN:
				return l.compareTo(r) < 0;
			case LESS_THAN_OR_EQUAL:
				return l.compareTo(r) <= 0;
			case GREATER_THAN:
				return l.compareTo(r) > 0;
			case GREATER_THAN_OR_EQUAL:
				return l.compareTo(r) >= 0;
			case ADDITION:
				return l.add(r);
			case SUBTRACTION:
				return l.subtract(r);
			case MULTIPLICATION:
				return l.multiply(r);
			case DIVISION:
				return r.signum() == 0 ? BigInteger.ZERO : l.divide(r);
			case MODULO:
				return r.signum() == 0 ? BigInteger.ZERO : l.remainder(r);
			case BITWISE_AND:
				return l.and(r);
			case BITWISE_OR:
				return l.or(r);
			case BITWISE_XOR:
				return l.xor(r);
			case LEFT_SHIFT:
				return isShiftAmount(r) ? l.shiftLeft(r.intValue()) : BigInteger.ZERO;
			case RIGHT_SHIFT:
				return isShiftAmount(r) ? l.shiftRight(r.intValue()) : BigInteger.ZERO;
			default:
				throw new IllegalArgumentException("unknown binary operator " + expr.getOperator());
		}
	}

	/**
	 * Shifts by a negative amount, or by more than the widest type, yield zero.
	 *
	 * @param amount
	 * @return
	 */
	private static boolean isShiftAmount(BigInteger amount) {
		return amount.signum() >= 0 && amount.compareTo(MAX_SHIFT) <= 0;
	}
}
