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

import static wpgen.core.Logic.*;

import java.math.BigInteger;

import wpgen.core.Logic.BinaryOperator;
import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.WpException;

/**
 * Constructs the side-conditions under which an arithmetic operation is well
 * defined. For example, consider the following assignment:
 *
 * <pre>
 *     t := a + b
 * </pre>
 *
 * If <code>a</code> and <code>b</code> are of type <code>i32</code>, there is an
 * implicit precondition that <code>a + b</code> lies within
 * <code>[I32_MIN, I32_MAX]</code>. This is conjoined onto the predicate which
 * holds after the assignment. Likewise, <code>t := a / b</code> requires
 * <code>b != 0</code> and, for signed operands, that <code>a / b</code> stays
 * within range (since <code>I32_MIN / -1</code> does not).
 *
 * Each guard clause is tagged with a {@link Kind} attribute.
 */
public class Guards {

	public enum Kind {
		OVERFLOW, UNDERFLOW, DIVIDE_BY_ZERO
	}

	/**
	 * Conjoin the pair of range checks for <code>lhs op rhs</code> at the given
	 * type onto a predicate. Both directions are always checked.
	 *
	 * @param wp
	 * @param type
	 * @param op
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr overflow(Expr wp, Type type, BinaryOperator op, Expr lhs, Expr rhs) {
		if (!type.isInteger()) {
			throw new WpException.UnsupportedConstruct("no overflow check for " + op + " at type " + type);
		}
		Expr result = BINARY(op, lhs, rhs);
		Expr upper = LTEQ(result, maximum(type), ATTRIBUTE(Kind.OVERFLOW));
		Expr lower = GTEQ(result, minimum(type), ATTRIBUTE(Kind.UNDERFLOW));
		return AND(wp, AND(upper, lower));
	}

	/**
	 * Conjoin <code>divisor != 0</code> onto a predicate. The zero literal takes
	 * the type of the divisor.
	 *
	 * @param wp
	 * @param divisor
	 * @return
	 */
	public static Expr divisionByZero(Expr wp, Expr divisor) {
		Type type = Types.evaluationType(divisor);
		if (!type.isInteger()) {
			throw new WpException.UnsupportedConstruct("division by non-integer " + divisor);
		}
		return AND(wp, NEQ(divisor, CONST(type, BigInteger.ZERO), ATTRIBUTE(Kind.DIVIDE_BY_ZERO)));
	}

	public static Expr minimum(Type type) {
		// Checks width is supported
		Types.ofWidth(type.getWidth(), type.isSigned());
		return CONST(type, type.getMinimum());
	}

	public static Expr maximum(Type type) {
		Types.ofWidth(type.getWidth(), type.isSigned());
		return CONST(type, type.getMaximum());
	}
}
