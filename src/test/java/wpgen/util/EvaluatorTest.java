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

import static org.junit.jupiter.api.Assertions.*;
import static wpgen.core.Logic.*;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import wpgen.core.Logic.BinaryOperator;
import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;

public class EvaluatorTest {
	private static final Expr A = VAR("a", Type.I32);
	private static final Expr B = VAR("b", Type.I32);

	private static Map<String, Object> env(long a, long b) {
		HashMap<String, Object> env = new HashMap<>();
		env.put("a", a);
		env.put("b", b);
		return env;
	}

	@Test
	public void test_division_01() {
		// Truncates towards zero
		assertEquals(BigInteger.valueOf(-3), Evaluator.evaluate(DIV(A, B), env(-7, 2)));
		assertEquals(BigInteger.valueOf(-3), Evaluator.evaluate(DIV(A, B), env(7, -2)));
		assertEquals(BigInteger.valueOf(3), Evaluator.evaluate(DIV(A, B), env(-7, -2)));
	}

	@Test
	public void test_remainder_01() {
		// Sign of dividend
		assertEquals(BigInteger.valueOf(-1), Evaluator.evaluate(REM(A, B), env(-7, 2)));
		assertEquals(BigInteger.valueOf(1), Evaluator.evaluate(REM(A, B), env(7, -2)));
	}

	@Test
	public void test_division_02() {
		assertEquals(BigInteger.ZERO, Evaluator.evaluate(DIV(A, B), env(5, 0)));
		assertEquals(BigInteger.ZERO, Evaluator.evaluate(REM(A, B), env(5, 0)));
	}

	@Test
	public void test_unbounded_01() {
		// Arithmetic does not wrap
		Expr sum = ADD(A, B);
		assertEquals(BigInteger.valueOf(4294967294L),
				Evaluator.evaluate(sum, env(Integer.MAX_VALUE, Integer.MAX_VALUE)));
		assertFalse(Evaluator.holds(LTEQ(sum, SIGNED(32, Integer.MAX_VALUE)), env(Integer.MAX_VALUE, 1)));
	}

	@Test
	public void test_logical_01() {
		Expr p = VAR("p", Type.BOOL);
		Expr q = VAR("q", Type.BOOL);
		HashMap<String, Object> env = new HashMap<>();
		env.put("p", false);
		env.put("q", false);
		assertTrue(Evaluator.holds(IMPLIES(p, q), env));
		assertTrue(Evaluator.holds(NOT(AND(p, q)), env));
		assertFalse(Evaluator.holds(OR(p, q), env));
		assertTrue(Evaluator.holds(EQ(p, q), env));
	}

	@Test
	public void test_bitwise_01() {
		assertEquals(BigInteger.valueOf(-6), Evaluator.evaluate(BITNOT(A), env(5, 0)));
		assertEquals(BigInteger.valueOf(12), Evaluator.evaluate(BINARY(BinaryOperator.LEFT_SHIFT, A, B), env(3, 2)));
		assertEquals(BigInteger.valueOf(1), Evaluator.evaluate(BINARY(BinaryOperator.BITWISE_AND, A, B), env(3, 5)));
		assertEquals(BigInteger.ZERO, Evaluator.evaluate(BINARY(BinaryOperator.LEFT_SHIFT, A, B), env(3, -1)));
	}

	@Test
	public void test_unbound_01() {
		assertThrows(IllegalArgumentException.class, () -> Evaluator.evaluate(A, new HashMap<>()));
	}
}
