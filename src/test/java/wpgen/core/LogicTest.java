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

import static org.junit.jupiter.api.Assertions.*;
import static wpgen.core.Logic.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import wpgen.core.Logic.BinaryOperator;
import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;

public class LogicTest {

	@Test
	public void test_type_01() {
		assertEquals(BigInteger.valueOf(-128), Type.I8.getMinimum());
		assertEquals(BigInteger.valueOf(127), Type.I8.getMaximum());
		assertEquals(BigInteger.ZERO, Type.U32.getMinimum());
		assertEquals(BigInteger.valueOf(4294967295L), Type.U32.getMaximum());
		assertEquals(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE), Type.U64.getMaximum());
		assertTrue(Type.U8.contains(BigInteger.valueOf(255)));
		assertFalse(Type.U8.contains(BigInteger.valueOf(-1)));
		assertThrows(IllegalArgumentException.class, () -> Type.BOOL.getMaximum());
		assertEquals("i16", Type.I16.toString());
	}

	@Test
	public void test_operators_01() {
		assertTrue(BinaryOperator.MODULO.isArithmetic());
		assertFalse(BinaryOperator.BITWISE_AND.isArithmetic());
		assertTrue(BinaryOperator.RIGHT_SHIFT.isBitwise());
		assertTrue(BinaryOperator.NOT_EQUAL.isRelational());
		assertFalse(BinaryOperator.AND.isRelational());
		assertTrue(BinaryOperator.IMPLICATION.isLogical());
	}

	@Test
	public void test_equality_01() {
		Expr x = VAR("x", Type.I32);
		assertEquals(ADD(x, SIGNED(32, 1)), ADD(VAR("x", Type.I32), SIGNED(32, 1)));
		assertEquals(ADD(x, SIGNED(32, 1)).hashCode(), ADD(VAR("x", Type.I32), SIGNED(32, 1)).hashCode());
		assertNotEquals(ADD(x, SIGNED(32, 1)), SUB(x, SIGNED(32, 1)));
		assertNotEquals(x, VAR("x", Type.U32));
		// Signedness and width distinguish literals
		assertNotEquals(SIGNED(32, 1), UNSIGNED(32, 1));
		assertNotEquals(SIGNED(32, 1), SIGNED(64, 1));
	}

	@Test
	public void test_attributes_01() {
		Expr e = LT(VAR("x", Type.U8), UNSIGNED(8, 3), ATTRIBUTE("bound"));
		assertEquals("bound", e.getAttribute(String.class));
		assertNull(e.getAttribute(Integer.class));
		// Attributes do not affect equality
		assertEquals(LT(VAR("x", Type.U8), UNSIGNED(8, 3)), e);
	}

	@Test
	public void test_literals_01() {
		assertThrows(IllegalArgumentException.class, () -> UNSIGNED(8, -1));
		assertEquals(SIGNED(16, -5), CONST(Type.I16, BigInteger.valueOf(-5)));
	}

	@Test
	public void test_field_01() {
		Expr.VariableMapping t = VAR("tmp1", Type.I32);
		assertEquals(VAR("tmp1.0", Type.I32), t.field(0, Type.I32));
		assertEquals(VAR("tmp1.1", Type.BOOL), t.field(1, Type.BOOL));
	}
}
