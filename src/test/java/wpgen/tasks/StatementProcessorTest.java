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
package wpgen.tasks;

import static org.junit.jupiter.api.Assertions.*;
import static wpgen.core.Logic.*;
import static wpgen.core.Mir.*;

import org.junit.jupiter.api.Test;

import wpgen.core.Logic.BinaryOperator;
import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.Mir.BinOp;
import wpgen.core.Mir.Body;
import wpgen.core.Mir.UnOp;
import wpgen.core.WpException;

public class StatementProcessorTest {
	private static final Body BODY = new Body.Builder("f")
			.argument("a", "i32")
			.argument("b", "bool")
			.argument("c", "u8")
			.argument("r", "&mut i32")
			.temporary("(i32, i32)")
			.temporary("(u8, bool)")
			.temporary("i32")
			.temporary("bool")
			.local("x", "u8")
			.returns("i32")
			.build();

	private static final Expr A = VAR("a", Type.I32);
	private static final Expr B = VAR("b", Type.BOOL);
	private static final Expr C = VAR("c", Type.U8);
	private static final Expr RETURN = VAR("return", Type.I32);
	private static final Expr TMP2 = VAR("tmp2", Type.I32);
	private static final Expr TMP3 = VAR("tmp3", Type.BOOL);
	private static final Expr I32_ZERO = SIGNED(32, 0);
	private static final Expr I32_MAX = SIGNED(32, Integer.MAX_VALUE);
	private static final Expr I32_MIN = SIGNED(32, Integer.MIN_VALUE);

	private final StatementProcessor processor = new StatementProcessor(new Resolver(BODY));

	@Test
	public void test_use_01() {
		Expr post = LT(RETURN, SIGNED(32, 10));
		Expr wp = processor.apply(ASSIGN(RETURN_POINTER(), USE(CONSUME(ARGUMENT(0)))), post);
		assertEquals(LT(A, SIGNED(32, 10)), wp);
	}

	@Test
	public void test_use_02() {
		Expr post = EQ(VAR("var0", Type.U8), UNSIGNED(8, 3));
		Expr wp = processor.apply(ASSIGN(LOCAL(0), USE(LITERAL("u8", 255))), post);
		assertEquals(EQ(UNSIGNED(8, 255), UNSIGNED(8, 3)), wp);
	}

	@Test
	public void test_use_03() {
		// Out of range for its kind
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> processor.apply(ASSIGN(LOCAL(0), USE(LITERAL("u8", 256))), CONST(true)));
	}

	@Test
	public void test_use_04() {
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> processor.apply(ASSIGN(TEMP(2), USE(LITERAL("i128", 1))), CONST(true)));
	}

	@Test
	public void test_use_05() {
		// Predicates not mentioning the target are unaffected
		Expr post = GT(C, UNSIGNED(8, 0));
		assertSame(post, processor.apply(ASSIGN(RETURN_POINTER(), USE(CONSUME(ARGUMENT(0)))), post));
	}

	@Test
	public void test_not_01() {
		Expr wp = processor.apply(ASSIGN(TEMP(3), UNOP(UnOp.NOT, CONSUME(ARGUMENT(1)))), TMP3);
		assertEquals(NOT(B), wp);
	}

	@Test
	public void test_not_02() {
		Expr wp = processor.apply(ASSIGN(TEMP(2), UNOP(UnOp.NOT, CONSUME(ARGUMENT(0)))), EQ(TMP2, I32_ZERO));
		assertEquals(EQ(BITNOT(A), I32_ZERO), wp);
	}

	@Test
	public void test_neg_01() {
		Expr wp = processor.apply(ASSIGN(TEMP(2), UNOP(UnOp.NEG, CONSUME(ARGUMENT(0)))), EQ(TMP2, I32_ZERO));
		assertEquals(EQ(NEG(A), I32_ZERO), wp);
	}

	@Test
	public void test_relational_01() {
		Expr wp = processor.apply(ASSIGN(TEMP(3), BINOP(BinOp.LT, CONSUME(ARGUMENT(0)), LITERAL("i32", 0))), TMP3);
		assertEquals(LT(A, I32_ZERO), wp);
	}

	@Test
	public void test_shift_01() {
		Expr wp = processor.apply(ASSIGN(TEMP(2), BINOP(BinOp.SHL, CONSUME(ARGUMENT(0)), LITERAL("i32", 1))),
				EQ(TMP2, I32_ZERO));
		assertEquals(EQ(BINARY(BinaryOperator.LEFT_SHIFT, A, SIGNED(32, 1)), I32_ZERO), wp);
	}

	@Test
	public void test_checked_mul_01() {
		Expr post = EQ(VAR("tmp1.0", Type.U8), UNSIGNED(8, 4));
		Expr wp = processor.apply(ASSIGN(TEMP(1), CHECKED(BinOp.MUL, CONSUME(ARGUMENT(2)), CONSUME(ARGUMENT(2)))),
				post);
		Expr cc = MUL(C, C);
		Expr expected = AND(EQ(cc, UNSIGNED(8, 4)), AND(LTEQ(cc, UNSIGNED(8, 255)), GTEQ(cc, UNSIGNED(8, 0))));
		assertEquals(expected, wp);
	}

	@Test
	public void test_checked_bitand_01() {
		assertThrows(WpException.UnsupportedConstruct.class, () -> processor.apply(
				ASSIGN(TEMP(1), CHECKED(BinOp.BITAND, CONSUME(ARGUMENT(2)), CONSUME(ARGUMENT(2)))), CONST(true)));
	}

	@Test
	public void test_remainder_01() {
		Expr three = SIGNED(32, 3);
		Expr rem = REM(A, three);
		Expr wp = processor.apply(ASSIGN(TEMP(2), BINOP(BinOp.REM, CONSUME(ARGUMENT(0)), LITERAL("i32", 3))),
				EQ(TMP2, I32_ZERO));
		Expr guarded = AND(EQ(rem, I32_ZERO), AND(LTEQ(rem, I32_MAX), GTEQ(rem, I32_MIN)));
		assertEquals(AND(guarded, NEQ(three, I32_ZERO)), wp);
	}

	@Test
	public void test_tuple_01() {
		Expr first = VAR("tmp0.0", Type.I32);
		Expr second = VAR("tmp0.1", Type.I32);
		Expr wp = processor.apply(ASSIGN(TEMP(0), TUPLE(CONSUME(ARGUMENT(0)), LITERAL("i32", 1))), LT(first, second));
		assertEquals(LT(A, SIGNED(32, 1)), wp);
	}

	@Test
	public void test_tuple_02() {
		// Both fields are replaced at once
		Expr first = VAR("tmp0.0", Type.I32);
		Expr second = VAR("tmp0.1", Type.I32);
		Expr wp = processor.apply(ASSIGN(TEMP(0), TUPLE(CONSUME(FIELD(TEMP(0), 1)), CONSUME(FIELD(TEMP(0), 0)))),
				LT(first, second));
		assertEquals(LT(second, first), wp);
	}

	@Test
	public void test_tuple_03() {
		assertThrows(WpException.UnsupportedConstruct.class, () -> processor.apply(
				ASSIGN(TEMP(0), TUPLE(LITERAL("i32", 1), LITERAL("i32", 2), LITERAL("i32", 3))), CONST(true)));
	}

	@Test
	public void test_tuple_04() {
		// Not a tuple type
		assertThrows(WpException.TypeResolution.class, () -> processor.apply(
				ASSIGN(TEMP(2), TUPLE(LITERAL("i32", 1), LITERAL("i32", 2))), CONST(true)));
	}

	@Test
	public void test_cast_01() {
		Expr post = EQ(TMP2, I32_ZERO);
		assertSame(post, processor.apply(ASSIGN(TEMP(2), CAST(CONSUME(ARGUMENT(2)), "i32")), post));
	}

	@Test
	public void test_ref_01() {
		// References resolve to the type referred to
		Expr post = EQ(VAR("r", Type.I32), I32_ZERO);
		assertSame(post, processor.apply(ASSIGN(ARGUMENT(3), REF(TEMP(2))), post));
	}

	@Test
	public void test_len_01() {
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> processor.apply(ASSIGN(TEMP(2), new RVal.Len(ARGUMENT(0))), CONST(true)));
	}

	@Test
	public void test_projection_01() {
		LVal index = new LVal.Projection(TEMP(0), new ProjectionElem.Index(LITERAL("u8", 0)));
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> processor.apply(ASSIGN(TEMP(2), USE(CONSUME(index))), CONST(true)));
	}

	@Test
	public void test_projection_02() {
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> processor.apply(ASSIGN(TEMP(2), USE(CONSUME(FIELD(RETURN_POINTER(), 0)))), CONST(true)));
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> processor.apply(ASSIGN(TEMP(2), USE(CONSUME(FIELD(FIELD(TEMP(0), 0), 0)))), CONST(true)));
	}

	@Test
	public void test_static_01() {
		assertThrows(WpException.UnsupportedConstruct.class, () -> processor
				.apply(ASSIGN(TEMP(2), USE(CONSUME(new LVal.Static("COUNTER")))), CONST(true)));
	}

	@Test
	public void test_undeclared_01() {
		assertThrows(WpException.InvariantViolation.class,
				() -> processor.apply(ASSIGN(TEMP(9), USE(LITERAL("i32", 1))), CONST(true)));
	}
}
