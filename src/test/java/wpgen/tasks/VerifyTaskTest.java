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

import org.junit.jupiter.api.Test;

import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.WpException;
import wpgen.util.Solver;
import wpgen.util.testing.EnumeratingSolver;

public class VerifyTaskTest {
	private static final Expr X = VAR("x", Type.I32);
	private static final Expr RETURN = VAR("return", Type.I32);

	private final VerifyTask task = new VerifyTask().setSolver(new EnumeratingSolver());

	@Test
	public void test_decrement_valid() {
		Expr pre = GT(X, SIGNED(32, 0));
		Expr post = GTEQ(RETURN, SIGNED(32, 0));
		assertEquals(VerifyTask.Outcome.VALID, task.verify(Bodies.decrement(), pre, post));
	}

	@Test
	public void test_decrement_invalid_01() {
		// Without the precondition, x <= 0 reaches the panic
		Expr post = GTEQ(RETURN, SIGNED(32, 0));
		assertEquals(VerifyTask.Outcome.INVALID, task.verify(Bodies.decrement(), CONST(true), post));
	}

	@Test
	public void test_decrement_invalid_02() {
		Expr pre = GT(X, SIGNED(32, 0));
		Expr post = GT(RETURN, SIGNED(32, 0));
		assertEquals(VerifyTask.Outcome.INVALID, task.verify(Bodies.decrement(), pre, post));
	}

	@Test
	public void test_divide_01() {
		Expr b = VAR("b", Type.U8);
		assertEquals(VerifyTask.Outcome.INVALID, task.verify(Bodies.divide("u8"), CONST(true), CONST(true)));
		assertEquals(VerifyTask.Outcome.VALID,
				task.verify(Bodies.divide("u8"), NEQ(b, UNSIGNED(8, 0)), CONST(true)));
	}

	@Test
	public void test_divide_02() {
		// i8::MIN / -1 overflows
		Expr a = VAR("a", Type.I8);
		Expr b = VAR("b", Type.I8);
		Expr pre = AND(NEQ(b, SIGNED(8, 0)), GT(a, SIGNED(8, -128)));
		assertEquals(VerifyTask.Outcome.INVALID,
				task.verify(Bodies.divide("i8"), NEQ(b, SIGNED(8, 0)), CONST(true)));
		assertEquals(VerifyTask.Outcome.VALID, task.verify(Bodies.divide("i8"), pre, CONST(true)));
	}

	@Test
	public void test_unknown_01() {
		VerifyTask t = new VerifyTask().setSolver(f -> Solver.Result.UNKNOWN);
		assertEquals(VerifyTask.Outcome.UNKNOWN, t.verify(Bodies.decrement(), CONST(true), CONST(true)));
	}

	@Test
	public void test_loop_01() {
		assertThrows(WpException.UnsupportedConstruct.class,
				() -> task.verify(Bodies.spin(), CONST(true), CONST(true)));
	}
}
