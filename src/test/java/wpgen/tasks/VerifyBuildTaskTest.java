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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.WpException;
import wpgen.util.testing.EnumeratingSolver;

public class VerifyBuildTaskTest {

	@ParameterizedTest
	@ValueSource(booleans = { false, true })
	public void test_build_01(boolean parallel) {
		Expr zero = SIGNED(32, 0);
		Expr post = GTEQ(VAR("return", Type.I32), zero);
		VerifyBuildTask task = new VerifyBuildTask()
				.setSolver(new EnumeratingSolver())
				.setParallel(parallel)
				.addSources(Arrays.asList(
						new VerifyBuildTask.Function(Bodies.decrement(), GT(VAR("x", Type.I32), zero), post),
						new VerifyBuildTask.Function(Bodies.spin(), CONST(true), post),
						new VerifyBuildTask.Function(Bodies.divide("u8"), CONST(true), CONST(true))));
		List<VerifyBuildTask.Result> results = task.run();
		assertEquals(3, results.size());
		// Results are in order, irrespective of parallelism
		assertEquals("decrement", results.get(0).getName());
		assertTrue(results.get(0).isValid());
		assertEquals("spin", results.get(1).getName());
		assertNull(results.get(1).getOutcome());
		assertTrue(results.get(1).getFailure() instanceof WpException.UnsupportedConstruct);
		assertEquals("divide", results.get(2).getName());
		assertEquals(VerifyTask.Outcome.INVALID, results.get(2).getOutcome());
	}
}
