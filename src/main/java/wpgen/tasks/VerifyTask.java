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

import static wpgen.core.Logic.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wpgen.core.Logic.Expr;
import wpgen.core.Mir;
import wpgen.core.WpException;
import wpgen.io.SmtLibPrinter;
import wpgen.util.Solver;
import wpgen.util.Z3;

/**
 * Verifies a function body against its contract. The body is correct if
 * its precondition implies the weakest precondition of its postcondition or,
 * equivalently, if <code>pre &amp;&amp; !wp</code> is unsatisfiable.
 */
public class VerifyTask {
	private static final Logger logger = LoggerFactory.getLogger(VerifyTask.class);

	public enum Outcome {
		/**
		 * Every execution satisfying the precondition is well-defined and establishes
		 * the postcondition.
		 */
		VALID,
		/**
		 * Some execution satisfying the precondition either fails a guard or does not
		 * establish the postcondition.
		 */
		INVALID,
		/**
		 * The solver could not decide.
		 */
		UNKNOWN
	}

	/**
	 * Handle for the solver used to discharge queries.
	 */
	private Solver solver = new Z3();
	/**
	 * Generator for weakest preconditions.
	 */
	private WeakestPrecondition generator = new WeakestPrecondition();
	/**
	 * Specify whether to report each query or not.
	 */
	private boolean verbose = false;

	public VerifyTask setSolver(Solver solver) {
		this.solver = solver;
		return this;
	}

	public VerifyTask setGenerator(WeakestPrecondition generator) {
		this.generator = generator;
		return this;
	}

	public VerifyTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	/**
	 * Verify a given body against a given pre- and postcondition.
	 *
	 * @param body
	 * @param precondition
	 * @param postcondition
	 * @return
	 * @throws WpException if no weakest precondition can be generated for the
	 *                     body.
	 */
	public Outcome verify(Mir.Body body, Expr precondition, Expr postcondition) {
		Expr wp = generator.compute(body, postcondition);
		Expr query = AND(precondition, NOT(wp));
		if (verbose) {
			logger.info("checking {}:\n{}", body.getName(), SmtLibPrinter.toScript(query));
		}
		Solver.Result result = solver.check(query);
		logger.debug("solver returned {} for {}", result, body.getName());
		switch (result) {
			case UNSAT:
				return Outcome.VALID;
			case SAT:
				return Outcome.INVALID;
			default:
				return Outcome.UNKNOWN;
		}
	}
}
