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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wpgen.core.Logic.Expr;
import wpgen.core.Mir;
import wpgen.core.WpException;
import wpgen.util.Solver;

/**
 * Verifies a collection of functions. A function for which no weakest
 * precondition can be generated is recorded as a failure, and does not stop
 * the remaining functions from being verified.
 */
public class VerifyBuildTask {
	private static final Logger logger = LoggerFactory.getLogger(VerifyBuildTask.class);

	private final VerifyTask verifier = new VerifyTask();

	private final List<Function> sources = new ArrayList<>();
	/**
	 * Specify whether to verify functions in parallel or not.
	 */
	private boolean parallel = false;

	private ForkJoinPool pool = ForkJoinPool.commonPool();

	public VerifyBuildTask setSolver(Solver solver) {
		verifier.setSolver(solver);
		return this;
	}

	public VerifyBuildTask setGenerator(WeakestPrecondition generator) {
		verifier.setGenerator(generator);
		return this;
	}

	public VerifyBuildTask setVerbose(boolean flag) {
		verifier.setVerbose(flag);
		return this;
	}

	public VerifyBuildTask setParallel(boolean flag) {
		this.parallel = flag;
		return this;
	}

	public VerifyBuildTask setPool(ForkJoinPool pool) {
		this.pool = pool;
		return this;
	}

	public VerifyBuildTask addSource(Function f) {
		this.sources.add(f);
		return this;
	}

	public VerifyBuildTask addSources(Collection<Function> fs) {
		this.sources.addAll(fs);
		return this;
	}

	public List<Function> getSources() {
		return sources;
	}

	/**
	 * Verify every function added to this task.
	 *
	 * @return One result per function, in the order they were added.
	 */
	public List<Result> run() {
		ArrayList<Result> results = new ArrayList<>();
		if (parallel) {
			ArrayList<Future<Result>> futures = new ArrayList<>();
			for (Function f : sources) {
				futures.add(pool.submit(() -> verify(f)));
			}
			for (Future<Result> f : futures) {
				try {
					results.add(f.get());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new RuntimeException(e.getMessage(), e);
				} catch (ExecutionException e) {
					throw new RuntimeException(e.getCause().getMessage(), e.getCause());
				}
			}
		} else {
			for (Function f : sources) {
				results.add(verify(f));
			}
		}
		return results;
	}

	private Result verify(Function f) {
		try {
			VerifyTask.Outcome outcome = verifier.verify(f.getBody(), f.getPrecondition(), f.getPostcondition());
			logger.info("{}: {}", f.getName(), outcome);
			return new Result(f.getName(), outcome, null);
		} catch (WpException e) {
			logger.warn("{}: {}", f.getName(), e.getMessage());
			return new Result(f.getName(), null, e);
		}
	}

	/**
	 * A function body together with its pre- and postcondition.
	 */
	public static class Function {
		private final Mir.Body body;
		private final Expr precondition;
		private final Expr postcondition;

		public Function(Mir.Body body, Expr precondition, Expr postcondition) {
			this.body = body;
			this.precondition = precondition;
			this.postcondition = postcondition;
		}

		public String getName() {
			return body.getName();
		}

		public Mir.Body getBody() {
			return body;
		}

		public Expr getPrecondition() {
			return precondition;
		}

		public Expr getPostcondition() {
			return postcondition;
		}
	}

	public static class Result {
		private final String name;
		private final VerifyTask.Outcome outcome;
		private final WpException failure;

		public Result(String name, VerifyTask.Outcome outcome, WpException failure) {
			this.name = name;
			this.outcome = outcome;
			this.failure = failure;
		}

		public String getName() {
			return name;
		}

		/**
		 * Get the verification outcome, or <code>null</code> if no precondition could
		 * be generated.
		 *
		 * @return
		 */
		public VerifyTask.Outcome getOutcome() {
			return outcome;
		}

		public WpException getFailure() {
			return failure;
		}

		public boolean isValid() {
			return outcome == VerifyTask.Outcome.VALID;
		}

		@Override
		public String toString() {
			return name + ": " + (failure != null ? failure.getMessage() : outcome);
		}
	}
}
