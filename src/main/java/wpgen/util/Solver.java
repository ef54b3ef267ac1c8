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

import wpgen.core.Logic.Expr;

/**
 * A decision procedure for the satisfiability of formulas in the logic.
 */
public interface Solver {

	public enum Result {
		SAT, UNSAT, UNKNOWN
	}

	/**
	 * Determine whether some assignment to the free variables of the given
	 * (boolean) formula makes it true. Integer-typed variables range only over
	 * the values of their type.
	 *
	 * @param formula
	 * @return
	 */
	public Result check(Expr formula);
}
