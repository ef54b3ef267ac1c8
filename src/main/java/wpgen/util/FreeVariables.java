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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import wpgen.core.Logic.Expr;

/**
 * Collects the variables occurring in an expression, in order of first
 * occurrence (left to right).
 */
public class FreeVariables extends AbstractExpressionFold<Set<Expr.VariableMapping>> {

	public static Set<Expr.VariableMapping> of(Expr expr) {
		return new FreeVariables().visitExpression(expr);
	}

	@Override
	protected Set<Expr.VariableMapping> constructVariableMapping(Expr.VariableMapping expr) {
		return Collections.singleton(expr);
	}

	@Override
	protected Set<Expr.VariableMapping> BOTTOM() {
		return Collections.emptySet();
	}

	@Override
	protected Set<Expr.VariableMapping> join(Set<Expr.VariableMapping> lhs, Set<Expr.VariableMapping> rhs) {
		if (lhs.isEmpty()) {
			return rhs;
		} else if (rhs.isEmpty()) {
			return lhs;
		}
		LinkedHashSet<Expr.VariableMapping> r = new LinkedHashSet<>(lhs);
		r.addAll(rhs);
		return r;
	}
}
