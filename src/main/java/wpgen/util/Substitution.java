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
import java.util.LinkedHashMap;
import java.util.Map;

import wpgen.core.Logic.Expr;

/**
 * Replaces every occurrence of a variable within an expression by another
 * expression. A variable matches when both its name and its type agree with the
 * target. Since expressions are immutable, the replacement is shared between
 * all the places it is substituted into. When several variables are replaced,
 * the replacement is simultaneous: variables occurring in a replacement are
 * never themselves substituted.
 */
public class Substitution extends AbstractExpressionTransform {
	private final Map<Expr.VariableMapping, Expr> replacements;

	public Substitution(Expr.VariableMapping target, Expr replacement) {
		this(Collections.singletonMap(target, replacement));
	}

	public Substitution(Map<Expr.VariableMapping, Expr> replacements) {
		this.replacements = new LinkedHashMap<>(replacements);
	}

	/**
	 * Apply this substitution to a given expression.
	 *
	 * @param expr
	 * @return
	 */
	public Expr apply(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	protected Expr constructVariableMapping(Expr.VariableMapping expr) {
		Expr replacement = replacements.get(expr);
		return replacement != null ? replacement : expr;
	}

	/**
	 * Construct <code>tree[target := replacement]</code>.
	 *
	 * @param tree
	 * @param target
	 * @param replacement
	 * @return
	 */
	public static Expr substitute(Expr tree, Expr.VariableMapping target, Expr replacement) {
		return new Substitution(target, replacement).apply(tree);
	}

	/**
	 * Construct <code>tree[x1 := e1, ..., xn := en]</code>, replacing all variables
	 * at once.
	 *
	 * @param tree
	 * @param replacements
	 * @return
	 */
	public static Expr substitute(Expr tree, Map<Expr.VariableMapping, Expr> replacements) {
		return new Substitution(replacements).apply(tree);
	}
}
