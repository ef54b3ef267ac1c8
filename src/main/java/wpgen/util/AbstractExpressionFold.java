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
 * An expression visitor which combines the results of operands with a
 * <code>join</code>, with leaves yielding <code>BOTTOM</code> unless
 * overridden.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructBoolean(Expr.BooleanLiteral expr) {
        return BOTTOM();
    }

    @Override
    protected E constructBitVector(Expr.BitVector expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariableMapping(Expr.VariableMapping expr) {
        return BOTTOM();
    }

    @Override
    protected E constructUnaryExpression(Expr.UnaryExpression expr, E operand) {
        return operand;
    }

    @Override
    protected E constructBinaryExpression(Expr.BinaryExpression expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);
}
