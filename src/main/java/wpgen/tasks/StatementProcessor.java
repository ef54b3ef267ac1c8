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

import java.util.LinkedHashMap;
import java.util.List;

import wpgen.core.Logic.BinaryOperator;
import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.Mir;
import wpgen.core.Mir.BinOp;
import wpgen.core.Mir.RVal;
import wpgen.core.WpException;
import wpgen.util.Guards;
import wpgen.util.Substitution;
import wpgen.util.Types;

/**
 * Applies the backwards semantics of a single assignment to a predicate. That
 * is, given an assignment <code>x := e</code> and a predicate <code>Q</code>
 * which should hold afterwards, this constructs <code>Q[x := e]</code> together
 * with any guards needed to ensure <code>e</code> is well-defined. For example,
 * consider:
 *
 * <pre>
 * tmp2 := CheckedAdd(x, const 1_i32)
 * </pre>
 *
 * Given the predicate <code>tmp2.0 &gt; 0</code>, this produces
 * <code>((x + 1) &gt; 0) &amp;&amp; ((x + 1) &lt;= I32_MAX) &amp;&amp; ((x + 1) &gt;= I32_MIN)</code>.
 */
public class StatementProcessor {
	private final Resolver resolver;

	public StatementProcessor(Resolver resolver) {
		this.resolver = resolver;
	}

	public Resolver getResolver() {
		return resolver;
	}

	/**
	 * Construct the weakest precondition of a statement with respect to a given
	 * predicate.
	 *
	 * @param stmt
	 * @param predicate
	 * @return
	 */
	public Expr apply(Mir.Stmt stmt, Expr predicate) {
		if (stmt instanceof Mir.Stmt.Assign) {
			return apply((Mir.Stmt.Assign) stmt, predicate);
		} else {
			throw new WpException.InvariantViolation("unexpected statement " + stmt);
		}
	}

	private Expr apply(Mir.Stmt.Assign stmt, Expr predicate) {
		Expr.VariableMapping target = resolver.resolve(stmt.getLeftHandSide());
		RVal rval = stmt.getRightHandSide();
		if (rval instanceof RVal.CheckedBinaryOp) {
			return applyCheckedBinaryOp(target, (RVal.CheckedBinaryOp) rval, predicate);
		} else if (rval instanceof RVal.BinaryOp) {
			return applyBinaryOp(target, (RVal.BinaryOp) rval, predicate);
		} else if (rval instanceof RVal.UnaryOp) {
			return applyUnaryOp(target, (RVal.UnaryOp) rval, predicate);
		} else if (rval instanceof RVal.Use) {
			Expr e = resolver.resolve(((RVal.Use) rval).getOperand());
			return Substitution.substitute(predicate, target, e);
		} else if (rval instanceof RVal.Aggregate) {
			return applyAggregate(stmt.getLeftHandSide(), target, (RVal.Aggregate) rval, predicate);
		} else if (rval instanceof RVal.Cast || rval instanceof RVal.Ref) {
			// Not modelled, so target is left as is
			return predicate;
		} else {
			throw new WpException.UnsupportedConstruct("unsupported rvalue " + rval);
		}
	}

	private Expr applyCheckedBinaryOp(Expr.VariableMapping target, RVal.CheckedBinaryOp rval, Expr predicate) {
		switch (rval.getOperator()) {
			case ADD:
			case SUB:
			case MUL:
			case DIV:
			case REM:
			case SHL:
			case SHR:
				break;
			default:
				throw new WpException.UnsupportedConstruct("unsupported checked operation " + rval);
		}
		// Result is the value field, whilst field 1 is the overflow flag
		Expr.VariableMapping key = target.field(0, target.getType());
		return applyBinaryOp(key, rval, predicate);
	}

	private Expr applyBinaryOp(Expr.VariableMapping key, RVal.BinaryOp rval, Expr predicate) {
		Expr lhs = resolver.resolve(rval.getLeftHandSide());
		Expr rhs = resolver.resolve(rval.getRightHandSide());
		BinaryOperator op = operator(rval.getOperator());
		switch (rval.getOperator()) {
			case ADD:
			case SUB:
			case MUL:
				predicate = Guards.overflow(predicate, key.getType(), op, lhs, rhs);
				break;
			case DIV:
			case REM:
				if (Types.evaluationType(rhs).isSigned()) {
					predicate = Guards.overflow(predicate, key.getType(), op, lhs, rhs);
				}
				predicate = Guards.divisionByZero(predicate, rhs);
				break;
			default:
		}
		return Substitution.substitute(predicate, key, BINARY(op, lhs, rhs));
	}

	private Expr applyUnaryOp(Expr.VariableMapping target, RVal.UnaryOp rval, Expr predicate) {
		Expr operand = resolver.resolve(rval.getOperand());
		Expr e;
		switch (rval.getOperator()) {
			case NEG:
				e = NEG(operand);
				break;
			case NOT:
				e = Types.evaluationType(operand) == Type.BOOL ? NOT(operand) : BITNOT(operand);
				break;
			default:
				throw new WpException.UnsupportedConstruct("unsupported unary operation " + rval);
		}
		return Substitution.substitute(predicate, target, e);
	}

	private Expr applyAggregate(Mir.LVal lval, Expr.VariableMapping target, RVal.Aggregate rval, Expr predicate) {
		List<Mir.Operand> operands = rval.getOperands();
		if (rval.getKind() != Mir.AggregateKind.TUPLE || operands.size() != 2) {
			throw new WpException.UnsupportedConstruct("unsupported aggregate " + rval);
		}
		String type = resolver.declaredType(lval);
		LinkedHashMap<Expr.VariableMapping, Expr> replacements = new LinkedHashMap<>();
		for (int i = 0; i != operands.size(); ++i) {
			Type ith = Types.fromText(Types.tupleElement(type, i));
			replacements.put(target.field(i, ith), resolver.resolve(operands.get(i)));
		}
		return Substitution.substitute(predicate, replacements);
	}

	private static BinaryOperator operator(BinOp op) {
		switch (op) {
			case ADD:
				return BinaryOperator.ADDITION;
			case SUB:
				return BinaryOperator.SUBTRACTION;
			case MUL:
				return BinaryOperator.MULTIPLICATION;
			case DIV:
				return BinaryOperator.DIVISION;
			case REM:
				return BinaryOperator.MODULO;
			case BITXOR:
				return BinaryOperator.BITWISE_XOR;
			case BITAND:
				return BinaryOperator.BITWISE_AND;
			case BITOR:
				return BinaryOperator.BITWISE_OR;
			case SHL:
				return BinaryOperator.LEFT_SHIFT;
			case SHR:
				return BinaryOperator.RIGHT_SHIFT;
			case EQ:
				return BinaryOperator.EQUAL;
			case LT:
				return BinaryOperator.LESS_THAN;
			case LE:
				return BinaryOperator.LESS_THAN_OR_EQUAL;
			case NE:
				return BinaryOperator.NOT_EQUAL;
			case GE:
				return BinaryOperator.GREATER_THAN_OR_EQUAL;
			case GT:
				return BinaryOperator.GREATER_THAN;
			default:
				throw new WpException.UnsupportedConstruct("unsupported binary operation " + op);
		}
	}
}
