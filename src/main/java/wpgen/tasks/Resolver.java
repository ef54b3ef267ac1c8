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

import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.Mir;
import wpgen.core.Mir.LVal;
import wpgen.core.Mir.Literal;
import wpgen.core.Mir.Operand;
import wpgen.core.Mir.ProjectionElem;
import wpgen.core.WpException;
import wpgen.util.Types;

/**
 * Resolves the places, operands and literals of a function body into the
 * variables and leaves of the logic. Arguments keep their declared names,
 * whilst temporaries, locals and the return slot are given the names
 * <code>tmpN</code>, <code>varN</code> and <code>return</code>. A field of a
 * tuple is named after its base, as in <code>tmp3.0</code>.
 */
public class Resolver {
	private static final Pattern RESERVED = Pattern.compile("(tmp|var)[0-9]+|return");

	private final Mir.Body body;

	public Resolver(Mir.Body body) {
		this.body = body;
		checkArguments(body.getArguments());
	}

	/**
	 * Resolve an lvalue to the variable it denotes.
	 *
	 * @param lval
	 * @return
	 */
	public Expr.VariableMapping resolve(LVal lval) {
		if (lval instanceof LVal.Argument) {
			Mir.Decl.Argument decl = argument(((LVal.Argument) lval).getIndex());
			return VAR(decl.getName(), Types.fromText(decl.getType()));
		} else if (lval instanceof LVal.Temporary) {
			int index = ((LVal.Temporary) lval).getIndex();
			String type = temporary(index).getType();
			if (Types.isTuple(type)) {
				// A tuple temporary stands for its first element
				type = Types.tupleElement(type, 0);
			}
			return VAR("tmp" + index, Types.fromText(type));
		} else if (lval instanceof LVal.Local) {
			int index = ((LVal.Local) lval).getIndex();
			return VAR("var" + index, Types.fromText(local(index).getType()));
		} else if (lval instanceof LVal.ReturnPointer) {
			return VAR("return", Types.fromText(body.getReturnType()));
		} else if (lval instanceof LVal.Projection) {
			LVal.Projection p = (LVal.Projection) lval;
			int field = field(p);
			return VAR(baseName(p.getBase()) + "." + field, Types.fromText(declaredType(lval)));
		} else {
			throw new WpException.UnsupportedConstruct("unsupported lvalue " + lval);
		}
	}

	/**
	 * Determine the declared type text of an lvalue. For a tuple this is the
	 * whole tuple type, rather than that of its first element.
	 *
	 * @param lval
	 * @return
	 */
	public String declaredType(LVal lval) {
		if (lval instanceof LVal.Argument) {
			return argument(((LVal.Argument) lval).getIndex()).getType();
		} else if (lval instanceof LVal.Temporary) {
			return temporary(((LVal.Temporary) lval).getIndex()).getType();
		} else if (lval instanceof LVal.Local) {
			return local(((LVal.Local) lval).getIndex()).getType();
		} else if (lval instanceof LVal.ReturnPointer) {
			return body.getReturnType();
		} else if (lval instanceof LVal.Projection) {
			LVal.Projection p = (LVal.Projection) lval;
			int field = field(p);
			baseName(p.getBase());
			return Types.tupleElement(declaredType(p.getBase()), field);
		} else {
			throw new WpException.UnsupportedConstruct("unsupported lvalue " + lval);
		}
	}

	public Expr resolve(Operand operand) {
		if (operand instanceof Operand.Consume) {
			return resolve(((Operand.Consume) operand).getLVal());
		} else if (operand instanceof Operand.Constant) {
			return resolve(((Operand.Constant) operand).getLiteral());
		} else {
			throw new WpException.UnsupportedConstruct("unsupported operand " + operand);
		}
	}

	public Expr resolve(Literal literal) {
		if (literal instanceof Literal.Bool) {
			return CONST(((Literal.Bool) literal).getValue());
		} else if (literal instanceof Literal.Integer) {
			Literal.Integer i = (Literal.Integer) literal;
			Type type = Types.fromKind(i.getKind());
			if (!type.contains(i.getValue())) {
				throw new WpException.UnsupportedConstruct("literal " + literal + " out of range");
			}
			return CONST(type, i.getValue());
		} else {
			throw new WpException.UnsupportedConstruct("unsupported constant " + literal);
		}
	}

	private String baseName(LVal lval) {
		if (lval instanceof LVal.Argument) {
			return argument(((LVal.Argument) lval).getIndex()).getName();
		} else if (lval instanceof LVal.Temporary) {
			int index = ((LVal.Temporary) lval).getIndex();
			temporary(index);
			return "tmp" + index;
		} else if (lval instanceof LVal.Local) {
			int index = ((LVal.Local) lval).getIndex();
			local(index);
			return "var" + index;
		} else if (lval instanceof LVal.ReturnPointer) {
			throw new WpException.UnsupportedConstruct("projection of return value");
		} else {
			throw new WpException.UnsupportedConstruct("unsupported projection base " + lval);
		}
	}

	private static int field(LVal.Projection p) {
		ProjectionElem element = p.getElement();
		if (element instanceof ProjectionElem.Field) {
			return ((ProjectionElem.Field) element).getIndex();
		}
		throw new WpException.UnsupportedConstruct("unsupported projection " + p);
	}

	private Mir.Decl.Argument argument(int index) {
		return lookup(body.getArguments(), index, "argument");
	}

	private Mir.Decl.Temporary temporary(int index) {
		return lookup(body.getTemporaries(), index, "temporary");
	}

	private Mir.Decl.Local local(int index) {
		return lookup(body.getLocals(), index, "local");
	}

	private static <T> T lookup(List<T> decls, int index, String kind) {
		if (index < 0 || index >= decls.size()) {
			throw new WpException.InvariantViolation("undeclared " + kind + " " + index);
		}
		return decls.get(index);
	}

	private static void checkArguments(List<Mir.Decl.Argument> arguments) {
		HashSet<String> names = new HashSet<>();
		for (Mir.Decl.Argument arg : arguments) {
			String name = arg.getName();
			if (RESERVED.matcher(name).matches()) {
				throw new WpException.InvariantViolation("argument name \"" + name + "\" is reserved");
			} else if (!names.add(name)) {
				throw new WpException.InvariantViolation("duplicate argument \"" + name + "\"");
			}
		}
	}
}
