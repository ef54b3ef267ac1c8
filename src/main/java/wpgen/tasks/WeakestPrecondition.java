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

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.Mir;
import wpgen.core.Mir.Terminator;
import wpgen.core.WpException;
import wpgen.util.Types;
import wpgen.util.WpObserver;

/**
 * Computes the weakest precondition of a function body with respect to a given
 * postcondition. This works backwards through the control-flow graph, starting
 * from the entry block. The predicate for a block is obtained by first
 * determining that of its terminator (which may require the predicates of its
 * successors), and then folding its statements from last to first. For
 * example, consider this body:
 *
 * <pre>
 * bb0: {
 *   tmp0 := Gt(x, const 0_i32)
 *   If(tmp0) -&gt; [bb1, bb2]
 * }
 * bb1: { return := Use(x); Return }
 * bb2: { return := Neg(x); Return }
 * </pre>
 *
 * With postcondition <code>return &gt;= 0</code> this produces:
 *
 * <pre>
 * ((x &gt; 0) ==&gt; (x &gt;= 0)) &amp;&amp; (!(x &gt; 0) ==&gt; (-x &gt;= 0))
 * </pre>
 *
 * Control-flow graphs containing loops cannot be handled, as this would require
 * loop invariants. Likewise, the only calls permitted are to the panic
 * machinery, since these never return.
 */
public class WeakestPrecondition {
	private static final Logger logger = LoggerFactory.getLogger(WeakestPrecondition.class);

	private WpObserver observer = WpObserver.NULL;

	/**
	 * Substrings identifying a call to the panic machinery.
	 */
	private List<String> panicMarkers = Arrays.asList("begin_panic");

	public WeakestPrecondition setObserver(WpObserver observer) {
		this.observer = observer == null ? WpObserver.NULL : observer;
		return this;
	}

	public WeakestPrecondition setPanicMarkers(String... markers) {
		this.panicMarkers = Arrays.asList(markers);
		return this;
	}

	/**
	 * Compute the weakest precondition of a given body with respect to a given
	 * postcondition.
	 *
	 * @param body
	 * @param postcondition
	 * @return
	 * @throws WpException if the body contains anything which cannot be handled.
	 */
	public Expr compute(Mir.Body body, Expr postcondition) {
		logger.debug("computing precondition of {} for {}", body.getName(), postcondition);
		Context context = new Context(body, postcondition);
		Expr wp = context.visitBlock(0);
		logger.debug("precondition of {} is {}", body.getName(), wp);
		return wp;
	}

	/**
	 * State for a single computation.
	 */
	private class Context {
		private final Mir.Body body;
		private final Expr postcondition;
		private final StatementProcessor processor;
		private final HashMap<Integer, Expr> cache = new HashMap<>();
		private final HashSet<Integer> path = new HashSet<>();

		public Context(Mir.Body body, Expr postcondition) {
			this.body = body;
			this.postcondition = postcondition;
			this.processor = new StatementProcessor(new Resolver(body));
		}

		public Expr visitBlock(int index) {
			List<Mir.BasicBlock> blocks = body.getBlocks();
			if (index < 0 || index >= blocks.size()) {
				throw new WpException.InvariantViolation("invalid block bb" + index);
			}
			Expr wp = cache.get(index);
			if (wp != null) {
				return wp;
			}
			Mir.BasicBlock block = blocks.get(index);
			if (block.getTerminator() == null) {
				throw new WpException.InvariantViolation("missing terminator").at(index, -1);
			}
			path.add(index);
			try {
				wp = visitTerminator(index, block.getTerminator());
			} catch (WpException e) {
				throw e.hasLocation() ? e : e.at(index, -1);
			} finally {
				path.remove(index);
			}
			observer.enterBlock(index, wp);
			List<Mir.Stmt> stmts = block.getStatements();
			for (int i = stmts.size() - 1; i >= 0; --i) {
				Mir.Stmt stmt = stmts.get(i);
				Expr before = wp;
				try {
					wp = processor.apply(stmt, before);
				} catch (WpException e) {
					throw e.at(index, i);
				}
				observer.exitStatement(index, stmt, before, wp);
			}
			observer.exitBlock(index, wp);
			cache.put(index, wp);
			return wp;
		}

		private Expr visitTerminator(int index, Terminator terminator) {
			if (terminator instanceof Terminator.Goto) {
				return visitSuccessor(index, ((Terminator.Goto) terminator).getTarget());
			} else if (terminator instanceof Terminator.Assert) {
				return visitSuccessor(index, ((Terminator.Assert) terminator).getTarget());
			} else if (terminator instanceof Terminator.Return) {
				return postcondition;
			} else if (terminator instanceof Terminator.If) {
				return visitIf(index, (Terminator.If) terminator);
			} else if (terminator instanceof Terminator.Call) {
				return visitCall((Terminator.Call) terminator);
			} else {
				throw new WpException.UnsupportedConstruct("unsupported terminator " + terminator);
			}
		}

		private Expr visitIf(int index, Terminator.If terminator) {
			Expr condition = processor.getResolver().resolve(terminator.getCondition());
			if (Types.evaluationType(condition) != Type.BOOL) {
				throw new WpException.UnsupportedConstruct("non-boolean branch condition " + condition);
			}
			Expr trueBranch = visitSuccessor(index, terminator.getTrueTarget());
			Expr falseBranch = visitSuccessor(index, terminator.getFalseTarget());
			return AND(IMPLIES(condition, trueBranch), IMPLIES(NOT(condition), falseBranch));
		}

		private Expr visitCall(Terminator.Call terminator) {
			Mir.Operand function = terminator.getFunction();
			if (function instanceof Mir.Operand.Constant) {
				Mir.Literal literal = ((Mir.Operand.Constant) function).getLiteral();
				if (literal instanceof Mir.Literal.Item && isPanic(((Mir.Literal.Item) literal).getPath())) {
					// Never returns
					return CONST(false);
				}
			}
			throw new WpException.UnsupportedConstruct("unsupported call " + terminator);
		}

		private Expr visitSuccessor(int index, int target) {
			if (path.contains(target)) {
				throw new WpException.UnsupportedConstruct("loop back-edge bb" + index + " -> bb" + target);
			}
			return visitBlock(target);
		}
	}

	private boolean isPanic(String path) {
		for (String marker : panicMarkers) {
			if (path.contains(marker)) {
				return true;
			}
		}
		return false;
	}
}
