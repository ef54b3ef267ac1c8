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
package wpgen.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * The typed control-flow graph of a single function body, as handed over by a
 * front end. A body consists of declaration tables (arguments, temporaries,
 * locals and the return type) and a list of basic blocks, the first of which is
 * the entry block. Types are given as declared type text (e.g.
 * <code>i32</code> or <code>(u8, bool)</code>) and are only interpreted when a
 * weakest precondition is computed.
 * </p>
 * <p>
 * Everything here is immutable. Blocks refer to each other by index.
 * </p>
 */
public class Mir {

	// =========================================================================
	// Function Body
	// =========================================================================

	public static class Body {
		private final String name;
		private final List<Decl.Argument> arguments;
		private final List<Decl.Temporary> temporaries;
		private final List<Decl.Local> locals;
		private final String returnType;
		private final List<BasicBlock> blocks;

		public Body(String name, List<Decl.Argument> arguments, List<Decl.Temporary> temporaries,
				List<Decl.Local> locals, String returnType, List<BasicBlock> blocks) {
			this.name = name;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			this.temporaries = Collections.unmodifiableList(new ArrayList<>(temporaries));
			this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
			this.returnType = returnType;
			this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
		}

		public String getName() {
			return name;
		}

		public List<Decl.Argument> getArguments() {
			return arguments;
		}

		public List<Decl.Temporary> getTemporaries() {
			return temporaries;
		}

		public List<Decl.Local> getLocals() {
			return locals;
		}

		public String getReturnType() {
			return returnType;
		}

		public List<BasicBlock> getBlocks() {
			return blocks;
		}

		/**
		 * Incrementally assembles a body. Declarations and blocks are numbered in the
		 * order they are added.
		 */
		public static class Builder {
			private final String name;
			private final List<Decl.Argument> arguments = new ArrayList<>();
			private final List<Decl.Temporary> temporaries = new ArrayList<>();
			private final List<Decl.Local> locals = new ArrayList<>();
			private final List<BasicBlock> blocks = new ArrayList<>();
			private String returnType = "()";

			public Builder(String name) {
				this.name = name;
			}

			public Builder argument(String name, String type) {
				arguments.add(new Decl.Argument(name, type));
				return this;
			}

			public Builder temporary(String type) {
				temporaries.add(new Decl.Temporary(type));
				return this;
			}

			public Builder local(String name, String type) {
				locals.add(new Decl.Local(name, type));
				return this;
			}

			public Builder returns(String type) {
				this.returnType = type;
				return this;
			}

			public Builder block(BasicBlock block) {
				blocks.add(block);
				return this;
			}

			public Body build() {
				return new Body(name, arguments, temporaries, locals, returnType, blocks);
			}
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl {

		public String getType();

		public static class Argument implements Decl {
			private final String name;
			private final String type;

			public Argument(String name, String type) {
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			@Override
			public String getType() {
				return type;
			}
		}

		/**
		 * Temporaries are anonymous. Their values are named by position only.
		 */
		public static class Temporary implements Decl {
			private final String type;

			public Temporary(String type) {
				this.type = type;
			}

			@Override
			public String getType() {
				return type;
			}
		}

		public static class Local implements Decl {
			private final String name;
			private final String type;

			public Local(String name, String type) {
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			@Override
			public String getType() {
				return type;
			}
		}
	}

	// =========================================================================
	// Basic Blocks
	// =========================================================================

	public static class BasicBlock {
		private final List<Stmt> statements;
		private final Terminator terminator;

		public BasicBlock(List<Stmt> statements, Terminator terminator) {
			this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
			this.terminator = terminator;
		}

		public List<Stmt> getStatements() {
			return statements;
		}

		/**
		 * Get the terminator of this block. This is <code>null</code> only for
		 * malformed input.
		 *
		 * @return
		 */
		public Terminator getTerminator() {
			return terminator;
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt {

		public static class Assign implements Stmt {
			private final LVal lhs;
			private final RVal rhs;

			public Assign(LVal lhs, RVal rhs) {
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public LVal getLeftHandSide() {
				return lhs;
			}

			public RVal getRightHandSide() {
				return rhs;
			}

			@Override
			public String toString() {
				return lhs + " = " + rhs;
			}
		}

		public static class StorageLive implements Stmt {
			private final LVal operand;

			public StorageLive(LVal operand) {
				this.operand = operand;
			}

			public LVal getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "StorageLive(" + operand + ")";
			}
		}

		public static class StorageDead implements Stmt {
			private final LVal operand;

			public StorageDead(LVal operand) {
				this.operand = operand;
			}

			public LVal getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "StorageDead(" + operand + ")";
			}
		}

		public static class Nop implements Stmt {
			@Override
			public String toString() {
				return "nop";
			}
		}
	}

	// =========================================================================
	// Terminators
	// =========================================================================

	public interface Terminator {

		public static class Goto implements Terminator {
			private final int target;

			public Goto(int target) {
				this.target = target;
			}

			public int getTarget() {
				return target;
			}

			@Override
			public String toString() {
				return "goto -> bb" + target;
			}
		}

		/**
		 * Continue at <code>target</code> when <code>condition == expected</code>,
		 * otherwise panic with the given message.
		 */
		public static class Assert implements Terminator {
			private final Operand condition;
			private final boolean expected;
			private final String message;
			private final int target;

			public Assert(Operand condition, boolean expected, String message, int target) {
				this.condition = condition;
				this.expected = expected;
				this.message = message;
				this.target = target;
			}

			public Operand getCondition() {
				return condition;
			}

			public boolean getExpected() {
				return expected;
			}

			public String getMessage() {
				return message;
			}

			public int getTarget() {
				return target;
			}

			@Override
			public String toString() {
				return "assert(" + (expected ? "" : "!") + condition + ", \"" + message + "\") -> bb" + target;
			}
		}

		public static class Return implements Terminator {
			@Override
			public String toString() {
				return "return";
			}
		}

		public static class If implements Terminator {
			private final Operand condition;
			private final int trueTarget;
			private final int falseTarget;

			public If(Operand condition, int trueTarget, int falseTarget) {
				this.condition = condition;
				this.trueTarget = trueTarget;
				this.falseTarget = falseTarget;
			}

			public Operand getCondition() {
				return condition;
			}

			public int getTrueTarget() {
				return trueTarget;
			}

			public int getFalseTarget() {
				return falseTarget;
			}

			@Override
			public String toString() {
				return "if(" + condition + ") -> [true: bb" + trueTarget + ", false: bb" + falseTarget + "]";
			}
		}

		public static class Call implements Terminator {
			private final Operand function;
			private final List<Operand> arguments;
			private final LVal destination;
			private final Integer target;

			/**
			 * Construct a call. Both <code>destination</code> and <code>target</code>
			 * are <code>null</code> for calls which never return.
			 */
			public Call(Operand function, List<Operand> arguments, LVal destination, Integer target) {
				this.function = function;
				this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
				this.destination = destination;
				this.target = target;
			}

			public Operand getFunction() {
				return function;
			}

			public List<Operand> getArguments() {
				return arguments;
			}

			public LVal getDestination() {
				return destination;
			}

			public Integer getTarget() {
				return target;
			}

			@Override
			public String toString() {
				String r = destination == null ? "" : destination + " = ";
				String args = arguments.toString();
				return r + function + "(" + args.substring(1, args.length() - 1) + ")"
						+ (target == null ? "" : " -> bb" + target);
			}
		}

		/**
		 * Multi-way branch on an enumeration discriminant.
		 */
		public static class Switch implements Terminator {
			private final LVal discriminant;
			private final int[] targets;

			public Switch(LVal discriminant, int... targets) {
				this.discriminant = discriminant;
				this.targets = targets.clone();
			}

			public LVal getDiscriminant() {
				return discriminant;
			}

			public int[] getTargets() {
				return targets.clone();
			}

			@Override
			public String toString() {
				return "switch(" + discriminant + ") -> " + Arrays.toString(targets);
			}
		}

		/**
		 * Multi-way branch on an integer value. The last target is the fallback.
		 */
		public static class SwitchInt implements Terminator {
			private final Operand discriminant;
			private final List<BigInteger> values;
			private final int[] targets;

			public SwitchInt(Operand discriminant, List<BigInteger> values, int... targets) {
				this.discriminant = discriminant;
				this.values = Collections.unmodifiableList(new ArrayList<>(values));
				this.targets = targets.clone();
			}

			public Operand getDiscriminant() {
				return discriminant;
			}

			public List<BigInteger> getValues() {
				return values;
			}

			public int[] getTargets() {
				return targets.clone();
			}

			@Override
			public String toString() {
				return "switchInt(" + discriminant + ") " + values + " -> " + Arrays.toString(targets);
			}
		}

		public static class Drop implements Terminator {
			private final LVal location;
			private final int target;

			public Drop(LVal location, int target) {
				this.location = location;
				this.target = target;
			}

			public LVal getLocation() {
				return location;
			}

			public int getTarget() {
				return target;
			}

			@Override
			public String toString() {
				return "drop(" + location + ") -> bb" + target;
			}
		}

		public static class DropAndReplace implements Terminator {
			private final LVal location;
			private final Operand value;
			private final int target;

			public DropAndReplace(LVal location, Operand value, int target) {
				this.location = location;
				this.value = value;
				this.target = target;
			}

			public LVal getLocation() {
				return location;
			}

			public Operand getValue() {
				return value;
			}

			public int getTarget() {
				return target;
			}

			@Override
			public String toString() {
				return "replace(" + location + " <- " + value + ") -> bb" + target;
			}
		}

		public static class Unreachable implements Terminator {
			@Override
			public String toString() {
				return "unreachable";
			}
		}

		public static class Resume implements Terminator {
			@Override
			public String toString() {
				return "resume";
			}
		}
	}

	// =========================================================================
	// Lvalues
	// =========================================================================

	public interface LVal {

		public static class Argument implements LVal {
			private final int index;

			public Argument(int index) {
				this.index = index;
			}

			public int getIndex() {
				return index;
			}

			@Override
			public String toString() {
				return "arg" + index;
			}
		}

		public static class Temporary implements LVal {
			private final int index;

			public Temporary(int index) {
				this.index = index;
			}

			public int getIndex() {
				return index;
			}

			@Override
			public String toString() {
				return "tmp" + index;
			}
		}

		public static class Local implements LVal {
			private final int index;

			public Local(int index) {
				this.index = index;
			}

			public int getIndex() {
				return index;
			}

			@Override
			public String toString() {
				return "var" + index;
			}
		}

		public static class ReturnPointer implements LVal {
			@Override
			public String toString() {
				return "return";
			}
		}

		public static class Static implements LVal {
			private final String name;

			public Static(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		public static class Projection implements LVal {
			private final LVal base;
			private final ProjectionElem element;

			public Projection(LVal base, ProjectionElem element) {
				this.base = base;
				this.element = element;
			}

			public LVal getBase() {
				return base;
			}

			public ProjectionElem getElement() {
				return element;
			}

			@Override
			public String toString() {
				if (element instanceof ProjectionElem.Field) {
					return base + "." + ((ProjectionElem.Field) element).getIndex();
				} else if (element instanceof ProjectionElem.Index) {
					return base + "[" + ((ProjectionElem.Index) element).getIndex() + "]";
				} else {
					return "(*" + base + ")";
				}
			}
		}
	}

	public interface ProjectionElem {

		public static class Field implements ProjectionElem {
			private final int index;

			public Field(int index) {
				this.index = index;
			}

			public int getIndex() {
				return index;
			}
		}

		public static class Index implements ProjectionElem {
			private final Operand index;

			public Index(Operand index) {
				this.index = index;
			}

			public Operand getIndex() {
				return index;
			}
		}

		public static class Deref implements ProjectionElem {
		}
	}

	// =========================================================================
	// Operands & Literals
	// =========================================================================

	public interface Operand {

		/**
		 * A read of the given location.
		 */
		public static class Consume implements Operand {
			private final LVal lval;

			public Consume(LVal lval) {
				this.lval = lval;
			}

			public LVal getLVal() {
				return lval;
			}

			@Override
			public String toString() {
				return lval.toString();
			}
		}

		public static class Constant implements Operand {
			private final Literal literal;

			public Constant(Literal literal) {
				this.literal = literal;
			}

			public Literal getLiteral() {
				return literal;
			}

			@Override
			public String toString() {
				return "const " + literal;
			}
		}
	}

	public interface Literal {

		public static class Bool implements Literal {
			private final boolean value;

			public Bool(boolean value) {
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public String toString() {
				return Boolean.toString(value);
			}
		}

		/**
		 * An integer constant tagged with its integer kind (e.g. <code>u8</code>).
		 */
		public static class Integer implements Literal {
			private final String kind;
			private final BigInteger value;

			public Integer(String kind, BigInteger value) {
				this.kind = kind;
				this.value = value;
			}

			public String getKind() {
				return kind;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public String toString() {
				return value + kind;
			}
		}

		/**
		 * A reference to a named item, such as a function being called.
		 */
		public static class Item implements Literal {
			private final String path;

			public Item(String path) {
				this.path = path;
			}

			public String getPath() {
				return path;
			}

			@Override
			public String toString() {
				return path;
			}
		}

		public static class Promoted implements Literal {
			private final int index;

			public Promoted(int index) {
				this.index = index;
			}

			public int getIndex() {
				return index;
			}

			@Override
			public String toString() {
				return "promoted[" + index + "]";
			}
		}
	}

	// =========================================================================
	// Rvalues
	// =========================================================================

	public enum BinOp {
		ADD("Add"), SUB("Sub"), MUL("Mul"), DIV("Div"), REM("Rem"), BITXOR("BitXor"), BITAND("BitAnd"),
		BITOR("BitOr"), SHL("Shl"), SHR("Shr"), EQ("Eq"), LT("Lt"), LE("Le"), NE("Ne"), GE("Ge"), GT("Gt");

		private final String label;

		BinOp(String label) {
			this.label = label;
		}

		@Override
		public String toString() {
			return label;
		}
	}

	public enum UnOp {
		NOT, NEG
	}

	public enum AggregateKind {
		TUPLE, ARRAY, ADT, CLOSURE
	}

	public interface RVal {

		public static class Use implements RVal {
			private final Operand operand;

			public Use(Operand operand) {
				this.operand = operand;
			}

			public Operand getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return operand.toString();
			}
		}

		public static class BinaryOp implements RVal {
			private final BinOp op;
			private final Operand lhs;
			private final Operand rhs;

			public BinaryOp(BinOp op, Operand lhs, Operand rhs) {
				this.op = op;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public BinOp getOperator() {
				return op;
			}

			public Operand getLeftHandSide() {
				return lhs;
			}

			public Operand getRightHandSide() {
				return rhs;
			}

			@Override
			public String toString() {
				return op + "(" + lhs + ", " + rhs + ")";
			}
		}

		/**
		 * A binary operation producing a pair: the (wrapped) result and an overflow
		 * flag.
		 */
		public static class CheckedBinaryOp extends BinaryOp {
			public CheckedBinaryOp(BinOp op, Operand lhs, Operand rhs) {
				super(op, lhs, rhs);
			}

			@Override
			public String toString() {
				return "Checked" + super.toString();
			}
		}

		public static class UnaryOp implements RVal {
			private final UnOp op;
			private final Operand operand;

			public UnaryOp(UnOp op, Operand operand) {
				this.op = op;
				this.operand = operand;
			}

			public UnOp getOperator() {
				return op;
			}

			public Operand getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return (op == UnOp.NOT ? "Not" : "Neg") + "(" + operand + ")";
			}
		}

		public static class Aggregate implements RVal {
			private final AggregateKind kind;
			private final List<Operand> operands;

			public Aggregate(AggregateKind kind, List<Operand> operands) {
				this.kind = kind;
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			public AggregateKind getKind() {
				return kind;
			}

			public List<Operand> getOperands() {
				return operands;
			}

			@Override
			public String toString() {
				return kind.name().toLowerCase() + operands;
			}
		}

		public static class Cast implements RVal {
			private final Operand operand;
			private final String type;

			public Cast(Operand operand, String type) {
				this.operand = operand;
				this.type = type;
			}

			public Operand getOperand() {
				return operand;
			}

			public String getType() {
				return type;
			}

			@Override
			public String toString() {
				return operand + " as " + type;
			}
		}

		public static class Ref implements RVal {
			private final LVal operand;
			private final boolean mutable;

			public Ref(LVal operand, boolean mutable) {
				this.operand = operand;
				this.mutable = mutable;
			}

			public LVal getOperand() {
				return operand;
			}

			public boolean isMutable() {
				return mutable;
			}

			@Override
			public String toString() {
				return (mutable ? "&mut " : "&") + operand;
			}
		}

		public static class Box implements RVal {
			private final String type;

			public Box(String type) {
				this.type = type;
			}

			public String getType() {
				return type;
			}

			@Override
			public String toString() {
				return "box " + type;
			}
		}

		public static class Len implements RVal {
			private final LVal operand;

			public Len(LVal operand) {
				this.operand = operand;
			}

			public LVal getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "Len(" + operand + ")";
			}
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	// Blocks & Statements

	public static BasicBlock BLOCK(Terminator terminator, Stmt... stmts) {
		return new BasicBlock(Arrays.asList(stmts), terminator);
	}

	public static Stmt.Assign ASSIGN(LVal lhs, RVal rhs) {
		return new Stmt.Assign(lhs, rhs);
	}

	// Terminators

	public static Terminator.Goto GOTO(int target) {
		return new Terminator.Goto(target);
	}

	public static Terminator.Return RETURN() {
		return new Terminator.Return();
	}

	public static Terminator.If IF(Operand condition, int trueTarget, int falseTarget) {
		return new Terminator.If(condition, trueTarget, falseTarget);
	}

	public static Terminator.Assert ASSERT(Operand condition, boolean expected, String message, int target) {
		return new Terminator.Assert(condition, expected, message, target);
	}

	public static Terminator.Call CALL(String function, Operand... arguments) {
		return new Terminator.Call(new Operand.Constant(new Literal.Item(function)), Arrays.asList(arguments), null,
				null);
	}

	// Lvalues

	public static LVal.Argument ARGUMENT(int index) {
		return new LVal.Argument(index);
	}

	public static LVal.Temporary TEMP(int index) {
		return new LVal.Temporary(index);
	}

	public static LVal.Local LOCAL(int index) {
		return new LVal.Local(index);
	}

	public static LVal.ReturnPointer RETURN_POINTER() {
		return new LVal.ReturnPointer();
	}

	public static LVal.Projection FIELD(LVal base, int field) {
		return new LVal.Projection(base, new ProjectionElem.Field(field));
	}

	// Operands

	public static Operand.Consume CONSUME(LVal lval) {
		return new Operand.Consume(lval);
	}

	public static Operand.Constant LITERAL(boolean b) {
		return new Operand.Constant(new Literal.Bool(b));
	}

	public static Operand.Constant LITERAL(String kind, long value) {
		return new Operand.Constant(new Literal.Integer(kind, BigInteger.valueOf(value)));
	}

	public static Operand.Constant LITERAL(String kind, BigInteger value) {
		return new Operand.Constant(new Literal.Integer(kind, value));
	}

	// Rvalues

	public static RVal.Use USE(Operand operand) {
		return new RVal.Use(operand);
	}

	public static RVal.BinaryOp BINOP(BinOp op, Operand lhs, Operand rhs) {
		return new RVal.BinaryOp(op, lhs, rhs);
	}

	public static RVal.CheckedBinaryOp CHECKED(BinOp op, Operand lhs, Operand rhs) {
		return new RVal.CheckedBinaryOp(op, lhs, rhs);
	}

	public static RVal.UnaryOp UNOP(UnOp op, Operand operand) {
		return new RVal.UnaryOp(op, operand);
	}

	public static RVal.Aggregate TUPLE(Operand... operands) {
		return new RVal.Aggregate(AggregateKind.TUPLE, Arrays.asList(operands));
	}

	public static RVal.Cast CAST(Operand operand, String type) {
		return new RVal.Cast(operand, type);
	}

	public static RVal.Ref REF(LVal operand) {
		return new RVal.Ref(operand, false);
	}
}
