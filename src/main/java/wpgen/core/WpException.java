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

/**
 * Signals that a weakest precondition cannot be generated for a function body.
 * Every such failure is fatal for the function concerned: no partial
 * precondition is ever produced. Where known, the offending block and statement
 * are recorded and reported as part of the message.
 */
@SuppressWarnings("serial")
public abstract class WpException extends RuntimeException {
	/**
	 * Index of the enclosing basic block, or <code>-1</code> if not known.
	 */
	private final int block;
	/**
	 * Index of the offending statement within its block, or <code>-1</code> if the
	 * problem lies with the block's terminator (or is not known).
	 */
	private final int statement;

	protected WpException(String message, int block, int statement) {
		super(message);
		this.block = block;
		this.statement = statement;
	}

	public int getBlock() {
		return block;
	}

	public int getStatement() {
		return statement;
	}

	public boolean hasLocation() {
		return block >= 0;
	}

	/**
	 * Get the message without location information.
	 *
	 * @return
	 */
	public String getReason() {
		return super.getMessage();
	}

	/**
	 * Create a copy of this exception which records the given location.
	 *
	 * @param block
	 * @param statement
	 * @return
	 */
	public abstract WpException at(int block, int statement);

	@Override
	public String getMessage() {
		String msg = super.getMessage();
		if (block < 0) {
			return msg;
		} else if (statement < 0) {
			return msg + " at bb" + block;
		} else {
			return msg + " at bb" + block + "[" + statement + "]";
		}
	}

	/**
	 * A construct which cannot be modelled, such as a loop, a multi-way branch, a
	 * call which is not a panic or a heap operation.
	 */
	public static class UnsupportedConstruct extends WpException {
		public UnsupportedConstruct(String message) {
			this(message, -1, -1);
		}

		private UnsupportedConstruct(String message, int block, int statement) {
			super(message, block, statement);
		}

		@Override
		public UnsupportedConstruct at(int block, int statement) {
			UnsupportedConstruct e = new UnsupportedConstruct(getReason(), block, statement);
			e.setStackTrace(getStackTrace());
			return e;
		}
	}

	/**
	 * Declared type text which does not correspond to a supported semantic type.
	 */
	public static class TypeResolution extends WpException {
		private final String type;

		public TypeResolution(String type) {
			this(type, -1, -1);
		}

		private TypeResolution(String type, int block, int statement) {
			super("unsupported type \"" + type + "\"", block, statement);
			this.type = type;
		}

		public String getType() {
			return type;
		}

		@Override
		public TypeResolution at(int block, int statement) {
			TypeResolution e = new TypeResolution(type, block, statement);
			e.setStackTrace(getStackTrace());
			return e;
		}
	}

	/**
	 * Input which breaks the assumed shape of a function body (e.g. a block
	 * without a terminator). This indicates a bug in the front end rather than an
	 * unsupported program.
	 */
	public static class InvariantViolation extends WpException {
		public InvariantViolation(String message) {
			this(message, -1, -1);
		}

		private InvariantViolation(String message, int block, int statement) {
			super(message, block, statement);
		}

		@Override
		public InvariantViolation at(int block, int statement) {
			InvariantViolation e = new InvariantViolation(getReason(), block, statement);
			e.setStackTrace(getStackTrace());
			return e;
		}
	}
}
