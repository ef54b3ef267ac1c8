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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wpgen.core.Logic.Expr;
import wpgen.core.Mir;

/**
 * Receives progress notifications during weakest precondition generation. This
 * is purely observational: an observer cannot affect the result.
 */
public interface WpObserver {

	/**
	 * Called when the statements of a block are about to be folded, with the
	 * predicate contributed by its terminator.
	 *
	 * @param block
	 * @param predicate
	 */
	public void enterBlock(int block, Expr predicate);

	/**
	 * Called after one statement has been folded into the predicate.
	 *
	 * @param block
	 * @param statement
	 * @param before    predicate holding after the statement
	 * @param after     predicate holding before the statement
	 */
	public void exitStatement(int block, Mir.Stmt statement, Expr before, Expr after);

	/**
	 * Called when a block's weakest precondition is complete.
	 *
	 * @param block
	 * @param predicate
	 */
	public default void exitBlock(int block, Expr predicate) {
	}

	public static final WpObserver NULL = new WpObserver() {
		@Override
		public void enterBlock(int block, Expr predicate) {
		}

		@Override
		public void exitStatement(int block, Mir.Stmt statement, Expr before, Expr after) {
		}
	};

	/**
	 * Writes every notification to the log at debug level.
	 */
	public static final WpObserver LOGGING = new WpObserver() {
		private final Logger logger = LoggerFactory.getLogger(WpObserver.class);

		@Override
		public void enterBlock(int block, Expr predicate) {
			logger.debug("processing bb{} with {}", block, predicate);
		}

		@Override
		public void exitStatement(int block, Mir.Stmt statement, Expr before, Expr after) {
			if (logger.isDebugEnabled()) {
				logger.debug("bb{}: {}\n\tinto {}\n\tgives {}", block, statement, before, after);
			}
		}

		@Override
		public void exitBlock(int block, Expr predicate) {
			logger.debug("bb{} returned {}", block, predicate);
		}
	};
}
