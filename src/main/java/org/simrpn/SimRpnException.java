/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.simrpn;

/**
 * Raised by the tokeniser and evaluator, the whole call is aborted but earlier side effects are kept
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class SimRpnException extends Exception {
	private static final long serialVersionUID = 1L;

	/** What went wrong */
	public static enum Kind {
		LEX,
		STACK_UNDERFLOW,
		UNKNOWN_TOKEN,
		HISTORY_REFERENCE,
		FUNCTION_ARITY,
		UNTERMINATED_BLOCK,
		SLOT_RANGE,
		DEPTH_LIMIT
	}

	private final Kind kind;

	public SimRpnException (Kind kind, String message) {
		super (message);
		this.kind = kind;
	}

	/**
	 * Gets the kind of failure
	 *
	 * @return The failure kind, never null
	 */
	public Kind getKind () {
		return kind;
	}
}
