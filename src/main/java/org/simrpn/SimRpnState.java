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

import static org.simrpn.SimRpn.logV;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;

/**
 * The state bundle an evaluation runs against: persistent variables, simvars, the function library and the
 * result history. Session registers are not part of it, they never outlive one evaluator entry.
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class SimRpnState {
	private static final String LOG_TAG = SimRpnState.class.getSimpleName ();

	/** Number of persistent variable slots, and of session register slots */
	public static final int SLOTS = 10;

	/** Number of result stacks kept in the history */
	public static final int HISTORY_LIMIT = 8;

	private final double[] variables = new double[SLOTS];
	private SimVars simVars = new SimVars ();
	private final LinkedHashMap<String, Function> functions = new LinkedHashMap<String, Function> ();
	private final LinkedList<List<Double>> results = new LinkedList<List<Double>> ();

	/** A library function, its body is tokenised on first call and not validated before */
	public static final class Function {
		final String name;
		final int params;
		final String rpn;
		private List<SimRpn.Token> body = null;

		public Function (String name, int params, String rpn) {
			this.name = name;
			this.params = params;
			this.rpn = rpn;
		}

		public String getName () {
			return name;
		}

		public int getParams () {
			return params;
		}

		public String getRpn () {
			return rpn;
		}

		/**
		 * Tokenises the body, once
		 *
		 * @return The body tokens, shared so callers must copy before altering
		 * @throws SimRpnException If the body cannot be tokenised
		 */
		List<SimRpn.Token> body () throws SimRpnException {
			if (body == null)
				body = SimRpn.tokenise (rpn);

			return body;
		}
	}

	/**
	 * Gets a persistent variable
	 *
	 * @param slot Slot number
	 * @return The value, or 0 for a slot outside the range
	 */
	public double variableGet (int slot) {
		return (slot < 0 || slot >= SLOTS ? 0 : variables[slot]);
	}

	/**
	 * Sets a persistent variable
	 *
	 * @param slot Slot number, 0 to {@link #SLOTS} - 1
	 * @param value Value to store
	 */
	public void variableSet (int slot, double value) {
		if (SimRpn.DEBUG)
			logV (LOG_TAG, "Setting variable: s" + slot + "=" + value);

		variables[slot] = value;
	}

	/**
	 * Retrieves the persistent variables, the array is live and always {@link #SLOTS} long
	 */
	public double[] variablesGet () {
		return variables;
	}

	/**
	 * Stores the persistent variables, padding short input with zeros and ignoring anything past the last slot
	 *
	 * @param values Values as loaded, may be null
	 */
	public void variablesSet (double[] values) {
		for (int i = 0; i < SLOTS; ++i)
			variables[i] = (values != null && i < values.length ? values[i] : 0);
	}

	/**
	 * Zeroes all persistent variables
	 */
	public void variablesReset () {
		variablesSet (null);
	}

	/**
	 * Retrieves the simvar store
	 */
	public SimVars simVarsGet () {
		return simVars;
	}

	/**
	 * Replaces the simvar store
	 *
	 * @param simVars The new store
	 */
	public void simVarsSet (SimVars simVars) {
		this.simVars = (simVars == null ? new SimVars () : simVars);
	}

	/**
	 * Adds a function to the library, replacing one with the same name
	 *
	 * @param function The function to add
	 */
	public void functionAdd (Function function) {
		functions.put (function.name, function);
	}

	/**
	 * Adds a function to the library, replacing one with the same name
	 *
	 * @param name Name used to call it
	 * @param params Number of parameters, p1 to pN in the body
	 * @param rpn The body in postfix notation
	 */
	public void functionAdd (String name, int params, String rpn) {
		functionAdd (new Function (name, params, rpn));
	}

	/**
	 * Gets a function
	 *
	 * @param name Function name
	 * @return The function, or null if there is none by that name
	 */
	public Function functionGet (String name) {
		return functions.get (name);
	}

	/**
	 * Retrieves all functions in the order they were added
	 */
	public Collection<Function> functionsGet () {
		return functions.values ();
	}

	/**
	 * Empties the function library
	 */
	public void functionRemoveAll () {
		functions.clear ();
	}

	/**
	 * Prepends a result stack to the history, dropping the oldest past {@link #HISTORY_LIMIT}
	 *
	 * @param stack The result stack
	 */
	public void resultPush (List<Double> stack) {
		results.addFirst (new ArrayList<Double> (stack));
		while (results.size () > HISTORY_LIMIT)
			results.removeLast ();
	}

	/**
	 * Appends a result stack to the history as loaded, oldest last
	 *
	 * @param stack The result stack
	 */
	public void resultAppend (List<Double> stack) {
		if (results.size () < HISTORY_LIMIT)
			results.addLast (new ArrayList<Double> (stack));
	}

	/**
	 * Retrieves the result history, most recent first
	 */
	public List<List<Double>> resultsGet () {
		return results;
	}

	/**
	 * Deep copy for scratch evaluations which must not touch the real state
	 *
	 * @return An independent state, functions are shared as they are immutable
	 */
	public SimRpnState copy () {
		SimRpnState state = new SimRpnState ();
		state.variablesSet (variables);
		state.simVars = simVars.copy ();
		state.functions.putAll (functions);
		for (List<Double> stack : results)
			state.results.addLast (new ArrayList<Double> (stack));

		return state;
	}
}
