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

package org.simrpn.example;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;
import org.simrpn.SimRpn;
import org.simrpn.SimRpnException;
import org.simrpn.SimRpnState;
import org.simrpn.SimRpnStep;
import org.simrpn.SimRpnStore;

/**
 * SimRpn for Java
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class Main {
	/** Nesting depth the command line allows before giving up on a runaway function */
	private static final int WATCHDOG_DEPTH = 1000;

	/**
	 * @param args The command line options when invoked
	 */
	public static void main (String[] args) {
		System.exit (run (args));
	}

	/**
	 * Runs one command line invocation
	 *
	 * @param args The command line options
	 * @return The return code for the invoking shell
	 */
	static int run (String[] args) {
		// Process command line flags
		List <String> params = Arrays.asList (args);
		boolean paramHelp = params.contains ("--help") || params.contains ("-?");
		boolean paramStep = params.contains ("--step") || params.contains ("-s");
		boolean paramEndStep = params.contains ("--endstep");
		boolean paramInfix = params.contains ("--infix") || params.contains ("-i");
		boolean paramPrecompile = params.contains ("--precompile") || params.contains ("-p");
		boolean paramNoColour = params.contains ("--nocolor") || params.contains ("-c") || params.contains ("-n");
		boolean paramMark = params.contains ("--mark") || params.contains ("-m");
		boolean paramNoPrompt = params.contains ("--noprompt");
		boolean paramPrint = params.contains ("--print");
		boolean paramReset = params.contains ("--reset");
		boolean paramToInfix = params.contains ("--toinfix");

		SimRpnStore store = SimRpnStore.fromEnvironment ();

		if (paramReset) { // Zero the persistent variables and stop
			try {
				store.variablesSave (new double[SimRpnState.SLOTS]);
			} catch (IOException e) {
				System.err.println ("Error: cannot write " + store.stateFileGet () + ": " + e.getMessage ());
				return 1;
			}

			System.out.println ("Variables s0..s9 reset.");
			System.out.println ("State file: " + store.stateFileGet ());
			return 0;
		}

		if (paramPrint) { // Show the persistent variables and stop
			System.out.println ("Persistent variables (s0..s9): " + Arrays.toString (store.variablesLoad ()));
			System.out.println ("State file: " + store.stateFileGet ());
			return 0;
		}

		boolean hasExpression = (args.length > 0 && !args[0].startsWith ("-"));
		if (paramHelp || !hasExpression) {
			usage (store);
			if (!hasExpression)
				return 2;
		}

		String expression = args[0];

		// Inline context, laid over what was loaded
		JSONObject context = new JSONObject ();
		int contextIndex = params.indexOf ("--ctx");
		if (contextIndex != -1) {
			if (contextIndex + 1 >= args.length) {
				System.err.println ("Error: --ctx requires a JSON argument");
				return 2;
			}

			try {
				context = new JSONObject (args[contextIndex + 1]);
			} catch (JSONException e) {
				System.err.println ("Error: --ctx is not valid JSON: " + e.getMessage ());
				return 2;
			}
		}

		SimRpnState state = store.load (new SimRpnState ());
		if (!store.stderr.isEmpty ())
			System.err.println (store.stderr);

		JSONObject contextSimVars = context.optJSONObject ("simvars");
		if (contextSimVars != null)
			state.simVarsGet ().merge (SimRpnStore.simVarsParse (contextSimVars));

		HashMap<String, Double> bindings = new HashMap<String, Double> ();
		JSONObject contextParams = context.optJSONObject ("params");
		if (contextParams != null) {
			for (String name : contextParams.keySet ())
				bindings.put (name, SimRpnStore.numberCoerce (contextParams.opt (name)));
		}

		List<SimRpn.Token> tokens;
		try {
			tokens = SimRpn.tokenise (expression);

			if (paramToInfix) { // Render only, nothing is evaluated
				System.out.println (SimRpnStep.postfixToInfix (tokens));
				return 0;
			}
		} catch (SimRpnException e) {
			System.out.println ("Error: " + e.getMessage ());
			return 1;
		}

		// Ask for any parameter the context did not bind
		try {
			prompt (SimRpn.parametersMissing (tokens, bindings), bindings, paramNoPrompt);
		} catch (IOException e) {
			System.err.println ("Error: cannot read parameters: " + e.getMessage ());
			return 1;
		}

		// Create a new instance over the loaded state
		SimRpn simRpn = new SimRpn (state);
		simRpn.watchdogSet (WATCHDOG_DEPTH);
		simRpn.precompileSet (paramPrecompile);

		boolean success = simRpn.run (expression, bindings);
		if (!success) {
			System.out.println (simRpn.stderr);
			return 1;
		}

		SimRpn.Outcome outcome = simRpn.outcomeGet ();

		// Only a successful run is saved
		try {
			store.variablesSave (outcome.variables);

			if (outcome.isSimVarsDirty ())
				store.simVarsSave (outcome.simVars);

			if (!SimRpn.isResultReference (tokens))
				store.resultsSave (state.resultsGet ());
		} catch (IOException e) {
			System.err.println ("Error: cannot save state: " + e.getMessage ());
			return 1;
		}

		if (paramStep || paramEndStep) {
			SimRpnStep step = new SimRpnStep (simRpn, outcome.registers);
			step.colourSet (!paramNoColour);
			step.markerSet (paramMark);
			step.endStepSet (paramEndStep);
			step.infixSet (paramInfix);
			step.outputSet (System.out);

			try {
				step.visualise (paramPrecompile ? simRpn.precompile (tokens) : tokens);
			} catch (SimRpnException e) {
				System.out.println ("Error: " + e.getMessage ());
				return 1;
			}
		} else {
			System.out.println (simRpn.stdout);
		}

		return 0;
	}

	/**
	 * Reads a value for each missing parameter from standard input, a blank or unparsable line counts as 0
	 *
	 * @param missing Parameter names in the order to ask
	 * @param bindings Where the answers are stored
	 * @param silent True to read without printing a label
	 * @throws IOException If standard input fails
	 */
	private static void prompt (List<String> missing, Map<String, Double> bindings, boolean silent) throws IOException {
		if (missing.isEmpty ())
			return;

		BufferedReader reader = new BufferedReader (new InputStreamReader (System.in, StandardCharsets.UTF_8));
		for (String name : missing) {
			if (!silent) {
				System.out.print ("Parameter " + name + ": ");
				System.out.flush ();
			}

			String line = reader.readLine ();
			bindings.put (name, SimRpn.numberExtract (line, 0));
		}
	}

	private static void usage (SimRpnStore store) {
		System.out.println ("SimRpn for Java (v " + SimRpn.VERSION_MAJOR + "." + SimRpn.VERSION_MINOR + ")\n");
		System.out.println ("Usage:  java -jar simrpn.jar \"<expr>\" [options]");
		System.out.println ("");
		System.out.println ("Options:");
		System.out.println ("   --step, -s         Show each reduction step");
		System.out.println ("   --endstep          Also show the expression after each step with the result marked");
		System.out.println ("   --infix, -i        Describe steps in infix, such as \"9 - 5 = 4\"");
		System.out.println ("   --precompile, -p   Replace function names by their bodies, without pN, first");
		System.out.println ("   --nocolor, -c, -n  No colours");
		System.out.println ("   --mark, -m         Mark with a yellow background");
		System.out.println ("   --noprompt         Read parameters without printing labels");
		System.out.println ("   --ctx JSON         Inline context, {\"params\": {...}, \"simvars\": {...}}");
		System.out.println ("   --toinfix          Print the expression in infix and exit");
		System.out.println ("   --print            Print the persistent variables (no <expr>)");
		System.out.println ("   --reset            Reset the persistent variables (no <expr>)");
		System.out.println ("   --help, -?         Show this help");
		System.out.println ("");
		System.out.println ("Files:");
		System.out.println ("   State:    " + store.stateFileGet ());
		System.out.println ("   SimVars:  " + store.simVarsFileGet ());
		System.out.println ("   Funcs:    " + store.functionsFileGet ());
		System.out.println ("   Results:  " + store.resultsFileGet ());
	}
}
