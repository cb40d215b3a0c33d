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

import static org.simrpn.SimRpn.DEBUG;
import static org.simrpn.SimRpn.logD;
import static org.simrpn.SimRpn.logV;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.simrpn.SimRpnState.Function;

/**
 * Loads and saves the four stores a state bundle is built from, each as its own JSON file.
 * <p>
 * Missing files load as defaults silently, unreadable or malformed ones load as defaults with a warning left in
 * {@link #stderr}. Saving writes a temporary sibling first and moves it over the target, so a reader never sees a
 * half written file.
 * </p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class SimRpnStore {
	private static final String LOG_TAG = SimRpnStore.class.getSimpleName ();
	private static final String TEMP_PREFIX = ".tmp-";
	private static final int JSON_INDENT = 2;

	private final File stateFile;
	private final File simVarsFile;
	private final File functionsFile;
	private final File resultsFile;

	/** Warnings about files that could not be loaded, one per line */
	public String stderr = "";

	/**
	 * Constructor
	 *
	 * @param stateFile Persistent variables, {"vars": [...]}
	 * @param simVarsFile Simvars, {"simvars": {...}}
	 * @param functionsFile Function library, [{"name", "params", "rpn"}, ...]
	 * @param resultsFile Result history, {"results": [[...], ...]}
	 */
	public SimRpnStore (File stateFile, File simVarsFile, File functionsFile, File resultsFile) {
		this.stateFile = stateFile;
		this.simVarsFile = simVarsFile;
		this.functionsFile = functionsFile;
		this.resultsFile = resultsFile;
	}

	/**
	 * Creates a store located by the RPN_STATE, RPN_SIMVARS, RPN_FUNCS and RPN_STACK environment variables, each
	 * falling back to a dot file in the home directory
	 */
	public static SimRpnStore fromEnvironment () {
		return new SimRpnStore (
			environmentFile ("RPN_STATE", ".rpn_state.json"),
			environmentFile ("RPN_SIMVARS", ".simvars.json"),
			environmentFile ("RPN_FUNCS", ".rpnfunc.json"),
			environmentFile ("RPN_STACK", ".rpnstack.json"));
	}

	private static File environmentFile (String name, String fallback) {
		String path = System.getenv (name);
		if (path == null || path.isEmpty ())
			return new File (System.getProperty ("user.home"), fallback);

		return new File (path);
	}

	public File stateFileGet () {
		return stateFile;
	}

	public File simVarsFileGet () {
		return simVarsFile;
	}

	public File functionsFileGet () {
		return functionsFile;
	}

	public File resultsFileGet () {
		return resultsFile;
	}

	/**
	 * Loads all four stores into a state bundle, replacing what it held
	 *
	 * @param state The state to fill
	 * @return The same state
	 */
	public SimRpnState load (SimRpnState state) {
		state.variablesSet (variablesLoad ());
		state.simVarsSet (simVarsLoad ());

		state.functionRemoveAll ();
		for (Function function : functionsLoad ())
			state.functionAdd (function);

		state.resultsGet ().clear ();
		for (List<Double> stack : resultsLoad ())
			state.resultAppend (stack);

		if (DEBUG)
			logD (LOG_TAG, "Loaded state with " + state.functionsGet ().size () + " functions and " + state.resultsGet ().size () + " results");

		return state;
	}

	/**
	 * Loads the persistent variables
	 *
	 * @return Always {@link SimRpnState#SLOTS} values, missing or non-numeric entries are 0
	 */
	public double[] variablesLoad () {
		double[] variables = new double[SimRpnState.SLOTS];

		JSONObject root = objectRead (stateFile);
		JSONArray values = (root == null ? null : root.optJSONArray ("vars"));
		if (values == null)
			return variables;

		for (int i = 0, j = Math.min (values.length (), SimRpnState.SLOTS); i < j; ++i)
			variables[i] = numberCoerce (values.opt (i));

		return variables;
	}

	/**
	 * Saves the persistent variables
	 *
	 * @param variables The values to save
	 * @throws IOException If the file cannot be written
	 */
	public void variablesSave (double[] variables) throws IOException {
		JSONArray values = new JSONArray ();
		for (double value : variables)
			values.put (numberJson (value));

		write (stateFile, new JSONObject ().put ("vars", values));
	}

	/**
	 * Loads the simvar store, its dirty flag is clear
	 *
	 * @return The store, empty if there is nothing to load
	 */
	public SimVars simVarsLoad () {
		JSONObject root = objectRead (simVarsFile);
		JSONObject values = (root == null ? null : root.optJSONObject ("simvars"));

		SimVars simVars = (values == null ? new SimVars () : simVarsParse (values));
		simVars.dirtyClear ();
		return simVars;
	}

	/**
	 * Saves the simvar store, legacy scalars go back directly under "simvars"
	 *
	 * @param simVars The store to save
	 * @throws IOException If the file cannot be written
	 */
	public void simVarsSave (SimVars simVars) throws IOException {
		JSONObject values = new JSONObject ();

		for (Map.Entry<String, ? extends Map<String, Double>> prefix : simVars.prefixesGet ().entrySet ()) {
			JSONObject entries = new JSONObject ();
			for (Map.Entry<String, Double> entry : prefix.getValue ().entrySet ())
				entries.put (entry.getKey (), numberJson (entry.getValue ()));

			values.put (prefix.getKey (), entries);
		}

		for (Map.Entry<String, Double> entry : simVars.legacyGet ().entrySet ()) {
			if (!values.has (entry.getKey ()))
				values.put (entry.getKey (), numberJson (entry.getValue ()));
		}

		write (simVarsFile, new JSONObject ().put ("simvars", values));
	}

	/**
	 * Builds a simvar store from JSON, an object value is a prefix and a scalar value a legacy entry
	 *
	 * @param values Object as found under "simvars", or the simvars of an inline context
	 * @return The store, written values mark it dirty
	 */
	public static SimVars simVarsParse (JSONObject values) {
		SimVars simVars = new SimVars ();

		for (String key : values.keySet ()) {
			JSONObject entries = values.optJSONObject (key);
			if (entries == null) {
				simVars.legacySet (key, numberCoerce (values.opt (key)));
				continue;
			}

			for (String entry : entries.keySet ())
				simVars.simVarSet (key, entry, numberCoerce (entries.opt (entry)));
		}

		return simVars;
	}

	/**
	 * Loads the function library, records missing a field or with negative params are dropped
	 *
	 * @return The functions in file order
	 */
	public List<Function> functionsLoad () {
		ArrayList<Function> functions = new ArrayList<Function> ();

		String data = read (functionsFile);
		if (data == null)
			return functions;

		JSONArray records;
		try {
			records = new JSONArray (data);
		} catch (JSONException e) {
			warn (functionsFile, e);
			return functions;
		}

		for (int i = 0, j = records.length (); i < j; ++i) {
			JSONObject record = records.optJSONObject (i);
			if (record == null || !record.has ("name") || !record.has ("params") || !record.has ("rpn"))
				continue;

			int params = record.optInt ("params", -1);
			if (params < 0) {
				if (DEBUG)
					logV (LOG_TAG, "Dropping function record " + i + " with params " + record.opt ("params"));

				continue;
			}

			functions.add (new Function (String.valueOf (record.get ("name")), params, String.valueOf (record.get ("rpn"))));
		}

		return functions;
	}

	/**
	 * Saves the function library
	 *
	 * @param functions The functions to save
	 * @throws IOException If the file cannot be written
	 */
	public void functionsSave (Iterable<Function> functions) throws IOException {
		JSONArray records = new JSONArray ();
		for (Function function : functions)
			records.put (new JSONObject ().put ("name", function.name).put ("params", function.params).put ("rpn", function.rpn));

		write (functionsFile, records);
	}

	/**
	 * Loads the result history
	 *
	 * @return At most {@link SimRpnState#HISTORY_LIMIT} stacks, most recent first
	 */
	public List<List<Double>> resultsLoad () {
		ArrayList<List<Double>> results = new ArrayList<List<Double>> ();

		JSONObject root = objectRead (resultsFile);
		JSONArray stacks = (root == null ? null : root.optJSONArray ("results"));
		if (stacks == null)
			return results;

		for (int i = 0, j = stacks.length (); i < j && results.size () < SimRpnState.HISTORY_LIMIT; ++i) {
			JSONArray values = stacks.optJSONArray (i);
			if (values == null)
				continue;

			ArrayList<Double> stack = new ArrayList<Double> ();
			for (int k = 0, l = values.length (); k < l; ++k)
				stack.add (numberCoerce (values.opt (k)));

			results.add (stack);
		}

		return results;
	}

	/**
	 * Saves the result history, truncated to {@link SimRpnState#HISTORY_LIMIT} stacks
	 *
	 * @param results Stacks, most recent first
	 * @throws IOException If the file cannot be written
	 */
	public void resultsSave (List<List<Double>> results) throws IOException {
		JSONArray stacks = new JSONArray ();
		for (int i = 0, j = Math.min (results.size (), SimRpnState.HISTORY_LIMIT); i < j; ++i) {
			JSONArray values = new JSONArray ();
			for (Double value : results.get (i))
				values.put (numberJson (value));

			stacks.put (values);
		}

		write (resultsFile, new JSONObject ().put ("results", stacks));
	}

	/**
	 * Converts a loaded JSON value to a number
	 *
	 * @param value A JSON value, possibly null
	 * @return Its numeric value, text is parsed, a boolean is 1 or 0 and anything else is 0
	 */
	public static double numberCoerce (Object value) {
		if (value instanceof Number)
			return ((Number) value).doubleValue ();

		if (value instanceof Boolean)
			return ((Boolean) value ? 1 : 0);

		if (value instanceof String)
			return SimRpn.numberExtract ((String) value, 0);

		return 0;
	}

	/**
	 * JSON has no infinity or NaN, those are written as text and parsed back by {@link #numberCoerce(Object)}
	 */
	private static Object numberJson (double value) {
		if (Double.isNaN (value) || Double.isInfinite (value))
			return String.valueOf (value);

		return value;
	}

	private JSONObject objectRead (File file) {
		String data = read (file);
		if (data == null)
			return null;

		try {
			return new JSONObject (data);
		} catch (JSONException e) {
			warn (file, e);
			return null;
		}
	}

	/**
	 * Reads a whole file
	 *
	 * @return The contents, or null if the file is missing or unreadable
	 */
	private String read (File file) {
		if (!file.exists ())
			return null;

		try {
			return new String (Files.readAllBytes (file.toPath ()), StandardCharsets.UTF_8);
		} catch (IOException e) {
			warn (file, e);
			return null;
		}
	}

	/**
	 * Writes JSON to a temporary sibling and moves it over the target
	 */
	private void write (File file, Object json) throws IOException {
		String data = (json instanceof JSONObject ? ((JSONObject) json).toString (JSON_INDENT) : ((JSONArray) json).toString (JSON_INDENT));

		File parent = file.getAbsoluteFile ().getParentFile ();
		if (parent != null)
			Files.createDirectories (parent.toPath ());

		File temp = new File (parent, TEMP_PREFIX + file.getName ());
		Files.write (temp.toPath (), data.getBytes (StandardCharsets.UTF_8));

		try {
			Files.move (temp.toPath (), file.toPath (), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move (temp.toPath (), file.toPath (), StandardCopyOption.REPLACE_EXISTING);
		}

		if (DEBUG)
			logV (LOG_TAG, "Saved " + file);
	}

	private void warn (File file, Exception e) {
		String message = "Warn: ignoring " + file + ": " + e.getMessage ();

		if (DEBUG)
			logD (LOG_TAG, message);

		stderr += (stderr.isEmpty () ? "" : "\n") + message;
	}
}
