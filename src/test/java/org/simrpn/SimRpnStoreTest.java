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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.FixMethodOrder;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runners.MethodSorters;
import org.simrpn.SimRpnState.Function;

/**
 * Unit testing for the JSON stores, each test works in its own temporary directory
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class SimRpnStoreTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder ();

	private File stateFile;
	private File simVarsFile;
	private File functionsFile;
	private File resultsFile;
	private SimRpnStore store;

	@Before
	public void setUp () {
		stateFile = new File (folder.getRoot (), "state.json");
		simVarsFile = new File (folder.getRoot (), "simvars.json");
		functionsFile = new File (folder.getRoot (), "funcs.json");
		resultsFile = new File (folder.getRoot (), "stack.json");
		store = new SimRpnStore (stateFile, simVarsFile, functionsFile, resultsFile);
	}

	private static void writeFile (File file, String data) throws IOException {
		Files.write (file.toPath (), data.getBytes (StandardCharsets.UTF_8));
	}

	private static String readFile (File file) throws IOException {
		return new String (Files.readAllBytes (file.toPath ()), StandardCharsets.UTF_8);
	}

	@Test
	public void _01_MissingFiles () {
		SimRpnState state = store.load (new SimRpnState ());

		assertArrayEquals (new double[SimRpnState.SLOTS], state.variablesGet (), 0);
		assertEquals (0, state.simVarsGet ().prefixesGet ().size ());
		assertEquals (0, state.functionsGet ().size ());
		assertEquals (0, state.resultsGet ().size ());
		assertEquals ("", store.stderr);
	}

	@Test
	public void _02_Variables () throws IOException {
		writeFile (stateFile, "{\"vars\": [1, \"2,5\", true, null, 4.5]}");
		assertArrayEquals (new double[] {1, 2.5, 1, 0, 4.5, 0, 0, 0, 0, 0}, store.variablesLoad (), 0);

		double[] variables = new double[SimRpnState.SLOTS];
		variables[0] = 42;
		variables[9] = -1.5;
		store.variablesSave (variables);

		JSONArray saved = new JSONObject (readFile (stateFile)).getJSONArray ("vars");
		assertEquals (SimRpnState.SLOTS, saved.length ());
		assertEquals (42, saved.getDouble (0), 0);
		assertArrayEquals (variables, store.variablesLoad (), 0);

		// Longer arrays are cut at the last slot
		writeFile (stateFile, "{\"vars\": [0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11]}");
		assertEquals (9, store.variablesLoad ()[9], 0);
	}

	@Test
	public void _03_NonFinite () throws IOException {
		double[] variables = new double[SimRpnState.SLOTS];
		variables[0] = Double.POSITIVE_INFINITY;
		variables[1] = Double.NaN;
		store.variablesSave (variables);

		JSONArray saved = new JSONObject (readFile (stateFile)).getJSONArray ("vars");
		assertEquals ("Infinity", saved.getString (0));
		assertEquals ("NaN", saved.getString (1));

		double[] loaded = store.variablesLoad ();
		assertEquals (Double.POSITIVE_INFINITY, loaded[0], 0);
		assertEquals (true, Double.isNaN (loaded[1]));
	}

	@Test
	public void _04_Malformed () throws IOException {
		writeFile (stateFile, "{\"vars\": [1, 2");
		writeFile (functionsFile, "{\"name\": \"double\"}");
		writeFile (resultsFile, "not json at all");

		SimRpnState state = store.load (new SimRpnState ());
		assertArrayEquals (new double[SimRpnState.SLOTS], state.variablesGet (), 0);
		assertEquals (0, state.functionsGet ().size ());
		assertEquals (0, state.resultsGet ().size ());

		String[] warnings = store.stderr.split ("\n");
		assertEquals (3, warnings.length);
		assertEquals (true, warnings[0].startsWith ("Warn: ignoring " + stateFile));

		// A state of the wrong shape loads empty quietly, simvars that are not an object warn
		store = new SimRpnStore (stateFile, simVarsFile, functionsFile, resultsFile);
		writeFile (stateFile, "{\"vars\": 5}");
		writeFile (simVarsFile, "[1, 2]");
		store.load (new SimRpnState ());
		assertEquals (true, store.stderr.startsWith ("Warn: ignoring " + simVarsFile));
		assertArrayEquals (new double[SimRpnState.SLOTS], store.variablesLoad (), 0);
	}

	@Test
	public void _05_SimVarsLegacy () throws IOException {
		writeFile (simVarsFile, "{\"simvars\": {\"A\": {\"x\": 1}, \"speed\": 7, \"L\": {\"alt\": \"3,5\"}}}");

		SimVars simVars = store.simVarsLoad ();
		assertEquals (1, simVars.simVarGet ("A", "x"), 0);
		assertEquals (7, simVars.simVarGet ("A", "speed"), 0);
		assertEquals (0, simVars.simVarGet ("L", "speed"), 0);
		assertEquals (3.5, simVars.simVarGet ("L", "alt"), 0);
		assertEquals (false, simVars.isDirty ());

		// Legacy scalars are written back as scalars
		simVars.simVarSet ("B", "y", 2);
		store.simVarsSave (simVars);

		JSONObject saved = new JSONObject (readFile (simVarsFile)).getJSONObject ("simvars");
		assertEquals (7, saved.getDouble ("speed"), 0);
		assertEquals (1, saved.getJSONObject ("A").getDouble ("x"), 0);
		assertEquals (2, saved.getJSONObject ("B").getDouble ("y"), 0);
		assertEquals (3.5, saved.getJSONObject ("L").getDouble ("alt"), 0);

		SimVars reloaded = store.simVarsLoad ();
		assertEquals (7, reloaded.simVarGet ("A", "speed"), 0);
		assertEquals (2, reloaded.simVarGet ("B", "y"), 0);
	}

	@Test
	public void _06_Functions () throws IOException {
		writeFile (functionsFile, "["
			+ "{\"name\": \"double\", \"params\": 1, \"rpn\": \"p1 p1 +\"},"
			+ "{\"name\": \"bad\", \"params\": -1, \"rpn\": \"1\"},"
			+ "{\"name\": \"partial\", \"rpn\": \"1\"},"
			+ "\"not a record\","
			+ "{\"name\": \"pair\", \"params\": \"0\", \"rpn\": \"1 2\"}"
			+ "]");

		List<Function> functions = store.functionsLoad ();
		assertEquals (2, functions.size ());
		assertEquals ("double", functions.get (0).getName ());
		assertEquals (1, functions.get (0).getParams ());
		assertEquals ("p1 p1 +", functions.get (0).getRpn ());
		assertEquals ("pair", functions.get (1).getName ());
		assertEquals (0, functions.get (1).getParams ());

		store.functionsSave (functions);
		assertEquals (2, new JSONArray (readFile (functionsFile)).length ());
		assertEquals (2, store.functionsLoad ().size ());
	}

	@Test
	public void _07_Results () throws IOException {
		ArrayList<List<Double>> results = new ArrayList<List<Double>> ();
		for (int i = 0; i < 10; ++i)
			results.add (Arrays.asList ((double) i, i + 0.5));

		store.resultsSave (results);

		JSONArray saved = new JSONObject (readFile (resultsFile)).getJSONArray ("results");
		assertEquals (SimRpnState.HISTORY_LIMIT, saved.length ());

		List<List<Double>> loaded = store.resultsLoad ();
		assertEquals (SimRpnState.HISTORY_LIMIT, loaded.size ());
		assertEquals (Arrays.asList (0.0, 0.5), loaded.get (0));
		assertEquals (Arrays.asList (7.0, 7.5), loaded.get (7));

		writeFile (resultsFile, "{\"results\": [[1, 2], 3, [\"4\"]]}");
		loaded = store.resultsLoad ();
		assertEquals (2, loaded.size ());
		assertEquals (Arrays.asList (4.0), loaded.get (1));
	}

	@Test
	public void _08_AtomicWrite () throws IOException {
		writeFile (stateFile, "{\"vars\": [9]}");
		store.variablesSave (new double[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10});

		// The temporary sibling has been moved over the target
		assertEquals (false, new File (folder.getRoot (), ".tmp-state.json").exists ());
		assertEquals (Arrays.asList ("state.json"), Arrays.asList (folder.getRoot ().list ()));
		assertEquals (1, store.variablesLoad ()[0], 0);

		// Missing directories are created
		File nested = new File (folder.getRoot (), "a/b/state.json");
		new SimRpnStore (nested, simVarsFile, functionsFile, resultsFile).variablesSave (new double[SimRpnState.SLOTS]);
		assertEquals (true, nested.exists ());
	}

	@Test
	public void _09_RoundTrip () throws IOException {
		writeFile (functionsFile, "[{\"name\": \"double\", \"params\": 1, \"rpn\": \"p1 p1 +\"}]");

		SimRpnState state = store.load (new SimRpnState ());
		SimRpn simRpn = new SimRpn (state);
		assertEquals (true, simRpn.run ("3 double s1 (L:alt) 1 + (>L:alt) l1"));
		assertEquals ("6", simRpn.stdout);

		SimRpn.Outcome outcome = simRpn.outcomeGet ();
		store.variablesSave (outcome.variables);
		if (outcome.isSimVarsDirty ())
			store.simVarsSave (outcome.simVars);
		store.resultsSave (state.resultsGet ());

		// A fresh load continues where the last one stopped
		SimRpn next = new SimRpn (store.load (new SimRpnState ()));
		assertEquals (true, next.run ("l1 (L:alt) r1"));
		assertEquals ("6 1 6", next.stdout);
		assertEquals (false, next.outcomeGet ().isSimVarsDirty ());
	}
}
