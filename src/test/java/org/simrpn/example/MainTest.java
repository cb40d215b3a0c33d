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

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.FixMethodOrder;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runners.MethodSorters;

/**
 * Command line runs against stores kept in a temporary home directory
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class MainTest {
	@Rule
	public TemporaryFolder home = new TemporaryFolder ();

	private final ByteArrayOutputStream buffer = new ByteArrayOutputStream ();
	private PrintStream stdout;
	private String userHome;

	@Before
	public void setUp () {
		userHome = System.getProperty ("user.home");
		System.setProperty ("user.home", home.getRoot ().getPath ());

		stdout = System.out;
		System.setOut (new PrintStream (buffer, true));
	}

	@After
	public void tearDown () {
		System.setOut (stdout);
		System.setProperty ("user.home", userHome);
	}

	private String printed () {
		return new String (buffer.toByteArray (), StandardCharsets.UTF_8).trim ();
	}

	private List<String> printedLines () {
		return Arrays.asList (printed ().split ("\\r?\\n"));
	}

	private void writeFile (String name, String data) throws IOException {
		Files.write (new File (home.getRoot (), name).toPath (), data.getBytes (StandardCharsets.UTF_8));
	}

	private JSONObject readObject (String name) throws IOException {
		return new JSONObject (new String (Files.readAllBytes (new File (home.getRoot (), name).toPath ()), StandardCharsets.UTF_8));
	}

	@Test
	public void _01_Usage () {
		assertEquals (2, Main.run (new String[] {}));
		assertEquals (true, printed ().startsWith ("SimRpn for Java (v 1.0)"));
		assertEquals (false, new File (home.getRoot (), ".rpn_state.json").exists ());
	}

	@Test
	public void _02_Help () {
		// Help with an expression still evaluates it
		assertEquals (0, Main.run (new String[] {"1 2 +", "--help"}));
		List<String> lines = printedLines ();
		assertEquals (true, printed ().contains ("--toinfix"));
		assertEquals ("3", lines.get (lines.size () - 1));
	}

	@Test
	public void _03_ToInfix () {
		assertEquals (0, Main.run (new String[] {"3 4 + 2 *", "--toinfix"}));
		assertEquals ("((3 + 4) * 2)", printed ());
		assertEquals (false, new File (home.getRoot (), ".rpnstack.json").exists ());
	}

	@Test
	public void _04_BadContext () {
		assertEquals (2, Main.run (new String[] {"1", "--ctx", "{broken"}));
		assertEquals (2, Main.run (new String[] {"1", "--ctx"}));
	}

	@Test
	public void _05_LoadEvaluateSave () throws IOException {
		writeFile (".rpn_state.json", "{\"vars\": [0, 0, 0, 0, 0, 0, 0, 0, 0, 4]}");
		writeFile (".simvars.json", "{\"simvars\": {\"L\": {\"alt\": 1, \"lat\": 50}}}");
		writeFile (".rpnstack.json", "{\"results\": [[7]]}");

		String context = "{\"params\": {\"p1\": 2}, \"simvars\": {\"L\": {\"alt\": 3}}}";
		assertEquals (0, Main.run (new String[] {"p1 (L:alt) * s1 l1 l9 5 (>L:y) r1", "--ctx", context, "--noprompt"}));
		assertEquals ("6 4 7", printed ());

		JSONArray vars = readObject (".rpn_state.json").getJSONArray ("vars");
		assertEquals (6, vars.getDouble (1), 0);
		assertEquals (4, vars.getDouble (9), 0);

		// The context overrides are saved along with the write
		JSONObject simVars = readObject (".simvars.json").getJSONObject ("simvars").getJSONObject ("L");
		assertEquals (5, simVars.getDouble ("y"), 0);
		assertEquals (3, simVars.getDouble ("alt"), 0);
		assertEquals (50, simVars.getDouble ("lat"), 0);

		JSONArray results = readObject (".rpnstack.json").getJSONArray ("results");
		assertEquals (2, results.length ());
		assertEquals ("[6,4,7]", results.getJSONArray (0).toString ().replace (".0", ""));
		assertEquals (7, results.getJSONArray (1).getDouble (0), 0);
	}

	@Test
	public void _06_FailureSavesNothing () throws IOException {
		assertEquals (1, Main.run (new String[] {"5 s0 +"}));
		assertEquals ("Error: Stack underflow: + requires 2 operands but the stack holds 0", printed ());
		assertEquals (false, new File (home.getRoot (), ".rpn_state.json").exists ());
		assertEquals (false, new File (home.getRoot (), ".simvars.json").exists ());

		// A run that writes no simvar leaves the simvar file alone
		assertEquals (0, Main.run (new String[] {"2 s0"}));
		assertEquals (true, new File (home.getRoot (), ".rpn_state.json").exists ());
		assertEquals (false, new File (home.getRoot (), ".simvars.json").exists ());
	}

	@Test
	public void _07_Step () throws IOException {
		writeFile (".rpnfunc.json", "[{\"name\": \"sq\", \"params\": 1, \"rpn\": \"p1 p1 *\"}]");

		assertEquals (0, Main.run (new String[] {"9 5 - sq", "--step", "-n"}));
		assertEquals (Arrays.asList (
			"9 5 - sq",
			"Step 1: 9 5 - sq",
			"9 5 - = 4",
			"Step 2: 4 sq",
			"4 sq = 16",
			"16"
		), printedLines ());
	}

	@Test
	public void _08_StepPrecompiled () throws IOException {
		// A 0-arity body that uses the caller's stack only reduces once expanded
		writeFile (".rpnfunc.json", "[{\"name\": \"add1\", \"params\": 0, \"rpn\": \"1 +\"}]");

		assertEquals (0, Main.run (new String[] {"2 add1", "-s", "-p", "-n"}));
		assertEquals (Arrays.asList (
			"2 1 +",
			"Step 1: 2 1 +",
			"2 1 + = 3",
			"3"
		), printedLines ());

		JSONArray results = readObject (".rpnstack.json").getJSONArray ("results");
		assertEquals (3, results.getJSONArray (0).getDouble (0), 0);
	}
}
