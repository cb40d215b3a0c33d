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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;
import org.simrpn.SimRpn.Token;
import org.simrpn.SimRpn.TokenType;
import org.simrpn.SimRpnException.Kind;

@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class SimRpnTokeniseTest {
	private static List<TokenType> types (List<Token> tokens) {
		ArrayList<TokenType> types = new ArrayList<TokenType> ();
		for (Token token : tokens)
			types.add (token.getType ());

		return types;
	}

	@Test
	public void _01_Whitespace () throws SimRpnException {
		assertEquals ("[5, 3, +]", SimRpn.tokenise ("5 3 +").toString ());
		assertEquals ("[5, 3, +]", SimRpn.tokenise ("  5\t3\n+  ").toString ());
		assertEquals (0, SimRpn.tokenise ("").size ());
		assertEquals (0, SimRpn.tokenise (null).size ());
	}

	@Test
	public void _02_Classification () throws SimRpnException {
		List<Token> tokens = SimRpn.tokenise ("-5 2,5 p1 s3 l3 sp0 lp0 r r2 r2,1 (A:x) (>L:y) sin sqrt double");

		assertEquals (Arrays.asList (
			TokenType.NUMBER, TokenType.NUMBER, TokenType.PARAMETER, TokenType.STORE, TokenType.LOAD,
			TokenType.REGISTER_STORE, TokenType.REGISTER_LOAD, TokenType.RESULT, TokenType.RESULT, TokenType.RESULT,
			TokenType.SIMVAR_READ, TokenType.SIMVAR_WRITE, TokenType.OPERATOR, TokenType.OPERATOR, TokenType.NAME
		), types (tokens));

		assertEquals (-5, tokens.get (0).getNumber (), 0);
		assertEquals (2.5, tokens.get (1).getNumber (), 0);
		assertEquals ("2,5", tokens.get (1).getValue ());
	}

	@Test
	public void _03_Blocks () throws SimRpnException {
		List<Token> tokens = SimRpn.tokenise ("1 if{2}else{3}");

		assertEquals ("[1, if{, 2, }, else{, 3, }]", tokens.toString ());
		assertEquals (Arrays.asList (
			TokenType.NUMBER, TokenType.BLOCK_IF, TokenType.NUMBER, TokenType.BLOCK_END,
			TokenType.BLOCK_ELSE, TokenType.NUMBER, TokenType.BLOCK_END
		), types (tokens));
	}

	@Test
	public void _04_Parentheses () throws SimRpnException {
		// Nested groups stay whole, whitespace inside included
		List<Token> tokens = SimRpn.tokenise ("(>L:x (y)) (A: speed )2");

		assertEquals (3, tokens.size ());
		assertEquals ("(>L:x (y))", tokens.get (0).getValue ());
		assertEquals (TokenType.SIMVAR_WRITE, tokens.get (0).getType ());
		assertEquals ("(A: speed )", tokens.get (1).getValue ());
		assertEquals (TokenType.SIMVAR_READ, tokens.get (1).getType ());
		assertEquals ("2", tokens.get (2).getValue ());

		try {
			SimRpn.tokenise ("1 (A:x");
			fail ("Expected an unterminated group to be rejected");
		} catch (SimRpnException e) {
			assertEquals (Kind.LEX, e.getKind ());
			assertEquals ("Unterminated parenthesis group: (A:x", e.getMessage ());
		}
	}

	@Test
	public void _05_StrayBrackets () throws SimRpnException {
		assertEquals ("[1, ), {, 2]", SimRpn.tokenise ("1 ) { 2").toString ());
		assertEquals ("[a, {, b]", SimRpn.tokenise ("a{b").toString ());
		assertEquals (TokenType.NAME, SimRpn.tokenise (")").get (0).getType ());
	}

	@Test
	public void _06_ResultReference () throws SimRpnException {
		assertEquals (true, SimRpn.isResultReference (SimRpn.tokenise ("r")));
		assertEquals (true, SimRpn.isResultReference (SimRpn.tokenise (" r3,2 ")));
		assertEquals (false, SimRpn.isResultReference (SimRpn.tokenise ("r1 r2")));
		assertEquals (false, SimRpn.isResultReference (SimRpn.tokenise ("r 1 +")));
	}

	@Test
	public void _07_Arity () {
		assertEquals (1, SimRpn.arity ("dnor"));
		assertEquals (2, SimRpn.arity ("<>"));
		assertEquals (3, SimRpn.arity ("clamp"));
		assertEquals (0, SimRpn.arity ("Number"));
		assertEquals (-1, SimRpn.arity ("double"));
	}
}
