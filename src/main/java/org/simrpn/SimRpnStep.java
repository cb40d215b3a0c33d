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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

import org.simrpn.SimRpn.Token;
import org.simrpn.SimRpn.TokenType;
import org.simrpn.SimRpnException.Kind;
import org.simrpn.SimRpnState.Function;

/**
 * Replays an expression one reduction at a time for display.
 * <p>
 * Each pass scans from the start for the first reducible operator, block or function call, highlights it,
 * evaluates just that piece and splices the formatted result back in, until one token is left or nothing can be
 * reduced. Every reduction runs against a scratch copy of the state, so replaying an expression that has already
 * been evaluated never writes anything twice.
 * </p>
 * <p>
 * <b>NOTE:</b> a reduced if{ } else{ } block is replaced by the values its branch leaves on the stack, whereas
 * {@link SimRpn#evaluate(List, java.util.Map)} discards them. Both behaviours are kept as they are.
 * </p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class SimRpnStep {
	private static final String LOG_TAG = SimRpnStep.class.getSimpleName ();

	// Terminal styles
	private static final String ANSI_RESET = "\u001b[0m";
	private static final String ANSI_RED = "\u001b[31m";
	private static final String ANSI_YELLOW = "\u001b[33m";
	private static final String ANSI_MARK_ON = "\u001b[43m\u001b[30m";
	private static final String ANSI_MARK_OFF = "\u001b[0m";

	private final SimRpn engine;
	private final double[] registers;
	private boolean colour = true;
	private boolean marker = false;
	private boolean endStep = false;
	private boolean infix = false;
	private PrintStream output = null;
	private ArrayList<String> lines = new ArrayList<String> ();

	/** One reduction, as rendered */
	public static final class Step {
		final int number;
		final String target;
		final String detail;
		final String end;
		final List<Token> tokens;

		Step (int number, String target, String detail, String end, List<Token> tokens) {
			this.number = number;
			this.target = target;
			this.detail = detail;
			this.end = end;
			this.tokens = Collections.unmodifiableList (new ArrayList<Token> (tokens));
		}

		/** Step number, from 1 */
		public int getNumber () {
			return number;
		}

		/** The "Step N:" line, the token line before reducing with the target highlighted */
		public String getTarget () {
			return target;
		}

		/** What was computed, such as "9 5 - = 4" */
		public String getDetail () {
			return detail;
		}

		/** The token line after reducing with the result highlighted, only when end of step lines are on */
		public String getEnd () {
			return end;
		}

		/** The token line after reducing */
		public List<Token> getTokens () {
			return tokens;
		}
	}

	/**
	 * Constructor
	 *
	 * @param engine The engine holding the state and function library to read from, it is never written to
	 * @param registers Session registers the expression left behind, null for all zeros
	 */
	public SimRpnStep (SimRpn engine, double[] registers) {
		this.engine = engine;
		this.registers = (registers == null ? new double[SimRpnState.SLOTS] : registers.clone ());
	}

	/**
	 * Sets whether output is coloured with ANSI escapes
	 */
	public void colourSet (boolean colour) {
		this.colour = colour;
	}

	/**
	 * Sets whether the target is marked with a background colour instead of a foreground colour
	 */
	public void markerSet (boolean marker) {
		this.marker = marker;
	}

	/**
	 * Sets whether the token line is shown again after every step with the new result highlighted
	 */
	public void endStepSet (boolean endStep) {
		this.endStep = endStep;
	}

	/**
	 * Sets whether unary and binary steps are described in infix notation, such as "9 - 5 = 4"
	 */
	public void infixSet (boolean infix) {
		this.infix = infix;
	}

	/**
	 * Sets where rendered lines are printed as they are produced
	 *
	 * @param output Stream to print to, or null to only collect them
	 */
	public void outputSet (PrintStream output) {
		this.output = output;
	}

	/**
	 * Retrieves every line rendered by the last {@link #visualise(List)}
	 */
	public List<String> linesGet () {
		return lines;
	}

	/**
	 * Reduces the tokens step by step
	 *
	 * @param tokens Tokens of an expression, typically the ones just evaluated
	 * @return The steps taken, possibly none
	 * @throws SimRpnException If a reduction fails to evaluate
	 */
	public List<Step> visualise (List<Token> tokens) throws SimRpnException {
		ArrayList<Step> steps = new ArrayList<Step> ();
		ArrayList<Token> current = new ArrayList<Token> (tokens);
		lines = new ArrayList<String> ();

		emit (join (current, 0, current.size ()));

		for (int number = 1; current.size () > 1 || number == 1; ++number) {
			// Collect pending operands until something can consume them
			ArrayList<Integer> pending = new ArrayList<Integer> ();
			int target = -1, end = -1, argc = 0;
			Function function = null;

			for (int i = 0, j = current.size (); i < j; ++i) {
				Token token = current.get (i);

				if (tokenValue (token) != null) {
					pending.add (i);
					continue;
				}

				if (token.type == TokenType.BLOCK_IF) {
					if (pending.isEmpty ())
						continue;

					int endIf = SimRpn.blockEnd (current, i);
					end = (endIf + 1 < j && current.get (endIf + 1).type == TokenType.BLOCK_ELSE ? SimRpn.blockEnd (current, endIf + 1) : endIf);
					argc = 1;
					target = i;
					break;
				}

				function = engine.functionFor (token);
				if (function != null) {
					if (pending.size () < function.params)
						continue;

					argc = function.params;
					target = end = i;
					break;
				}

				int arity = (token.type == TokenType.OPERATOR ? SimRpn.arity (token.value) : 0);
				if (arity > 0 && pending.size () >= arity) {
					argc = arity;
					target = end = i;
					break;
				}
			}

			// Irreducible
			if (target == -1)
				break;

			List<Integer> args = pending.subList (pending.size () - argc, pending.size ());
			int start = (args.isEmpty () ? target : args.get (0));

			double[] values = new double[argc];
			StringBuilder argsText = new StringBuilder ();
			for (int k = 0; k < argc; ++k) {
				Token arg = current.get (args.get (k));
				values[k] = tokenValue (arg);
				argsText.append (k > 0 ? " " : "").append (arg.value);
			}

			String targetLine = "Step " + number + ": " + highlightRange (current, start, end, marker ? "M" : "Y");
			emit (targetLine);

			Token chosen = current.get (target);
			List<Double> results;
			String detail;

			if (chosen.type == TokenType.BLOCK_IF) {
				int endIf = SimRpn.blockEnd (current, target);
				boolean hasElse = (endIf != end);
				boolean takeIf = (values[0] != 0);
				List<Token> ifBody = current.subList (target + 1, endIf);
				List<Token> elseBody = (hasElse ? current.subList (endIf + 2, end) : Collections.<Token> emptyList ());

				results = scratch ().evaluate (new ArrayList<Token> (takeIf ? ifBody : elseBody), null).stack;

				detail = argsText + " if{ " + (takeIf ? join (ifBody, 0, ifBody.size ()) : "...") + " }";
				if (hasElse)
					detail += " else{ " + (takeIf ? "..." : join (elseBody, 0, elseBody.size ())) + " }";
				detail += " → branch: " + (takeIf ? "IF" : (hasElse ? "ELSE" : "NONE")) + " →" + (results.isEmpty () ? "" : " " + SimRpn.stackFormat (results));
			} else if (function != null) {
				results = lastOf (scratch ().evaluate (SimRpn.bind (function, values), null).stack);
				detail = (argc > 0 ? argsText + " " : "") + chosen.value + " = " + SimRpn.stackFormat (results);
			} else {
				ArrayList<Double> stack = new ArrayList<Double> ();
				for (double value : values)
					stack.add (value);

				SimRpn.operate (chosen.value, stack);
				results = lastOf (stack);

				String result = SimRpn.stackFormat (results);
				if (infix && argc == 2) {
					detail = current.get (args.get (0)).value + " " + chosen.value + " " + current.get (args.get (1)).value + " = " + result;
				} else if (infix && argc == 1) {
					detail = chosen.value + " " + argsText + " = " + result;
				} else {
					detail = argsText + " " + chosen.value + " = " + result;
				}
			}

			emit (colour (detail, "Y"));

			if (DEBUG)
				logV (LOG_TAG, "Reduced " + join (current, start, end + 1) + " to " + results);

			// Splice the result values over the reduced span
			ArrayList<Token> next = new ArrayList<Token> (current.subList (0, start));
			for (Double result : results)
				next.add (Token.number (result));
			next.addAll (current.subList (end + 1, current.size ()));
			current = next;

			String endLine = null;
			if (endStep) {
				if (results.isEmpty ()) {
					endLine = "Step " + number + " end: " + join (current, 0, current.size ());
				} else {
					endLine = "Step " + number + " end: " + highlightSingle (current, start + results.size () - 1, marker ? "M" : "Y");
				}

				emit (endLine);
			}

			steps.add (new Step (number, targetLine, detail, endLine, current));
		}

		emit (join (current, 0, current.size ()));

		if (DEBUG)
			logD (LOG_TAG, "Visualised in " + steps.size () + " steps");

		return steps;
	}

	/**
	 * Renders postfix tokens as a fully bracketed infix string, for display only
	 *
	 * @param tokens Tokens of an expression
	 * @return Infix text, or the remaining pieces space separated when more than one value is left
	 * @throws SimRpnException When an operator lacks operands
	 */
	public static String postfixToInfix (List<Token> tokens) throws SimRpnException {
		ArrayList<String> stack = new ArrayList<String> ();

		for (Token token : tokens) {
			int arity = (token.type == TokenType.OPERATOR ? SimRpn.arity (token.value) : 0);

			if (stack.size () < arity)
				throw new SimRpnException (Kind.STACK_UNDERFLOW, "Too few operands for " + token.value);

			if (arity == 3) {
				String c = stack.remove (stack.size () - 1), b = stack.remove (stack.size () - 1), a = stack.remove (stack.size () - 1);
				stack.add (token.value + "(" + a + ", " + b + ", " + c + ")");
			} else if (arity == 2) {
				String b = stack.remove (stack.size () - 1), a = stack.remove (stack.size () - 1);
				stack.add ("(" + a + " " + token.value + " " + b + ")");
			} else if (arity == 1) {
				String a = stack.remove (stack.size () - 1);
				stack.add (token.value.equals ("not") ? "(not " + a + ")" : token.value + "(" + a + ")");
			} else {
				stack.add (token.value);
			}
		}

		return String.join (" ", stack);
	}

	/**
	 * Value of an operand-like token: number, persistent variable, session register or simvar read
	 *
	 * @return The value, or null if the token is not operand-like
	 */
	private Double tokenValue (Token token) {
		SimRpnState state = engine.stateGet ();

		if (token.type == TokenType.NUMBER) {
			return token.number;
		} else if (token.type == TokenType.LOAD) {
			return state.variableGet (SimRpn.index (token.value.substring (1)));
		} else if (token.type == TokenType.REGISTER_LOAD) {
			int slot = SimRpn.index (token.value.substring (2));
			return (slot < SimRpnState.SLOTS ? registers[slot] : 0);
		} else if (token.type == TokenType.SIMVAR_READ) {
			Matcher matcher = SimRpn.simVarMatch (token);
			return state.simVarsGet ().simVarGet (matcher.group (2), matcher.group (3).trim ());
		}

		return null;
	}

	/**
	 * A throwaway engine over a copy of the state with an empty history, as a nested call would see it
	 */
	private SimRpn scratch () {
		SimRpnState state = engine.stateGet ().copy ();
		state.resultsGet ().clear ();

		SimRpn scratch = new SimRpn (state);
		scratch.watchdogSet (engine.watchdogGet ());
		return scratch;
	}

	private static List<Double> lastOf (List<Double> stack) {
		return Collections.singletonList (stack.isEmpty () ? 0.0 : stack.get (stack.size () - 1));
	}

	private String highlightRange (List<Token> tokens, int start, int end, String style) {
		String prefix = join (tokens, 0, start);
		String middle = join (tokens, start, end + 1);
		String suffix = join (tokens, end + 1, tokens.size ());

		StringBuilder sb = new StringBuilder ();
		if (!prefix.isEmpty ())
			sb.append (colour (prefix, "R")).append (middle.isEmpty () && suffix.isEmpty () ? "" : " ");
		if (!middle.isEmpty ())
			sb.append (colour (middle, style)).append (suffix.isEmpty () ? "" : " ");
		if (!suffix.isEmpty ())
			sb.append (colour (suffix, "R"));

		return sb.toString ();
	}

	private String highlightSingle (List<Token> tokens, int index, String style) {
		String prefix = join (tokens, 0, index);
		String suffix = join (tokens, index + 1, tokens.size ());

		return (prefix.isEmpty () ? "" : prefix + " ") + colour (tokens.get (index).value, style) + (suffix.isEmpty () ? "" : " " + suffix);
	}

	private String colour (String text, String style) {
		if (!colour)
			return text;

		if (style.equals ("Y"))
			return ANSI_YELLOW + text + ANSI_RESET;

		if (style.equals ("R"))
			return ANSI_RED + text + ANSI_RESET;

		if (style.equals ("M"))
			return ANSI_MARK_ON + text + ANSI_MARK_OFF;

		return text;
	}

	private static String join (List<Token> tokens, int from, int to) {
		StringBuilder sb = new StringBuilder ();
		for (int i = from; i < to; ++i) {
			if (i > from)
				sb.append (' ');

			sb.append (tokens.get (i).value);
		}

		return sb.toString ();
	}

	private void emit (String line) {
		lines.add (line);

		if (output != null)
			output.println (line);
	}
}
