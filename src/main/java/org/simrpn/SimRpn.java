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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.simrpn.SimRpnException.Kind;
import org.simrpn.SimRpnState.Function;

/**
 * SimRpn for Java, a postfix expression engine for persistent variables, simvars and prior results
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class SimRpn {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = SimRpn.class.getSimpleName ();
	static final boolean DEBUG = Boolean.getBoolean ("simrpn.debug");

	// Engine defaults
	private static final int watchdogDepthLimitDefault = 0;

	private int watchdogDepthLimit = watchdogDepthLimitDefault;
	private boolean precompileEnabled = false;

	// Engine internals
	private SimRpnState state;
	private Outcome outcome = null;
	private static final List<List<Double>> NO_RESULTS = Collections.emptyList ();
	private static final Map<String, Double> NO_PARAMS = Collections.emptyMap ();

	/** Execution normal output, the formatted result stack of {@link #run(String)} */
	public String stdout = "";

	/** Execution error output, populated with {@link #error(String)} */
	public String stderr = "";

	/** Token types the engine understands */
	public static enum TokenType {
		NUMBER,
		PARAMETER,
		STORE,
		LOAD,
		REGISTER_STORE,
		REGISTER_LOAD,
		RESULT,
		SIMVAR_READ,
		SIMVAR_WRITE,
		BLOCK_IF,
		BLOCK_ELSE,
		BLOCK_END,
		OPERATOR,
		NAME
	}

	/** Holds a token, the lowest unit of execution */
	public static final class Token {
		final TokenType type;
		final String value;
		final double number;

		Token (TokenType type, String value) {
			this (type, value, 0);
		}

		Token (TokenType type, String value, double number) {
			this.type = type;
			this.value = value;
			this.number = number;
		}

		/**
		 * Creates a numeric token carrying the exact value, its text is the display format
		 *
		 * @param number The value
		 * @return A NUMBER token
		 */
		public static Token number (double number) {
			return new Token (TokenType.NUMBER, numberFormat (number), number);
		}

		public TokenType getType () {
			return type;
		}

		public String getValue () {
			return value;
		}

		public double getNumber () {
			return number;
		}

		@Override
		public boolean equals (Object other) {
			if (!(other instanceof Token))
				return false;

			Token token = (Token) other;
			return type == token.type && value.equals (token.value);
		}

		@Override
		public int hashCode () {
			return type.hashCode () * 31 + value.hashCode ();
		}

		@Override
		public String toString () {
			return value;
		}
	}

	/** The result of one top-level evaluation */
	public static final class Outcome {
		/** Final operand stack */
		public final List<Double> stack;

		/** Session registers as left by the top-level call */
		public final double[] registers;

		/** Persistent variables, live */
		public final double[] variables;

		/** Simvar store, live */
		public final SimVars simVars;

		Outcome (List<Double> stack, double[] registers, double[] variables, SimVars simVars) {
			this.stack = Collections.unmodifiableList (stack);
			this.registers = registers;
			this.variables = variables;
			this.simVars = simVars;
		}

		/**
		 * Whether the simvar store was written to and needs saving
		 */
		public boolean isSimVarsDirty () {
			return simVars.isDirty ();
		}
	}

	/** Operators taking one operand */
	private static final String[] operatorUnary = {
		"not",   // Logical not
		"!",     // Logical not
		"round", // Round half up
		"floor", // Round down
		"ceil",  // Round up
		"abs",   // Absolute value
		"sin",   // Sine (radians)
		"cos",   // Cosine (radians)
		"tan",   // Tangent (radians)
		"log",   // Natural logarithm
		"exp",   // Natural exponent
		"pow2",  // Square
		"sqrt2", // Square root
		"dnor"   // Normalise degrees into [0,360)
	};

	/** Operators taking two operands */
	private static final String[] operatorBinary = {
		"+",   // Addition
		"-",   // Subtraction
		"*",   // Multiplication
		"/",   // Division
		"%",   // Modulo
		"^",   // Power
		"==",  // Equal to
		"=",   // Equal to
		"!=",  // Not equal to
		"<>",  // Not equal to
		">",   // Greater than
		"<",   // Less than
		">=",  // Greater than or equal to
		"<=",  // Less than or equal to
		"and", // Logical and
		"&&",  // Logical and
		"or",  // Logical or
		"||",  // Logical or
		"min", // Smaller of two
		"max", // Larger of two
		"pow", // Power
		"sqrt" // Root, a^(1/b)
	};

	/** Operators taking three operands */
	private static final String[] operatorTernary = {
		"clamp" // Clamp value between low and high
	};

	/** Type annotations left over from older expressions, they do nothing */
	private static final String[] operatorIgnored = {
		"Number",
		"Boolean",
		","
	};

	private static final Pattern patternNumber = Pattern.compile ("[-+]?\\d+(?:[.,]\\d+)?");
	private static final Pattern patternParameter = Pattern.compile ("p(\\d+)");
	private static final Pattern patternResult = Pattern.compile ("r(\\d+)?(?:,(\\d+))?");
	private static final Pattern patternStore = Pattern.compile ("s(\\d+)");
	private static final Pattern patternLoad = Pattern.compile ("l(\\d+)");
	private static final Pattern patternRegisterStore = Pattern.compile ("sp(\\d+)");
	private static final Pattern patternRegisterLoad = Pattern.compile ("lp(\\d+)");
	private static final Pattern patternSimVar = Pattern.compile ("\\((>?)([A-Za-z]+):(.*)\\)", Pattern.DOTALL);

	/**
	 * Constructor, starts from an empty state
	 */
	public SimRpn () {
		this (new SimRpnState ());
	}

	/**
	 * Constructor
	 *
	 * @param state The state bundle evaluations run against
	 */
	public SimRpn (SimRpnState state) {
		if (DEBUG)
			logD (LOG_TAG, "Instantiating SimRpn");

		stateSet (state);
	}

	/**
	 * Retrieves the state bundle
	 */
	public SimRpnState stateGet () {
		return state;
	}

	/**
	 * Replaces the state bundle
	 *
	 * @param state The new state, null for an empty one
	 */
	public void stateSet (SimRpnState state) {
		this.state = (state == null ? new SimRpnState () : state);
	}

	/**
	 * Gets the watchdog nesting depth limit
	 *
	 * @return Maximum depth of function and block calls, 0 when disabled
	 */
	public int watchdogGet () {
		return watchdogDepthLimit;
	}

	/**
	 * Sets the watchdog nesting depth limit, a self-recursive function is otherwise only stopped by the JVM
	 *
	 * @param watchdogDepthLimit Maximum depth, 0 disables and negative restores the default
	 */
	public void watchdogSet (int watchdogDepthLimit) {
		this.watchdogDepthLimit = (watchdogDepthLimit < 0 ? watchdogDepthLimitDefault : watchdogDepthLimit);

		if (DEBUG)
			logD (LOG_TAG, "Set watchdog depth limit=" + this.watchdogDepthLimit);
	}

	/**
	 * Gets whether {@link #run(String)} precompiles function calls before evaluating
	 */
	public boolean precompileGet () {
		return precompileEnabled;
	}

	/**
	 * Sets whether {@link #run(String)} precompiles function calls before evaluating, see {@link #precompile(List)}
	 *
	 * @param precompileEnabled True to precompile
	 */
	public void precompileSet (boolean precompileEnabled) {
		this.precompileEnabled = precompileEnabled;
	}

	/**
	 * Retrieves the outcome of the last successful {@link #run(String)}
	 *
	 * @return The outcome, or null if the last run failed or none happened
	 */
	public Outcome outcomeGet () {
		return outcome;
	}

	/**
	 * Tokenises, evaluates and records an expression in one go
	 * <p>On success the result stack is prepended to the history, unless the expression was nothing but a result
	 * reference, and {@link #stdout} holds the formatted stack. On failure {@link #stderr} holds the reason. Side
	 * effects that ran before a failure stay in the state.</p>
	 *
	 * @param expression Postfix expression
	 * @return True if evaluated successfully, or false if there was an error
	 */
	public boolean run (String expression) {
		return run (expression, null);
	}

	/**
	 * Tokenises, evaluates and records an expression in one go, see {@link #run(String)}
	 *
	 * @param expression Postfix expression
	 * @param params Parameter bindings for p1..pN, may be null
	 * @return True if evaluated successfully, or false if there was an error
	 */
	public boolean run (String expression, Map<String, Double> params) {
		stdout = stderr = "";
		outcome = null;

		try {
			List<Token> tokens = tokenise (expression);
			List<Token> evaluated = (precompileEnabled ? precompile (tokens) : tokens);

			outcome = evaluate (evaluated, params);

			if (!isResultReference (tokens))
				state.resultPush (outcome.stack);

			stdout = stackFormat (outcome.stack);
			return true;
		} catch (SimRpnException e) {
			return error (e.getMessage ());
		} catch (StackOverflowError e) {
			if (DEBUG)
				logD (LOG_TAG, "Stack overflow with watchdog depth limit=" + watchdogDepthLimit);

			return error ("Executor crash: nesting too deep");
		} catch (Exception e) {
			if (DEBUG)
				e.printStackTrace ();

			return error ("Executor crash: " + e.toString ());
		}
	}

	/**
	 * Step 1: Tokenisation
	 * <p>Splits on whitespace, keeps a parenthesised span whole (nesting included) and treats if{, else{ and } as
	 * tokens of their own even when glued to their neighbours.</p>
	 *
	 * @param text Source text, null is treated as empty
	 * @return The tokens in source order
	 * @throws SimRpnException If a parenthesis group is never closed
	 */
	public static List<Token> tokenise (String text) throws SimRpnException {
		ArrayList<Token> tokens = new ArrayList<Token> ();

		if (text == null)
			return tokens;

		int i = 0, j = text.length ();
		while (i < j) {
			char c = text.charAt (i);

			if (Character.isWhitespace (c)) {
				++i;
				continue;
			}

			if (c == '(') {
				int depth = 1, k = i + 1;
				for (; k < j && depth > 0; ++k) {
					if (text.charAt (k) == '(') {
						++depth;
					} else if (text.charAt (k) == ')') {
						--depth;
					}
				}

				if (depth > 0)
					throw new SimRpnException (Kind.LEX, "Unterminated parenthesis group: " + text.substring (i));

				tokens.add (classify (text.substring (i, k)));
				i = k;
			} else if (text.startsWith ("if{", i)) {
				tokens.add (new Token (TokenType.BLOCK_IF, "if{"));
				i += 3;
			} else if (text.startsWith ("else{", i)) {
				tokens.add (new Token (TokenType.BLOCK_ELSE, "else{"));
				i += 5;
			} else if (c == '}') {
				tokens.add (new Token (TokenType.BLOCK_END, "}"));
				++i;
			} else {
				int k = i;
				while (k < j && !Character.isWhitespace (text.charAt (k)) && "(){}".indexOf (text.charAt (k)) == -1)
					++k;

				// A stray { or ) stands alone so it is reported rather than stalling the scan
				if (k == i)
					++k;

				tokens.add (classify (text.substring (i, k)));
				i = k;
			}
		}

		if (DEBUG)
			logV (LOG_TAG, "Tokenised: " + tokens);

		return tokens;
	}

	/**
	 * Works out the type of a single non-block token
	 *
	 * @param text Token text
	 * @return The classified token
	 */
	private static Token classify (String text) {
		if (patternNumber.matcher (text).matches ())
			return new Token (TokenType.NUMBER, text, numberExtract (text, 0));

		if (patternParameter.matcher (text).matches ())
			return new Token (TokenType.PARAMETER, text);

		if (patternResult.matcher (text).matches ())
			return new Token (TokenType.RESULT, text);

		if (patternStore.matcher (text).matches ())
			return new Token (TokenType.STORE, text);

		if (patternLoad.matcher (text).matches ())
			return new Token (TokenType.LOAD, text);

		if (patternRegisterStore.matcher (text).matches ())
			return new Token (TokenType.REGISTER_STORE, text);

		if (patternRegisterLoad.matcher (text).matches ())
			return new Token (TokenType.REGISTER_LOAD, text);

		Matcher matcher = patternSimVar.matcher (text);
		if (matcher.matches ())
			return new Token (matcher.group (1).isEmpty () ? TokenType.SIMVAR_READ : TokenType.SIMVAR_WRITE, text);

		if (arity (text) > -1)
			return new Token (TokenType.OPERATOR, text);

		return new Token (TokenType.NAME, text);
	}

	/**
	 * Step 2 (optional): Precompilation
	 * <p>Replaces every library function name with its body, recursively, dropping all p1..pN tokens on the way.
	 * Arguments are not bound so this only preserves behaviour for bodies which do not read their parameters.</p>
	 *
	 * @param tokens Tokens to expand
	 * @return New token list free of function calls
	 * @throws SimRpnException If a body cannot be tokenised or the watchdog trips on a recursive function
	 */
	public List<Token> precompile (List<Token> tokens) throws SimRpnException {
		return precompile (tokens, 0);
	}

	private List<Token> precompile (List<Token> tokens, int depth) throws SimRpnException {
		watchdogCheck (depth);

		ArrayList<Token> expanded = new ArrayList<Token> ();
		for (Token token : tokens) {
			Function function = functionFor (token);
			if (function == null) {
				expanded.add (token);
				continue;
			}

			ArrayList<Token> body = new ArrayList<Token> ();
			for (Token bodyToken : function.body ()) {
				if (bodyToken.type != TokenType.PARAMETER)
					body.add (bodyToken);
			}

			expanded.addAll (precompile (body, depth + 1));
		}

		return expanded;
	}

	/**
	 * Tokenises and evaluates an expression without touching the history, see {@link #evaluate(List, Map)}
	 *
	 * @param text Postfix expression
	 * @return The outcome
	 * @throws SimRpnException On any evaluation error
	 */
	public Outcome evaluate (String text) throws SimRpnException {
		return evaluate (tokenise (text), null);
	}

	/**
	 * Step 3: Evaluation
	 * <p>Runs the tokens against the state with fresh session registers. Persistent variables and simvars are
	 * changed in place, the history is read but never written here.</p>
	 *
	 * @param tokens Tokens to run
	 * @param params Parameter bindings for p1..pN, may be null
	 * @return The outcome
	 * @throws SimRpnException On any evaluation error, earlier side effects are not rolled back
	 */
	public Outcome evaluate (List<Token> tokens, Map<String, Double> params) throws SimRpnException {
		if (DEBUG)
			logV (LOG_TAG, "Evaluating: " + tokens + " with params " + params);

		double[] registers = new double[SimRpnState.SLOTS];
		ArrayList<Double> stack = execute (tokens, (params == null ? NO_PARAMS : params), state.resultsGet (), registers, 0);

		return new Outcome (stack, registers, state.variablesGet (), state.simVarsGet ());
	}

	/**
	 * One evaluator entry, nested calls come back here with their own stack and registers
	 */
	private ArrayList<Double> execute (List<Token> tokens, Map<String, Double> params, List<List<Double>> results, double[] registers, int depth) throws SimRpnException {
		watchdogCheck (depth);

		ArrayList<Double> stack = new ArrayList<Double> ();

		int i = 0, j = tokens.size ();
		while (i < j) {
			Token token = tokens.get (i);

			if (DEBUG)
				logV (LOG_TAG, "	" + depth + "	" + i + "	" + token.type + "	" + token.value + "	" + stack);

			if (token.type == TokenType.NUMBER) {
				stack.add (token.number);
			} else if (token.type == TokenType.PARAMETER) {
				Double value = params.get (token.value);
				stack.add (value == null ? 0 : value);
			} else if (token.type == TokenType.RESULT) {
				resultLoad (token, results, stack);
			} else if (token.type == TokenType.STORE) {
				int slot = slotIndex (token, 1);
				state.variableSet (slot, pop (stack, token));
			} else if (token.type == TokenType.LOAD) {
				stack.add (state.variableGet (index (token.value.substring (1))));
			} else if (token.type == TokenType.REGISTER_STORE) {
				int slot = slotIndex (token, 2);
				registers[slot] = (stack.isEmpty () ? 0 : stack.get (stack.size () - 1));
			} else if (token.type == TokenType.REGISTER_LOAD) {
				int slot = index (token.value.substring (2));
				stack.add (slot < SimRpnState.SLOTS ? registers[slot] : 0);
			} else if (token.type == TokenType.SIMVAR_READ) {
				Matcher matcher = simVarMatch (token);
				stack.add (state.simVarsGet ().simVarGet (matcher.group (2), matcher.group (3).trim ()));
			} else if (token.type == TokenType.SIMVAR_WRITE) {
				Matcher matcher = simVarMatch (token);
				double value = pop (stack, token);
				state.simVarsGet ().simVarSet (matcher.group (2), matcher.group (3).trim (), value);
			} else if (token.type == TokenType.BLOCK_IF) {
				int endIf = blockEnd (tokens, i);
				int endElse = (endIf + 1 < j && tokens.get (endIf + 1).type == TokenType.BLOCK_ELSE ? blockEnd (tokens, endIf + 1) : -1);

				List<Token> body = null;
				if (pop (stack, token) != 0) {
					body = tokens.subList (i + 1, endIf);
				} else if (endElse != -1) {
					body = tokens.subList (endIf + 2, endElse);
				}

				// The branch keeps its side effects, its stack is thrown away
				if (body != null)
					execute (body, params, NO_RESULTS, new double[SimRpnState.SLOTS], depth + 1);

				i = (endElse != -1 ? endElse : endIf) + 1;
				continue;
			} else if (token.type == TokenType.BLOCK_ELSE) {
				i = blockEnd (tokens, i) + 1;
				continue;
			} else if (functionFor (token) != null) {
				Function function = functionFor (token);
				if (stack.size () < function.params)
					throw new SimRpnException (Kind.FUNCTION_ARITY, "Function " + function.name + " requires " + function.params + " parameters but the stack holds " + stack.size ());

				double[] args = new double[function.params];
				for (int k = function.params - 1; k > -1; --k)
					args[k] = stack.remove (stack.size () - 1);

				stack.addAll (execute (bind (function, args), params, NO_RESULTS, new double[SimRpnState.SLOTS], depth + 1));
			} else if (token.type == TokenType.OPERATOR) {
				operate (token.value, stack);
			} else {
				throw new SimRpnException (Kind.UNKNOWN_TOKEN, "Unknown token: " + token.value);
			}

			++i;
		}

		return stack;
	}

	/**
	 * Pushes a result history reference: r, rN or rN,M
	 */
	private static void resultLoad (Token token, List<List<Double>> results, ArrayList<Double> stack) throws SimRpnException {
		Matcher matcher = patternResult.matcher (token.value);
		matcher.matches ();

		int slot = (matcher.group (1) == null ? 1 : index (matcher.group (1)));
		if (slot < 1 || slot > results.size ())
			throw new SimRpnException (Kind.HISTORY_REFERENCE, "No stored result r" + slot);

		List<Double> result = results.get (slot - 1);
		if (matcher.group (2) == null) {
			stack.addAll (result);
		} else {
			int position = index (matcher.group (2));
			if (position < 1 || position > result.size ())
				throw new SimRpnException (Kind.HISTORY_REFERENCE, "No value at position " + position + " of r" + slot);

			stack.add (result.get (position - 1));
		}
	}

	/**
	 * Substitutes arguments for p1..pN in a fresh copy of a function body, anything past N becomes 0
	 *
	 * @param function The function being called
	 * @param args Arguments, p1 first
	 * @return Bound body tokens
	 * @throws SimRpnException If the body cannot be tokenised
	 */
	static List<Token> bind (Function function, double[] args) throws SimRpnException {
		List<Token> body = function.body ();
		ArrayList<Token> bound = new ArrayList<Token> (body.size ());

		for (Token token : body) {
			if (token.type == TokenType.PARAMETER) {
				int n = index (token.value.substring (1));
				bound.add (Token.number (n >= 1 && n <= args.length ? args[n - 1] : 0));
			} else {
				bound.add (token);
			}
		}

		return bound;
	}

	/**
	 * Finds the } closing the block opened at the given index, if{ and else{ both open a level
	 *
	 * @param tokens Tokens to search
	 * @param open Index of the if{ or else{
	 * @return Index of the matching }
	 * @throws SimRpnException If there is no matching }
	 */
	static int blockEnd (List<Token> tokens, int open) throws SimRpnException {
		int depth = 1;
		for (int i = open + 1, j = tokens.size (); i < j; ++i) {
			TokenType type = tokens.get (i).type;
			if (type == TokenType.BLOCK_IF || type == TokenType.BLOCK_ELSE) {
				++depth;
			} else if (type == TokenType.BLOCK_END && --depth == 0) {
				return i;
			}
		}

		throw new SimRpnException (Kind.UNTERMINATED_BLOCK, "Missing closing } for block at token " + (open + 1));
	}

	/**
	 * Applies a built-in operator to the stack
	 *
	 * @param operator Operator text
	 * @param stack The stack to pop operands from and push the result to
	 * @throws SimRpnException On stack underflow
	 */
	static void operate (String operator, List<Double> stack) throws SimRpnException {
		int arity = arity (operator);
		if (stack.size () < arity)
			throw new SimRpnException (Kind.STACK_UNDERFLOW, "Stack underflow: " + operator + " requires " + arity + " operands but the stack holds " + stack.size ());

		if (arity == 3) {
			double value = stack.remove (stack.size () - 1);
			double high = stack.remove (stack.size () - 1);
			double low = stack.remove (stack.size () - 1);
			stack.add (Math.max (low, Math.min (high, value)));
		} else if (arity == 2) {
			double right = stack.remove (stack.size () - 1);
			double left = stack.remove (stack.size () - 1);
			stack.add (operateBinary (operator, left, right));
		} else if (arity == 1) {
			stack.add (operateUnary (operator, stack.remove (stack.size () - 1)));
		}
	}

	private static double operateUnary (String operator, double a) {
		if (operator.equals ("not") || operator.equals ("!")) {
			return (a != 0 ? 0 : 1);
		} else if (operator.equals ("round")) {
			return Math.floor (a + 0.5);
		} else if (operator.equals ("floor")) {
			return Math.floor (a);
		} else if (operator.equals ("ceil")) {
			return Math.ceil (a);
		} else if (operator.equals ("abs")) {
			return Math.abs (a);
		} else if (operator.equals ("sin")) {
			return Math.sin (a);
		} else if (operator.equals ("cos")) {
			return Math.cos (a);
		} else if (operator.equals ("tan")) {
			return Math.tan (a);
		} else if (operator.equals ("log")) {
			return Math.log (a);
		} else if (operator.equals ("exp")) {
			return Math.exp (a);
		} else if (operator.equals ("pow2")) {
			return a * a;
		} else if (operator.equals ("sqrt2")) {
			return Math.sqrt (a);
		}

		// dnor
		return ((a % 360) + 360) % 360;
	}

	private static double operateBinary (String operator, double a, double b) {
		if (operator.equals ("+")) {
			return a + b;
		} else if (operator.equals ("-")) {
			return a - b;
		} else if (operator.equals ("*")) {
			return a * b;
		} else if (operator.equals ("/")) {
			return a / b;
		} else if (operator.equals ("%")) {
			return a % b;
		} else if (operator.equals ("^") || operator.equals ("pow")) {
			return Math.pow (a, b);
		} else if (operator.equals ("==") || operator.equals ("=")) {
			return (a == b ? 1 : 0);
		} else if (operator.equals ("!=") || operator.equals ("<>")) {
			return (a != b ? 1 : 0);
		} else if (operator.equals (">")) {
			return (a > b ? 1 : 0);
		} else if (operator.equals ("<")) {
			return (a < b ? 1 : 0);
		} else if (operator.equals (">=")) {
			return (a >= b ? 1 : 0);
		} else if (operator.equals ("<=")) {
			return (a <= b ? 1 : 0);
		} else if (operator.equals ("and") || operator.equals ("&&")) {
			return (a != 0 && b != 0 ? 1 : 0);
		} else if (operator.equals ("or") || operator.equals ("||")) {
			return (a != 0 || b != 0 ? 1 : 0);
		} else if (operator.equals ("min")) {
			return Math.min (a, b);
		} else if (operator.equals ("max")) {
			return Math.max (a, b);
		}

		// sqrt
		return Math.pow (a, 1.0 / b);
	}

	/**
	 * Number of operands a built-in operator takes
	 *
	 * @param operator Operator text
	 * @return 1 to 3, 0 for the ignored type annotations, or -1 if not a built-in
	 */
	public static int arity (String operator) {
		if (Arrays.asList (operatorUnary).contains (operator))
			return 1;

		if (Arrays.asList (operatorBinary).contains (operator))
			return 2;

		if (Arrays.asList (operatorTernary).contains (operator))
			return 3;

		if (Arrays.asList (operatorIgnored).contains (operator))
			return 0;

		return -1;
	}

	/**
	 * Gets the library function a token calls, library names win over built-in operators
	 *
	 * @param token Any token
	 * @return The function, or null if the token is not a function call
	 */
	Function functionFor (Token token) {
		if (token.type != TokenType.NAME && token.type != TokenType.OPERATOR)
			return null;

		return state.functionGet (token.value);
	}

	/**
	 * Lists the parameters an expression reads that have no binding yet, in numeric order
	 *
	 * @param tokens Tokens of the expression
	 * @param params Existing bindings, may be null
	 * @return Parameter names such as p1, without duplicates
	 */
	public static List<String> parametersMissing (List<Token> tokens, Map<String, Double> params) {
		TreeMap<Integer, String> missing = new TreeMap<Integer, String> ();

		for (Token token : tokens) {
			if (token.type == TokenType.PARAMETER && (params == null || !params.containsKey (token.value)))
				missing.put (index (token.value.substring (1)), token.value);
		}

		return new ArrayList<String> (missing.values ());
	}

	/**
	 * Whether an expression is nothing but one result reference, such results are not recorded again
	 *
	 * @param tokens Tokens of the expression
	 * @return True for a lone r, rN or rN,M
	 */
	public static boolean isResultReference (List<Token> tokens) {
		return tokens.size () == 1 && tokens.get (0).type == TokenType.RESULT;
	}

	/**
	 * Formats a stack as space separated numbers
	 *
	 * @param stack The stack, bottom first
	 * @return Formatted stack, empty for an empty stack
	 */
	public static String stackFormat (List<Double> stack) {
		StringBuilder sb = new StringBuilder ();
		for (Double value : stack) {
			if (sb.length () > 0)
				sb.append (' ');

			sb.append (numberFormat (value));
		}

		return sb.toString ();
	}

	/**
	 * Formats a number, integral values lose their fractional part
	 *
	 * @param number Number to format
	 * @return String of formatted number
	 */
	public static String numberFormat (double number) {
		if (!Double.isNaN (number) && !Double.isInfinite (number) && Math.abs (number) < 1e18 && Math.abs (number - Math.rint (number)) < 1e-12)
			return String.valueOf ((long) Math.rint (number));

		return String.valueOf (number);
	}

	/**
	 * Attempts to extract a number from a string, a decimal comma is accepted
	 *
	 * @param number The string containing a number to extract
	 * @param numberDefault The fallback number to return if extraction failed
	 * @return The extracted number or the numberDefault fallback on failure
	 */
	public static double numberExtract (String number, double numberDefault) {
		if (number == null)
			return numberDefault;

		try {
			return Double.valueOf (number.trim ().replace (',', '.'));
		} catch (NumberFormatException e) {
			return numberDefault;
		}
	}

	private void watchdogCheck (int depth) throws SimRpnException {
		if (watchdogDepthLimit > 0 && depth > watchdogDepthLimit)
			throw new SimRpnException (Kind.DEPTH_LIMIT, "Watchdog " + watchdogDepthLimit + " nesting depth exceeded, execution break");
	}

	private static double pop (List<Double> stack, Token token) throws SimRpnException {
		if (stack.isEmpty ())
			throw new SimRpnException (Kind.STACK_UNDERFLOW, "Stack underflow: " + token.value + " requires a value");

		return stack.remove (stack.size () - 1);
	}

	static Matcher simVarMatch (Token token) {
		Matcher matcher = patternSimVar.matcher (token.value);
		matcher.matches ();
		return matcher;
	}

	/**
	 * Slot number of a writing token, which unlike a read has nowhere to go when out of range
	 */
	private static int slotIndex (Token token, int prefixLength) throws SimRpnException {
		int slot = index (token.value.substring (prefixLength));
		if (slot >= SimRpnState.SLOTS)
			throw new SimRpnException (Kind.SLOT_RANGE, "Slot out of range: " + token.value + " (0-" + (SimRpnState.SLOTS - 1) + ")");

		return slot;
	}

	/**
	 * Parses the digits of a slot or position, too many digits saturate rather than fail
	 */
	static int index (String digits) {
		try {
			return Integer.parseInt (digits);
		} catch (NumberFormatException e) {
			return Integer.MAX_VALUE;
		}
	}

	/**
	 * Sends an error to stderr
	 *
	 * @param message Optional string or null of the message to display
	 * @return False (used as a placeholder for returns in other methods)
	 */
	private boolean error (String message) {
		stderr = "Error: " + (message != null ? message : "Unknown error");
		return false;
	}

	/**
	 * Implementation specific logging for Verbose messages
	 *
	 * @param msg The message to log
	 */
	protected static void logV (String tag, String msg) {
		System.out.println ("V: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}

	/**
	 * Implementation specific logging for Debug messages
	 *
	 * @param msg The message to log
	 */
	protected static void logD (String tag, String msg) {
		System.out.println ("D: " + (tag.isEmpty () ? "" : tag + ": ") + msg);
	}
}
