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

package org.subaruu;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * SUBARUU for Java
 * <p>A direct-execution interpreter for a small line-numbered BASIC: integer arithmetic, single letter variables,
 * <code>LET</code>, <code>PRINT</code>, <code>REM</code>, <code>GOTO</code> and <code>IF … THEN</code>. There is no
 * syntax tree, statements are executed straight off a {@link TokenSource} and every jump re-scans that source from
 * the beginning.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class Subaruu {
	// Public information
	public static final int VERSION_MAJOR = 1;
	public static final int VERSION_MINOR = 0;

	// Internal settings
	private static final String LOG_TAG = Subaruu.class.getSimpleName ();
	private static final boolean DEBUG = false;

	// Engine defaults
	private static final int watchdogTickLimitDefault = 100000;
	private static final int variableCount = 26;

	private int watchdogTickLimit = watchdogTickLimitDefault;

	// Engine internals
	private TokenSource tokenSource = null;
	private final int[] variables = new int[variableCount];
	private HashMap<Integer, Boolean> lineIndex = new HashMap<Integer, Boolean> ();
	private Jump pendingJump = null;
	private boolean executionFinished = false;
	private int lineNumber = 0;

	// Output sinks, buffered unless streams are set with streamSet()
	private StringBuilder stdoutBuffer = new StringBuilder ();
	private StringBuilder stderrBuffer = new StringBuilder ();
	private PrintStream stdoutStream = null;
	private PrintStream stderrStream = null;

	/** Program output of the last run (empty when streaming with {@link #streamSet(PrintStream, PrintStream)}) */
	public String stdout = "";

	/** Diagnostic output of the last run, one <code>WARNING:</code> or <code>ERROR:</code> line per message */
	public String stderr = "";

	/** Token kinds produced by a {@link TokenSource}, each with the text used when rendering it in diagnostics */
	public static enum TokenType {
		ERROR ("error"),
		EOF ("EOF"),
		EOL ("EOL"),
		NUMBER ("number"),
		LETTER ("letter"),
		STRING ("string"),
		SEPARATOR (","),
		PLUS ("+"),
		MINUS ("-"),
		ASTERISK ("*"),
		SLASH ("/"),
		LEFT_PAREN ("("),
		RIGHT_PAREN (")"),
		EQUAL ("="),
		LT ("<"),
		GT (">"),
		LT_EQ ("<="),
		GT_EQ (">="),
		NOT_EQUAL ("<>"),
		REM ("REM"),
		PRINT ("PRINT"),
		IF ("IF"),
		THEN ("THEN"),
		GOTO ("GOTO"),
		LET ("LET");

		private final String text;

		TokenType (String text) {
			this.text = text;
		}

		public String text () {
			return text;
		}
	}

	/**
	 * The tokenizing collaborator the engine executes from
	 * <p>The engine never looks at program characters except through {@link #peekChar()}, and never keeps a position
	 * of its own; it only asks for a restart with {@link #reset()} and advances with {@link #nextToken()}.</p>
	 */
	public interface TokenSource {
		/**
		 * @return The kind of the current token
		 */
		TokenType currentToken ();

		/**
		 * Advance by one token; at the end of input the current token stays {@link TokenType#EOF}
		 */
		void nextToken ();

		/**
		 * @return True if the current token is {@link TokenType#EOF}
		 */
		boolean finished ();

		/**
		 * Rewind to the first token of the program
		 */
		void reset ();

		/**
		 * @return The raw character straight after the current token, or 0 at the end of input
		 */
		char peekChar ();

		/**
		 * @return The value of the current {@link TokenType#NUMBER} token
		 */
		int getNum ();

		/**
		 * @return The text of the current {@link TokenType#STRING} token, without the quotes
		 */
		String getString ();

		/**
		 * @return The character of the current {@link TokenType#LETTER} token, as written
		 */
		char getLetter ();

		/**
		 * Discard everything up to and including the next end of line
		 */
		void skipToEol ();

		/**
		 * @param token The token kind to render
		 * @return A short human readable form of the token kind
		 */
		String tokenToString (TokenType token);
	}

	/** How a jump reaches its target line */
	public static enum JumpMode {
		/** Reset the token source and scan forward to the target before returning */
		RESCAN,

		/** Leave the target pending; the main loop skips lines forward until it meets it */
		DEFERRED
	}

	/** A control transfer request, at most one is pending at a time */
	private static final class Jump {
		final JumpMode mode;
		final int target;

		Jump (JumpMode mode, int target) {
			this.mode = mode;
			this.target = target;
		}
	}

	/** Unwinds the evaluator after a fatal error has been written, only {@link #run()} catches it */
	private static final class ExecutionAbort extends RuntimeException {
		private static final long serialVersionUID = 1L;

		ExecutionAbort (String message) {
			super (message);
		}
	}

	/**
	 * Constructor, all variables start at zero
	 */
	public Subaruu () {
		if (DEBUG)
			logD (LOG_TAG, "Instantiating Subaruu");

		variableClearAll ();
	}

	/**
	 * Gets the watchdog tick limit
	 *
	 * @return Number of statement ticks a run may take, 0 meaning no limit
	 */
	public int watchdogGet () {
		return watchdogTickLimit;
	}

	/**
	 * Sets the watchdog tick limit
	 *
	 * @param watchdogTickLimit Number of ticks, 0 to disable, or negative for the default
	 */
	public void watchdogSet (int watchdogTickLimit) {
		this.watchdogTickLimit = (watchdogTickLimit < 0 ? watchdogTickLimitDefault : watchdogTickLimit);

		if (DEBUG)
			logD (LOG_TAG, "Set watchdog tick limit=" + this.watchdogTickLimit);
	}

	/**
	 * Sends program output and diagnostics straight to streams instead of {@link #stdout} and {@link #stderr}
	 *
	 * @param out Stream for program output, or null to buffer it
	 * @param err Stream for diagnostics, or null to buffer them
	 */
	public void streamSet (PrintStream out, PrintStream err) {
		stdoutStream = out;
		stderrStream = err;
	}

	/**
	 * Resets the instance between executions of the same script
	 */
	public void reset () {
		lineNumber = 0;
		stdout = stderr = "";
		stdoutBuffer = new StringBuilder ();
		stderrBuffer = new StringBuilder ();
		pendingJump = null;
		executionFinished = false;
		lineIndex = new HashMap<Integer, Boolean> ();
		variableClearAll ();

		if (DEBUG)
			logD (LOG_TAG, "Subaruu engine reset");
	}

	/**
	 * Gets a variable
	 *
	 * @param name Variable letter, either case
	 * @return The value of the variable
	 */
	public int variableGet (char name) {
		return variables[variableSlot (name)];
	}

	/**
	 * Sets a variable
	 *
	 * @param name Variable letter, either case
	 * @param value Value to store
	 */
	public void variableSet (char name, int value) {
		if (DEBUG)
			logV (LOG_TAG, "Setting variable: " + Character.toLowerCase (name) + "=" + value);

		variables[variableSlot (name)] = value;
	}

	/**
	 * Sets every variable back to zero
	 */
	public void variableClearAll () {
		if (DEBUG)
			logV (LOG_TAG, "Clearing all variables");

		for (int i = 0; i < variableCount; ++i)
			variables[i] = 0;
	}

	/**
	 * Retrieves a copy of the complete variable store
	 *
	 * @return Map of letter a..z to value, always 26 entries
	 */
	public Map<Character, Integer> variableStoreGet () {
		HashMap<Character, Integer> store = new HashMap<Character, Integer> ();
		for (int i = 0; i < variableCount; ++i)
			store.put ((char) ('a' + i), variables[i]);

		return store;
	}

	/**
	 * Retrieves the line numbers found by the last line index scan
	 *
	 * @return Sorted line numbers, empty if no scan has happened yet
	 */
	public SortedSet<Integer> lineIndexGet () {
		return new TreeSet<Integer> (lineIndex.keySet ());
	}

	/**
	 * Loads a program from source text, ready for {@link #run()}
	 *
	 * @param source Program text
	 * @return True if the program is ready to run, or false if there was nothing to load
	 */
	public boolean script (String source) {
		if (DEBUG)
			logD (LOG_TAG, source == null ? "No input script passed" : "Input script was passed");

		reset ();

		if (source == null) {
			tokenSource = null;
			error ("No script to load");
			stderr = stderrBuffer.toString ();
			return false;
		}

		// Remove any UTF BOM
		if (source.startsWith ("\uFEFF"))
			source = source.substring (1);

		tokenSource = new SubaruuTokenizer (source);
		return true;
	}

	/**
	 * Uses an already prepared token source as the program, ready for {@link #run()}
	 *
	 * @param tokenSource The token source to execute
	 */
	public void tokenSourceSet (TokenSource tokenSource) {
		reset ();
		this.tokenSource = tokenSource;
	}

	/**
	 * Runs the loaded program from its first line
	 * <p>Variables are NOT cleared between runs of the same program, use {@link #reset()} for that.</p>
	 *
	 * @return True if the program ran to its end, or false on a fatal error (stderr will contain the reason)
	 */
	public boolean run () {
		return runFrom (null);
	}

	/**
	 * Runs the loaded program from a given line, skipping forward over everything before it
	 *
	 * @param startLine Leading line number to start at
	 * @return True if the program ran to its end, or false on a fatal error (stderr will contain the reason)
	 */
	public boolean run (int startLine) {
		return runFrom (Integer.valueOf (startLine));
	}

	private boolean runFrom (Integer startLine) {
		stdoutBuffer = new StringBuilder ();
		stderrBuffer = new StringBuilder ();

		try {
			return execute (startLine);
		} catch (ExecutionAbort e) {
			if (DEBUG)
				logD (LOG_TAG, "Execution aborted: " + e.getMessage ());

			return false;
		} catch (Exception e) {
			if (DEBUG)
				e.printStackTrace ();

			return error ("Executor crash: " + e.toString ());
		} finally {
			stdout = stdoutBuffer.toString ();
			stderr = stderrBuffer.toString ();
		}
	}

	/**
	 * The main execution loop
	 * <p>Each iteration is one tick: either a line statement, or while a deferred jump is pending, one step of the
	 * forward search for its target.</p>
	 */
	private boolean execute (Integer startLine) {
		if (tokenSource == null)
			return error ("Script must be loaded before running");

		if (DEBUG)
			logV (LOG_TAG, "Starting program execution");

		int watchdogTickCounter = 0;
		lineNumber = 0;
		pendingJump = null;
		executionFinished = false;

		buildLineIndex ();

		if (startLine != null)
			jump (JumpMode.DEFERRED, startLine);

		while (!executionFinished) {
			if (tokenSource.finished ()) {
				if (pendingJump != null)
					fatal ("Internal Error: Failed to find valid line number " + pendingJump.target);

				executionFinished = true;
				continue;
			}

			// Make sure the program does not run indefinitely (i.e., infinite goto loop)
			if (++watchdogTickCounter == watchdogTickLimit && watchdogTickLimit > 0)
				fatal ("Watchdog " + watchdogTickCounter + " ticks timeout, execution break");

			if (pendingJump != null)
				searchStep ();
			else
				lineStatement ();
		}

		if (DEBUG)
			logV (LOG_TAG, "Program execution finished");

		return true;
	}

	/**
	 * One step of the deferred forward search: run the target line if this is it, otherwise discard the line
	 */
	private void searchStep () {
		if (tokenSource.currentToken () == TokenType.NUMBER && tokenSource.getNum () == pendingJump.target) {
			if (DEBUG)
				logD (LOG_TAG, pendingJump.mode + " jump reached line " + pendingJump.target);

			lineNumber = pendingJump.target;
			pendingJump = null;
			tokenSource.nextToken ();
			statement ();
		} else {
			skipLine ();
		}
	}

	/**
	 * Executes the statement of one source line, consuming its leading line number if there is one
	 */
	private void lineStatement () {
		// Skip empty lines
		while (tokenSource.currentToken () == TokenType.EOL)
			tokenSource.nextToken ();

		if (tokenSource.finished ()) {
			executionFinished = true;
			return;
		}

		if (tokenSource.currentToken () == TokenType.NUMBER) {
			lineNumber = tokenSource.getNum ();
			tokenSource.nextToken ();
		}

		statement ();
	}

	/**
	 * Dispatches on the leading token of a statement
	 */
	private void statement () {
		TokenType token = tokenSource.currentToken ();

		if (DEBUG)
			logV (LOG_TAG, "Line " + lineNumber + " statement: " + tokenSource.tokenToString (token));

		switch (token) {
			case REM:
				tokenSource.skipToEol ();
				break;
			case PRINT:
				printStatement ();
				break;
			case IF:
				ifStatement ();
				break;
			case GOTO:
				gotoStatement ();
				break;
			case LET:
				accept (TokenType.LET);
				letStatement ();
				break;
			case LETTER:
				letStatement ();
				break;
			default:
				fatal ("Syntax Error: Unrecognized statement `" + tokenSource.tokenToString (token) + "`");
		}
	}

	/**
	 * <code>[LET] letter = expression</code>
	 */
	private void letStatement () {
		if (tokenSource.currentToken () != TokenType.LETTER)
			fatal ("Syntax Error: Expected variable name, got `" + tokenSource.tokenToString (tokenSource.currentToken ()) + "`");

		char name = Character.toLowerCase (tokenSource.getLetter ());
		tokenSource.nextToken ();
		accept (TokenType.EQUAL);

		int value = expression ();
		variableSet (name, value);
	}

	/**
	 * <code>PRINT item…</code> where an item is a string, an expression or a separator
	 */
	private void printStatement () {
		accept (TokenType.PRINT);

		boolean needSpace = false;
		boolean printing = true;
		while (printing && !tokenSource.finished ()) {
			TokenType token = tokenSource.currentToken ();

			if (token == TokenType.EOL || isLineNumber ())
				break;

			switch (token) {
				case STRING:
					if (needSpace)
						print (" ");
					print (tokenSource.getString ());
					needSpace = true;
					tokenSource.nextToken ();
					break;
				case SEPARATOR:
					print (" ");
					needSpace = false;
					tokenSource.nextToken ();
					break;
				case LETTER:
				case NUMBER:
				case LEFT_PAREN:
					if (needSpace)
						print (" ");
					print (String.valueOf (expression ()));
					needSpace = true;
					break;
				default:
					if (DEBUG)
						logV (LOG_TAG, "Print stopped at " + tokenSource.tokenToString (token));

					printing = false;
			}
		}

		print ("\n");

		// A line number straight after the items belongs to the next statement
		if (isLineNumber ())
			return;

		if (tokenSource.finished ()) {
			executionFinished = true;
		} else if (tokenSource.currentToken () == TokenType.EOL) {
			tokenSource.nextToken ();
		}
	}

	/**
	 * <code>IF relation THEN line</code>
	 */
	private void ifStatement () {
		accept (TokenType.IF);
		int condition = relation ();
		accept (TokenType.THEN);

		if (tokenSource.currentToken () != TokenType.NUMBER)
			fatal ("Syntax Error: Expected line number after THEN, got `" + tokenSource.tokenToString (tokenSource.currentToken ()) + "`");

		int target = tokenSource.getNum ();
		tokenSource.nextToken ();

		if (DEBUG)
			logD (LOG_TAG, "Condition " + (condition != 0 ? "true, jumping to line " + target : "false"));

		if (condition != 0) {
			jump (JumpMode.RESCAN, target);
		} else if (tokenSource.currentToken () == TokenType.EOL) {
			tokenSource.nextToken ();
		}
	}

	/**
	 * <code>GOTO line</code>
	 */
	private void gotoStatement () {
		accept (TokenType.GOTO);

		int target = (tokenSource.currentToken () == TokenType.NUMBER ? tokenSource.getNum () : 0);
		accept (TokenType.NUMBER);
		accept (TokenType.EOL);

		jump (JumpMode.RESCAN, target);
	}

	/**
	 * Transfers control to a leading line number
	 * <p>Both modes share the same missing target policy: a line that is not in the index is a runtime error, and a
	 * line that is in the index but is never met by the scan is an internal error.</p>
	 *
	 * @param mode Whether to re-scan now or leave the search to the main loop
	 * @param target The leading line number to continue from
	 */
	private void jump (JumpMode mode, int target) {
		if (DEBUG)
			logD (LOG_TAG, "Jump " + mode + " to line " + target);

		if (lineIndex.isEmpty ())
			buildLineIndex ();

		if (!lineIndex.containsKey (target))
			fatal ("Runtime Error: Line number " + target + " not found");

		if (mode == JumpMode.DEFERRED) {
			pendingJump = new Jump (mode, target);
			return;
		}

		tokenSource.reset ();
		if (!findTargetLine (target))
			fatal ("Internal Error: Failed to find valid line number " + target);

		lineNumber = target;
	}

	/**
	 * Scans forward line by line until a line starts with the target number, then steps past that number
	 *
	 * @param target The leading line number to look for
	 * @return True if found, or false if the end of input was reached
	 */
	private boolean findTargetLine (int target) {
		while (!tokenSource.finished ()) {
			if (tokenSource.currentToken () == TokenType.NUMBER && tokenSource.getNum () == target) {
				tokenSource.nextToken ();
				return true;
			}

			skipLine ();
		}

		return false;
	}

	/**
	 * Discards tokens up to and including the next end of line
	 */
	private void skipLine () {
		while (!tokenSource.finished () && tokenSource.currentToken () != TokenType.EOL)
			tokenSource.nextToken ();

		if (tokenSource.currentToken () == TokenType.EOL)
			tokenSource.nextToken ();
	}

	/**
	 * Records every number in the program that looks like a leading line number, then rewinds
	 */
	private void buildLineIndex () {
		lineIndex = new HashMap<Integer, Boolean> ();
		tokenSource.reset ();

		while (!tokenSource.finished ()) {
			if (tokenSource.currentToken () == TokenType.NUMBER && looksLikeLineNumber (tokenSource.getNum (), tokenSource.peekChar ()))
				lineIndex.put (tokenSource.getNum (), true);

			tokenSource.nextToken ();
		}

		if (DEBUG)
			logD (LOG_TAG, "Found these line numbers: " + lineIndexGet ());

		tokenSource.reset ();
	}

	/**
	 * <code>relation := expression [relop expression]</code>
	 *
	 * @return 1 if true, 0 if false; without a comparison any non-zero value is true
	 */
	private int relation () {
		int left = expression ();
		TokenType op = tokenSource.currentToken ();

		switch (op) {
			case EQUAL:
			case LT:
			case GT:
			case LT_EQ:
			case GT_EQ:
			case NOT_EQUAL:
				break;
			default:
				return left != 0 ? 1 : 0;
		}

		tokenSource.nextToken ();
		int right = expression ();

		if (DEBUG)
			logV (LOG_TAG, "Relation " + left + " " + op.text () + " " + right);

		boolean result;
		switch (op) {
			case EQUAL:
				result = left == right;
				break;
			case LT:
				result = left < right;
				break;
			case GT:
				result = left > right;
				break;
			case LT_EQ:
				result = left <= right;
				break;
			case GT_EQ:
				result = left >= right;
				break;
			default:
				result = left != right;
		}

		return result ? 1 : 0;
	}

	/**
	 * <code>expression := term {(+|-) term}</code>
	 * <p>Stops straight after the first term if the next token looks like the leading line number of the next
	 * statement, leaving that token in place.</p>
	 */
	private int expression () {
		int result = term ();

		if (isLineNumber ())
			return result;

		TokenType token = tokenSource.currentToken ();
		while (token == TokenType.PLUS || token == TokenType.MINUS) {
			tokenSource.nextToken ();
			int value = term ();

			if (token == TokenType.PLUS) {
				result += value;
			} else {
				result -= value;
			}

			token = tokenSource.currentToken ();
		}

		return result;
	}

	/**
	 * <code>term := factor {(*|/) factor}</code>
	 */
	private int term () {
		int result = factor ();

		TokenType token = tokenSource.currentToken ();
		while (token == TokenType.ASTERISK || token == TokenType.SLASH) {
			tokenSource.nextToken ();
			int value = factor ();

			if (token == TokenType.ASTERISK) {
				result *= value;
			} else {
				result = divide (result, value);
			}

			token = tokenSource.currentToken ();
		}

		return result;
	}

	/**
	 * <code>factor := number | letter | ( expression )</code>
	 */
	private int factor () {
		TokenType token = tokenSource.currentToken ();
		int result = 0;

		switch (token) {
			case NUMBER:
				result = tokenSource.getNum ();
				tokenSource.nextToken ();
				break;
			case LETTER:
				result = variableGet (tokenSource.getLetter ());
				tokenSource.nextToken ();
				break;
			case LEFT_PAREN:
				tokenSource.nextToken ();
				result = expression ();
				accept (TokenType.RIGHT_PAREN);
				break;
			default:
				fatal ("Syntax Error: Unexpected token in factor: " + tokenSource.tokenToString (token));
		}

		return result;
	}

	/**
	 * Integer division where a zero denominator is a warning and gives 0
	 */
	private int divide (int numerator, int denominator) {
		if (denominator == 0) {
			warning ("Divide by zero");
			return 0;
		}

		return numerator / denominator;
	}

	/**
	 * Consumes the current token if it is the expected kind, otherwise a fatal error
	 *
	 * @param expected The token kind required here
	 */
	private void accept (TokenType expected) {
		TokenType token = tokenSource.currentToken ();
		if (token != expected)
			fatal ("Syntax Error: unexpected `" + tokenSource.tokenToString (token) + "` expected `" + tokenSource.tokenToString (expected) + "`");

		tokenSource.nextToken ();
	}

	/**
	 * @return True if the current token is a number that looks like a leading line number
	 */
	private boolean isLineNumber () {
		return tokenSource.currentToken () == TokenType.NUMBER && looksLikeLineNumber (tokenSource.getNum (), tokenSource.peekChar ());
	}

	/**
	 * Decides if a number is a leading line number rather than a literal, since the token source does not tell them
	 * apart: at least 10, a multiple of 10, and followed by whitespace or the end of input
	 *
	 * @param value The number
	 * @param next The raw character straight after it, 0 at the end of input
	 * @return True if it should be treated as a leading line number
	 */
	public static boolean looksLikeLineNumber (int value, char next) {
		if (value < 10 || value % 10 != 0)
			return false;

		return next == ' ' || next == '\t' || next == '\n' || next == '\r' || next == 0;
	}

	private static int variableSlot (char name) {
		char c = Character.toLowerCase (name);
		if (c < 'a' || c > 'z')
			throw new IllegalArgumentException ("Not a variable name: " + name);

		return c - 'a';
	}

	private void print (String text) {
		if (stdoutStream != null) {
			stdoutStream.print (text);
		} else {
			stdoutBuffer.append (text);
		}
	}

	private void warning (String message) {
		diagnostic ("WARNING: " + message);
	}

	/**
	 * Writes a fatal error to the diagnostics
	 *
	 * @param message Optional string or null of the message to display
	 * @return False (used as a placeholder for returns in other methods)
	 */
	private boolean error (String message) {
		diagnostic ("ERROR: " + (message != null ? message : "Unknown error"));
		return false;
	}

	/**
	 * Writes a fatal error and abandons the run
	 */
	private void fatal (String message) {
		error (message);
		throw new ExecutionAbort (message);
	}

	private void diagnostic (String line) {
		if (stderrStream != null) {
			stderrStream.println (line);
		} else {
			stderrBuffer.append (line).append ('\n');
		}
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
