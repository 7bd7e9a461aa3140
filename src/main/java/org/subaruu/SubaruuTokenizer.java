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

import static org.subaruu.Subaruu.logV;

import java.util.HashMap;
import java.util.Locale;

import org.subaruu.Subaruu.TokenSource;
import org.subaruu.Subaruu.TokenType;

/**
 * Turns SUBARUU program text into tokens on demand, one token at a time
 * <p>Spaces, tabs and carriage returns separate tokens and are otherwise ignored; a newline is an {@link
 * TokenType#EOL} token. Words are keywords when they match one (in any case), a single letter otherwise, and an
 * {@link TokenType#ERROR} when they are longer than one letter. Anything unexpected is also an ERROR token rather
 * than a failure, the engine decides what to do about it.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public class SubaruuTokenizer implements TokenSource {
	private static final String LOG_TAG = SubaruuTokenizer.class.getSimpleName ();
	private static final boolean DEBUG = false;

	/** Keywords, matched without regard to case */
	private static final HashMap<String, TokenType> keywords = new HashMap<String, TokenType> ();
	static {
		keywords.put ("rem", TokenType.REM);
		keywords.put ("print", TokenType.PRINT);
		keywords.put ("if", TokenType.IF);
		keywords.put ("then", TokenType.THEN);
		keywords.put ("goto", TokenType.GOTO);
		keywords.put ("let", TokenType.LET);
	}

	private final String source;
	private int position; // Index of the first character after the current token
	private TokenType tokenType;
	private String tokenValue;
	private int tokenNumber;

	/**
	 * Constructor, positions on the first token
	 *
	 * @param source Program text
	 */
	public SubaruuTokenizer (String source) {
		this.source = (source == null ? "" : source);
		reset ();
	}

	public TokenType currentToken () {
		return tokenType;
	}

	public boolean finished () {
		return tokenType == TokenType.EOF;
	}

	public void reset () {
		position = 0;
		tokenType = null;
		nextToken ();
	}

	public char peekChar () {
		return position < source.length () ? source.charAt (position) : 0;
	}

	public int getNum () {
		return tokenNumber;
	}

	public String getString () {
		return tokenValue;
	}

	public char getLetter () {
		return tokenValue.charAt (0);
	}

	public void skipToEol () {
		// Comment text is skipped raw so it never has to tokenise
		int eol = source.indexOf ('\n', position);
		position = (eol == -1 ? source.length () : eol + 1);
		nextToken ();
	}

	public String tokenToString (TokenType token) {
		return token == null ? "null" : token.text ();
	}

	public void nextToken () {
		if (tokenType == TokenType.EOF)
			return;

		tokenValue = "";
		tokenNumber = 0;

		int j = source.length ();
		char c;

		// Skip whitespace
		while (position < j && ((c = source.charAt (position)) == ' ' || c == '\t' || c == '\r'))
			++position;

		if (position == j) {
			tokenType = TokenType.EOF;
		} else {
			c = source.charAt (position);
			int start = position++;

			if (c == '\n') {
				tokenType = TokenType.EOL;
			} else if (c >= '0' && c <= '9') {
				while (position < j && source.charAt (position) >= '0' && source.charAt (position) <= '9')
					++position;

				tokenValue = source.substring (start, position);
				try {
					tokenNumber = Integer.parseInt (tokenValue);
					tokenType = TokenType.NUMBER;
				} catch (NumberFormatException e) {
					tokenType = TokenType.ERROR; // Too big for an int
				}
			} else if (Character.isLetter (c)) {
				while (position < j && Character.isLetter (source.charAt (position)))
					++position;

				tokenValue = source.substring (start, position);
				TokenType keyword = keywords.get (tokenValue.toLowerCase (Locale.ROOT));
				tokenType = (keyword != null ? keyword : (tokenValue.length () == 1 && c < 128 ? TokenType.LETTER : TokenType.ERROR));
			} else if (c == '"') {
				while (position < j && source.charAt (position) != '"' && source.charAt (position) != '\n')
					++position;

				if (position < j && source.charAt (position) == '"') {
					tokenValue = source.substring (start + 1, position++);
					tokenType = TokenType.STRING;
				} else {
					tokenValue = source.substring (start, position);
					tokenType = TokenType.ERROR; // Unterminated string
				}
			} else if (c == '<') {
				if (position < j && source.charAt (position) == '=') {
					++position;
					tokenType = TokenType.LT_EQ;
				} else if (position < j && source.charAt (position) == '>') {
					++position;
					tokenType = TokenType.NOT_EQUAL;
				} else {
					tokenType = TokenType.LT;
				}
			} else if (c == '>') {
				if (position < j && source.charAt (position) == '=') {
					++position;
					tokenType = TokenType.GT_EQ;
				} else {
					tokenType = TokenType.GT;
				}
			} else {
				tokenType = (c == ',' ? TokenType.SEPARATOR : (c == '+' ? TokenType.PLUS : (c == '-' ? TokenType.MINUS : (c == '*' ? TokenType.ASTERISK : (c == '/' ? TokenType.SLASH : (c == '(' ? TokenType.LEFT_PAREN : (c == ')' ? TokenType.RIGHT_PAREN : (c == '=' ? TokenType.EQUAL : TokenType.ERROR))))))));
				tokenValue = String.valueOf (c);
			}
		}

		if (DEBUG)
			logV (LOG_TAG, "Token " + tokenType + (tokenValue.isEmpty () ? "" : " " + tokenValue) + " next=" + (int) peekChar ());
	}
}
