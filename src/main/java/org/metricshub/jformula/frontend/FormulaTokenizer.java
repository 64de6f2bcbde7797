package org.metricshub.jformula.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jformula
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a spreadsheet formula into raw lexical units: numbers, strings,
 * references, error codes, operators, separators, parentheses, function and
 * array boundaries, and whitespace.
 * <p>
 * Whitespace is reported as is. Deciding whether a blank is an intersection
 * operator or mere layout is the job of {@link FormulaLexer}.
 */
public final class FormulaTokenizer {

	/** Mantissa of a number in scientific notation, waiting for the sign of its exponent */
	private static final Pattern SCIENTIFIC_NOTATION = Pattern.compile("[1-9](\\.[0-9]+)?[Ee]");

	private static final String[] ERROR_CODES = {
			"#NULL!",
			"#DIV/0!",
			"#VALUE!",
			"#REF!",
			"#NAME?",
			"#NUM!",
			"#N/A",
			"#GETTING_DATA" };

	private static final String TOKEN_ENDERS = ",;}) +-*/^&=><%";

	private final String formula;
	private final List<Token> items = new ArrayList<Token>();
	private final Deque<Token> tokenStack = new ArrayDeque<Token>();

	/** Text of the operand being read */
	private final StringBuilder token = new StringBuilder();

	private int offset;

	private FormulaTokenizer(String formula) {
		this.formula = formula;
	}

	/**
	 * Tokenizes the specified formula. A leading {@code =} is optional.
	 *
	 * @param formula the formula to tokenize
	 * @return the raw tokens, in source order
	 * @throws ParserException when the formula cannot be split
	 */
	public static List<Token> tokenize(String formula) {
		FormulaTokenizer tokenizer = new FormulaTokenizer(formula == null ? "" : formula);
		tokenizer.parse();
		return Collections.unmodifiableList(tokenizer.items);
	}

	private void parse() {
		if (formula.isEmpty()) {
			return;
		}
		if (formula.charAt(0) == '=') {
			offset = 1;
		}
		while (offset < formula.length()) {
			if (checkScientificNotation()) {
				continue;
			}
			char c = formula.charAt(offset);
			if (TOKEN_ENDERS.indexOf(c) >= 0) {
				saveToken();
			}
			switch (c) {
			case '"':
			case '\'':
				offset += parseString();
				break;
			case '[':
				offset += parseBrackets();
				break;
			case '#':
				offset += parseError();
				break;
			case ' ':
			case '\n':
				offset += parseWhitespace();
				break;
			case '+':
			case '-':
			case '*':
			case '/':
			case '^':
			case '&':
			case '=':
			case '>':
			case '<':
			case '%':
				offset += parseOperator();
				break;
			case '{':
			case '(':
				offset += parseOpener();
				break;
			case ')':
			case '}':
				offset += parseCloser();
				break;
			case ';':
			case ',':
				offset += parseSeparator();
				break;
			default:
				token.append(c);
				offset++;
				break;
			}
		}
		saveToken();
	}

	/**
	 * Reads a double-quoted string literal, or a single-quoted sheet name
	 * which stays part of the reference being read.
	 *
	 * @return number of characters consumed
	 */
	private int parseString() {
		assertEmptyToken(":");
		char delimiter = formula.charAt(offset);
		int end = offset + 1;
		while (true) {
			if (end >= formula.length()) {
				String what = delimiter == '"' ? "string" : "link";
				throw new ParserException("Reached end of formula while parsing " + what + " in " + formula);
			}
			if (formula.charAt(end) == delimiter) {
				if (end + 1 < formula.length() && formula.charAt(end + 1) == delimiter) {
					// doubled delimiter is an escaped one
					end += 2;
					continue;
				}
				break;
			}
			end++;
		}
		String match = formula.substring(offset, end + 1);
		if (delimiter == '"') {
			items.add(Token.makeOperand(match));
		} else {
			token.append(match);
		}
		return match.length();
	}

	/**
	 * Reads a bracketed segment, like the table part of a structured reference.
	 *
	 * @return number of characters consumed
	 */
	private int parseBrackets() {
		int openCount = 0;
		for (int i = offset; i < formula.length(); i++) {
			char c = formula.charAt(i);
			if (c == '[') {
				openCount++;
			} else if (c == ']') {
				openCount--;
				if (openCount == 0) {
					token.append(formula, offset, i + 1);
					return i + 1 - offset;
				}
			}
		}
		throw new ParserException("Encountered unmatched '[' in " + formula);
	}

	private int parseError() {
		assertEmptyToken("!");
		for (String errorCode : ERROR_CODES) {
			if (formula.startsWith(errorCode, offset)) {
				items.add(Token.makeOperand(token + errorCode));
				token.setLength(0);
				return errorCode.length();
			}
		}
		throw new ParserException("Invalid error code at position " + offset + " in '" + formula + "'");
	}

	private int parseWhitespace() {
		items.add(new Token(String.valueOf(formula.charAt(offset)), TokenType.WSPACE));
		int end = offset;
		while (end < formula.length() && (formula.charAt(end) == ' ' || formula.charAt(end) == '\n')) {
			end++;
		}
		return end - offset;
	}

	private int parseOperator() {
		if (formula.startsWith(">=", offset) || formula.startsWith("<=", offset) || formula.startsWith("<>", offset)) {
			items.add(new Token(formula.substring(offset, offset + 2), TokenType.OP_IN));
			return 2;
		}
		char c = formula.charAt(offset);
		String value = String.valueOf(c);
		Token operator;
		if (c == '%') {
			operator = new Token(value, TokenType.OP_POST);
		} else if ("*/^&=><".indexOf(c) >= 0) {
			operator = new Token(value, TokenType.OP_IN);
		} else if (isInfixPosition()) {
			operator = new Token(value, TokenType.OP_IN);
		} else {
			operator = new Token(value, TokenType.OP_PRE);
		}
		items.add(operator);
		return 1;
	}

	/**
	 * A {@code +} or {@code -} is binary when it follows something that
	 * produces a value.
	 */
	private boolean isInfixPosition() {
		for (int i = items.size() - 1; i >= 0; i--) {
			Token previous = items.get(i);
			if (previous.getType() != TokenType.WSPACE) {
				return previous.getSubtype() == TokenSubtype.CLOSE
						|| previous.getType() == TokenType.OP_POST
						|| previous.getType() == TokenType.OPERAND;
			}
		}
		return false;
	}

	private int parseOpener() {
		Token opener;
		if (formula.charAt(offset) == '{') {
			assertEmptyToken("");
			opener = Token.makeSubexpression("{", false);
		} else if (token.length() > 0) {
			opener = Token.makeSubexpression(token + "(", true);
			token.setLength(0);
		} else {
			opener = Token.makeSubexpression("(", false);
		}
		items.add(opener);
		tokenStack.push(opener);
		return 1;
	}

	private int parseCloser() {
		if (tokenStack.isEmpty()) {
			throw new ParserException("Mismatched or misplaced parentheses");
		}
		Token closer = tokenStack.pop().getCloser();
		if (!closer.getValue().equals(String.valueOf(formula.charAt(offset)))) {
			throw new ParserException("Mismatched ( and { pair in '" + formula + "'");
		}
		items.add(closer);
		return 1;
	}

	private int parseSeparator() {
		char c = formula.charAt(offset);
		Token separator;
		if (c == ';') {
			separator = Token.makeSeparator(";");
		} else if (tokenStack.isEmpty() || tokenStack.peek().getType() == TokenType.PAREN) {
			// range union
			separator = new Token(",", TokenType.OP_IN);
		} else {
			separator = Token.makeSeparator(",");
		}
		items.add(separator);
		return 1;
	}

	private boolean checkScientificNotation() {
		char c = formula.charAt(offset);
		if ((c == '+' || c == '-') && token.length() > 0 && SCIENTIFIC_NOTATION.matcher(token).matches()) {
			token.append(c);
			offset++;
			return true;
		}
		return false;
	}

	/**
	 * Verifies that no operand text is pending, unless it ends with one of the
	 * allowed characters.
	 */
	private void assertEmptyToken(String canFollow) {
		if (token.length() > 0 && canFollow.indexOf(token.charAt(token.length() - 1)) < 0) {
			throw new ParserException("Unexpected character at position " + offset + " in '" + formula + "'");
		}
	}

	private void saveToken() {
		if (token.length() > 0) {
			items.add(Token.makeOperand(token.toString()));
			token.setLength(0);
		}
	}
}
