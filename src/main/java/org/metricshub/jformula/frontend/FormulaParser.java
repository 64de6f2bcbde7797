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
import org.metricshub.jformula.ast.AstNode;
import org.metricshub.jformula.ast.FunctionNode;

/**
 * Converts a formula token sequence into reverse polish notation.
 * <p>
 * The core is the shunting-yard algorithm, extended to count the arguments
 * of function calls, since spreadsheet functions are variadic. Array literals
 * are handled as nested calls: an {@code ARRAY} pseudo-function whose
 * arguments are {@code ARRAYROW} pseudo-functions.
 */
public final class FormulaParser {

	private static final Token OPEN_PAREN = new Token("(", TokenType.PAREN, TokenSubtype.OPEN);
	private static final Token CLOSE_PAREN = new Token(")", TokenType.PAREN, TokenSubtype.CLOSE);
	private static final Token ARG_SEPARATOR = new Token(",", TokenType.SEP, TokenSubtype.ARG);
	private static final Token ARRAYROW_OPEN = new Token("", TokenType.ARRAYROW, TokenSubtype.OPEN);

	private FormulaParser() {}

	/**
	 * Tokenizes and parses the specified formula.
	 *
	 * @param formula the formula to parse
	 * @return the syntax tree nodes in postfix order
	 * @throws ParserException if the formula is invalid
	 */
	public static List<AstNode> parseToPostfix(String formula) {
		return parseToPostfix(FormulaLexer.tokenize(formula));
	}

	/**
	 * Parses the specified tokens.
	 *
	 * @param tokens tokens as produced by {@link FormulaLexer}
	 * @return the syntax tree nodes in postfix order
	 * @throws ParserException if the tokens do not form a valid formula
	 */
	public static List<AstNode> parseToPostfix(List<Token> tokens) {
		List<AstNode> output = new ArrayList<AstNode>();
		Deque<Token> stack = new ArrayDeque<Token>();
		Deque<Boolean> wereValues = new ArrayDeque<Boolean>();
		Deque<Integer> argCount = new ArrayDeque<Integer>();

		for (Token token : canonicalize(tokens)) {
			if (token.getType() == TokenType.OPERAND) {
				output.add(AstNode.create(token));
				markValue(wereValues);

			} else if (token.getType() != TokenType.PAREN && token.getSubtype() == TokenSubtype.OPEN) {
				if (token.getType() == TokenType.ARRAY || token.getType() == TokenType.ARRAYROW) {
					token = new Token(token.getType().name(), token.getType(), token.getSubtype());
				}
				stack.push(token);
				argCount.push(0);
				markValue(wereValues);
				wereValues.push(Boolean.FALSE);

			} else if (token.getType() == TokenType.SEP) {
				while (!stack.isEmpty() && stack.peek().getSubtype() != TokenSubtype.OPEN) {
					output.add(AstNode.create(stack.pop()));
				}
				if (wereValues.isEmpty()) {
					throw new ParserException("Mismatched or misplaced parentheses");
				}
				if (wereValues.pop()) {
					argCount.push(argCount.pop() + 1);
				}
				wereValues.push(Boolean.FALSE);

			} else if (token.isOperator()) {
				Operator current = Operator.of(token);
				while (!stack.isEmpty() && stack.peek().isOperator()) {
					if (current.yieldsTo(Operator.of(stack.peek()))) {
						output.add(AstNode.create(stack.pop()));
					} else {
						break;
					}
				}
				stack.push(token);

			} else if (token.getSubtype() == TokenSubtype.OPEN) {
				stack.push(token);

			} else if (token.getSubtype() == TokenSubtype.CLOSE) {
				while (!stack.isEmpty() && stack.peek().getSubtype() != TokenSubtype.OPEN) {
					output.add(AstNode.create(stack.pop()));
				}
				if (stack.isEmpty()) {
					throw new ParserException("Mismatched or misplaced parentheses");
				}
				stack.pop();

				if (!stack.isEmpty() && stack.peek().isFuncOpen()) {
					FunctionNode function = (FunctionNode) AstNode.create(stack.pop());
					function.setNumArgs(argCount.pop() + (wereValues.pop() ? 1 : 0));
					output.add(function);
				}
			} else {
				throw new ParserException("Unexpected token: " + token);
			}
		}

		while (!stack.isEmpty()) {
			Token top = stack.pop();
			if (top.getSubtype() == TokenSubtype.OPEN || top.getSubtype() == TokenSubtype.CLOSE) {
				throw new ParserException("Mismatched or misplaced parentheses");
			}
			output.add(AstNode.create(top));
		}

		return Collections.unmodifiableList(output);
	}

	/**
	 * Rewrites the token stream so that function calls, array literals and
	 * array rows all look like a name followed by a parenthesized argument
	 * list.
	 */
	static List<Token> canonicalize(List<Token> tokens) {
		List<Token> result = new ArrayList<Token>(tokens.size() * 2);
		for (Token token : tokens) {
			if (token.matches(TokenType.FUNC, TokenSubtype.OPEN)) {
				result.add(token);
				result.add(OPEN_PAREN);

			} else if (token.matches(TokenType.FUNC, TokenSubtype.CLOSE)) {
				result.add(CLOSE_PAREN);

			} else if (token.matches(TokenType.ARRAY, TokenSubtype.OPEN)) {
				result.add(token);
				result.add(OPEN_PAREN);
				result.add(ARRAYROW_OPEN);
				result.add(OPEN_PAREN);

			} else if (token.matches(TokenType.ARRAY, TokenSubtype.CLOSE)) {
				// closes the last row, then the array itself
				result.add(token);
				result.add(CLOSE_PAREN);

			} else if (token.matches(TokenType.SEP, TokenSubtype.ROW)) {
				result.add(CLOSE_PAREN);
				result.add(ARG_SEPARATOR);
				result.add(ARRAYROW_OPEN);
				result.add(OPEN_PAREN);

			} else if (token.matches(TokenType.PAREN, TokenSubtype.OPEN)) {
				result.add(OPEN_PAREN);

			} else if (token.matches(TokenType.PAREN, TokenSubtype.CLOSE)) {
				result.add(CLOSE_PAREN);

			} else {
				result.add(token);
			}
		}
		return result;
	}

	private static void markValue(Deque<Boolean> wereValues) {
		if (!wereValues.isEmpty()) {
			wereValues.pop();
			wereValues.push(Boolean.TRUE);
		}
	}
}
