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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Produces the classified token sequence consumed by {@link FormulaParser}.
 * <p>
 * On top of {@link FormulaTokenizer}, resolves the whitespace ambiguity of
 * spreadsheet formulas: a blank between two things that produce a value is
 * the range intersection operator, any other blank is dropped.
 */
public final class FormulaLexer {

	private FormulaLexer() {}

	/**
	 * Tokenizes the specified formula.
	 *
	 * @param formula the formula, with or without its leading {@code =}
	 * @return the tokens, without any {@link TokenType#WSPACE} token
	 * @throws ParserException when the formula cannot be tokenized
	 */
	public static List<Token> tokenize(String formula) {
		List<Token> raw = FormulaTokenizer.tokenize(formula);
		List<Token> tokens = new ArrayList<Token>(raw.size());
		for (int i = 0; i < raw.size(); i++) {
			Token token = raw.get(i);
			if (token.getType() != TokenType.WSPACE) {
				tokens.add(token);
				continue;
			}
			if (i == 0 || i == raw.size() - 1) {
				continue;
			}
			if (endsValue(raw.get(i - 1)) && startsValue(raw.get(i + 1))) {
				tokens.add(new Token(" ", TokenType.OP_IN, TokenSubtype.INTERSECT));
			}
		}
		return Collections.unmodifiableList(tokens);
	}

	private static boolean endsValue(Token token) {
		return token.matches(TokenType.FUNC, TokenSubtype.CLOSE)
				|| token.matches(TokenType.PAREN, TokenSubtype.CLOSE)
				|| token.getType() == TokenType.OPERAND;
	}

	private static boolean startsValue(Token token) {
		return token.matches(TokenType.FUNC, TokenSubtype.OPEN)
				|| token.matches(TokenType.PAREN, TokenSubtype.OPEN)
				|| token.getType() == TokenType.OPERAND;
	}
}
