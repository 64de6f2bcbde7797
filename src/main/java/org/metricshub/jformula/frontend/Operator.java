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

import java.util.HashMap;
import java.util.Map;

/**
 * Precedence table of the formula operators, used by the shunting-yard
 * algorithm of {@link FormulaParser}. A higher precedence binds tighter.
 */
public enum Operator {
	RANGE(":", 8),
	INTERSECTION(" ", 8),
	UNION(",", 8),
	NEGATION("u-", 7),
	IDENTITY("u+", 7),
	PERCENT("%", 6),
	POWER("^", 5),
	MULTIPLY("*", 4),
	DIVIDE("/", 4),
	ADD("+", 3),
	SUBTRACT("-", 3),
	CONCATENATE("&", 2),
	EQUAL("=", 1),
	LESS("<", 1),
	GREATER(">", 1),
	LESS_OR_EQUAL("<=", 1),
	GREATER_OR_EQUAL(">=", 1),
	NOT_EQUAL("<>", 1);

	private static final Map<String, Operator> BY_SYMBOL = new HashMap<String, Operator>();

	static {
		for (Operator operator : values()) {
			BY_SYMBOL.put(operator.symbol, operator);
		}
	}

	private final String symbol;
	private final int precedence;
	private final boolean leftAssociative;

	Operator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.leftAssociative = true;
	}

	/**
	 * Looks up the operator of the specified token. A prefix {@code -} is the
	 * negation, which binds tighter than the subtraction.
	 *
	 * @param token an operator token
	 * @return the corresponding operator
	 * @throws ParserException if the token is not a known operator
	 */
	public static Operator of(Token token) {
		if (token.matches(TokenType.OP_PRE, null, "-")) {
			return NEGATION;
		}
		if (token.matches(TokenType.OP_PRE, null, "+")) {
			return IDENTITY;
		}
		if (token.matches(TokenType.OP_IN, TokenSubtype.INTERSECT)) {
			return INTERSECTION;
		}
		Operator operator = BY_SYMBOL.get(token.getValue());
		if (operator == null || operator == NEGATION || operator == IDENTITY) {
			throw new ParserException("Unknown operator: " + token.getValue());
		}
		return operator;
	}

	/**
	 * Whether an operator already on the stack must be output before this one
	 * is pushed.
	 *
	 * @param stacked the operator on top of the stack
	 * @return {@code true} if {@code stacked} is to be popped
	 */
	public boolean yieldsTo(Operator stacked) {
		return precedence < stacked.precedence || leftAssociative && precedence == stacked.precedence;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public boolean isLeftAssociative() {
		return leftAssociative;
	}
}
