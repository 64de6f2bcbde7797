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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A classified lexical unit of a formula.
 * <p>
 * Tokens are immutable. The later stages of the compiler never look at the
 * raw fields directly when a predicate exists: they rely on
 * {@link #matches(TokenType, TokenSubtype, String)}, {@link #isOperator()} and
 * {@link #isFuncOpen()}.
 */
public final class Token {

	private static final Pattern NUMBER = Pattern.compile("([0-9]+\\.?[0-9]*|\\.[0-9]+)([Ee][+-]?[0-9]+)?");

	private final String value;
	private final TokenType type;
	private final TokenSubtype subtype;

	/**
	 * Creates a token.
	 *
	 * @param value text of the token
	 * @param type main classification
	 * @param subtype secondary classification, {@link TokenSubtype#NONE} when {@code null}
	 */
	public Token(String value, TokenType type, TokenSubtype subtype) {
		this.value = Objects.requireNonNull(value, "Token value must not be null");
		this.type = Objects.requireNonNull(type, "Token type must not be null");
		this.subtype = subtype == null ? TokenSubtype.NONE : subtype;
	}

	/**
	 * Creates a token without subtype.
	 *
	 * @param value text of the token
	 * @param type main classification
	 */
	public Token(String value, TokenType type) {
		this(value, type, TokenSubtype.NONE);
	}

	/**
	 * Creates an operand token, deducing its subtype from its text.
	 *
	 * @param value text of the operand
	 * @return the operand token
	 */
	public static Token makeOperand(String value) {
		TokenSubtype subtype;
		if (value.startsWith("\"")) {
			subtype = TokenSubtype.TEXT;
		} else if (value.startsWith("#")) {
			subtype = TokenSubtype.ERROR;
		} else if ("TRUE".equalsIgnoreCase(value) || "FALSE".equalsIgnoreCase(value)) {
			subtype = TokenSubtype.LOGICAL;
		} else if (NUMBER.matcher(value).matches()) {
			subtype = TokenSubtype.NUMBER;
		} else {
			subtype = TokenSubtype.RANGE;
		}
		return new Token(value, TokenType.OPERAND, subtype);
	}

	/**
	 * Creates the token of a sub-expression boundary: a function call,
	 * an array literal or a parenthesized group.
	 *
	 * @param value text of the boundary, ending with a bracket
	 * @param func whether the boundary belongs to a function call
	 * @return the boundary token
	 */
	static Token makeSubexpression(String value, boolean func) {
		TokenType type;
		if (func) {
			type = TokenType.FUNC;
		} else if ("{".equals(value) || "}".equals(value)) {
			type = TokenType.ARRAY;
		} else if ("(".equals(value) || ")".equals(value)) {
			type = TokenType.PAREN;
		} else {
			type = TokenType.FUNC;
		}
		TokenSubtype subtype = ")".equals(value) || "}".equals(value) ? TokenSubtype.CLOSE : TokenSubtype.OPEN;
		return new Token(value, type, subtype);
	}

	/**
	 * @return the token closing the sub-expression opened by this token
	 */
	Token getCloser() {
		if (subtype != TokenSubtype.OPEN) {
			throw new IllegalStateException("Not an opening token: " + this);
		}
		return makeSubexpression(type == TokenType.ARRAY ? "}" : ")", type == TokenType.FUNC);
	}

	/**
	 * @param value {@code ,} or {@code ;}
	 * @return the separator token
	 */
	static Token makeSeparator(String value) {
		return new Token(value, TokenType.SEP, ";".equals(value) ? TokenSubtype.ROW : TokenSubtype.ARG);
	}

	public String getValue() {
		return value;
	}

	public TokenType getType() {
		return type;
	}

	public TokenSubtype getSubtype() {
		return subtype;
	}

	/**
	 * Checks this token against the specified filters. A {@code null} filter
	 * matches anything, and all filters must match.
	 *
	 * @param typeFilter expected type, or {@code null}
	 * @param subtypeFilter expected subtype, or {@code null}
	 * @param valueFilter expected value, or {@code null}
	 * @return whether this token matches
	 */
	public boolean matches(TokenType typeFilter, TokenSubtype subtypeFilter, String valueFilter) {
		return (typeFilter == null || type == typeFilter)
				&& (subtypeFilter == null || subtype == subtypeFilter)
				&& (valueFilter == null || value.equals(valueFilter));
	}

	public boolean matches(TokenType typeFilter, TokenSubtype subtypeFilter) {
		return matches(typeFilter, subtypeFilter, null);
	}

	/**
	 * @return whether this token is a prefix, infix or postfix operator
	 */
	public boolean isOperator() {
		return type == TokenType.OP_PRE || type == TokenType.OP_IN || type == TokenType.OP_POST;
	}

	/**
	 * @return whether this token opens a function call, an array or an array row
	 */
	public boolean isFuncOpen() {
		return subtype == TokenSubtype.OPEN
				&& (type == TokenType.FUNC || type == TokenType.ARRAY || type == TokenType.ARRAYROW);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Token)) {
			return false;
		}
		Token token = (Token) other;
		return value.equals(token.value) && type == token.type && subtype == token.subtype;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, subtype);
	}

	@Override
	public String toString() {
		return "'" + value + "' <" + type + (subtype == TokenSubtype.NONE ? "" : " " + subtype) + ">";
	}
}
