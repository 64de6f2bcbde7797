package org.metricshub.jformula.ast;

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

import org.metricshub.jformula.frontend.ParserException;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.frontend.TokenSubtype;
import org.metricshub.jformula.frontend.TokenType;

/**
 * A node of the syntax tree of a formula.
 * <p>
 * Nodes are created once from a classified token, and never reclassified.
 * They do not know their position in the tree: parent and children are
 * queried from the {@link AstGraph} the node is attached to, which the
 * {@link CodeEmitter} passes along during emission.
 */
public abstract class AstNode {

	private final Token token;

	protected AstNode(Token token) {
		this.token = token;
	}

	/**
	 * Creates the node matching the classification of the specified token.
	 *
	 * @param token an operand, function opening or operator token
	 * @return the new node
	 * @throws ParserException if the token cannot be a node
	 */
	public static AstNode create(Token token) {
		if (token.getType() == TokenType.OPERAND) {
			if (token.getSubtype() == TokenSubtype.RANGE) {
				return new RangeNode(token);
			}
			return new OperandNode(token);
		} else if (token.isFuncOpen()) {
			return new FunctionNode(token);
		} else if (token.isOperator()) {
			return new OperatorNode(token);
		}
		throw new ParserException("Unknown token type: " + token);
	}

	public Token getToken() {
		return token;
	}

	public String getValue() {
		return token.getValue();
	}

	public TokenType getType() {
		return token.getType();
	}

	public TokenSubtype getSubtype() {
		return token.getSubtype();
	}

	/**
	 * Produces the target-language code of this node. Children are emitted
	 * through the specified emitter before this node composes its own text.
	 *
	 * @param emitter gives access to the tree, the settings and the context
	 * @return the code of this node
	 * @throws ParserException if this node cannot be emitted
	 */
	public abstract String emit(CodeEmitter emitter);

	@Override
	public String toString() {
		String value = getValue();
		if (value.endsWith("(")) {
			value = value.substring(0, value.length() - 1);
		}
		return getClass().getSimpleName() + "<" + value + ">";
	}
}
