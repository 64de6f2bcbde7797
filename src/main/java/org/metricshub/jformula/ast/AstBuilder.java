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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.metricshub.jformula.frontend.ParserException;
import org.metricshub.jformula.frontend.TokenType;
import org.metricshub.jformula.util.FormulaLogger;
import org.slf4j.Logger;

/**
 * Builds the syntax tree of a formula from its postfix form.
 */
public final class AstBuilder {

	private static final Logger LOGGER = FormulaLogger.getLogger(AstBuilder.class);

	private AstBuilder() {}

	/**
	 * Reduces the specified postfix sequence into a tree.
	 * <p>
	 * Operands are leaves. An infix operator takes the two previous values
	 * (left at position 0, right at position 1), a prefix or postfix operator
	 * takes one (at position 1), and a function takes as many as its number of
	 * arguments, the oldest at position 0.
	 *
	 * @param postfix nodes in reverse polish order, as produced by the parser
	 * @return the tree, whose root is the last node reduced
	 * @throws ParserException if an operator or function lacks operands, or if
	 *         the sequence does not reduce to exactly one expression
	 */
	public static AstGraph build(List<AstNode> postfix) {
		AstGraph ast = new AstGraph();
		Deque<AstNode> stack = new ArrayDeque<AstNode>();

		for (AstNode node : postfix) {
			ast.addNode(node);
			if (node instanceof OperatorNode) {
				if (node.getType() == TokenType.OP_IN) {
					if (stack.size() < 2) {
						throw missingOperand(node);
					}
					AstNode right = stack.pop();
					AstNode left = stack.pop();
					ast.addEdge(left, node, 0);
					ast.addEdge(right, node, 1);
				} else {
					if (stack.isEmpty()) {
						throw missingOperand(node);
					}
					ast.addEdge(stack.pop(), node, 1);
				}
			} else if (node instanceof FunctionNode) {
				FunctionNode function = (FunctionNode) node;
				int numArgs = function.getNumArgs();
				if (stack.size() < numArgs) {
					throw new ParserException("'" + function.getName() + "' function missing arguments");
				}
				AstNode[] args = new AstNode[numArgs];
				for (int i = numArgs - 1; i >= 0; i--) {
					args[i] = stack.pop();
				}
				for (int i = 0; i < numArgs; i++) {
					ast.addEdge(args[i], node, i);
				}
			}
			stack.push(node);
		}

		if (stack.size() != 1) {
			throw new ParserException("Invalid formula: " + stack.size() + " expressions after reduction instead of 1");
		}
		ast.setRoot(stack.pop());
		LOGGER.trace("Built syntax tree of {} nodes rooted at {}", postfix.size(), ast.getRoot());
		return ast;
	}

	private static ParserException missingOperand(AstNode operator) {
		return new ParserException("'" + operator.getValue() + "' operator missing operand");
	}
}
