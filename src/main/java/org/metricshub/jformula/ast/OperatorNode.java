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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.frontend.TokenSubtype;
import org.metricshub.jformula.frontend.TokenType;

/**
 * A prefix, infix or postfix operator.
 */
public class OperatorNode extends AstNode {

	/**
	 * Target-language spelling of the operators that differ from the
	 * spreadsheet one.
	 */
	private static final Map<String, String> OPERATORS = new HashMap<String, String>();

	static {
		OPERATORS.put("^", "**");
		OPERATORS.put("=", "==");
		OPERATORS.put("<>", "!=");
		OPERATORS.put("&", "+");
		// range intersection
		OPERATORS.put(" ", "+");
	}

	OperatorNode(Token token) {
		super(token);
	}

	@Override
	public String emit(CodeEmitter emitter) {
		String symbol = getValue();
		String op = OPERATORS.getOrDefault(symbol, symbol);
		List<AstNode> args = emitter.getChildren(this);
		AstNode parent = emitter.getParent(this);

		String code;
		if (getType() == TokenType.OP_PRE && "+".equals(symbol)) {
			// identity, the operand already groups itself
			return emitter.emit(args.get(0));

		} else if (getType() == TokenType.OP_PRE) {
			code = "-" + emitter.emit(args.get(0));

		} else if (getType() == TokenType.OP_POST) {
			code = emitter.emit(args.get(0)) + " / 100";

		} else if ("^".equals(symbol) && parent instanceof FunctionNode && ((FunctionNode) parent).getKind().isRegression()) {
			// in a regression, the exponent selects the polynomial terms and is not emitted
			return emitter.emit(args.get(0));

		} else if (symbol.startsWith("<")) {
			// blank cells compare as zero
			code = guardBlank(emitter, args.get(0)) + " " + op + " " + emitter.emit(args.get(1));

		} else if (symbol.startsWith(">")) {
			code = emitter.emit(args.get(0)) + " " + op + " " + guardBlank(emitter, args.get(1));

		} else {
			String separator = ",".equals(op) ? op : " " + op;
			code = emitter.emit(args.get(0)) + separator + " " + emitter.emit(args.get(1));
		}

		if (parent != null && !(parent instanceof FunctionNode)) {
			code = "(" + code + ")";
		}
		return code;
	}

	private static String guardBlank(CodeEmitter emitter, AstNode operand) {
		String code = emitter.emit(operand);
		if (operand.getToken().matches(TokenType.OPERAND, TokenSubtype.NUMBER)) {
			return code;
		}
		return "(" + code + " if " + code + " is not None else 0)";
	}
}
