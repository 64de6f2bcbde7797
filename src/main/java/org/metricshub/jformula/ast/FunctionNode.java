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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.jformula.context.EvaluationContext;
import org.metricshub.jformula.context.RegressionPosition;
import org.metricshub.jformula.frontend.ParserException;
import org.metricshub.jformula.frontend.Token;

/**
 * A function call, or one of the {@code ARRAY} and {@code ARRAYROW}
 * pseudo-functions the parser uses for array literals.
 * <p>
 * The number of arguments is only known once the parser reaches the closing
 * parenthesis, so it is set after creation.
 */
public class FunctionNode extends AstNode {

	private final String name;
	private final FunctionKind kind;
	private int numArgs;

	FunctionNode(Token token) {
		super(token);
		String lower = token.getValue().toLowerCase(Locale.ROOT);
		this.name = lower.endsWith("(") ? lower.substring(0, lower.length() - 1) : lower;
		this.kind = FunctionKind.forName(name);
	}

	/**
	 * @return lower-case name of the function, without parenthesis
	 */
	public String getName() {
		return name;
	}

	public FunctionKind getKind() {
		return kind;
	}

	public int getNumArgs() {
		return numArgs;
	}

	public void setNumArgs(int numArgs) {
		this.numArgs = numArgs;
	}

	@Override
	public String emit(CodeEmitter emitter) {
		switch (kind) {
		case ATAN2:
			return emitAtan2(emitter);
		case PI:
			return "pi";
		case IF:
			return emitIf(emitter);
		case ARRAY:
			return emitArray(emitter);
		case ARRAYROW:
			return commaJoin(emitArguments(emitter));
		case LINEST:
			return emitRegression(emitter);
		case AND:
			return "all([" + commaJoin(emitArguments(emitter)) + "])";
		case OR:
			return "any([" + commaJoin(emitArguments(emitter)) + "])";
		default:
			return emitter.getSettings().getEmittedFunctionName(name)
					+ "(" + commaJoin(emitArguments(emitter)) + ")";
		}
	}

	private List<String> emitArguments(CodeEmitter emitter) {
		List<AstNode> children = emitter.getChildren(this);
		List<String> args = new ArrayList<String>(children.size());
		for (AstNode child : children) {
			args.add(emitter.emit(child));
		}
		return args;
	}

	private static String commaJoin(List<String> args) {
		return String.join(", ", args);
	}

	private String emitAtan2(CodeEmitter emitter) {
		List<String> args = emitArguments(emitter);
		if (args.size() != 2) {
			throw new ParserException("ATAN2 with " + args.size() + " arguments not supported");
		}
		// spreadsheets take (x, y), the target language takes (y, x)
		return "atan2(" + args.get(1) + ", " + args.get(0) + ")";
	}

	private String emitIf(CodeEmitter emitter) {
		List<String> args = emitArguments(emitter);
		if (args.size() != 2 && args.size() != 3) {
			throw new ParserException("IF with " + args.size() + " arguments not supported");
		}
		String otherwise = args.size() == 3 ? args.get(2) : "0";
		return "(" + args.get(1) + " if " + args.get(0) + " else " + otherwise + ")";
	}

	private String emitArray(CodeEmitter emitter) {
		List<String> rows = emitArguments(emitter);
		if (rows.size() == 1) {
			return "[" + rows.get(0) + "]";
		}
		List<String> bracketed = new ArrayList<String>(rows.size());
		for (String row : rows) {
			bracketed.add("[" + row + "]");
		}
		return "[" + commaJoin(bracketed) + "]";
	}

	/**
	 * A regression used in an array formula returns all its coefficients,
	 * and each cell of the array formula displays one of them: the call is
	 * followed by the selection of the coefficient of the current cell.
	 */
	private String emitRegression(CodeEmitter emitter) {
		StringBuilder code = new StringBuilder(name).append('(').append(commaJoin(emitArguments(emitter)));

		EvaluationContext context = emitter.getContext();
		RegressionPosition position = context == null ? RegressionPosition.UNKNOWN : context.resolveRegressionPosition();

		if (name.equals(kind.getPrimaryName())) {
			code.append(", degree=").append(position.getDegree()).append(')');
		} else {
			code.append(')');
		}

		// a single coefficient nested in another expression is used as is
		if (!(position.getDegree() == 1 && emitter.getParent(this) != null)) {
			code.append('[').append(position.getCoefficient() - 1).append(']');
		}
		return code.toString();
	}
}
