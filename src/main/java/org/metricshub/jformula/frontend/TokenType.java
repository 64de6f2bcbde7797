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

/**
 * Main classification of a formula {@link Token}.
 */
public enum TokenType {
	/** Number, text, logical, error or reference */
	OPERAND,
	/** Function call boundary ({@code SUM(} and its closing parenthesis) */
	FUNC,
	/** Array literal boundary ({@code {} and <code>}</code>) */
	ARRAY,
	/** Row of an array literal, synthesized by the parser */
	ARRAYROW,
	/** Grouping parenthesis */
	PAREN,
	/** Argument or array row separator */
	SEP,
	/** Prefix operator */
	OP_PRE,
	/** Infix operator */
	OP_IN,
	/** Postfix operator */
	OP_POST,
	/** Run of blanks */
	WSPACE
}
