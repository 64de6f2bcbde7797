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
 * The single error raised while compiling a formula.
 * <p>
 * Lexing, parsing, syntax tree construction and code emission all report
 * their failures with this exception, and compilation is aborted on the
 * first one. No distinction is made between an invalid formula and an
 * internal inconsistency of the compiler.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new parser exception with the provided message.
	 *
	 * @param message description of the problem
	 */
	public ParserException(String message) {
		super(message);
	}

	/**
	 * Creates a new parser exception with the provided message and cause.
	 *
	 * @param message description of the problem
	 * @param cause underlying cause
	 */
	public ParserException(String message, Throwable cause) {
		super(message, cause);
	}
}
