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

import java.util.Locale;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.frontend.TokenSubtype;

/**
 * A literal: number, text, logical or error value.
 */
public class OperandNode extends AstNode {

	OperandNode(Token token) {
		super(token);
	}

	@Override
	public String emit(CodeEmitter emitter) {
		if (getSubtype() == TokenSubtype.LOGICAL) {
			return "true".equals(getValue().toLowerCase(Locale.ROOT)) ? "True" : "False";
		}
		if (getSubtype() == TokenSubtype.TEXT || getSubtype() == TokenSubtype.ERROR) {
			return quote(getValue());
		}
		return getValue();
	}

	/**
	 * Turns a spreadsheet string literal, where quotes are doubled, into a
	 * target-language one, where they are escaped with a backslash.
	 */
	static String quote(String literal) {
		String text = literal;
		if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
			text = text.substring(1, text.length() - 1);
		}
		text = text.replace("\\", "\\\\").replace("\"\"", "\\\"");
		return "\"" + text + "\"";
	}
}
