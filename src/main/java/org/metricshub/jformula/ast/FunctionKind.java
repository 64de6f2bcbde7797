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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Functions whose code is not a plain call. Any other function is
 * {@link #GENERIC}.
 */
public enum FunctionKind {
	/** Arguments are swapped */
	ATAN2("atan2"),
	/** A constant, not a call */
	PI("pi"),
	/** Inlined as a conditional expression */
	IF("if"),
	/** Array literal, whose arguments are rows */
	ARRAY("array"),
	/** Row of an array literal */
	ARRAYROW("arrayrow"),
	/** Regressions, whose array formula spreads coefficients over several cells */
	LINEST("linest", "linestmario"),
	AND("and"),
	OR("or"),
	GENERIC;

	private static final Map<String, FunctionKind> BY_NAME = new HashMap<String, FunctionKind>();

	static {
		for (FunctionKind kind : values()) {
			for (String name : kind.names) {
				BY_NAME.put(name, kind);
			}
		}
	}

	private final List<String> names;

	FunctionKind(String... names) {
		this.names = Collections.unmodifiableList(Arrays.asList(names));
	}

	/**
	 * @param name lower-case function name
	 * @return the kind of the function, {@link #GENERIC} when it needs no special handling
	 */
	public static FunctionKind forName(String name) {
		FunctionKind kind = BY_NAME.get(name);
		return kind == null ? GENERIC : kind;
	}

	public List<String> getNames() {
		return names;
	}

	/**
	 * @return the name the family is known by, or {@code null} for {@link #GENERIC}
	 */
	public String getPrimaryName() {
		return names.isEmpty() ? null : names.get(0);
	}

	public boolean isRegression() {
		return this == LINEST;
	}
}
