package org.metricshub.jformula.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to SLF4J for the compiler classes.
 * <p>
 * Loading this class lowers the verbosity of SLF4J's own reporting (provider
 * discovery and the like), unless the embedding application already chose a
 * level.
 */
public final class FormulaLogger {

	/** SLF4J system property controlling its internal reporting */
	private static final String SLF4J_VERBOSITY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(SLF4J_VERBOSITY) == null) {
			System.setProperty(SLF4J_VERBOSITY, "WARN");
		}
	}

	private FormulaLogger() {}

	/**
	 * @param clazz class of the compiler component that logs
	 * @return the SLF4J logger named after {@code clazz}
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
