package org.metricshub.jformula.context;

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
 * Position of the current cell in an array formula spanning the outputs of a
 * regression function: the degree of the regression and the (1-based) index
 * of the coefficient the cell displays.
 */
public final class RegressionPosition {

	/** Position used when it cannot be determined */
	public static final RegressionPosition UNKNOWN = new RegressionPosition(-1, -1);

	private final int degree;
	private final int coefficient;

	/**
	 * @param degree number of coefficients spanned by the array formula
	 * @param coefficient 1-based index of the coefficient of the current cell
	 */
	public RegressionPosition(int degree, int coefficient) {
		this.degree = degree;
		this.coefficient = coefficient;
	}

	public int getDegree() {
		return degree;
	}

	public int getCoefficient() {
		return coefficient;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof RegressionPosition)) {
			return false;
		}
		RegressionPosition position = (RegressionPosition) other;
		return degree == position.degree && coefficient == position.coefficient;
	}

	@Override
	public int hashCode() {
		return 31 * degree + coefficient;
	}

	@Override
	public String toString() {
		return "RegressionPosition(degree=" + degree + ", coefficient=" + coefficient + ")";
	}
}
