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

import java.util.Objects;

/**
 * Immutable {@link EvaluationContext} backed by a spreadsheet model and a
 * {@link DegreeResolver} querying it.
 *
 * @param <M> type of the spreadsheet model
 */
public final class FormulaContext<M> implements EvaluationContext {

	private final String currentSheet;
	private final String currentCell;
	private final M model;
	private final DegreeResolver<M> degreeResolver;

	/**
	 * @param currentSheet sheet qualifying unqualified references
	 * @param currentCell address of the cell whose formula is compiled
	 * @param model the spreadsheet model, may be {@code null} if the resolver does not need it
	 * @param degreeResolver resolver of regression positions
	 */
	public FormulaContext(String currentSheet, String currentCell, M model, DegreeResolver<M> degreeResolver) {
		this.currentSheet = Objects.requireNonNull(currentSheet, "Current sheet must not be null");
		this.currentCell = Objects.requireNonNull(currentCell, "Current cell must not be null");
		this.model = model;
		this.degreeResolver = Objects.requireNonNull(degreeResolver, "Degree resolver must not be null");
	}

	/**
	 * Creates a context without model: regression positions are unknown.
	 *
	 * @param currentSheet sheet qualifying unqualified references
	 * @param currentCell address of the cell whose formula is compiled
	 * @return the new context
	 */
	public static FormulaContext<Object> of(String currentSheet, String currentCell) {
		return new FormulaContext<Object>(currentSheet, currentCell, null, (model, cell) -> RegressionPosition.UNKNOWN);
	}

	@Override
	public String getCurrentSheet() {
		return currentSheet;
	}

	@Override
	public String getCurrentCell() {
		return currentCell;
	}

	public M getModel() {
		return model;
	}

	@Override
	public RegressionPosition resolveRegressionPosition() {
		RegressionPosition position = degreeResolver.resolve(model, currentCell);
		return position == null ? RegressionPosition.UNKNOWN : position;
	}

	@Override
	public String toString() {
		return currentSheet + " (" + currentCell + ")";
	}
}
