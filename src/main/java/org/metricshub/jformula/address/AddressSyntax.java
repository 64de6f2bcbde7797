package org.metricshub.jformula.address;

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

import java.util.List;

/**
 * Syntax of the cell and range references found in formulas.
 * <p>
 * Implementations are pure functions over the address text, and must be safe
 * to share between threads.
 */
public interface AddressSyntax {

	/**
	 * @param address a reference, possibly qualified with a sheet name
	 * @return {@code true} if the reference spans several cells
	 */
	boolean isRange(String address);

	/**
	 * @param address a range reference
	 * @return the sheet and the corners of the range
	 * @throws org.metricshub.jformula.frontend.ParserException if the address is not a range
	 */
	RangeAddress splitRange(String address);

	/**
	 * @param address a single cell reference
	 * @return the sheet, column and row of the cell
	 * @throws org.metricshub.jformula.frontend.ParserException if the address is not a cell
	 */
	CellAddress splitAddress(String address);

	/**
	 * Enumerates the cells of a reference.
	 *
	 * @param address a cell or range reference
	 * @return the addresses of the cells, row by row
	 * @throws org.metricshub.jformula.frontend.ParserException if the reference cannot be enumerated
	 */
	List<String> resolveRange(String address);
}
