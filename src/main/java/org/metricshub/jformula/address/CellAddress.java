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

import java.util.Objects;

/**
 * A single cell reference, split into its sheet, column and row parts.
 */
public final class CellAddress {

	private final String sheet;
	private final String column;
	private final int row;

	/**
	 * @param sheet sheet name, or {@code null} for an unqualified reference
	 * @param column column letters, upper-case
	 * @param row row number, starting at 1
	 */
	public CellAddress(String sheet, String column, int row) {
		this.sheet = sheet;
		this.column = Objects.requireNonNull(column, "Column must not be null");
		this.row = row;
	}

	public String getSheet() {
		return sheet;
	}

	public boolean hasSheet() {
		return sheet != null && !sheet.isEmpty();
	}

	public String getColumn() {
		return column;
	}

	public int getRow() {
		return row;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof CellAddress)) {
			return false;
		}
		CellAddress address = (CellAddress) other;
		return row == address.row && Objects.equals(sheet, address.sheet) && column.equals(address.column);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sheet, column, row);
	}

	@Override
	public String toString() {
		return (hasSheet() ? sheet + "!" : "") + column + row;
	}
}
