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
 * A range reference, split into its sheet and its two corners.
 * The corners are kept as text, since whole columns or rows
 * ({@code A:C}, {@code 1:3}) are valid ranges.
 */
public final class RangeAddress {

	private final String sheet;
	private final String start;
	private final String end;

	/**
	 * @param sheet sheet name, or {@code null} for an unqualified reference
	 * @param start top-left corner
	 * @param end bottom-right corner
	 */
	public RangeAddress(String sheet, String start, String end) {
		this.sheet = sheet;
		this.start = Objects.requireNonNull(start, "Range start must not be null");
		this.end = Objects.requireNonNull(end, "Range end must not be null");
	}

	public String getSheet() {
		return sheet;
	}

	public boolean hasSheet() {
		return sheet != null && !sheet.isEmpty();
	}

	public String getStart() {
		return start;
	}

	public String getEnd() {
		return end;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof RangeAddress)) {
			return false;
		}
		RangeAddress address = (RangeAddress) other;
		return Objects.equals(sheet, address.sheet) && start.equals(address.start) && end.equals(address.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sheet, start, end);
	}

	@Override
	public String toString() {
		return (hasSheet() ? sheet + "!" : "") + start + ":" + end;
	}
}
