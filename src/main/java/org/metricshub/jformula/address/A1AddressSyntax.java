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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jformula.frontend.ParserException;

/**
 * The usual A1 reference syntax: {@code B3}, {@code $B$3}, {@code A1:C10},
 * {@code Sheet1!A1} or {@code 'My Sheet'!A1:B2}.
 */
public class A1AddressSyntax implements AddressSyntax {

	/** Last row of a worksheet */
	public static final int MAX_ROW = 1048576;

	/** Last column of a worksheet ({@code XFD}) */
	public static final int MAX_COLUMN = 16384;

	/** Largest number of cells {@link #resolveRange(String)} enumerates: one full column */
	public static final long MAX_ENUMERATED_CELLS = MAX_ROW;

	private static final Pattern CELL = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([1-9][0-9]{0,6})");

	@Override
	public boolean isRange(String address) {
		return address.indexOf(':') > 0;
	}

	@Override
	public RangeAddress splitRange(String address) {
		String[] sheetAndRest = splitSheet(address);
		String rest = sheetAndRest[1];
		int colon = rest.indexOf(':');
		if (colon <= 0 || colon == rest.length() - 1) {
			throw new ParserException("Invalid range address: " + address);
		}
		String start = rest.substring(0, colon);
		String end = rest.substring(colon + 1);
		// Sheet1!A1:Sheet1!B2
		int bang = end.lastIndexOf('!');
		if (bang >= 0) {
			end = end.substring(bang + 1);
		}
		return new RangeAddress(sheetAndRest[0], start, end);
	}

	@Override
	public CellAddress splitAddress(String address) {
		String[] sheetAndRest = splitSheet(address);
		Matcher matcher = CELL.matcher(sheetAndRest[1]);
		if (!matcher.matches()) {
			throw new ParserException("Invalid cell address: " + address);
		}
		return toCellAddress(sheetAndRest[0], matcher, address);
	}

	@Override
	public List<String> resolveRange(String address) {
		if (!isRange(address)) {
			return Collections.singletonList(splitAddress(address).toString());
		}
		RangeAddress range = splitRange(address);
		CellAddress start = cornerOf(range, range.getStart());
		CellAddress end = cornerOf(range, range.getEnd());

		int firstColumn = Math.min(columnIndex(start.getColumn()), columnIndex(end.getColumn()));
		int lastColumn = Math.max(columnIndex(start.getColumn()), columnIndex(end.getColumn()));
		int firstRow = Math.min(start.getRow(), end.getRow());
		int lastRow = Math.max(start.getRow(), end.getRow());

		long count = (long) (lastColumn - firstColumn + 1) * (lastRow - firstRow + 1);
		if (count > MAX_ENUMERATED_CELLS) {
			throw new ParserException("Cannot enumerate the " + count + " cells of " + range + ", the limit is " + MAX_ENUMERATED_CELLS);
		}
		List<String> cells = new ArrayList<String>((int) count);
		for (int row = firstRow; row <= lastRow; row++) {
			for (int column = firstColumn; column <= lastColumn; column++) {
				cells.add(new CellAddress(range.getSheet(), columnName(column), row).toString());
			}
		}
		return cells;
	}

	private CellAddress cornerOf(RangeAddress range, String corner) {
		Matcher matcher = CELL.matcher(corner);
		if (!matcher.matches()) {
			throw new ParserException("Cannot enumerate the cells of " + range);
		}
		return toCellAddress(range.getSheet(), matcher, corner);
	}

	/**
	 * Builds the address matched by {@link #CELL}, rejecting rows and columns
	 * beyond the worksheet limits.
	 */
	private static CellAddress toCellAddress(String sheet, Matcher matcher, String address) {
		String column = matcher.group(1).toUpperCase(Locale.ROOT);
		// at most 7 digits, cannot overflow
		int row = Integer.parseInt(matcher.group(2));
		if (row > MAX_ROW || columnIndex(column) > MAX_COLUMN) {
			throw new ParserException("Invalid cell address: " + address);
		}
		return new CellAddress(sheet, column, row);
	}

	/**
	 * @return the sheet name (or {@code null}) and the rest of the address
	 */
	private static String[] splitSheet(String address) {
		int bang = address.indexOf('!');
		if (address.startsWith("'")) {
			// the sheet name may contain a '!'
			int closingQuote = address.lastIndexOf('\'');
			bang = address.indexOf('!', closingQuote);
		}
		if (bang < 0) {
			return new String[] { null, address };
		}
		return new String[] { address.substring(0, bang), address.substring(bang + 1) };
	}

	/**
	 * @param column column letters, like {@code AB}
	 * @return 1-based index of the column
	 */
	public static int columnIndex(String column) {
		int index = 0;
		for (int i = 0; i < column.length(); i++) {
			index = index * 26 + (Character.toUpperCase(column.charAt(i)) - 'A' + 1);
		}
		return index;
	}

	/**
	 * @param index 1-based index of a column
	 * @return the column letters
	 */
	public static String columnName(int index) {
		StringBuilder name = new StringBuilder();
		int remaining = index;
		while (remaining > 0) {
			int digit = (remaining - 1) % 26;
			name.insert(0, (char) ('A' + digit));
			remaining = (remaining - 1) / 26;
		}
		return name.toString();
	}
}
