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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.metricshub.jformula.address.A1AddressSyntax;
import org.metricshub.jformula.address.AddressSyntax;

/**
 * A simple container for the parameters of the formula compiler.
 * These values have defaults, which may be changed through command line
 * arguments, or when invoking the compiler programmatically.
 * <p>
 * The compiler takes a copy of the settings it is created with, so changing
 * an instance afterwards has no effect on an existing compiler.
 */
public class CompilerSettings {

	/**
	 * Name of the runtime function returning the value of a single cell.
	 */
	private String cellLookupName = "eval_cell";

	/**
	 * Name of the runtime function returning the values of a range.
	 */
	private String rangeLookupName = "eval_range";

	/**
	 * Spreadsheet function names (lower-case) that must be emitted under
	 * another name, because the spreadsheet name collides with a built-in
	 * of the target language.
	 */
	private final Map<String, String> functionNames = new LinkedHashMap<String, String>();

	/**
	 * Syntax of the cell and range addresses found in formulas.
	 */
	private AddressSyntax addressSyntax = new A1AddressSyntax();

	/** Print the tokens of each formula (command line only) */
	private boolean dumpTokens;

	/** Print the postfix form of each formula (command line only) */
	private boolean dumpPostfix;

	/** Print the syntax tree of each formula (command line only) */
	private boolean dumpSyntaxTree;

	/**
	 * Creates settings with the default values.
	 */
	public CompilerSettings() {
		functionNames.put("ln", "xlog");
		functionNames.put("min", "xmin");
		functionNames.put("max", "xmax");
		functionNames.put("sum", "xsum");
		functionNames.put("gammaln", "lgamma");
		functionNames.put("round", "xround");
	}

	/**
	 * Copy constructor.
	 *
	 * @param other settings to copy
	 */
	public CompilerSettings(CompilerSettings other) {
		this.cellLookupName = other.cellLookupName;
		this.rangeLookupName = other.rangeLookupName;
		this.functionNames.putAll(other.functionNames);
		this.addressSyntax = other.addressSyntax;
		this.dumpTokens = other.dumpTokens;
		this.dumpPostfix = other.dumpPostfix;
		this.dumpSyntaxTree = other.dumpSyntaxTree;
	}

	public String getCellLookupName() {
		return cellLookupName;
	}

	public void setCellLookupName(String cellLookupName) {
		this.cellLookupName = Objects.requireNonNull(cellLookupName, "Cell lookup name must not be null");
	}

	public String getRangeLookupName() {
		return rangeLookupName;
	}

	public void setRangeLookupName(String rangeLookupName) {
		this.rangeLookupName = Objects.requireNonNull(rangeLookupName, "Range lookup name must not be null");
	}

	/**
	 * @return read-only view of the function name mapping
	 */
	public Map<String, String> getFunctionNames() {
		return Collections.unmodifiableMap(functionNames);
	}

	/**
	 * Emits the specified spreadsheet function under another name.
	 *
	 * @param spreadsheetName name of the function in formulas (case-insensitive)
	 * @param emittedName name of the function in the emitted code
	 */
	public void putFunctionName(String spreadsheetName, String emittedName) {
		Objects.requireNonNull(spreadsheetName, "Function name must not be null");
		Objects.requireNonNull(emittedName, "Emitted function name must not be null");
		functionNames.put(spreadsheetName.toLowerCase(Locale.ROOT), emittedName);
	}

	/**
	 * @param name lower-case spreadsheet function name
	 * @return the name to emit for this function
	 */
	public String getEmittedFunctionName(String name) {
		String mapped = functionNames.get(name);
		return mapped == null ? name : mapped;
	}

	public AddressSyntax getAddressSyntax() {
		return addressSyntax;
	}

	public void setAddressSyntax(AddressSyntax addressSyntax) {
		this.addressSyntax = Objects.requireNonNull(addressSyntax, "Address syntax must not be null");
	}

	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}

	public boolean isDumpPostfix() {
		return dumpPostfix;
	}

	public void setDumpPostfix(boolean dumpPostfix) {
		this.dumpPostfix = dumpPostfix;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	/**
	 * @return a human readable representation of the settings values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("cellLookupName = ").append(getCellLookupName()).append(newLine);
		desc.append("rangeLookupName = ").append(getRangeLookupName()).append(newLine);
		desc.append("functionNames = ").append(getFunctionNames()).append(newLine);
		desc.append("addressSyntax = ").append(getAddressSyntax().getClass().getSimpleName()).append(newLine);

		return desc.toString();
	}
}
