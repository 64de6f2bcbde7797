package org.metricshub.jformula;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jformula.address.AddressSyntax;
import org.metricshub.jformula.ast.AstGraph;
import org.metricshub.jformula.ast.AstNode;
import org.metricshub.jformula.ast.RangeNode;

/**
 * Result of the compilation of a formula: the emitted code and the syntax
 * tree it was emitted from.
 */
public final class CompiledFormula {

	private final String formula;
	private final String code;
	private final AstGraph ast;
	private final AddressSyntax addressSyntax;

	CompiledFormula(String formula, String code, AstGraph ast, AddressSyntax addressSyntax) {
		this.formula = formula;
		this.code = code;
		this.ast = ast;
		this.addressSyntax = addressSyntax;
	}

	/**
	 * @return the source formula
	 */
	public String getFormula() {
		return formula;
	}

	/**
	 * @return the emitted target-language expression
	 */
	public String getCode() {
		return code;
	}

	/**
	 * @return the syntax tree of the formula
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The syntax tree is read-only once built")
	public AstGraph getAst() {
		return ast;
	}

	public AstNode getRoot() {
		return ast.getRoot();
	}

	/**
	 * @return the cell and range references of the formula, in source order
	 */
	public List<RangeNode> getRanges() {
		List<RangeNode> ranges = new ArrayList<RangeNode>();
		AstNode root = ast.getRoot();
		if (root instanceof RangeNode) {
			ranges.add((RangeNode) root);
		}
		for (AstNode node : ast.getDescendants(root)) {
			if (node instanceof RangeNode) {
				ranges.add((RangeNode) node);
			}
		}
		return Collections.unmodifiableList(ranges);
	}

	/**
	 * @return the addresses of all the cells the formula depends on, without duplicates
	 * @throws org.metricshub.jformula.frontend.ParserException if a reference cannot be enumerated
	 */
	public Set<String> getPrecedents() {
		Set<String> cells = new LinkedHashSet<String>();
		for (RangeNode range : getRanges()) {
			cells.addAll(range.getCells(addressSyntax));
		}
		return Collections.unmodifiableSet(cells);
	}

	@Override
	public String toString() {
		return formula + " -> " + code;
	}
}
