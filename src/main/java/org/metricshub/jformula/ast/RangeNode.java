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

import java.util.List;
import org.metricshub.jformula.address.AddressSyntax;
import org.metricshub.jformula.context.EvaluationContext;
import org.metricshub.jformula.frontend.Token;

/**
 * A reference to a cell ({@code B3}) or to a range ({@code A1:C10}), emitted
 * as a call to the runtime lookup functions.
 */
public class RangeNode extends OperandNode {

	RangeNode(Token token) {
		super(token);
	}

	/**
	 * @param addressSyntax syntax of the reference
	 * @return the addresses of the cells covered by this reference
	 */
	public List<String> getCells(AddressSyntax addressSyntax) {
		return addressSyntax.resolveRange(getAddress());
	}

	/**
	 * @return the reference, without its {@code $} anchors
	 */
	public String getAddress() {
		return getValue().replace("$", "");
	}

	@Override
	public String emit(CodeEmitter emitter) {
		String address = getAddress();
		AddressSyntax addressSyntax = emitter.getSettings().getAddressSyntax();
		EvaluationContext context = emitter.getContext();
		String sheet = context != null && context.getCurrentSheet() != null ? context.getCurrentSheet() + "!" : "";

		String lookup;
		boolean qualified;
		if (addressSyntax.isRange(address)) {
			lookup = emitter.getSettings().getRangeLookupName();
			qualified = addressSyntax.splitRange(address).hasSheet();
		} else {
			lookup = emitter.getSettings().getCellLookupName();
			qualified = addressSyntax.splitAddress(address).hasSheet();
		}
		return lookup + "(\"" + (qualified ? address : sheet + address) + "\")";
	}
}
