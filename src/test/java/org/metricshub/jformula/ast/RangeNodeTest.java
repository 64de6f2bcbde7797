package org.metricshub.jformula.ast;

import static org.junit.Assert.*;
import static org.metricshub.jformula.ast.EmitterTestSupport.emit;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.jformula.address.A1AddressSyntax;
import org.metricshub.jformula.context.FormulaContext;
import org.metricshub.jformula.frontend.ParserException;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.util.CompilerSettings;

public class RangeNodeTest {

	private static final FormulaContext<Object> SHEET1 = FormulaContext.of("Sheet1", "Sheet1!C3");

	@Test
	public void testCell() {
		assertEquals("eval_cell(\"A1\")", emit("=A1"));
		assertEquals("eval_cell(\"A1\")", emit("=$A$1"));
	}

	@Test
	public void testRange() {
		assertEquals("eval_range(\"A1:B2\")", emit("=$A$1:B2"));
	}

	@Test
	public void testUnqualifiedReferenceUsesCurrentSheet() {
		assertEquals("eval_cell(\"Sheet1!A1\")", emit("=A1", SHEET1));
		assertEquals("eval_range(\"Sheet1!A1:B2\")", emit("=A1:B2", SHEET1));
	}

	@Test
	public void testQualifiedReferenceKeepsItsSheet() {
		assertEquals("eval_cell(\"Sheet2!A1\")", emit("=Sheet2!$A$1"));
		assertEquals("eval_range(\"Data!A1:B2\")", emit("=Data!A1:B2", SHEET1));
		assertEquals("eval_cell(\"'My Sheet'!B2\")", emit("='My Sheet'!$B$2", SHEET1));
	}

	@Test
	public void testLookupNames() {
		CompilerSettings settings = new CompilerSettings();
		settings.setCellLookupName("cell");
		settings.setRangeLookupName("cells");
		assertEquals("cell(\"A1\") + cells(\"B1:B2\")", emit("=A1+B1:B2", null, settings));
	}

	@Test
	public void testCells() {
		RangeNode range = (RangeNode) AstNode.create(Token.makeOperand("$A$1:B2"));
		assertEquals("A1:B2", range.getAddress());
		assertEquals(Arrays.asList("A1", "B1", "A2", "B2"), range.getCells(new A1AddressSyntax()));
	}

	@Test
	public void testRowBeyondSheetIsRejected() {
		assertThrows(ParserException.class, () -> emit("=A99999999999"));
		assertThrows(ParserException.class, () -> emit("=SUM(A1048577)+1"));
	}

	@Test
	public void testNamedRangeIsRejected() {
		assertThrows(ParserException.class, () -> emit("=Rate*2"));
	}
}
