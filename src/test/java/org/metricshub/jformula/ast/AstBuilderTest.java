package org.metricshub.jformula.ast;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jformula.frontend.FormulaParser;
import org.metricshub.jformula.frontend.ParserException;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.frontend.TokenSubtype;
import org.metricshub.jformula.frontend.TokenType;

public class AstBuilderTest {

	private static AstGraph build(String formula) {
		return AstBuilder.build(FormulaParser.parseToPostfix(formula));
	}

	private static List<String> values(List<AstNode> nodes) {
		List<String> values = new ArrayList<String>();
		for (AstNode node : nodes) {
			values.add(node.getValue());
		}
		return values;
	}

	@Test
	public void testInfixOperandOrder() {
		AstGraph ast = build("=1-2");
		AstNode root = ast.getRoot();
		assertEquals("-", root.getValue());
		List<AstNode> children = ast.getChildren(root);
		assertEquals(2, children.size());
		assertEquals("1", children.get(0).getValue());
		assertEquals("2", children.get(1).getValue());
		assertEquals(0, ast.getPosition(children.get(0)));
		assertEquals(1, ast.getPosition(children.get(1)));
		assertSame(root, ast.getParent(children.get(0)));
		assertSame(root, ast.getParent(children.get(1)));
	}

	@Test
	public void testRootHasNoParent() {
		AstGraph ast = build("=1-2");
		assertNull(ast.getParent(ast.getRoot()));
		assertEquals(-1, ast.getPosition(ast.getRoot()));
	}

	@Test
	public void testPrefixOperand() {
		AstGraph ast = build("=-A1");
		List<AstNode> children = ast.getChildren(ast.getRoot());
		assertEquals(1, children.size());
		assertEquals(1, ast.getPosition(children.get(0)));
		assertTrue(children.get(0) instanceof RangeNode);
	}

	@Test
	public void testFunctionArgumentOrder() {
		AstGraph ast = build("=SUM(1,2,3)");
		List<AstNode> children = ast.getChildren(ast.getRoot());
		assertEquals(3, children.size());
		for (int i = 0; i < 3; i++) {
			assertEquals(String.valueOf(i + 1), children.get(i).getValue());
			assertEquals(i, ast.getPosition(children.get(i)));
		}
	}

	@Test
	public void testFunctionWithoutArguments() {
		AstGraph ast = build("=PI()");
		assertTrue(ast.getRoot() instanceof FunctionNode);
		assertTrue(ast.getChildren(ast.getRoot()).isEmpty());
	}

	@Test
	public void testDescendants() {
		AstGraph ast = build("=SUM(1,2*3)");
		assertEquals(5, ast.getNodes().size());
		List<String> expected = new ArrayList<String>();
		Collections.addAll(expected, "1", "*", "2", "3");
		assertEquals(expected, values(ast.getDescendants(ast.getRoot())));
		assertTrue(ast.getDescendants(ast.getChildren(ast.getRoot()).get(0)).isEmpty());
	}

	@Test
	public void testMissingOperand() {
		ParserException e = assertThrows(ParserException.class, () -> build("=1+"));
		assertEquals("'+' operator missing operand", e.getMessage());
		assertThrows(ParserException.class, () -> build("=*1"));
		assertThrows(ParserException.class, () -> build("=-"));
	}

	@Test
	public void testMissingFunctionArguments() {
		FunctionNode sum = (FunctionNode) AstNode.create(new Token("SUM(", TokenType.FUNC, TokenSubtype.OPEN));
		sum.setNumArgs(2);
		List<AstNode> postfix = new ArrayList<AstNode>();
		postfix.add(AstNode.create(Token.makeOperand("1")));
		postfix.add(sum);
		ParserException e = assertThrows(ParserException.class, () -> AstBuilder.build(postfix));
		assertEquals("'sum' function missing arguments", e.getMessage());
	}

	@Test
	public void testTooManyExpressions() {
		ParserException e = assertThrows(ParserException.class, () -> build("=(1)(2)"));
		assertEquals("Invalid formula: 2 expressions after reduction instead of 1", e.getMessage());
	}

	@Test
	public void testEmptyFormula() {
		ParserException e = assertThrows(ParserException.class, () -> build("="));
		assertEquals("Invalid formula: 0 expressions after reduction instead of 1", e.getMessage());
	}

	@Test
	public void testDump() throws UnsupportedEncodingException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
		build("=SUM(1+2)").dump(ps);
		String[] lines = bytes.toString(StandardCharsets.UTF_8.name()).split("\\R");
		assertArrayEquals(
				new String[] { "FunctionNode<SUM>", " OperatorNode<+>", "  OperandNode<1>", "  OperandNode<2>" },
				lines);
	}

	@Test
	public void testNodeKinds() {
		assertTrue(AstNode.create(Token.makeOperand("A1")) instanceof RangeNode);
		assertTrue(AstNode.create(Token.makeOperand("1")) instanceof OperandNode);
		assertFalse(AstNode.create(Token.makeOperand("1")) instanceof RangeNode);
		assertTrue(AstNode.create(new Token("+", TokenType.OP_IN)) instanceof OperatorNode);
		assertTrue(AstNode.create(new Token("{", TokenType.ARRAY, TokenSubtype.OPEN)) instanceof FunctionNode);
		assertThrows(ParserException.class, () -> AstNode.create(new Token("(", TokenType.PAREN, TokenSubtype.OPEN)));
	}
}
