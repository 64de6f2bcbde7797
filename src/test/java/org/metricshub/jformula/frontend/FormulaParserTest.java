package org.metricshub.jformula.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jformula.ast.AstNode;
import org.metricshub.jformula.ast.FunctionNode;

public class FormulaParserTest {

	private static String postfix(String formula) {
		List<String> values = new ArrayList<String>();
		for (AstNode node : FormulaParser.parseToPostfix(formula)) {
			values.add(node.getValue());
		}
		return String.join(" ", values);
	}

	private static FunctionNode lastFunction(String formula) {
		List<AstNode> nodes = FormulaParser.parseToPostfix(formula);
		return (FunctionNode) nodes.get(nodes.size() - 1);
	}

	@Test
	public void testPrecedence() {
		assertEquals("1 2 3 * +", postfix("=1+2*3"));
		assertEquals("1 2 + 3 *", postfix("=(1+2)*3"));
		assertEquals("1 2 3 + &", postfix("=1&2+3"));
		assertEquals("1 2 = 3 <", postfix("=1=2<3"));
		assertEquals("10 % 2 ^", postfix("=10%^2"));
	}

	@Test
	public void testLeftAssociativity() {
		assertEquals("1 2 - 3 -", postfix("=1-2-3"));
		assertEquals("2 3 ^ 2 ^", postfix("=2^3^2"));
	}

	@Test
	public void testNegationBindsTighterThanPower() {
		assertEquals("2 - 2 ^", postfix("=-2^2"));
		assertEquals("2 2 - ^", postfix("=2^-2"));
		assertEquals("2 3 + *", postfix("=2*+3"));
		assertEquals("2 3 + ^", postfix("=2^+3"));
	}

	@Test
	public void testFunctionArguments() {
		assertEquals("1 2 3 SUM(", postfix("=SUM(1,2,3)"));
		assertEquals(3, lastFunction("=SUM(1,2,3)").getNumArgs());
		assertEquals(1, lastFunction("=SUM(A1:B2)").getNumArgs());
		assertEquals(0, lastFunction("=PI()").getNumArgs());
		assertEquals(0, lastFunction("=NOW()").getNumArgs());
	}

	@Test
	public void testNestedFunctions() {
		List<AstNode> nodes = FormulaParser.parseToPostfix("=IF(A1,SUM(B1,B2*2),3)");
		assertEquals("A1 B1 B2 2 * SUM( 3 IF(", postfix("=IF(A1,SUM(B1,B2*2),3)"));
		assertEquals(2, ((FunctionNode) nodes.get(5)).getNumArgs());
		assertEquals(3, ((FunctionNode) nodes.get(7)).getNumArgs());
	}

	@Test
	public void testArrayLiteral() {
		List<AstNode> nodes = FormulaParser.parseToPostfix("={1,2;3,4}");
		assertEquals("1 2 ARRAYROW 3 4 ARRAYROW ARRAY", postfix("={1,2;3,4}"));
		assertEquals(2, ((FunctionNode) nodes.get(2)).getNumArgs());
		assertEquals(2, ((FunctionNode) nodes.get(5)).getNumArgs());
		assertEquals(2, ((FunctionNode) nodes.get(6)).getNumArgs());
		assertEquals(TokenType.ARRAYROW, nodes.get(2).getType());
		assertEquals(TokenType.ARRAY, nodes.get(6).getType());
	}

	@Test
	public void testSingleRowArray() {
		List<AstNode> nodes = FormulaParser.parseToPostfix("={1,2,3}");
		assertEquals("1 2 3 ARRAYROW ARRAY", postfix("={1,2,3}"));
		assertEquals(3, ((FunctionNode) nodes.get(3)).getNumArgs());
		assertEquals(1, ((FunctionNode) nodes.get(4)).getNumArgs());
	}

	@Test
	public void testIntersectionAndUnion() {
		List<AstNode> intersection = FormulaParser.parseToPostfix("=A1 B1");
		assertEquals(3, intersection.size());
		assertTrue(intersection.get(2).getToken().matches(TokenType.OP_IN, TokenSubtype.INTERSECT));

		assertEquals("A1 B1 , SUM(", postfix("=SUM((A1,B1))"));
		assertEquals(1, lastFunction("=SUM((A1,B1))").getNumArgs());
	}

	@Test
	public void testCanonicalize() {
		assertEquals(
				Arrays
						.asList(
								new Token("{", TokenType.ARRAY, TokenSubtype.OPEN),
								new Token("(", TokenType.PAREN, TokenSubtype.OPEN),
								new Token("", TokenType.ARRAYROW, TokenSubtype.OPEN),
								new Token("(", TokenType.PAREN, TokenSubtype.OPEN),
								Token.makeOperand("1"),
								new Token(")", TokenType.PAREN, TokenSubtype.CLOSE),
								new Token(",", TokenType.SEP, TokenSubtype.ARG),
								new Token("", TokenType.ARRAYROW, TokenSubtype.OPEN),
								new Token("(", TokenType.PAREN, TokenSubtype.OPEN),
								Token.makeOperand("2"),
								new Token("}", TokenType.ARRAY, TokenSubtype.CLOSE),
								new Token(")", TokenType.PAREN, TokenSubtype.CLOSE)),
				FormulaParser.canonicalize(FormulaLexer.tokenize("={1;2}")));
	}

	@Test
	public void testMismatchedParentheses() {
		assertThrows(ParserException.class, () -> FormulaParser.parseToPostfix("=(1+2"));
		assertThrows(ParserException.class, () -> FormulaParser.parseToPostfix("=SUM(1,2"));
		assertThrows(ParserException.class, () -> FormulaParser.parseToPostfix("={1,2"));
		assertThrows(ParserException.class, () -> FormulaParser.parseToPostfix("=1+2)"));
		assertThrows(
				ParserException.class,
				() -> FormulaParser.parseToPostfix(Arrays.asList(new Token(")", TokenType.PAREN, TokenSubtype.CLOSE))));
	}

	@Test
	public void testSeparatorOutsideBrackets() {
		List<Token> tokens = Arrays
				.asList(Token.makeOperand("1"), new Token(",", TokenType.SEP, TokenSubtype.ARG), Token.makeOperand("2"));
		ParserException e = assertThrows(ParserException.class, () -> FormulaParser.parseToPostfix(tokens));
		assertEquals("Mismatched or misplaced parentheses", e.getMessage());
	}

	@Test
	public void testUnexpectedToken() {
		ParserException e = assertThrows(
				ParserException.class,
				() -> FormulaParser.parseToPostfix(Arrays.asList(new Token(" ", TokenType.WSPACE))));
		assertTrue(e.getMessage().startsWith("Unexpected token"));
	}

	@Test
	public void testEmptyFormula() {
		assertTrue(FormulaParser.parseToPostfix("=").isEmpty());
		assertTrue(FormulaParser.parseToPostfix(Collections.<Token>emptyList()).isEmpty());
	}
}
