package org.metricshub.jformula.frontend;

import static org.junit.Assert.*;

import org.junit.Test;

public class TokenTest {

	@Test
	public void testMatchesWithWildcards() {
		Token token = new Token("SUM(", TokenType.FUNC, TokenSubtype.OPEN);
		assertTrue(token.matches(null, null, null));
		assertTrue(token.matches(TokenType.FUNC, null));
		assertTrue(token.matches(null, TokenSubtype.OPEN, "SUM("));
		assertTrue(token.matches(TokenType.FUNC, TokenSubtype.OPEN, "SUM("));
		assertFalse(token.matches(TokenType.FUNC, TokenSubtype.CLOSE));
		assertFalse(token.matches(TokenType.PAREN, TokenSubtype.OPEN));
		assertFalse(token.matches(null, null, "SUM"));
	}

	@Test
	public void testIsOperator() {
		assertTrue(new Token("-", TokenType.OP_PRE).isOperator());
		assertTrue(new Token("+", TokenType.OP_IN).isOperator());
		assertTrue(new Token("%", TokenType.OP_POST).isOperator());
		assertFalse(new Token("1", TokenType.OPERAND, TokenSubtype.NUMBER).isOperator());
		assertFalse(new Token(",", TokenType.SEP, TokenSubtype.ARG).isOperator());
	}

	@Test
	public void testIsFuncOpen() {
		assertTrue(new Token("SUM(", TokenType.FUNC, TokenSubtype.OPEN).isFuncOpen());
		assertTrue(new Token("{", TokenType.ARRAY, TokenSubtype.OPEN).isFuncOpen());
		assertTrue(new Token("", TokenType.ARRAYROW, TokenSubtype.OPEN).isFuncOpen());
		assertFalse(new Token("(", TokenType.PAREN, TokenSubtype.OPEN).isFuncOpen());
		assertFalse(new Token(")", TokenType.FUNC, TokenSubtype.CLOSE).isFuncOpen());
	}

	@Test
	public void testOperandSubtypes() {
		assertEquals(TokenSubtype.TEXT, Token.makeOperand("\"abc\"").getSubtype());
		assertEquals(TokenSubtype.ERROR, Token.makeOperand("#N/A").getSubtype());
		assertEquals(TokenSubtype.LOGICAL, Token.makeOperand("TRUE").getSubtype());
		assertEquals(TokenSubtype.LOGICAL, Token.makeOperand("false").getSubtype());
		assertEquals(TokenSubtype.NUMBER, Token.makeOperand("1.5").getSubtype());
		assertEquals(TokenSubtype.NUMBER, Token.makeOperand("1E+3").getSubtype());
		assertEquals(TokenSubtype.NUMBER, Token.makeOperand(".5").getSubtype());
		assertEquals(TokenSubtype.RANGE, Token.makeOperand("A1").getSubtype());
		assertEquals(TokenSubtype.RANGE, Token.makeOperand("Sheet1!A1:B2").getSubtype());
		assertEquals(TokenType.OPERAND, Token.makeOperand("A1").getType());
	}

	@Test
	public void testCloser() {
		assertEquals(
				new Token(")", TokenType.FUNC, TokenSubtype.CLOSE),
				new Token("SUM(", TokenType.FUNC, TokenSubtype.OPEN).getCloser());
		assertEquals(
				new Token("}", TokenType.ARRAY, TokenSubtype.CLOSE),
				new Token("{", TokenType.ARRAY, TokenSubtype.OPEN).getCloser());
		assertEquals(
				new Token(")", TokenType.PAREN, TokenSubtype.CLOSE),
				new Token("(", TokenType.PAREN, TokenSubtype.OPEN).getCloser());
	}

	@Test
	public void testNullSubtypeIsNone() {
		assertEquals(TokenSubtype.NONE, new Token("+", TokenType.OP_IN, null).getSubtype());
		assertEquals(new Token("+", TokenType.OP_IN), new Token("+", TokenType.OP_IN, null));
	}
}
