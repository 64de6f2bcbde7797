package org.metricshub.jformula.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class FormulaLexerTest {

	private static final Token INTERSECT = new Token(" ", TokenType.OP_IN, TokenSubtype.INTERSECT);

	@Test
	public void testBlankBetweenReferencesIsIntersection() {
		assertEquals(
				Arrays.asList(Token.makeOperand("A1:C3"), INTERSECT, Token.makeOperand("B2:D4")),
				FormulaLexer.tokenize("=A1:C3 B2:D4"));
	}

	@Test
	public void testBlankAroundOperatorIsDropped() {
		assertEquals(
				Arrays.asList(Token.makeOperand("A1"), new Token("+", TokenType.OP_IN), Token.makeOperand("B1")),
				FormulaLexer.tokenize("=A1 + B1"));
	}

	@Test
	public void testLeadingAndTrailingBlanksAreDropped() {
		assertEquals(Arrays.asList(Token.makeOperand("1")), FormulaLexer.tokenize("= 1 "));
	}

	@Test
	public void testBlankAfterSeparatorIsDropped() {
		List<Token> tokens = FormulaLexer.tokenize("=SUM(A1, B1)");
		assertEquals(5, tokens.size());
		for (Token token : tokens) {
			assertNotEquals(TokenType.WSPACE, token.getType());
			assertFalse(token.matches(TokenType.OP_IN, TokenSubtype.INTERSECT));
		}
	}

	@Test
	public void testIntersectionOfParenthesizedExpressions() {
		assertEquals(
				Arrays
						.asList(
								new Token("SUM(", TokenType.FUNC, TokenSubtype.OPEN),
								Token.makeOperand("A1"),
								new Token(")", TokenType.FUNC, TokenSubtype.CLOSE),
								INTERSECT,
								new Token("(", TokenType.PAREN, TokenSubtype.OPEN),
								Token.makeOperand("B1"),
								new Token(")", TokenType.PAREN, TokenSubtype.CLOSE)),
				FormulaLexer.tokenize("=SUM(A1) (B1)"));
	}

	@Test
	public void testNewlineIntersectionValue() {
		List<Token> tokens = FormulaLexer.tokenize("=A1\nB1");
		assertEquals(3, tokens.size());
		assertEquals(INTERSECT, tokens.get(1));
	}

	@Test
	public void testNoWhitespaceTokenRemains() {
		for (Token token : FormulaLexer.tokenize("=  IF( A1 > 0 , {1 , 2} ,  \"a b\" )  ")) {
			assertNotEquals(TokenType.WSPACE, token.getType());
		}
	}
}
