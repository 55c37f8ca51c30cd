package org.lokray.eqcfg.parser;

import org.antlr.v4.runtime.Token;
import org.lokray.eqcfg.error.SyntaxException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EqCfgLexerTest
{
	/**
	 * Every token up to and including the first EOF.
	 */
	private static List<Token> tokenize(String text)
	{
		EqCfgLexer lexer = SourceParser.createLexer(SourceText.of("test", text));
		List<Token> tokens = new ArrayList<>();
		Token token;
		do
		{
			token = lexer.nextToken();
			tokens.add(token);
		}
		while (token.getType() != Token.EOF);
		return tokens;
	}

	private static int type(List<Token> tokens, int index)
	{
		return tokens.get(index).getType();
	}

	@Test
	void emptySourceYieldsSingleEof()
	{
		List<Token> tokens = tokenize("");
		assertEquals(1, tokens.size());
		assertEquals(Token.EOF, type(tokens, 0));
	}

	@Test
	void eofIsReturnedAgainAfterEnd()
	{
		EqCfgLexer lexer = SourceParser.createLexer(SourceText.of("test", "$a"));
		lexer.getAllTokens();
		assertEquals(Token.EOF, lexer.nextToken().getType());
		assertEquals(Token.EOF, lexer.nextToken().getType());
	}

	@Test
	void variableDeclarationTokens()
	{
		List<Token> tokens = tokenize("$a : int = 5;");
		assertEquals(EqCfgLexer.VAR_SYMB, type(tokens, 0));
		assertEquals(EqCfgLexer.ID, type(tokens, 1));
		assertEquals("a", tokens.get(1).getText());
		assertEquals(EqCfgLexer.COLON, type(tokens, 2));
		assertEquals(EqCfgLexer.INT_CONST, type(tokens, 3));
		assertEquals(EqCfgLexer.ASSIGN, type(tokens, 4));
		assertEquals(EqCfgLexer.INT, type(tokens, 5));
		assertEquals(EqCfgLexer.SEMICOLON, type(tokens, 6));
		assertEquals(Token.EOF, type(tokens, 7));
	}

	@Test
	void decimalPointNeedsFollowingDigit()
	{
		List<Token> tokens = tokenize("3.25 42 7..");
		assertEquals(EqCfgLexer.FLOAT, type(tokens, 0));
		assertEquals(EqCfgLexer.INT, type(tokens, 1));
		assertEquals(EqCfgLexer.INT, type(tokens, 2));
		assertEquals(EqCfgLexer.ELLIPSIS, type(tokens, 3));
	}

	@Test
	void keywordsAreRecognized()
	{
		List<Token> tokens = tokenize("оборудование класс_а сигнал входной дискрет соединение обработчик статус норма Да");
		assertEquals(EqCfgLexer.OBJ_CLASS, type(tokens, 0));
		assertEquals(EqCfgLexer.OBJ_TYPE, type(tokens, 1));
		assertEquals(EqCfgLexer.SIGN_KW, type(tokens, 2));
		assertEquals(EqCfgLexer.SIGN_DIRECT, type(tokens, 3));
		assertEquals(EqCfgLexer.SIGN_TYPE, type(tokens, 4));
		assertEquals(EqCfgLexer.CONN_KW, type(tokens, 5));
		assertEquals(EqCfgLexer.CONN_OPT, type(tokens, 6));
		assertEquals(EqCfgLexer.SIGN_OPT, type(tokens, 7));
		assertEquals(EqCfgLexer.S_CONST, type(tokens, 8));
		assertEquals(EqCfgLexer.BOOL, type(tokens, 9));
	}

	@Test
	void keywordPrefixIsAnIdentifier()
	{
		List<Token> tokens = tokenize("входной1 index в_ряд");
		assertEquals(EqCfgLexer.ID, type(tokens, 0));
		assertEquals(EqCfgLexer.ID, type(tokens, 1));
		assertEquals(EqCfgLexer.ID, type(tokens, 2));
	}

	@Test
	void stringLiteralSkipsNestedQuotes()
	{
		List<Token> tokens = tokenize("'a \"b' c\" d' \"d\"");
		assertEquals(EqCfgLexer.STR, type(tokens, 0));
		assertEquals("'a \"b' c\" d'", tokens.get(0).getText());
		assertEquals(EqCfgLexer.STR, type(tokens, 1));
	}

	@Test
	void commentsSpanLinesAndAreSkipped()
	{
		List<Token> tokens = tokenize("$a / comment\n still './x' comment / : int;");
		assertEquals(EqCfgLexer.VAR_SYMB, type(tokens, 0));
		assertEquals(EqCfgLexer.ID, type(tokens, 1));
		assertEquals(EqCfgLexer.COLON, type(tokens, 2));
		assertEquals(2, tokens.get(2).getLine());
	}

	@Test
	void unclosedCommentFails()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> tokenize("$a / never closed"));
		assertTrue(e.getMessage().contains("not closed"), e.getMessage());
		assertTrue(e.getTrace().contains("pos=<3>"), e.getTrace());
	}

	@Test
	void unclosedStringFails()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> tokenize("$a : str = 'open;"));
		assertTrue(e.getMessage().contains("symbol <'> is not closed"), e.getMessage());
	}

	@Test
	void unexpectedSymbolFails()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> tokenize("$a # b"));
		assertEquals("Syntax Error", e.getKindLabel());
		assertEquals("unexpected symbol", e.getMessage());
	}

	@Test
	void loneLessThanIsUnexpected()
	{
		assertThrows(SyntaxException.class, () -> tokenize("[0:1] < [i]"));
	}

	@Test
	void rangeAndJunctionTokens()
	{
		List<Token> tokens = tokenize("диапазон[~, 10] [0:2] <- [i] ..");
		assertEquals(EqCfgLexer.RANGE_KW, type(tokens, 0));
		assertEquals(EqCfgLexer.TILDA, type(tokens, 2));
		assertTrue(tokens.stream().anyMatch(t -> t.getType() == EqCfgLexer.JUNC));
		assertTrue(tokens.stream().anyMatch(t -> t.getType() == EqCfgLexer.IT));
		assertTrue(tokens.stream().anyMatch(t -> t.getType() == EqCfgLexer.ELLIPSIS));
	}

	@Test
	void positionsAreOneBasedLinesZeroBasedColumns()
	{
		List<Token> tokens = tokenize("\n  $a;");
		Token sigil = tokens.get(0);
		assertEquals(2, sigil.getLine());
		assertEquals(2, sigil.getCharPositionInLine());
	}
}
