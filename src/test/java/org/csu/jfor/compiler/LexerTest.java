package org.csu.jfor.compiler;

import org.csu.jfor.common.exception.LexException;
import org.csu.jfor.compiler.lexer.Lexer;
import org.csu.jfor.compiler.lexer.Token;
import org.csu.jfor.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private List<Token> lex(String source) {
        System.out.println("Input source: " + source);
        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Generated Tokens: " + tokens);
        return tokens;
    }

    private void assertTypes(List<Token> tokens, TokenType... expectedTypes) {
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配");
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }
    }

    @Test
    void testCounterLoopHeader() {
        System.out.println("--- Running test: testCounterLoopHeader ---");
        List<Token> tokens = lex("for i = 1 to 5 by 2 do print i end");
        assertTypes(tokens,
                TokenType.FOR, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER_CONST,
                TokenType.TO, TokenType.NUMBER_CONST, TokenType.BY, TokenType.NUMBER_CONST,
                TokenType.DO, TokenType.PRINT, TokenType.IDENTIFIER, TokenType.END, TokenType.EOF);
        assertEquals("i", tokens.get(1).lexeme());
        assertEquals("5", tokens.get(5).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSemicolonHeaderAndOperators() {
        System.out.println("--- Running test: testSemicolonHeaderAndOperators ---");
        List<Token> tokens = lex("for (j = 0; j <= 5; j = j + 1)");
        assertTypes(tokens,
                TokenType.FOR, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER_CONST,
                TokenType.SEMICOLON, TokenType.IDENTIFIER, TokenType.LESS_EQUAL, TokenType.NUMBER_CONST,
                TokenType.SEMICOLON, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.IDENTIFIER,
                TokenType.PLUS, TokenType.NUMBER_CONST, TokenType.RPAREN, TokenType.EOF);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAllComparisonOperators() {
        System.out.println("--- Running test: testAllComparisonOperators ---");
        List<Token> tokens = lex("< > <= >= == != = - * /");
        assertTypes(tokens,
                TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.ASSIGN, TokenType.MINUS,
                TokenType.ASTERISK, TokenType.SLASH, TokenType.EOF);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testListLiteralAndStrings() {
        System.out.println("--- Running test: testListLiteralAndStrings ---");
        List<Token> tokens = lex("[\"Hello\",'Bonjour']");
        assertTypes(tokens,
                TokenType.LBRACKET, TokenType.STRING_CONST, TokenType.COMMA, TokenType.STRING_CONST,
                TokenType.RBRACKET, TokenType.EOF);
        // 字符串常量的词素不含引号
        assertEquals("Hello", tokens.get(1).lexeme());
        assertEquals("Bonjour", tokens.get(3).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDecimalNumbers() {
        System.out.println("--- Running test: testDecimalNumbers ---");
        List<Token> tokens = lex("3.25 42");
        assertTypes(tokens, TokenType.NUMBER_CONST, TokenType.NUMBER_CONST, TokenType.EOF);
        assertEquals("3.25", tokens.get(0).lexeme());
        assertEquals("42", tokens.get(1).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testKeywordsAreCaseInsensitiveButIdentifiersAreNot() {
        System.out.println("--- Running test: testKeywordsAreCaseInsensitiveButIdentifiersAreNot ---");
        List<Token> tokens = lex("FOR Print End total Total");
        assertTypes(tokens, TokenType.FOR, TokenType.PRINT, TokenType.END,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF);
        assertNotEquals(tokens.get(3).lexeme(), tokens.get(4).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCommentsAndPositions() {
        System.out.println("--- Running test: testCommentsAndPositions ---");
        List<Token> tokens = lex("# a comment line\n  x = 1 # trailing\nprint x");
        assertTypes(tokens, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER_CONST,
                TokenType.PRINT, TokenType.IDENTIFIER, TokenType.EOF);
        assertEquals(2, tokens.get(0).line());
        assertEquals(3, tokens.get(0).column());
        assertEquals(3, tokens.get(3).line());
        assertEquals(1, tokens.get(3).column());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTokenCategories() {
        System.out.println("--- Running test: testTokenCategories ---");
        List<Token> tokens = lex("print \"s\" + n ; 7");
        assertEquals(TokenType.Category.KEYWORD, tokens.get(0).category());
        assertEquals(TokenType.Category.STRING, tokens.get(1).category());
        assertEquals(TokenType.Category.OPERATOR, tokens.get(2).category());
        assertEquals(TokenType.Category.IDENTIFIER, tokens.get(3).category());
        assertEquals(TokenType.Category.PUNCTUATION, tokens.get(4).category());
        assertEquals(TokenType.Category.NUMBER, tokens.get(5).category());
        assertEquals(TokenType.Category.END_OF_INPUT, tokens.get(6).category());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        System.out.println("--- Running test: testEmptyInputYieldsOnlyEof ---");
        assertTypes(lex("   \n\t "), TokenType.EOF);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNextTokenIsLazy() {
        System.out.println("--- Running test: testNextTokenIsLazy ---");
        // 非法字符在后面，前面的 Token 依然可以逐个取出
        Lexer lexer = new Lexer("x = 1 @");
        assertEquals(TokenType.IDENTIFIER, lexer.nextToken().type());
        assertEquals(TokenType.ASSIGN, lexer.nextToken().type());
        assertEquals(TokenType.NUMBER_CONST, lexer.nextToken().type());
        assertThrows(LexException.class, lexer::nextToken);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testIllegalCharacter() {
        System.out.println("--- Running test: testIllegalCharacter ---");
        LexException e = assertThrows(LexException.class, () -> lex("x = 1 $ 2"));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(7, e.getColumn());
        assertEquals("LexError", e.getKind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLoneBangIsIllegal() {
        System.out.println("--- Running test: testLoneBangIsIllegal ---");
        assertThrows(LexException.class, () -> lex("x ! y"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnterminatedString() {
        System.out.println("--- Running test: testUnterminatedString ---");
        LexException e = assertThrows(LexException.class, () -> lex("print \"abc"));
        assertTrue(e.getMessage().contains("Unterminated string"));
        assertEquals(7, e.getColumn());
        // 引号必须成对，单引号不能关闭双引号
        assertThrows(LexException.class, () -> lex("print \"abc'"));
        System.out.println("Result: Test PASSED.\n");
    }
}
