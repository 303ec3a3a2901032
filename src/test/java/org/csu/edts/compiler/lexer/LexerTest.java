package org.csu.edts.compiler.lexer;

import org.csu.edts.common.exception.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    @Test
    void testSimpleArithmetic() {
        System.out.println("--- Running test: testSimpleArithmetic ---");
        String source = "3 + 5 * 2";
        System.out.println("Input: " + source);

        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Generated Tokens: " + tokens);

        TokenType[] expectedTypes = {
                TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER,
                TokenType.ASTERISK, TokenType.NUMBER, TokenType.EOF
        };
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配");
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }

        // 位置是从0开始的字符偏移，EOF 位于输入末尾
        assertEquals(0, tokens.get(0).position());
        assertEquals(2, tokens.get(1).position());
        assertEquals(8, tokens.get(4).position());
        assertEquals(9, tokens.get(5).position());
        assertEquals(3.0, tokens.get(0).value());
        assertNull(tokens.get(1).value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testIdentifiersDecimalsAndParentheses() {
        System.out.println("--- Running test: testIdentifiersDecimalsAndParentheses ---");
        List<Token> tokens = new Lexer("rate_2*(x1-4.25)/_y").tokenize();

        TokenType[] expectedTypes = {
                TokenType.IDENTIFIER, TokenType.ASTERISK, TokenType.LPAREN, TokenType.IDENTIFIER,
                TokenType.MINUS, TokenType.NUMBER, TokenType.RPAREN, TokenType.SLASH,
                TokenType.IDENTIFIER, TokenType.EOF
        };
        assertEquals(expectedTypes.length, tokens.size());
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type());
        }
        assertEquals("rate_2", tokens.get(0).lexeme());
        assertEquals("x1", tokens.get(3).lexeme());
        assertEquals("4.25", tokens.get(5).lexeme());
        assertEquals(4.25, tokens.get(5).value());
        assertEquals("_y", tokens.get(8).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testWhitespaceIsSkipped() {
        List<Token> tokens = new Lexer(" \t12\r\n+\n  x ").tokenize();
        assertEquals(4, tokens.size());
        assertEquals("12", tokens.get(0).lexeme());
        assertEquals(TokenType.PLUS, tokens.get(1).type());
        assertEquals("x", tokens.get(2).lexeme());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    void testEmptyInputProducesOnlyEof() {
        List<Token> tokens = new Lexer("").tokenize();
        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type());
        assertEquals(0, tokens.get(0).position());
    }

    @Test
    void testIllegalCharacter() {
        System.out.println("--- Running test: testIllegalCharacter ---");
        System.out.println("Goal: An unknown character aborts tokenization with its position.");

        LexException e = assertThrows(LexException.class, () -> new Lexer("3 # 4").tokenize());
        assertEquals(2, e.getPosition());
        assertEquals('#', e.getCharacter());
        assertEquals("Lexical Error at position 2: Invalid character '#'", e.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDotWithoutDigitsIsIllegal() {
        LexException trailingDot = assertThrows(LexException.class, () -> new Lexer("3.").tokenize());
        assertEquals(1, trailingDot.getPosition());
        assertEquals('.', trailingDot.getCharacter());

        // 一个数字只允许一个小数点
        LexException secondDot = assertThrows(LexException.class, () -> new Lexer("1.2.3").tokenize());
        assertEquals(3, secondDot.getPosition());
    }

    @Test
    void testTokenListIsImmutable() {
        List<Token> tokens = new Lexer("x").tokenize();
        assertThrows(UnsupportedOperationException.class,
                () -> tokens.add(new Token(TokenType.EOF, "", 1)));
    }

    @Test
    void testAllWhitespaceIsSkipped() {
        System.out.println("--- Running test: testAllWhitespaceIsSkipped ---");
        // 换页符和垂直制表符同样是空白
        List<Token> tokens = new Lexer("1\f+\u000B2\t").tokenize();
        assertEquals(4, tokens.size());
        assertEquals(TokenType.NUMBER, tokens.get(0).type());
        assertEquals(TokenType.PLUS, tokens.get(1).type());
        assertEquals(2, tokens.get(1).position());
        assertEquals(TokenType.NUMBER, tokens.get(2).type());
        assertEquals(4, tokens.get(2).position());
        assertEquals(TokenType.EOF, tokens.get(3).type());
        assertEquals(6, tokens.get(3).position());
        System.out.println("Result: Test PASSED.\n");
    }
}
