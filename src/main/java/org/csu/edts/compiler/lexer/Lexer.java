package org.csu.edts.compiler.lexer;

import org.csu.edts.common.exception.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的算术表达式分解为一系列的Token，末尾总是追加一个 EOF。
 * 遇到非法字符时立即抛出 {@link LexException}，不会返回部分结果。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return 不可修改的Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return Collections.unmodifiableList(tokens);
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", position);
        }

        char currentChar = peek();

        // 识别标识符
        if (isLetter(currentChar)) {
            return readIdentifier();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            default:
                throw new LexException(position, currentChar);
        }
    }

    private Token readIdentifier() {
        int startPos = position;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        return new Token(TokenType.IDENTIFIER, text, startPos);
    }

    private Token readNumber() {
        int startPos = position;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        // 只有小数点后面紧跟数字时才算作小数的一部分
        if (position < input.length() && peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER, number, Double.parseDouble(number), startPos);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, position);
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
