package org.csu.edts.compiler.parser.ast.expression;

import org.csu.edts.compiler.lexer.TokenType;

/**
 * 二元算术运算符，集合是封闭的。
 */
public enum ArithmeticOperator {
    PLUS('+'),
    MINUS('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    ArithmeticOperator(char symbol) {
        this.symbol = symbol;
    }

    /**
     * 把运算符 Token 的种别码映射为运算符
     * @throws IllegalArgumentException 如果该种别码不是算术运算符
     */
    public static ArithmeticOperator fromTokenType(TokenType type) {
        return switch (type) {
            case PLUS -> PLUS;
            case MINUS -> MINUS;
            case ASTERISK -> MULTIPLY;
            case SLASH -> DIVIDE;
            default -> throw new IllegalArgumentException("Not an arithmetic operator: " + type);
        };
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
