package org.csu.edts.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param value 数字常量的数值，只有 NUMBER 类型才有，其余为 null
 * @param position 词素第一个字符在输入中的偏移 (从0开始)
 */
public record Token(TokenType type, String lexeme, Double value, int position) {

    public Token {
        if (type == TokenType.NUMBER && value == null) {
            throw new IllegalArgumentException("NUMBER token '" + lexeme + "' requires a numeric value");
        }
    }

    public Token(TokenType type, String lexeme, int position) {
        this(type, lexeme, null, position);
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-10s, Lexeme='%s', Position=%d]",
                type, lexeme, position);
    }
}
