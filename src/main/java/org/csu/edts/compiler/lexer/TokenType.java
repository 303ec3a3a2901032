package org.csu.edts.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 算术表达式语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 变量名, e.g., x, rate_2

    // ---- 常量 (Constants) ----
    NUMBER,     // 数字常量, e.g., 123 或 123.45

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    MINUS,      // -
    ASTERISK,   // *
    SLASH,      // /

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    EOF         // End-Of-File，表示输入流结束
}
