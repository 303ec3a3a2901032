package org.csu.edts.compiler.parser.ast.expression;

import org.csu.edts.compiler.lexer.Token;
import org.csu.edts.compiler.lexer.TokenType;

/**
 * AST 节点: 表示一个数字字面量 (e.g., 42, 3.14)
 */
public record NumberNode(Token literal) implements ExpressionNode {

    public NumberNode {
        if (literal == null || literal.type() != TokenType.NUMBER || literal.value() == null) {
            throw new IllegalArgumentException("NumberNode requires a NUMBER token, got: " + literal);
        }
    }

    public double value() {
        return literal.value();
    }

    /**
     * @return 源码中的原始写法, 打印语法树时使用
     */
    public String text() {
        return literal.lexeme();
    }
}
