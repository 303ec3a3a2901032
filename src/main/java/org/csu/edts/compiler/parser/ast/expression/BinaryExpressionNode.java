package org.csu.edts.compiler.parser.ast.expression;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., a + 2)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        ArithmeticOperator operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }
}
