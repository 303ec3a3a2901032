package org.csu.edts.compiler.parser.ast.expression;

/**
 * AST 节点: 所有算术表达式节点的公共接口。
 * 节点种类是封闭的：叶子只能是数字或标识符，内部节点只能是二元运算。
 */
public sealed interface ExpressionNode permits NumberNode, IdentifierNode, BinaryExpressionNode {
}
