package org.csu.edts.compiler.parser.ast.expression;

/**
 * AST 节点: 表示一个标识符引用 (e.g., x)。
 * 它的值只在求值阶段通过符号表解析。
 */
public record IdentifierNode(String name) implements ExpressionNode {
}
