package org.csu.edts.engine;

import org.csu.edts.compiler.lexer.Token;
import org.csu.edts.compiler.parser.ast.expression.ExpressionNode;

import java.util.List;

/**
 * 一次完整处理 (词法 → 语法 → 求值) 的结果。
 *
 * @param source 原始表达式文本
 * @param tokens 词法分析结果
 * @param ast 语法树
 * @param decoratedTree 带 .val 的语法树
 */
public record EvaluationResult(String source, List<Token> tokens, ExpressionNode ast, DecoratedTree decoratedTree) {

    public double value() {
        return decoratedTree.getValue();
    }
}
