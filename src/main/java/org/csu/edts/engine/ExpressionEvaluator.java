package org.csu.edts.engine;

import org.csu.edts.common.exception.DivisionByZeroException;
import org.csu.edts.common.exception.UndefinedSymbolException;
import org.csu.edts.compiler.parser.ast.expression.ArithmeticOperator;
import org.csu.edts.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.edts.compiler.parser.ast.expression.ExpressionNode;
import org.csu.edts.compiler.parser.ast.expression.IdentifierNode;
import org.csu.edts.compiler.parser.ast.expression.NumberNode;
import org.csu.edts.symbol.Symbol;
import org.csu.edts.symbol.SymbolTable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Objects;

/**
 * 表达式求值器。
 * 后序遍历语法树，自底向上计算综合属性 .val：先求左右孩子，再按运算符合并。
 * 符号表只读；任何一个节点出错都会中止整个求值，不返回部分结果。
 */
public class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static double evaluate(ExpressionNode expression, SymbolTable symbolTable) {
        return decorate(expression, symbolTable).getValue();
    }

    /**
     * 计算整棵树每个节点的 .val。
     * @return 原树加上 .val 旁路表
     * @throws UndefinedSymbolException 标识符不在符号表中
     * @throws DivisionByZeroException  除数恰好为零
     */
    public static DecoratedTree decorate(ExpressionNode expression, SymbolTable symbolTable) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(symbolTable, "symbolTable");
        IdentityHashMap<ExpressionNode, Double> attributes = new IdentityHashMap<>();
        evaluateNode(expression, symbolTable, attributes);
        return new DecoratedTree(expression, attributes);
    }

    /**
     * 左链用显式栈迭代处理，只对右孩子递归；
     * 一长串同级运算 (1+1+...+1) 解析出的树向左倾斜，不会因此耗尽调用栈。
     */
    private static double evaluateNode(ExpressionNode node, SymbolTable symbolTable,
                                       IdentityHashMap<ExpressionNode, Double> attributes) {
        Deque<BinaryExpressionNode> leftSpine = new ArrayDeque<>();
        ExpressionNode current = node;
        while (current instanceof BinaryExpressionNode binaryNode) {
            leftSpine.push(binaryNode);
            current = binaryNode.left();
        }

        double value = evaluateLeaf(current, symbolTable);
        attributes.put(current, value);

        while (!leftSpine.isEmpty()) {
            BinaryExpressionNode binaryNode = leftSpine.pop();
            double right = evaluateNode(binaryNode.right(), symbolTable, attributes);
            value = combine(binaryNode.operator(), value, right);
            attributes.put(binaryNode, value);
        }
        return value;
    }

    private static double evaluateLeaf(ExpressionNode node, SymbolTable symbolTable) {
        if (node instanceof NumberNode numberNode) {
            return numberNode.value();
        }
        if (node instanceof IdentifierNode idNode) {
            return symbolTable.lookup(idNode.name())
                    .map(Symbol::getValue)
                    .orElseThrow(() -> new UndefinedSymbolException(idNode.name()));
        }
        throw new IllegalStateException("Unsupported expression node: " + node.getClass().getSimpleName());
    }

    private static double combine(ArithmeticOperator operator, double left, double right) {
        return switch (operator) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0) {
                    throw new DivisionByZeroException();
                }
                yield left / right;
            }
        };
    }
}
