package org.csu.edts.cli.tool;

import org.csu.edts.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.edts.compiler.parser.ast.expression.ExpressionNode;
import org.csu.edts.compiler.parser.ast.expression.IdentifierNode;
import org.csu.edts.compiler.parser.ast.expression.NumberNode;
import org.csu.edts.engine.DecoratedTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 一个可重用的工具类，用于把语法树格式化为缩进的文本，方便调试。
 * 只读，不会影响之后的求值；相同的树总是得到相同的文本。
 *
 * <pre>
 * BinOp(+) -> val=13
 *   L:
 *     Number(3) -> val=3
 *   R:
 *     BinOp(*) -> val=10
 *       ...
 * </pre>
 */
public class AstPrinter {

    private final String unit;

    public AstPrinter() {
        this(2);
    }

    public AstPrinter(int indent) {
        this.unit = " ".repeat(indent);
    }

    /**
     * 打印未求值的语法树
     */
    public String render(ExpressionNode node) {
        List<String> lines = new ArrayList<>();
        renderNode(node, null, "", lines);
        return String.join("\n", lines);
    }

    /**
     * 打印带 .val 的语法树，每个节点后面附上 "-> val=..."
     */
    public String render(DecoratedTree tree) {
        List<String> lines = new ArrayList<>();
        renderNode(tree.getRoot(), tree, "", lines);
        return String.join("\n", lines);
    }

    // 左链迭代展开，只对右孩子递归，与求值器的遍历方式一致
    private void renderNode(ExpressionNode node, DecoratedTree tree, String indent, List<String> lines) {
        Deque<BinaryExpressionNode> leftSpine = new ArrayDeque<>();
        Deque<String> spineIndents = new ArrayDeque<>();
        ExpressionNode current = node;
        String currentIndent = indent;
        while (current instanceof BinaryExpressionNode binaryNode) {
            lines.add(currentIndent + label(binaryNode) + suffix(binaryNode, tree));
            lines.add(currentIndent + unit + "L:");
            leftSpine.push(binaryNode);
            spineIndents.push(currentIndent);
            current = binaryNode.left();
            currentIndent = currentIndent + unit + unit;
        }
        lines.add(currentIndent + label(current) + suffix(current, tree));

        while (!leftSpine.isEmpty()) {
            BinaryExpressionNode binaryNode = leftSpine.pop();
            String nodeIndent = spineIndents.pop();
            lines.add(nodeIndent + unit + "R:");
            renderNode(binaryNode.right(), tree, nodeIndent + unit + unit, lines);
        }
    }

    private static String suffix(ExpressionNode node, DecoratedTree tree) {
        return tree == null ? "" : " -> val=" + formatValue(tree.valueOf(node));
    }

    /**
     * 单行括号形式, e.g. {@code BinOp(+, Number(3), Id(x))}
     */
    public static String toInlineString(ExpressionNode node) {
        StringBuilder sb = new StringBuilder();
        appendInline(node, sb);
        return sb.toString();
    }

    private static void appendInline(ExpressionNode node, StringBuilder sb) {
        Deque<BinaryExpressionNode> leftSpine = new ArrayDeque<>();
        ExpressionNode current = node;
        while (current instanceof BinaryExpressionNode binaryNode) {
            sb.append("BinOp(").append(binaryNode.operator()).append(", ");
            leftSpine.push(binaryNode);
            current = binaryNode.left();
        }
        sb.append(label(current));
        while (!leftSpine.isEmpty()) {
            sb.append(", ");
            appendInline(leftSpine.pop().right(), sb);
            sb.append(")");
        }
    }

    /**
     * 整数值不带小数部分 (13 而不是 13.0)
     */
    public static String formatValue(double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)
                && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static String label(ExpressionNode node) {
        if (node instanceof NumberNode numberNode) {
            return "Number(" + numberNode.text() + ")";
        }
        if (node instanceof IdentifierNode idNode) {
            return "Id(" + idNode.name() + ")";
        }
        if (node instanceof BinaryExpressionNode binaryNode) {
            return "BinOp(" + binaryNode.operator() + ")";
        }
        throw new IllegalStateException("Unsupported expression node: " + node.getClass().getSimpleName());
    }
}
