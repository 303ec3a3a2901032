package org.csu.edts.engine;

import lombok.Getter;
import org.csu.edts.compiler.parser.ast.expression.ExpressionNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 带综合属性 .val 的语法树。
 * 原树不被修改，属性按节点的引用 (而不是 equals) 挂在旁路表上，
 * 因此结构相同的两棵子树各自拥有自己的 .val。
 */
public class DecoratedTree {

    @Getter
    private final ExpressionNode root;
    private final Map<ExpressionNode, Double> attributes;

    DecoratedTree(ExpressionNode root, IdentityHashMap<ExpressionNode, Double> attributes) {
        this.root = root;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /**
     * @return 根节点的 .val，即整个表达式的值
     */
    public double getValue() {
        return valueOf(root);
    }

    /**
     * @param node 这棵树中的某个节点 (按引用匹配)
     * @return 该节点的 .val
     * @throws IllegalArgumentException 如果节点不属于这棵树
     */
    public double valueOf(ExpressionNode node) {
        Double value = attributes.get(node);
        if (value == null) {
            throw new IllegalArgumentException("Node is not part of this decorated tree: " + node);
        }
        return value;
    }

    public int size() {
        return attributes.size();
    }
}
