package org.csu.edts.compiler.grammar;

import java.util.List;

/**
 * 算术表达式文法。
 * 原始文法是左递归的，不能直接用于递归下降；消除左递归后得到 LL(1) 文法，
 * {@link org.csu.edts.compiler.parser.Parser} 中的循环正是 E'、T' 的实现。
 */
public final class ExpressionGrammar {

    public static final String ID = "id";
    public static final String NUM = "num";

    private ExpressionGrammar() {
    }

    /**
     * <pre>
     * E → E + T | E - T | T
     * T → T * F | T / F | F
     * F → ( E ) | id | num
     * </pre>
     */
    public static Grammar leftRecursive() {
        return new Grammar("E", List.of(
                Production.of("E", "E", "+", "T"),
                Production.of("E", "E", "-", "T"),
                Production.of("E", "T"),
                Production.of("T", "T", "*", "F"),
                Production.of("T", "T", "/", "F"),
                Production.of("T", "F"),
                Production.of("F", "(", "E", ")"),
                Production.of("F", ID),
                Production.of("F", NUM)
        ));
    }

    public static Grammar ll1() {
        return LeftRecursionEliminator.eliminate(leftRecursive());
    }
}
