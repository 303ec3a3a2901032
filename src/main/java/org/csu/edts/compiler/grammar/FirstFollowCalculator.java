package org.csu.edts.compiler.grammar;

import java.util.*;

/**
 * 计算文法的 FIRST / FOLLOW 集合，并据此检查文法是否为 LL(1)。
 * 两个集合都用不动点迭代求得，直到一轮迭代中没有任何集合再变大。
 */
public class FirstFollowCalculator {

    private final Grammar grammar;
    private final Map<String, Set<String>> first = new LinkedHashMap<>();
    private final Map<String, Set<String>> follow = new LinkedHashMap<>();

    public FirstFollowCalculator(Grammar grammar) {
        this.grammar = grammar;
        computeFirst();
        computeFollow();
    }

    /**
     * @return FIRST(symbol)，终结符的 FIRST 就是它自己
     */
    public Set<String> first(String symbol) {
        if (!grammar.isNonTerminal(symbol)) {
            return Set.of(symbol);
        }
        return Collections.unmodifiableSet(first.get(symbol));
    }

    /**
     * @return FIRST(X1 X2 ... Xn)，若整个串可推导出空串则包含 ε
     */
    public Set<String> firstOfSequence(List<String> symbols) {
        Set<String> result = new LinkedHashSet<>();
        for (String symbol : symbols) {
            Set<String> symbolFirst = grammar.isNonTerminal(symbol) ? first.get(symbol) : Set.of(symbol);
            for (String terminal : symbolFirst) {
                if (!terminal.equals(Grammar.EPSILON)) {
                    result.add(terminal);
                }
            }
            if (!symbolFirst.contains(Grammar.EPSILON)) {
                return result;
            }
        }
        result.add(Grammar.EPSILON);
        return result;
    }

    public Set<String> follow(String nonTerminal) {
        Set<String> set = follow.get(nonTerminal);
        if (set == null) {
            throw new IllegalArgumentException("Not a nonterminal: " + nonTerminal);
        }
        return Collections.unmodifiableSet(set);
    }

    /**
     * PREDICT(A → α) = FIRST(α) - {ε}，若 ε ∈ FIRST(α) 再并上 FOLLOW(A)
     */
    public Set<String> predict(Production production) {
        Set<String> bodyFirst = firstOfSequence(production.body());
        Set<String> result = new LinkedHashSet<>(bodyFirst);
        if (result.remove(Grammar.EPSILON)) {
            result.addAll(follow.get(production.head()));
        }
        return result;
    }

    /**
     * 同一非终结符的任意两个候选式的 PREDICT 集合必须不相交。
     * @return 所有冲突的描述，空列表表示文法是 LL(1)
     */
    public List<String> conflicts() {
        List<String> conflicts = new ArrayList<>();
        for (String head : grammar.getNonTerminals()) {
            List<Production> alternatives = grammar.productionsFor(head);
            for (int i = 0; i < alternatives.size(); i++) {
                for (int j = i + 1; j < alternatives.size(); j++) {
                    Set<String> common = new LinkedHashSet<>(predict(alternatives.get(i)));
                    common.retainAll(predict(alternatives.get(j)));
                    if (!common.isEmpty()) {
                        conflicts.add(String.format("%s: '%s' and '%s' both predict %s",
                                head, alternatives.get(i), alternatives.get(j), common));
                    }
                }
            }
        }
        return conflicts;
    }

    public boolean isLl1() {
        return conflicts().isEmpty();
    }

    private void computeFirst() {
        for (String nonTerminal : grammar.getNonTerminals()) {
            first.put(nonTerminal, new LinkedHashSet<>());
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : grammar.getProductions()) {
                Set<String> target = first.get(p.head());
                if (target.addAll(firstOfSequence(p.body()))) {
                    changed = true;
                }
            }
        }
    }

    private void computeFollow() {
        for (String nonTerminal : grammar.getNonTerminals()) {
            follow.put(nonTerminal, new LinkedHashSet<>());
        }
        follow.get(grammar.getStartSymbol()).add(Grammar.END_MARKER);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : grammar.getProductions()) {
                List<String> body = p.body();
                for (int i = 0; i < body.size(); i++) {
                    String symbol = body.get(i);
                    if (!grammar.isNonTerminal(symbol)) {
                        continue;
                    }
                    Set<String> target = follow.get(symbol);
                    Set<String> restFirst = firstOfSequence(body.subList(i + 1, body.size()));
                    for (String terminal : restFirst) {
                        if (!terminal.equals(Grammar.EPSILON) && target.add(terminal)) {
                            changed = true;
                        }
                    }
                    // β 可以推导出空串时，FOLLOW(A) ⊆ FOLLOW(B)
                    if (restFirst.contains(Grammar.EPSILON) && target.addAll(follow.get(p.head()))) {
                        changed = true;
                    }
                }
            }
        }
    }
}
