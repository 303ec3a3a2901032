package org.csu.edts.compiler.grammar;

import lombok.Getter;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 上下文无关文法 (CFG)。
 * 非终结符就是所有产生式的左部，其余出现在右部的符号都是终结符。
 */
@Getter
public class Grammar {

    public static final String EPSILON = "ε";
    public static final String END_MARKER = "$";

    private final String startSymbol;
    private final List<Production> productions;
    private final Set<String> nonTerminals;
    private final Set<String> terminals;

    public Grammar(String startSymbol, List<Production> productions) {
        this.startSymbol = startSymbol;
        this.productions = List.copyOf(productions);

        Set<String> heads = new LinkedHashSet<>();
        for (Production p : this.productions) {
            heads.add(p.head());
        }
        if (!heads.contains(startSymbol)) {
            throw new IllegalArgumentException("Start symbol '" + startSymbol + "' has no production");
        }
        Set<String> terms = new LinkedHashSet<>();
        for (Production p : this.productions) {
            for (String symbol : p.body()) {
                if (!heads.contains(symbol)) {
                    terms.add(symbol);
                }
            }
        }
        this.nonTerminals = Collections.unmodifiableSet(heads);
        this.terminals = Collections.unmodifiableSet(terms);
    }

    public boolean isNonTerminal(String symbol) {
        return nonTerminals.contains(symbol);
    }

    public List<Production> productionsFor(String head) {
        return productions.stream()
                .filter(p -> p.head().equals(head))
                .collect(Collectors.toList());
    }

    /**
     * 每个非终结符一行，形如 {@code E → T E' | ε}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String head : nonTerminals) {
            String alternatives = productionsFor(head).stream()
                    .map(Production::bodyText)
                    .collect(Collectors.joining(" | "));
            sb.append(head).append(" → ").append(alternatives).append("\n");
        }
        return sb.toString().trim();
    }
}
