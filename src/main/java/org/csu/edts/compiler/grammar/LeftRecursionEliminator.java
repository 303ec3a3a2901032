package org.csu.edts.compiler.grammar;

import org.csu.edts.common.exception.GrammarException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 消除直接左递归:
 * <pre>
 * A → A α1 | ... | A αn | β1 | ... | βm
 * ⇒
 * A  → β1 A' | ... | βm A'
 * A' → α1 A' | ... | αn A' | ε
 * </pre>
 * 没有左递归的非终结符原样保留。
 */
public final class LeftRecursionEliminator {

    private LeftRecursionEliminator() {
    }

    public static Grammar eliminate(Grammar grammar) {
        List<Production> result = new ArrayList<>();
        Set<String> usedNames = new HashSet<>(grammar.getNonTerminals());
        usedNames.addAll(grammar.getTerminals());

        for (String head : grammar.getNonTerminals()) {
            List<Production> alternatives = grammar.productionsFor(head);
            List<List<String>> alphas = new ArrayList<>();
            List<List<String>> betas = new ArrayList<>();
            for (Production p : alternatives) {
                if (!p.isEpsilon() && p.body().get(0).equals(head)) {
                    if (p.body().size() == 1) {
                        throw new GrammarException("Cyclic production: " + p);
                    }
                    alphas.add(p.body().subList(1, p.body().size()));
                } else {
                    betas.add(p.body());
                }
            }

            if (alphas.isEmpty()) {
                result.addAll(alternatives);
                continue;
            }
            if (betas.isEmpty()) {
                throw new GrammarException("Nonterminal '" + head + "' has only left-recursive alternatives");
            }

            String tail = freshName(head, usedNames);
            for (List<String> beta : betas) {
                result.add(new Production(head, append(beta, tail)));
            }
            for (List<String> alpha : alphas) {
                result.add(new Production(tail, append(alpha, tail)));
            }
            result.add(new Production(tail, List.of()));
        }
        return new Grammar(grammar.getStartSymbol(), result);
    }

    private static String freshName(String head, Set<String> usedNames) {
        String name = head + "'";
        while (usedNames.contains(name)) {
            name += "'";
        }
        usedNames.add(name);
        return name;
    }

    private static List<String> append(List<String> symbols, String last) {
        List<String> body = new ArrayList<>(symbols);
        body.add(last);
        return body;
    }
}
