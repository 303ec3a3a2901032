package org.csu.edts.compiler.grammar;

import java.util.List;

/**
 * 一条产生式 head → body，body 为空表示 ε。
 */
public record Production(String head, List<String> body) {

    public Production {
        body = List.copyOf(body);
    }

    public static Production of(String head, String... body) {
        return new Production(head, List.of(body));
    }

    public boolean isEpsilon() {
        return body.isEmpty();
    }

    public String bodyText() {
        return isEpsilon() ? Grammar.EPSILON : String.join(" ", body);
    }

    @Override
    public String toString() {
        return head + " → " + bodyText();
    }
}
