package org.csu.edts.common.exception;

import lombok.Getter;
import org.csu.edts.compiler.lexer.Token;

/**
 * @author hidyouth
 */
@Getter
public class ParseException extends ExpressionException {

    private final String reason;   // e.g. "expected ')'"
    private final int position;
    private final Token token;     // 出错位置的 Token

    public ParseException(String reason, Token token) {
        super(String.format("Syntax Error at position %d: %s, but found '%s' (%s)",
                token.position(),
                reason,
                token.lexeme(),
                token.type()));
        this.reason = reason;
        this.position = token.position();
        this.token = token;
    }
}
