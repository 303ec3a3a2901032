package org.csu.edts.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 词法分析阶段的异常，遇到无法识别的字符时抛出
 */
@Getter
public class LexException extends ExpressionException {

    private final int position;
    private final char character;

    public LexException(int position, char character) {
        super(String.format("Lexical Error at position %d: Invalid character '%c'", position, character));
        this.position = position;
        this.character = character;
    }
}
