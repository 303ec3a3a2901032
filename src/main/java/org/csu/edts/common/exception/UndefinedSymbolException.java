package org.csu.edts.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 求值阶段的异常，标识符在符号表中不存在
 */
@Getter
public class UndefinedSymbolException extends ExpressionException {

    private final String name;

    public UndefinedSymbolException(String name) {
        super("Undefined identifier: '" + name + "'");
        this.name = name;
    }
}
