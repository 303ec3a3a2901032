package org.csu.edts.common.exception;

/**
 * @author hidyouth
 * @description: 文法变换/分析阶段的异常，例如无法消除的左递归
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }
}
