package org.csu.edts.common.exception;

/**
 * @author hidyouth
 * @description: 表达式处理流程中所有前端/名字解析错误的公共父类
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
