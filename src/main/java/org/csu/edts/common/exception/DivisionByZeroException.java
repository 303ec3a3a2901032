package org.csu.edts.common.exception;

/**
 * @author hidyouth
 * @description: 除数恰好为零时抛出
 */
public class DivisionByZeroException extends ArithmeticException {

    public DivisionByZeroException() {
        super("division by zero");
    }
}
