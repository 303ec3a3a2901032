package org.csu.edts.symbol;

/**
 * 符号的数值类型。两者在求值时都按实数处理，只影响展示。
 */
public enum DataType {
    INT,
    DECIMAL
}
