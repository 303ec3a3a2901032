package org.csu.edts.symbol;

import lombok.Getter;

import java.util.Objects;

/**
 * 在内存中表示符号表里的一个条目。
 */
@Getter
public class Symbol {
    private final String name;
    private final DataType type;
    private final double value;

    public Symbol(String name, DataType type, double value) {
        this.name = name;
        this.type = type;
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Double.compare(symbol.value, value) == 0 && name.equals(symbol.name) && type == symbol.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value);
    }

    @Override
    public String toString() {
        return "Symbol[name=" + name + ", type=" + type + ", value=" + value + "]";
    }
}
