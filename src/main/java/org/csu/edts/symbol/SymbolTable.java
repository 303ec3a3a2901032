package org.csu.edts.symbol;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 符号表，负责管理标识符到数值的映射。
 * 由调用方在求值之前填充；求值器只读不写。
 * 同一个名字重复插入时，后插入的覆盖先插入的。
 */
public class SymbolTable {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // 保持插入顺序，方便打印
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    /**
     * 插入一个符号。
     * @param name  标识符名称 (区分大小写)
     * @param type  数值类型
     * @param value 数值
     * @throws IllegalArgumentException 如果名称不是合法的标识符
     */
    public void insert(String name, DataType type, double value) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier name: '" + name + "'");
        }
        Objects.requireNonNull(type, "type");
        symbols.put(name, new Symbol(name, type, value));
    }

    /**
     * 插入一个符号，类型根据数值推断：整数值为 INT，否则为 DECIMAL。
     */
    public void insert(String name, double value) {
        boolean integral = !Double.isInfinite(value) && value == Math.rint(value);
        insert(name, integral ? DataType.INT : DataType.DECIMAL, value);
    }

    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /**
     * @return 按插入顺序排列的所有符号 (只读视图)
     */
    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }
}
