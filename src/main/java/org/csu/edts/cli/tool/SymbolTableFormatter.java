package org.csu.edts.cli.tool;

import org.csu.edts.symbol.Symbol;
import org.csu.edts.symbol.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * 将符号表格式化为带边框的控制台表格。
 */
public class SymbolTableFormatter {

    private static final List<String> HEADERS = List.of("name", "type", "value");

    public static String format(SymbolTable symbolTable) {
        if (symbolTable.isEmpty()) {
            return "Symbol table is empty.";
        }

        List<List<String>> rows = new ArrayList<>();
        for (Symbol symbol : symbolTable.getSymbols()) {
            rows.add(List.of(symbol.getName(), symbol.getType().name(), AstPrinter.formatValue(symbol.getValue())));
        }

        // 1. 计算每列的最大宽度
        List<Integer> columnWidths = new ArrayList<>();
        for (int i = 0; i < HEADERS.size(); i++) {
            int maxWidth = HEADERS.get(i).length();
            for (List<String> row : rows) {
                maxWidth = Math.max(maxWidth, row.get(i).length());
            }
            columnWidths.add(maxWidth);
        }

        // 2. 表头
        StringBuilder sb = new StringBuilder();
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(HEADERS, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");

        // 3. 数据行
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }
        sb.append(getSeparator(columnWidths));
        return sb.toString();
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
