package org.csu.edts.engine;

/**
 * {@link ExpressionProcessor} 的配置。
 *
 * @param trace 为 true 时把每个阶段的中间结果打印到标准输出
 * @param indent 打印语法树时每一层缩进的空格数
 */
public record ProcessorOptions(boolean trace, int indent) {

    public static final int DEFAULT_INDENT = 2;

    public ProcessorOptions {
        if (indent < 1) {
            throw new IllegalArgumentException("indent must be positive, got " + indent);
        }
    }

    public static ProcessorOptions defaults() {
        return new ProcessorOptions(false, DEFAULT_INDENT);
    }
}
