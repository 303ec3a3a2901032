package org.csu.edts.engine;

import lombok.Getter;
import org.csu.edts.cli.tool.AstPrinter;
import org.csu.edts.common.exception.ExpressionException;
import org.csu.edts.compiler.lexer.Lexer;
import org.csu.edts.compiler.lexer.Token;
import org.csu.edts.compiler.parser.Parser;
import org.csu.edts.compiler.parser.ast.expression.ExpressionNode;
import org.csu.edts.symbol.SymbolTable;

import java.util.List;

/**
 * 表达式处理的统一入口：词法分析 → 语法分析 → 求值。
 */
public class ExpressionProcessor {

    @Getter
    private final ProcessorOptions options;
    private final AstPrinter printer;

    public ExpressionProcessor() {
        this(ProcessorOptions.defaults());
    }

    public ExpressionProcessor(ProcessorOptions options) {
        this.options = options;
        this.printer = new AstPrinter(options.indent());
    }

    /**
     * 处理一条表达式，出错时原样抛出带类型的异常。
     */
    public EvaluationResult process(String source, SymbolTable symbolTable) {
        List<Token> tokens = new Lexer(source).tokenize();
        trace("Tokens: " + tokens);

        ExpressionNode ast = new Parser(tokens).parse();
        trace("AST: " + AstPrinter.toInlineString(ast));

        DecoratedTree decoratedTree = ExpressionEvaluator.decorate(ast, symbolTable);
        trace("Value: " + AstPrinter.formatValue(decoratedTree.getValue()));

        return new EvaluationResult(source, tokens, ast, decoratedTree);
    }

    /**
     * 处理一条表达式并返回可直接展示的文本。
     * @return 带 .val 的语法树和最终值；出错时返回 "ERROR: ..."
     */
    public String executeAndGetResult(String source, SymbolTable symbolTable) {
        try {
            EvaluationResult result = process(source, symbolTable);
            return printer.render(result.decoratedTree()) + "\n"
                    + "Value: " + AstPrinter.formatValue(result.value());
        } catch (ExpressionException | ArithmeticException e) {
            System.err.println("Error while processing '" + source + "': " + e.getMessage());
            return "ERROR: " + e.getMessage();
        }
    }

    private void trace(String message) {
        if (options.trace()) {
            System.out.println("[TRACE] " + message);
        }
    }
}
