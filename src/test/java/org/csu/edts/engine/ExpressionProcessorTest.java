package org.csu.edts.engine;

import org.csu.edts.common.exception.DivisionByZeroException;
import org.csu.edts.common.exception.LexException;
import org.csu.edts.common.exception.ParseException;
import org.csu.edts.common.exception.UndefinedSymbolException;
import org.csu.edts.symbol.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 整个处理流程 (词法 → 语法 → 求值) 的集成测试。
 */
public class ExpressionProcessorTest {

    private ExpressionProcessor processor;
    private SymbolTable emptyTable;

    @BeforeEach
    void setUp() {
        processor = new ExpressionProcessor();
        emptyTable = new SymbolTable();
    }

    @Test
    void testScenarios() {
        System.out.println("--- Running test: testScenarios ---");
        assertEquals(13.0, processor.process("3 + 5 * 2", emptyTable).value());
        assertEquals(16.0, processor.process("(3 + 5) * 2", emptyTable).value());
        assertEquals(2.0, processor.process("10 / 2 - 3", emptyTable).value());

        SymbolTable table = new SymbolTable();
        table.insert("x", 5);
        assertEquals(7.0, processor.process("x + 2", table).value());

        assertThrows(DivisionByZeroException.class, () -> processor.process("1 / 0", emptyTable));
        UndefinedSymbolException nameError =
                assertThrows(UndefinedSymbolException.class, () -> processor.process("y + 1", emptyTable));
        assertEquals("y", nameError.getName());
        ParseException syntaxError =
                assertThrows(ParseException.class, () -> processor.process("(3 + 5", emptyTable));
        assertEquals("expected ')'", syntaxError.getReason());
        assertThrows(LexException.class, () -> processor.process("3 $ 5", emptyTable));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testResultKeepsEveryStage() {
        EvaluationResult result = processor.process("4 * (1 + 2)", emptyTable);
        assertEquals("4 * (1 + 2)", result.source());
        assertEquals(8, result.tokens().size());
        assertSame(result.ast(), result.decoratedTree().getRoot());
        assertEquals(12.0, result.value());
    }

    @Test
    void testExecuteAndGetResultRendersDecoratedTree() {
        System.out.println("--- Running test: testExecuteAndGetResultRendersDecoratedTree ---");
        String output = processor.executeAndGetResult("3 + 5 * 2", emptyTable);
        System.out.println(output);

        String expected = String.join("\n",
                "BinOp(+) -> val=13",
                "  L:",
                "    Number(3) -> val=3",
                "  R:",
                "    BinOp(*) -> val=10",
                "      L:",
                "        Number(5) -> val=5",
                "      R:",
                "        Number(2) -> val=2",
                "Value: 13");
        assertEquals(expected, output);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testExecuteAndGetResultReportsErrors() {
        System.out.println("--- Running test: testExecuteAndGetResultReportsErrors ---");
        assertEquals("ERROR: division by zero", processor.executeAndGetResult("1 / 0", emptyTable));
        assertEquals("ERROR: Undefined identifier: 'y'", processor.executeAndGetResult("y + 1", emptyTable));
        assertEquals("ERROR: Syntax Error at position 6: expected ')', but found '' (EOF)",
                processor.executeAndGetResult("(3 + 5", emptyTable));
        assertEquals("ERROR: Lexical Error at position 2: Invalid character '#'",
                processor.executeAndGetResult("3 # 4", emptyTable));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTraceOptionPrintsEachStage() {
        ExpressionProcessor tracing = new ExpressionProcessor(new ProcessorOptions(true, 2));
        SymbolTable table = new SymbolTable();
        table.insert("x", 5);

        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            tracing.process("x + 2", table);
        } finally {
            System.setOut(originalOut);
        }

        String log = captured.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("[TRACE] Tokens: "));
        assertTrue(log.contains("[TRACE] AST: BinOp(+, Id(x), Number(2))"));
        assertTrue(log.contains("[TRACE] Value: 7"));
    }

    @Test
    void testOptions() {
        assertEquals(ProcessorOptions.defaults(), processor.getOptions());
        assertFalse(ProcessorOptions.defaults().trace());
        assertEquals(ProcessorOptions.DEFAULT_INDENT, ProcessorOptions.defaults().indent());
        assertThrows(IllegalArgumentException.class, () -> new ProcessorOptions(false, 0));
    }
}
