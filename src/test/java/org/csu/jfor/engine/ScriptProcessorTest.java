package org.csu.jfor.engine;

import org.csu.jfor.common.exception.DivisionByZeroException;
import org.csu.jfor.common.exception.LexException;
import org.csu.jfor.common.exception.NameException;
import org.csu.jfor.common.exception.ParseException;
import org.csu.jfor.common.model.Value;
import org.csu.jfor.cli.DemoScript;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试: 源程序 -> 词法 -> 语法 -> 执行 -> 输出。
 */
public class ScriptProcessorTest {

    private ScriptProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ScriptProcessor();
    }

    private List<String> runAndGetLines(String source) {
        ScriptResult result = processor.executeAndGetResult(source);
        System.out.println("Output:\n" + result.output());
        assertTrue(result.isSuccess(), () -> "unexpected error: " + result.error().describe());
        return result.outputLines();
    }

    @Test
    void testScenarioCounterLoop() {
        System.out.println("--- Test: Scenario A, counter loop ---");
        assertEquals(List.of("1", "3", "5"), runAndGetLines("for i = 1 to 5 by 2 do print i end"));
    }

    @Test
    void testScenarioIteratorLoop() {
        System.out.println("--- Test: Scenario B, iterator loop ---");
        assertEquals(List.of("Hello World!", "Bonjour World!", "Hola World!"),
                runAndGetLines("for w in [\"Hello\",\"Bonjour\",\"Hola\"] do print w + \" World!\" end"));
    }

    @Test
    void testScenarioSemicolonLoop() {
        System.out.println("--- Test: Scenario C, semicolon loop ---");
        assertEquals(List.of("0", "1", "2", "3", "4"),
                runAndGetLines("for (j = 0; j < 5; j = j + 1) do print j end"));
    }

    @Test
    void testScenarioWhileStyleLoop() {
        System.out.println("--- Test: Scenario D, while-style loop ---");
        assertEquals(List.of("3", "2", "1"),
                runAndGetLines("x = 3\nfor (; x > 0; ) do print x  x = x - 1 end"));
    }

    @Test
    void testWhileStyleMatchesWhileLoop() {
        System.out.println("--- Test: While-style loop behaves like while ---");
        // 条件一开始就不成立时循环体一次也不执行
        assertEquals(List.of("done"), runAndGetLines("x = 0 for (; x > 0; ) do print x end print \"done\""));
        // 每轮结束后重新计算条件
        assertEquals(List.of("1", "2", "4", "8"),
                runAndGetLines("p = 1 for (; p < 10; ) do print p p = p * 2 end"));
    }

    @Test
    void testCounterLoopWithExpressionsAndDefaultStep() {
        System.out.println("--- Test: Counter loop with expression bounds ---");
        assertEquals(List.of("2", "3", "4"), runAndGetLines("a = 2 for i = a to a + 2 do print i end"));
        assertEquals(List.of("10", "7", "4", "1"), runAndGetLines("for i = 10 to 0 by -3 do print i end"));
        assertEquals(List.of("0.5", "1", "1.5"), runAndGetLines("for t = 0.5 to 1.5 by 0.5 do print t end"));
    }

    @Test
    void testBoundsEvaluatedOnce() {
        System.out.println("--- Test: Counter bounds evaluated once ---");
        assertEquals(List.of("1", "2", "3"), runAndGetLines("n = 3 for i = 1 to n do print i n = n + 1 end"));
    }

    @Test
    void testConcatenationRules() {
        System.out.println("--- Test: Concatenation Rules ---");
        assertEquals(List.of("a1", "1a", "3"), runAndGetLines("print \"a\" + 1 print 1 + \"a\" print 1 + 2"));
    }

    @Test
    void testPrintFormatting() {
        System.out.println("--- Test: Print Formatting ---");
        assertEquals(List.of("2.5", "[1, \"b\", [2]]", "verbatim 'text'"),
                runAndGetLines("print 5 / 2 print [1, \"b\", [2]] print \"verbatim 'text'\""));
    }

    @Test
    void testDemoProgram() {
        System.out.println("--- Test: Demo Program ---");
        assertEquals(List.of(
                "Counter (ALGOL/BASIC style):", "1", "3", "5",
                "Iterator:", "Hello World!", "Bonjour World!", "Hola World!",
                "Johnson/C-style semicolon loop:", "0", "1", "2", "3", "4",
                "While-style using semicolons (omit init/step):", "3", "2", "1"
        ), runAndGetLines(DemoScript.SOURCE));
    }

    @Test
    void testUnboundVariableReported() {
        System.out.println("--- Test: Unbound Variable ---");
        ScriptResult result = processor.executeAndGetResult("print y");
        assertFalse(result.isSuccess());
        NameException error = assertInstanceOf(NameException.class, result.error());
        assertEquals("y", error.getName());
        assertTrue(result.error().describe().startsWith("NameError: "));
        assertEquals("", result.output());
    }

    @Test
    void testPartialOutputIsKeptOnFailure() {
        System.out.println("--- Test: Partial Output On Failure ---");
        ScriptResult result = processor.executeAndGetResult("x = 4 print x print x / 0 print 9");
        assertInstanceOf(DivisionByZeroException.class, result.error());
        assertEquals(List.of("4"), result.outputLines());
        assertEquals(Value.number(4), result.variables().get("x"));
    }

    @Test
    void testEmptyStringPrintsAnEmptyLine() {
        System.out.println("--- Test: Empty String Lines ---");
        assertEquals(List.of(""), runAndGetLines("print \"\""));
        assertEquals(List.of("1", ""), runAndGetLines("print 1 print \"\""));
        assertEquals(List.of("", "a", ""), runAndGetLines("print '' print 'a' print ''"));
        assertEquals(List.of(), runAndGetLines("x = 1"));
    }

    @Test
    void testLexAndParseErrorsProduceNoOutput() {
        System.out.println("--- Test: Front End Errors ---");
        ScriptResult lexFailure = processor.executeAndGetResult("print 1 print @");
        assertInstanceOf(LexException.class, lexFailure.error());
        assertEquals("", lexFailure.output());

        ScriptResult parseFailure = processor.executeAndGetResult("print 1 for i = 1 to 3 do print i");
        assertInstanceOf(ParseException.class, parseFailure.error());
        assertEquals("", parseFailure.output());
    }

    @Test
    void testExecuteWritesToStreamAndReturnsEnvironment() {
        System.out.println("--- Test: Execute To Stream ---");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Environment env = processor.execute("for i = 1 to 2 do print i end",
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
        assertEquals("1" + System.lineSeparator() + "2" + System.lineSeparator(),
                buffer.toString(StandardCharsets.UTF_8));
        assertEquals(Value.number(3), env.get("i"));
        assertThrows(NameException.class, () -> processor.execute("print nope", new PrintStream(buffer)));
    }
}
