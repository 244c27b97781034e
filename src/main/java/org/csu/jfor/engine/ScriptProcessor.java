package org.csu.jfor.engine;

import org.csu.jfor.common.config.JforConfig;
import org.csu.jfor.common.exception.JforException;
import org.csu.jfor.compiler.lexer.Lexer;
import org.csu.jfor.compiler.lexer.Token;
import org.csu.jfor.compiler.parser.Parser;
import org.csu.jfor.compiler.parser.ast.ProgramNode;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * @description: 解释器的入口，串起 词法分析 -> 语法分析 -> 执行 三个阶段
 *
 * 每次执行都会创建一个新的 Environment，执行结束后即丢弃。
 */
public class ScriptProcessor {

    private final JforConfig config;

    public ScriptProcessor(JforConfig config) {
        this.config = config;
    }

    public ScriptProcessor() {
        this(JforConfig.defaults());
    }

    /**
     * 只做词法和语法分析。
     */
    public ProgramNode parse(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        config.trace("Lexed " + tokens.size() + " token(s)");
        ProgramNode program = new Parser(tokens).parse();
        config.trace("Parsed " + program.statements().size() + " top-level statement(s)");
        return program;
    }

    /**
     * 执行脚本，print 输出写到 out。第一个错误会直接抛出，之前已经输出的内容保留。
     * @return 执行结束时的环境
     */
    public Environment execute(String source, PrintStream out) {
        ProgramNode program = parse(source);
        Environment env = new Environment();
        new ExecutionEngine(out, config).run(program, env);
        config.trace("Run completed with " + env.size() + " variable(s) bound");
        return env;
    }

    /**
     * 执行脚本并把输出收集到 ScriptResult 中，不会抛出 JforException。
     */
    public ScriptResult executeAndGetResult(String source) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Environment env = new Environment();
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            try {
                ProgramNode program = parse(source);
                new ExecutionEngine(out, config).run(program, env);
            } catch (JforException e) {
                if (config.isTraceEnabled()) {
                    System.err.println("[ERROR] " + e.describe());
                }
                return ScriptResult.failure(buffer.toString(StandardCharsets.UTF_8), e, env.snapshot());
            }
        }
        return ScriptResult.success(buffer.toString(StandardCharsets.UTF_8), env.snapshot());
    }
}
