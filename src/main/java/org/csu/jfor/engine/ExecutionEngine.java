package org.csu.jfor.engine;

import org.csu.jfor.common.config.JforConfig;
import org.csu.jfor.common.model.Value;
import org.csu.jfor.compiler.parser.ast.ProgramNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;
import org.csu.jfor.compiler.parser.ast.statement.*;
import org.csu.jfor.engine.loop.CLikeLoopDriver;
import org.csu.jfor.engine.loop.CounterLoopDriver;
import org.csu.jfor.engine.loop.IteratorLoopDriver;
import org.csu.jfor.engine.loop.LoopDriver;

import java.io.PrintStream;
import java.util.List;

/**
 * 语句执行引擎。
 * 按顺序执行语句，所有语句共享同一个 Environment；遇到第一个错误立即向上抛出。
 */
public class ExecutionEngine {
    private final PrintStream out;
    private final JforConfig config;

    public ExecutionEngine(PrintStream out, JforConfig config) {
        this.out = out;
        this.config = config;
    }

    public ExecutionEngine(PrintStream out) {
        this(out, JforConfig.defaults());
    }

    public void run(ProgramNode program, Environment env) {
        executeAll(program.statements(), env);
    }

    public void execute(StatementNode statement, Environment env) {
        if (statement instanceof AssignmentStatementNode assignment) {
            assign(assignment, env);
            return;
        }
        if (statement instanceof PrintStatementNode print) {
            out.println(ExpressionEvaluator.evaluate(print.expression(), env));
            return;
        }
        if (statement instanceof LoopStatementNode loop) {
            runLoop(buildLoopDriver(loop), loop.body(), env);
            return;
        }
        throw new UnsupportedOperationException("Unsupported statement type: " + statement.getClass().getSimpleName());
    }

    /**
     * 赋值: 先求值右侧，再绑定 (覆盖) 到目标变量。
     */
    public static void assign(AssignmentStatementNode assignment, Environment env) {
        Value value = ExpressionEvaluator.evaluate(assignment.expression(), env);
        env.set(assignment.target().name(), value);
    }

    /**
     * 四种 for 形式都走同一个状态机，区别只在驱动器。
     */
    private void runLoop(LoopDriver driver, List<StatementNode> body, Environment env) {
        driver.init(env);
        config.trace("Entering " + driver.describe());
        int iterations = 0;
        while (driver.checkCondition(env)) {
            executeAll(body, env);
            driver.step(env);
            iterations++;
        }
        config.trace("Leaving " + driver.describe() + " after " + iterations + " iteration(s)");
    }

    private LoopDriver buildLoopDriver(LoopStatementNode loop) {
        if (loop instanceof ForCounterStatementNode counterNode) {
            return new CounterLoopDriver(counterNode);
        }
        if (loop instanceof ForIteratorStatementNode iteratorNode) {
            return new IteratorLoopDriver(iteratorNode);
        }
        if (loop instanceof ForCLikeStatementNode cLikeNode) {
            return new CLikeLoopDriver(cLikeNode);
        }
        throw new UnsupportedOperationException("Unsupported loop type: " + loop.getClass().getSimpleName());
    }

    private void executeAll(List<StatementNode> statements, Environment env) {
        for (StatementNode statement : statements) {
            execute(statement, env);
        }
    }
}
