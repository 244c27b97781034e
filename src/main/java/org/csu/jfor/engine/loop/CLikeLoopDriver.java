package org.csu.jfor.engine.loop;

import org.csu.jfor.compiler.parser.ast.statement.ForCLikeStatementNode;
import org.csu.jfor.engine.Environment;
import org.csu.jfor.engine.ExecutionEngine;
import org.csu.jfor.engine.ExpressionEvaluator;

/**
 * 分号形式 for (init; cond; step)，省略 init 和 step 时即 while 循环。
 * 省略条件时视为恒真，这样的循环不会自己结束。
 */
public class CLikeLoopDriver implements LoopDriver {

    private final ForCLikeStatementNode node;

    public CLikeLoopDriver(ForCLikeStatementNode node) {
        this.node = node;
    }

    @Override
    public void init(Environment env) {
        if (node.init() != null) {
            ExecutionEngine.assign(node.init(), env);
        }
    }

    @Override
    public boolean checkCondition(Environment env) {
        if (node.condition() == null) {
            return true;
        }
        return ExpressionEvaluator.isTruthy(ExpressionEvaluator.evaluate(node.condition(), env));
    }

    @Override
    public void step(Environment env) {
        if (node.step() != null) {
            ExecutionEngine.assign(node.step(), env);
        }
    }

    @Override
    public String describe() {
        return node.isWhileForm() ? "while-style loop" : "semicolon loop";
    }
}
