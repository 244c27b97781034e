package org.csu.jfor.engine.loop;

import org.csu.jfor.common.exception.InvalidStepException;
import org.csu.jfor.common.exception.TypeException;
import org.csu.jfor.common.model.Value;
import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.statement.ForCounterStatementNode;
import org.csu.jfor.engine.Environment;
import org.csu.jfor.engine.ExpressionEvaluator;

/**
 * 计数循环 for i = FROM to TO [by STEP]。
 * FROM、TO、STEP 只在 init 时求值一次；上界包含在内；STEP 的正负决定比较方向。
 * 循环变量本身就是计数器，每轮结束后从环境中读回并加上 STEP。
 * STEP 为 0 时不会进入死循环，而是在第一轮之前抛出 InvalidStepException。
 */
public class CounterLoopDriver implements LoopDriver {

    private final ForCounterStatementNode node;
    private final String variable;
    private double to;
    private double step;

    public CounterLoopDriver(ForCounterStatementNode node) {
        this.node = node;
        this.variable = node.variable().name();
    }

    /**
     * 求出三个边界并绑定循环变量。
     * @throws InvalidStepException STEP 为 0 时抛出，此时循环变量尚未绑定
     */
    @Override
    public void init(Environment env) {
        double from = evaluateBound(node.from(), "start", env);
        this.to = evaluateBound(node.to(), "end", env);
        this.step = node.step() == null ? 1 : evaluateBound(node.step(), "step", env);
        if (step == 0) {
            throw new InvalidStepException(variable);
        }
        env.set(variable, Value.number(from));
    }

    @Override
    public boolean checkCondition(Environment env) {
        double current = currentValue(env);
        return step > 0 ? current <= to : current >= to;
    }

    @Override
    public void step(Environment env) {
        env.set(variable, Value.number(currentValue(env) + step));
    }

    @Override
    public String describe() {
        return "counter loop over '" + variable + "'";
    }

    private double currentValue(Environment env) {
        Value current = env.get(variable);
        if (!current.isNumber()) {
            throw new TypeException("Counter loop variable '" + variable + "' must stay a number, got " + current.describeType());
        }
        return current.asNumber();
    }

    private double evaluateBound(ExpressionNode expression, String role, Environment env) {
        Value value = ExpressionEvaluator.evaluate(expression, env);
        if (!value.isNumber()) {
            throw new TypeException("Counter loop " + role + " must be a number, got " + value.describeType());
        }
        return value.asNumber();
    }
}
