package org.csu.jfor.engine.loop;

import org.csu.jfor.common.exception.TypeException;
import org.csu.jfor.common.model.Value;
import org.csu.jfor.compiler.parser.ast.statement.ForIteratorStatementNode;
import org.csu.jfor.engine.Environment;
import org.csu.jfor.engine.ExpressionEvaluator;

import java.util.List;

/**
 * 迭代循环 for v in EXPR。
 * EXPR 只求值一次且必须是列表；每次条件成立时把下一个元素绑定到循环变量。
 */
public class IteratorLoopDriver implements LoopDriver {

    private final ForIteratorStatementNode node;
    private List<Value> elements = List.of();
    private int index = 0;

    public IteratorLoopDriver(ForIteratorStatementNode node) {
        this.node = node;
    }

    @Override
    public void init(Environment env) {
        Value iterable = ExpressionEvaluator.evaluate(node.iterable(), env);
        if (!iterable.isList()) {
            throw new TypeException("Cannot iterate over a " + iterable.describeType() + ", expected a list");
        }
        this.elements = iterable.asList();
        this.index = 0;
    }

    @Override
    public boolean checkCondition(Environment env) {
        if (index >= elements.size()) {
            return false;
        }
        env.set(node.variable().name(), elements.get(index));
        return true;
    }

    @Override
    public void step(Environment env) {
        index++;
    }

    @Override
    public String describe() {
        return "iterator loop over '" + node.variable().name() + "' (" + elements.size() + " elements)";
    }
}
