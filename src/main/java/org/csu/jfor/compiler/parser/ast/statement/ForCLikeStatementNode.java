package org.csu.jfor.compiler.parser.ast.statement;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * AST 节点: 分号形式的循环 for (init; cond; step) do ... end
 * 三个子句都可以省略 (为 null)。省略 init 和 step 时就是 while 循环。
 */
public record ForCLikeStatementNode(
        AssignmentStatementNode init,
        ExpressionNode condition,
        AssignmentStatementNode step,
        List<StatementNode> body
) implements LoopStatementNode {

    public ForCLikeStatementNode {
        body = List.copyOf(body);
    }

    public boolean isWhileForm() {
        return init == null && step == null;
    }
}
