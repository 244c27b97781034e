package org.csu.jfor.compiler.parser.ast.statement;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;
import org.csu.jfor.compiler.parser.ast.expression.IdentifierNode;

import java.util.List;

/**
 * AST 节点: 计数循环 for i = FROM to TO [by STEP] do ... end
 *
 * @param step 省略 by 子句时为 null，执行时按 1 处理
 */
public record ForCounterStatementNode(
        IdentifierNode variable,
        ExpressionNode from,
        ExpressionNode to,
        ExpressionNode step,
        List<StatementNode> body
) implements LoopStatementNode {

    public ForCounterStatementNode {
        body = List.copyOf(body);
    }
}
