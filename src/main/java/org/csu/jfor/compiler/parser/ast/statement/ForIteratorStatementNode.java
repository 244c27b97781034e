package org.csu.jfor.compiler.parser.ast.statement;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;
import org.csu.jfor.compiler.parser.ast.expression.IdentifierNode;

import java.util.List;

/**
 * AST 节点: 迭代循环 for v in EXPR do ... end
 */
public record ForIteratorStatementNode(
        IdentifierNode variable,
        ExpressionNode iterable,
        List<StatementNode> body
) implements LoopStatementNode {

    public ForIteratorStatementNode {
        body = List.copyOf(body);
    }
}
