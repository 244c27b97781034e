package org.csu.jfor.compiler.parser.ast.expression;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: 列表字面量 (e.g., ["Hello", "Bonjour", "Hola"])
 */
public record ListLiteralNode(List<ExpressionNode> elements) implements ExpressionNode {

    public ListLiteralNode {
        elements = List.copyOf(elements);
    }
}
