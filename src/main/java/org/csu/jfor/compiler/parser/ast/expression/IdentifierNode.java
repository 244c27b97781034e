package org.csu.jfor.compiler.parser.ast.expression;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 变量名。既可以作为表达式读取变量，也可以作为赋值和循环的目标。
 */
public record IdentifierNode(String name) implements ExpressionNode {

    @Override
    public String toString() {
        return "IdentifierNode[" + name + "]";
    }
}
