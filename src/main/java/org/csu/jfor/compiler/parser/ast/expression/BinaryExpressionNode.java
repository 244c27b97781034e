package org.csu.jfor.compiler.parser.ast.expression;

import org.csu.jfor.compiler.lexer.Token;
import org.csu.jfor.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., j < 5, w + " World!")
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        Token operator,
        ExpressionNode right
) implements ExpressionNode {
}
