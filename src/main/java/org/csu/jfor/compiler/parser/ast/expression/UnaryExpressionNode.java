package org.csu.jfor.compiler.parser.ast.expression;

import org.csu.jfor.compiler.lexer.Token;
import org.csu.jfor.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 一元取负 (e.g., -x)
 */
public record UnaryExpressionNode(Token operator, ExpressionNode operand) implements ExpressionNode {
}
