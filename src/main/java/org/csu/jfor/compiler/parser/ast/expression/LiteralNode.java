package org.csu.jfor.compiler.parser.ast.expression;

import org.csu.jfor.compiler.lexer.Token;
import org.csu.jfor.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个字面量 (数字或字符串)
 */
public record LiteralNode(Token literal) implements ExpressionNode {
}
