package org.csu.jfor.compiler.parser.ast.statement;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;
import org.csu.jfor.compiler.parser.ast.expression.IdentifierNode;

/**
 * AST 节点: 赋值语句 NAME = EXPR
 */
public record AssignmentStatementNode(IdentifierNode target, ExpressionNode expression) implements StatementNode {
}
