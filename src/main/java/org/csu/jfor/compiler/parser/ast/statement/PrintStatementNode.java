package org.csu.jfor.compiler.parser.ast.statement;

import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;

/**
 * AST 节点: print EXPR
 */
public record PrintStatementNode(ExpressionNode expression) implements StatementNode {
}
