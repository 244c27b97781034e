package org.csu.jfor.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 按顺序排列的顶层语句
 */
public record ProgramNode(List<StatementNode> statements) {

    public ProgramNode {
        statements = List.copyOf(statements);
    }
}
