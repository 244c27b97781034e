package org.csu.jfor.compiler.parser.ast.statement;

import org.csu.jfor.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * 三种 for 语句的公共接口
 */
public interface LoopStatementNode extends StatementNode {

    List<StatementNode> body();
}
