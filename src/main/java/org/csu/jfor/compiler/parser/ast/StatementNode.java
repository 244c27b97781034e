package org.csu.jfor.compiler.parser.ast;

/**
 * 所有语句节点的标记接口。语句执行时只产生副作用 (修改环境或输出)。
 */
public interface StatementNode {
}
