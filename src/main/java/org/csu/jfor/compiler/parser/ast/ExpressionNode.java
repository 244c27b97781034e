package org.csu.jfor.compiler.parser.ast;

/**
 * 所有表达式节点的标记接口。表达式求值得到一个值。
 */
public interface ExpressionNode {
}
