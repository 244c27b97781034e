package org.csu.jfor.common.model;

/**
 * 运行时值的类型标签
 */
public enum ValueType {
    NUMBER,
    STRING,
    LIST
}
