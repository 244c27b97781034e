package org.csu.jfor.common.exception;

/**
 * @description: 求值阶段抛出的错误的父类
 */
public abstract class JforRuntimeException extends JforException {

    protected JforRuntimeException(String message) {
        super(message);
    }
}
