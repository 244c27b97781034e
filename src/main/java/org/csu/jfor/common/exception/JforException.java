package org.csu.jfor.common.exception;

/**
 * @description: 解释器所有错误的公共父类
 *
 * 每一种错误都有一个面向用户的种类名称 (kind)，命令行会以 "kind: message" 的形式输出。
 */
public abstract class JforException extends RuntimeException {

    protected JforException(String message) {
        super(message);
    }

    public abstract String getKind();

    /**
     * @return 形如 "NameError: Name 'y' is not defined" 的描述
     */
    public String describe() {
        return getKind() + ": " + getMessage();
    }
}
