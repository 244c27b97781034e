package org.csu.jfor.common.exception;

/**
 * @description: 运算符或循环头遇到了不支持的操作数类型
 */
public class TypeException extends JforRuntimeException {

    public TypeException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return "TypeError";
    }
}
