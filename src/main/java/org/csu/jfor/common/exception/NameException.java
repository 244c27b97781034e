package org.csu.jfor.common.exception;

import lombok.Getter;

/**
 * @description: 读取未绑定的变量
 */
@Getter
public class NameException extends JforRuntimeException {
    private final String name;

    public NameException(String name) {
        super("Name '" + name + "' is not defined");
        this.name = name;
    }

    @Override
    public String getKind() {
        return "NameError";
    }
}
