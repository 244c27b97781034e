package org.csu.jfor.common.exception;

public class DivisionByZeroException extends JforRuntimeException {

    public DivisionByZeroException() {
        super("Division by zero");
    }

    @Override
    public String getKind() {
        return "DivisionByZeroError";
    }
}
