package org.csu.jfor.common.exception;

/**
 * @description: 计数循环的 by 步长为 0
 */
public class InvalidStepException extends JforRuntimeException {

    public InvalidStepException(String variable) {
        super("Step of counter loop over '" + variable + "' cannot be 0");
    }

    @Override
    public String getKind() {
        return "ValueError";
    }
}
