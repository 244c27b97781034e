package org.csu.jfor.common.exception;

import lombok.Getter;

/**
 * @description: 词法分析阶段的自定义异常 (非法字符、未闭合的字符串)
 */
@Getter
public class LexException extends JforException {
    private final int line;
    private final int column;

    public LexException(String message, int line, int column) {
        super(String.format("Lexical Error at line %d, column %d: %s", line, column, message));
        this.line = line;
        this.column = column;
    }

    @Override
    public String getKind() {
        return "LexError";
    }
}
