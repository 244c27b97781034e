package org.csu.jfor.common.exception;

import lombok.Getter;
import org.csu.jfor.compiler.lexer.Token;

/**
 * @description: 语法分析阶段的自定义异常
 */
@Getter
public class ParseException extends JforException {
    private final String expected;
    private final Token found;

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found %s (%s)",
                token.line(),
                token.column(),
                expected,
                token.describe(),
                token.type()));
        this.expected = expected;
        this.found = token;
    }

    public int getLine() {
        return found.line();
    }

    public int getColumn() {
        return found.column();
    }

    @Override
    public String getKind() {
        return "ParseError";
    }
}
