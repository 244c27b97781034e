package org.csu.jfor.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)，字符串常量不含引号
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    public TokenType.Category category() {
        return type.category();
    }

    /**
     * 用于错误信息中描述该 Token。
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        if (type == TokenType.STRING_CONST) {
            return "\"" + lexeme + "\"";
        }
        return "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-13s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
