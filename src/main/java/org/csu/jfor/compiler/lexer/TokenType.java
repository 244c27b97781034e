package org.csu.jfor.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 这是 jfor 语言中所有可能出现的“单词”的分类。
 * 每个种别码都归属于一个粗粒度的 {@link Category}。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    FOR(Category.KEYWORD),      // "for"
    TO(Category.KEYWORD),       // "to"
    BY(Category.KEYWORD),       // "by"
    DO(Category.KEYWORD),       // "do"
    IN(Category.KEYWORD),       // "in"
    END(Category.KEYWORD),      // "end"
    PRINT(Category.KEYWORD),    // "print"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER(Category.IDENTIFIER), // 变量名

    // ---- 常量 (Constants) ----
    NUMBER_CONST(Category.NUMBER),   // 数字常量, e.g., 123 或 1.5
    STRING_CONST(Category.STRING),   // 字符串常量, e.g., "hello"

    // ---- 运算符 (Operators) ----
    PLUS(Category.OPERATOR),          // +
    MINUS(Category.OPERATOR),         // -
    ASTERISK(Category.OPERATOR),      // *
    SLASH(Category.OPERATOR),         // /
    ASSIGN(Category.OPERATOR),        // =
    EQUAL(Category.OPERATOR),         // ==
    NOT_EQUAL(Category.OPERATOR),     // !=
    LESS(Category.OPERATOR),          // <
    LESS_EQUAL(Category.OPERATOR),    // <=
    GREATER(Category.OPERATOR),       // >
    GREATER_EQUAL(Category.OPERATOR), // >=

    // ---- 分隔符 (Delimiters) ----
    LPAREN(Category.PUNCTUATION),     // (
    RPAREN(Category.PUNCTUATION),     // )
    LBRACKET(Category.PUNCTUATION),   // [
    RBRACKET(Category.PUNCTUATION),   // ]
    COMMA(Category.PUNCTUATION),      // ,
    SEMICOLON(Category.PUNCTUATION),  // ;

    // ---- 特殊 Token ----
    EOF(Category.END_OF_INPUT);       // End-Of-File，表示输入流结束

    /**
     * 粗粒度的单词类别。
     */
    public enum Category {
        NUMBER,
        STRING,
        IDENTIFIER,
        KEYWORD,
        OPERATOR,
        PUNCTUATION,
        END_OF_INPUT
    }

    private final Category category;

    TokenType(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
