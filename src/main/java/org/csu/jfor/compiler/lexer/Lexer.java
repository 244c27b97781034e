package org.csu.jfor.compiler.lexer;

import org.csu.jfor.common.exception.LexException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将 jfor 源程序分解为一系列的 Token。
 * 可以通过 {@link #nextToken()} 逐个按需读取，也可以通过 {@link #tokenize()} 一次性读完。
 * 遇到无法识别的字符或未闭合的字符串时抛出 {@link LexException}。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("for", TokenType.FOR);
        keywords.put("to", TokenType.TO);
        keywords.put("by", TokenType.BY);
        keywords.put("do", TokenType.DO);
        keywords.put("in", TokenType.IN);
        keywords.put("end", TokenType.END);
        keywords.put("print", TokenType.PRINT);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * 获取下一个Token。读到 EOF 之后再调用会一直返回 EOF。
     * @return 解析出的下一个Token
     */
    public Token nextToken() {
        skipWhitespaceAndComments();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        // 识别标识符或关键字
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串，单双引号均可，但必须成对
        if (currentChar == '"' || currentChar == '\'') {
            return readString(currentChar);
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '[':
                return consumeAndReturn(TokenType.LBRACKET, "[");
            case ']':
                return consumeAndReturn(TokenType.RBRACKET, "]");
            case '=':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.EQUAL, "==");
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            case '>':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            case '<':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '!':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                throw new LexException("Unexpected character '!' (did you mean '!=')", line, column);
            default:
                throw new LexException("Unexpected character '" + currentChar + "'", line, column);
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 检查是否是关键字，忽略大小写；标识符本身区分大小写
        TokenType type = keywords.getOrDefault(text.toLowerCase(), TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        // 最多一个小数点，且小数点后面必须还有数字
        if (position < input.length() && peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER_CONST, number, line, startCol);
    }

    private Token readString(char quote) {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的引号
        int startPos = position;
        while (position < input.length() && peek() != quote) {
            if (peek() == '\n') {
                line++;
                column = 0;
            }
            advance();
        }
        if (position >= input.length()) {
            throw new LexException("Unterminated string literal", startLine, startCol);
        }
        String text = input.substring(startPos, position);
        advance(); // 跳过结束的引号
        return new Token(TokenType.STRING_CONST, text, startLine, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (ch == '#') {
                // 注释一直持续到行尾，换行符留给下一轮处理
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private Token consumeTwoAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
