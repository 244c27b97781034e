package org.csu.jfor.compiler.parser;

import org.csu.jfor.common.exception.ParseException;
import org.csu.jfor.compiler.lexer.Token;
import org.csu.jfor.compiler.lexer.TokenType;
import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.ProgramNode;
import org.csu.jfor.compiler.parser.ast.StatementNode;
import org.csu.jfor.compiler.parser.ast.expression.*;
import org.csu.jfor.compiler.parser.ast.statement.*;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 * 表达式按优先级分层: comparison < additive < multiplicative < unary < primary，二元运算均为左结合。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public ProgramNode parse() {
        List<StatementNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(parseStatement());
        }
        consume(TokenType.EOF, "end of input");
        return new ProgramNode(statements);
    }

    private StatementNode parseStatement() {
        if (match(TokenType.PRINT)) {
            return new PrintStatementNode(parseExpression());
        }
        if (match(TokenType.FOR)) {
            return parseForStatement();
        }
        if (check(TokenType.IDENTIFIER)) {
            return parseAssignment();
        }
        throw new ParseException(peek(), "a statement (assignment, 'print' or 'for')");
    }

    private AssignmentStatementNode parseAssignment() {
        IdentifierNode target = new IdentifierNode(consume(TokenType.IDENTIFIER, "variable name").lexeme());
        consume(TokenType.ASSIGN, "'=' after variable name");
        return new AssignmentStatementNode(target, parseExpression());
    }

    /**
     * 三种 for 头部共用一个关键字，只根据 'for' 之后的 Token 做分派:
     * '(' 为分号形式，IDENT '=' 为计数形式，IDENT 'in' 为迭代形式。
     * 新增循环形式时只需要修改这里。
     */
    private StatementNode parseForStatement() {
        if (check(TokenType.LPAREN)) {
            return parseCLikeFor();
        }
        if (check(TokenType.IDENTIFIER)) {
            TokenType following = peekNext().type();
            if (following == TokenType.ASSIGN) {
                return parseCounterFor();
            }
            if (following == TokenType.IN) {
                return parseIteratorFor();
            }
            advance();
            throw new ParseException(peek(), "'=' or 'in' after loop variable");
        }
        throw new ParseException(peek(), "a loop variable or '(' after 'for'");
    }

    private ForCounterStatementNode parseCounterFor() {
        IdentifierNode variable = new IdentifierNode(consume(TokenType.IDENTIFIER, "loop variable").lexeme());
        consume(TokenType.ASSIGN, "'=' after loop variable");
        ExpressionNode from = parseExpression();
        consume(TokenType.TO, "'to' in counter loop header");
        ExpressionNode to = parseExpression();
        ExpressionNode step = null;
        if (match(TokenType.BY)) {
            step = parseExpression();
        }
        return new ForCounterStatementNode(variable, from, to, step, parseLoopBody());
    }

    private ForIteratorStatementNode parseIteratorFor() {
        IdentifierNode variable = new IdentifierNode(consume(TokenType.IDENTIFIER, "loop variable").lexeme());
        consume(TokenType.IN, "'in' after loop variable");
        ExpressionNode iterable = parseExpression();
        return new ForIteratorStatementNode(variable, iterable, parseLoopBody());
    }

    private ForCLikeStatementNode parseCLikeFor() {
        consume(TokenType.LPAREN, "'(' after 'for'");
        AssignmentStatementNode init = null;
        if (!check(TokenType.SEMICOLON)) {
            init = parseAssignment();
        }
        consume(TokenType.SEMICOLON, "';' after loop initializer");
        ExpressionNode condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = parseExpression();
        }
        consume(TokenType.SEMICOLON, "';' after loop condition");
        AssignmentStatementNode step = null;
        if (!check(TokenType.RPAREN)) {
            step = parseAssignment();
        }
        consume(TokenType.RPAREN, "')' after loop step");
        return new ForCLikeStatementNode(init, condition, step, parseLoopBody());
    }

    private List<StatementNode> parseLoopBody() {
        consume(TokenType.DO, "'do' after for header");
        List<StatementNode> body = new ArrayList<>();
        while (!check(TokenType.END)) {
            if (isAtEnd()) {
                throw new ParseException(peek(), "'end' to close the for loop");
            }
            body.add(parseStatement());
        }
        consume(TokenType.END, "'end' to close the for loop");
        return body;
    }

    private ExpressionNode parseExpression() {
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parseAdditive();
        while (match(TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.EQUAL, TokenType.NOT_EQUAL)) {
            Token operator = previous();
            ExpressionNode right = parseAdditive();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseAdditive() {
        ExpressionNode left = parseMultiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExpressionNode right = parseMultiplicative();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseMultiplicative() {
        ExpressionNode left = parseUnary();
        while (match(TokenType.ASTERISK, TokenType.SLASH)) {
            Token operator = previous();
            ExpressionNode right = parseUnary();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (match(TokenType.MINUS)) {
            Token operator = previous();
            return new UnaryExpressionNode(operator, parseUnary());
        }
        return parsePrimaryExpression();
    }

    private ExpressionNode parsePrimaryExpression() {
        if (match(TokenType.NUMBER_CONST, TokenType.STRING_CONST)) {
            return new LiteralNode(previous());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().lexeme());
        }
        if (match(TokenType.LBRACKET)) {
            return parseListLiteral();
        }
        if (match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN, "')' after expression");
            return expr;
        }
        throw new ParseException(peek(), "an expression (a number, a string, a variable, a list or '(')");
    }

    private ListLiteralNode parseListLiteral() {
        List<ExpressionNode> elements = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elements.add(parseExpression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACKET, "']' after list elements");
        return new ListLiteralNode(elements);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (peek().type() == type) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        Token current = peek();
        if (!isAtEnd()) position++;
        return current;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekNext() {
        if (position + 1 >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(position + 1);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
