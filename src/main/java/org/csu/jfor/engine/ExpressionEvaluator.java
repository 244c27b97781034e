package org.csu.jfor.engine;

import org.csu.jfor.common.exception.DivisionByZeroException;
import org.csu.jfor.common.exception.TypeException;
import org.csu.jfor.common.model.Value;
import org.csu.jfor.compiler.lexer.TokenType;
import org.csu.jfor.compiler.parser.ast.ExpressionNode;
import org.csu.jfor.compiler.parser.ast.expression.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式求值器。
 * 除了读取变量之外没有任何副作用。运算符按操作数的类型标签分派，不支持的组合一律抛出 TypeException，不做隐式转换。
 */
public class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static Value evaluate(ExpressionNode expression, Environment env) {
        if (expression instanceof LiteralNode literalNode) {
            return getLiteralValue(literalNode);
        }
        if (expression instanceof IdentifierNode idNode) {
            return env.get(idNode.name());
        }
        if (expression instanceof ListLiteralNode listNode) {
            List<Value> elements = new ArrayList<>(listNode.elements().size());
            for (ExpressionNode element : listNode.elements()) {
                elements.add(evaluate(element, env));
            }
            return Value.list(elements);
        }
        if (expression instanceof UnaryExpressionNode unaryNode) {
            Value operand = evaluate(unaryNode.operand(), env);
            if (!operand.isNumber()) {
                throw new TypeException("Bad operand type for unary '-': " + operand.describeType());
            }
            return Value.number(-operand.asNumber());
        }
        if (expression instanceof BinaryExpressionNode node) {
            Value leftValue = evaluate(node.left(), env);
            Value rightValue = evaluate(node.right(), env);
            return applyBinary(node.operator().type(), node.operator().lexeme(), leftValue, rightValue);
        }
        throw new UnsupportedOperationException("Unsupported expression type: " + expression.getClass().getSimpleName());
    }

    /**
     * 循环条件的真假: 数字 0 为假，其它数字为真，非数字抛出 TypeException。
     */
    public static boolean isTruthy(Value value) {
        if (!value.isNumber()) {
            throw new TypeException("Loop condition must be a number, got " + value.describeType());
        }
        return value.asNumber() != 0;
    }

    private static Value applyBinary(TokenType operator, String symbol, Value left, Value right) {
        return switch (operator) {
            case PLUS -> add(left, right);
            case MINUS, ASTERISK, SLASH -> arithmetic(operator, symbol, left, right);
            case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, EQUAL, NOT_EQUAL -> compare(operator, symbol, left, right);
            default -> throw new UnsupportedOperationException("Unsupported binary operator: " + operator);
        };
    }

    private static Value add(Value left, Value right) {
        if (left.isNumber() && right.isNumber()) {
            return Value.number(left.asNumber() + right.asNumber());
        }
        // 只要有一边是字符串，就把另一边转成文本后拼接
        if (left.isString() || right.isString()) {
            return Value.string(left.toString() + right);
        }
        if (left.isList() && right.isList()) {
            List<Value> joined = new ArrayList<>(left.asList());
            joined.addAll(right.asList());
            return Value.list(joined);
        }
        throw unsupportedOperands("+", left, right);
    }

    private static Value arithmetic(TokenType operator, String symbol, Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) {
            throw unsupportedOperands(symbol, left, right);
        }
        double l = left.asNumber();
        double r = right.asNumber();
        return switch (operator) {
            case MINUS -> Value.number(l - r);
            case ASTERISK -> Value.number(l * r);
            case SLASH -> {
                if (r == 0) {
                    throw new DivisionByZeroException();
                }
                yield Value.number(l / r);
            }
            default -> throw new UnsupportedOperationException("Unsupported arithmetic operator: " + operator);
        };
    }

    private static Value compare(TokenType operator, String symbol, Value left, Value right) {
        int cmp;
        if (left.isNumber() && right.isNumber()) {
            double l = left.asNumber();
            double r = right.asNumber();
            cmp = l < r ? -1 : (l > r ? 1 : 0);
        } else if (left.isString() && right.isString()) {
            cmp = left.asString().compareTo(right.asString());
        } else {
            throw unsupportedOperands(symbol, left, right);
        }
        return Value.bool(switch (operator) {
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
            case GREATER -> cmp > 0;
            case GREATER_EQUAL -> cmp >= 0;
            case LESS -> cmp < 0;
            case LESS_EQUAL -> cmp <= 0;
            default -> throw new UnsupportedOperationException("Unsupported comparison operator: " + operator);
        });
    }

    private static Value getLiteralValue(LiteralNode literalNode) {
        String lexeme = literalNode.literal().lexeme();
        return switch (literalNode.literal().type()) {
            case NUMBER_CONST -> Value.number(Double.parseDouble(lexeme));
            case STRING_CONST -> Value.string(lexeme);
            default -> throw new IllegalStateException("Unsupported literal type in expression: " + literalNode.literal().type());
        };
    }

    private static TypeException unsupportedOperands(String symbol, Value left, Value right) {
        return new TypeException(String.format("Unsupported operand types for '%s': %s and %s",
                symbol, left.describeType(), right.describeType()));
    }
}
