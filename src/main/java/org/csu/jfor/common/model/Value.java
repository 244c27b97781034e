package org.csu.jfor.common.model;

import org.csu.jfor.common.exception.TypeException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 表示一个运行时的值: 数字、字符串或列表。值一旦创建就不可变。
 * 语言本身不区分整数和小数，数字统一用 double 保存。
 */
public final class Value {
    private final ValueType type;
    private final double number;
    private final String text;
    private final List<Value> elements;

    private Value(ValueType type, double number, String text, List<Value> elements) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.elements = elements;
    }

    public static Value number(double number) {
        return new Value(ValueType.NUMBER, number, null, null);
    }

    public static Value string(String text) {
        return new Value(ValueType.STRING, 0, Objects.requireNonNull(text), null);
    }

    public static Value list(List<Value> elements) {
        return new Value(ValueType.LIST, 0, null, List.copyOf(elements));
    }

    public static Value bool(boolean condition) {
        return number(condition ? 1 : 0);
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isString() {
        return type == ValueType.STRING;
    }

    public boolean isList() {
        return type == ValueType.LIST;
    }

    public double asNumber() {
        if (!isNumber()) {
            throw new TypeException("Expected a number but got " + describeType());
        }
        return number;
    }

    public String asString() {
        if (!isString()) {
            throw new TypeException("Expected a string but got " + describeType());
        }
        return text;
    }

    public List<Value> asList() {
        if (!isList()) {
            throw new TypeException("Expected a list but got " + describeType());
        }
        return elements;
    }

    /**
     * @return 用于错误信息的类型名, e.g. "number"
     */
    public String describeType() {
        return type.name().toLowerCase();
    }

    /**
     * 数字的文本形式: 整数不带小数部分 (3)，其余去掉末尾的 0 (2.5)，不使用科学计数法。
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == 0) {
            return "0";
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * print 语句和字符串拼接使用的文本形式。
     * 字符串原样输出；列表输出为 [e1, e2]，其中字符串元素带引号。
     */
    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> formatNumber(number);
            case STRING -> text;
            case LIST -> elements.stream()
                    .map(Value::toElementString)
                    .collect(Collectors.joining(", ", "[", "]"));
        };
    }

    private String toElementString() {
        if (isString()) {
            return "\"" + text + "\"";
        }
        return toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value other = (Value) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && Objects.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, elements);
    }
}
