package org.symbolicsmt.expressions;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * 常量节点：整数 (Long / BigInteger)、浮点数 (Double / BigDecimal) 或布尔值。
 * 此类是不可变的。
 */
@Getter
public final class Literal implements Expression {

    /**
     * 字面量的取值类型
     */
    public enum ValueType {
        INT,
        FLOAT,
        BOOL
    }

    public static final Literal TRUE = new Literal(Boolean.TRUE, ValueType.BOOL);
    public static final Literal FALSE = new Literal(Boolean.FALSE, ValueType.BOOL);

    private final Object value;
    private final ValueType valueType;

    private Literal(Object value, ValueType valueType) {
        this.value = value;
        this.valueType = valueType;
    }

    public static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Literal of(long value) {
        return new Literal(value, ValueType.INT);
    }

    public static Literal of(BigInteger value) {
        Objects.requireNonNull(value, "Literal: value 不能为 null");
        return new Literal(value, ValueType.INT);
    }

    public static Literal of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("浮点字面量必须是有限值: " + value);
        }
        return new Literal(BigDecimal.valueOf(value), ValueType.FLOAT);
    }

    public static Literal of(BigDecimal value) {
        Objects.requireNonNull(value, "Literal: value 不能为 null");
        return new Literal(value, ValueType.FLOAT);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.LITERAL;
    }

    @Override
    public boolean isBoolean() {
        return valueType == ValueType.BOOL;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    /**
     * 以 Z3 数值字符串形式返回算术字面量，例如 "42"、"-2.5"。
     */
    public String toNumeralString() {
        return switch (valueType) {
            case INT -> value.toString();
            case FLOAT -> ((BigDecimal) value).toPlainString();
            case BOOL -> throw new IllegalStateException("布尔字面量没有数值形式: " + value);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Literal literal = (Literal) o;
        if (valueType != literal.valueType) {
            return false;
        }
        return switch (valueType) {
            case INT -> new BigInteger(value.toString()).equals(new BigInteger(literal.value.toString()));
            case FLOAT -> ((BigDecimal) value).compareTo((BigDecimal) literal.value) == 0;
            case BOOL -> value.equals(literal.value);
        };
    }

    @Override
    public int hashCode() {
        return switch (valueType) {
            case INT -> Objects.hash(valueType, new BigInteger(value.toString()));
            case FLOAT -> Objects.hash(valueType, ((BigDecimal) value).stripTrailingZeros());
            case BOOL -> Objects.hash(valueType, value);
        };
    }

    @Override
    public String toString() {
        return valueType == ValueType.BOOL ? value.toString() : toNumeralString();
    }
}
