package org.symbolicsmt.expressions;

import org.symbolicsmt.core.VariableKind;

/**
 * 构造表达式树的静态工厂方法。
 */
public final class Expressions {

    private Expressions() {
    }

    public static Variable boolVar(String name) {
        return Variable.of(name, VariableKind.BOOL);
    }

    public static Variable intVar(String name) {
        return Variable.of(name, VariableKind.INTEGER);
    }

    public static Variable realVar(String name) {
        return Variable.of(name, VariableKind.REAL);
    }

    public static Literal literal(long value) {
        return Literal.of(value);
    }

    public static Literal literal(double value) {
        return Literal.of(value);
    }

    public static Literal literal(boolean value) {
        return Literal.of(value);
    }

    // --- 逻辑连接词 ---

    public static Operation not(Expression operand) {
        return Operation.of(OperatorKind.NOT, operand);
    }

    public static Operation and(Expression... operands) {
        return Operation.of(OperatorKind.AND, operands);
    }

    public static Operation or(Expression... operands) {
        return Operation.of(OperatorKind.OR, operands);
    }

    // --- 比较 ---

    public static Operation ge(Expression left, Expression right) {
        return Operation.of(OperatorKind.GE, left, right);
    }

    public static Operation ge(Expression left, long right) {
        return ge(left, Literal.of(right));
    }

    public static Operation le(Expression left, Expression right) {
        return Operation.of(OperatorKind.LE, left, right);
    }

    public static Operation le(Expression left, long right) {
        return le(left, Literal.of(right));
    }

    public static Operation gt(Expression left, Expression right) {
        return Operation.of(OperatorKind.GT, left, right);
    }

    public static Operation gt(Expression left, long right) {
        return gt(left, Literal.of(right));
    }

    public static Operation lt(Expression left, Expression right) {
        return Operation.of(OperatorKind.LT, left, right);
    }

    public static Operation lt(Expression left, long right) {
        return lt(left, Literal.of(right));
    }

    public static Operation eq(Expression left, Expression right) {
        return Operation.of(OperatorKind.EQ, left, right);
    }

    public static Operation eq(Expression left, long right) {
        return eq(left, Literal.of(right));
    }

    // --- 算术 ---

    public static Operation add(Expression... operands) {
        return Operation.of(OperatorKind.ADD, operands);
    }

    public static Operation sub(Expression left, Expression right) {
        return Operation.of(OperatorKind.SUB, left, right);
    }

    public static Operation neg(Expression operand) {
        return Operation.of(OperatorKind.SUB, operand);
    }

    public static Operation mul(Expression... operands) {
        return Operation.of(OperatorKind.MUL, operands);
    }

    public static Operation pow(Expression base, Expression exponent) {
        return Operation.of(OperatorKind.POW, base, exponent);
    }

    public static Operation div(Expression dividend, Expression divisor) {
        return Operation.of(OperatorKind.DIV, dividend, divisor);
    }
}
