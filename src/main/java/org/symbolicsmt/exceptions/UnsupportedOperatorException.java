package org.symbolicsmt.exceptions;

import lombok.Getter;

/**
 * 遇到未实现的运算符或不被支持的子节点个数。
 */
@Getter
public class UnsupportedOperatorException extends SymbolicSmtException {

    private final String operator;
    private final int arity;

    public UnsupportedOperatorException(String operator, int arity) {
        super("不支持的运算符: " + operator + " (arity " + arity + ")");
        this.operator = operator;
        this.arity = arity;
    }
}
