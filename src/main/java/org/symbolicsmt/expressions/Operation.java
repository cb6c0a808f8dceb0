package org.symbolicsmt.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.exceptions.UnsupportedOperatorException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 运算节点：运算符加上有序的子表达式列表。
 * 构造时检查子节点个数是否被运算符支持。此类是不可变的。
 */
@Getter
public final class Operation implements Expression {

    private static final Logger logger = LoggerFactory.getLogger(Operation.class);

    private final OperatorKind operator;
    private final List<Expression> children;
    private final int hashCode;

    private Operation(OperatorKind operator, List<Expression> children) {
        Objects.requireNonNull(operator, "Operation-构造函数: operator 不能为 null");
        Objects.requireNonNull(children, "Operation-构造函数: children 不能为 null");
        if (!operator.acceptsArity(children.size())) {
            logger.error("Operation-构造函数: 运算符 {} 不支持 {} 个子节点", operator, children.size());
            throw new UnsupportedOperatorException(operator.name(), children.size());
        }
        for (Expression child : children) {
            Objects.requireNonNull(child, "Operation-构造函数: 子表达式不能为 null");
        }
        this.operator = operator;
        this.children = List.copyOf(children);
        this.hashCode = Objects.hash(operator, this.children);
    }

    public static Operation of(OperatorKind operator, List<Expression> children) {
        return new Operation(operator, children);
    }

    public static Operation of(OperatorKind operator, Expression... children) {
        return new Operation(operator, Arrays.asList(children));
    }

    public int arity() {
        return children.size();
    }

    public Expression getChild(int index) {
        return children.get(index);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.OPERATION;
    }

    @Override
    public boolean isBoolean() {
        return operator.isBoolean();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Operation that = (Operation) o;
        return operator == that.operator && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (operator == OperatorKind.NOT) {
            return "!(" + children.get(0) + ")";
        }
        if (operator == OperatorKind.SUB && children.size() == 1) {
            return "-" + wrap(children.get(0));
        }
        if (children.size() == 1) {
            return operator.getSymbol() + "(" + children.get(0) + ")";
        }
        String separator = " " + operator.getSymbol() + " ";
        if (operator == OperatorKind.POW) {
            separator = operator.getSymbol();
        }
        return children.stream()
                .map(this::wrap)
                .collect(Collectors.joining(separator));
    }

    // 子节点本身是多元运算时加括号
    private String wrap(Expression child) {
        if (child instanceof Operation && ((Operation) child).arity() > 1) {
            return "(" + child + ")";
        }
        return child.toString();
    }
}
