package org.symbolicsmt.expressions;

import lombok.Getter;
import org.symbolicsmt.core.VariableKind;

import java.util.Objects;

/**
 * 具名符号变量。同一个 ConstraintStore 内，同名变量必须始终具有相同的 {@link VariableKind}。
 * 此类是不可变的。
 */
@Getter
public final class Variable implements Expression {

    private final String name;
    private final VariableKind kind;

    private Variable(String name, VariableKind kind) {
        this.name = Objects.requireNonNull(name, "Variable-构造函数: name 不能为 null");
        this.kind = Objects.requireNonNull(kind, "Variable-构造函数: kind 不能为 null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("变量名不能为空");
        }
    }

    public static Variable of(String name, VariableKind kind) {
        return new Variable(name, kind);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.VARIABLE;
    }

    @Override
    public boolean isBoolean() {
        return kind == VariableKind.BOOL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return name.equals(variable.name) && kind == variable.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind);
    }

    @Override
    public String toString() {
        return name;
    }
}
