package org.symbolicsmt.exceptions;

import lombok.Getter;
import org.symbolicsmt.core.VariableKind;

/**
 * 同一个 Z3 Context 中，同名变量以两种不同的类型被请求。
 */
@Getter
public class VariableKindConflictException extends SymbolicSmtException {

    private final String variableName;
    private final VariableKind declaredKind;
    private final VariableKind requestedKind;

    public VariableKindConflictException(String variableName, VariableKind declaredKind, VariableKind requestedKind) {
        super("变量 '" + variableName + "' 已声明为 " + declaredKind.getDisplayName()
                + "，不能再以 " + requestedKind.getDisplayName() + " 使用");
        this.variableName = variableName;
        this.declaredKind = declaredKind;
        this.requestedKind = requestedKind;
    }
}
