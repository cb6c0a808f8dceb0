package org.symbolicsmt.core; // 放在 core 包下

/**
 * 符号变量的类型。
 * 注意：INTEGER 和 REAL 在 Z3 侧都映射到整数 sort，REAL 的精度只等同于整数理论。
 */
public enum VariableKind {

    BOOL("Bool"),
    INTEGER("Integer"),
    REAL("Real");

    private final String displayName;

    VariableKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
