package org.symbolicsmt.exceptions;

import lombok.Getter;

/**
 * 子节点没有被翻译成运算符所需的 Z3 项 (例如布尔项出现在算术运算中)。
 * 这表示内部不变式被破坏，不可恢复。
 */
@Getter
public class TranslationEscapeException extends SymbolicSmtException {

    private final String subterm;
    private final String kind;

    public TranslationEscapeException(String subterm, String kind, String reason) {
        super(subterm + " (kind " + kind + ") 没有被转换为合法的 Z3 表达式: " + reason);
        this.subterm = subterm;
        this.kind = kind;
    }
}
