package org.symbolicsmt.exceptions;

/**
 * 翻译阶段致命错误的基类。抛出时当前调用中止，ConstraintStore 的背景断言不受影响。
 */
public class SymbolicSmtException extends RuntimeException {

    public SymbolicSmtException(String message) {
        super(message);
    }

    public SymbolicSmtException(String message, Throwable cause) {
        super(message, cause);
    }
}
