package org.symbolicsmt.exceptions;

/**
 * 调用前提不满足，例如在可满足的约束集上请求 unsat core。不重试，直接报告给调用方。
 */
public class PreconditionException extends IllegalStateException {

    public PreconditionException(String message) {
        super(message);
    }
}
