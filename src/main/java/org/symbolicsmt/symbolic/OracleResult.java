package org.symbolicsmt.symbolic;

import com.microsoft.z3.Status;

/**
 * Z3 检查结果的三值表示。UNKNOWN 是一等结果，不能被当作 false。
 */
public enum OracleResult {
    SAT,
    UNSAT,
    UNKNOWN;

    public static OracleResult fromStatus(Status status) {
        return switch (status) {
            case SATISFIABLE -> SAT;
            case UNSATISFIABLE -> UNSAT;
            case UNKNOWN -> UNKNOWN;
        };
    }

    /**
     * SAT -> true，UNSAT -> false，UNKNOWN -> null。
     */
    public Boolean toBoolean() {
        return switch (this) {
            case SAT -> Boolean.TRUE;
            case UNSAT -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }
}
