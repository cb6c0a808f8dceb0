package org.symbolicsmt.query;

import com.microsoft.z3.BoolExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.constraints.ConstraintStore;
import org.symbolicsmt.exceptions.PreconditionException;
import org.symbolicsmt.expressions.Expression;
import org.symbolicsmt.symbolic.OracleResult;

import java.util.*;

/**
 * 从不可满足的背景约束集中提取 unsat core，并映射回从 1 开始的约束下标。
 * core 由 Z3 决定，不保证最小。
 */
public final class UnsatCoreDiagnostic {

    private static final Logger logger = LoggerFactory.getLogger(UnsatCoreDiagnostic.class);

    private UnsatCoreDiagnostic() {
    }

    /**
     * @param store 背景约束集，必须不可满足。
     * @return core 中约束的下标 (从 1 开始)，有序。
     * @throws PreconditionException 如果背景约束可满足或 Z3 无法判定。
     */
    public static SortedSet<Integer> unsatCore(ConstraintStore store) {
        Objects.requireNonNull(store, "ConstraintStore cannot be null");
        OracleResult status = store.checkBackground();
        if (status != OracleResult.UNSAT) {
            logger.error("UnsatCoreDiagnostic: 背景约束检查结果为 {}，无法提取 unsat core", status);
            throw new PreconditionException("core requested on a satisfiable constraint set (background is " + status + ")");
        }
        if (!store.getOptions().isProduceUnsatCores()) {
            throw new PreconditionException("unsat core 未开启: " + store.getOptions());
        }

        SortedSet<Integer> indices = new TreeSet<>();
        for (BoolExpr label : store.unsatCoreLabels()) {
            int index = store.indexOfLabel(label);
            if (index < 0) {
                // 非背景约束的标签不应出现在 core 中
                logger.warn("UnsatCoreDiagnostic: 忽略未知标签 {}", label);
                continue;
            }
            indices.add(index);
        }
        logger.info("UnsatCoreDiagnostic: unsat core = {}", indices);
        return Collections.unmodifiableSortedSet(indices);
    }

    /**
     * @return core 中的原始约束，按下标顺序。
     */
    public static List<Expression> coreConstraints(ConstraintStore store) {
        List<Expression> result = new ArrayList<>();
        for (int index : unsatCore(store)) {
            result.add(store.getConstraint(index));
        }
        return result;
    }
}
