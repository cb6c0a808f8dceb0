package org.symbolicsmt.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.constraints.ConstraintStore;
import org.symbolicsmt.expressions.Expression;
import org.symbolicsmt.expressions.Expressions;
import org.symbolicsmt.expressions.Literal;
import org.symbolicsmt.symbolic.OracleResult;

import java.util.Objects;

/**
 * 基于 {@link ConstraintStore#speculativeCheck(Expression)} 的三个派生查询：
 * 可满足性、可证明性和常量化简。
 *
 * <p>注意：如果背景约束本身不可满足，任何表达式及其否定都不可满足，
 * 因此 {@link #isProvable(Expression)} 对所有表达式都返回 false (而不是经典逻辑中的"空真")。
 * 调用方如需区分这种情况，应先检查 {@link ConstraintStore#checkBackground()}。
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final ConstraintStore store;

    public QueryEngine(ConstraintStore store) {
        this.store = Objects.requireNonNull(store, "ConstraintStore cannot be null");
    }

    public ConstraintStore getStore() {
        return store;
    }

    /**
     * 检查 expr 与背景约束的合取是否可满足，返回三值结果。
     * 字面量 false 不经过 Z3 直接为 UNSAT；字面量 true 等价于检查背景约束本身。
     */
    public OracleResult checkSatisfiability(Expression expr) {
        Objects.requireNonNull(expr, "表达式不能为 null");
        if (expr instanceof Literal && expr.isBoolean()) {
            Literal literal = (Literal) expr;
            return literal.isTrue() ? store.checkBackground() : OracleResult.UNSAT;
        }
        return store.speculativeCheck(expr);
    }

    /**
     * @return true 可满足，false 不可满足，null 表示 Z3 无法判定。
     */
    public Boolean isSatisfiable(Expression expr) {
        Boolean result = checkSatisfiability(expr).toBoolean();
        logger.debug("QueryEngine.isSatisfiable: {} => {}", expr, result);
        return result;
    }

    /**
     * expr 可满足且 !expr 不可满足时为 true。
     * 任何一步得到 UNKNOWN 都视为不可证明。
     */
    public boolean isProvable(Expression expr) {
        boolean provable = Boolean.TRUE.equals(isSatisfiable(expr))
                && Boolean.FALSE.equals(isSatisfiable(Expressions.not(expr)));
        logger.debug("QueryEngine.isProvable: {} => {}", expr, provable);
        return provable;
    }

    /**
     * 尝试把 expr 化简为布尔常量。
     * @return 可证明时为 {@link Literal#TRUE}，否定可证明时为 {@link Literal#FALSE}，否则原样返回 expr 本身。
     */
    public Expression resolve(Expression expr) {
        if (isProvable(expr)) {
            return Literal.TRUE;
        }
        if (isProvable(Expressions.not(expr))) {
            return Literal.FALSE;
        }
        return expr;
    }
}
