package org.symbolicsmt.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.expressions.Expression;

import java.util.Objects;

/**
 * 证明上下文：独占一个 Z3 Context 和一个 Solver。
 * 所有断言、作用域 (push/pop) 和检查都经过此类。
 *
 * <p>不是线程安全的。push/assert/check/pop 序列是对同一个 Solver 的临界区，
 * 需要并发查询时，每个调用方应持有各自的实例。
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private static final String LABEL_PREFIX = "constraint_";

    private final Context context;
    private final Solver solver;
    private final Z3VariableManager varManager;
    private final TermTranslator translator;
    private final SolverOptions options;
    private boolean closed;

    public Z3Oracle() {
        this(SolverOptions.defaults());
    }

    public Z3Oracle(SolverOptions options) {
        this.options = Objects.requireNonNull(options, "SolverOptions cannot be null.");
        this.context = new Context();
        try {
            this.solver = options.hasLogic() ? context.mkSolver(options.getLogic()) : context.mkSolver();
            Params params = context.mkParams();
            params.add("unsat_core", options.isProduceUnsatCores());
            if (options.hasTimeout()) {
                params.add("timeout", options.getTimeoutMillis());
            }
            solver.setParameters(params);
        } catch (RuntimeException e) {
            context.close();
            throw e;
        }
        this.varManager = new Z3VariableManager(context);
        this.translator = new TermTranslator(context, varManager);
        logger.debug("Z3Oracle 初始化完成: {}", options);
    }

    /**
     * 将布尔表达式转换为 Z3 BoolExpr。
     */
    public BoolExpr translate(Expression expr) {
        ensureOpen();
        return translator.lowerBool(expr);
    }

    /**
     * 为第 index 个背景约束 (从 1 开始) 创建追踪标签。
     * 使用 fresh 常量，标签名不会与用户变量冲突。
     */
    public BoolExpr newLabel(int index) {
        ensureOpen();
        return (BoolExpr) context.mkFreshConst(LABEL_PREFIX + index, context.getBoolSort());
    }

    /**
     * 断言 term 并将其与 label 关联，unsat core 通过 label 指出该断言。
     */
    public void assertTracked(BoolExpr term, BoolExpr label) {
        ensureOpen();
        solver.assertAndTrack(term, label);
        logger.debug("断言 Z3 约束 [{}]: {}", label, term);
    }

    /**
     * 断言 term，不追踪，不会出现在 unsat core 中。
     */
    public void assertUntracked(BoolExpr term) {
        ensureOpen();
        solver.add(term);
        logger.debug("断言 Z3 约束: {}", term);
    }

    /**
     * 对当前已断言的状态调用 Z3 check。
     */
    public OracleResult check() {
        ensureOpen();
        Status status = solver.check();
        OracleResult result = OracleResult.fromStatus(status);
        if (result == OracleResult.UNKNOWN) {
            logger.warn("Z3 返回 UNKNOWN: {}", solver.getReasonUnknown());
        }
        return result;
    }

    /**
     * 打开一个新作用域 (push)。返回的 Scope 关闭时执行 pop，应配合 try-with-resources 使用。
     */
    public Scope openScope() {
        ensureOpen();
        solver.push();
        return new Scope(solver.getNumScopes());
    }

    /**
     * 最近一次 UNSAT 检查的 unsat core，元素为此前使用过的标签。
     */
    public BoolExpr[] unsatCoreLabels() {
        ensureOpen();
        return solver.getUnsatCore();
    }

    public int scopeDepth() {
        ensureOpen();
        return solver.getNumScopes();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Z3Oracle 已关闭");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        context.close();
        logger.debug("Z3Oracle 已关闭");
    }

    /**
     * push/pop 配对的作用域守卫。close 恰好执行一次 pop。
     */
    public final class Scope implements AutoCloseable {

        private final int depth;
        private boolean popped;

        private Scope(int depth) {
            this.depth = depth;
        }

        public int getDepth() {
            return depth;
        }

        @Override
        public void close() {
            if (popped) {
                return;
            }
            popped = true;
            if (closed) {
                return;
            }
            if (solver.getNumScopes() != depth) {
                logger.error("Z3Oracle.Scope: 作用域深度不一致，期望 {}，实际 {}", depth, solver.getNumScopes());
                throw new IllegalStateException("作用域深度不一致: 期望 " + depth + "，实际 " + solver.getNumScopes());
            }
            solver.pop();
        }
    }
}
