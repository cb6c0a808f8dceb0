package org.symbolicsmt.constraints; // 放在 constraints 包下

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import org.apache.commons.lang3.tuple.ImmutableTriple;
import org.apache.commons.lang3.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.expressions.Expression;
import org.symbolicsmt.symbolic.OracleResult;
import org.symbolicsmt.symbolic.SolverOptions;
import org.symbolicsmt.symbolic.Z3Oracle;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 背景约束集，语义为所有约束的合取。
 * 构造时把每条约束 (表达式, Z3 项, 追踪标签) 断言进独占的 {@link Z3Oracle}，之后不可增删。
 * 查询只能通过 {@link #speculativeCheck(Expression)}：push、断言、check、pop，
 * 因此任何查询都不会改变背景断言。
 *
 * <p>不是线程安全的。并发查询需要每个线程各自构造一个 ConstraintStore。
 */
public final class ConstraintStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintStore.class);

    // (原始表达式, Z3 项, 标签)，顺序即输入顺序，下标 i 对应第 i+1 条约束
    private final List<Triple<Expression, BoolExpr, BoolExpr>> background;
    private final List<Expression> constraints;
    private final Z3Oracle oracle;

    public ConstraintStore(List<? extends Expression> constraints) {
        this(constraints, SolverOptions.defaults());
    }

    /**
     * 构造约束集，并把所有约束带标签地断言进新的 Z3Oracle。
     * @param constraints 有序的布尔表达式列表，可以为空。
     * @param options 求解器配置。
     * @throws org.symbolicsmt.exceptions.SymbolicSmtException 如果某条约束无法转换。此时 Z3Oracle 已被关闭。
     */
    public ConstraintStore(List<? extends Expression> constraints, SolverOptions options) {
        Objects.requireNonNull(constraints, "Constraints list cannot be null");
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        this.oracle = new Z3Oracle(options);
        List<Triple<Expression, BoolExpr, BoolExpr>> entries = new ArrayList<>(constraints.size());
        try {
            int index = 1;
            for (Expression constraint : this.constraints) {
                Objects.requireNonNull(constraint, "约束不能为 null");
                BoolExpr label = oracle.newLabel(index);
                BoolExpr term = oracle.translate(constraint);
                oracle.assertTracked(term, label);
                entries.add(ImmutableTriple.of(constraint, term, label));
                index++;
            }
        } catch (RuntimeException e) {
            logger.error("ConstraintStore 构造失败，关闭 Z3Oracle: {}", e.getMessage());
            oracle.close();
            throw e;
        }
        this.background = Collections.unmodifiableList(entries);
        logger.info("创建 ConstraintStore，共 {} 条背景约束", background.size());
    }

    public static ConstraintStore of(Expression... constraints) {
        return new ConstraintStore(Arrays.asList(constraints));
    }

    /**
     * 在新作用域中断言 expr 并检查，结束后恢复到调用前的断言状态。
     * 表达式在 push 之前转换，转换失败不会留下未弹出的作用域；
     * check 抛出异常时 pop 也一定执行。
     * @param expr 布尔表达式。
     * @return SAT / UNSAT / UNKNOWN。
     */
    public OracleResult speculativeCheck(Expression expr) {
        Objects.requireNonNull(expr, "表达式不能为 null");
        BoolExpr term = oracle.translate(expr);
        OracleResult result;
        try (Z3Oracle.Scope scope = oracle.openScope()) {
            oracle.assertUntracked(term);
            result = oracle.check();
        }
        logger.debug("ConstraintStore.speculativeCheck: {} 在 {} 条背景约束下为 {}", expr, background.size(), result);
        return result;
    }

    /**
     * 只检查背景约束本身是否可满足。
     */
    public OracleResult checkBackground() {
        OracleResult result = oracle.check();
        logger.debug("ConstraintStore.checkBackground: {}", result);
        return result;
    }

    /**
     * 最近一次 UNSAT 检查返回的 core 标签。
     */
    public BoolExpr[] unsatCoreLabels() {
        return oracle.unsatCoreLabels();
    }

    /**
     * 根据标签查找背景约束的下标。
     * @param label Z3 返回的标签项。
     * @return 从 1 开始的下标；不是本约束集的标签时返回 -1。
     */
    public int indexOfLabel(Expr<?> label) {
        for (int i = 0; i < background.size(); i++) {
            if (background.get(i).getRight().equals(label)) {
                return i + 1;
            }
        }
        return -1;
    }

    /**
     * @return 原始约束表达式的只读视图，按输入顺序。
     */
    public List<Expression> getConstraints() {
        return constraints;
    }

    /**
     * @param index 从 1 开始的下标。
     */
    public Expression getConstraint(int index) {
        if (index < 1 || index > constraints.size()) {
            throw new IndexOutOfBoundsException("约束下标越界: " + index + "，共 " + constraints.size() + " 条");
        }
        return constraints.get(index - 1);
    }

    public int size() {
        return constraints.size();
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    /**
     * 当前 Solver 的作用域深度，查询之间应始终为 0。
     */
    public int scopeDepth() {
        return oracle.scopeDepth();
    }

    public SolverOptions getOptions() {
        return oracle.getOptions();
    }

    @Override
    public void close() {
        oracle.close();
    }

    @Override
    public String toString() {
        return "Constraints:\n" + constraints.stream()
                .map(c -> "  " + c)
                .collect(Collectors.joining(" ∧\n"));
    }
}
