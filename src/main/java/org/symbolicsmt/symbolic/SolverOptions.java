package org.symbolicsmt.symbolic;

import lombok.Getter;

import java.util.Objects;
import java.util.Properties;

/**
 * 创建 Z3Oracle 时使用的求解器配置。此类是不可变的。
 */
@Getter
public final class SolverOptions {

    public static final String LOGIC_PROPERTY = "symbolicsmt.solver.logic";
    public static final String TIMEOUT_PROPERTY = "symbolicsmt.solver.timeout";

    private static final SolverOptions DEFAULTS = new SolverOptions(null, null, true);

    // null 表示使用 Z3 的通用求解器
    private final String logic;
    // 毫秒；null 表示不限时。超时后 check 返回 UNKNOWN
    private final Integer timeoutMillis;
    private final boolean produceUnsatCores;

    private SolverOptions(String logic, Integer timeoutMillis, boolean produceUnsatCores) {
        this.logic = logic;
        this.timeoutMillis = timeoutMillis;
        this.produceUnsatCores = produceUnsatCores;
    }

    public static SolverOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 从 Properties 读取配置，未出现的键使用默认值。
     * @throws IllegalArgumentException 如果超时不是合法的非负整数。
     */
    public static SolverOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties 不能为 null");
        SolverOptions options = defaults();
        String logic = properties.getProperty(LOGIC_PROPERTY);
        if (logic != null && !logic.isBlank()) {
            options = options.withLogic(logic.trim());
        }
        String timeout = properties.getProperty(TIMEOUT_PROPERTY);
        if (timeout != null && !timeout.isBlank()) {
            try {
                options = options.withTimeoutMillis(Integer.parseInt(timeout.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("非法的超时配置 " + TIMEOUT_PROPERTY + "=" + timeout, e);
            }
        }
        return options;
    }

    public SolverOptions withLogic(String logic) {
        Objects.requireNonNull(logic, "logic 不能为 null");
        return new SolverOptions(logic, timeoutMillis, produceUnsatCores);
    }

    public SolverOptions withTimeoutMillis(int timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("超时必须是非负数: " + timeoutMillis);
        }
        return new SolverOptions(logic, timeoutMillis, produceUnsatCores);
    }

    public SolverOptions withUnsatCores(boolean produceUnsatCores) {
        return new SolverOptions(logic, timeoutMillis, produceUnsatCores);
    }

    public boolean hasLogic() {
        return logic != null;
    }

    public boolean hasTimeout() {
        return timeoutMillis != null;
    }

    @Override
    public String toString() {
        return "SolverOptions{logic=" + (logic == null ? "<default>" : logic)
                + ", timeoutMillis=" + timeoutMillis
                + ", produceUnsatCores=" + produceUnsatCores + "}";
    }
}
