package org.symbolicsmt.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.core.VariableKind;
import org.symbolicsmt.exceptions.VariableKindConflictException;
import org.symbolicsmt.expressions.Variable;

import java.util.*;

/**
 * 负责管理变量名到 Z3 常量的映射。
 * 确保同一个 Context 中每个变量名只对应一个 Z3 常量，并在重复声明时检查类型是否一致。
 * BOOL 映射为布尔常量；INTEGER 和 REAL 都映射为整数常量。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 不是线程安全的，与所属的 Z3Oracle 一样只能由单个调用方持有
    private final Map<String, Pair<VariableKind, Expr<?>>> declaredVars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.declaredVars = new LinkedHashMap<>();
    }

    /**
     * 获取指定变量对应的 Z3 常量。
     * 如果变量尚未声明，则会创建并缓存。
     * @param variable 表达式中的变量。
     * @return 对应的 Z3 常量。
     * @throws VariableKindConflictException 如果同名变量此前以不同类型声明过。
     */
    public Expr<?> getZ3Var(Variable variable) {
        return getZ3Var(variable.getName(), variable.getKind());
    }

    /**
     * 按名称和类型获取 Z3 常量。
     * @param name 变量名。
     * @param kind 变量类型。
     * @return 对应的 Z3 常量，同名同类型的两次请求返回同一个符号。
     */
    public Expr<?> getZ3Var(String name, VariableKind kind) {
        Pair<VariableKind, Expr<?>> existing = declaredVars.get(name);
        if (existing != null) {
            if (existing.getLeft() != kind) {
                logger.error("变量 {} 已声明为 {}，现在又以 {} 请求", name, existing.getLeft(), kind);
                throw new VariableKindConflictException(name, existing.getLeft(), kind);
            }
            return existing.getRight();
        }
        Expr<?> z3Var = switch (kind) {
            case BOOL -> ctx.mkBoolConst(name);
            // REAL 也使用整数 sort
            case INTEGER, REAL -> ctx.mkIntConst(name);
        };
        declaredVars.put(name, Pair.of(kind, z3Var));
        logger.info("创建 Z3 变量: {} ({})", name, kind.getDisplayName());
        return z3Var;
    }

    /**
     * 查询变量是否已声明。
     */
    public boolean isDeclared(String name) {
        return declaredVars.containsKey(name);
    }

    /**
     * 返回已声明变量的类型，未声明时返回 empty。
     */
    public Optional<VariableKind> getDeclaredKind(String name) {
        Pair<VariableKind, Expr<?>> existing = declaredVars.get(name);
        return existing == null ? Optional.empty() : Optional.of(existing.getLeft());
    }

    public int size() {
        return declaredVars.size();
    }
}
