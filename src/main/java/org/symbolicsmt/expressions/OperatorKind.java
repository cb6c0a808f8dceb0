package org.symbolicsmt.expressions; // 放在 expressions 包下

/**
 * 表达式树中允许出现的运算符，封闭集合。
 * 每个运算符记录其打印符号以及允许的子节点个数范围 [minArity, maxArity]。
 */
public enum OperatorKind {

    /**
     * 运算符枚举
     */
    NOT("!", 1, 1),
    AND("&", 1, Integer.MAX_VALUE),
    OR("|", 1, Integer.MAX_VALUE),
    GE(">=", 2, 2),   // Greater Equal
    LE("<=", 2, 2),   // Less Equal
    GT(">", 2, 2),    // Greater Than
    LT("<", 2, 2),    // Less Than
    EQ("==", 2, 2),   // Equal
    ADD("+", 1, Integer.MAX_VALUE),
    SUB("-", 1, 2),   // 一元取负或二元减法
    MUL("*", 1, Integer.MAX_VALUE),
    POW("^", 2, 2),
    DIV("/", 2, 2);

    private final String symbol;
    private final int minArity;
    private final int maxArity;

    OperatorKind(String symbol, int minArity, int maxArity) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 检查给定的子节点个数是否被此运算符支持。
     */
    public boolean acceptsArity(int arity) {
        return arity >= minArity && arity <= maxArity;
    }

    /**
     * 结果是否为布尔值 (逻辑连接词或比较)。
     */
    public boolean isBoolean() {
        return switch (this) {
            case NOT, AND, OR, GE, LE, GT, LT, EQ -> true;
            case ADD, SUB, MUL, POW, DIV -> false;
        };
    }
}
