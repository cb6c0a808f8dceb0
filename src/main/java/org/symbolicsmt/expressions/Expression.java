package org.symbolicsmt.expressions;

/**
 * 符号表达式树的节点。实现类只有 {@link Variable}、{@link Literal} 和 {@link Operation}，
 * 均为不可变对象，翻译器只读地消费它们。
 */
public interface Expression {

    /**
     * 节点种类，用于翻译器中的封闭分派。
     */
    enum NodeType {
        VARIABLE,
        LITERAL,
        OPERATION
    }

    NodeType getNodeType();

    /**
     * 该节点是否表示一个布尔值。
     */
    boolean isBoolean();
}
