package org.symbolicsmt.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symbolicsmt.exceptions.TranslationEscapeException;
import org.symbolicsmt.exceptions.UnsupportedOperatorException;
import org.symbolicsmt.expressions.Expression;
import org.symbolicsmt.expressions.Literal;
import org.symbolicsmt.expressions.Operation;
import org.symbolicsmt.expressions.OperatorKind;
import org.symbolicsmt.expressions.Variable;

import java.util.List;
import java.util.Objects;

/**
 * 将表达式树递归地转换为 Z3 表达式。
 * 先转换所有子节点 (后序)，再按运算符分派到对应的 Z3 构造函数。
 * 变量在第一次遇到时通过 {@link Z3VariableManager} 声明。
 *
 * <p>整数除法沿用 Z3 的 div 语义，这里不做任何修正：欧几里得除法，余数始终非负
 * (除数为正时向下取整，除数为负时向上取整，例如 7 div -2 = -3)；除数为 0 时结果未定义。
 * 如果某个算术运算的操作数中出现实数项 (例如浮点字面量)，整数项会先经 int2real 提升。
 */
public class TermTranslator {

    private static final Logger logger = LoggerFactory.getLogger(TermTranslator.class);

    private final Context ctx;
    private final Z3VariableManager varManager;

    public TermTranslator(Context ctx, Z3VariableManager varManager) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.varManager = Objects.requireNonNull(varManager, "Z3VariableManager cannot be null.");
    }

    /**
     * 将表达式转换为 Z3 表达式。
     * @param expr 表达式树，只读。
     * @return 对应的 Z3 表达式。
     */
    public Expr lower(Expression expr) {
        Objects.requireNonNull(expr, "TermTranslator.lower: 表达式不能为 null");
        Expr result = switch (expr.getNodeType()) {
            case VARIABLE -> varManager.getZ3Var((Variable) expr);
            case LITERAL -> lowerLiteral((Literal) expr);
            case OPERATION -> lowerOperation((Operation) expr);
        };
        logger.debug("TermTranslator.lower: {} => {}", expr, result);
        return result;
    }

    /**
     * 将布尔表达式转换为 Z3 BoolExpr。
     * @throws TranslationEscapeException 如果转换结果不是布尔项。
     */
    public BoolExpr lowerBool(Expression expr) {
        return requireBool(expr, lower(expr));
    }

    private Expr lowerLiteral(Literal literal) {
        return switch (literal.getValueType()) {
            case INT -> ctx.mkInt(literal.toNumeralString());
            case FLOAT -> ctx.mkReal(literal.toNumeralString());
            case BOOL -> ctx.mkBool(literal.isTrue());
        };
    }

    private Expr lowerOperation(Operation operation) {
        OperatorKind operator = operation.getOperator();
        List<Expression> children = operation.getChildren();
        int arity = children.size();
        if (!operator.acceptsArity(arity)) {
            logger.error("TermTranslator: 运算符 {} 不支持 {} 个子节点: {}", operator, arity, operation);
            throw new UnsupportedOperatorException(operator.name(), arity);
        }

        Expr[] terms = new Expr[arity];
        for (int i = 0; i < arity; i++) {
            terms[i] = lower(children.get(i));
        }
        for (int i = 0; i < arity; i++) {
            if (terms[i] == null) {
                Expression child = children.get(i);
                logger.error("TermTranslator: 子表达式 {} 没有被转换", child);
                throw new TranslationEscapeException(child.toString(), kindOf(child), "转换结果为空");
            }
        }

        return switch (operator) {
            case NOT -> ctx.mkNot(requireBool(children.get(0), terms[0]));
            case AND -> ctx.mkAnd(requireBools(children, terms));
            case OR -> ctx.mkOr(requireBools(children, terms));
            case GE -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield ctx.mkGe(args[0], args[1]);
            }
            case LE -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield ctx.mkLe(args[0], args[1]);
            }
            case GT -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield ctx.mkGt(args[0], args[1]);
            }
            case LT -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield ctx.mkLt(args[0], args[1]);
            }
            case EQ -> lowerEquality(children, terms);
            case ADD -> ctx.mkAdd(requireAriths(children, terms));
            case SUB -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield arity == 1 ? ctx.mkUnaryMinus(args[0]) : ctx.mkSub(args);
            }
            case MUL -> ctx.mkMul(requireAriths(children, terms));
            case POW -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield ctx.mkPower(args[0], args[1]);
            }
            case DIV -> {
                ArithExpr[] args = requireAriths(children, terms);
                yield ctx.mkDiv(args[0], args[1]);
            }
        };
    }

    // 两边同为布尔或同为算术
    private Expr lowerEquality(List<Expression> children, Expr[] terms) {
        if (terms[0].isBool() && terms[1].isBool()) {
            return ctx.mkEq(terms[0], terms[1]);
        }
        ArithExpr[] args = requireAriths(children, terms);
        return ctx.mkEq(args[0], args[1]);
    }

    private BoolExpr requireBool(Expression child, Expr term) {
        if (!term.isBool()) {
            logger.error("TermTranslator: {} 期望布尔项，实际为 {}", child, term.getSort());
            throw new TranslationEscapeException(child.toString(), kindOf(child), "期望布尔项，实际 sort 为 " + term.getSort());
        }
        return (BoolExpr) term;
    }

    private BoolExpr[] requireBools(List<Expression> children, Expr[] terms) {
        BoolExpr[] result = new BoolExpr[terms.length];
        for (int i = 0; i < terms.length; i++) {
            result[i] = requireBool(children.get(i), terms[i]);
        }
        return result;
    }

    /**
     * 检查所有操作数都是算术项；只要有一个是实数 sort，就把整数项提升为实数。
     */
    private ArithExpr[] requireAriths(List<Expression> children, Expr[] terms) {
        boolean anyReal = false;
        for (int i = 0; i < terms.length; i++) {
            if (!terms[i].isInt() && !terms[i].isReal()) {
                Expression child = children.get(i);
                logger.error("TermTranslator: {} 期望算术项，实际为 {}", child, terms[i].getSort());
                throw new TranslationEscapeException(child.toString(), kindOf(child), "期望算术项，实际 sort 为 " + terms[i].getSort());
            }
            anyReal |= terms[i].isReal();
        }
        ArithExpr[] result = new ArithExpr[terms.length];
        for (int i = 0; i < terms.length; i++) {
            if (anyReal && terms[i] instanceof IntExpr) {
                result[i] = ctx.mkInt2Real((IntExpr) terms[i]);
            } else {
                result[i] = (ArithExpr) terms[i];
            }
        }
        return result;
    }

    private static String kindOf(Expression expr) {
        return switch (expr.getNodeType()) {
            case VARIABLE -> ((Variable) expr).getKind().getDisplayName();
            case LITERAL -> ((Literal) expr).getValueType().name();
            case OPERATION -> expr.isBoolean() ? "Bool" : "Arithmetic";
        };
    }
}
