package org.symbolicsmt.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symbolicsmt.constraints.ConstraintStore;
import org.symbolicsmt.expressions.Expression;
import org.symbolicsmt.expressions.Literal;
import org.symbolicsmt.expressions.Variable;
import org.symbolicsmt.symbolic.OracleResult;
import org.symbolicsmt.symbolic.SolverOptions;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.symbolicsmt.expressions.Expressions.*;

class QueryEngineTest {

    private final Variable x = intVar("x");
    private final Variable y = intVar("y");

    private static QueryEngine engineOf(Expression... constraints) {
        return new QueryEngine(ConstraintStore.of(constraints));
    }

    @Nested
    @DisplayName("可满足性 (Satisfiability)")
    class SatisfiabilityTests {

        @Test
        @DisplayName("多变量算术表达式按和式求解 (x >= 1, y >= 1)")
        void testMultiVariableArithmetic() {
            QueryEngine engine = engineOf(ge(x, 1), ge(y, 1));
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertEquals(Boolean.FALSE, engine.isSatisfiable(le(add(x, y), literal(0)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(ge(add(x, y), literal(2)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(ge(add(x, y), literal(100)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(eq(sub(x, y), literal(0)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(lt(sub(x, y), literal(0)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(eq(mul(x, y), literal(1)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(le(neg(x), literal(-1))))
                );
            }
        }

        @Test
        @DisplayName("空背景不限制任何变量")
        void testEmptyBackground() {
            QueryEngine engine = engineOf();
            try (ConstraintStore ignored = engine.getStore()) {
                assertEquals(Boolean.TRUE, engine.isSatisfiable(gt(realVar("x"), 100)));
            }
        }

        @Test
        @DisplayName("布尔变量 (背景 [p])")
        void testBooleanVariable() {
            Variable p = boolVar("p");
            Variable q = boolVar("q");
            QueryEngine engine = engineOf(p);
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(p)),
                        () -> assertEquals(Boolean.FALSE, engine.isSatisfiable(not(p))),
                        () -> assertTrue(engine.isProvable(p)),
                        () -> assertTrue(engine.isProvable(or(p, q))),
                        () -> assertFalse(engine.isProvable(q))
                );
            }
        }

        @Test
        @DisplayName("布尔字面量")
        void testBooleanLiterals() {
            QueryEngine engine = engineOf(ge(x, 0));
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(Literal.TRUE)),
                        () -> assertEquals(Boolean.FALSE, engine.isSatisfiable(Literal.FALSE)),
                        () -> assertEquals(OracleResult.UNSAT, engine.checkSatisfiability(Literal.FALSE))
                );
            }
        }

        @Test
        @DisplayName("比较运算与常量 (x >= 0, y >= 0)")
        void testComparisonsAndConstants() {
            Variable rx = realVar("x");
            Variable ry = realVar("y");
            QueryEngine engine = engineOf(ge(rx, 0), ge(ry, 0));
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(eq(rx, 5))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(ge(add(rx, literal(5)), literal(5)))),
                        () -> assertEquals(Boolean.TRUE, engine.isSatisfiable(ge(sub(add(mul(literal(2), rx), mul(literal(3), ry)), literal(1)), literal(0)))),
                        () -> assertEquals(Boolean.FALSE, engine.isSatisfiable(lt(add(rx, ry), literal(0))))
                );
            }
        }
    }

    @Nested
    @DisplayName("无法判定 (Unknown)")
    class UnknownTests {

        @Test
        @DisplayName("超时得到 UNKNOWN 时返回 null，且不可证明 (x^3 + y^3 == z^3)")
        void testUnknownPropagatesAsNull() {
            Variable z = intVar("z");
            SolverOptions options = SolverOptions.defaults().withTimeoutMillis(1);
            try (ConstraintStore store = new ConstraintStore(List.of(gt(x, 1), gt(y, 1), gt(z, 1)), options)) {
                QueryEngine engine = new QueryEngine(store);
                Expression cubes = eq(add(pow(x, literal(3)), pow(y, literal(3))), pow(z, literal(3)));
                assertAll(
                        () -> assertEquals(OracleResult.UNKNOWN, engine.checkSatisfiability(cubes)),
                        () -> assertNull(engine.isSatisfiable(cubes)),
                        () -> assertFalse(engine.isProvable(cubes)),
                        () -> assertSame(cubes, engine.resolve(cubes)),
                        () -> assertEquals(0, store.scopeDepth())
                );
            }
        }
    }

    @Nested
    @DisplayName("可证明性 (Provability)")
    class ProvabilityTests {

        @Test
        @DisplayName("由背景约束推出的结论可证明")
        void testProvable() {
            QueryEngine engine = engineOf(ge(x, 1), ge(y, 1));
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertTrue(engine.isProvable(ge(add(x, y), literal(2)))),
                        () -> assertTrue(engine.isProvable(gt(add(x, y), literal(0)))),
                        () -> assertTrue(engine.isProvable(ge(mul(x, y), literal(1)))),
                        () -> assertFalse(engine.isProvable(ge(x, 2))),
                        () -> assertFalse(engine.isProvable(lt(x, 0)))
                );
            }
        }

        @Test
        @DisplayName("背景约束矛盾时任何表达式都不可证明")
        void testContradictoryBackground() {
            QueryEngine engine = engineOf(gt(x, 5), lt(x, 3));
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertEquals(Boolean.FALSE, engine.isSatisfiable(Literal.TRUE)),
                        () -> assertEquals(Boolean.FALSE, engine.isSatisfiable(ge(x, 0))),
                        () -> assertFalse(engine.isProvable(Literal.TRUE)),
                        () -> assertFalse(engine.isProvable(ge(x, 0))),
                        () -> assertFalse(engine.isProvable(not(ge(x, 0)))),
                        () -> assertSame(engine.getStore().getConstraint(1), engine.resolve(engine.getStore().getConstraint(1)))
                );
            }
        }

        @Test
        @DisplayName("可证明则其否定不可满足")
        void testDuality() {
            QueryEngine engine = engineOf(ge(x, 0), le(x, 3));
            try (ConstraintStore ignored = engine.getStore()) {
                List<Expression> candidates = List.of(ge(x, 0), ge(x, 1), le(x, 3), eq(x, 2),
                        ge(pow(x, literal(2)), literal(0)), le(pow(x, literal(2)), literal(9)));
                for (Expression candidate : candidates) {
                    if (engine.isProvable(candidate)) {
                        assertEquals(Boolean.FALSE, engine.isSatisfiable(not(candidate)), candidate.toString());
                    }
                }
                assertTrue(engine.isProvable(ge(pow(x, literal(2)), literal(0))));
                assertFalse(engine.isProvable(ge(x, 1)));
            }
        }
    }

    @Nested
    @DisplayName("常量化简 (Resolution)")
    class ResolveTests {

        @Test
        @DisplayName("resolve 返回 true、false 或原表达式本身 (x > 5)")
        void testResolve() {
            QueryEngine engine = engineOf(gt(x, 5));
            Expression undecided = gt(x, 10);
            try (ConstraintStore ignored = engine.getStore()) {
                assertAll(
                        () -> assertEquals(Literal.TRUE, engine.resolve(gt(x, 0))),
                        () -> assertEquals(Literal.FALSE, engine.resolve(lt(x, 0))),
                        () -> assertSame(undecided, engine.resolve(undecided))
                );
            }
        }

        @Test
        @DisplayName("常量结果再次 resolve 保持不变")
        void testResolveFixedPoint() {
            QueryEngine engine = engineOf(gt(x, 5));
            try (ConstraintStore ignored = engine.getStore()) {
                Expression t = engine.resolve(gt(x, 0));
                Expression f = engine.resolve(lt(x, 0));
                assertAll(
                        () -> assertEquals(Literal.TRUE, engine.resolve(t)),
                        () -> assertEquals(Literal.FALSE, engine.resolve(f))
                );
            }
        }
    }
}
