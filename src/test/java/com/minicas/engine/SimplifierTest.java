package com.minicas.engine;

import com.minicas.ast.Expression;
import com.minicas.ast.expressions.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.minicas.ast.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SimplifierTest - 表达式化简器测试
 *
 * 测试化简器的各条规则:
 * - 常量折叠
 * - 加法/乘法的单位元消除
 * - 乘法的零元
 * - 幂运算的边界情况
 * - 单遍化简不保证不动点
 */
@DisplayName("表达式化简器测试")
class SimplifierTest {

    private Simplifier simplifier;
    private VariableExpression x;

    @BeforeEach
    void setUp() {
        simplifier = new Simplifier();
        x = variable("x");
    }

    @Test
    @DisplayName("常量和变量原样返回")
    void testLeaves() {
        ConstantExpression five = constant(5);

        assertSame(five, simplifier.simplify(five));
        assertSame(x, simplifier.simplify(x));
        assertEquals(constant(5), simplifier.simplify(constant(5)));
    }

    @Test
    @DisplayName("常量加法折叠")
    void testFoldAdd() {
        assertEquals(constant(5), simplifier.simplify(add(constant(2), constant(3))));
        assertEquals(constant(2.5), simplifier.simplify(add(constant(2), constant(0.5))));
    }

    @Test
    @DisplayName("加零消除")
    void testAddZero() {
        assertEquals(x, simplifier.simplify(add(x, constant(0))));
        assertEquals(x, simplifier.simplify(add(constant(0), x)));
        assertEquals(x, simplifier.simplify(add(x, constant(0.0))));
    }

    @Test
    @DisplayName("乘一消除")
    void testMultiplyOne() {
        assertEquals(x, simplifier.simplify(mul(x, constant(1))));
        assertEquals(x, simplifier.simplify(mul(constant(1), x)));
    }

    @Test
    @DisplayName("乘零得零")
    void testMultiplyZero() {
        assertEquals(constant(0), simplifier.simplify(mul(x, constant(0))));
        assertEquals(constant(0), simplifier.simplify(mul(constant(0), pow(x, 5))));
    }

    @Test
    @DisplayName("常量乘法折叠")
    void testFoldMultiply() {
        assertEquals(constant(6), simplifier.simplify(mul(2, constant(3))));
        assertEquals(constant(-2), simplifier.simplify(mul(-1, constant(2))));
    }

    @Test
    @DisplayName("零次幂得一,一次幂得底数")
    void testPowerIdentities() {
        assertEquals(constant(1), simplifier.simplify(pow(x, constant(0))));
        assertEquals(x, simplifier.simplify(pow(x, constant(1))));
    }

    @Test
    @DisplayName("0^0 化简为 1")
    void testZeroToTheZero() {
        assertEquals(constant(1), simplifier.simplify(pow(constant(0), constant(0))));
    }

    @Test
    @DisplayName("常量幂折叠")
    void testFoldPower() {
        assertEquals(constant(8), simplifier.simplify(pow(constant(2), constant(3))));
        assertEquals(constant(0.25), simplifier.simplify(pow(constant(2), constant(-2))));
    }

    @Test
    @DisplayName("0 的负数次幂保留为幂运算")
    void testUnfoldablePower() {
        Expression expr = pow(constant(0), constant(-1));

        assertEquals(expr, simplifier.simplify(expr));
        assertEquals("(0^-1)", simplifier.simplify(expr).toString());
    }

    @Test
    @DisplayName("子节点先化简")
    void testChildrenFirst() {
        Expression expr = add(mul(x, add(constant(1), constant(0))), pow(x, add(constant(1), constant(1))));

        assertEquals("(x + (x^2))", simplifier.simplify(expr).toString());
    }

    @Test
    @DisplayName("无法化简时重建相同形状")
    void testRebuildsSameShape() {
        Expression expr = mul(add(x, 1), pow(x, variable("n")));

        Expression result = simplifier.simplify(expr);
        assertEquals(expr, result);
        assertNotSame(expr, result);
    }

    @Test
    @DisplayName("单遍化简: 不合并同类项")
    void testSinglePass() {
        // 3 * (2 * x) 不会被重排为 6 * x
        Expression expr = mul(3, mul(2, x));

        assertEquals("(3 * (2 * x))", simplifier.simplify(expr).toString());
    }

    @Test
    @DisplayName("化简结果再次化简不变")
    void testIdempotentOnReducedForm() {
        Expression reduced = simplifier.simplify(add(mul(3, mul(2, x)), add(constant(1), constant(1))));

        assertEquals(reduced, simplifier.simplify(reduced));
    }

    @Test
    @DisplayName("null 表达式抛出异常")
    void testNullExpression() {
        assertThrows(IllegalArgumentException.class, () -> simplifier.simplify(null));
    }
}
