package com.minicas.ast.expressions;

import com.minicas.ast.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BinaryExpressionTest - 二元表达式测试
 *
 * 测试渲染总是加括号、结构相等、以及子节点不能为null。
 */
@DisplayName("二元表达式测试")
class BinaryExpressionTest {

    private final VariableExpression x = new VariableExpression("x");

    @Test
    @DisplayName("各运算符的渲染格式")
    void testRendering() {
        assertEquals("(x + 1)", new AddExpression(x, new ConstantExpression(1)).toString());
        assertEquals("(x * 1)", new MultiplyExpression(x, new ConstantExpression(1)).toString());
        assertEquals("(x^1)", new PowerExpression(x, new ConstantExpression(1)).toString());
    }

    @Test
    @DisplayName("嵌套表达式不省略括号")
    void testNestedRendering() {
        Expression expr = new AddExpression(
                new MultiplyExpression(new ConstantExpression(2), x),
                new PowerExpression(x, new AddExpression(x, new ConstantExpression(-1)))
        );

        assertEquals("((2 * x) + (x^(x + -1)))", expr.toString());
    }

    @Test
    @DisplayName("结构相等: 同类型同子节点")
    void testStructuralEquality() {
        Expression a = new AddExpression(x, new ConstantExpression(1));
        Expression b = new AddExpression(new VariableExpression("x"), new ConstantExpression(1));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new MultiplyExpression(x, new ConstantExpression(1)));
        assertNotEquals(a, new AddExpression(new ConstantExpression(1), x));
    }

    @Test
    @DisplayName("幂运算的底数和指数")
    void testPowerAccessors() {
        PowerExpression power = new PowerExpression(x, new ConstantExpression(3));

        assertSame(x, power.getBase());
        assertEquals(new ConstantExpression(3), power.getExponent());
        assertEquals(Operator.POWER, power.getOperator());
        assertEquals(Expression.ExpressionType.POWER, power.getType());
    }

    @Test
    @DisplayName("子节点为null时拒绝构造")
    void testNullOperand() {
        assertThrows(NullPointerException.class, () -> new AddExpression(null, x));
        assertThrows(NullPointerException.class, () -> new PowerExpression(x, null));
    }
}
