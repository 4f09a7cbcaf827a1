package com.minicas;

import com.minicas.ast.Expression;
import com.minicas.ast.Expressions;
import com.minicas.engine.Differentiator;
import com.minicas.engine.Simplifier;

import java.io.PrintStream;

/**
 * Mini CAS - 主入口
 *
 * 演示符号求导: 构造 f(x) = 3x^2 + 2x + 1,输出原始导数和化简后的导数。
 * 这是学习项目,不要试图在这里添加公式解析之类的功能。
 */
public class MiniCas {

    public static void main(String[] args) {
        run(System.out);
    }

    static void run(PrintStream out) {
        Simplifier simplifier = new Simplifier();
        Differentiator differentiator = new Differentiator(simplifier);

        out.println("Symbolic Differentiation System");
        out.println();
        out.println("-".repeat(60));

        Expression x = Expressions.variable("x");
        Expression f = Expressions.mul(3, x.pow(2))
                .plus(Expressions.mul(2, x))
                .plus(1);

        out.println("Example Polynomial");
        out.println();
        out.println("f(x) = " + f);

        Expression derivative = differentiator.differentiate(f);
        out.println("f'(x) [raw] = " + derivative);
        out.println("f'(x) [simplified] = " + simplifier.simplify(derivative));
    }
}
