package co.streamx.fluent.arith.expression;

import static co.streamx.fluent.arith.expression.Expression.number;
import static co.streamx.fluent.arith.expression.Expression.symbol;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Collections;
import java.util.Map;

import org.junit.Test;

public class DifferentiatorTest {

	private final Expression x = symbol("x");
	private final Expression y = symbol("y");

	private static double valueAt(Expression e, double x) {
		Map<String, Number> symbols = Collections.singletonMap("x", x);
		return Interpreter.evaluate(e, symbols).doubleValue();
	}

	@Test
	public void testTerminals() {
		assertEquals("0", Differentiator.differentiate(number(7), "x").toString());
		assertEquals("1", Differentiator.differentiate(x, "x").toString());
		assertEquals("0", Differentiator.differentiate(y, "x").toString());
	}

	@Test
	public void testSumAndProduct() {
		Expression e = x.multiply(y).add(x);
		assertEquals("Add(Add(Multiply(1, 'y'), Multiply('x', 0)), 1)",
				Differentiator.differentiate(e, "x").toDebugString());
	}

	@Test
	public void testPolynomial() {
		// 3x^2 - 4x + 2
		Expression e = number(3).multiply(x.power(2)).subtract(x.multiply(4)).add(2);
		Expression d = Differentiator.differentiate(e, "x");

		assertEquals(-4.0, valueAt(d, 0), 0.0);
		assertEquals(8.0, valueAt(d, 2), 0.0);
	}

	@Test
	public void testQuotient() {
		// x / (x + 1)
		Expression e = x.divide(x.add(1));
		Expression d = Differentiator.differentiate(e, "x");

		assertEquals(0.25, valueAt(d, 1), 1e-12);
	}

	@Test
	public void testDerivativeSharesOperands() {
		Expression a = x.add(1);
		BinaryExpression e = a.multiply(3);
		BinaryExpression d = (BinaryExpression) Differentiator.differentiate(e, "x");

		// da * 3 + a * d3
		BinaryExpression right = (BinaryExpression) d.getSecond();
		assertSame(a, right.getFirst());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testSymbolicExponentIsUnsupported() {
		Differentiator.differentiate(x.power(y), "x");
	}
}
