package co.streamx.fluent.arith.expression;

import static co.streamx.fluent.arith.expression.Expression.number;
import static co.streamx.fluent.arith.expression.Expression.symbol;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class PostorderVisitorTest {

	@Test
	public void testEvaluation() {
		Expression e = number(2).add(number(3).multiply(number(4)));
		assertEquals(14, PostorderVisitor.visit(e, Interpreter.Instance));
	}

	@Test
	public void testSharedNodeIsCombinedOnce() {
		Expression s = number(5).add(number(1));
		Expression e = s.multiply(s);
		Map<Expression, Integer> calls = new IdentityHashMap<>();

		Number result = PostorderVisitor.visit(e, (node, operands, context) -> {
			calls.merge(node, 1, Integer::sum);
			return Interpreter.Instance.combine(node, operands, null);
		});

		assertEquals(36, result);
		assertEquals(Integer.valueOf(1), calls.get(s));
		assertEquals(Integer.valueOf(1), calls.get(e));
		// 5, 1, s, e
		assertEquals(4, calls.size());
	}

	@Test
	public void testEqualButDistinctNodesAreCombinedSeparately() {
		Expression e = number(5).add(1).multiply(number(5).add(1));
		List<Expression> combined = new ArrayList<>();

		PostorderVisitor.visit(e, (node, operands, context) -> combined.add(node));

		assertEquals(7, combined.size());
	}

	@Test
	public void testCallsAreBoundedByDistinctNodes() {
		Expression e = number(1);
		for (int i = 0; i < 60; i++)
			e = e.add(e);

		int[] calls = new int[1];
		Number result = PostorderVisitor.visit(e, (node, operands, context) -> {
			calls[0]++;
			return Interpreter.Instance.combine(node, operands, null);
		});

		assertEquals(1L << 60, result);
		assertEquals(61, calls[0]);
	}

	@Test
	public void testOperandsAreCombinedLeftToRightBeforeParent() {
		Expression e = symbol("x").add(symbol("y")).multiply(symbol("z"));
		List<String> order = new ArrayList<>();

		PostorderVisitor.visit(e, (node, operands, context) -> order.add(node.toString()));

		assertEquals(Arrays.asList("x", "y", "x + y", "z", "(x + y) * z"), order);
	}

	@Test
	public void testOperandResultsArePassedInOrder() {
		Expression e = number(10).subtract(number(4));

		String result = PostorderVisitor.visit(e, (node, operands, context) -> node.getExpressionType().isTerminal()
				? node.toString()
				: operands.get(0) + "|" + operands.get(1));

		assertEquals("10|4", result);
	}

	@Test
	public void testContextIsPassedUnchanged() {
		Object context = new Object();
		Expression e = symbol("a").power(2).divide(symbol("b"));
		int[] calls = new int[1];

		PostorderVisitor.visit(e, (node, operands, ctx) -> {
			assertSame(context, ctx);
			return ++calls[0];
		}, context);

		assertEquals(5, calls[0]);
	}

	@Test
	public void testNullResultsAreMemoized() {
		Expression s = symbol("s").multiply(2);
		Expression e = s.add(s);
		int[] calls = new int[1];

		Object result = e.fold((node, operands, context) -> {
			calls[0]++;
			return null;
		}, null);

		assertNull(result);
		assertEquals(4, calls[0]);
	}

	@Test
	public void testDeepChainDoesNotOverflow() {
		int n = 100_000;
		Expression e = number(1);
		for (int i = 1; i < n; i++)
			e = number(1).add(e);

		assertEquals(n, PostorderVisitor.visit(e, Interpreter.Instance));
	}

	@Test
	public void testDeepLeftChainDoesNotOverflow() {
		int n = 100_000;
		Expression e = number(1);
		for (int i = 1; i < n; i++)
			e = e.add(1);

		assertEquals(n, Interpreter.evaluate(e));
	}

	@Test
	public void testCombinerExceptionPropagates() {
		IllegalStateException failure = new IllegalStateException("boom");
		Expression e = number(1).add(symbol("x")).add(number(2));
		List<Expression> combined = new ArrayList<>();

		try {
			PostorderVisitor.visit(e, (node, operands, context) -> {
				if (node instanceof SymbolExpression)
					throw failure;
				combined.add(node);
				return node;
			});
			fail();
		} catch (IllegalStateException ex) {
			assertSame(failure, ex);
		}

		// only the literal 1 preceded the symbol
		assertEquals(1, combined.size());
	}
}
