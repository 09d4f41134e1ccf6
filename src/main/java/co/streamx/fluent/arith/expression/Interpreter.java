package co.streamx.fluent.arith.expression;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import co.streamx.fluent.arith.function.math.BinaryOperator;

/**
 * Evaluates an expression numerically. The context maps symbol names to their values; a symbol missing from it
 * cannot be evaluated.
 * 
 * 
 */

public final class Interpreter implements Combiner<Number, Map<String, ? extends Number>> {

	public static final Interpreter Instance = new Interpreter();

	private Interpreter() {
	}

	/**
	 * Evaluates an expression that contains no symbols.
	 */
	public static Number evaluate(Expression e) {
		return evaluate(e, Collections.emptyMap());
	}

	/**
	 * Evaluates an expression, resolving symbols from {@code symbols}.
	 * 
	 * @throws NoSuchElementException if a symbol has no value in {@code symbols}.
	 */
	public static Number evaluate(Expression e, Map<String, ? extends Number> symbols) {
		return PostorderVisitor.visit(e, Instance, symbols);
	}

	@Override
	public Number combine(Expression node, List<Number> operands, Map<String, ? extends Number> symbols) {
		switch (node.getExpressionType()) {
		case Number:
			return ((NumberExpression) node).getValue();
		case Symbol:
			String name = ((SymbolExpression) node).getName();
			Number value = symbols != null ? symbols.get(name) : null;
			if (value == null)
				throw new NoSuchElementException("Symbol has no value: " + name);
			return value;
		default:
			return BinaryOperator.of(node.getExpressionType()).eval(operands.get(0), operands.get(1));
		}
	}
}
