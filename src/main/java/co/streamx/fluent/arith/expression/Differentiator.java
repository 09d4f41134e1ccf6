package co.streamx.fluent.arith.expression;

import java.util.List;

import co.streamx.fluent.arith.function.math.BinaryOperator;

/**
 * Differentiates an expression with respect to the symbol named by the context. The derivative is not simplified and
 * shares operand nodes with the original expression.
 * 
 * 
 */
public final class Differentiator implements Combiner<Expression, String> {

	public static final Differentiator Instance = new Differentiator();

	private Differentiator() {
	}

	/**
	 * Produces d{@code e}/d{@code variable}.
	 * 
	 * @throws UnsupportedOperationException if {@code e} raises to a power that is not a number.
	 */
	public static Expression differentiate(Expression e, String variable) {
		return PostorderVisitor.visit(e, Instance, variable);
	}

	@Override
	public Expression combine(Expression node, List<Expression> operands, String variable) {
		switch (node.getExpressionType()) {
		case Number:
			return Expression.number(0);
		case Symbol:
			return Expression.number(((SymbolExpression) node).getName().equals(variable) ? 1 : 0);
		default:
			break;
		}

		BinaryExpression e = (BinaryExpression) node;
		Expression a = e.getFirst();
		Expression b = e.getSecond();
		Expression da = operands.get(0);
		Expression db = operands.get(1);

		switch (e.getExpressionType()) {
		case Add:
			return da.add(db);
		case Subtract:
			return da.subtract(db);
		case Multiply:
			return da.multiply(b).add(a.multiply(db));
		case Divide:
			return da.multiply(b).subtract(a.multiply(db)).divide(b.power(2));
		case Power:
			if (!(b instanceof NumberExpression))
				throw new UnsupportedOperationException("Exponent must be a number: " + b);
			Number n = ((NumberExpression) b).getValue();
			return b.multiply(a.power(BinaryOperator.Subtract.eval(n, 1))).multiply(da);
		default:
			throw new IllegalStateException(e.getExpressionType().name());
		}
	}
}
