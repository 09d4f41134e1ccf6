package co.streamx.fluent.arith.expression;

/**
 * Represents a numeric literal.
 * 
 * 
 */
public final class NumberExpression extends TerminalExpression<Number> {

	NumberExpression(Number value) {
		super(ExpressionType.Number, value);
	}
}
