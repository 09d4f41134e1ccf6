package co.streamx.fluent.arith.expression;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * Provides the base class for leaf nodes, which hold a scalar payload and have no operands.
 * 
 * @param <V> payload type.
 * 
 * 
 */

@Getter
public abstract class TerminalExpression<V> extends Expression {

	private final V value;

	TerminalExpression(ExpressionType expressionType, V value) {
		super(expressionType);

		this.value = value;
	}

	@Override
	public final List<Expression> getOperands() {
		return Collections.emptyList();
	}
}
