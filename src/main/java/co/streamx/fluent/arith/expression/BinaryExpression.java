package co.streamx.fluent.arith.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * Represents an expression that has a binary operator.
 * 
 * 
 */
@Getter
public final class BinaryExpression extends Expression {

	private final Expression first;
	private final Expression second;
	private final List<Expression> operands;

	BinaryExpression(ExpressionType expressionType, @NonNull Expression first, @NonNull Expression second) {
		super(expressionType);

		if (expressionType.isTerminal())
			throw new IllegalArgumentException(expressionType.name());

		this.first = first;
		this.second = second;
		this.operands = Collections.unmodifiableList(Arrays.asList(first, second));
	}

	@Override
	public List<Expression> getOperands() {
		return operands;
	}

	/**
	 * Gets the display symbol of the operator, e.g. {@code +}.
	 */
	public String getSymbol() {
		return getExpressionType().getSymbol();
	}
}
