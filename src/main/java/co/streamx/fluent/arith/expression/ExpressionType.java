package co.streamx.fluent.arith.expression;

import lombok.Getter;

/**
 * Describes the node types of an expression tree.
 * <p>
 * The set is closed: terminals are {@link #Number} and {@link #Symbol}, every other constant is a binary operator
 * carrying its precedence and display symbol.
 * </p>
 * 
 * 
 */

@Getter
public enum ExpressionType {
	/**
	 * A numeric literal.
	 */
	Number(Integer.MAX_VALUE, null),
	/**
	 * A named symbol.
	 */
	Symbol(Integer.MAX_VALUE, null),
	/**
	 * An addition operation, such as a + b.
	 */
	Add(1, "+"),
	/**
	 * A subtraction operation, such as a - b.
	 */
	Subtract(1, "-"),
	/**
	 * A multiplication operation, such as a * b.
	 */
	Multiply(2, "*"),
	/**
	 * A division operation, such as a / b.
	 */
	Divide(2, "/"),
	/**
	 * An exponentiation operation, such as a ^ b.
	 */
	Power(3, "^");

	private final int precedence;
	private final String symbol;

	ExpressionType(int precedence, String symbol) {
		this.precedence = precedence;
		this.symbol = symbol;
	}

	/**
	 * Gets a value indicating whether nodes of this type have no operands.
	 */
	public boolean isTerminal() {
		return symbol == null;
	}
}
