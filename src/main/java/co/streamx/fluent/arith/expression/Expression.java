package co.streamx.fluent.arith.expression;

import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * Provides the base class from which the classes that represent expression tree nodes are derived. It also contains
 * static factory methods to create the various node types.
 * <p>
 * Nodes are immutable and compared by identity. The same node may be used as an operand of any number of operators,
 * so an expression is a directed acyclic graph rather than a strict tree.
 * </p>
 * 
 * 
 */

@Getter
public abstract class Expression {

	private final ExpressionType expressionType;

	/**
	 * Constructs a new instance of Expression.
	 * 
	 * @param expressionType The {@link ExpressionType} to set as the node type.
	 */
	Expression(@NonNull ExpressionType expressionType) {
		this.expressionType = expressionType;
	}

	/**
	 * Gets the operands of this node, in order. Empty for terminals, {@code [first, second]} for operators.
	 * 
	 * @return unmodifiable operand list.
	 */
	public abstract List<Expression> getOperands();

	/**
	 * Gets the binding strength of this node, used to decide parenthesization when rendering.
	 */
	public int getPrecedence() {
		return expressionType.getPrecedence();
	}

	/**
	 * Folds this expression bottom-up with {@link PostorderVisitor}.
	 * 
	 * @see PostorderVisitor#visit(Expression, Combiner, Object)
	 */
	public <R, A> R fold(Combiner<R, A> fn, A context) {
		return PostorderVisitor.visit(this, fn, context);
	}

	/**
	 * Creates a {@link NumberExpression}.
	 * 
	 * @param value a {@link Number} payload.
	 * @return a {@link NumberExpression} holding {@code value}.
	 * @throws IllegalArgumentException if {@code value} is not a {@link Number}.
	 */
	public static NumberExpression number(Object value) {
		if (!(value instanceof Number))
			throw new IllegalArgumentException("Number value must be a numeric type: " + describe(value));

		return new NumberExpression((Number) value);
	}

	/**
	 * Creates a {@link SymbolExpression}.
	 * 
	 * @param name a {@link String} payload.
	 * @return a {@link SymbolExpression} named {@code name}.
	 * @throws IllegalArgumentException if {@code name} is not a {@link String}.
	 */
	public static SymbolExpression symbol(Object name) {
		if (!(name instanceof String))
			throw new IllegalArgumentException("Symbol value must be a string: " + describe(name));

		return new SymbolExpression((String) name);
	}

	/**
	 * Creates a {@link BinaryExpression}, given the left and right operands. An operand that is not an
	 * {@link Expression} is wrapped with {@link #number(Object)}.
	 * 
	 * @param expressionType an operator {@link ExpressionType}.
	 * @param left           left operand, an {@link Expression} or a {@link Number}.
	 * @param right          right operand, an {@link Expression} or a {@link Number}.
	 * @return A {@link BinaryExpression} that has the specified node type and operands.
	 * @throws IllegalArgumentException if {@code expressionType} is a terminal type or an operand is neither an
	 *                                  {@link Expression} nor a number.
	 */
	public static BinaryExpression binary(@NonNull ExpressionType expressionType, Object left, Object right) {
		if (expressionType.isTerminal())
			throw new IllegalArgumentException("Not an operator: " + expressionType.name());

		return new BinaryExpression(expressionType, coerce(left), coerce(right));
	}

	public static BinaryExpression add(Object left, Object right) {
		return binary(ExpressionType.Add, left, right);
	}

	public static BinaryExpression subtract(Object left, Object right) {
		return binary(ExpressionType.Subtract, left, right);
	}

	public static BinaryExpression multiply(Object left, Object right) {
		return binary(ExpressionType.Multiply, left, right);
	}

	public static BinaryExpression divide(Object left, Object right) {
		return binary(ExpressionType.Divide, left, right);
	}

	public static BinaryExpression power(Object left, Object right) {
		return binary(ExpressionType.Power, left, right);
	}

	/**
	 * {@code this + other}
	 */
	public BinaryExpression add(Object other) {
		return add(this, other);
	}

	/**
	 * {@code this - other}
	 */
	public BinaryExpression subtract(Object other) {
		return subtract(this, other);
	}

	/**
	 * {@code other - this}
	 */
	public BinaryExpression subtractFrom(Object other) {
		return subtract(other, this);
	}

	/**
	 * {@code this * other}
	 */
	public BinaryExpression multiply(Object other) {
		return multiply(this, other);
	}

	/**
	 * {@code this / other}
	 */
	public BinaryExpression divide(Object other) {
		return divide(this, other);
	}

	/**
	 * {@code other / this}
	 */
	public BinaryExpression divideInto(Object other) {
		return divide(other, this);
	}

	/**
	 * {@code this ^ other}
	 */
	public BinaryExpression power(Object other) {
		return power(this, other);
	}

	/**
	 * {@code other ^ this}
	 */
	public BinaryExpression raise(Object other) {
		return power(other, this);
	}

	private static Expression coerce(Object operand) {
		return operand instanceof Expression ? (Expression) operand : number(operand);
	}

	private static String describe(Object value) {
		return value == null ? "null" : value.getClass().getName() + " " + value;
	}

	/**
	 * Renders this expression in infix form, parenthesizing an operand only when it binds looser than its parent.
	 */
	@Override
	public String toString() {
		return fold(ExpressionPrinter.Infix, null);
	}

	/**
	 * Renders this expression in an unambiguous structural form, e.g. {@code Multiply(Add('x', 'y'), 'z')}.
	 */
	public String toDebugString() {
		return fold(ExpressionPrinter.Debug, null);
	}
}
