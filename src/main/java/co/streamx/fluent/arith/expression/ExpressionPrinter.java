package co.streamx.fluent.arith.expression;

import java.util.List;

/**
 * Renders expressions to text. Used by {@link Expression#toString()} and {@link Expression#toDebugString()}.
 * 
 * 
 */
enum ExpressionPrinter implements Combiner<String, Void> {
	/**
	 * Infix form. An operand is parenthesized iff its precedence is strictly lower than its parent's, except that the
	 * left operand of a {@link ExpressionType#Power} is also parenthesized at equal precedence.
	 */
	Infix {
		@Override
		public String combine(Expression node, List<String> operands, Void context) {
			if (node.getExpressionType().isTerminal())
				return String.valueOf(((TerminalExpression<?>) node).getValue());

			BinaryExpression e = (BinaryExpression) node;
			StringBuilder b = new StringBuilder();
			// ^ is right associative
			append(b, e.getFirst(), operands.get(0), e.getPrecedence(), e.getExpressionType() == ExpressionType.Power);
			b.append(' ');
			b.append(e.getSymbol());
			b.append(' ');
			append(b, e.getSecond(), operands.get(1), e.getPrecedence(), false);
			return b.toString();
		}

		private void append(StringBuilder b, Expression operand, String text, int precedence, boolean groupEqual) {
			int operandPrecedence = operand.getPrecedence();
			if (operandPrecedence < precedence || (groupEqual && operandPrecedence == precedence)) {
				b.append('(');
				b.append(text);
				b.append(')');
			} else
				b.append(text);
		}
	},
	/**
	 * Structural form: {@code Kind(first, second)}, symbols quoted.
	 */
	Debug {
		@Override
		public String combine(Expression node, List<String> operands, Void context) {
			switch (node.getExpressionType()) {
			case Number:
				return String.valueOf(((NumberExpression) node).getValue());
			case Symbol:
				return "'" + ((SymbolExpression) node).getName() + "'";
			default:
				return node.getExpressionType().name() + '(' + operands.get(0) + ", " + operands.get(1) + ')';
			}
		}
	};
}
