package co.streamx.fluent.arith.expression;

/**
 * Represents a named symbol. Two symbols with the same name are still distinct nodes.
 * 
 * 
 */

public final class SymbolExpression extends TerminalExpression<String> {

	SymbolExpression(String name) {
		super(ExpressionType.Symbol, name);
	}

	public String getName() {
		return getValue();
	}
}
