package co.streamx.fluent.arith.expression;

import java.util.List;

/**
 * Combines a node with the already computed results of its operands. Supplied to {@link PostorderVisitor}.
 * 
 * @param <R> result type.
 * @param <A> type of the auxiliary context threaded into every call.
 * 
 * 
 */
@FunctionalInterface
public interface Combiner<R, A> {
	/**
	 * Combines the {@code node}.
	 * 
	 * @param node the node being visited.
	 * @param operands results for {@code node.getOperands()}, in the same order.
	 * @param context the auxiliary value given to the visitor, unchanged.
	 * @return result for {@code node}.
	 */
	R combine(Expression node, List<R> operands, A context);
}
