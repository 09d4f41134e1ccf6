package co.streamx.fluent.arith.expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link Combiner} to every node of an expression graph in postorder.
 * <p>
 * The traversal keeps an explicit work stack instead of recursing, so the depth of the expression is bounded by
 * heap, not by the thread stack. Results are memoized by node identity: a node reachable through several parents is
 * combined once and its result reused, so the number of {@link Combiner#combine} calls equals the number of distinct
 * reachable nodes.
 * </p>
 * <p>
 * The input must be acyclic. Graphs built through the {@link Expression} factories always are; a cycle makes the
 * traversal loop forever.
 * </p>
 * <p>
 * The memo table is local to each call; concurrent calls over shared nodes are safe.
 * </p>
 */

public final class PostorderVisitor {

	private PostorderVisitor() {
	}

	/**
	 * Visits {@code root} in postorder with no auxiliary context.
	 * 
	 * @see #visit(Expression, Combiner, Object)
	 */
	public static <R, A> R visit(Expression root, Combiner<R, A> fn) {
		return visit(root, fn, null);
	}

	/**
	 * Visits {@code root} in postorder, applying {@code fn} to each distinct node after all of its operands.
	 * Exceptions thrown by {@code fn} propagate unchanged and abort the traversal.
	 * 
	 * @param <R>     the result type.
	 * @param <A>     the context type.
	 * @param root    the expression to visit.
	 * @param fn      the combining function.
	 * @param context auxiliary value passed unchanged into every call of {@code fn}.
	 * @return the result of {@code fn} for {@code root}.
	 */
	public static <R, A> R visit(Expression root, Combiner<R, A> fn, A context) {
		Map<Expression, R> visited = new IdentityHashMap<>();
		Deque<Expression> stack = new ArrayDeque<>();
		stack.push(root);

		while (!stack.isEmpty()) {
			Expression node = stack.pop();
			if (visited.containsKey(node))
				continue;

			List<Expression> operands = node.getOperands();
			if (isReady(operands, visited)) {
				List<R> results = new ArrayList<>(operands.size());
				for (Expression operand : operands)
					results.add(visited.get(operand));

				visited.put(node, fn.combine(node, results, context));
			} else {
				stack.push(node);
				// reversed, so the leftmost operand is popped first
				for (int i = operands.size() - 1; i >= 0; i--) {
					Expression operand = operands.get(i);
					if (!visited.containsKey(operand))
						stack.push(operand);
				}
			}
		}

		return visited.get(root);
	}

	private static boolean isReady(List<Expression> operands, Map<Expression, ?> visited) {
		for (Expression operand : operands)
			if (!visited.containsKey(operand))
				return false;
		return true;
	}
}
