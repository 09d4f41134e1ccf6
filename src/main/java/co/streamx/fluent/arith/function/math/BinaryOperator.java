package co.streamx.fluent.arith.function.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import co.streamx.fluent.arith.expression.ExpressionType;

/**
 * Provides mathematical binary operations implementations.
 * <p>
 * Operands are promoted to the wider of int, long, {@link BigInteger}, double and {@link BigDecimal}. Integer
 * arithmetic is exact: a result that overflows its width is widened instead of wrapping, and results that fit back
 * into an int are returned as {@link Integer}.
 * </p>
 * 
 * 
 */

public enum BinaryOperator {
	/**
	 * a + b operator.
	 */
	Add {
		@Override
		BigInteger apply(BigInteger a, BigInteger b) {
			return a.add(b);
		}

		@Override
		double apply(double a, double b) {
			return a + b;
		}

		@Override
		BigDecimal apply(BigDecimal a, BigDecimal b) {
			return a.add(b);
		}
	},
	/**
	 * a - b operator.
	 */
	Subtract {
		@Override
		BigInteger apply(BigInteger a, BigInteger b) {
			return a.subtract(b);
		}

		@Override
		double apply(double a, double b) {
			return a - b;
		}

		@Override
		BigDecimal apply(BigDecimal a, BigDecimal b) {
			return a.subtract(b);
		}
	},
	/**
	 * a * b operator.
	 */
	Multiply {
		@Override
		BigInteger apply(BigInteger a, BigInteger b) {
			return a.multiply(b);
		}

		@Override
		double apply(double a, double b) {
			return a * b;
		}

		@Override
		BigDecimal apply(BigDecimal a, BigDecimal b) {
			return a.multiply(b);
		}
	},
	/**
	 * a / b operator. Always true division: integral operands produce a {@link Double}.
	 */
	Divide {
		@Override
		public Number eval(Number a, Number b) {
			int rank = rank(a, b);
			if (rank <= BIG_INTEGER && isZero(b))
				throw new ArithmeticException("division by zero");
			if (rank <= DOUBLE)
				return a.doubleValue() / b.doubleValue();

			return apply(toBigDecimal(a), toBigDecimal(b));
		}

		@Override
		BigInteger apply(BigInteger a, BigInteger b) {
			throw new IllegalStateException();
		}

		@Override
		double apply(double a, double b) {
			return a / b;
		}

		@Override
		BigDecimal apply(BigDecimal a, BigDecimal b) {
			if (b.signum() == 0)
				throw new ArithmeticException("division by zero");
			return a.divide(b, MathContext.DECIMAL128);
		}
	},
	/**
	 * a ^ b operator. Exact for integral operands with a non-negative exponent (or a base of 0, 1 or -1), computed in
	 * double otherwise. Zero raised to a negative integral exponent fails like integral division by zero.
	 */
	Power {
		@Override
		public Number eval(Number a, Number b) {
			int rank = rank(a, b);
			if (rank <= BIG_INTEGER) {
				BigInteger base = toBigInteger(a);
				BigInteger exponent = toBigInteger(b);
				if (base.signum() == 0 && exponent.signum() < 0)
					throw new ArithmeticException("division by zero");
				if (exponent.signum() >= 0 || base.abs().equals(BigInteger.ONE))
					return narrow(apply(base, exponent), rank);
			}
			if (rank == BIG_DECIMAL && rank(b) <= BIG_INTEGER && toBigInteger(b).signum() >= 0)
				return apply(toBigDecimal(a), toBigDecimal(b));

			return apply(a.doubleValue(), b.doubleValue());
		}

		@Override
		BigInteger apply(BigInteger a, BigInteger b) {
			if (a.signum() == 0)
				return b.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO;
			if (a.equals(BigInteger.ONE))
				return a;
			if (a.equals(BigInteger.ONE.negate()))
				return b.testBit(0) ? a : BigInteger.ONE;
			return a.pow(b.intValueExact());
		}

		@Override
		double apply(double a, double b) {
			return Math.pow(a, b);
		}

		@Override
		BigDecimal apply(BigDecimal a, BigDecimal b) {
			return a.pow(b.intValueExact(), MathContext.DECIMAL128);
		}
	};

	private static final int INT = 0;
	private static final int LONG = 1;
	private static final int BIG_INTEGER = 2;
	private static final int DOUBLE = 3;
	private static final int BIG_DECIMAL = 4;

	private static final BigInteger MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
	private static final BigInteger MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);
	private static final BigInteger MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

	/**
	 * Evaluates the operator.
	 * 
	 * @param a
	 *            left operand.
	 * @param b
	 *            right operand.
	 * @return operation result.
	 * @throws ArithmeticException on integral division by zero or an unsupported {@link Number} type.
	 */
	public Number eval(Number a, Number b) {
		int rank = rank(a, b);
		switch (rank) {
		case DOUBLE:
			return apply(a.doubleValue(), b.doubleValue());
		case BIG_DECIMAL:
			return apply(toBigDecimal(a), toBigDecimal(b));
		default:
			return narrow(apply(toBigInteger(a), toBigInteger(b)), rank);
		}
	}

	abstract BigInteger apply(BigInteger a, BigInteger b);

	abstract double apply(double a, double b);

	abstract BigDecimal apply(BigDecimal a, BigDecimal b);

	/**
	 * Gets the operator implementing the given operator node type.
	 * 
	 * @param expressionType an operator {@link ExpressionType}.
	 * @return the matching operator.
	 * @throws IllegalArgumentException if {@code expressionType} is a terminal type.
	 */
	public static BinaryOperator of(ExpressionType expressionType) {
		switch (expressionType) {
		case Add:
			return Add;
		case Subtract:
			return Subtract;
		case Multiply:
			return Multiply;
		case Divide:
			return Divide;
		case Power:
			return Power;
		default:
			throw new IllegalArgumentException("Not an operator: " + expressionType.name());
		}
	}

	private static int rank(Number value) {
		if (value instanceof Integer || value instanceof Short || value instanceof Byte)
			return INT;
		if (value instanceof Long)
			return LONG;
		if (value instanceof BigInteger)
			return BIG_INTEGER;
		if (value instanceof Double || value instanceof Float)
			return DOUBLE;
		if (value instanceof BigDecimal)
			return BIG_DECIMAL;

		throw new ArithmeticException(value.getClass().toString());
	}

	// BigDecimal cannot hold NaN or infinity
	private static int rank(Number a, Number b) {
		int rank = Math.max(rank(a), rank(b));
		if (rank == BIG_DECIMAL && !(isFinite(a) && isFinite(b)))
			return DOUBLE;
		return rank;
	}

	private static boolean isFinite(Number value) {
		return !(value instanceof Double || value instanceof Float) || Double.isFinite(value.doubleValue());
	}

	private static Number narrow(BigInteger value, int rank) {
		if (rank <= INT && value.compareTo(MIN_INT) >= 0 && value.compareTo(MAX_INT) <= 0)
			return value.intValue();
		if (rank <= LONG && value.compareTo(MIN_LONG) >= 0 && value.compareTo(MAX_LONG) <= 0)
			return value.longValue();
		return value;
	}

	private static boolean isZero(Number value) {
		return toBigInteger(value).signum() == 0;
	}

	private static BigInteger toBigInteger(Number value) {
		if (value instanceof BigInteger)
			return (BigInteger) value;
		if (value instanceof BigDecimal)
			return ((BigDecimal) value).toBigInteger();
		return BigInteger.valueOf(value.longValue());
	}

	private static BigDecimal toBigDecimal(Number value) {
		if (value instanceof BigDecimal)
			return (BigDecimal) value;
		if (value instanceof BigInteger)
			return new BigDecimal((BigInteger) value);
		if (value instanceof Double || value instanceof Float)
			return BigDecimal.valueOf(value.doubleValue());
		return BigDecimal.valueOf(value.longValue());
	}
}
