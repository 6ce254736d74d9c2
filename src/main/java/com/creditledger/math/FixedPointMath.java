package com.creditledger.math;

import java.math.BigInteger;

/**
 * Integer-only helpers for ratios, percentages and basis-point interest.
 *
 * ROUNDING:
 * =========
 * Every division truncates toward zero. Nothing rounds to nearest.
 *
 * DIVISION BY ZERO:
 * =================
 * A zero denominator is not a fault here. {@link #ratio} treats it as the
 * worst case and returns the full scale (income = 0 means DTI = 100.00%).
 * {@link #ratioOrDefault} lets the caller pick a different value, e.g. a
 * neutral score for a borrower with no loan history.
 *
 * OVERFLOW:
 * =========
 * Ratios and percentages are exact for every long input: an intermediate
 * product that does not fit in 64 bits is carried in a BigInteger, and a
 * quotient beyond the long range saturates at Long.MAX_VALUE / MIN_VALUE.
 * The monthly payment is a money amount, so there an overflow raises
 * {@link ArithmeticException} instead.
 */
public final class FixedPointMath {

    /** Basis points in 100%. */
    public static final long BASIS_POINTS = 10_000L;

    /** 12 months x 10,000 bps: converts an annual bps rate into a per-month fraction. */
    public static final long MONTHLY_BPS_DIVISOR = 120_000L;

    private FixedPointMath() {
    }

    /**
     * {@code numerator * scale / denominator}, truncating.
     * A zero denominator yields {@code scale}.
     */
    public static long ratio(long numerator, long denominator, long scale) {
        return ratioOrDefault(numerator, denominator, scale, scale);
    }

    /**
     * {@code numerator * scale / denominator}, truncating.
     * A zero denominator yields {@code fallback}.
     */
    public static long ratioOrDefault(long numerator, long denominator, long scale, long fallback) {
        if (denominator == 0) {
            return fallback;
        }
        return multiplyDivide(numerator, scale, denominator);
    }

    /**
     * {@code value * numerator / denominator}, truncating.
     * Used for fixed weights like "40% of income" or "95% of the composite".
     */
    public static long percentOf(long value, long numerator, long denominator) {
        if (denominator == 0) {
            throw new IllegalArgumentException("Denominator must not be zero");
        }
        return multiplyDivide(value, numerator, denominator);
    }

    /**
     * {@code a * b / divisor} without an intermediate overflow.
     */
    static long multiplyDivide(long a, long b, long divisor) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
            return low / divisor;
        }
        BigInteger quotient = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(divisor));
        if (quotient.bitLength() < Long.SIZE) {
            return quotient.longValue();
        }
        return quotient.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
    }

    /**
     * Straight-line monthly payment estimate.
     *
     * totalInterest = principal * annualRateBps * months / 120000
     * payment       = (principal + totalInterest) / months
     *
     * Simple interest, no declining-balance compounding. Callers validate
     * {@code months > 0} beforehand.
     */
    public static long amortizedMonthlyPayment(long principal, long annualRateBps, long months) {
        if (months <= 0) {
            throw new IllegalArgumentException("Term must be positive: " + months);
        }
        long totalInterest = Math.multiplyExact(Math.multiplyExact(principal, annualRateBps), months)
                / MONTHLY_BPS_DIVISOR;
        return Math.addExact(principal, totalInterest) / months;
    }
}
