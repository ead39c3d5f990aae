package com.nosota.mloan.service;

import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ValidationException;

import java.math.BigInteger;

/**
 * Integer arithmetic for collateral amounts, values and ratios.
 *
 * <p>Division truncates toward zero. Sums and products that leave the {@code long}
 * range are rejected with {@link ErrorCode#AMOUNT_OVERFLOW}.
 */
public final class CollateralMath {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private CollateralMath() {
    }

    /**
     * Collateral ratio in percent: {@code totalValue * 100 / referenceValue}.
     * Saturates at {@link Long#MAX_VALUE}.
     */
    public static long ratio(long totalValue, long referenceValue) {
        if (referenceValue <= 0) {
            throw new IllegalArgumentException("Reference value must be positive: " + referenceValue);
        }
        BigInteger ratio = BigInteger.valueOf(totalValue).multiply(HUNDRED).divide(BigInteger.valueOf(referenceValue));
        return ratio.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : ratio.longValue();
    }

    /**
     * Value of an amount at a unit price.
     */
    public static long value(long amount, long unitPrice) throws ValidationException {
        try {
            return Math.multiplyExact(amount, unitPrice);
        } catch (ArithmeticException e) {
            throw overflow(amount + " * " + unitPrice);
        }
    }

    public static long add(long left, long right) throws ValidationException {
        try {
            return Math.addExact(left, right);
        } catch (ArithmeticException e) {
            throw overflow(left + " + " + right);
        }
    }

    /**
     * {@code amount * percent / 100}, truncated.
     */
    public static long percentOf(long amount, long percent) throws ValidationException {
        try {
            return Math.multiplyExact(amount, percent) / 100;
        } catch (ArithmeticException e) {
            throw overflow(amount + " * " + percent + "%");
        }
    }

    private static ValidationException overflow(String expression) {
        return new ValidationException(ErrorCode.AMOUNT_OVERFLOW, "Amount out of range: " + expression);
    }
}
