package com.flagship.transaction_engine.amount;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Fixed-point monetary value with four decimal digits of precision.
 *
 * The value is held as a count of 1/10,000th units so all arithmetic is
 * exact integer arithmetic. Overflow throws {@link ArithmeticException}
 * instead of wrapping or clamping.
 *
 * Decimal text is scaled to four digits using round-half-away-from-zero:
 * "1.23455" becomes 1.2346 and "-1.23455" becomes -1.2346.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Amount implements Comparable<Amount> {

    public static final int SCALE = 4;
    public static final Amount ZERO = new Amount(0L);

    // Sign, digits and an optional fraction. No exponents, no separators.
    private static final Pattern DECIMAL_TEXT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)");

    long units;

    public static Amount ofUnits(long units) {
        return units == 0L ? ZERO : new Amount(units);
    }

    /**
     * Parses decimal text such as "2.5" or "-0.0001".
     *
     * @throws AmountFormatException if the text is not a plain decimal number
     *         or does not fit once scaled
     */
    public static Amount fromDecimalText(String text) {
        if (text == null) {
            throw new AmountFormatException("Amount text is missing");
        }
        String trimmed = text.trim();
        if (!DECIMAL_TEXT.matcher(trimmed).matches()) {
            throw new AmountFormatException("Malformed amount: '" + text + "'");
        }
        try {
            BigDecimal scaled = new BigDecimal(trimmed).setScale(SCALE, RoundingMode.HALF_UP);
            return ofUnits(scaled.unscaledValue().longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new AmountFormatException("Amount out of range: '" + text + "'", e);
        }
    }

    public Amount add(Amount other) {
        return ofUnits(Math.addExact(units, other.units));
    }

    public Amount subtract(Amount other) {
        return ofUnits(Math.subtractExact(units, other.units));
    }

    public boolean isNegative() {
        return units < 0;
    }

    public boolean isPositive() {
        return units > 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    /**
     * Renders the value with exactly four fractional digits, e.g. "1.5000" or "-0.2500".
     */
    public String toDecimalText() {
        return BigDecimal.valueOf(units, SCALE).toPlainString();
    }

    @Override
    public int compareTo(Amount other) {
        return Long.compare(units, other.units);
    }

    @Override
    public String toString() {
        return toDecimalText();
    }
}
