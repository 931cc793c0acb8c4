package org.stianloader.picoversion.literal;

import java.math.BigDecimal;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoversion.MalformedVersionLiteralException;

/**
 * A version literal given as a number.
 *
 * <p>Trailing zeros of the fraction are not part of the literal: a number has no memory of how it was
 * written down. Negative numbers are representable, but will be rejected by the parser.
 *
 * <p>The integer part may have at most {@value #MAX_INTEGER_DIGITS} digits and the fraction at most
 * {@value #MAX_FRACTION_DIGITS} digits. Larger numbers are rejected before they are written out as text.
 */
public record NumericLiteral(@NotNull BigDecimal value) implements VersionLiteral {

    /**
     * Digits of {@link Long#MAX_VALUE}. A 19 digit integer part may still overflow, which is caught by the parser.
     */
    public static final int MAX_INTEGER_DIGITS = 19;
    public static final int MAX_FRACTION_DIGITS = 1024;

    public NumericLiteral {
        Objects.requireNonNull(value, "value may not be null");
        BigDecimal stripped = value.stripTrailingZeros();
        // precision and scale are ints, the difference may not fit
        long integerDigits = (long) stripped.precision() - stripped.scale();
        if (integerDigits > NumericLiteral.MAX_INTEGER_DIGITS) {
            throw new MalformedVersionLiteralException(value.toString(), -1, "Component exceeds the range of a 64-bit integer");
        }
        if (stripped.scale() > NumericLiteral.MAX_FRACTION_DIGITS) {
            throw new MalformedVersionLiteralException(value.toString(), -1, "Fraction has more than " + NumericLiteral.MAX_FRACTION_DIGITS + " digits");
        }
    }

    @NotNull
    public static NumericLiteral of(@NotNull BigDecimal value) {
        return new NumericLiteral(value);
    }

    @NotNull
    public static NumericLiteral of(double value) {
        if (!Double.isFinite(value)) {
            throw new MalformedVersionLiteralException(Double.toString(value), -1, "Number is not finite");
        }
        return new NumericLiteral(BigDecimal.valueOf(value));
    }

    @NotNull
    public static NumericLiteral of(long value) {
        return new NumericLiteral(BigDecimal.valueOf(value));
    }

    @Override
    @NotNull
    public String text() {
        return this.value.stripTrailingZeros().toPlainString();
    }
}
