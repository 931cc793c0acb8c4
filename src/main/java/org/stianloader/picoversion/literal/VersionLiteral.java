package org.stianloader.picoversion.literal;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoversion.UnsupportedCoercionException;

/**
 * The raw input of the version parser: either a plain number or a piece of text.
 *
 * <p>Both kinds are reduced to the same textual form through {@link #text()} before being classified,
 * so that the behaviour of the parser only depends on the characters of the literal and not on the
 * type it came from. A numeric literal is written in its shortest plain decimal notation, which
 * means that the number {@code 1.10} is seen as the text {@code "1.1"}.
 */
public sealed interface VersionLiteral permits NumericLiteral, TextLiteral {

    /**
     * Converts an arbitrary object into a literal.
     *
     * <p>Accepted are other {@link VersionLiteral} instances, {@link CharSequence CharSequences}
     * as well as the boxed integral and floating point types of the JDK, {@link BigInteger} and
     * {@link BigDecimal}.
     *
     * @param value The value to convert
     * @return The literal corresponding to the value
     * @throws UnsupportedCoercionException If the value is null or of any other type
     */
    @NotNull
    static VersionLiteral coerce(@Nullable Object value) {
        if (value instanceof VersionLiteral) {
            return (VersionLiteral) value;
        } else if (value instanceof CharSequence) {
            return new TextLiteral(value.toString());
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NumericLiteral.of(((Number) value).longValue());
        } else if (value instanceof Double) {
            return NumericLiteral.of(((Double) value).doubleValue());
        } else if (value instanceof Float) {
            // Float#toString keeps the short form (0.96f is "0.96" and not 0.9599999785423279)
            return NumericLiteral.of(new BigDecimal(value.toString()));
        } else if (value instanceof BigInteger) {
            return NumericLiteral.of(new BigDecimal((BigInteger) value));
        } else if (value instanceof BigDecimal) {
            return NumericLiteral.of((BigDecimal) value);
        }
        throw new UnsupportedCoercionException(value == null ? null : value.getClass());
    }

    /**
     * Obtains the characters the parser works on.
     *
     * @return The textual form of the literal
     */
    @NotNull
    String text();
}
