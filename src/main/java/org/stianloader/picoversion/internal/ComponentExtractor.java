package org.stianloader.picoversion.internal;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoversion.MalformedVersionLiteralException;

/**
 * Turns a {@link ClassifiedLiteral} into its integer components.
 *
 * <p>Dotted literals are split at every '.' and at the alpha marker, each run of digits being one component.
 * Decimal literals are split into the integer part and groups of three fraction digits, where the fraction
 * is padded with zeros on the right until its length is a multiple of three. That way "1.2" becomes
 * [1, 200] and "1.0023" becomes [1, 2, 300].
 */
public final class ComponentExtractor {

    public static final int DECIMAL_GROUP_WIDTH = 3;

    @Contract(pure = true)
    public static long @NotNull[] extract(@NotNull ClassifiedLiteral literal) {
        if (literal.form() == LiteralForm.DIRECT_DOTTED) {
            return ComponentExtractor.extractDotted(literal);
        } else {
            return ComponentExtractor.extractDecimal(literal);
        }
    }

    private static long @NotNull[] extractDecimal(@NotNull ClassifiedLiteral literal) {
        String body = literal.body();
        int dot = body.indexOf('.');
        if (dot == -1) {
            return new long[] {ComponentExtractor.parseComponent(literal, body, 0, body.length())};
        }

        StringBuilder fraction = new StringBuilder(body.length() - dot + ComponentExtractor.DECIMAL_GROUP_WIDTH);
        for (int i = dot + 1; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != LiteralClassifier.ALPHA_MARKER) {
                fraction.append(c);
            }
        }
        while (fraction.length() % ComponentExtractor.DECIMAL_GROUP_WIDTH != 0) {
            fraction.append('0');
        }

        int groups = fraction.length() / ComponentExtractor.DECIMAL_GROUP_WIDTH;
        long[] components = new long[groups + 1];
        components[0] = ComponentExtractor.parseComponent(literal, body, 0, dot);
        for (int i = 0; i < groups; i++) {
            int start = i * ComponentExtractor.DECIMAL_GROUP_WIDTH;
            // At most three digits, cannot overflow
            components[i + 1] = Long.parseLong(fraction, start, start + ComponentExtractor.DECIMAL_GROUP_WIDTH, 10);
        }
        return components;
    }

    private static long @NotNull[] extractDotted(@NotNull ClassifiedLiteral literal) {
        String body = literal.body();
        int count = 1;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '.' || c == LiteralClassifier.ALPHA_MARKER) {
                count++;
            }
        }

        long[] components = new long[count];
        int segmentStart = 0;
        int index = 0;
        for (int i = 0; i <= body.length(); i++) {
            if (i == body.length() || body.charAt(i) == '.' || body.charAt(i) == LiteralClassifier.ALPHA_MARKER) {
                components[index++] = ComponentExtractor.parseComponent(literal, body, segmentStart, i);
                segmentStart = i + 1;
            }
        }
        return components;
    }

    private static long parseComponent(@NotNull ClassifiedLiteral literal, @NotNull String body, int start, int end) {
        try {
            return Long.parseLong(body, start, end, 10);
        } catch (NumberFormatException e) {
            throw new MalformedVersionLiteralException(literal.literal(), literal.toLiteralIndex(start), "Component exceeds the range of a 64-bit integer", e);
        }
    }

    private ComponentExtractor() {
        throw new UnsupportedOperationException();
    }
}
