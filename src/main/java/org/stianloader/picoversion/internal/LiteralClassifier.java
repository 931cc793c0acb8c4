package org.stianloader.picoversion.internal;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoversion.MalformedVersionLiteralException;
import org.stianloader.picoversion.literal.VersionLiteral;

/**
 * Decides which grammar a literal is read with and rejects everything that fits neither of them.
 *
 * <p>A literal is read as a dotted-decimal version if it starts with 'v' (or 'V') or if it contains
 * at least two dots. Everything else is a decimal number. Both grammars share the same character set:
 * digits, '.', and at most one '_' (the alpha marker) which must sit in the last segment.
 */
public final class LiteralClassifier {

    public static final char ALPHA_MARKER = '_';

    @NotNull
    @Contract(pure = true)
    public static ClassifiedLiteral classify(@NotNull VersionLiteral literal) {
        String text = literal.text();
        if (text.isEmpty()) {
            throw new MalformedVersionLiteralException(text, -1, "Literal is empty");
        }

        boolean leadingV = text.charAt(0) == 'v' || text.charAt(0) == 'V';
        int offset = leadingV ? 1 : 0;
        int dots = 0;
        int alphaIndex = -1;
        boolean digits = false;

        for (int i = offset; i < text.length(); i++) {
            char c = text.charAt(i);
            if (LiteralClassifier.isDigit(c)) {
                digits = true;
            } else if (c == '.') {
                if (alphaIndex != -1) {
                    throw new MalformedVersionLiteralException(text, alphaIndex, "The alpha marker may only appear in the last segment");
                }
                dots++;
            } else if (c == LiteralClassifier.ALPHA_MARKER) {
                if (alphaIndex != -1) {
                    throw new MalformedVersionLiteralException(text, i, "Duplicate alpha marker");
                }
                alphaIndex = i;
            } else if (c == 'v' || c == 'V') {
                throw new MalformedVersionLiteralException(text, i, "The 'v' prefix may only appear at the start of the literal");
            } else {
                throw new MalformedVersionLiteralException(text, i, "Unexpected character '" + c + "'");
            }
        }

        if (!digits) {
            throw new MalformedVersionLiteralException(text, -1, "Literal contains no digits");
        }

        for (int i = offset; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '.' && c != LiteralClassifier.ALPHA_MARKER) {
                continue;
            }
            if (i == offset || !LiteralClassifier.isDigit(text.charAt(i - 1))) {
                throw new MalformedVersionLiteralException(text, i, "'" + c + "' is not preceded by a digit");
            }
            if (i + 1 == text.length() || !LiteralClassifier.isDigit(text.charAt(i + 1))) {
                throw new MalformedVersionLiteralException(text, i, "'" + c + "' is not followed by a digit");
            }
        }

        if (alphaIndex != -1 && dots == 0) {
            // Decimal: must be part of the fraction. Dotted: must follow the last dot.
            throw new MalformedVersionLiteralException(text, alphaIndex, "The alpha marker must follow a '.'");
        }

        LiteralForm form = (leadingV || dots >= 2) ? LiteralForm.DIRECT_DOTTED : LiteralForm.DECIMAL_GROUPED;
        return new ClassifiedLiteral(text, form, leadingV, text.substring(offset), alphaIndex == -1 ? -1 : alphaIndex - offset);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private LiteralClassifier() {
        throw new UnsupportedOperationException();
    }
}
