package org.stianloader.picoversion.internal;

import org.jetbrains.annotations.NotNull;

/**
 * A literal that passed the grammar checks of the {@link LiteralClassifier}.
 *
 * @param literal The full literal text, including a leading 'v' if present
 * @param form The grammar the literal is read with
 * @param leadingV Whether the literal starts with 'v' or 'V'
 * @param body The literal without the leading 'v'
 * @param alphaIndex The index of the alpha marker within {@link #body()}, or -1
 */
public record ClassifiedLiteral(@NotNull String literal, @NotNull LiteralForm form, boolean leadingV, @NotNull String body, int alphaIndex) {

    public boolean isAlpha() {
        return this.alphaIndex != -1;
    }

    public int toLiteralIndex(int bodyIndex) {
        return this.leadingV ? bodyIndex + 1 : bodyIndex;
    }
}
