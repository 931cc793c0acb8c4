package org.stianloader.picoversion;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a literal is matched by neither the dotted-decimal nor the decimal version grammar.
 * Parsing never falls back to a default version, so this exception is the only outcome of a bad literal.
 */
public class MalformedVersionLiteralException extends IllegalArgumentException {

    private static final long serialVersionUID = 6130563283410127468L;

    private final int errorIndex;

    @NotNull
    private final String literal;

    public MalformedVersionLiteralException(@NotNull String literal, int errorIndex, @NotNull String reason) {
        this(literal, errorIndex, reason, null);
    }

    public MalformedVersionLiteralException(@NotNull String literal, int errorIndex, @NotNull String reason, @Nullable Throwable cause) {
        super(MalformedVersionLiteralException.describe(literal, errorIndex, reason), cause);
        this.literal = literal;
        this.errorIndex = errorIndex;
    }

    @NotNull
    private static String describe(@NotNull String literal, int errorIndex, @NotNull String reason) {
        if (errorIndex < 0) {
            return "Malformed version literal \"" + literal + "\": " + reason;
        }
        return "Malformed version literal \"" + literal + "\" at index " + errorIndex + ": " + reason;
    }

    /**
     * Obtains the index of the first offending character within {@link #getLiteral()}.
     *
     * @return The index of the offending character, or -1 if the literal is wrong as a whole.
     */
    public int getErrorIndex() {
        return this.errorIndex;
    }

    @NotNull
    public String getLiteral() {
        return this.literal;
    }
}
