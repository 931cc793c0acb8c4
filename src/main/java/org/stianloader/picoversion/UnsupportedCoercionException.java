package org.stianloader.picoversion;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a comparison operand is neither a {@link Version} nor something that can be
 * read as a version literal.
 */
public class UnsupportedCoercionException extends IllegalArgumentException {

    private static final long serialVersionUID = -2795410866402233519L;

    @Nullable
    private final Class<?> operandType;

    public UnsupportedCoercionException(@Nullable Class<?> operandType) {
        super(operandType == null
                ? "Cannot compare a version with null"
                : "Cannot coerce an instance of " + operandType.getName() + " into a version");
        this.operandType = operandType;
    }

    /**
     * The type of the rejected operand.
     *
     * @return The class of the operand, or null if the operand itself was null.
     */
    @Nullable
    public Class<?> getOperandType() {
        return this.operandType;
    }
}
