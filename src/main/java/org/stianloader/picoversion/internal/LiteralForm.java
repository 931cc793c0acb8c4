package org.stianloader.picoversion.internal;

public enum LiteralForm {
    /**
     * Leading 'v' or two and more dots. Every run of digits is a component on its own.
     */
    DIRECT_DOTTED,

    /**
     * A plain number. The fraction is cut into groups of three digits.
     */
    DECIMAL_GROUPED;
}
