package org.stianloader.picoversion.literal;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

public record TextLiteral(@NotNull String text) implements VersionLiteral {
    public TextLiteral {
        Objects.requireNonNull(text, "text may not be null");
    }
}
