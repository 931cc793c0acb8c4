package org.stianloader.picoversion;

import java.util.Comparator;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoversion.literal.VersionLiteral;
import org.stianloader.picoversion.logging.LoggingAdapter;

/**
 * The total order of {@link Version versions}.
 *
 * <p>Components are compared one by one, the shorter version being treated as if it had trailing zero
 * components. If all components are equal, an alpha version is older than a non-alpha version:
 * "1.2.3_4" precedes "1.2.3.4". Whether a version is dotted-decimal or decimal does not matter.
 */
public final class VersionComparator implements Comparator<Version> {

    @NotNull
    public static final VersionComparator INSTANCE = new VersionComparator();

    /**
     * Reads an operand as a version. {@link Version} instances are returned as-is,
     * everything else is converted using {@link VersionLiteral#coerce(Object)} and parsed
     * using {@link Version#parse(VersionLiteral)}.
     *
     * <p>Note that coercion uses the same rules as parsing does. The number 0.96 is therefore
     * read as [0, 960] and is newer than "v0.95.0" and also newer than "v0.96.0".
     *
     * @param operand The operand to coerce
     * @return The operand as a version
     * @throws UnsupportedCoercionException If the operand is neither a version nor a literal
     * @throws MalformedVersionLiteralException If the operand is a literal, but not a valid one
     */
    @NotNull
    public static Version coerce(@Nullable Object operand) {
        if (operand instanceof Version) {
            return (Version) operand;
        }
        VersionLiteral literal = VersionLiteral.coerce(operand);
        LoggingAdapter.getDefaultLogger().debug(VersionComparator.class, "Coercing operand of type {} into a version: \"{}\"", operand.getClass().getName(), literal.text());
        return Version.parse(literal);
    }

    private VersionComparator() {
    }

    @Override
    public int compare(@NotNull Version a, @NotNull Version b) {
        int n = Math.max(a.getComponentCount(), b.getComponentCount());
        for (int i = 0; i < n; i++) {
            long left = i < a.getComponentCount() ? a.getComponent(i) : 0L;
            long right = i < b.getComponentCount() ? b.getComponent(i) : 0L;
            if (left != right) {
                return Long.compare(left, right);
            }
        }

        if (a.isAlpha() == b.isAlpha()) {
            return 0;
        }
        return a.isAlpha() ? -1 : 1;
    }

    public int compareCoercing(@Nullable Object a, @Nullable Object b) {
        return this.compare(VersionComparator.coerce(a), VersionComparator.coerce(b));
    }
}
