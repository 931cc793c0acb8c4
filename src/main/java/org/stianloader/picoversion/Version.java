package org.stianloader.picoversion;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoversion.internal.ClassifiedLiteral;
import org.stianloader.picoversion.internal.ComponentExtractor;
import org.stianloader.picoversion.internal.LiteralClassifier;
import org.stianloader.picoversion.internal.LiteralForm;
import org.stianloader.picoversion.internal.VersionFormatter;
import org.stianloader.picoversion.literal.NumericLiteral;
import org.stianloader.picoversion.literal.TextLiteral;
import org.stianloader.picoversion.literal.VersionLiteral;
import org.stianloader.picoversion.logging.LoggingAdapter;

/**
 * A version that was written either as a decimal number ("1.002003") or as a dotted-decimal
 * identifier ("v1.2.3"). Both notations are mapped onto the same list of integer components,
 * so that versions can be compared regardless of how they were written.
 *
 * <p>A decimal number is read by cutting its fraction into groups of three digits, after padding
 * it with zeros. "1.2" is therefore [1, 200] and not [1, 2]; the dotted-decimal equivalent of "1.2" is
 * "v1.200.0". A dotted-decimal identifier is read as-is: "v1.2" is [1, 2].
 *
 * <p>An underscore in the last segment of a literal marks an alpha (pre-release) version. The marker
 * is not a component of its own in the decimal notation ("1.002_003" is [1, 2, 3]) while it acts as a
 * separator in the dotted-decimal notation ("v1.2_3" is [1, 2, 3] as well). Alpha versions sort
 * before the equivalent version without the marker.
 *
 * <p>Instances are immutable. {@link #equals(Object)} is consistent with {@link #compareTo(Version)}:
 * trailing zero components, the notation and the origin text do not take part in equality.
 */
public final class Version implements Comparable<Version> {

    private static final Pattern STRICT_LITERAL = Pattern.compile("(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?|v(?:0|[1-9][0-9]*)(?:\\.[0-9]{1,3}){2,}");

    @NotNull
    public static Version declare(@NotNull BigDecimal literal) {
        return Version.declare(NumericLiteral.of(literal));
    }

    @NotNull
    public static Version declare(double literal) {
        return Version.declare(NumericLiteral.of(literal));
    }

    @NotNull
    public static Version declare(long literal) {
        return Version.declare(NumericLiteral.of(literal));
    }

    /**
     * Parses a literal and marks the result as a dotted-decimal version, no matter which notation
     * the literal uses. The components are derived the same way {@link #parse(String)} derives them,
     * so "1.2" still becomes [1, 200], but it is rendered as "v1.200.0" by {@link #stringify()}.
     *
     * @param literal The literal to parse
     * @return The declared version, for which {@link #isQv()} always returns true
     * @throws MalformedVersionLiteralException If the literal is invalid
     */
    @NotNull
    public static Version declare(@NotNull String literal) {
        return Version.declare(new TextLiteral(literal));
    }

    @NotNull
    public static Version declare(@NotNull VersionLiteral literal) {
        return Version.fromLiteral(literal, true);
    }

    /**
     * Shorthand for {@link VersionComparator#compareCoercing(Object, Object)} on {@link VersionComparator#INSTANCE}.
     * Operands that are not {@link Version versions} are parsed first.
     *
     * @param a The first operand
     * @param b The second operand
     * @return A negative value if a is older than b, 0 if they are equal and a positive value if a is newer than b
     * @throws UnsupportedCoercionException If either operand is neither a version nor a literal
     * @throws MalformedVersionLiteralException If either operand is an invalid literal
     */
    public static int compare(@Nullable Object a, @Nullable Object b) {
        return VersionComparator.INSTANCE.compareCoercing(a, b);
    }

    @NotNull
    private static Version fromLiteral(@NotNull VersionLiteral literal, boolean declared) {
        ClassifiedLiteral classified = LiteralClassifier.classify(literal);
        long[] components = ComponentExtractor.extract(classified);
        boolean dotted = classified.form() == LiteralForm.DIRECT_DOTTED;
        if (dotted && components.length == 1) {
            LoggingAdapter.getDefaultLogger().warn(Version.class, "Dotted-decimal version \"{}\" has a single component. Consider writing \"v{}.0.0\" instead.", classified.literal(), components[0]);
        }
        return new Version(components, declared || dotted, classified.isAlpha(), classified.literal());
    }

    /**
     * Checks whether {@link #parse(String)} accepts a literal.
     *
     * @param literal The literal to check
     * @return True if the literal is valid, false otherwise
     */
    public static boolean isLax(@NotNull String literal) {
        try {
            ComponentExtractor.extract(LiteralClassifier.classify(new TextLiteral(literal)));
            return true;
        } catch (MalformedVersionLiteralException e) {
            return false;
        }
    }

    /**
     * Checks whether a literal is written in one of the two unambiguous notations: a decimal number
     * without leading zeros in the integer part, or a 'v' followed by three or more components
     * where all but the first have one to three digits. Alpha versions are never strict.
     *
     * @param literal The literal to check
     * @return True if the literal is strict, false otherwise
     */
    public static boolean isStrict(@NotNull String literal) {
        return Version.STRICT_LITERAL.matcher(literal).matches();
    }

    /**
     * Creates a dotted-decimal version out of its components.
     *
     * @param components The components, most significant first
     * @return The version
     */
    @NotNull
    @Contract(pure = true)
    public static Version of(long @NotNull... components) {
        return Version.ofComponents(components, true, false);
    }

    /**
     * Creates a version out of its components. The returned version has no origin text,
     * so {@link #stringify()} renders it in its normal or decimal form.
     *
     * @param components The components, most significant first. The array is copied.
     * @param qv Whether the version is a dotted-decimal version
     * @param alpha Whether the version is an alpha version
     * @return The version
     * @throws IllegalArgumentException If there are no components or if a component is negative
     */
    @NotNull
    @Contract(pure = true)
    public static Version ofComponents(long @NotNull[] components, boolean qv, boolean alpha) {
        if (components.length == 0) {
            throw new IllegalArgumentException("A version needs at least one component");
        }
        for (long component : components) {
            if (component < 0) {
                throw new IllegalArgumentException("Negative component " + component);
            }
        }
        return new Version(components.clone(), qv, alpha, null);
    }

    @NotNull
    public static Version parse(@NotNull BigDecimal literal) {
        return Version.parse(NumericLiteral.of(literal));
    }

    @NotNull
    public static Version parse(double literal) {
        return Version.parse(NumericLiteral.of(literal));
    }

    @NotNull
    public static Version parse(long literal) {
        return Version.parse(NumericLiteral.of(literal));
    }

    /**
     * Parses a literal. Literals starting with 'v' or containing two or more dots are read as dotted-decimal
     * versions, everything else as a decimal number.
     *
     * @param literal The literal to parse
     * @return The parsed version
     * @throws MalformedVersionLiteralException If the literal is invalid
     */
    @NotNull
    public static Version parse(@NotNull String literal) {
        return Version.parse(new TextLiteral(literal));
    }

    @NotNull
    public static Version parse(@NotNull VersionLiteral literal) {
        return Version.fromLiteral(literal, false);
    }

    private final boolean alpha;
    private final long @NotNull[] components;

    @Nullable
    private final String originText;

    private final boolean qv;

    private Version(long @NotNull[] components, boolean qv, boolean alpha, @Nullable String originText) {
        this.components = components;
        this.qv = qv;
        this.alpha = alpha;
        this.originText = originText;
    }

    @Override
    public int compareTo(@NotNull Version o) {
        return VersionComparator.INSTANCE.compare(this, o);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Version) {
            return this.compareTo((Version) obj) == 0;
        }
        return false;
    }

    public long getComponent(int index) {
        return this.components[index];
    }

    public int getComponentCount() {
        return this.components.length;
    }

    /**
     * Obtains a copy of the components of this version.
     *
     * @return The components, most significant first
     */
    public long @NotNull[] getComponents() {
        return this.components.clone();
    }

    /**
     * Obtains the literal this version was parsed from. Versions created through {@link #of(long...)}
     * or {@link #ofComponents(long[], boolean, boolean)} have none.
     *
     * @return The original literal, or null
     */
    @Nullable
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        int last = this.components.length - 1;
        while (last > 0 && this.components[last] == 0) {
            last--;
        }
        int hash = Boolean.hashCode(this.alpha);
        for (int i = 0; i <= last; i++) {
            hash = 31 * hash + Long.hashCode(this.components[i]);
        }
        return hash;
    }

    public boolean isAlpha() {
        return this.alpha;
    }

    public boolean isNewerThan(@NotNull Version other) {
        return this.compareTo(other) > 0;
    }

    public boolean isOlderThan(@NotNull Version other) {
        return this.compareTo(other) < 0;
    }

    /**
     * Whether this version is a dotted-decimal version, either because it was written as one
     * or because it was created through {@link #declare(String)}.
     *
     * @return True for dotted-decimal versions
     */
    public boolean isQv() {
        return this.qv;
    }

    public boolean isZero() {
        for (long component : this.components) {
            if (component != 0) {
                return false;
            }
        }
        return true;
    }

    @NotNull
    public String normal() {
        return VersionFormatter.normal(this);
    }

    @NotNull
    public String numify() {
        return VersionFormatter.numify(this);
    }

    @NotNull
    public String stringify() {
        return VersionFormatter.stringify(this);
    }

    @Override
    public String toString() {
        return this.stringify();
    }
}
