package org.stianloader.picoversion.internal;

import java.util.Arrays;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoversion.Version;
import org.stianloader.picoversion.literal.TextLiteral;
import org.stianloader.picoversion.logging.LoggingAdapter;

public final class VersionFormatter {

    private static final int MAX_GROUP_VALUE = 999;
    private static final int NORMAL_MIN_COMPONENTS = 3;

    /**
     * Renders a version in the canonical dotted-decimal notation, that is with a leading 'v' and at least three components.
     * Missing components are filled up with zeros. An alpha version has its last separator replaced by the alpha marker.
     *
     * <p>For an alpha version with less than three components the marker is placed in front of the last
     * emitted (padding) component so that the result is a valid literal again: the components [1, 230]
     * are rendered as "v1.230_0".
     *
     * @param version The version to render
     * @return The normal form of the version
     */
    @NotNull
    @Contract(pure = true)
    public static String normal(@NotNull Version version) {
        int count = version.getComponentCount();
        int emitted = Math.max(count, VersionFormatter.NORMAL_MIN_COMPONENTS);
        int alphaSeparator = version.isAlpha() ? emitted - 1 : -1;

        StringBuilder builder = new StringBuilder().append('v');
        for (int i = 0; i < emitted; i++) {
            if (i != 0) {
                builder.append(i == alphaSeparator ? LiteralClassifier.ALPHA_MARKER : '.');
            }
            builder.append(i < count ? version.getComponent(i) : 0L);
        }
        return builder.toString();
    }

    /**
     * Renders a version as a decimal number. The components after the first are written as zero-padded
     * groups of three digits, trailing zeros are removed afterwards. The alpha marker is not part of the
     * decimal notation and is therefore dropped.
     *
     * @param version The version to render
     * @return The decimal form of the version
     */
    @NotNull
    public static String numify(@NotNull Version version) {
        int count = version.getComponentCount();
        String integerPart = Long.toString(version.getComponent(0));
        if (count == 1) {
            return integerPart;
        }

        StringBuilder fraction = new StringBuilder(ComponentExtractor.DECIMAL_GROUP_WIDTH * (count - 1));
        boolean lossy = false;
        for (int i = 1; i < count; i++) {
            long component = version.getComponent(i);
            lossy |= component > VersionFormatter.MAX_GROUP_VALUE;
            String digits = Long.toString(component);
            for (int j = digits.length(); j < ComponentExtractor.DECIMAL_GROUP_WIDTH; j++) {
                fraction.append('0');
            }
            fraction.append(digits);
        }

        if (lossy) {
            LoggingAdapter.getDefaultLogger().warn(VersionFormatter.class, "Version {} has a component above {}, its decimal form does not parse back to the same version", VersionFormatter.normal(version), VersionFormatter.MAX_GROUP_VALUE);
        }

        int end = fraction.length();
        while (end > 0 && fraction.charAt(end - 1) == '0') {
            end--;
        }
        if (end == 0) {
            return integerPart;
        }
        return integerPart + '.' + fraction.substring(0, end);
    }

    /**
     * Renders a version the way it was originally written, if it still describes the version.
     * Otherwise dotted-decimal versions fall back to {@link #normal(Version)} and decimal versions to {@link #numify(Version)}.
     *
     * @param version The version to render
     * @return The string form of the version
     */
    @NotNull
    public static String stringify(@NotNull Version version) {
        String originText = version.getOriginText();
        if (originText != null) {
            ClassifiedLiteral origin = LiteralClassifier.classify(new TextLiteral(originText));
            boolean originQv = origin.form() == LiteralForm.DIRECT_DOTTED;
            if (origin.isAlpha() == version.isAlpha()
                    && originQv == version.isQv()
                    && Arrays.equals(ComponentExtractor.extract(origin), version.getComponents())) {
                return origin.leadingV() ? 'v' + origin.body() : originText;
            }
        }

        if (version.isQv()) {
            return VersionFormatter.normal(version);
        } else {
            return VersionFormatter.numify(version);
        }
    }

    private VersionFormatter() {
        throw new UnsupportedOperationException();
    }
}
