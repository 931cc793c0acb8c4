package org.stianloader.picoversion.range;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoversion.MalformedVersionLiteralException;
import org.stianloader.picoversion.Version;

/**
 * A set of constraints a version needs to fulfil, such as {@code ">= 1.2, != 1.5, < v2.0.0"}.
 *
 * <p>A range consists of comma-separated clauses. Each clause is an operator followed by a version
 * literal, valid operators being {@code >=}, {@code >}, {@code <=}, {@code <}, {@code ==} and {@code !=}.
 * A clause without an operator is a minimum version, so {@code "1.2"} is the same as {@code ">= 1.2"}.
 * A version lies within the range if it satisfies every clause.
 */
public class VersionRange {

    // Basically an interval where the other bound is infinity.
    private static class Edge implements VersionSet {
        private final Version edgeVersion;
        private final EdgeType type;

        public Edge(Version edgeVersion, EdgeType type) {
            this.edgeVersion = edgeVersion;
            this.type = type;
        }

        @Override
        public boolean contains(Version version) {
            if (this.type == EdgeType.UP_TO) {
                return !version.isNewerThan(this.edgeVersion);
            } else if (this.type == EdgeType.UNDER) {
                return version.isOlderThan(this.edgeVersion);
            } else if (this.type == EdgeType.NOT_UNDER) {
                return !version.isOlderThan(this.edgeVersion);
            } else {
                // Type is EdgeType.ABOVE
                return version.isNewerThan(this.edgeVersion);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Edge) {
                Edge other = (Edge) obj;
                return other.edgeVersion.equals(this.edgeVersion) && other.type.equals(this.type);
            }

            return false;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.edgeVersion, this.type);
        }

        @Override
        public String toString() {
            return this.type.operator + ' ' + this.edgeVersion.stringify();
        }
    }

    private enum EdgeType {
        UP_TO("<="),
        UNDER("<"),
        NOT_UNDER(">="),
        ABOVE(">");

        private final String operator;

        EdgeType(String operator) {
            this.operator = operator;
        }
    }

    private static class ExcludedVersion implements VersionSet {
        private final Version version;

        public ExcludedVersion(Version version) {
            this.version = version;
        }

        @Override
        public boolean contains(Version version) {
            return !this.version.equals(version);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof ExcludedVersion && ((ExcludedVersion) obj).version.equals(this.version);
        }

        @Override
        public int hashCode() {
            return ~this.version.hashCode();
        }

        @Override
        public String toString() {
            return "!= " + this.version.stringify();
        }
    }

    private static class PinnedVersion implements VersionSet {
        private final Version version;

        public PinnedVersion(Version version) {
            this.version = version;
        }

        @Override
        public boolean contains(Version version) {
            return this.version.equals(version);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof PinnedVersion && ((PinnedVersion) obj).version.equals(this.version);
        }

        @Override
        public int hashCode() {
            return this.version.hashCode();
        }

        @Override
        public String toString() {
            return "== " + this.version.stringify();
        }
    }

    private static interface VersionSet {
        boolean contains(Version version);
    }

    /**
     * Sentinel value for a range without any clauses, which accepts every version.
     * Corresponds to the empty (or blank) string.
     */
    @NotNull
    public static final VersionRange FREE_RANGE = new VersionRange(Collections.emptyList());

    @NotNull
    public static VersionRange parse(@NotNull String string) {
        if (string.isBlank()) {
            return VersionRange.FREE_RANGE;
        }

        List<@NotNull VersionSet> sets = new ArrayList<>();
        int clauseStart = 0;
        while (clauseStart <= string.length()) {
            int clauseEnd = string.indexOf(',', clauseStart);
            if (clauseEnd == -1) {
                clauseEnd = string.length();
            }
            sets.add(VersionRange.parseClause(string, clauseStart, clauseEnd));
            clauseStart = clauseEnd + 1;
        }
        return new VersionRange(sets);
    }

    @NotNull
    private static VersionSet parseClause(@NotNull String string, int start, int end) {
        String clause = string.substring(start, end).strip();
        if (clause.isEmpty()) {
            throw new MalformedVersionLiteralException(string, start, "Empty clause in version range");
        }

        String operator;
        if (clause.startsWith(">=") || clause.startsWith("<=") || clause.startsWith("==") || clause.startsWith("!=")) {
            operator = clause.substring(0, 2);
        } else if (clause.startsWith(">") || clause.startsWith("<")) {
            operator = clause.substring(0, 1);
        } else {
            // A bare version is the minimum version
            operator = "";
        }

        String versionText = clause.substring(operator.length()).strip();
        if (versionText.isEmpty()) {
            throw new MalformedVersionLiteralException(string, start, "Operator '" + operator + "' is not followed by a version");
        }
        Version version = Version.parse(versionText);

        switch (operator) {
        case "":
        case ">=":
            return new Edge(version, EdgeType.NOT_UNDER);
        case ">":
            return new Edge(version, EdgeType.ABOVE);
        case "<=":
            return new Edge(version, EdgeType.UP_TO);
        case "<":
            return new Edge(version, EdgeType.UNDER);
        case "==":
            return new PinnedVersion(version);
        case "!=":
            return new ExcludedVersion(version);
        default:
            throw new AssertionError(operator);
        }
    }

    @NotNull
    private final List<@NotNull VersionSet> versionSets;

    private VersionRange(@NotNull List<@NotNull VersionSet> sets) {
        this.versionSets = Collections.unmodifiableList(new ArrayList<>(sets));
    }

    public boolean containsVersion(@NotNull Version version) {
        for (VersionSet set : this.versionSets) {
            if (!set.contains(version)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Obtains the oldest version the range explicitly allows, that is the newest version
     * of all {@code >=} and {@code ==} clauses. Exclusive lower bounds ({@code >}) have no oldest
     * version and are therefore ignored.
     *
     * @return The minimum version of the range, or null if there is no such clause.
     */
    @Nullable
    public Version getMinimum() {
        Version minimum = null;
        for (VersionSet set : this.versionSets) {
            Version candidate;
            if (set instanceof PinnedVersion) {
                candidate = ((PinnedVersion) set).version;
            } else if (set instanceof Edge && ((Edge) set).type == EdgeType.NOT_UNDER) {
                candidate = ((Edge) set).edgeVersion;
            } else {
                continue;
            }
            if (minimum == null || candidate.isNewerThan(minimum)) {
                minimum = candidate;
            }
        }
        return minimum;
    }

    @NotNull
    public VersionRange intersect(@NotNull VersionRange range) {
        if (this == VersionRange.FREE_RANGE) {
            return range;
        } else if (range == VersionRange.FREE_RANGE) {
            return this;
        }

        List<@NotNull VersionSet> sets = new ArrayList<>(this.versionSets);
        sets.addAll(range.versionSets);
        return new VersionRange(sets);
    }

    /**
     * Selects the newest version that lies within this range.
     *
     * @param knownAvailable The versions to choose from
     * @return The newest matching version, or null if none matches
     */
    @Nullable
    public Version selectFrom(@Nullable Collection<@NotNull Version> knownAvailable) {
        if (knownAvailable == null) {
            return null;
        }

        Version candidateVersion = null;
        for (Version known : knownAvailable) {
            if ((candidateVersion == null || known.isNewerThan(candidateVersion)) && this.containsVersion(known)) {
                candidateVersion = known;
            }
        }
        return candidateVersion;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (VersionSet set : this.versionSets) {
            if (builder.length() != 0) {
                builder.append(", ");
            }
            builder.append(set.toString());
        }
        return builder.toString();
    }
}
