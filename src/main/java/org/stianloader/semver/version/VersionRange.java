package org.stianloader.semver.version;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.semver.logging.LoggingAdapter;

// Based on https://learn.microsoft.com/en-us/nuget/concepts/package-versioning#version-ranges
/**
 * An interval of {@link SemanticVersion versions} with optional lower and upper bounds, each of which
 * may be inclusive or exclusive.
 *
 * <p>Ranges are written in the NuGet bracket notation:
 * <ul>
 *  <li><code>1.0</code> - x &gt;= 1.0 (a bare version is a minimum, not a pin)</li>
 *  <li><code>(1.0,)</code> - x &gt; 1.0</li>
 *  <li><code>[1.0]</code> - x == 1.0</li>
 *  <li><code>(,1.0]</code> - x &lt;= 1.0</li>
 *  <li><code>(,1.0)</code> - x &lt; 1.0</li>
 *  <li><code>[1.0,2.0]</code> - 1.0 &lt;= x &lt;= 2.0</li>
 *  <li><code>(1.0,2.0)</code> - 1.0 &lt; x &lt; 2.0</li>
 *  <li><code>[1.0,2.0)</code> - 1.0 &lt;= x &lt; 2.0</li>
 * </ul>
 * Bounds are parsed using the {@link VersionGrammar#LOOSE loose} grammar.
 *
 * <p>The inclusivity flag of a side is stored even if there is no bound on that side,
 * in which case it has no influence on {@link #satisfies(SemanticVersion)}.
 */
public final class VersionRange {

    private static final String GREATER_THAN_OR_EQUAL = "\u2265";
    private static final String LESS_THAN_OR_EQUAL = "\u2264";

    /**
     * Creates a range that accepts the given version and any newer version.
     * This is the range described by a bare version string.
     *
     * @param min The oldest accepted version
     * @return The range <code>[min,)</code>
     */
    @NotNull
    @Contract(pure = true, value = "_ -> new")
    public static VersionRange atLeast(@NotNull SemanticVersion min) {
        return new VersionRange(Objects.requireNonNull(min, "min may not be null"), true, null, false);
    }

    /**
     * Parses a version range string.
     *
     * @param string The string to parse
     * @return The parsed range
     * @throws VersionFormatException If the string is not a valid version range
     * @see #tryParse(String)
     */
    @NotNull
    public static VersionRange parse(@NotNull String string) {
        VersionRange range = VersionRange.tryParse(string);
        if (range == null) {
            throw new VersionFormatException("'" + string + "' is not a valid version range string", string);
        }
        return range;
    }

    private static void reject(@NotNull String string, @NotNull String reason) {
        LoggingAdapter logger = LoggingAdapter.getDefaultLogger();
        if (logger.isDebugEnabled(VersionRange.class)) {
            logger.debug(VersionRange.class, "Rejecting version range '{}': {}", string, reason);
        }
    }

    /**
     * Attempts to parse a version range string. A string that is a valid {@link VersionGrammar#LOOSE loose}
     * version is read as an inclusive lower bound; anything else has to use the bracket notation.
     *
     * @param string The string to parse. Leading and trailing whitespace is ignored
     * @return The parsed range, or null if the string is not a valid version range
     */
    @Nullable
    public static VersionRange tryParse(@NotNull String string) {
        String trimmed = Objects.requireNonNull(string, "string may not be null").trim();

        SemanticVersion version = SemanticVersion.tryParseLoose(trimmed);
        if (version != null) {
            return VersionRange.atLeast(version);
        }

        if (trimmed.length() < 3) {
            VersionRange.reject(string, "too short to be an interval");
            return null;
        }

        boolean minInclusive;
        char first = trimmed.charAt(0);
        if (first == '[') {
            minInclusive = true;
        } else if (first == '(') {
            minInclusive = false;
        } else {
            VersionRange.reject(string, "neither a version nor an interval opened by '[' or '('");
            return null;
        }

        boolean maxInclusive;
        char last = trimmed.charAt(trimmed.length() - 1);
        if (last == ']') {
            maxInclusive = true;
        } else if (last == ')') {
            maxInclusive = false;
        } else {
            VersionRange.reject(string, "interval is not closed by ']' or ')'");
            return null;
        }

        String[] parts = trimmed.substring(1, trimmed.length() - 1).split(",", -1);
        if (parts.length > 2) {
            VersionRange.reject(string, "an interval has at most two bounds");
            return null;
        }

        boolean bounded = false;
        for (String part : parts) {
            if (!part.isEmpty()) {
                bounded = true;
                break;
            }
        }
        if (!bounded) {
            VersionRange.reject(string, "neither bound is specified");
            return null;
        }

        // "[1.0]" and "(1.0)" use the same version for both bounds
        String minString = parts[0];
        String maxString = parts.length == 2 ? parts[1] : parts[0];

        SemanticVersion min = null;
        if (!minString.isBlank()) {
            min = SemanticVersion.tryParseLoose(minString);
            if (min == null) {
                VersionRange.reject(string, "lower bound '" + minString + "' is not a valid version");
                return null;
            }
        }

        SemanticVersion max = null;
        if (!maxString.isBlank()) {
            max = SemanticVersion.tryParseLoose(maxString);
            if (max == null) {
                VersionRange.reject(string, "upper bound '" + maxString + "' is not a valid version");
                return null;
            }
        }

        return new VersionRange(min, minInclusive, max, maxInclusive);
    }

    @Nullable
    private final SemanticVersion max;
    private final boolean maxInclusive;
    @Nullable
    private final SemanticVersion min;
    private final boolean minInclusive;

    /**
     * Creates a range that only accepts versions equal to the given version.
     *
     * @param version The pinned version
     */
    public VersionRange(@NotNull SemanticVersion version) {
        this(Objects.requireNonNull(version, "version may not be null"), true, version, true);
    }

    /**
     * Creates a range.
     *
     * @param min The lower bound, or null if the range is unbounded below
     * @param minInclusive True if versions equal to min are part of the range
     * @param max The upper bound, or null if the range is unbounded above
     * @param maxInclusive True if versions equal to max are part of the range
     */
    public VersionRange(@Nullable SemanticVersion min, boolean minInclusive, @Nullable SemanticVersion max, boolean maxInclusive) {
        this.min = min;
        this.minInclusive = minInclusive;
        this.max = max;
        this.maxInclusive = maxInclusive;

        if (min != null && max != null) {
            int order = min.compareTo(max);
            if (order > 0 || (order == 0 && !(minInclusive && maxInclusive))) {
                LoggingAdapter.getDefaultLogger().warn(VersionRange.class, "Version range {} can never be satisfied", this.toBracketString());
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionRange) {
            VersionRange other = (VersionRange) obj;
            return Objects.equals(other.min, this.min)
                    && Objects.equals(other.max, this.max)
                    && other.minInclusive == this.minInclusive
                    && other.maxInclusive == this.maxInclusive;
        }
        return false;
    }

    @Nullable
    public SemanticVersion getMax() {
        return this.max;
    }

    @Nullable
    public SemanticVersion getMin() {
        return this.min;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.min, this.minInclusive, this.max, this.maxInclusive);
    }

    /**
     * Checks whether this range only accepts versions equal to a single version, as is the case for <code>[1.0]</code>.
     *
     * @return True if both bounds are inclusive and equal
     */
    private boolean isPinned() {
        return this.min != null && this.minInclusive && this.maxInclusive && this.min.equals(this.max);
    }

    public boolean isMaxInclusive() {
        return this.maxInclusive;
    }

    public boolean isMinInclusive() {
        return this.minInclusive;
    }

    /**
     * Checks whether this range has the shape produced by a bare version string.
     */
    private boolean isMinimumOnly() {
        return this.min != null && this.minInclusive && this.max == null && !this.maxInclusive;
    }

    /**
     * Checks whether a version lies within this range.
     *
     * @param version The version to test
     * @return True if the version is accepted by both bounds
     * @throws IllegalArgumentException If the version is null and this range has a bound
     */
    public boolean satisfies(@NotNull SemanticVersion version) {
        boolean condition = true;
        if (this.min != null) {
            if (this.minInclusive) {
                condition = SemanticVersion.greaterThanOrEqual(version, this.min);
            } else {
                condition = SemanticVersion.greaterThan(version, this.min);
            }
        }

        if (this.max != null) {
            if (this.maxInclusive) {
                condition = condition && SemanticVersion.lessThanOrEqual(version, this.max);
            } else {
                condition = condition && SemanticVersion.lessThan(version, this.max);
            }
        }

        return condition;
    }

    /**
     * Renders this range in the bracket notation accepted by {@link #parse(String)}. A range with only an
     * inclusive lower bound is rendered as the bare version and a pinned range as <code>[version]</code>.
     * An absent bound is rendered as an empty string, such as in <code>(, 2.0]</code>.
     *
     * @return The bracket notation of this range
     */
    @NotNull
    public String toBracketString() {
        if (this.isMinimumOnly()) {
            return String.valueOf(this.min);
        }

        if (this.isPinned()) {
            return "[" + this.min + "]";
        }

        StringBuilder builder = new StringBuilder();
        builder.append(this.minInclusive ? '[' : '(');
        if (this.min != null) {
            builder.append(this.min);
        }
        builder.append(", ");
        if (this.max != null) {
            builder.append(this.max);
        }
        builder.append(this.maxInclusive ? ']' : ')');
        return builder.toString();
    }

    /**
     * Renders this range as a human readable inequality such as <code>(&gt; 1.0 &amp;&amp; &lt; 2.0)</code>,
     * <code>(&#x2265; 1.0)</code> or <code>(= 1.0)</code>. This notation cannot be parsed back.
     *
     * @return The mathematical notation of this range, or an empty string if the range has no bounds
     */
    @NotNull
    public String toMathString() {
        if (this.isMinimumOnly()) {
            return "(" + VersionRange.GREATER_THAN_OR_EQUAL + " " + this.min + ")";
        }

        if (this.isPinned()) {
            return "(= " + this.min + ")";
        }

        StringBuilder builder = new StringBuilder();
        if (this.min != null) {
            builder.append(this.minInclusive ? "(" + VersionRange.GREATER_THAN_OR_EQUAL + " " : "(> ");
            builder.append(this.min);
        }

        if (this.max != null) {
            builder.append(builder.length() == 0 ? "(" : " && ");
            builder.append(this.maxInclusive ? VersionRange.LESS_THAN_OR_EQUAL + " " : "< ");
            builder.append(this.max);
        }

        if (builder.length() != 0) {
            builder.append(')');
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return this.toBracketString();
    }
}
