package org.stianloader.semver.version;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.semver.logging.LoggingAdapter;

/**
 * A version made of four non-negative numeric components (major, minor, patch and revision) and an
 * optional pre-release label, as described by <a href="https://semver.org/">semver.org</a> and relaxed
 * for Microsoft/NuGet style versions.
 *
 * <p>Versions are ordered by their numeric components first. If those are equal, a version
 * without a pre-release label is newer than one with a label and two labels are compared
 * ordinally, ignoring case. Consequently <code>1.0</code>, <code>1.0.0</code> and <code>1.0.0.0</code>
 * are all equal, as are <code>1.6.2-BeTa</code> and <code>1.6.02-beta</code>.
 *
 * <p>While the ordering works on the normalized components, {@link #toString()} returns the text
 * the version was parsed from (minus whitespace), so <code>1.0</code> is printed as <code>1.0</code>
 * and not as <code>1.0.0.0</code>.
 *
 * <p>Instances are immutable.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    /**
     * A {@link Comparator} that follows {@link #compare(SemanticVersion, SemanticVersion)}, that is
     * one that sorts null before any version.
     */
    @NotNull
    public static final Comparator<@Nullable SemanticVersion> NULLS_FIRST = SemanticVersion::compare;

    private static final int HASH_MULTIPLIER = 4567;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Compares two versions where null is considered to be older than any version and two nulls are equal.
     *
     * @param a The first version
     * @param b The second version
     * @return -1 if a precedes b, 0 if they are equal and 1 if b precedes a
     */
    @Contract(pure = true)
    public static int compare(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        if (a == null) {
            return b == null ? 0 : -1;
        } else if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }

    @Contract(pure = true)
    public static boolean equal(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        if (a == null) {
            return b == null;
        }
        return a.equals(b);
    }

    /**
     * Case-folds a pre-release label the same way {@link String#CASE_INSENSITIVE_ORDER} compares characters,
     * so that the hash code agrees with {@link #equals(Object)}.
     */
    @NotNull
    private static String foldCase(@NotNull String label) {
        StringBuilder builder = new StringBuilder(label.length());
        label.codePoints().forEach(codepoint -> builder.appendCodePoint(Character.toLowerCase(Character.toUpperCase(codepoint))));
        return builder.toString();
    }

    @Contract(pure = true)
    public static boolean greaterThan(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        return SemanticVersion.compare(SemanticVersion.requireLeftOperand(a), b) > 0;
    }

    @Contract(pure = true)
    public static boolean greaterThanOrEqual(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        return SemanticVersion.equal(a, b) || SemanticVersion.greaterThan(a, b);
    }

    /**
     * Checks whether a precedes b.
     *
     * @param a The left operand, may not be null
     * @param b The right operand. Null precedes every version
     * @return True if a is older than b
     * @throws IllegalArgumentException If a is null
     */
    @Contract(pure = true)
    public static boolean lessThan(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        return SemanticVersion.compare(SemanticVersion.requireLeftOperand(a), b) < 0;
    }

    /**
     * Checks whether a precedes or equals b. Two nulls are equal, but a null left operand
     * compared against a version is rejected just like with {@link #lessThan(SemanticVersion, SemanticVersion)}.
     *
     * @param a The left operand
     * @param b The right operand
     * @return True if a is older than or equal to b
     * @throws IllegalArgumentException If a is null but b is not
     */
    @Contract(pure = true)
    public static boolean lessThanOrEqual(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        return SemanticVersion.equal(a, b) || SemanticVersion.lessThan(a, b);
    }

    @Contract(pure = true)
    public static boolean notEqual(@Nullable SemanticVersion a, @Nullable SemanticVersion b) {
        return !SemanticVersion.equal(a, b);
    }

    /**
     * Parses a version string using the given grammar.
     *
     * @param string The string to parse. Leading and trailing whitespace is ignored
     * @param grammar The dialect to use
     * @return The parsed version
     * @throws IllegalArgumentException If the string is null or empty
     * @throws VersionFormatException If the string is not a valid version in the given dialect
     */
    @NotNull
    public static SemanticVersion parse(@Nullable String string, @NotNull VersionGrammar grammar) {
        if (string == null || string.isEmpty()) {
            throw new IllegalArgumentException("The version string may not be null or empty");
        }

        SemanticVersion version = SemanticVersion.tryParse(string, grammar);
        if (version == null) {
            throw new VersionFormatException("'" + string + "' is not a valid version string", string);
        }
        return version;
    }

    /**
     * Parses a version string in the {@link VersionGrammar#LOOSE loose} dialect.
     *
     * @param string The string to parse
     * @return The parsed version
     * @throws IllegalArgumentException If the string is null or empty
     * @throws VersionFormatException If the string is not a valid version
     * @see #parse(String, VersionGrammar)
     */
    @NotNull
    public static SemanticVersion parseLoose(@Nullable String string) {
        return SemanticVersion.parse(string, VersionGrammar.LOOSE);
    }

    /**
     * Parses a version string in the {@link VersionGrammar#STRICT strict} dialect.
     *
     * @param string The string to parse
     * @return The parsed version
     * @throws IllegalArgumentException If the string is null or empty
     * @throws VersionFormatException If the string is not a valid version
     * @see #parse(String, VersionGrammar)
     */
    @NotNull
    public static SemanticVersion parseStrict(@Nullable String string) {
        return SemanticVersion.parse(string, VersionGrammar.STRICT);
    }

    @NotNull
    private static String render(@Nullable String preRelease, int... components) {
        StringBuilder builder = new StringBuilder();
        for (int component : components) {
            if (builder.length() != 0) {
                builder.append('.');
            }
            builder.append(component);
        }
        if (preRelease != null && !preRelease.isEmpty()) {
            builder.append('-').append(preRelease);
        }
        return builder.toString();
    }

    @NotNull
    private static SemanticVersion requireLeftOperand(@Nullable SemanticVersion version) {
        if (version == null) {
            throw new IllegalArgumentException("The left operand of a version comparison may not be null");
        }
        return version;
    }

    /**
     * Attempts to parse a version string using the given grammar. Unlike {@link #parse(String, VersionGrammar)}
     * this method never throws for malformed input.
     *
     * @param string The string to parse. Leading and trailing whitespace is ignored
     * @param grammar The dialect to use
     * @return The parsed version, or null if the string is null, empty or not a valid version
     */
    @Nullable
    @Contract(pure = true, value = "null, _ -> null")
    public static SemanticVersion tryParse(@Nullable String string, @NotNull VersionGrammar grammar) {
        if (string == null || string.isEmpty()) {
            return null;
        }

        String trimmed = string.trim();
        Matcher matcher = grammar.getPattern().matcher(trimmed);
        if (!matcher.matches()) {
            return null;
        }

        String[] components = matcher.group(VersionGrammar.VERSION_GROUP).split("\\.");
        int[] numbers = new int[4];
        for (int i = 0; i < components.length; i++) {
            try {
                numbers[i] = Integer.parseInt(components[i].trim());
            } catch (NumberFormatException e) {
                LoggingAdapter logger = LoggingAdapter.getDefaultLogger();
                if (logger.isDebugEnabled(SemanticVersion.class)) {
                    logger.debug(SemanticVersion.class, "Rejecting version string '{}': component '{}' exceeds the supported range", string, components[i].trim());
                }
                return null;
            }
        }

        String originText = SemanticVersion.WHITESPACE.matcher(trimmed).replaceAll("");
        return new SemanticVersion(numbers[0], numbers[1], numbers[2], numbers[3], matcher.group(VersionGrammar.RELEASE_GROUP), originText);
    }

    @Nullable
    @Contract(pure = true, value = "null -> null")
    public static SemanticVersion tryParseLoose(@Nullable String string) {
        return SemanticVersion.tryParse(string, VersionGrammar.LOOSE);
    }

    @Nullable
    @Contract(pure = true, value = "null -> null")
    public static SemanticVersion tryParseStrict(@Nullable String string) {
        return SemanticVersion.tryParse(string, VersionGrammar.STRICT);
    }

    private final int major;
    private final int minor;
    @NotNull
    private final String originText;
    private final int patch;
    @Nullable
    private final String preRelease;
    private final int revision;

    public SemanticVersion(int major, int minor, int patch) {
        this(major, minor, patch, null);
    }

    public SemanticVersion(int major, int minor, int build, int revision) {
        this(major, minor, build, revision, null);
    }

    public SemanticVersion(int major, int minor, int build, int revision, @Nullable String preRelease) {
        this(major, minor, build, revision, preRelease, SemanticVersion.render(preRelease, major, minor, build, revision));
    }

    public SemanticVersion(int major, int minor, int patch, @Nullable String preRelease) {
        this(major, minor, patch, 0, preRelease, SemanticVersion.render(preRelease, major, minor, patch));
    }

    private SemanticVersion(int major, int minor, int patch, int revision, @Nullable String preRelease, @NotNull String originText) {
        if (major < 0 || minor < 0 || patch < 0 || revision < 0) {
            throw new IllegalArgumentException("Version components may not be negative: " + originText);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.revision = revision;
        this.preRelease = (preRelease == null || preRelease.isEmpty()) ? null : preRelease;
        this.originText = originText;
    }

    @Override
    public int compareTo(@NotNull SemanticVersion other) {
        int result = Integer.compare(this.major, other.major);
        if (result == 0) {
            result = Integer.compare(this.minor, other.minor);
        }
        if (result == 0) {
            result = Integer.compare(this.patch, other.patch);
        }
        if (result == 0) {
            result = Integer.compare(this.revision, other.revision);
        }
        if (result != 0) {
            return Integer.signum(result);
        }

        if (this.preRelease == null) {
            return other.preRelease == null ? 0 : 1;
        } else if (other.preRelease == null) {
            return -1;
        }
        return Integer.signum(String.CASE_INSENSITIVE_ORDER.compare(this.preRelease, other.preRelease));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SemanticVersion) {
            SemanticVersion other = (SemanticVersion) obj;
            return other.major == this.major
                    && other.minor == this.minor
                    && other.patch == this.patch
                    && other.revision == this.revision
                    && (this.preRelease == null ? other.preRelease == null : this.preRelease.equalsIgnoreCase(other.preRelease));
        }
        return false;
    }

    /**
     * Alias of {@link #getPatch()}, named after the third component of Microsoft style versions.
     *
     * @return The third numeric component
     */
    public int getBuild() {
        return this.patch;
    }

    public int getMajor() {
        return this.major;
    }

    public int getMinor() {
        return this.minor;
    }

    /**
     * Obtains the text this version was created from, with all whitespace removed.
     * For versions created through a constructor this is the dot-separated list of the components
     * passed to the constructor, followed by the pre-release label if there is one.
     *
     * @return The display string of this version, identical to {@link #toString()}
     */
    @NotNull
    public String getOriginText() {
        return this.originText;
    }

    public int getPatch() {
        return this.patch;
    }

    /**
     * Obtains the pre-release label without the leading hyphen, in the case it was written in.
     *
     * @return The label, or null if this is a release version
     */
    @Nullable
    public String getPreRelease() {
        return this.preRelease;
    }

    public int getRevision() {
        return this.revision;
    }

    @Override
    public int hashCode() {
        int hashCode = ((this.major * 31 + this.minor) * 31 + this.patch) * 31 + this.revision;
        if (this.preRelease != null) {
            hashCode = hashCode * SemanticVersion.HASH_MULTIPLIER + SemanticVersion.foldCase(this.preRelease).hashCode();
        }
        return hashCode;
    }

    public boolean isNewerThan(@NotNull SemanticVersion other) {
        return this.compareTo(other) > 0;
    }

    public boolean isOlderThan(@NotNull SemanticVersion other) {
        return this.compareTo(other) < 0;
    }

    public boolean isPreRelease() {
        return this.preRelease != null;
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
