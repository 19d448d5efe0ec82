package org.stianloader.semver.version;

import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

/**
 * The two dialects understood by {@link SemanticVersion#parse(String, VersionGrammar)}.
 *
 * <p>Both dialects share the same shape: dot-separated decimal components followed by an optional
 * pre-release label introduced by a hyphen. The label has to start with a letter and may then contain
 * letters, digits and hyphens. Letters are matched case-insensitively.
 */
public enum VersionGrammar {

    /**
     * Exactly three components (<code>major.minor.patch</code>) without any whitespace between them.
     */
    STRICT("\\.", 2, 2),

    /**
     * Microsoft or NuGet style versions: two to four components (<code>major.minor[.build[.revision]]</code>)
     * where the dots may be surrounded by whitespace. Missing components are treated as 0.
     */
    LOOSE("\\s*\\.\\s*", 1, 3);

    static final String RELEASE_GROUP = "release";
    static final String VERSION_GROUP = "version";

    @NotNull
    private final Pattern pattern;

    VersionGrammar(@NotNull String separator, int minTrailing, int maxTrailing) {
        this.pattern = Pattern.compile("^(?<" + VERSION_GROUP + ">[0-9]+(?:" + separator + "[0-9]+){" + minTrailing + "," + maxTrailing + "})"
                + "(?:-(?<" + RELEASE_GROUP + ">[a-z][0-9a-z-]*))?$", Pattern.CASE_INSENSITIVE);
    }

    @NotNull
    Pattern getPattern() {
        return this.pattern;
    }
}
