package org.stianloader.semver.version;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a non-empty string does not describe a {@link SemanticVersion} or a {@link VersionRange}.
 * The rejected string is available through {@link #getInput()}.
 */
public class VersionFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = -2375010526352164903L;

    @NotNull
    private final String input;

    public VersionFormatException(@NotNull String message, @NotNull String input) {
        super(message);
        this.input = input;
    }

    /**
     * Obtains the string that failed to parse, exactly as it was handed to the parser.
     *
     * @return The offending input
     */
    @NotNull
    public String getInput() {
        return this.input;
    }
}
