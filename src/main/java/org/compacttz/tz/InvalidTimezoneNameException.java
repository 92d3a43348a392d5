package org.compacttz.tz;

import lombok.Getter;

/**
 * Raised when a name is neither a canonical zone nor a known alias.
 */
@Getter
public final class InvalidTimezoneNameException extends RuntimeException {
    /** Rejected input, possibly {@code null}. */
    private final String name;

    /**
     * Creates an exception for a rejected name.
     *
     * @param name rejected input.
     */
    public InvalidTimezoneNameException(String name) {
        super("Unknown timezone name: " + (name == null ? "<null>" : "'" + name + "'"));
        this.name = name;
    }
}
