package org.compacttz.tz;

import org.compacttz.core.id.TimezoneId;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Handle to a validated timezone.
 *
 * <p>Obtained from {@link #parse(String)}; every offset query on a valid handle is total.
 * Offsets are minutes east of UTC.</p>
 */
public final class Tz {
    /** Permanent zero offset. Needs no embedded data. */
    public static final Tz UTC = new Tz(null, null);

    private final TzDatabase database;
    private final TimezoneId id;

    Tz(TzDatabase database, TimezoneId id) {
        this.database = database;
        this.id = id;
    }

    /**
     * Resolves a name against the embedded database.
     *
     * @param name canonical or alias IANA name.
     * @return zone handle.
     * @throws InvalidTimezoneNameException If the name is not known.
     */
    public static Tz parse(String name) {
        if (TzDatabase.UTC_NAME.equals(name)) {
            return UTC;
        }
        return TzDatabase.embedded().parse(name);
    }

    /**
     * Resolves a name against the embedded database without throwing.
     */
    public static Optional<Tz> tryParse(String name) {
        if (TzDatabase.UTC_NAME.equals(name)) {
            return Optional.of(UTC);
        }
        return TzDatabase.embedded().tryParse(name);
    }

    /**
     * Lists the canonical names of the embedded database.
     */
    public static List<String> listTimezones() {
        return TzDatabase.embedded().listTimezones();
    }

    /**
     * Returns the canonical name.
     */
    public String name() {
        return id == null ? TzDatabase.UTC_NAME : id.getName();
    }

    /**
     * Returns the offset at an instant.
     *
     * @param epochSeconds Unix timestamp in seconds.
     * @return offset in minutes east of UTC.
     */
    public int offsetAtTimestamp(long epochSeconds) {
        if (database == null) {
            return 0;
        }
        return database.offsetMinutes(id, epochSeconds);
    }

    /**
     * Returns the offset at an instant in seconds.
     */
    public int offsetSecondsAt(long epochSeconds) {
        return offsetAtTimestamp(epochSeconds) * 60;
    }

    /**
     * Returns the offset at an instant as a value object.
     */
    public TzOffset offsetAt(long epochSeconds) {
        return TzOffset.ofMinutes(offsetAtTimestamp(epochSeconds));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tz)) {
            return false;
        }
        Tz other = (Tz) o;
        return database == other.database && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(database), id);
    }

    @Override
    public String toString() {
        return name();
    }
}
